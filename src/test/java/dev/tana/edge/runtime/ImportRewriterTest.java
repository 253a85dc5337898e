package dev.tana.edge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ImportRewriterTest {
    @Test
    void rewritesTanaImportsIntoLookups() {
        assertEquals("const {console} = __tanaImport('tana/core');",
            ImportRewriter.rewriteLine("import { console } from 'tana/core';"));
        assertEquals("const {data, block} = __tanaImport('tana:data');",
            ImportRewriter.rewriteLine("import {data, block} from \"tana:data\""));
    }

    @Test
    void aliasesBecomeDestructuringRenames() {
        assertEquals("const {fetch: get} = __tanaImport('tana/net');",
            ImportRewriter.rewriteLine("import { fetch as get } from 'tana/net';"));
    }

    @Test
    void stripsLeadingExport() {
        assertEquals("async function Get(req) {",
            ImportRewriter.rewriteLine("export async function Get(req) {"));
        assertEquals("  const x = 1;", ImportRewriter.rewriteLine("  export const x = 1;"));
    }

    @Test
    void leavesOtherLinesAlone() {
        String line = "import lodash from 'lodash';";
        assertEquals(line, ImportRewriter.rewriteLine(line));
        assertEquals("const exported = 1;", ImportRewriter.rewriteLine("const exported = 1;"));
    }

    @Test
    void keepsLineStructure() {
        String source = "import { tx } from 'tana/tx';\n\nexport function Get() {\n  return tx.getChanges();\n}\n";
        String expected = "const {tx} = __tanaImport('tana/tx');\n\nfunction Get() {\n  return tx.getChanges();\n}\n";
        assertEquals(expected, ImportRewriter.rewrite(source));
    }
}
