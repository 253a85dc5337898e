package dev.tana.edge.runtime;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based rewrite of {@code tana/*} module imports into {@code __tanaImport} lookups, so contracts
 * run as plain scripts. Lines that are not such imports lose a leading {@code export} keyword.
 */
public final class ImportRewriter {
    private static final Pattern IMPORT = Pattern.compile(
        "^\\s*import\\s+\\{([^}]+)\\}\\s+from\\s+[\"'](tana[/:][^\"']+)[\"'];?\\s*$");
    private static final Pattern EXPORT = Pattern.compile("^(\\s*)export\\s+");
    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+");

    private ImportRewriter() {}

    public static String rewrite(String source) {
        String[] lines = source.split("\n", -1);
        StringBuilder out = new StringBuilder(source.length() + 64);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(rewriteLine(lines[i]));
        }
        return out.toString();
    }

    static String rewriteLine(String line) {
        Matcher importMatch = IMPORT.matcher(line);
        if (importMatch.matches()) {
            String names = ALIAS.matcher(importMatch.group(1).trim()).replaceAll(": ");
            String module = importMatch.group(2).trim();
            return "const {" + names + "} = __tanaImport('" + module + "');";
        }
        return EXPORT.matcher(line).replaceFirst("$1");
    }
}
