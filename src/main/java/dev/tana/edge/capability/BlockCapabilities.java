package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.tana.edge.block.BlockQueries;
import java.util.List;

/**
 * {@code block.*}: invocation context getters plus the batch ledger queries.
 */
final class BlockCapabilities {
    private BlockCapabilities() {}

    static CapabilityRegistry register(CapabilityRegistry registry, BlockQueries blocks) {
        registry.sync("block.height", List.of(), (scope, args) -> LongNode.valueOf(scope.context().height()));
        registry.sync("block.timestamp", List.of(), (scope, args) -> LongNode.valueOf(scope.context().timestamp()));
        registry.sync("block.hash", List.of(), (scope, args) -> TextNode.valueOf(scope.context().hash()));
        registry.sync("block.previousHash", List.of(), (scope, args) -> TextNode.valueOf(scope.context().previousHash()));
        registry.sync("block.executor", List.of(), (scope, args) -> TextNode.valueOf(scope.context().executor()));
        registry.sync("block.contractId", List.of(), (scope, args) ->
            scope.context().contractId() == null
                ? JsonNodeFactory.instance.nullNode()
                : TextNode.valueOf(scope.context().contractId()));
        registry.sync("block.gasLimit", List.of(), (scope, args) -> LongNode.valueOf(scope.context().gasLimit()));
        registry.sync("block.gasUsed", List.of(), (scope, args) -> LongNode.valueOf(scope.context().gasUsed()));

        registry.async("block.getBalance", List.of(ArgKind.STRUCTURED, ArgKind.STRING), (scope, args) ->
            blocks.getBalance(args.get(0), args.get(1).asText()));
        registry.async("block.getUser", List.of(ArgKind.STRUCTURED), (scope, args) ->
            blocks.getUser(args.get(0)));
        registry.async("block.getTransaction", List.of(ArgKind.STRUCTURED), (scope, args) ->
            blocks.getTransaction(args.get(0)));
        return registry;
    }
}
