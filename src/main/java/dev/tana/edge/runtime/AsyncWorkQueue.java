package dev.tana.edge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import org.graalvm.polyglot.Value;

/**
 * FIFO of host work whose guest promises are still pending. Confined to the invocation thread.
 */
final class AsyncWorkQueue {
    private final Deque<Pending> pending = new ArrayDeque<>();

    void add(Pending work) {
        pending.addLast(work);
    }

    Pending poll() {
        return pending.pollFirst();
    }

    record Pending(String name, CompletableFuture<JsonNode> work, Value resolve, Value reject) {}
}
