package dev.tana.edge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.tana.edge.capability.CallScope;
import dev.tana.edge.capability.CallingConvention;
import dev.tana.edge.capability.CapabilityRegistry;
import dev.tana.edge.error.EdgeException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

/**
 * The one host object a guest isolate ever sees. It is captured by the bootstrap and removed from
 * the global object before contract code runs.
 *
 * <p>Sync calls answer with an envelope, {@code {ok:true, value}} or
 * {@code {ok:false, error:{name, message, kind}}}, which the bootstrap turns back into a value or a
 * thrown {@code Error}/{@code TypeError}. Async calls start on the runner executor and are settled
 * by {@link #settle(AsyncWorkQueue.Pending)} when the dispatcher drains the queue.</p>
 */
public final class GuestBridge {
    static final String GLOBAL_NAME = "__edgeHost";

    private static final Logger log = LogManager.getLogger(GuestBridge.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final CapabilityRegistry registry;
    private final CallScope scope;
    private final AsyncWorkQueue queue;
    private final Executor executor;
    private final Context context;
    private final Value jsonParse;
    private final Value newObject;
    private final Value newArray;

    GuestBridge(Context context, CapabilityRegistry registry, CallScope scope, AsyncWorkQueue queue, Executor executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.context = context;
        this.jsonParse = context.eval("js", "JSON.parse");
        this.newObject = context.eval("js", "(() => ({}))");
        this.newArray = context.eval("js", "(() => [])");
    }

    @HostAccess.Export
    public Value call(String name, Value args) {
        try {
            CapabilityRegistry.Entry entry = registry.get(name);
            if (entry.convention() != CallingConvention.SYNC) {
                throw EdgeException.typeError(name + " is asynchronous");
            }
            JsonNode result = entry.invoke(scope, GuestValues.arguments(args));
            ObjectNode envelope = NODES.objectNode();
            envelope.put("ok", true);
            envelope.set("value", result == null ? NODES.nullNode() : result);
            return toGuest(envelope);
        } catch (Exception ex) {
            ObjectNode envelope = NODES.objectNode();
            envelope.put("ok", false);
            envelope.set("error", failure(name, ex));
            return toGuest(envelope);
        }
    }

    @HostAccess.Export
    public void enqueue(String name, Value args, Value resolve, Value reject) {
        CompletableFuture<JsonNode> work;
        try {
            CapabilityRegistry.Entry entry = registry.get(name);
            if (entry.convention() != CallingConvention.ASYNC) {
                throw EdgeException.typeError(name + " is synchronous");
            }
            List<JsonNode> validated = entry.validate(GuestValues.arguments(args));
            work = CompletableFuture.supplyAsync(() -> {
                try {
                    return entry.function().invoke(scope, validated);
                } catch (RuntimeException ex) {
                    throw ex;
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, executor);
        } catch (RuntimeException ex) {
            work = CompletableFuture.failedFuture(ex);
        }
        queue.add(new AsyncWorkQueue.Pending(name, work, resolve, reject));
    }

    /**
     * Waits for the host side of {@code pending} and settles its guest promise. Must run on the
     * invocation thread.
     */
    void settle(AsyncWorkQueue.Pending pending) {
        JsonNode result;
        try {
            result = pending.work().join();
        } catch (CompletionException | CancellationException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            pending.reject().execute(toGuest(failure(pending.name(), cause)));
            return;
        }
        pending.resolve().execute(toGuest(result == null ? NODES.nullNode() : result));
    }

    /**
     * Copies {@code node} into the isolate. JSON text cannot carry {@code Infinity} or {@code NaN},
     * so trees holding such numbers are built member by member instead.
     */
    Value toGuest(JsonNode node) {
        if (!hasNonFinite(node)) {
            return jsonParse.execute(node.toString());
        }
        return build(node);
    }

    private Value build(JsonNode node) {
        if (node.isObject()) {
            Value object = newObject.execute();
            node.fields().forEachRemaining(field -> object.putMember(field.getKey(), build(field.getValue())));
            return object;
        }
        if (node.isArray()) {
            Value array = newArray.execute();
            for (JsonNode element : node) {
                array.invokeMember("push", build(element));
            }
            return array;
        }
        if (node.isNumber()) {
            return context.asValue(node.doubleValue());
        }
        if (node.isBoolean()) {
            return context.asValue(node.booleanValue());
        }
        if (node.isTextual()) {
            return context.asValue(node.textValue());
        }
        return jsonParse.execute("null");
    }

    private static boolean hasNonFinite(JsonNode node) {
        if (node.isFloatingPointNumber()) {
            return !Double.isFinite(node.doubleValue());
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                if (hasNonFinite(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static ObjectNode failure(String name, Throwable error) {
        ObjectNode node = NODES.objectNode();
        if (error instanceof EdgeException edge) {
            log.debug("{} failed: {}", name, edge.getMessage());
            node.put("name", edge.guestName());
            node.put("message", edge.getMessage());
            node.put("kind", edge.kind().tag());
        } else {
            log.warn("{} failed unexpectedly", name, error);
            node.put("name", EdgeException.GUEST_ERROR);
            String message = error.getMessage();
            node.put("message", message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
        }
        return node;
    }
}
