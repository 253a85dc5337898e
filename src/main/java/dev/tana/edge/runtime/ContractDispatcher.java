package dev.tana.edge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.tana.edge.api.HttpMethod;
import dev.tana.edge.api.InvocationRequest;
import dev.tana.edge.api.InvocationResult;
import dev.tana.edge.api.ScriptResult;
import dev.tana.edge.block.InvocationContext;
import dev.tana.edge.capability.CallScope;
import dev.tana.edge.capability.CapabilityRegistry;
import dev.tana.edge.capability.ConsoleSink;
import dev.tana.edge.compile.SourceCompiler;
import dev.tana.edge.error.EdgeException;
import dev.tana.edge.error.ErrorKind;
import dev.tana.edge.ledger.GasMeter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

/**
 * Runs one contract invocation per call, each in a fresh isolate.
 *
 * <p>The isolate gets the capability bridge, the bootstrapped {@code tana/*} modules and the
 * contract source; the entry point matching the request method is called with a guest
 * {@code Request}, queued host work is drained until its promise settles, and the returned object
 * is read back as JSON. Any failure after the isolate exists becomes a 500 result carrying the
 * error message.</p>
 */
public final class ContractDispatcher {
    private static final Logger log = LogManager.getLogger(ContractDispatcher.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String BOOTSTRAP_RESOURCE = "/edge/bootstrap.js";
    private static final String BOOTSTRAP_SOURCE = loadBootstrap();
    private static final String SCRIPT_CONTRACT_ID = "script";

    private final IsolateFactory isolates;
    private final CapabilityRegistry registry;
    private final ContractLocator locator;
    private final SourceCompiler compiler;
    private final GasMeter gas;
    private final Executor executor;
    private final ConsoleSink console;
    private final String versionsJson;

    public ContractDispatcher(
        IsolateFactory isolates,
        CapabilityRegistry registry,
        ContractLocator locator,
        SourceCompiler compiler,
        GasMeter gas,
        Executor executor,
        ConsoleSink console,
        String tanaVersion
    ) {
        this.isolates = Objects.requireNonNull(isolates, "isolates");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.gas = Objects.requireNonNull(gas, "gas");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.console = Objects.requireNonNull(console, "console");
        ObjectNode versions = JsonNodeFactory.instance.objectNode();
        versions.put("tana", tanaVersion);
        versions.put("graaljs", isolates.engineVersion());
        this.versionsJson = versions.toString();
    }

    public InvocationResult dispatch(InvocationRequest request) {
        long started = System.nanoTime();
        Invocation invocation = new Invocation(InvocationContext.start(request.contractId(), gas));
        try {
            InvocationResult result = invocation.run(request);
            log.debug("{} {} -> {} in {}ms", request.method(), request.contractId(), result.status(),
                (System.nanoTime() - started) / 1_000_000);
            return result;
        } catch (EdgeException | PolyglotException ex) {
            return invocation.failed(request.contractId(), ex);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure invoking {}", request.contractId(), ex);
            return invocation.failed(request.contractId(), ex);
        }
    }

    /**
     * Runs a standalone script with top-level {@code await} under the same capabilities.
     */
    public ScriptResult runScript(ContractSource source) {
        Invocation invocation = new Invocation(InvocationContext.start(SCRIPT_CONTRACT_ID, gas));
        try {
            invocation.runScript(source);
            return ScriptResult.success(invocation.console.lines());
        } catch (EdgeException | PolyglotException ex) {
            return ScriptResult.failure(invocation.failed(source.path().toString(), ex).errorMessage(),
                invocation.console.lines());
        } catch (RuntimeException ex) {
            log.error("Unexpected failure running {}", source.path(), ex);
            return ScriptResult.failure(messageOf(ex), invocation.console.lines());
        }
    }

    private String prepare(Invocation invocation, ContractSource source) {
        String code = ImportRewriter.rewrite(source.code());
        if (source.typescript()) {
            code = ImportRewriter.rewrite(compiler.compile(code, source.path().getFileName().toString()));
            invocation.phase = DispatchPhase.COMPILED;
        }
        return code;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String stringMember(Value object, String name) {
        if (object == null || !object.hasMembers() || !object.hasMember(name)) {
            return null;
        }
        Value member = object.getMember(name);
        return member != null && member.isString() ? member.asString() : null;
    }

    private static String loadBootstrap() {
        try (InputStream in = ContractDispatcher.class.getResourceAsStream(BOOTSTRAP_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + BOOTSTRAP_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + BOOTSTRAP_RESOURCE, ex);
        }
    }

    /**
     * State of a single invocation; confined to the calling thread.
     */
    private final class Invocation {
        private final InvocationContext context;
        private final CapturingConsole console;
        private DispatchPhase phase = DispatchPhase.CREATED;

        Invocation(InvocationContext context) {
            this.context = context;
            this.console = new CapturingConsole(ContractDispatcher.this.console);
        }

        InvocationResult run(InvocationRequest request) {
            try (Context isolate = isolates.create()) {
                return execute(isolate, request);
            } catch (PolyglotException ex) {
                throw guestFailure(ex);
            }
        }

        private InvocationResult execute(Context isolate, InvocationRequest request) {
            try {
                AsyncWorkQueue queue = new AsyncWorkQueue();
                GuestBridge bridge = bind(isolate, queue);
                Value hooks = bootstrap(isolate);

                ContractSource source = locator.locate(request.contractId(), request.method());
                phase = DispatchPhase.SOURCE_LOADED;
                String code = prepare(this, source);
                isolate.eval(Source.newBuilder(IsolateFactory.LANGUAGE, code, source.path().toString()).buildLiteral());

                String entryName = request.method().entryPoint();
                Value entry = isolate.eval(IsolateFactory.LANGUAGE,
                    "typeof " + entryName + " === 'function' ? " + entryName + " : null");
                if (entry == null || entry.isNull()) {
                    log.debug("{} exports no {}", request.contractId(), entryName);
                    return InvocationResult.failure(InvocationResult.NO_ENTRY_POINT, ErrorKind.SETUP, console.lines());
                }

                Value guestRequest = hooks.invokeMember("request", bridge.toGuest(request.toGuestJson()));
                boolean withBody = request.method() == HttpMethod.POST;
                Value body = bridge.toGuest(request.body());
                PromiseSettlement settlement = new PromiseSettlement();
                hooks.invokeMember("run", entry, guestRequest, body, withBody, settlement);
                phase = DispatchPhase.ENTRY_INVOKED;

                drain(bridge, queue, settlement);
                InvocationResult result = extract(hooks, settlement);
                phase = DispatchPhase.RESULT_EXTRACTED;
                return result;
            } catch (PolyglotException ex) {
                throw guestFailure(ex);
            }
        }

        void runScript(ContractSource source) {
            try (Context isolate = isolates.create()) {
                executeScript(isolate, source);
            } catch (PolyglotException ex) {
                throw guestFailure(ex);
            }
        }

        private void executeScript(Context isolate, ContractSource source) {
            try {
                AsyncWorkQueue queue = new AsyncWorkQueue();
                GuestBridge bridge = bind(isolate, queue);
                Value hooks = bootstrap(isolate);
                phase = DispatchPhase.SOURCE_LOADED;

                String code = prepare(this, source);
                String wrapped = "(async function () {\n'use strict';\n" + code + "\n})()";
                Value promise = isolate.eval(Source.newBuilder(IsolateFactory.LANGUAGE, wrapped, source.path().toString()).buildLiteral());
                PromiseSettlement settlement = new PromiseSettlement();
                hooks.invokeMember("watch", promise, settlement);
                phase = DispatchPhase.ENTRY_INVOKED;

                drain(bridge, queue, settlement);
                if (settlement.isRejected()) {
                    throw settlement.failure();
                }
                phase = DispatchPhase.RESULT_EXTRACTED;
            } catch (PolyglotException ex) {
                throw guestFailure(ex);
            }
        }

        private GuestBridge bind(Context isolate, AsyncWorkQueue queue) {
            GuestBridge bridge = new GuestBridge(isolate, registry, new CallScope(context, console), queue, executor);
            isolate.getBindings(IsolateFactory.LANGUAGE).putMember(GuestBridge.GLOBAL_NAME, bridge);
            phase = DispatchPhase.CAPABILITIES_BOUND;
            return bridge;
        }

        private Value bootstrap(Context isolate) {
            Value hooks = isolate.eval(Source.newBuilder(IsolateFactory.LANGUAGE, BOOTSTRAP_SOURCE, "tana-bootstrap.js").buildLiteral())
                .execute(versionsJson);
            if (isolate.getBindings(IsolateFactory.LANGUAGE).hasMember(GuestBridge.GLOBAL_NAME)) {
                throw EdgeException.setup("Capability bridge still reachable from guest code");
            }
            phase = DispatchPhase.MODULES_BOOTSTRAPPED;
            return hooks;
        }

        private void drain(GuestBridge bridge, AsyncWorkQueue queue, PromiseSettlement settlement) {
            AsyncWorkQueue.Pending next;
            while ((next = queue.poll()) != null) {
                bridge.settle(next);
            }
            if (!settlement.isSettled()) {
                throw EdgeException.setup("Contract left unresolved asynchronous work");
            }
            phase = DispatchPhase.ASYNC_DRAINED;
        }

        private InvocationResult extract(Value hooks, PromiseSettlement settlement) {
            if (settlement.isRejected()) {
                throw settlement.failure();
            }
            Value serialized = hooks.invokeMember("serialize", settlement.value());
            if (serialized == null || serialized.isNull()) {
                throw EdgeException.setup("Contract must return an object with status and body");
            }
            JsonNode root;
            try {
                root = JSON.readTree(serialized.asString());
            } catch (IOException ex) {
                throw EdgeException.setup("Contract result is not valid JSON: " + ex.getMessage(), ex);
            }
            JsonNode statusNode = root.get("status");
            int status = statusNode != null && statusNode.isNumber() ? statusNode.intValue() : InvocationResult.DEFAULT_STATUS;
            JsonNode body = root.has("body") ? root.get("body") : NullNode.getInstance();
            Map<String, String> headers = new LinkedHashMap<>();
            JsonNode headerNode = root.get("headers");
            if (headerNode != null && headerNode.isObject()) {
                headerNode.fields().forEachRemaining(field -> headers.put(field.getKey(),
                    field.getValue().isTextual() ? field.getValue().asText() : field.getValue().toString()));
            }
            return new InvocationResult(status, body, headers, console.lines());
        }

        InvocationResult failed(String target, RuntimeException error) {
            String message = messageOf(error);
            ErrorKind kind = error instanceof EdgeException edge ? edge.kind() : ErrorKind.SETUP;
            if (kind == ErrorKind.VALIDATION || kind == ErrorKind.LIMIT) {
                log.info("Invocation of {} rejected during {} [{}]: {}", target, phase, kind.tag(), message);
            } else {
                log.warn("Invocation of {} failed during {} [{}]: {}", target, phase, kind.tag(), message);
            }
            return InvocationResult.failure(message, kind, console.lines());
        }

        /**
         * Reads the guest error's own message while the isolate is still open.
         */
        private EdgeException guestFailure(PolyglotException ex) {
            if (ex.isHostException() && ex.asHostException() instanceof EdgeException edge) {
                return edge;
            }
            String message = messageOf(ex);
            ErrorKind kind = ErrorKind.SETUP;
            if (ex.isGuestException()) {
                Value guestObject = ex.getGuestObject();
                String guestMessage = stringMember(guestObject, "message");
                if (guestMessage != null) {
                    message = guestMessage;
                }
                ErrorKind tagged = ErrorKind.fromTag(stringMember(guestObject, "kind"));
                if (tagged != null) {
                    kind = tagged;
                }
            }
            return new EdgeException(kind, EdgeException.GUEST_ERROR, message, ex);
        }
    }
}
