package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import dev.tana.edge.error.EdgeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of host operations guest code may call, keyed by name.
 *
 * <p>Entries are registered while the registry is being built; {@link #seal()} freezes it.</p>
 */
public final class CapabilityRegistry {
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private boolean sealed;

    public CapabilityRegistry register(String name, CallingConvention convention, List<ArgKind> args, Capability fn) {
        if (sealed) {
            throw new IllegalStateException("capability registry is sealed");
        }
        if (entries.containsKey(name)) {
            throw new IllegalArgumentException("capability already registered: " + name);
        }
        entries.put(name, new Entry(name, convention, List.copyOf(args), fn));
        return this;
    }

    public CapabilityRegistry sync(String name, List<ArgKind> args, Capability fn) {
        return register(name, CallingConvention.SYNC, args, fn);
    }

    public CapabilityRegistry async(String name, List<ArgKind> args, Capability fn) {
        return register(name, CallingConvention.ASYNC, args, fn);
    }

    public CapabilityRegistry seal() {
        sealed = true;
        return this;
    }

    public boolean sealed() {
        return sealed;
    }

    /**
     * @throws EdgeException with guest class {@code TypeError} for an unknown name
     */
    public Entry get(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw EdgeException.typeError("Unknown capability: " + name);
        }
        return entry;
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public record Entry(String name, CallingConvention convention, List<ArgKind> args, Capability function) {
        /**
         * Pads missing arguments and checks each against the schema.
         */
        public List<JsonNode> validate(List<JsonNode> raw) {
            List<JsonNode> normalized = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                JsonNode value = i < raw.size() ? raw.get(i) : MissingNode.getInstance();
                ArgKind kind = args.get(i);
                if (!kind.accepts(value)) {
                    throw EdgeException.typeError(
                        name + ": argument " + (i + 1) + " must be " + kind.description());
                }
                normalized.add(value);
            }
            return normalized;
        }

        public JsonNode invoke(CallScope scope, List<JsonNode> raw) throws Exception {
            return function.invoke(scope, validate(raw));
        }
    }
}
