package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Host operation reachable from guest code through the bridge.
 */
@FunctionalInterface
public interface Capability {
    JsonNode invoke(CallScope scope, List<JsonNode> args) throws Exception;
}
