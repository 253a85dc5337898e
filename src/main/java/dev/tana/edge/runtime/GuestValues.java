package dev.tana.edge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.graalvm.polyglot.Value;

/**
 * Converts guest values to Jackson trees. Functions are dropped the way {@code JSON.stringify}
 * drops them.
 */
final class GuestValues {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private GuestValues() {}

    static List<JsonNode> arguments(Value args) {
        List<JsonNode> list = new ArrayList<>();
        if (args == null || args.isNull() || !args.hasArrayElements()) {
            return list;
        }
        long size = args.getArraySize();
        for (long i = 0; i < size; i++) {
            list.add(toJson(args.getArrayElement(i)));
        }
        return list;
    }

    static JsonNode toJson(Value value) {
        if (value == null || value.isNull()) {
            return NullNode.getInstance();
        }
        if (value.isBoolean()) {
            return NODES.booleanNode(value.asBoolean());
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return NODES.numberNode(value.asInt());
            if (value.fitsInLong()) return NODES.numberNode(value.asLong());
            return NODES.numberNode(value.asDouble());
        }
        if (value.isString()) {
            return NODES.textNode(value.asString());
        }
        if (value.hasArrayElements()) {
            ArrayNode array = NODES.arrayNode();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                Value element = value.getArrayElement(i);
                array.add(element.canExecute() ? NullNode.getInstance() : toJson(element));
            }
            return array;
        }
        if (value.canExecute()) {
            return NullNode.getInstance();
        }
        if (value.hasMembers()) {
            ObjectNode object = NODES.objectNode();
            for (String key : value.getMemberKeys()) {
                Value member = value.getMember(key);
                if (member == null || member.canExecute()) continue;
                object.set(key, toJson(member));
            }
            return object;
        }
        return NODES.textNode(value.toString());
    }
}
