package work.mcps.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * Conversions between guest (JavaScript) values and plain Java values.
 * Plain values are {@code null}, String, Boolean, Number, List and Map; handles created by the runtime
 * come back as their Java objects.
 */
final class GuestValues {
    private static final ObjectMapper JSON = new ObjectMapper();

    private GuestValues() {}

    static Object toJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isProxyObject()) {
            Object proxy = value.asProxyObject();
            return proxy instanceof GuestHandles.Handle handle ? handle.unwrap() : proxy;
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.canExecute()) {
            return value.toString();
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }

    static Map<String, Object> toJavaObject(Value value) {
        Object converted = toJava(value);
        if (converted instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return new LinkedHashMap<>();
    }

    /**
     * Plain values cross as JSON; conversations and proxies are wrapped so scripts can use their members.
     */
    static Value toGuest(Context context, Object value) {
        if (value == null) {
            return context.asValue(null);
        }
        if (value instanceof Value guest) {
            return guest;
        }
        if (value instanceof Conversation conversation) {
            return context.asValue(new GuestHandles.ConversationHandle(conversation));
        }
        if (value instanceof ProxyObject proxy) {
            return context.asValue(proxy);
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return context.asValue(value);
        }
        try {
            String serialized = JSON.writeValueAsString(value);
            return context.eval("js", "JSON").getMember("parse").execute(serialized);
        } catch (JsonProcessingException ex) {
            return context.asValue(String.valueOf(value));
        }
    }

    /**
     * Joins values with single spaces: strings as-is, structured values as JSON.
     */
    static String render(Value[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(render(args[i]));
        }
        return builder.toString();
    }

    static String render(Value value) {
        if (value == null) {
            return "undefined";
        }
        if (value.isProxyObject() || value.isString() || value.isNumber() || value.isBoolean() || value.isNull()) {
            return value.isProxyObject() ? String.valueOf(value.asProxyObject()) : value.toString();
        }
        Object converted = toJava(value);
        if (converted instanceof Map<?, ?> || converted instanceof List<?>) {
            try {
                return JSON.writeValueAsString(converted);
            } catch (JsonProcessingException ex) {
                return value.toString();
            }
        }
        return String.valueOf(converted);
    }
}
