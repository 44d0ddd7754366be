package work.dyncall.engine.sandbox;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Conversions between polyglot values and plain Java data.
 */
final class PolyglotValues {
    private static final int MAX_DEPTH = 64;

    private PolyglotValues() {}

    static Object valueToJava(Value value) {
        return valueToJava(value, 0);
    }

    private static Object valueToJava(Value value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new DynamicCallException(ErrorType.NON_SERIALIZABLE_RESULT, "value is nested too deeply or is cyclic");
        }
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
        if (value.isHostObject()) {
            return toJava(value.asHostObject(), depth + 1);
        }
        if (value.canExecute()) {
            return new ScriptFunctionRef(value.toString());
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(valueToJava(value.getArrayElement(i), depth + 1));
            }
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, valueToJava(value.getMember(key), depth + 1));
            }
            return map;
        }
        return value.toString();
    }

    /**
     * Converts host-side arguments received from a script (polyglot maps, lists or values) into
     * detached plain Java data.
     */
    static Object toJava(Object raw) {
        return toJava(raw, 0);
    }

    private static Object toJava(Object raw, int depth) {
        if (depth > MAX_DEPTH) {
            throw new DynamicCallException(ErrorType.NON_SERIALIZABLE_RESULT, "value is nested too deeply or is cyclic");
        }
        if (raw instanceof Value value) {
            return valueToJava(value, depth);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), toJava(v, depth + 1)));
            return copy;
        }
        if (raw instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(toJava(item, depth + 1));
            }
            return copy;
        }
        return raw;
    }

    static Map<String, Object> toJavaMap(Object raw) {
        Object converted = toJava(raw);
        if (converted == null) {
            return new LinkedHashMap<>();
        }
        return JsonValues.asObject(converted);
    }

    static List<Object> toJavaList(Object raw) {
        Object converted = toJava(raw);
        if (converted == null) {
            return new ArrayList<>();
        }
        return JsonValues.asList(converted);
    }

    static Value toJsValue(Context context, Object value) {
        if (value == null) {
            return context.eval("js", "null");
        }
        try {
            String serialized = JsonValues.MAPPER.writeValueAsString(value);
            return context.eval("js", "JSON").getMember("parse").execute(serialized);
        } catch (Exception ex) {
            return context.asValue(value);
        }
    }

    static Object awaitValue(Context context, Value value) throws ExecutionException, InterruptedException {
        if (value != null && !value.isHostObject() && value.canInvokeMember("then")) {
            CompletableFuture<Object> future = new CompletableFuture<>();
            ProxyExecutable resolve = args -> {
                future.complete(valueToJava(args.length > 0 ? args[0] : context.eval("js", "undefined")));
                return null;
            };
            ProxyExecutable reject = args -> {
                Object reason = args.length > 0 ? valueToJava(args[0]) : "Promise rejected";
                String message = reason instanceof Map || reason instanceof List
                    ? JsonValues.render(reason)
                    : String.valueOf(reason);
                future.completeExceptionally(new DynamicCallException(ErrorType.EXECUTION, "Promise rejected: " + message));
                return null;
            };
            value.invokeMember("then", resolve, reject);
            if (!future.isDone()) {
                throw new DynamicCallException(ErrorType.EXECUTION, "Program returned a promise that never settled");
            }
            return future.get();
        }
        return valueToJava(value);
    }
}
