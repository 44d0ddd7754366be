package work.dyncall.engine.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed JSON-shaped values (maps, lists, scalars) that flow through calls.
 */
public final class JsonValues {
    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();
    public static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    public static final TypeReference<List<Object>> LIST_REF = new TypeReference<>() {};

    private JsonValues() {}

    public static Map<String, Object> asObject(Object raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        throw new IllegalArgumentException("Expected object, got " + raw.getClass().getSimpleName());
    }

    public static List<Object> asList(Object raw) {
        if (raw == null) {
            return new ArrayList<>();
        }
        if (raw instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        throw new IllegalArgumentException("Expected array, got " + raw.getClass().getSimpleName());
    }

    public static String optionalString(Object value) {
        if (value == null) return null;
        String str = value instanceof String s ? s : String.valueOf(value);
        return str.isBlank() ? null : str;
    }

    public static int intValue(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public static double doubleValue(Object value, double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public static Map<String, Object> deepCloneMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (map != null) {
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepClone(v)));
        }
        return copy;
    }

    public static Object deepClone(Object value) {
        if (value == null) return null;
        if (value instanceof Map<?, ?> map) {
            return deepCloneMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepClone(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * True when the value is made only of null, booleans, numbers, strings, lists and string-keyed maps.
     */
    public static boolean isPlainData(Object value) {
        if (value == null || value instanceof Boolean || value instanceof Number || value instanceof String) {
            return true;
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (!isPlainData(item)) return false;
            }
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isPlainData(entry.getValue())) return false;
            }
            return true;
        }
        return false;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    /** Renders a value for prompts and logs; never throws. */
    public static String render(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
