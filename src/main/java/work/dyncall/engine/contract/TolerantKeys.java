package work.dyncall.engine.contract;

import java.util.Map;

/**
 * Key lookups that treat {@code created_at}, {@code createdAt}, {@code created-at} and {@code CREATED_AT}
 * as the same field.
 */
public final class TolerantKeys {
    private TolerantKeys() {}

    public static String canonical(String key) {
        StringBuilder out = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c != '_' && c != '-' && c != ' ') {
                out.append(Character.toLowerCase(c));
            }
        }
        return out.toString();
    }

    /** The key actually present in {@code map} for {@code key}, preferring an exact match, or {@code null}. */
    public static String resolve(Map<?, ?> map, String key) {
        if (map.containsKey(key)) {
            return key;
        }
        String wanted = canonical(key);
        for (Object candidate : map.keySet()) {
            if (candidate != null && canonical(String.valueOf(candidate)).equals(wanted)) {
                return String.valueOf(candidate);
            }
        }
        return null;
    }

    public static boolean contains(Map<?, ?> map, String key) {
        return resolve(map, key) != null;
    }

    public static Object get(Map<?, ?> map, String key) {
        String present = resolve(map, key);
        return present == null ? null : map.get(present);
    }
}
