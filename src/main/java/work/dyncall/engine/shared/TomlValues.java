package work.dyncall.engine.shared;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;

/**
 * Converts tomlj tables into plain maps and lists.
 */
public final class TomlValues {
    private TomlValues() {}

    public static Map<String, Object> toMap(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (table == null) {
            return map;
        }
        for (String key : table.keySet()) {
            map.put(key, convert(table.get(List.of(key))));
        }
        return map;
    }

    public static Object convert(Object value) {
        if (value instanceof TomlTable table) {
            return toMap(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convert(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
