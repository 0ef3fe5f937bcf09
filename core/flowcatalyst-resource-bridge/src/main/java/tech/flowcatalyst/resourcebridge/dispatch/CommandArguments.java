package tech.flowcatalyst.resourcebridge.dispatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed read access to a decoded argument map.
 *
 * <p>Absent keys and explicit nulls read as absent. A present value of the
 * wrong shape raises {@link InvalidArgumentException}.
 */
public final class CommandArguments {

    private final Map<String, Object> values;

    public CommandArguments(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    public static CommandArguments empty() {
        return new CommandArguments(Map.of());
    }

    public Object raw(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String string(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection) {
            throw new InvalidArgumentException(name + " must be a string");
        }
        return value.toString();
    }

    public Integer integer(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return toInt(name, ((Number) value).longValue());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new InvalidArgumentException(name + " must be an integer");
            }
            return toInt(name, n.longValue());
        }
        if (value instanceof String s) {
            try {
                return toInt(name, Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(name + " must be an integer");
            }
        }
        throw new InvalidArgumentException(name + " must be an integer");
    }

    public int integer(String name, int defaultValue) {
        Integer value = integer(name);
        return value != null ? value : defaultValue;
    }

    public boolean bool(String name) {
        Object value = values.get(name);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        throw new InvalidArgumentException(name + " must be a boolean");
    }

    /**
     * An object argument, empty when absent.
     */
    public Map<String, Object> map(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidArgumentException(name + " must be an object");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * A list argument, empty when absent. A lone scalar reads as a single-element list.
     */
    public List<Object> list(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Map) {
            throw new InvalidArgumentException(name + " must be a list");
        }
        return List.of(value);
    }

    public List<String> stringList(String name) {
        List<String> result = new ArrayList<>();
        for (Object item : list(name)) {
            if (item instanceof Map || item instanceof Collection) {
                throw new InvalidArgumentException(name + " must be a list of strings");
            }
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    /**
     * Inline items keyed by child resource name; every value must be a list of objects.
     */
    public Map<String, List<Map<String, Object>>> inlines(String name) {
        Map<String, List<Map<String, Object>>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : map(name).entrySet()) {
            if (!(entry.getValue() instanceof Collection<?> items)) {
                throw new InvalidArgumentException(name + "." + entry.getKey() + " must be a list");
            }
            List<Map<String, Object>> converted = new ArrayList<>();
            for (Object item : items) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw new InvalidArgumentException(name + "." + entry.getKey() + " items must be objects");
                }
                Map<String, Object> copy = new LinkedHashMap<>();
                for (Map.Entry<?, ?> field : map.entrySet()) {
                    copy.put(String.valueOf(field.getKey()), field.getValue());
                }
                converted.add(copy);
            }
            result.put(entry.getKey(), converted);
        }
        return result;
    }

    private static int toInt(String name, long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidArgumentException(name + " is out of range");
        }
        return (int) value;
    }
}
