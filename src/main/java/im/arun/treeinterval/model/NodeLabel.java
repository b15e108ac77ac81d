package im.arun.treeinterval.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opaque payload attached to a node: a kind tag plus free-form metadata.
 *
 * <p>Attribute values are limited to what JSON carries: strings, booleans, numbers, lists
 * and string-keyed maps of those, and {@code null}. Values are stored in the form Jackson
 * reads them back in, so a label survives serialization unchanged:
 * <ul>
 *   <li>integral numbers become {@code Integer}, {@code Long} or {@code BigInteger}, the
 *       smallest that fits</li>
 *   <li>{@code Float} becomes {@code Double}</li>
 *   <li>arrays and other collections become lists</li>
 * </ul>
 * Anything else, including non-finite floating point values, is rejected.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NodeLabel {

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("attributes")
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public NodeLabel(String kind) {
        this.kind = kind;
    }

    public NodeLabel(String kind, Map<String, Object> attributes) {
        this.kind = kind;
        setAttributes(attributes);
    }

    public static NodeLabel of(String kind) {
        return new NodeLabel(kind);
    }

    /**
     * Read-only view of the attributes. Use {@link #with} to add one.
     */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach(this::with);
        }
    }

    /**
     * @throws IllegalArgumentException when {@code value} has no JSON representation
     */
    public NodeLabel with(String key, Object value) {
        attributes.put(key, normalize(key, value));
        return this;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    private static Object normalize(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return narrow(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger) {
            return narrow((BigInteger) value);
        }
        if (value instanceof Float || value instanceof Double) {
            double number = value instanceof Float
                ? Double.parseDouble(value.toString())
                : (Double) value;
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("Label attribute " + key + " is not a finite number: " + value);
            }
            return number;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(normalize(key, element));
            }
            return list;
        }
        if (value.getClass().isArray()) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                list.add(normalize(key, Array.get(value, i)));
            }
            return list;
        }
        if (value instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("Label attribute " + key + " has a non-string map key: " + entry.getKey());
                }
                map.put((String) entry.getKey(), normalize(key, entry.getValue()));
            }
            return map;
        }
        throw new IllegalArgumentException(
            "Label attribute " + key + " has unsupported type " + value.getClass().getName());
    }

    private static Number narrow(BigInteger value) {
        if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0) {
            return value.intValue();
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    @Override
    public String toString() {
        return attributes.isEmpty() ? String.valueOf(kind) : kind + attributes;
    }
}
