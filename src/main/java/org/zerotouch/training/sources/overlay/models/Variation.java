package org.zerotouch.training.sources.overlay.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One site variation of an overlay rule, kept as the key/value pairs of the source document.
 * A key that is absent is different from a key holding an empty value: absent keys are never
 * filled in, so consumers can tell "rule doesn't touch this dimension" from "rule blanks it".
 * <p>
 * Serializes back to exactly the keys it holds.
 */
public class Variation {
    public static final String TYPE = "type";
    public static final String ENTERPRISE_DEFAULT = "enterprise_default";
    public static final String SITE_OVERRIDE = "site_override";
    public static final String REASON = "reason";
    public static final String FIELD = "field";
    public static final String FIELD_TECHNICAL = "field_technical";
    public static final String STEP = "step";
    public static final String TIERS = "tiers";
    public static final String CONDITION = "condition";
    public static final String ACTIONS = "actions";
    public static final String TEMPERATURE_RANGES = "temperature_ranges";

    public static final String TYPE_PROCESS_GATE = "process_gate";
    public static final String TYPE_APPROVAL_RULE = "approval_rule";

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Variation() {
    }

    public Variation(Map<String, Object> attributes) {
        this.attributes.putAll(attributes);
    }

    @JsonAnySetter
    private void put(String key, Object value) {
        attributes.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(attributes);
    }

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * The value under {@code key} as text, or an empty string when the key is absent or null.
     */
    public String text(String key) {
        Object value = attributes.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    public String type() {
        return text(TYPE);
    }

    /**
     * A copy that shares no nested lists or maps with this variation.
     */
    public Variation copy() {
        Map<String, Object> copied = new LinkedHashMap<>();
        attributes.forEach((key, value) -> copied.put(key, deepCopy(value)));
        return new Variation(copied);
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copied = new LinkedHashMap<>();
            map.forEach((key, nested) -> copied.put(key, deepCopy(nested)));
            return copied;
        }
        if (value instanceof List<?> list) {
            List<Object> copied = new ArrayList<>(list.size());
            list.forEach(nested -> copied.add(deepCopy(nested)));
            return copied;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variation other)) {
            return false;
        }
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "Variation" + attributes;
    }
}
