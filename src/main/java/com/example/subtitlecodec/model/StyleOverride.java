package com.example.subtitlecodec.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable set of local attribute changes on top of a base style.
 * A {@code null} value reverts the attribute to the base style's value
 * (for example a bare {@code \b} or {@code \c} tag).
 */
public final class StyleOverride {

    private static final StyleOverride EMPTY = new StyleOverride(new EnumMap<>(StyleAttribute.class));

    private final EnumMap<StyleAttribute, Object> values;

    private StyleOverride(EnumMap<StyleAttribute, Object> values) {
        this.values = values;
    }

    public static StyleOverride empty() {
        return EMPTY;
    }

    public static StyleOverride of(StyleAttribute attribute, Object value) {
        return EMPTY.with(attribute, value);
    }

    public StyleOverride with(StyleAttribute attribute, Object value) {
        if (value != null && !attribute.type().isInstance(value)) {
            throw new IllegalArgumentException(
                    attribute + " expects " + attribute.type().getSimpleName() + " but got " + value.getClass());
        }
        EnumMap<StyleAttribute, Object> copy = new EnumMap<>(StyleAttribute.class);
        if (attribute == StyleAttribute.RESET) {
            // a reset discards changes made earlier in the same block
            copy.put(StyleAttribute.RESET, value == null ? "" : value);
        } else {
            copy.putAll(values);
            copy.put(attribute, value);
        }
        return new StyleOverride(copy);
    }

    /**
     * Applies {@code other} after this override; attributes of {@code other} win.
     */
    public StyleOverride then(StyleOverride other) {
        StyleOverride result = this;
        for (Map.Entry<StyleAttribute, Object> entry : other.values.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public boolean contains(StyleAttribute attribute) {
        return values.containsKey(attribute);
    }

    public Object get(StyleAttribute attribute) {
        return values.get(attribute);
    }

    public <T> T get(StyleAttribute attribute, Class<T> type) {
        return type.cast(values.get(attribute));
    }

    public Set<StyleAttribute> attributes() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<StyleAttribute, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StyleOverride other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "StyleOverride" + values;
    }
}
