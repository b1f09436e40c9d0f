package com.example.aggregates;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * One (attribute, value) cell of a microdata row, e.g. {@code age:42}.
 */
public final class AttributeValuePair {

    /**
     * Orders pairs by the lowercase form of {@code attribute:value}. Ties are broken by
     * attribute, then value, so the order is consistent with {@link #equals}.
     */
    public static final Comparator<AttributeValuePair> CANONICAL_ORDER =
            Comparator.comparing(AttributeValuePair::getSortKey)
                    .thenComparing(AttributeValuePair::getAttribute)
                    .thenComparing(AttributeValuePair::getValue);

    private final String attribute;
    private final String value;

    public AttributeValuePair(String attribute, String value) {
        this.attribute = Objects.requireNonNull(attribute, "attribute");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getAttribute() {
        return attribute;
    }

    public String getValue() {
        return value;
    }

    public String getSortKey() {
        return toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeValuePair)) {
            return false;
        }
        AttributeValuePair other = (AttributeValuePair) o;
        return attribute.equals(other.attribute) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * attribute.hashCode() + value.hashCode();
    }

    /**
     * @return {@code attribute:value}, the persisted form of a single pair
     */
    @Override
    public String toString() {
        return attribute + AggregateCodec.PAIR_SEPARATOR + value;
    }
}
