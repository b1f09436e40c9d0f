package com.example.aggregates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Text form of a combo: {@code attribute:value} pairs joined by {@code ;} in canonical
 * order, e.g. {@code age:42;sex:F}.
 * <p>
 * Attributes and values must not contain {@code :} or {@code ;};
 * {@link MicrodataLoader#cleanValue} remaps both before records are built.
 */
public class AggregateCodec {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateCodec.class);

    public static final String PAIR_SEPARATOR = ":";
    public static final String COMBO_SEPARATOR = ";";

    public static String encode(Combo combo) {
        StringJoiner joiner = new StringJoiner(COMBO_SEPARATOR);
        for (AttributeValuePair pair : combo.getPairs()) {
            joiner.add(pair.getAttribute() + PAIR_SEPARATOR + pair.getValue());
        }
        return joiner.toString();
    }

    /**
     * Parses an encoded combo. The returned length is the number of {@code ;}-separated
     * segments; segments that do not split into exactly one attribute and one value are
     * left out of the combo (and logged), so the combo can be shorter than the length.
     * Pairs keep the order in which they appear in {@code comboString}.
     */
    public static DecodedCombo decode(String comboString) {
        String[] segments = comboString.split(COMBO_SEPARATOR, -1);
        List<AttributeValuePair> pairs = new ArrayList<>(segments.length);
        for (String segment : segments) {
            String[] parts = segment.split(PAIR_SEPARATOR, -1);
            if (parts.length == 2) {
                pairs.add(new AttributeValuePair(parts[0], parts[1]));
            } else {
                LOG.debug("Dropping malformed segment '{}' of combo '{}'", segment, comboString);
            }
        }
        return new DecodedCombo(segments.length, Combo.ofSorted(List.copyOf(pairs)));
    }
}
