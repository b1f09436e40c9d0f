package com.example.aggregates;

import java.util.Objects;

public class DecodedCombo {
    private final int length;
    private final Combo combo;

    public DecodedCombo(int length, Combo combo) {
        this.length = length;
        this.combo = combo;
    }

    /**
     * @return the number of segments in the decoded string
     */
    public int getLength() {
        return length;
    }

    public Combo getCombo() {
        return combo;
    }

    /**
     * @return true if some segment was dropped while decoding
     */
    public boolean isLossy() {
        return combo.length() != length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodedCombo)) {
            return false;
        }
        DecodedCombo other = (DecodedCombo) o;
        return length == other.length && combo.equals(other.combo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, combo);
    }

    @Override
    public String toString() {
        return "DecodedCombo{" +
               "length=" + length +
               ", combo='" + combo + '\'' +
               '}';
    }
}
