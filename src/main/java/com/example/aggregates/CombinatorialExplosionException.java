package com.example.aggregates;

/**
 * Thrown when counting combos of some length would exceed the configured combo budget,
 * or ran out of memory while doing so.
 */
public class CombinatorialExplosionException extends RuntimeException {

    private final int length;
    private final long estimatedCombos;

    public CombinatorialExplosionException(int length, long estimatedCombos, long budget) {
        super("Counting combos of length " + length + " would generate " + estimatedCombos
                + " combos, exceeding the budget of " + budget
                + "; lower reporting_length or raise max_combos_per_length");
        this.length = length;
        this.estimatedCombos = estimatedCombos;
    }

    public CombinatorialExplosionException(int length, long estimatedCombos, Throwable cause) {
        super("Ran out of memory counting " + estimatedCombos + " combos of length " + length, cause);
        this.length = length;
        this.estimatedCombos = estimatedCombos;
    }

    public int getLength() {
        return length;
    }

    public long getEstimatedCombos() {
        return estimatedCombos;
    }
}
