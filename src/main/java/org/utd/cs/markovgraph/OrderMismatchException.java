package org.utd.cs.markovgraph;

/**
 * Thrown when two models of different n-gram length are merged.
 */
public class OrderMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public OrderMismatchException(int expected, int actual) {
        super("N-gram lengths " + expected + " and " + actual + " do not match!");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
