package com.example.kbassist.index;

/** A vector does not match the dimension the index was built with. */
public class VectorDimensionException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public VectorDimensionException(String what, int expected, int actual) {
        super("%s has dimension %d, index expects %d".formatted(what, actual, expected));
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
