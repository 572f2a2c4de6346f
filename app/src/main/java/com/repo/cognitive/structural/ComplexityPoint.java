package com.repo.cognitive.structural;

import com.repo.cognitive.tree.SourcePosition;

import java.util.Objects;

/**
 * One scoring event: the amount added to a function's score and where it comes from.
 * Structural increments cost {@code nesting + 1}, flat increments cost 1.
 */
public record ComplexityPoint(int amount, SourcePosition location) {

    public ComplexityPoint {
        if (amount < 1) {
            throw new IllegalArgumentException("Complexity amount must be at least 1, got " + amount);
        }
        Objects.requireNonNull(location, "location");
    }

    public static ComplexityPoint flat(SourcePosition location) {
        return new ComplexityPoint(1, location);
    }

    public static ComplexityPoint structural(int nesting, SourcePosition location) {
        return new ComplexityPoint(nesting + 1, location);
    }

    /**
     * Part of the amount charged for nesting.
     */
    public int nesting() {
        return amount - 1;
    }

    /**
     * Same point, one nesting level deeper.
     */
    public ComplexityPoint nestedOnce() {
        return new ComplexityPoint(amount + 1, location);
    }

    /**
     * Annotation shown next to the point's location, e.g. {@code +3 (incl. 2 for nesting)}.
     */
    public String message() {
        if (amount == 1) {
            return "+1";
        }
        return "+%d (incl. %d for nesting)".formatted(amount, nesting());
    }
}
