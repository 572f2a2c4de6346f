package com.repo.cognitive.structural;

import com.repo.cognitive.tree.SourcePosition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComplexityPointTest {

    private static final SourcePosition POSITION = SourcePosition.at(4, 9);

    @Test
    void testMessages() {
        assertEquals("+1", ComplexityPoint.flat(POSITION).message());
        assertEquals("+1", ComplexityPoint.structural(0, POSITION).message());
        assertEquals("+3 (incl. 2 for nesting)", ComplexityPoint.structural(2, POSITION).message());
    }

    @Test
    void testNestedOnce() {
        ComplexityPoint point = ComplexityPoint.structural(0, POSITION).nestedOnce();
        assertEquals(2, point.amount());
        assertEquals(1, point.nesting());
        assertEquals(POSITION, point.location());
    }

    @Test
    void testAmountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ComplexityPoint(0, POSITION));
    }
}
