package com.ryuqq.wick.core.number;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RationalNumber 테스트.
 *
 * @author Wick Team
 * @since 1.0.0
 */
class RationalNumberTest {

    @Test
    void of_ReducesFraction() {
        // When
        RationalNumber half = RationalNumber.of(2, 4);

        // Then
        assertEquals(BigInteger.ONE, half.getNumerator());
        assertEquals(BigInteger.TWO, half.getDenominator());
        assertEquals("1/2", half.toString());
    }

    @Test
    void of_NegativeDenominator_MovesSignToNumerator() {
        // When
        RationalNumber value = RationalNumber.of(3, -6);

        // Then
        assertEquals("-1/2", value.toString());
        assertEquals(-1, value.signum());
    }

    @Test
    void of_ZeroDenominator_ThrowsArithmeticException() {
        assertThrows(ArithmeticException.class, () -> RationalNumber.of(1, 0));
    }

    @Test
    void add_DifferentDenominators_ReturnsExactSum() {
        // When
        RationalNumber sum = RationalNumber.of(1, 2).add(RationalNumber.of(1, 3));

        // Then
        assertEquals(RationalNumber.of(5, 6), sum);
    }

    @Test
    void subtract_And_Negate_AreConsistent() {
        RationalNumber a = RationalNumber.of(7, 4);
        RationalNumber b = RationalNumber.of(1, 4);

        assertEquals(RationalNumber.of(3, 2), a.subtract(b));
        assertEquals(a.add(b.negate()), a.subtract(b));
    }

    @Test
    void multiply_And_Divide() {
        RationalNumber a = RationalNumber.of(2, 3);

        assertEquals(RationalNumber.of(4, 9), a.multiply(a));
        assertEquals(RationalNumber.of(-2, 1), a.multiply(-3));
        assertEquals(RationalNumber.ONE, a.divide(a));
    }

    @Test
    void divide_ByZero_ThrowsArithmeticException() {
        assertThrows(ArithmeticException.class, () -> RationalNumber.ONE.divide(RationalNumber.ZERO));
    }

    @Test
    void parse_FractionAndInteger() {
        assertEquals(RationalNumber.of(-3, 4), RationalNumber.parse("-3/4"));
        assertEquals(RationalNumber.of(5), RationalNumber.parse("5"));
        assertEquals("5", RationalNumber.parse("10/2").toString());
    }

    @Test
    void parse_Malformed_ThrowsNumberFormatException() {
        assertThrows(NumberFormatException.class, () -> RationalNumber.parse("1/x"));
        assertThrows(NumberFormatException.class, () -> RationalNumber.parse(" "));
    }

    @Test
    void inverseFactorial_ReturnsOneOverFactorial() {
        assertEquals(RationalNumber.ONE, RationalNumber.inverseFactorial(0));
        assertEquals(RationalNumber.of(1, 6), RationalNumber.inverseFactorial(3));
        assertThrows(IllegalArgumentException.class, () -> RationalNumber.inverseFactorial(-1));
    }

    @Test
    void compareTo_IsExact() {
        assertTrue(RationalNumber.of(1, 3).compareTo(RationalNumber.of(1, 2)) < 0);
        assertEquals(0, RationalNumber.of(2, 4).compareTo(RationalNumber.of(1, 2)));
    }

    @Test
    void predicates() {
        assertTrue(RationalNumber.ZERO.isZero());
        assertTrue(RationalNumber.of(3, 3).isOne());
        assertTrue(RationalNumber.of(4, 2).isInteger());
        assertFalse(RationalNumber.of(1, 2).isInteger());
        assertEquals(RationalNumber.of(1, 2), RationalNumber.of(-1, 2).abs());
    }

    @Test
    void toDouble_ReturnsApproximation() {
        assertEquals(0.5, RationalNumber.of(1, 2).toDouble(), 1e-15);
        assertEquals(-1.0 / 3.0, RationalNumber.of(-1, 3).toDouble(), 1e-15);
    }
}
