package com.ryuqq.wick.testkit.contract;

import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.number.RationalNumber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: dot product and norm.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>dot is symmetric</li>
 *   <li>dot is bilinear</li>
 *   <li>norm(A) == sqrt(dot(A, A)), zero only for the zero expression</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
class InnerProductContractTest extends AbstractAlgebraContractTest {

    private Expression a() {
        return expr("2 { a+(v_0) a-(o_0) }\n-1/2 { a+(a_0) }\n+3");
    }

    private Expression b() {
        return expr("{ a+(v_0) a-(o_0) }\n+4 { a+(a_0) }\n-t^{o_0}_{v_0}");
    }

    private Expression c() {
        return expr("-1/3 { a+(a_0) }\n+5 t^{o_0}_{v_0}\n+1");
    }

    @Test
    void testDot_IsSymmetric() {
        assertEquals(session.dot(a(), b()), session.dot(b(), a()));
        assertEquals(RationalNumber.ZERO, session.dot(a(), b()));
    }

    @Test
    void testDot_IsBilinear() {
        // Given
        RationalNumber alpha = RationalNumber.of(2, 3);
        RationalNumber beta = RationalNumber.of(-5);
        Expression combination = b().scalarMultiply(alpha).add(c().scalarMultiply(beta));

        // When
        RationalNumber left = session.dot(a(), combination);
        RationalNumber right = alpha.multiply(session.dot(a(), b()))
            .add(beta.multiply(session.dot(a(), c())));

        // Then
        assertEquals(right, left);
    }

    @Test
    void testNorm_IsSquareRootOfSelfDot() {
        // Given
        Expression a = a();

        // When
        double norm = session.norm(a);

        // Then
        assertEquals(Math.sqrt(session.dot(a, a).toDouble()), norm, 1e-12);
        assertTrue(norm > 0);
    }

    @Test
    void testNorm_ZeroOnlyForZeroExpression() {
        Expression zero = a().add(a().scalarMultiply(RationalNumber.MINUS_ONE));

        assertEquals(0.0, session.norm(zero));
        assertTrue(session.norm(c()) > 0);
    }
}
