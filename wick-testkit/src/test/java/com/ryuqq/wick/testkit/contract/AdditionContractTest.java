package com.ryuqq.wick.testkit.contract;

import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.error.SymmetryException;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.number.RationalNumber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: addition on canonical-key maps.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A + B == B + A</li>
 *   <li>(A + B) + C == A + (B + C)</li>
 *   <li>A + (-1 × A) has no terms</li>
 *   <li>A failed merge leaves the target unchanged</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
class AdditionContractTest extends AbstractAlgebraContractTest {

    @Test
    void testAddition_IsCommutative() {
        // Given
        Expression a = expr("t^{o_0}_{v_0} { a+(v_0) a-(o_0) }\n+1/2 { a+(a_0) }");
        Expression b = expr("-3 f^{a_0}_{a_1} { a+(a_0) a-(a_1) }\n+{ a+(a_0) }");

        // When
        Expression ab = a.copy().add(b);
        Expression ba = b.copy().add(a);

        // Then
        assertSameExpression(ab, ba);
        assertEquals(RationalNumber.of(3, 2), ab.coefficientOf(term("{ a+(a_0) }")));
    }

    @Test
    void testAddition_IsAssociative() {
        // Given
        Expression a = expr("t^{o_0,o_1}_{v_0,v_1} { a+(v_0) a+(v_1) a-(o_1) a-(o_0) }");
        Expression b = expr("2/3 { a+(v_0) a-(o_0) }\n-t^{o_1,o_0}_{v_0,v_1} { a+(v_0) a+(v_1) a-(o_1) a-(o_0) }");
        Expression c = expr("-2/3 { a+(v_0) a-(o_0) }\n+7");

        // When
        Expression left = a.copy().add(b).add(c);
        Expression right = a.copy().add(b.copy().add(c));

        // Then
        assertSameExpression(left, right);
    }

    @Test
    void testAddition_NegatedSelf_IsZero() {
        // Given
        Expression a = session.buildOperatorExpr("T", java.util.List.of("v+ o", "v+ v+ o o"), true);

        // When
        Expression sum = a.copy().add(a.copy().scalarMultiply(RationalNumber.MINUS_ONE));

        // Then
        assertZero(sum);
        assertEquals(0, sum.size());
    }

    @Test
    void testAddition_EquivalentTermsMergeUnderRelabeling() {
        // Given: same term with dummy indices renamed
        Expression first = expr("f^{o_0}_{o_1} { a+(o_1) a-(o_0) }");
        Expression second = expr("f^{o_2}_{o_3} { a+(o_3) a-(o_2) }");

        // When
        Expression sum = first.copy().add(second);

        // Then
        assertEquals(1, sum.size());
        assertSameExpression(first.copy().scalarMultiply(RationalNumber.of(2)), sum);
    }

    @Test
    void testAddition_FailedMerge_LeavesTargetUntouched() {
        // Given
        Expression target = expr("g^{o_0}_{o_1} { a+(o_1) a-(o_0) }\n+{ a+(a_0) }");
        String before = target.toString();
        Expression conflicting = expr("{ a+(v_0) }\n+g^{v_0}_{v_1} { a+(v_1) a-(v_0) }", Symmetry.SYMMETRIC);

        // When
        assertThrows(SymmetryException.class, () -> target.add(conflicting));

        // Then
        assertEquals(before, target.toString());
        assertEquals(2, target.size());
    }
}
