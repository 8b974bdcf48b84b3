package com.ryuqq.wick.testkit.contract;

import com.ryuqq.wick.core.algebra.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: commutator and adjoint laws.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>[C, C] = 0</li>
 *   <li>[A, B] = -[B, A]</li>
 *   <li>adjoint(adjoint(A)) == A</li>
 *   <li>Operators on disjoint spaces commute</li>
 *   <li>[f, t] for a one-body f and a single excitation t has a fixed canonical value</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
class CommutatorContractTest extends AbstractAlgebraContractTest {

    @Test
    void testCommutator_WithSelf_IsZero() {
        Expression t = session.buildOperatorExpr("T", List.of("v+ o", "v+ v+ o o"), true);

        assertZero(t.commutator(t));
    }

    @Test
    void testCommutator_IsAntisymmetric() {
        // Given
        Expression f = session.buildOperatorExpr("f", List.of("a+ a", "v+ o"), false);
        Expression t = session.buildOperatorExpr("t", List.of("v+ a"), true);

        // When
        Expression sum = f.commutator(t).add(t.commutator(f));

        // Then
        assertZero(sum);
    }

    @Test
    void testCommutator_DisjointSpaces_Vanishes() {
        Expression c = session.buildOperatorExpr("C", List.of("o+ o"), false);
        Expression d = session.buildOperatorExpr("D", List.of("v+ v"), false);

        assertZero(c.commutator(d));
    }

    @Test
    void testCommutator_OneBodyWithSingleExcitation_CanonicalValue() {
        // Given
        Expression f = session.buildOperatorExpr("f", List.of("v+ v", "o+ o"), false);
        Expression t = session.buildOperatorExpr("t", List.of("v+ o"), true);

        // When
        Expression commutator = session.canonicalize(f.commutator(t));

        // Then
        assertPrints("-f^{o0}_{o1} t^{o1}_{v0} { a+(v0) a-(o0) }\n"
            + "+f^{v0}_{v1} t^{o0}_{v0} { a+(v1) a-(o0) }", commutator);
    }

    @Test
    void testCommutator_GeneralSpace_DoesNotVanish() {
        Expression creation = expr("{ a+(a_0) }");
        Expression annihilation = expr("{ a-(a_1) }");

        assertFalse(creation.commutator(annihilation).isZero());
    }

    @Test
    void testAdjoint_IsInvolution() {
        // Given
        Expression a = expr("2/3 t^{o_0,o_1}_{v_0,v_1} { a+(v_0) a+(v_1) a-(o_1) a-(o_0) }\n"
            + "-f^{a_0}_{a_1} a+(a_0) a-(a_1)\n+4");

        // When
        Expression twice = a.adjoint().adjoint();

        // Then
        assertSameExpression(a, twice);
        assertNotEquals(a, a.adjoint());
    }
}
