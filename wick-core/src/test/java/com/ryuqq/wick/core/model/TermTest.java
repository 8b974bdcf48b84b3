package com.ryuqq.wick.core.model;

import com.ryuqq.wick.core.TestSpaces;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Term / Operator / TensorLabel 테스트.
 *
 * @author Wick Team
 * @since 1.0.0
 */
class TermTest {

    private Index o0;
    private Index v0;
    private Index a1;

    @BeforeEach
    void setUp() {
        SpaceRegistry registry = TestSpaces.standard();
        o0 = registry.index("o", 0);
        v0 = registry.index("v", 0);
        a1 = registry.index("a", 1);
    }

    @Test
    void toString_PlainProduct_PrintsSpaceSeparated() {
        // Given
        Term term = Term.builder()
            .coefficient(RationalNumber.MINUS_ONE)
            .tensor(TensorLabel.of("t", List.of(a1), List.of(o0), Symmetry.ANTISYMMETRIC))
            .operator(Operator.creation(a1))
            .operator(Operator.annihilation(o0))
            .build();

        // When & Then
        assertEquals("-t^{a1}_{o0} a+(a1) a-(o0)", term.toString());
    }

    @Test
    void toString_NormalProduct_PrintsBraces() {
        Term term = Term.builder()
            .coefficient(RationalNumber.of(1, 2))
            .operator(Operator.creation(v0))
            .operator(Operator.annihilation(o0))
            .normalOrdered(true)
            .build();

        assertEquals("1/2 { a+(v0) a-(o0) }", term.toString());
    }

    @Test
    void toString_Scalar_PrintsCoefficientOnly() {
        assertEquals("1", Term.scalar(RationalNumber.ONE).toString());
        assertEquals("-1", Term.scalar(RationalNumber.MINUS_ONE).toString());
        assertEquals("3/2", Term.scalar(RationalNumber.of(3, 2)).toString());
    }

    @Test
    void build_NoOperators_IsNeverNormalOrdered() {
        Term term = Term.builder().normalOrdered(true).build();

        assertFalse(term.isNormalOrdered());
        assertTrue(term.isScalar());
    }

    @Test
    void summedIndices_CountsTensorAndOperatorOccurrences() {
        // Given
        Term term = Term.builder()
            .tensor(TensorLabel.of("t", List.of(v0), List.of(o0), Symmetry.ANTISYMMETRIC))
            .operator(Operator.creation(v0))
            .operator(Operator.annihilation(a1))
            .build();

        // When
        Set<Index> summed = term.summedIndices();
        Map<Index, Integer> occurrences = term.indexOccurrences();

        // Then
        assertEquals(Set.of(v0), summed);
        assertEquals(2, occurrences.get(v0));
        assertEquals(1, occurrences.get(o0));
    }

    @Test
    void adjoint_ReversesOperatorsAndSwapsTensorSlots() {
        Term term = Term.builder()
            .tensor(TensorLabel.of("t", List.of(v0), List.of(o0), Symmetry.ANTISYMMETRIC))
            .operator(Operator.creation(v0))
            .operator(Operator.annihilation(o0))
            .build();

        Term adjoint = term.adjoint();

        assertEquals("t^{o0}_{v0} a+(o0) a-(v0)", adjoint.toString());
        assertEquals(term, adjoint.adjoint());
    }

    @Test
    void substitute_ReplacesIndicesEverywhere() {
        Term term = Term.builder()
            .tensor(TensorLabel.of("f", List.of(v0), List.of(a1), Symmetry.NONE))
            .operator(Operator.annihilation(v0))
            .build();

        Term replaced = term.substitute(Map.of(v0, o0));

        assertEquals("f^{o0}_{a1} a-(o0)", replaced.toString());
    }

    @Test
    void tensorLabel_InvalidName_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> TensorLabel.of("1t", List.of(), List.of(), Symmetry.NONE));
    }

    @Test
    void tensorLabel_Signature_UsesSlotCounts() {
        TensorLabel tensor = TensorLabel.of("T", List.of(o0, a1), List.of(v0), Symmetry.ANTISYMMETRIC);

        assertEquals("T(2,1)", tensor.signature());
        assertEquals(3, tensor.rank());
        assertEquals("T^{o0,a1}_{v0}", tensor.toString());
    }

    @Test
    void operator_AdjointFlipsKind() {
        assertEquals(Operator.annihilation(v0), Operator.creation(v0).adjoint());
        assertEquals("a-(v0)", Operator.annihilation(v0).toString());
    }
}
