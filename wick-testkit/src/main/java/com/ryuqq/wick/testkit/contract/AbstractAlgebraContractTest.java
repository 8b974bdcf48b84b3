package com.ryuqq.wick.testkit.contract;

import com.ryuqq.wick.application.session.AlgebraSession;
import com.ryuqq.wick.application.session.DefaultAlgebraSession;
import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.spi.ExpansionRuntime;
import com.ryuqq.wick.core.spi.SequentialExpansionRuntime;
import com.ryuqq.wick.core.text.ExpressionParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for algebra Contract Tests.
 *
 * <p>This class provides a fresh session per test with the standard index spaces
 * and helper methods for building and comparing expressions.</p>
 *
 * <p><strong>Standard spaces:</strong></p>
 * <ul>
 *   <li>o: fermion, occupied, stems i j k l</li>
 *   <li>a: fermion, general, stems u v w x</li>
 *   <li>v: fermion, unoccupied, stems a b c d</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyRuntimeContractTest extends AbstractAlgebraContractTest {
 *     {@literal @}Override
 *     protected ExpansionRuntime createRuntime() {
 *         return new MyExpansionRuntime();
 *     }
 *
 *     {@literal @}Test
 *     void commutatorOfSelfVanishes() {
 *         Expression t = session.buildOperatorExpr("T", List.of("v+ o"), true);
 *         assertZero(t.commutator(t));
 *     }
 * }
 * </pre>
 *
 * <p>A runtime returned by {@link #createRuntime()} that implements {@link AutoCloseable}
 * is closed after each test.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public abstract class AbstractAlgebraContractTest {

    protected AlgebraSession session;
    protected ExpressionParser parser;
    protected ExpansionRuntime runtime;

    /**
     * Sets up a fresh registry, runtime and session before each test.
     */
    @BeforeEach
    void setUpSession() {
        runtime = createRuntime();
        AlgebraContext context = new AlgebraContext(new SpaceRegistry()).withRuntime(runtime);
        session = new DefaultAlgebraSession(context);
        parser = new ExpressionParser(context);
        registerSpaces();
    }

    /**
     * Closes the runtime when it holds resources.
     *
     * @throws Exception if closing the runtime fails
     */
    @AfterEach
    void tearDownSession() throws Exception {
        if (runtime instanceof AutoCloseable) {
            ((AutoCloseable) runtime).close();
        }
    }

    /**
     * Runtime under test. Defaults to the sequential runtime.
     *
     * @return expansion runtime
     */
    protected ExpansionRuntime createRuntime() {
        return new SequentialExpansionRuntime();
    }

    /**
     * Registers the standard o / a / v spaces. Override to use a different configuration.
     */
    protected void registerSpaces() {
        session.addSpace("o", "fermion", "occupied", List.of("i", "j", "k", "l"));
        session.addSpace("a", "fermion", "general", List.of("u", "v", "w", "x"));
        session.addSpace("v", "fermion", "unoccupied", List.of("a", "b", "c", "d"));
    }

    protected Expression expr(String text) {
        return session.buildExpression(text);
    }

    protected Expression expr(String text, Symmetry symmetry) {
        return parser.parse(text, symmetry);
    }

    protected Term term(String text) {
        return parser.parseTerm(text);
    }

    /**
     * Asserts that two expressions have the same canonical keys and coefficients.
     *
     * @param expected the expected expression
     * @param actual the actual expression
     */
    protected void assertSameExpression(Expression expected, Expression actual) {
        assertEquals(expected, actual,
                String.format("Expected expression%n%s%nbut was%n%s", expected, actual));
    }

    /**
     * Asserts that the expression has no terms.
     *
     * @param actual the actual expression
     */
    protected void assertZero(Expression actual) {
        assertTrue(actual.isZero(),
                String.format("Expected the zero expression but was%n%s", actual));
    }

    /**
     * Asserts the printed form of an expression.
     *
     * @param expected the expected text
     * @param actual the actual expression
     */
    protected void assertPrints(String expected, Expression actual) {
        assertEquals(expected, actual.toString());
    }
}
