package com.ryuqq.wick.adapter.runner;

import com.ryuqq.wick.application.session.AlgebraSession;
import com.ryuqq.wick.application.session.DefaultAlgebraSession;
import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.space.SpaceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 병렬 전개 동시성 테스트.
 *
 * <p>하나의 ParallelExpansionRuntime을 여러 세션과 호출 스레드가 공유해도
 * 결과가 순차 전개와 같음을 검증합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
class ConcurrencyTest {

    private ParallelExpansionRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ParallelExpansionRuntime(new ParallelRuntimeConfig(4, 0, 60_000));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runtime.shutdown();
    }

    private static AlgebraSession newSession(AlgebraContext context) {
        AlgebraSession session = new DefaultAlgebraSession(context);
        session.addSpace("o", "fermion", "occupied", List.of("i", "j", "k", "l"));
        session.addSpace("a", "fermion", "general", List.of("u", "v", "w", "x"));
        session.addSpace("v", "fermion", "unoccupied", List.of("a", "b", "c", "d"));
        return session;
    }

    private static Expression bch(AlgebraSession session) {
        Expression f = session.buildOperatorExpr("f", List.of("a+ a", "o+ o", "v+ v"), false);
        Expression t = session.buildOperatorExpr("t", List.of("v+ o", "a+ o", "v+ a"), true);
        return session.bchSeries(f, t, 2);
    }

    @Test
    void 병렬_BCH는_순차_BCH와_같음() {
        // given
        SpaceRegistry registry = new SpaceRegistry();
        AlgebraContext sequentialContext = new AlgebraContext(registry);
        AlgebraSession sequential = newSession(sequentialContext);
        AlgebraSession parallel = new DefaultAlgebraSession(sequentialContext.withRuntime(runtime));

        // when
        Expression expected = bch(sequential);
        Expression actual = bch(parallel);

        // then
        assertThat(actual.size()).isGreaterThan(1);
        assertThat(actual).isEqualTo(expected);
        assertThat(actual.toString()).isEqualTo(expected.toString());
    }

    @Test
    void 여러_스레드가_runtime을_공유해도_결과가_같음() throws Exception {
        // given
        SpaceRegistry reference = new SpaceRegistry();
        String expected = bch(newSession(new AlgebraContext(reference))).toString();
        ExecutorService callers = Executors.newFixedThreadPool(4);

        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> bch(newSession(new AlgebraContext(new SpaceRegistry()).withRuntime(runtime))).toString());
            }

            // when
            List<Future<String>> results = callers.invokeAll(tasks, 60, TimeUnit.SECONDS);

            // then
            for (Future<String> result : results) {
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            callers.shutdownNow();
        }
    }
}
