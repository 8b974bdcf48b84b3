package com.ryuqq.wick.adapter.runner;

import com.ryuqq.wick.core.error.ResourceLimitException;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.spi.ExpansionRuntime;
import com.ryuqq.wick.core.wick.OperatorProduct;
import com.ryuqq.wick.core.wick.WickEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * worker pool 기반 병렬 Wick 전개 runtime.
 *
 * <p>각 OperatorProduct의 전개를 고정 크기 스레드 풀에 제출하고, 결과는 입력 순서대로
 * 호출 스레드에서 모읍니다. 병합(Expression)은 호출 스레드 한 곳에서만 일어나므로
 * worker 사이에 공유되는 가변 상태가 없습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>SpaceRegistry freeze (전개 중 공간 추가 금지)</li>
 *   <li>곱 개수가 sequentialThreshold 이하이면 호출 스레드에서 순차 전개</li>
 *   <li>아니면 곱마다 작업 제출, Future를 입력 순서대로 수집</li>
 *   <li>전개 예외는 원래 타입으로 다시 던짐 (나머지 작업은 취소)</li>
 * </ol>
 *
 * <p><strong>Thread Safety:</strong> 여러 스레드에서 동시에 expandAll을 호출해도 안전합니다.
 * {@link #shutdown()} 이후의 호출은 {@link IllegalStateException}을 던집니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class ParallelExpansionRuntime implements ExpansionRuntime, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelExpansionRuntime.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ParallelRuntimeConfig config;
    private final ExecutorService workerExecutor;

    public ParallelExpansionRuntime() {
        this(new ParallelRuntimeConfig());
    }

    /**
     * 생성자.
     *
     * @param config 병렬 전개 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ParallelExpansionRuntime(ParallelRuntimeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory());
    }

    public ParallelRuntimeConfig getConfig() {
        return config;
    }

    @Override
    public List<Term> expandAll(WickEngine engine, List<OperatorProduct> products) {
        if (engine == null || products == null) {
            throw new IllegalArgumentException("engine and products cannot be null");
        }
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("ParallelExpansionRuntime has been shut down");
        }
        engine.getRegistry().freeze();

        if (products.size() <= config.sequentialThreshold()) {
            List<Term> results = new ArrayList<>();
            for (OperatorProduct product : products) {
                results.addAll(engine.expand(product));
            }
            return results;
        }

        List<Future<List<Term>>> futures = submitAll(engine, products);
        log.debug("Submitted {} operator products to {} workers", products.size(), config.concurrency());
        try {
            return collect(futures);
        } finally {
            for (Future<List<Term>> future : futures) {
                future.cancel(true);
            }
        }
    }

    private List<Future<List<Term>>> submitAll(WickEngine engine, List<OperatorProduct> products) {
        List<Future<List<Term>>> futures = new ArrayList<>(products.size());
        try {
            for (OperatorProduct product : products) {
                futures.add(workerExecutor.submit(() -> engine.expand(product)));
            }
        } catch (RejectedExecutionException e) {
            for (Future<List<Term>> future : futures) {
                future.cancel(true);
            }
            throw new IllegalStateException("ParallelExpansionRuntime has been shut down", e);
        }
        return futures;
    }

    /**
     * 입력 순서대로 결과 수집.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * {@link IllegalStateException}으로 감싸서 던집니다.</p>
     */
    private List<Term> collect(List<Future<List<Term>>> futures) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
        List<Term> results = new ArrayList<>();
        for (Future<List<Term>> future : futures) {
            long remaining = deadline - System.nanoTime();
            try {
                results.addAll(future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for expansion results", e);
            } catch (ExecutionException e) {
                throw unwrap(e);
            } catch (TimeoutException e) {
                log.warn("Expansion did not finish within {}ms", config.timeoutMs());
                throw new ResourceLimitException(
                    "Expansion did not finish within " + config.timeoutMs() + "ms", config.timeoutMs());
            } catch (CancellationException e) {
                throw new IllegalStateException("Expansion task was cancelled", e);
            }
        }
        return results;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("Expansion failed", cause);
    }

    /**
     * worker 풀 종료.
     *
     * <p>진행 중인 전개가 끝나기를 기다리고, 시간 내에 끝나지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Expansion workers did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            workerExecutor.shutdownNow();
        }
        log.info("ParallelExpansionRuntime shut down");
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
    }

    /**
     * daemon worker 스레드 ("wick-expand-N").
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wick-expand-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
