package com.hvdc.ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for per-case extraction and classification.
 *
 * Cases are independent, so a fixed pool of platform threads is enough; the
 * wrapper copies the caller's MDC (run id) into every task so worker log lines
 * can be correlated with the run that spawned them.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.concurrency:8}")
    private int concurrency;

    @Bean(name = "caseProcessingExecutor", destroyMethod = "shutdown")
    public ExecutorService caseProcessingExecutor() {
        int threads = Math.max(1, concurrency);
        log.info("Creating case processing executor with {} threads and MDC propagation", threads);
        return mdcPropagating(Executors.newFixedThreadPool(threads, namedThreads("case-worker-")));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static ExecutorService mdcPropagating(ExecutorService delegate) {
        return new ExecutorService() {

            private <T> Callable<T> wrap(Callable<T> callable) {
                final Map<String, String> context = MDC.getCopyOfContextMap();
                return () -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        return callable.call();
                    } finally {
                        MDC.clear();
                    }
                };
            }

            private Runnable wrap(Runnable runnable) {
                final Map<String, String> context = MDC.getCopyOfContextMap();
                return () -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        runnable.run();
                    } finally {
                        MDC.clear();
                    }
                };
            }

            private <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
                return tasks.stream().<Callable<T>>map(this::wrap).toList();
            }

            @Override
            public void execute(Runnable command) {
                delegate.execute(wrap(command));
            }

            @Override
            public <T> Future<T> submit(Callable<T> task) {
                return delegate.submit(wrap(task));
            }

            @Override
            public Future<?> submit(Runnable task) {
                return delegate.submit(wrap(task));
            }

            @Override
            public <T> Future<T> submit(Runnable task, T result) {
                return delegate.submit(wrap(task), result);
            }

            @Override
            public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
                return delegate.invokeAll(wrapAll(tasks));
            }

            @Override
            public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                    throws InterruptedException {
                return delegate.invokeAll(wrapAll(tasks), timeout, unit);
            }

            @Override
            public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                    throws InterruptedException, ExecutionException {
                return delegate.invokeAny(wrapAll(tasks));
            }

            @Override
            public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                    throws InterruptedException, ExecutionException, TimeoutException {
                return delegate.invokeAny(wrapAll(tasks), timeout, unit);
            }

            @Override
            public void shutdown() { delegate.shutdown(); }
            @Override
            public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
            @Override
            public boolean isShutdown() { return delegate.isShutdown(); }
            @Override
            public boolean isTerminated() { return delegate.isTerminated(); }
            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                return delegate.awaitTermination(timeout, unit);
            }
        };
    }
}
