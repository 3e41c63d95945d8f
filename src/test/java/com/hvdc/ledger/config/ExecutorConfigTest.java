package com.hvdc.ledger.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("caseProcessingExecutor")
    private ExecutorService caseProcessingExecutor;

    private static final String RUN_ID = "runId";

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldPropagateMdcWithExecute() throws Exception {
        final String runId = UUID.randomUUID().toString();
        final CountDownLatch latch = new CountDownLatch(1);
        final CompletableFuture<String> mdcValueFuture = new CompletableFuture<>();

        MDC.put(RUN_ID, runId);

        caseProcessingExecutor.execute(() -> {
            try {
                mdcValueFuture.complete(MDC.get(RUN_ID));
            } finally {
                latch.countDown();
            }
        });

        latch.await(5, TimeUnit.SECONDS);
        MDC.remove(RUN_ID);

        assertThat(mdcValueFuture).isCompletedWithValue(runId);
        assertThat(MDC.get(RUN_ID)).isNull();
    }

    @Test
    void shouldPropagateMdcWithSubmit() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        Future<String> future = caseProcessingExecutor.submit(() -> MDC.get(RUN_ID));

        String mdcValue = future.get(5, TimeUnit.SECONDS);
        MDC.remove(RUN_ID);

        assertThat(mdcValue).isEqualTo(runId);
    }

    @Test
    void shouldPropagateMdcWithInvokeAll() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(RUN_ID))
                .collect(Collectors.toList());

        List<Future<String>> futures = caseProcessingExecutor.invokeAll(tasks, 5, TimeUnit.SECONDS);
        MDC.remove(RUN_ID);

        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(runId);
        }
    }

    @Test
    void shouldPropagateMdcWithCompletableFuture() {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        String seen = CompletableFuture.supplyAsync(() -> MDC.get(RUN_ID), caseProcessingExecutor).join();

        assertThat(seen).isEqualTo(runId);
    }

    @Test
    void shouldClearMdcOnWorkerAfterTask() throws Exception {
        ExecutorService single = ExecutorConfig.mdcPropagating(
                Executors.newSingleThreadExecutor(ExecutorConfig.namedThreads("test-worker-")));
        try {
            MDC.put(RUN_ID, "first");
            single.submit(() -> MDC.get(RUN_ID)).get(5, TimeUnit.SECONDS);
            MDC.clear();

            // no caller context: the worker must not still carry the previous run id
            String leftover = single.submit(() -> MDC.get(RUN_ID)).get(5, TimeUnit.SECONDS);
            String threadName = single.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

            assertThat(leftover).isNull();
            assertThat(threadName).isEqualTo("test-worker-1");
        } finally {
            single.shutdownNow();
        }
    }
}
