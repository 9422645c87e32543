package com.nnipa.iam.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class MdcTaskDecoratorTest {

    private final MdcTaskDecorator decorator = new MdcTaskDecorator();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void workerSeesSubmittingThreadsCorrelationId() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            MDC.put(CorrelationIdFilter.CORRELATION_ID_MDC_KEY, "req-7");
            AtomicReference<String> seen = new AtomicReference<>();
            Runnable task = decorator.decorate(() -> seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)));

            CompletableFuture.runAsync(task, executor).get(5, TimeUnit.SECONDS);
            assertThat(seen.get()).isEqualTo("req-7");

            AtomicReference<String> after = new AtomicReference<>("unset");
            CompletableFuture.runAsync(() -> after.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)), executor)
                    .get(5, TimeUnit.SECONDS);
            assertThat(after.get()).isNull();
        } finally {
            executor.shutdownNow();
        }
    }
}
