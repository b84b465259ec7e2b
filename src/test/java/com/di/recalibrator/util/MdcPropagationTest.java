package com.di.recalibrator.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Wrapped executor carries the submitter's MDC to the worker")
    void testWrapExecutorPropagates() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put(MdcPropagation.BATCH_ID, "b-1");
            String seen = pool.submit(() -> MDC.get(MdcPropagation.BATCH_ID)).get(5, TimeUnit.SECONDS);
            assertEquals("b-1", seen);

            MDC.clear();
            String after = pool.submit(() -> MDC.get(MdcPropagation.BATCH_ID)).get(5, TimeUnit.SECONDS);
            assertNull(after);
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("Wrapped runnable sees the MDC captured at wrap time")
    void testWrapRunnableCapturesAtWrapTime() throws Exception {
        MDC.put(MdcPropagation.HORIZON, "7d");
        String[] seen = new String[1];
        Runnable task = MdcPropagation.wrapRunnable(() -> seen[0] = MDC.get(MdcPropagation.HORIZON));
        MDC.put(MdcPropagation.HORIZON, "30d");

        Thread worker = new Thread(task);
        worker.start();
        worker.join(5000);

        assertEquals("7d", seen[0]);
    }
}
