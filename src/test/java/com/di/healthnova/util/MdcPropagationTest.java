package com.di.healthnova.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        MDC.clear();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should carry the submitting thread's job and user onto the worker")
    void testWrapExecutor_CarriesContext() throws Exception {
        MDC.put(MdcPropagation.JOB_ID, "job-1");
        MDC.put(MdcPropagation.USER_ID, "u1");

        Future<String> seen = pool.submit(() -> MDC.get(MdcPropagation.JOB_ID) + "/" + MDC.get(MdcPropagation.USER_ID));

        assertEquals("job-1/u1", seen.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should leave the worker thread clean after the task")
    void testWrapExecutor_ClearsAfterTask() throws Exception {
        MDC.put(MdcPropagation.JOB_ID, "job-1");
        pool.submit(() -> { }).get(5, TimeUnit.SECONDS);
        MDC.clear();

        Future<String> seen = pool.submit(() -> MDC.get(MdcPropagation.JOB_ID));

        assertNull(seen.get(5, TimeUnit.SECONDS));
    }
}
