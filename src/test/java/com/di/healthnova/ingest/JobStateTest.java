package com.di.healthnova.ingest;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.IllegalJobTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobState Tests")
class JobStateTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @ParameterizedTest
    @CsvSource({
            "QUEUED, PARSING, true",
            "PARSING, CANONICALIZING, true",
            "PARSING, FAILED, true",
            "CANONICALIZING, PERSISTING, true",
            "CANONICALIZING, FAILED, true",
            "PERSISTING, COMPLETED, true",
            "PERSISTING, FAILED, true",
            "FAILED, QUEUED, true",
            "QUEUED, COMPLETED, false",
            "QUEUED, FAILED, false",
            "PARSING, PERSISTING, false",
            "COMPLETED, QUEUED, false",
            "COMPLETED, FAILED, false",
            "FAILED, PARSING, false"
    })
    @DisplayName("Should allow only the edges of the job state machine")
    void testCanTransitionTo(JobState from, JobState to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    @DisplayName("Should classify terminal and running states")
    void testTerminalAndRunning() {
        assertTrue(JobState.COMPLETED.isTerminal());
        assertTrue(JobState.FAILED.isTerminal());
        assertFalse(JobState.QUEUED.isTerminal());
        assertTrue(JobState.CANONICALIZING.isRunning());
        assertFalse(JobState.QUEUED.isRunning());
        assertTrue(JobState.COMPLETED.successors().isEmpty());
    }

    @Test
    @DisplayName("Should count an attempt each time the job enters Parsing")
    void testJob_AttemptsAndHistory() {
        IngestionJob job = new IngestionJob("j1", "u1", "a.csv", null, null, T0);

        job.transitionTo(JobState.PARSING, T0);
        job.fail(ErrorCategory.FILE_READ_ERROR, "missing", T0.plusSeconds(1));
        job.transitionTo(JobState.QUEUED, T0.plusSeconds(2));
        job.transitionTo(JobState.PARSING, T0.plusSeconds(3));

        assertEquals(2, job.getAttempts());
        assertEquals(ErrorCategory.FILE_READ_ERROR, job.getErrorCategory());
        assertEquals(List.of("missing"), job.getErrorLog());
        assertEquals(List.of(JobState.QUEUED, JobState.PARSING, JobState.FAILED, JobState.QUEUED, JobState.PARSING),
                job.getHistory());
        assertEquals(T0.plusSeconds(3), job.getUpdatedAt());
    }

    @Test
    @DisplayName("Should reject an edge the state machine does not have")
    void testJob_IllegalTransition() {
        IngestionJob job = new IngestionJob("j1", "u1", "a.csv", null, null, T0);

        IllegalJobTransitionException e = assertThrows(IllegalJobTransitionException.class,
                () -> job.transitionTo(JobState.COMPLETED, T0));
        assertTrue(e.getMessage().contains("QUEUED -> COMPLETED"));
        assertEquals(JobState.QUEUED, job.getState());
    }
}
