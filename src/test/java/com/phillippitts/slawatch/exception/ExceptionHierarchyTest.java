package com.phillippitts.slawatch.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void slaWatchExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SlaWatchException ex = new SlaWatchException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void ingestExceptionShouldIncludeKind() {
        IngestException ex = new IngestException(IngestException.Kind.RATE_LIMIT, "slow down");

        assertThat(ex.getMessage()).contains("slow down").contains("RATE_LIMIT");
        assertThat(ex.getKind()).isEqualTo(IngestException.Kind.RATE_LIMIT);
        assertThat(ex).isInstanceOf(SlaWatchException.class);
    }

    @Test
    void onlyTransientIngestFailuresAreRetriable() {
        assertThat(IngestException.Kind.NETWORK.isRetriable()).isTrue();
        assertThat(IngestException.Kind.SERVER.isRetriable()).isTrue();
        assertThat(IngestException.Kind.RATE_LIMIT.isRetriable()).isTrue();
        assertThat(IngestException.Kind.AUTH.isRetriable()).isFalse();
        assertThat(IngestException.Kind.VALIDATION.isRetriable()).isFalse();
    }

    @Test
    void localStorageExceptionShouldIncludeLocation() {
        IOException cause = new IOException("No space left on device");
        LocalStorageException ex = new LocalStorageException("Cannot write backlog file", "/var/backlog/a.jsonl", cause);

        assertThat(ex.getMessage()).contains("Cannot write backlog file").contains("/var/backlog/a.jsonl");
        assertThat(ex.getLocation()).isEqualTo("/var/backlog/a.jsonl");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidMeasurementExceptionShouldBeSlaWatchException() {
        assertThat(new InvalidMeasurementException("negative")).isInstanceOf(SlaWatchException.class);
    }
}
