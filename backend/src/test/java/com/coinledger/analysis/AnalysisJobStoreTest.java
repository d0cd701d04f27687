package com.coinledger.analysis;

import com.coinledger.domain.AnalysisJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisJobStoreTest {

    private MutableClock clock;
    private AnalysisJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        PipelineProperties properties = new PipelineProperties();
        properties.setJobTtlHours(24);
        store = new AnalysisJobStore(properties, clock);
    }

    @Test
    @DisplayName("created jobs can be looked up, unknown ids cannot")
    void lookup() {
        AnalysisJob job = store.create();

        assertThat(store.get(job.getId())).isSameAs(job);
        assertThatThrownBy(() -> store.get("nope")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.get(null)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("finished jobs expire after the TTL, running jobs never do")
    void expiry() {
        AnalysisJob finished = store.create();
        AnalysisJob running = store.create();
        finished.fail("boom");

        clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> store.get(finished.getId())).isInstanceOf(JobNotFoundException.class);
        assertThat(store.get(running.getId())).isSameAs(running);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("housekeeping removes expired jobs")
    void housekeeping() {
        store.create().fail("one");
        store.create().fail("two");
        store.create();

        assertThat(store.deleteExpiredJobs()).isZero();
        clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThat(store.deleteExpiredJobs()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
