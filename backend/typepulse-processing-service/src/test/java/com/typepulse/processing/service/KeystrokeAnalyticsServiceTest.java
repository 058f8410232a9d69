package com.typepulse.processing.service;

import com.typepulse.processing.recorder.TypingSession;
import com.typepulse.processing.report.AnalyticsReport;
import com.typepulse.processing.report.SessionScore;
import com.typepulse.processing.support.Services;
import com.typepulse.processing.support.Typist;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class KeystrokeAnalyticsServiceTest {

    private static final String TEXT = "pack my box with five dozen liquor jugs";

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private KeystrokeAnalyticsService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        registry = new SimpleMeterRegistry();
        service = Services.analytics(executor, registry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldAnalyzeSynchronouslyAndRecordMetrics() {
        TypingSession session = new Typist(TEXT).wrong(90, 70).typeRest(90, 70).session();

        AnalyticsReport report = service.analyze(session);

        assertThat(report.totalErrors()).isEqualTo(1);
        assertThat(report.errorKeys()).containsExactly("p");
        assertThat(registry.counter("typepulse_sessions_analyzed_total").count()).isEqualTo(1.0);
        assertThat(registry.timer("typepulse_analysis_duration_seconds").count()).isEqualTo(1);
    }

    @Test
    void shouldSnapshotBeforeGoingAsync() throws Exception {
        // Given a finished session that the host resets straight away
        TypingSession session = new Typist(TEXT).typeRest(90, 70).session();

        // When
        var future = service.analyzeAsync(session);
        session.reset();
        AnalyticsReport report = future.get(5, TimeUnit.SECONDS);

        // Then the report still covers every key
        assertThat(report.accuracy()).isEqualTo(100.0);
        assertThat(report.keyHeatmap().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(TEXT.length());
    }

    @Test
    void shouldPassHostScoreThroughAsyncPath() throws Exception {
        TypingSession session = new Typist(TEXT).typeRest(90, 70).session();

        AnalyticsReport report = service.analyzeAsync(session, new SessionScore(64, 66, 98.0, 2))
                .get(5, TimeUnit.SECONDS);

        assertThat(report.wpm()).isEqualTo(64);
        assertThat(report.totalErrors()).isEqualTo(2);
    }

    @Test
    void shouldCountSuspiciousSessions() {
        TypingSession session = new Typist("abcdefghij".repeat(4)).typeRest(20, 30).session();

        AnalyticsReport report = service.analyze(session);

        assertThat(report.antiCheat().suspicious()).isTrue();
        assertThat(registry.counter("typepulse_anticheat_suspicious_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("typepulse_anticheat_flags_total", "flag", "perfect_rhythm").count()).isEqualTo(1.0);
    }
}
