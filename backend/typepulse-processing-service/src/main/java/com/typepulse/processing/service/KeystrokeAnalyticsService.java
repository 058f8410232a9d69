package com.typepulse.processing.service;

import com.typepulse.anomaly.service.AntiCheatService;
import com.typepulse.processing.recorder.KeystrokeEvent;
import com.typepulse.processing.recorder.TypingSession;
import com.typepulse.processing.report.AnalyticsReport;
import com.typepulse.processing.report.ReportAssembler;
import com.typepulse.processing.report.SessionScore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for end-of-test analytics. The event log is copied on the calling thread, so the
 * session may be reset or discarded as soon as a call returns, including the async variants.
 */
@Service
public class KeystrokeAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(KeystrokeAnalyticsService.class);

    private final ReportAssembler assembler;
    private final AntiCheatService antiCheat;
    private final ExecutorService executor;
    private final MeterRegistry metrics;
    private final Counter sessionsAnalyzed;
    private final Timer analysisDuration;

    public KeystrokeAnalyticsService(ReportAssembler assembler,
                                     AntiCheatService antiCheat,
                                     @Qualifier("analyticsExecutor") ExecutorService executor,
                                     MeterRegistry metrics) {
        this.assembler = assembler;
        this.antiCheat = antiCheat;
        this.executor = executor;
        this.metrics = metrics;
        this.sessionsAnalyzed = metrics.counter("typepulse_sessions_analyzed_total");
        this.analysisDuration = metrics.timer("typepulse_analysis_duration_seconds");
    }

    public AnalyticsReport analyze(TypingSession session) {
        List<KeystrokeEvent> events = session.snapshot();
        return compute(events, session.expectedText(), SessionScore.derive(events));
    }

    public AnalyticsReport analyze(TypingSession session, SessionScore score) {
        return compute(session.snapshot(), session.expectedText(), score);
    }

    public CompletableFuture<AnalyticsReport> analyzeAsync(TypingSession session) {
        List<KeystrokeEvent> events = session.snapshot();
        String text = session.expectedText();
        return CompletableFuture.supplyAsync(() -> compute(events, text, SessionScore.derive(events)), executor);
    }

    public CompletableFuture<AnalyticsReport> analyzeAsync(TypingSession session, SessionScore score) {
        List<KeystrokeEvent> events = session.snapshot();
        String text = session.expectedText();
        return CompletableFuture.supplyAsync(() -> compute(events, text, score), executor);
    }

    private AnalyticsReport compute(List<KeystrokeEvent> events, String expectedText, SessionScore score) {
        Timer.Sample sample = Timer.start(metrics);
        AnalyticsReport report;
        try {
            report = assembler.assemble(events, expectedText, score);
        } finally {
            long nanos = sample.stop(analysisDuration);
            log.debug("Analytics pass over {} events took {} us", events.size(), nanos / 1000);
        }
        sessionsAnalyzed.increment();
        antiCheat.record(report.antiCheat());

        log.info("Session analyzed: events={} wpm={} accuracy={} consistency={} score={} flags={}",
                events.size(), report.wpm(), report.accuracy(), report.consistencyRating(),
                report.antiCheat().validationScore(), report.antiCheat().flags());
        return report;
    }
}
