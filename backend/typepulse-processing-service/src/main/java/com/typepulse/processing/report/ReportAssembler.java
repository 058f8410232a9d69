package com.typepulse.processing.report;

import com.typepulse.anomaly.detection.AntiCheatValidator;
import com.typepulse.anomaly.model.AntiCheatResult;
import com.typepulse.anomaly.model.KeystrokeTimings;
import com.typepulse.processing.analytics.DigraphProfile;
import com.typepulse.processing.analytics.DigraphProfiler;
import com.typepulse.processing.analytics.ErrorClassifier;
import com.typepulse.processing.analytics.ErrorProfile;
import com.typepulse.processing.analytics.KeyUsageProfile;
import com.typepulse.processing.analytics.KeyUsageProfiler;
import com.typepulse.processing.analytics.TimingAnalyzer;
import com.typepulse.processing.analytics.TimingProfile;
import com.typepulse.processing.analytics.WindowedMetrics;
import com.typepulse.processing.analytics.WindowedProfile;
import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.List;
import java.util.Objects;

/**
 * Runs every analysis pass over a closed event log and combines the results. Side-effect
 * free: the same log always yields the same report, so it can run on any thread.
 */
public class ReportAssembler {

    private final AntiCheatValidator antiCheat;

    public ReportAssembler(AntiCheatValidator antiCheat) {
        this.antiCheat = Objects.requireNonNull(antiCheat, "antiCheat");
    }

    public AnalyticsReport assemble(List<KeystrokeEvent> events, String expectedText) {
        return assemble(events, expectedText, SessionScore.derive(events));
    }

    public AnalyticsReport assemble(List<KeystrokeEvent> events, String expectedText, SessionScore score) {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(score, "score");

        if (events.isEmpty()) {
            return new AnalyticsReport(score.wpm(), score.rawWpm(), score.accuracy(),
                    null, null, null, null, null, null, null, null, null, null, null,
                    score.totalErrors(), null, null, null, null, null, null, null, null, null, null, null, null,
                    AntiCheatResult.neutral());
        }

        TimingProfile timing = TimingAnalyzer.analyze(events);
        WindowedProfile windowed = WindowedMetrics.analyze(events, score.wpm());
        DigraphProfile digraphs = DigraphProfiler.profile(events);
        ErrorProfile errors = ErrorClassifier.classify(events, expectedText);
        KeyUsageProfile usage = KeyUsageProfiler.profile(events);
        AntiCheatResult verdict = antiCheat.validate(timingsOf(events), score.wpm() != null ? score.wpm() : 0);

        return new AnalyticsReport(
                score.wpm(),
                score.rawWpm(),
                score.accuracy(),
                timing.consistency(),
                timing.consistencyRating(),
                timing.avgDwellTime(),
                timing.avgFlightTime(),
                timing.stdDevFlightTime(),
                digraphs.fastest(),
                digraphs.slowest(),
                digraphs.top(),
                digraphs.bottom(),
                usage.fingerUsage(),
                usage.handBalance(),
                score.totalErrors(),
                errors.errorsByType(),
                errors.errorKeys(),
                windowed.wpmByPosition(),
                errors.slowestWords(),
                usage.keyHeatmap(),
                windowed.burstWpm(),
                windowed.adjustedWpm(),
                windowed.rollingAccuracy(),
                timing.typingRhythm(),
                windowed.peakPerformanceWindow(),
                windowed.fatigueIndicator(),
                errors.errorBurstCount(),
                verdict);
    }

    public static KeystrokeTimings timingsOf(List<KeystrokeEvent> events) {
        return new KeystrokeTimings(
                events.stream().map(KeystrokeEvent::pressTime).toList(),
                TimingAnalyzer.flightTimes(events));
    }
}
