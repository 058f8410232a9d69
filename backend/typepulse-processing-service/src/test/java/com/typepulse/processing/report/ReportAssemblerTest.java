package com.typepulse.processing.report;

import com.typepulse.anomaly.detection.AntiCheatThresholds;
import com.typepulse.anomaly.detection.AntiCheatValidator;
import com.typepulse.anomaly.model.AntiCheatResult;
import com.typepulse.anomaly.model.SuspicionFlag;
import com.typepulse.processing.analytics.ErrorType;
import com.typepulse.processing.recorder.KeystrokeEvent;
import com.typepulse.processing.support.Typist;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private static final String SIXTY_CHARS = "the quick brown fox jumps over the lazy dog as rain fell now";

    private ReportAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ReportAssembler(new AntiCheatValidator(AntiCheatThresholds.defaults()));
    }

    @ParameterizedTest
    @ValueSource(longs = {42L, 7L, 1234L})
    @DisplayName("Should produce a clean full report for a jittered human session")
    void humanSession(long seed) {
        // Given 60 correct keys, press-to-press mean about 150 ms
        List<KeystrokeEvent> events = new Typist(SIXTY_CHARS)
                .typeRestWithJitter(new Random(seed), 70, 40)
                .events();

        // When
        AnalyticsReport report = assembler.assemble(events, SIXTY_CHARS);

        // Then
        assertThat(events).hasSize(60);
        assertThat(report.accuracy()).isEqualTo(100.0);
        assertThat(report.totalErrors()).isZero();
        assertThat(report.errorBurstCount()).isZero();
        assertThat(report.wpm()).isEqualTo(SessionScore.derive(events).wpm()).isBetween(55, 110);
        assertThat(report.consistency()).isBetween(0.0, 100.0);
        assertThat(report.consistencyRating()).isBetween(0, 100);
        assertThat(report.typingRhythm()).isNotNull();
        assertThat(report.wpmByPosition()).hasSize(10);
        assertThat(report.rollingAccuracy()).containsOnly(100);
        assertThat(report.burstWpm()).isNotNull().isLessThanOrEqualTo(300);
        assertThat(report.peakPerformanceWindow()).isNotNull();
        assertThat(report.fastestDigraph()).isNotNull();
        assertThat(report.topDigraphs()).hasSize(5);
        assertThat(report.keyHeatmap()).containsEntry(" ", 12);
        assertThat(report.slowestWords()).isNotNull();
        assertThat(report.errorsByType()).containsEntry(ErrorType.SUBSTITUTION, 0);

        AntiCheatResult antiCheat = report.antiCheat();
        assertThat(antiCheat.suspicious()).isFalse();
        assertThat(antiCheat.syntheticInputDetected()).isFalse();
        assertThat(antiCheat.flags()).isEmpty();
        assertThat(antiCheat.validationScore()).isEqualTo(100);
    }

    @Test
    void shouldFlagScriptedInput() {
        String text = "abcdefghij".repeat(5);
        List<KeystrokeEvent> events = new Typist(text).typeRest(20, 30).events();

        AntiCheatResult antiCheat = assembler.assemble(events, text).antiCheat();

        assertThat(antiCheat.syntheticInputDetected()).isTrue();
        assertThat(antiCheat.suspicious()).isTrue();
        assertThat(antiCheat.flags()).contains(SuspicionFlag.PROGRAMMATIC_PATTERN, SuspicionFlag.PERFECT_RHYTHM);
        assertThat(antiCheat.flags()).doesNotContain(SuspicionFlag.UNIFORM_FLIGHT_TIMES);
    }

    @Test
    void shouldUseHostScoreWhenGiven() {
        List<KeystrokeEvent> events = new Typist("abcdef").typeRest(90, 60).events();

        AnalyticsReport report = assembler.assemble(events, "abcdef", new SessionScore(77, 80, 99.5, 1));

        assertThat(report.wpm()).isEqualTo(77);
        assertThat(report.rawWpm()).isEqualTo(80);
        assertThat(report.accuracy()).isEqualTo(99.5);
        assertThat(report.totalErrors()).isEqualTo(1);
    }

    @Test
    void shouldReturnNeutralReportForEmptySession() {
        AnalyticsReport report = assembler.assemble(List.of(), "abc");

        assertThat(report.wpm()).isNull();
        assertThat(report.accuracy()).isNull();
        assertThat(report.totalErrors()).isZero();
        assertThat(report.consistency()).isNull();
        assertThat(report.fingerUsage()).isNull();
        assertThat(report.burstWpm()).isNull();
        assertThat(report.antiCheat()).isEqualTo(AntiCheatResult.neutral());
    }

    @Test
    void shouldLeaveWindowedMetricsAbsentForShortSessions() {
        List<KeystrokeEvent> events = new Typist("abcd").typeRest(90, 60).events();

        AnalyticsReport report = assembler.assemble(events, "abcd");

        assertThat(report.burstWpm()).isNull();
        assertThat(report.rollingAccuracy()).isNull();
        assertThat(report.wpmByPosition()).isNull();
        assertThat(report.fatigueIndicator()).isNull();
        assertThat(report.adjustedWpm()).isNotNull();
        assertThat(report.antiCheat().validationScore()).isEqualTo(100);
    }

    @Test
    void shouldTolerateEventWithoutKeyGlyph() {
        List<KeystrokeEvent> events = new ArrayList<>(new Typist(SIXTY_CHARS).typeRest(80, 60).events());
        KeystrokeEvent e = events.get(3);
        events.set(3, new KeystrokeEvent(null, e.code(), e.pressTime(), e.releaseTime(), e.dwellTime(),
                e.flightTime(), false, e.expectedKey(), e.position(), e.finger(), e.hand()));

        AnalyticsReport report = assembler.assemble(events, SIXTY_CHARS);

        assertThat(report.totalErrors()).isEqualTo(1);
        assertThat(report.errorsByType()).containsEntry(ErrorType.SUBSTITUTION, 1);
        assertThat(report.keyHeatmap()).doesNotContainKey(null).containsEntry(" ", 11);
    }
}
