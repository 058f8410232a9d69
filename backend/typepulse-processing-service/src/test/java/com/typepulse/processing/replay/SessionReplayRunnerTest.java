package com.typepulse.processing.replay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typepulse.processing.recorder.KeystrokeEvent;
import com.typepulse.processing.recorder.TypingSession;
import com.typepulse.processing.report.AnalyticsReport;
import com.typepulse.processing.support.Services;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionReplayRunnerTest {

    private ExecutorService executor;
    private SessionReplayRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        executor = Executors.newSingleThreadExecutor();
        runner = new SessionReplayRunner(
                Services.analytics(executor, new SimpleMeterRegistry()),
                new ObjectMapper(),
                fixture().toString());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Path fixture() throws Exception {
        return Path.of(SessionReplayRunnerTest.class.getResource("/replay/captured-session.json").toURI());
    }

    @Test
    void shouldReplayCapturedFileWithHostScore() throws Exception {
        AnalyticsReport report = runner.replay(fixture());

        assertThat(report.wpm()).isEqualTo(40);
        assertThat(report.accuracy()).isEqualTo(83.33);
        // derived from the events: 7 keys over 980 ms, one wrong
        assertThat(report.rawWpm()).isEqualTo(86);
        assertThat(report.totalErrors()).isEqualTo(1);
        assertThat(report.errorKeys()).containsExactly("y");
        assertThat(report.keyHeatmap()).containsEntry("T", 1).containsEntry(" ", 1);
    }

    @Test
    void shouldRunWithoutFailingOnValidFile() {
        runner.run();
    }

    @Test
    void shouldWrapUnreadableFile() {
        Path missing = Path.of("does-not-exist.json");

        assertThatThrownBy(() -> runner.replay(missing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to replay session: " + missing);
    }

    @Test
    void shouldApplyCursorAndExplicitPositions() {
        CapturedSession captured = new CapturedSession("ab", null, null, null, null, List.of(
                new CapturedKeyEvent("down", "a", null, 100, null, null, null),
                new CapturedKeyEvent("up", "a", null, 160, true, null, null),
                new CapturedKeyEvent("cursor", null, null, 0, null, null, 1),
                new CapturedKeyEvent("down", "x", null, 250, null, null, null),
                new CapturedKeyEvent("up", "x", null, 300, false, null, null),
                new CapturedKeyEvent("down", "b", null, 380, null, null, null),
                new CapturedKeyEvent("up", "b", null, 440, true, "b", null),
                new CapturedKeyEvent(null, "z", null, 500, null, null, null)));

        TypingSession session = SessionReplayRunner.toSession(captured);

        assertThat(session.events()).extracting(KeystrokeEvent::expectedKey).containsExactly("a", "b", "b");
        assertThat(session.events()).extracting(KeystrokeEvent::position).containsExactly(0, 1, 1);
        assertThat(session.events().get(1).flightTime()).isEqualTo(90L);
    }
}
