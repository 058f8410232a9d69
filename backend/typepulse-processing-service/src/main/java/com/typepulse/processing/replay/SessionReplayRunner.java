package com.typepulse.processing.replay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typepulse.processing.recorder.TypingSession;
import com.typepulse.processing.report.AnalyticsReport;
import com.typepulse.processing.report.SessionScore;
import com.typepulse.processing.service.KeystrokeAnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays a captured session file through a {@link TypingSession} and logs the report.
 * Only active when {@code typepulse.replay.file} is set.
 */
@Component
@ConditionalOnProperty(name = "typepulse.replay.file")
public class SessionReplayRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SessionReplayRunner.class);

    private final KeystrokeAnalyticsService analytics;
    private final ObjectMapper objectMapper;
    private final Path file;

    public SessionReplayRunner(KeystrokeAnalyticsService analytics,
                               ObjectMapper objectMapper,
                               @Value("${typepulse.replay.file}") String file) {
        this.analytics = analytics;
        this.objectMapper = objectMapper;
        this.file = Path.of(file);
    }

    @Override
    public void run(String... args) {
        AnalyticsReport report = replay(file);
        try {
            log.info("Replay report for {}:\n{}", file,
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render replay report: " + file, e);
        }
    }

    public AnalyticsReport replay(Path path) {
        CapturedSession captured;
        try (InputStream in = Files.newInputStream(path)) {
            captured = objectMapper.readValue(in, CapturedSession.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to replay session: " + path, e);
        }

        TypingSession session = toSession(captured);
        log.info("Replayed {} captured events into {} keystrokes",
                captured.events() == null ? 0 : captured.events().size(), session.events().size());

        if (captured.wpm() == null) {
            return analytics.analyze(session);
        }
        SessionScore derived = SessionScore.derive(session.snapshot());
        SessionScore score = new SessionScore(
                captured.wpm(),
                captured.rawWpm() != null ? captured.rawWpm() : derived.rawWpm(),
                captured.accuracy() != null ? captured.accuracy() : derived.accuracy(),
                captured.totalErrors() != null ? captured.totalErrors() : derived.totalErrors());
        return analytics.analyze(session, score);
    }

    static TypingSession toSession(CapturedSession captured) {
        TypingSession session = new TypingSession(captured.expectedText() == null ? "" : captured.expectedText());
        List<CapturedKeyEvent> events = captured.events() == null ? List.of() : captured.events();
        for (CapturedKeyEvent e : events) {
            if (e.type() == null) continue;
            switch (e.type()) {
                case "down" -> session.onKeyDown(e.key(), e.code(), e.timestamp());
                case "up" -> {
                    boolean correct = Boolean.TRUE.equals(e.correct());
                    if (e.position() != null) {
                        session.onKeyUp(e.key(), e.code(), e.timestamp(), correct, e.expected(), e.position());
                    } else if (e.expected() != null) {
                        session.onKeyUp(e.key(), e.code(), e.timestamp(), correct, e.expected(), session.cursorPosition());
                    } else {
                        session.onKeyUp(e.key(), e.code(), e.timestamp(), correct);
                    }
                }
                case "cursor" -> {
                    if (e.position() != null) session.setCursorPosition(e.position());
                }
                default -> log.debug("Skipping captured event of unknown type '{}'", e.type());
            }
        }
        return session;
    }
}
