package com.typepulse.processing.analytics;

import com.typepulse.processing.recorder.KeystrokeEvent;
import com.typepulse.processing.recorder.TypingSession;
import com.typepulse.processing.support.Typist;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private static final String TEXT = "the quick brown fox jumps";

    @Nested
    @DisplayName("Error bursts")
    class Bursts {

        @Test
        @DisplayName("Should count one run of five consecutive errors once")
        void singleRun() {
            List<KeystrokeEvent> events = new Typist(TEXT)
                    .correct(5, 90, 60)
                    .wrong(5, 90, 60)
                    .typeRest(90, 60)
                    .events();

            ErrorProfile profile = ErrorClassifier.classify(events, TEXT);

            assertThat(profile.errorCount()).isEqualTo(5);
            assertThat(profile.errorBurstCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should count runs separated by correct keys separately")
        void twoRuns() {
            List<KeystrokeEvent> events = new Typist(TEXT)
                    .wrong(2, 90, 60)
                    .correct(3, 90, 60)
                    .wrong(3, 90, 60)
                    .typeRest(90, 60)
                    .events();

            ErrorProfile profile = ErrorClassifier.classify(events, TEXT);

            assertThat(profile.errorCount()).isEqualTo(5);
            assertThat(profile.errorBurstCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should be absent below three events")
        void tooShort() {
            assertThat(ErrorClassifier.errorBurstCount(new Typist("ab").wrong(2, 90, 60).events())).isNull();
            assertThat(ErrorClassifier.errorBurstCount(new Typist("abc").typeRest(90, 60).events())).isZero();
        }
    }

    @Test
    void shouldClassifyErrorTypesAndCollectExpectedKeys() {
        TypingSession session = new TypingSession("abc");
        session.onKeyDown("x", null, 1_000);
        session.onKeyUp("x", null, 1_050, false, "a", 0);
        session.onKeyDown("b", null, 1_100);
        session.onKeyUp("b", null, 1_150, false, "b", 1);
        session.onKeyDown("z", null, 1_200);
        session.onKeyUp("z", null, 1_250, false, null, 2);
        session.onKeyDown("c", null, 1_300);
        session.onKeyUp("c", null, 1_350, true, "c", 2);

        ErrorProfile profile = ErrorClassifier.classify(session.events(), "abc");

        assertThat(profile.errorCount()).isEqualTo(3);
        assertThat(profile.errorsByType())
                .containsEntry(ErrorType.SUBSTITUTION, 1)
                .containsEntry(ErrorType.DOUBLET, 1)
                .containsEntry(ErrorType.OTHER, 1);
        assertThat(profile.errorKeys()).containsExactly("a", "b");
    }

    @Test
    void shouldReportZeroCountsForEveryTypeWhenClean() {
        ErrorProfile profile = ErrorClassifier.classify(new Typist("abc").typeRest(90, 60).events(), "abc");

        assertThat(profile.errorsByType()).containsOnlyKeys(ErrorType.values()).doesNotContainValue(1);
        assertThat(profile.errorKeys()).isEmpty();
    }

    @Nested
    @DisplayName("Slowest words")
    class SlowestWords {

        @Test
        @DisplayName("Should list words taking over 1.3x the mean word time")
        void slowWord() {
            // "brown" spans positions 10..14 and is typed with 400 ms flights
            Typist typist = new Typist(TEXT).correct(11, 50, 50).correct(4, 400, 50);
            List<KeystrokeEvent> events = typist.typeRest(50, 50).events();

            assertThat(ErrorClassifier.slowestWords(events, TEXT)).containsExactly("brown");
        }

        @Test
        @DisplayName("Should return an empty list when no word is slow")
        void noneSlow() {
            List<KeystrokeEvent> events = new Typist(TEXT).typeRest(50, 50).events();

            assertThat(ErrorClassifier.slowestWords(events, TEXT)).isEmpty();
        }

        @Test
        @DisplayName("Should be absent for single-word texts and short logs")
        void absent() {
            assertThat(ErrorClassifier.slowestWords(new Typist("keyboards").typeRest(50, 50).events(), "keyboards"))
                    .isNull();
            assertThat(ErrorClassifier.slowestWords(new Typist(TEXT).correct(4, 50, 50).events(), TEXT)).isNull();
        }

        @Test
        @DisplayName("Should be absent when fewer than three words resolve")
        void tooFewResolvable() {
            // only "the" and "quick" have two or more keys
            List<KeystrokeEvent> events = new Typist(TEXT).correct(9, 50, 50).events();

            assertThat(ErrorClassifier.slowestWords(events, TEXT)).isNull();
        }
    }
}
