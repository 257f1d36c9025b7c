package im.arun.genreport.ged;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GedLineTest {

    @Nested
    @DisplayName("levelOf")
    class LevelOf {

        @Test
        void readsLeadingInteger() {
            assertThat(GedLine.levelOf("0 HEAD")).isEqualTo(0);
            assertThat(GedLine.levelOf("  2 DATE 1850")).isEqualTo(2);
            assertThat(GedLine.levelOf("12 _X value")).isEqualTo(12);
        }

        @Test
        void nonStructuralLinesHaveNoLevel() {
            assertThat(GedLine.levelOf("HEAD")).isNull();
            assertThat(GedLine.levelOf("1")).isNull();
            assertThat(GedLine.levelOf("")).isNull();
            assertThat(GedLine.levelOf(null)).isNull();
            assertThat(GedLine.levelOrZero("continued text")).isZero();
        }
    }

    @Nested
    @DisplayName("tagAndValue")
    class TagAndValue {

        @Test
        void splitsTagFromValue() {
            GedLine.TagValue tv = GedLine.tagAndValue("1 NAME Anna /Karlsson/");

            assertThat(tv.tag()).isEqualTo("NAME");
            assertThat(tv.value()).isEqualTo("Anna /Karlsson/");
        }

        @Test
        void skipsXrefToken() {
            assertThat(GedLine.tagAndValue("0 @I1@ INDI")).isEqualTo(new GedLine.TagValue("INDI", ""));
            assertThat(GedLine.tagAndValue("0 @N1@ NOTE Some text"))
                .isEqualTo(new GedLine.TagValue("NOTE", "Some text"));
        }

        @Test
        void tagWithoutValue() {
            assertThat(GedLine.tagAndValue("1 BIRT")).isEqualTo(new GedLine.TagValue("BIRT", ""));
        }

        @Test
        void lineWithoutTagIsEmpty() {
            assertThat(GedLine.tagAndValue("garbage")).isEqualTo(GedLine.TagValue.EMPTY);
            assertThat(GedLine.tagAndValue(null)).isEqualTo(GedLine.TagValue.EMPTY);
        }
    }

    @Nested
    @DisplayName("continuations")
    class Continuations {

        @Test
        @DisplayName("CONC lines reassemble the exact unsplit value")
        void concatenationRoundTrip() {
            List<String> lines = List.of(
                "1 NOTE The qui",
                "2 CONC ck brown f",
                "2 CONC ox",
                "1 SEX M");

            GedLine.Continuation value = GedLine.valueWithContinuation(lines, 0);

            assertThat(value.text()).isEqualTo("The quick brown fox");
            assertThat(value.nextIndex()).isEqualTo(3);
        }

        @Test
        @DisplayName("CONT lines insert a line break at each continuation point")
        void newlineContinuation() {
            List<String> lines = List.of(
                "1 NOTE First",
                "2 CONT Second",
                "2 CONC  half",
                "2 CONT Third");

            assertThat(GedLine.valueWithContinuation(lines, 0).text())
                .isEqualTo("First\nSecond half\nThird");
        }

        @Test
        void stopsAtSiblingOrOtherTag() {
            List<String> lines = List.of(
                "1 BIRT",
                "2 DATE 1850",
                "2 CONC ignored");

            GedLine.Continuation none = GedLine.collectContinuation(lines, 0, 1);

            assertThat(none.text()).isEmpty();
            assertThat(none.nextIndex()).isEqualTo(1);
        }

        @Test
        void stopsAtLineWithoutLevel() {
            List<String> lines = List.of("1 NOTE a", "b", "2 CONC c");

            assertThat(GedLine.valueWithContinuation(lines, 0).text()).isEqualTo("a");
        }
    }

    @Test
    void idNumberOfXref() {
        assertThat(GedLine.idNumber("@I123@")).isEqualTo("123");
        assertThat(GedLine.idNumber("@P45X@")).isEqualTo("45");
        assertThat(GedLine.idNumber("@ABC@")).isEqualTo("ABC");
    }

    @Test
    void xrefTokens() {
        assertThat(GedLine.isXref("@I1@")).isTrue();
        assertThat(GedLine.isXref("I1")).isFalse();
        assertThat(GedLine.isXref("@")).isFalse();
    }
}
