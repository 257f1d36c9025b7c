package im.arun.genreport.graph;

import im.arun.genreport.GedFixtures;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static im.arun.genreport.GedFixtures.ISLAND;
import static im.arun.genreport.GedFixtures.JOHAN;
import static im.arun.genreport.GedFixtures.KARL;
import static im.arun.genreport.GedFixtures.PLACEHOLDER;
import static org.assertj.core.api.Assertions.assertThat;

class ConnectivityCheckerTest {

    private GedDocument document;
    private ConnectivityChecker checker;

    @BeforeEach
    void setUp() throws GedLoadException {
        document = GedFixtures.family();
        checker = new ConnectivityChecker(document);
    }

    @Test
    @DisplayName("media-only placeholder is never reported even though unreachable")
    void placeholderIsExcluded() {
        Set<String> disconnected = checker.findDisconnected(JOHAN);

        assertThat(disconnected).containsExactly(ISLAND);
        assertThat(checker.isMediaPlaceholder(PLACEHOLDER)).isTrue();
    }

    @Test
    void reachableFromAnyFamilyMember() {
        assertThat(checker.findDisconnected(KARL)).containsExactly(ISLAND);
    }

    @Test
    void isolatedRootReportsEveryoneElseInDocumentOrder() {
        assertThat(checker.findDisconnected(ISLAND)).containsExactly(
            "@I1@", "@I2@", "@I3@", "@I4@", "@I5@", "@I6@", "@I7@", "@I8@", "@I9@", "@I10@");
    }

    @Test
    void placeholderRootReportsAllCandidates() {
        assertThat(checker.findDisconnected(PLACEHOLDER)).hasSize(11).doesNotContain(PLACEHOLDER);
    }

    @Test
    void namedOrLinkedRecordsAreNotPlaceholders() {
        GedDocument doc = GedFixtures.of(
            "0 @I1@ INDI",
            "1 NAME Anna /Berg/",
            "1 OBJE",
            "0 @I2@ INDI",
            "1 FAMS @F1@",
            "1 OBJE",
            "0 @I3@ INDI",
            "1 NAME",
            "1 OBJE",
            "0 @I4@ INDI",
            "1 NOTE no media");
        ConnectivityChecker c = new ConnectivityChecker(doc);

        assertThat(c.isMediaPlaceholder("@I1@")).isFalse();
        assertThat(c.isMediaPlaceholder("@I2@")).isFalse();
        assertThat(c.isMediaPlaceholder("@I3@")).isTrue();
        assertThat(c.isMediaPlaceholder("@I4@")).isFalse();
        assertThat(c.isMediaPlaceholder("@I404@")).isFalse();
    }

    @Test
    void spousesWithoutChildrenAreConnected() {
        GedDocument doc = GedFixtures.of(
            "0 @I1@ INDI",
            "1 NAME A /A/",
            "0 @I2@ INDI",
            "1 NAME B /B/",
            "0 @F1@ FAM",
            "1 HUSB @I1@",
            "1 WIFE @I2@");

        assertThat(new ConnectivityChecker(doc).findDisconnected("@I2@")).isEmpty();
    }
}
