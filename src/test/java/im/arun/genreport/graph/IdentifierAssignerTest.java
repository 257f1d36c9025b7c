package im.arun.genreport.graph;

import im.arun.genreport.GedFixtures;
import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLoadException;
import im.arun.genreport.model.BirthDateKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static im.arun.genreport.GedFixtures.ANDERS;
import static im.arun.genreport.GedFixtures.ELNA;
import static im.arun.genreport.GedFixtures.ELSA;
import static im.arun.genreport.GedFixtures.ISLAND;
import static im.arun.genreport.GedFixtures.JOHAN;
import static im.arun.genreport.GedFixtures.KARL;
import static im.arun.genreport.GedFixtures.KERSTIN;
import static im.arun.genreport.GedFixtures.LARS;
import static im.arun.genreport.GedFixtures.MARIA;
import static im.arun.genreport.GedFixtures.NILS;
import static im.arun.genreport.GedFixtures.PER;
import static im.arun.genreport.GedFixtures.PLACEHOLDER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class IdentifierAssignerTest {

    private GedDocument document;
    private IdentifierAssigner assigner;

    @BeforeEach
    void setUp() throws GedLoadException {
        document = GedFixtures.family();
        assigner = new IdentifierAssigner(document);
    }

    @Nested
    @DisplayName("ancestors")
    class Ancestors {

        @Test
        @DisplayName("layers go father before mother, one generation at a time")
        void layers() {
            assertThat(assigner.ancestorLayers(JOHAN)).containsExactly(
                List.of(JOHAN),
                List.of(PER, KERSTIN),
                List.of(ANDERS, ELNA));
        }

        @Test
        void ancestorsAreNumberedFromZero() {
            Map<String, Integer> ids = assigner.assign(JOHAN);

            assertThat(ids).contains(
                entry(JOHAN, 0), entry(PER, 1), entry(KERSTIN, 2), entry(ANDERS, 3), entry(ELNA, 4));
        }

        @Test
        @DisplayName("an ancestor reachable by two paths keeps the first generation")
        void pedigreeCollapse() {
            GedDocument doc = GedFixtures.of(
                "0 @I1@ INDI", "1 FAMC @F1@",
                "0 @I2@ INDI", "1 FAMC @F2@", "1 FAMS @F1@",
                "0 @I3@ INDI", "1 FAMC @F3@", "1 FAMS @F1@",
                "0 @I4@ INDI", "1 FAMS @F2@", "1 FAMS @F3@",
                "0 @I5@ INDI", "1 FAMS @F2@",
                "0 @I6@ INDI", "1 FAMS @F3@",
                "0 @F1@ FAM", "1 HUSB @I2@", "1 WIFE @I3@", "1 CHIL @I1@",
                "0 @F2@ FAM", "1 HUSB @I4@", "1 WIFE @I5@", "1 CHIL @I2@",
                "0 @F3@ FAM", "1 HUSB @I4@", "1 WIFE @I6@", "1 CHIL @I3@");

            assertThat(new IdentifierAssigner(doc).ancestorLayers("@I1@")).containsExactly(
                List.of("@I1@"),
                List.of("@I2@", "@I3@"),
                List.of("@I4@", "@I5@", "@I6@"));
        }

        @Test
        void rootWithoutParents() {
            assertThat(assigner.ancestorLayers(ISLAND)).containsExactly(List.of(ISLAND));
        }
    }

    @Nested
    @DisplayName("relatives")
    class Relatives {

        @Test
        @DisplayName("children of the root come first, oldest first")
        void rootChildrenOldestFirst() {
            Map<String, Integer> ids = assigner.assign(JOHAN);

            assertThat(ids.get(ELSA)).isEqualTo(1000);
            assertThat(ids.get(KARL)).isEqualTo(1001);
        }

        @Test
        @DisplayName("root generation: spouse, then full siblings oldest first")
        void rootGeneration() {
            Map<String, Integer> ids = assigner.assign(JOHAN);

            assertThat(ids).contains(entry(MARIA, 1002), entry(NILS, 1003), entry(LARS, 1004));
        }

        @Test
        void unreachableIndividualsGetNoIdentifier() {
            Map<String, Integer> ids = assigner.assign(JOHAN);

            assertThat(ids).doesNotContainKeys(ISLAND, PLACEHOLDER).hasSize(10);
        }

        @Test
        void mapIsInAssignmentOrder() {
            assertThat(assigner.assign(JOHAN).keySet()).containsExactly(
                JOHAN, PER, KERSTIN, ANDERS, ELNA, ELSA, KARL, MARIA, NILS, LARS);
        }

        @Test
        void deeperGenerationsFollowChildren() {
            Map<String, Integer> ids = new IdentifierAssigner(document).assign(KARL);

            // Karl's ancestors: Karl, Johan, Maria, Per, Kerstin, Anders, Elna
            assertThat(ids).contains(entry(KARL, 0), entry(JOHAN, 1), entry(MARIA, 2), entry(PER, 3),
                entry(KERSTIN, 4), entry(ANDERS, 5), entry(ELNA, 6));
            // Elsa is a full sibling; Nils and Lars are Johan's siblings, oldest first
            assertThat(ids).contains(entry(ELSA, 1000), entry(NILS, 1001), entry(LARS, 1002));
        }
    }

    @Nested
    @DisplayName("invariants")
    class Invariants {

        @Test
        void identifiersAreUnique() {
            Map<String, Integer> ids = assigner.assign(JOHAN);

            assertThat(new HashSet<>(ids.values())).hasSameSizeAs(ids.values());
        }

        @Test
        void deterministic() {
            assertThat(new IdentifierAssigner(document).assign(JOHAN))
                .containsExactlyEntriesOf(new IdentifierAssigner(document).assign(JOHAN));
        }

        @Test
        void ancestorsBelowEveryoneElse() {
            Map<String, Integer> ids = assigner.assign(JOHAN);
            Set<String> ancestors = new HashSet<>();
            assigner.ancestorLayers(JOHAN).forEach(ancestors::addAll);

            int highestAncestor = ids.entrySet().stream()
                .filter(e -> ancestors.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue).max().orElseThrow();
            int lowestOther = ids.entrySet().stream()
                .filter(e -> !ancestors.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue).min().orElseThrow();

            assertThat(highestAncestor).isLessThan(lowestOther);
        }

        @Test
        void relativesOfLoneRootStartAtOneThousand() {
            GedDocument doc = GedFixtures.of(
                "0 @I1@ INDI", "1 FAMS @F1@",
                "0 @I2@ INDI", "1 FAMS @F1@",
                "0 @F1@ FAM", "1 HUSB @I1@", "1 WIFE @I2@");

            assertThat(new IdentifierAssigner(doc).assign("@I1@"))
                .containsExactly(entry("@I1@", 0), entry("@I2@", 1000));
        }
    }

    @Nested
    @DisplayName("exception band")
    class ExceptionBand {

        @Test
        void listedIndividualsGetFixedRange() {
            GenReportConfig.ExceptionBand band = new GenReportConfig.ExceptionBand();
            band.setXrefs(List.of(ISLAND, KARL, "@I404@", PLACEHOLDER));

            Map<String, Integer> ids = new IdentifierAssigner(document, band).assign(JOHAN);

            assertThat(ids).contains(entry(ISLAND, 9001), entry(KARL, 1001), entry(PLACEHOLDER, 9002));
            assertThat(ids).doesNotContainKey("@I404@");
        }

        @Test
        void skipsIdentifiersInUse() {
            GenReportConfig.ExceptionBand band = new GenReportConfig.ExceptionBand();
            band.setStart(1003);
            band.setXrefs(List.of(ISLAND));

            assertThat(new IdentifierAssigner(document, band).assign(JOHAN)).contains(entry(ISLAND, 1005));
        }
    }

    @Nested
    @DisplayName("birth key")
    class BirthKey {

        @Test
        void parsesYearMonthDay() {
            assertThat(IdentifierAssigner.parseBirthKey("1885-03-12")).isEqualTo(new BirthDateKey(1885, 3, 12));
            assertThat(IdentifierAssigner.parseBirthKey("1885/3/2")).isEqualTo(new BirthDateKey(1885, 3, 2));
        }

        @Test
        void missingPartsSortLast() {
            assertThat(assigner.birthKey(JOHAN)).isEqualTo(new BirthDateKey(1885, 9999, 9999));
            assertThat(assigner.birthKey(ANDERS)).isEqualTo(BirthDateKey.MISSING);
            assertThat(IdentifierAssigner.parseBirthKey("okänt")).isEqualTo(BirthDateKey.MISSING);
            assertThat(new BirthDateKey(1885, 3, 12)).isLessThan(new BirthDateKey(1885, 9999, 9999));
        }
    }
}
