package im.arun.genreport.report;

import im.arun.genreport.GedFixtures;
import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.extract.IndividualExtractor;
import im.arun.genreport.extract.StandardValueNormalizer;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLoadException;
import im.arun.genreport.graph.IdentifierAssigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static im.arun.genreport.GedFixtures.JOHAN;
import static org.assertj.core.api.Assertions.assertThat;

class MainExportWriterTest {

    @TempDir
    Path outdir;

    private GedDocument document;
    private MainExportWriter writer;
    private Map<String, Integer> identifiers;

    @BeforeEach
    void setUp() throws GedLoadException {
        document = GedFixtures.family();
        GenReportConfig config = new GenReportConfig();
        writer = new MainExportWriter(document,
            new IndividualExtractor(document, new StandardValueNormalizer(config.getPlaces())), config);
        identifiers = new IdentifierAssigner(document).assign(JOHAN);
    }

    @Nested
    @DisplayName("report content")
    class Content {

        @Test
        void writesEveryIndividual() throws IOException {
            Path out = outdir.resolve("persongalleri.md");

            int count = writer.write(out, identifiers);

            String text = Files.readString(out, StandardCharsets.UTF_8);
            assertThat(count).isEqualTo(12);
            assertThat(text).startsWith("# Persongalleri\n\n");
            assertThat(text).contains("## , 99\n");
            assertThat(text).contains("## Okänd Person , 11\n");
        }

        @Test
        void sectionOfRoot() throws IOException {
            Path out = outdir.resolve("persongalleri.md");
            writer.write(out, identifiers);

            String text = Files.readString(out, StandardCharsets.UTF_8);

            assertThat(text).contains(String.join("\n",
                "## [0] Johan Andersson 1885-1950, 1",
                "Född: 1885-03-12 i Vånga socken, Skåne",
                "Död: 1950-01-03 i Kristianstad",
                "Syssla: Lantbrukare",
                "INDI.NOTE,individual note,Flyttade till gården 1910. Sålde den 1945.",
                "Far: Per Andersson 1850-, 2",
                "Mor: Kerstin Nilsdotter 1855-, 3",
                "Gift: Maria Svensson 1890-, 6",
                "Barn: Karl Andersson 1920-, 7",
                "Barn: Elsa Andersson 1915-, 8",
                "",
                ""));
        }

        @Test
        void skipsEmailMediaAndExcludedFields() throws IOException {
            Path out = outdir.resolve("persongalleri.md");
            writer.write(out, identifiers);

            String text = Files.readString(out, StandardCharsets.UTF_8);

            assertThat(text)
                .doesNotContain("johan@example.com")
                .doesNotContain("myheritage")
                .doesNotContain("Principal")
                .doesNotContain("unassociated.jpg")
                .doesNotContain("@S1@");
        }

        @Test
        void relationLinesGetTheSameEmailGuard() throws IOException {
            GedDocument doc = GedFixtures.of(
                "0 @I1@ INDI",
                "1 NAME Adam /Ek/",
                "1 SEX M",
                "1 FAMS @F1@",
                "0 @I2@ INDI",
                "1 NAME Eva /Berg@old/",
                "1 SEX F",
                "1 BIRT",
                "2 DATE 1900",
                "1 FAMS @F1@",
                "0 @I3@ INDI",
                "1 NAME Per /Ek/",
                "1 FAMC @F1@",
                "0 @F1@ FAM",
                "1 HUSB @I1@",
                "1 WIFE @I2@",
                "1 CHIL @I3@");
            GenReportConfig config = new GenReportConfig();
            MainExportWriter small = new MainExportWriter(doc, new IndividualExtractor(doc), config);
            Path out = outdir.resolve("small.md");

            small.write(out, new IdentifierAssigner(doc).assign("@I1@"));

            assertThat(Files.readString(out, StandardCharsets.UTF_8))
                .contains("## [1001] Eva Berg@old 1900-, 2\n")
                .contains("Barn: Per Ek , 3\n")
                .contains("Far: Adam Ek , 1\n")
                .doesNotContain("Gift: Eva")
                .doesNotContain("Mor: Eva");
        }

        @Test
        void multiLineValuesAreFlattened() throws IOException {
            Path out = outdir.resolve("persongalleri.md");
            writer.write(out, identifiers);

            assertThat(Files.readString(out, StandardCharsets.UTF_8))
                .contains("INDI.NOTE,individual note,Emigrerade till Amerika / 1910 & kom aldrig tillbaka\n");
        }
    }

    @Nested
    @DisplayName("line helpers")
    class Helpers {

        @Test
        void eventLineOmitsMissingParts() {
            assertThat(writer.formatEventLine("Född:", "1850", "", "")).isEqualTo("Född: 1850");
            assertThat(writer.formatEventLine("Död:", "", "Lund", "drunknade")).isEqualTo("Död: i Lund, Not: drunknade");
            assertThat(writer.formatEventLine("Född:", "", "", "")).isNull();
        }

        @Test
        void flatten() {
            assertThat(MainExportWriter.flatten(" a \n  b\nc ")).isEqualTo("a / b / c");
            assertThat(MainExportWriter.flatten(null)).isEmpty();
        }

        @Test
        void emailAndMediaDetection() {
            assertThat(MainExportWriter.isEmailLike("_EMAIL", "", "x")).isTrue();
            assertThat(MainExportWriter.isEmailLike("RESI.ADDR", "residence address", "a@b.se")).isTrue();
            assertThat(MainExportWriter.isEmailLike("OCCU", "occupation", "Bonde")).isFalse();
            assertThat(MainExportWriter.isMediaLike("OBJE.FILE", "")).isTrue();
            assertThat(MainExportWriter.isMediaLike("_PHOTO", "bild")).isTrue();
            assertThat(MainExportWriter.isMediaLike("OCCU", "occupation")).isFalse();
        }
    }

    @Test
    void uniqueOutputNames() throws IOException {
        Path first = ReportFiles.uniquePath(outdir, ReportType.MAINEXPORT);
        Files.writeString(first, "x");
        Path second = ReportFiles.uniquePath(outdir, ReportType.MAINEXPORT);
        Files.writeString(second, "x");
        Path third = ReportFiles.uniquePath(outdir, ReportType.MAINEXPORT);

        assertThat(first.getFileName()).hasToString("persongalleri.md");
        assertThat(second.getFileName()).hasToString("persongalleri-2.md");
        assertThat(third.getFileName()).hasToString("persongalleri-3.md");
    }

    @Test
    void reportTypeByName() {
        assertThat(ReportType.fromName("JSON")).isEqualTo(ReportType.JSON);
        assertThat(ReportType.fromName("mainexport")).isEqualTo(ReportType.MAINEXPORT);
        assertThat(ReportType.fromName("pdf")).isEqualTo(ReportType.MAINEXPORT);
    }
}
