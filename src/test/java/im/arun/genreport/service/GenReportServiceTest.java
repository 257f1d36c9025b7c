package im.arun.genreport.service;

import im.arun.genreport.GedFixtures;
import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLoadException;
import im.arun.genreport.report.ReportType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static im.arun.genreport.GedFixtures.ISLAND;
import static im.arun.genreport.GedFixtures.JOHAN;
import static im.arun.genreport.GedFixtures.NILS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenReportServiceTest {

    private GenReportService service;
    private GedDocument document;

    @BeforeEach
    void setUp() throws GedLoadException {
        service = new GenReportService(new GenReportConfig());
        document = service.load(GedFixtures.familyPath());
    }

    @Nested
    @DisplayName("resolveRoot")
    class ResolveRoot {

        @Test
        void xrefOrNumber() {
            assertThat(service.resolveRoot(document, "@I9@")).isEqualTo(NILS);
            assertThat(service.resolveRoot(document, "9")).isEqualTo(NILS);
        }

        @Test
        void defaultsToLowestNumber() {
            assertThat(service.resolveRoot(document, null)).isEqualTo(JOHAN);
            assertThat(service.resolveRoot(document, " ")).isEqualTo(JOHAN);
        }

        @Test
        void unknownRootEchoesInput() {
            assertThatThrownBy(() -> service.resolveRoot(document, "@I404@"))
                .isInstanceOf(RootResolutionException.class)
                .hasMessage("Root '@I404@' not found in GED.");
            assertThatThrownBy(() -> service.resolveRoot(document, "404"))
                .hasMessage("Root '404' not found in GED.");
        }

        @Test
        void documentWithoutIndividuals() {
            GedDocument empty = GedFixtures.of("0 HEAD", "0 TRLR");

            assertThatThrownBy(() -> service.resolveRoot(empty, null))
                .isInstanceOf(RootResolutionException.class)
                .hasMessage("No individuals found in GED.");
        }
    }

    @Nested
    @DisplayName("checkConnectivity")
    class Connectivity {

        @Test
        void reportsIslandWithHeader() {
            ConnectivityReport report = service.checkConnectivity(document, JOHAN);

            assertThat(report.isConnected()).isFalse();
            assertThat(report.disconnected()).containsExactly(ISLAND);
            assertThat(report.preview()).containsExactly("Okänd Person , 11  (@I11@)");
            assertThat(report.message(false)).isEqualTo(String.join("\n",
                "Connectivity check failed: Found 1 disconnected individual(s) not linked to the chosen root.",
                "Examples:",
                "  - Okänd Person , 11  (@I11@)",
                "Tip: verify --root, fix family links, or re-run with --allow-islands to proceed anyway."));
        }

        @Test
        void warningWordingWhenProceeding() {
            assertThat(service.checkConnectivity(document, JOHAN).message(true))
                .startsWith("Connectivity check warning: Found 1");
        }

        @Test
        void previewIsLimited() {
            GenReportConfig config = new GenReportConfig();
            config.setIslandPreviewLimit(3);

            ConnectivityReport report = new GenReportService(config).checkConnectivity(document, ISLAND);

            assertThat(report.disconnected()).hasSize(10);
            assertThat(report.preview()).hasSize(3);
            assertThat(report.remaining()).isEqualTo(7);
            assertThat(report.message(false)).contains("  ... and 7 more\n");
        }

        @Test
        void connectedDocument() {
            GedDocument doc = GedFixtures.of("0 @I1@ INDI", "1 NAME Anna /Berg/");

            assertThat(service.checkConnectivity(doc, "@I1@").isConnected()).isTrue();
        }
    }

    @Nested
    @DisplayName("writeReport")
    class WriteReport {

        @TempDir
        Path outdir;

        @Test
        void markdownThenSuffixedSecondRun() throws IOException {
            Map<String, Integer> ids = service.assignIdentifiers(document, JOHAN);

            ExportResult first = service.writeReport(document, ReportType.MAINEXPORT, outdir, JOHAN, ids);
            ExportResult second = service.writeReport(document, ReportType.MAINEXPORT, outdir, JOHAN, ids);

            assertThat(first.count()).isEqualTo(12);
            assertThat(first.path().getFileName()).hasToString("persongalleri.md");
            assertThat(second.path().getFileName()).hasToString("persongalleri-2.md");
            assertThat(Files.readString(first.path())).isEqualTo(Files.readString(second.path()));
        }

        @Test
        void json() throws IOException {
            ExportResult result = service.writeReport(document, ReportType.JSON, outdir.resolve("nested"), JOHAN,
                service.assignIdentifiers(document, JOHAN));

            assertThat(result.path()).exists().hasFileName("genreport.json");
        }

        @Test
        void exceptionBandFromConfig() {
            GenReportConfig config = new GenReportConfig();
            config.getExceptionBand().setXrefs(new ArrayList<>(List.of(ISLAND)));

            Map<String, Integer> ids = new GenReportService(config).assignIdentifiers(document, JOHAN);

            assertThat(ids).containsEntry(ISLAND, 9001);
        }
    }
}
