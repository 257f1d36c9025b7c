package im.arun.genreport.cli;

import im.arun.genreport.config.ConfigLoader;
import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLoadException;
import im.arun.genreport.report.ReportType;
import im.arun.genreport.service.ConnectivityReport;
import im.arun.genreport.service.ExportResult;
import im.arun.genreport.service.GenReportService;
import im.arun.genreport.service.RootResolutionException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for GenReport using Picocli.
 */
@Command(
    name = "genreport",
    description = "Generate person reports with generation-based numbering from GEDCOM files",
    mixinStandardHelpOptions = true,
    version = "GenReport 1.0"
)
public class GenReportCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_ISLANDS = 2;

    @Option(names = {"--input"}, description = "Path to GED file", required = true)
    private String input;

    @Option(names = {"--report"}, description = "Report type: mainexport or json", defaultValue = "mainexport")
    private String report;

    @Option(names = {"--outdir"}, description = "Directory where the report is written", defaultValue = ".")
    private String outdir;

    @Option(names = {"--root"}, description = "Root individual (@I123@ or 123), numbered 0")
    private String root;

    @Option(names = {"--allow-islands"}, description = "Continue even if individuals are not linked to the root")
    private boolean allowIslands;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path inputPath = Paths.get(input);
        if (!Files.exists(inputPath)) {
            err.println("Error: Input GED not found: " + input);
            return EXIT_ERROR;
        }

        GenReportConfig config = new ConfigLoader(configPath).load();
        GenReportService service = new GenReportService(config);

        try {
            GedDocument document = service.load(inputPath);
            String rootXref = service.resolveRoot(document, root);

            ConnectivityReport connectivity = service.checkConnectivity(document, rootXref);
            if (!connectivity.isConnected()) {
                err.println(connectivity.message(allowIslands));
                if (!allowIslands) {
                    return EXIT_ISLANDS;
                }
            }

            Map<String, Integer> identifiers = service.assignIdentifiers(document, rootXref);
            ExportResult result = service.writeReport(document, ReportType.fromName(report),
                Paths.get(outdir), rootXref, identifiers);

            out.println("Exported " + result.count() + " individuals to " + result.path());
            out.flush();
            return EXIT_OK;
        } catch (GedLoadException | RootResolutionException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("Error writing report: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            err.flush();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenReportCLI()).execute(args);
        System.exit(exitCode);
    }
}
