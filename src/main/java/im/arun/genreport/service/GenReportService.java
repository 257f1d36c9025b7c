package im.arun.genreport.service;

import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.extract.IndividualExtractor;
import im.arun.genreport.extract.StandardValueNormalizer;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLine;
import im.arun.genreport.ged.GedLoadException;
import im.arun.genreport.graph.ConnectivityChecker;
import im.arun.genreport.graph.IdentifierAssigner;
import im.arun.genreport.report.JsonExportWriter;
import im.arun.genreport.report.MainExportWriter;
import im.arun.genreport.report.ReportFiles;
import im.arun.genreport.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one report: load, resolve the root, check connectivity, number individuals, write.
 * The connectivity decision is left to the caller.
 */
public class GenReportService {
    private static final Logger logger = LoggerFactory.getLogger(GenReportService.class);

    private final GenReportConfig config;

    public GenReportService(GenReportConfig config) {
        this.config = config;
    }

    public GenReportConfig getConfig() {
        return config;
    }

    public GedDocument load(Path input) throws GedLoadException {
        logger.info("Loading {}", input);
        return GedDocument.load(input);
    }

    /**
     * Root xref from {@code @I123@} or {@code 123}; without an argument, the individual with the
     * lowest number.
     *
     * @throws RootResolutionException if the root is unknown or there are no individuals
     */
    public String resolveRoot(GedDocument document, String rootArg) {
        if (rootArg != null && !rootArg.isBlank()) {
            String candidate = rootArg.strip();
            String resolved = GedLine.isXref(candidate)
                ? (document.containsIndividual(candidate) ? candidate : null)
                : document.resolveIndividual(candidate).orElse(null);
            if (resolved == null) {
                throw new RootResolutionException("Root '" + rootArg + "' not found in GED.");
            }
            return resolved;
        }
        List<String> xrefs = document.individualXrefs();
        if (xrefs.isEmpty()) {
            throw new RootResolutionException("No individuals found in GED.");
        }
        logger.info("No root given, using {}", xrefs.get(0));
        return xrefs.get(0);
    }

    public ConnectivityReport checkConnectivity(GedDocument document, String rootXref) {
        Set<String> disconnected = new ConnectivityChecker(document).findDisconnected(rootXref);
        IndividualExtractor extractor = new IndividualExtractor(document);

        List<String> preview = new ArrayList<>();
        int limit = Math.max(0, config.getIslandPreviewLimit());
        for (String xref : disconnected) {
            if (preview.size() >= limit) {
                break;
            }
            preview.add(extractor.header(xref).orElse(xref) + "  (" + xref + ")");
        }
        return new ConnectivityReport(rootXref, new ArrayList<>(disconnected), preview);
    }

    public Map<String, Integer> assignIdentifiers(GedDocument document, String rootXref) {
        return new IdentifierAssigner(document, config.getExceptionBand()).assign(rootXref);
    }

    /**
     * Write {@code type} into {@code outdir} under a name not used yet.
     */
    public ExportResult writeReport(GedDocument document, ReportType type, Path outdir,
                                    String rootXref, Map<String, Integer> identifiers) throws IOException {
        IndividualExtractor extractor = new IndividualExtractor(document,
            new StandardValueNormalizer(config.getPlaces()));
        Path outPath = ReportFiles.uniquePath(outdir, type);

        int count;
        switch (type) {
            case JSON:
                count = new JsonExportWriter(document, extractor).write(outPath, rootXref, identifiers);
                break;
            case MAINEXPORT:
            default:
                count = new MainExportWriter(document, extractor, config).write(outPath, identifiers);
                break;
        }
        return new ExportResult(outPath, count);
    }
}
