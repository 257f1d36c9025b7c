package im.arun.genreport.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.genreport.extract.IndividualExtractor;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.model.IndividualView;
import im.arun.genreport.model.ReportExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the root, identifier map and every individual's view as one JSON document.
 */
public class JsonExportWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonExportWriter.class);

    private final GedDocument document;
    private final IndividualExtractor extractor;
    private final ObjectMapper objectMapper;

    public JsonExportWriter(GedDocument document, IndividualExtractor extractor) {
        this.document = document;
        this.extractor = extractor;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ReportExport build(String rootXref, Map<String, Integer> identifiers) {
        List<IndividualView> individuals = new ArrayList<>();
        for (String xref : document.individualXrefs()) {
            extractor.describe(xref).ifPresent(individuals::add);
        }
        String source = document.getPath() == null ? null : document.getPath().getFileName().toString();
        return new ReportExport(source, rootXref, new LinkedHashMap<>(identifiers), individuals);
    }

    /**
     * @return number of individuals written
     */
    public int write(Path outPath, String rootXref, Map<String, Integer> identifiers) throws IOException {
        ReportExport export = build(rootXref, identifiers);
        objectMapper.writeValue(outPath.toFile(), export);
        logger.info("Wrote {} individuals to {}", export.getIndividuals().size(), outPath);
        return export.getIndividuals().size();
    }
}
