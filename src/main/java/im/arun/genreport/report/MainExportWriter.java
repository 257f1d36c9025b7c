package im.arun.genreport.report;

import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.extract.IndividualExtractor;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.graph.ConnectivityChecker;
import im.arun.genreport.model.Field;
import im.arun.genreport.model.IndividualView;
import im.arun.genreport.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes the "persongalleri" Markdown report: one section per individual with birth and
 * death lines, remaining fields and labelled relations.
 */
public class MainExportWriter {
    private static final Logger logger = LoggerFactory.getLogger(MainExportWriter.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\n\\s*");
    private static final Set<String> EVENT_FIELDS = Set.of(
        "BIRT.DATE", "BIRT.PLAC", "BIRT.NOTE",
        "DEAT.DATE", "DEAT.PLAC", "DEAT.NOTE", "DEAT._DESCRIPTION");

    private final GedDocument document;
    private final IndividualExtractor extractor;
    private final GenReportConfig.Labels labels;
    private final FieldFilter fieldFilter;
    private final RelationLabeler relationLabeler;
    private final ConnectivityChecker connectivityChecker;

    public MainExportWriter(GedDocument document, IndividualExtractor extractor, GenReportConfig config) {
        this.document = document;
        this.extractor = extractor;
        this.labels = config.getLabels();
        this.fieldFilter = new FieldFilter(config.getFieldRules());
        this.relationLabeler = new RelationLabeler(extractor, config.getLabels());
        this.connectivityChecker = new ConnectivityChecker(document);
    }

    /**
     * Write every individual in document order.
     *
     * @param identifiers assigned identifiers, rendered as {@code [n]} in each section heading
     * @return number of individuals written
     */
    public int write(Path outPath, Map<String, Integer> identifiers) throws IOException {
        int count = 0;
        try (BufferedWriter out = Files.newBufferedWriter(outPath, StandardCharsets.UTF_8)) {
            out.write("# " + labels.getTitle() + "\n\n");
            for (String xref : document.individualXrefs()) {
                IndividualView view = extractor.describe(xref).orElse(null);
                if (view == null) {
                    continue;
                }
                writeIndividual(out, view, identifiers.get(xref));
                count++;
            }
        }
        logger.info("Wrote {} individuals to {}", count, outPath);
        return count;
    }

    private void writeIndividual(BufferedWriter out, IndividualView view, Integer id) throws IOException {
        if (id == null) {
            if (!connectivityChecker.isMediaPlaceholder(view.getXref())) {
                logger.warn("No identifier assigned to {} ({})", view.getXref(), view.getHeader());
            }
            out.write("## " + view.getHeader() + "\n");
        } else {
            out.write("## [" + id + "] " + view.getHeader() + "\n");
        }

        writeEventLine(out, labels.getBirth(), view, "BIRT");
        writeEventLine(out, labels.getDeath(), view, "DEAT");

        for (Field field : view.getFields()) {
            String content = flatten(field.getContent());
            String fieldId = upper(field.getFieldId());
            if (content.isEmpty() || EVENT_FIELDS.contains(fieldId)) {
                continue;
            }
            if (isEmailLike(field.getFieldId(), field.getDescription(), content)
                    || isMediaLike(field.getFieldId(), field.getDescription())
                    || fieldFilter.excludes(field.getFieldId(), content)) {
                continue;
            }
            if ("OCCU".equals(fieldId)) {
                out.write(labels.getOccupation() + " " + content + "\n");
            } else {
                out.write(field.getFieldId() + "," + field.getDescription() + "," + content + "\n");
            }
        }

        for (Relation relation : view.getRelations()) {
            String line = flatten(relation.getTargetLine());
            String kind = relation.getKind() == null ? "" : relation.getKind().name();
            if (line.isEmpty()
                    || isEmailLike(kind, relation.getDescription(), line)
                    || isMediaLike(kind, relation.getDescription())) {
                continue;
            }
            out.write(relationLabeler.label(relation) + " " + line + "\n");
        }
        out.write("\n");
    }

    /**
     * {@code "<label> <date> i <place>, Not: <note>"}, omitting absent parts; nothing when all
     * three are absent. The last value of each field wins.
     */
    private void writeEventLine(BufferedWriter out, String label, IndividualView view, String event)
            throws IOException {
        String date = "";
        String place = "";
        String note = "";
        for (Field field : view.getFields()) {
            String fieldId = upper(field.getFieldId());
            if (fieldId.equals(event + ".DATE")) {
                date = flatten(field.getContent());
            } else if (fieldId.equals(event + ".PLAC")) {
                place = flatten(field.getContent());
            } else if (fieldId.equals(event + ".NOTE")) {
                note = flatten(field.getContent());
            }
        }
        String line = formatEventLine(label, date, place, note);
        if (line != null) {
            out.write(line + "\n");
        }
    }

    String formatEventLine(String label, String date, String place, String note) {
        if (date.isEmpty() && place.isEmpty() && note.isEmpty()) {
            return null;
        }
        StringBuilder line = new StringBuilder(label);
        if (!date.isEmpty()) {
            line.append(' ').append(date);
        }
        if (!place.isEmpty()) {
            line.append(' ').append(labels.getPlacePreposition()).append(' ').append(place);
        }
        if (!note.isEmpty()) {
            line.append(", ").append(labels.getNote()).append(' ').append(note);
        }
        return line.toString();
    }

    /**
     * Multi-line values on one line, joined with {@code " / "}.
     */
    static String flatten(String text) {
        if (text == null) {
            return "";
        }
        return LINE_BREAK.matcher(text.strip()).replaceAll(" / ");
    }

    static boolean isEmailLike(String fieldId, String description, String content) {
        String c = content == null ? "" : content;
        return upper(fieldId).contains("EMAIL")
            || lower(description).contains("email")
            || c.strip().equalsIgnoreCase("EMAIL")
            || c.contains("@");
    }

    static boolean isMediaLike(String fieldId, String description) {
        String id = upper(fieldId);
        String d = lower(description);
        return id.contains("OBJE") || id.contains(".FILE") || id.contains(".FORM")
            || d.contains("media") || d.contains("file") || d.contains("bild");
    }

    private static String upper(String s) {
        return s == null ? "" : s.toUpperCase(Locale.ROOT);
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
