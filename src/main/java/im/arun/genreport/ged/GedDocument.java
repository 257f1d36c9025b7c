package im.arun.genreport.ged;

import im.arun.genreport.model.FamilyRecord;
import im.arun.genreport.model.RecordRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed GEDCOM file: the lines plus indices of individual, family and note records.
 * Immutable once constructed. Cross-references are keys into these indices, so every lookup
 * is optional.
 */
public class GedDocument {
    private static final Logger logger = LoggerFactory.getLogger(GedDocument.class);

    private static final Pattern INDI_NUMBER = Pattern.compile("@I(\\d+)@");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final Path path;
    private final List<String> lines;
    private final Map<String, RecordRange> individuals;
    private final Map<String, RecordRange> families;
    private final Map<String, String> notes;
    private final Map<String, String> numberToXref;

    private GedDocument(Path path, List<String> lines) {
        this.path = path;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));

        RecordIndexer indexer = new RecordIndexer();
        this.individuals = Collections.unmodifiableMap(indexer.index(this.lines, RecordType.INDIVIDUAL));
        this.families = Collections.unmodifiableMap(indexer.index(this.lines, RecordType.FAMILY));
        this.notes = Collections.unmodifiableMap(indexer.indexNotes(this.lines));

        Map<String, String> numbers = new HashMap<>();
        for (String xref : individuals.keySet()) {
            Matcher m = INDI_NUMBER.matcher(xref);
            if (m.find()) {
                numbers.put(m.group(1), xref);
            }
        }
        this.numberToXref = Collections.unmodifiableMap(numbers);

        logger.info("Indexed {} individuals, {} families, {} notes",
            individuals.size(), families.size(), notes.size());
    }

    /**
     * Load and index a GEDCOM file.
     *
     * @throws GedLoadException if the file cannot be read or is empty
     */
    public static GedDocument load(Path path) throws GedLoadException {
        return new GedDocument(path, new GedTextLoader().load(path));
    }

    /**
     * Index already decoded lines.
     */
    public static GedDocument fromLines(List<String> lines) {
        return new GedDocument(null, lines);
    }

    public Path getPath() {
        return path;
    }

    public List<String> lines() {
        return lines;
    }

    public String line(int index) {
        return lines.get(index);
    }

    public Map<String, RecordRange> individualRanges() {
        return individuals;
    }

    public Map<String, RecordRange> familyRanges() {
        return families;
    }

    public int individualCount() {
        return individuals.size();
    }

    public boolean containsIndividual(String xref) {
        return xref != null && individuals.containsKey(xref);
    }

    public Optional<RecordRange> individual(String xref) {
        return xref == null ? Optional.empty() : Optional.ofNullable(individuals.get(xref));
    }

    public Optional<RecordRange> familyRange(String xref) {
        return xref == null ? Optional.empty() : Optional.ofNullable(families.get(xref));
    }

    public Optional<String> note(String xref) {
        return xref == null ? Optional.empty() : Optional.ofNullable(notes.get(xref.strip()));
    }

    /**
     * Individual xrefs ordered by ascending embedded number, ties broken by the xref itself.
     */
    public List<String> individualXrefs() {
        List<String> order = new ArrayList<>(individuals.keySet());
        order.sort(Comparator.comparingLong(GedDocument::numericKey).thenComparing(Comparator.naturalOrder()));
        return order;
    }

    /**
     * Resolve {@code @I123@} or a bare {@code 123} to an individual xref present in the document.
     */
    public Optional<String> resolveIndividual(String idOrXref) {
        if (idOrXref == null || idOrXref.isBlank()) {
            return Optional.empty();
        }
        String candidate = idOrXref.strip();
        if (individuals.containsKey(candidate)) {
            return Optional.of(candidate);
        }
        if (GedLine.isXref(candidate)) {
            return Optional.empty();
        }
        String digits = NON_DIGITS.matcher(candidate).replaceAll("");
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        String xref = numberToXref.get(digits);
        if (xref != null) {
            return Optional.of(xref);
        }
        String guess = "@I" + digits + "@";
        return individuals.containsKey(guess) ? Optional.of(guess) : Optional.empty();
    }

    /**
     * Values of the level-1 lines with the given tag (e.g. FAMC, FAMS) of an individual,
     * in source order.
     */
    public List<String> familyLinks(String indiXref, String tag) {
        Optional<RecordRange> range = individual(indiXref);
        if (range.isEmpty()) {
            return List.of();
        }
        List<String> links = new ArrayList<>();
        for (int i = range.get().start() + 1; i < range.get().end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level == null || level != 1) {
                continue;
            }
            GedLine.TagValue tv = GedLine.tagAndValue(lines.get(i));
            if (tag.equals(tv.tag()) && !tv.value().isBlank()) {
                links.add(tv.value().strip());
            }
        }
        return links;
    }

    /**
     * Families in which the individual is a spouse (FAMS).
     */
    public List<String> spouseFamilies(String indiXref) {
        return familyLinks(indiXref, "FAMS");
    }

    /**
     * Families in which the individual is a child (FAMC).
     */
    public List<String> childFamilies(String indiXref) {
        return familyLinks(indiXref, "FAMC");
    }

    /**
     * HUSB, WIFE and CHIL of a family record. When a tag repeats, the last HUSB/WIFE wins.
     */
    public Optional<FamilyRecord> family(String famXref) {
        return familyRange(famXref).map(range -> readFamily(famXref, range));
    }

    private FamilyRecord readFamily(String famXref, RecordRange range) {
        String husband = null;
        String wife = null;
        List<String> children = new ArrayList<>();
        for (int i = range.start() + 1; i < range.end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level == null || level != 1) {
                continue;
            }
            GedLine.TagValue tv = GedLine.tagAndValue(lines.get(i));
            String value = tv.value().strip();
            if (value.isEmpty()) {
                continue;
            }
            switch (tv.tag()) {
                case "HUSB":
                    husband = value;
                    break;
                case "WIFE":
                    wife = value;
                    break;
                case "CHIL":
                    children.add(value);
                    break;
                default:
                    break;
            }
        }
        return new FamilyRecord(famXref, husband, wife, children);
    }

    /**
     * All family records in order of appearance.
     */
    public List<FamilyRecord> allFamilies() {
        List<FamilyRecord> all = new ArrayList<>(families.size());
        families.forEach((xref, range) -> all.add(readFamily(xref, range)));
        return all;
    }

    private static long numericKey(String xref) {
        String digits = NON_DIGITS.matcher(xref).replaceAll("");
        if (digits.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
