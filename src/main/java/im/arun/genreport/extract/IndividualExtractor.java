package im.arun.genreport.extract;

import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLine;
import im.arun.genreport.model.FamilyRecord;
import im.arun.genreport.model.Field;
import im.arun.genreport.model.Gender;
import im.arun.genreport.model.IndividualView;
import im.arun.genreport.model.NameParts;
import im.arun.genreport.model.RecordRange;
import im.arun.genreport.model.Relation;
import im.arun.genreport.model.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one individual record into its header line, fields and relations.
 * Never throws for bad data: missing names, dates or references become empty values or
 * omitted entries, so one malformed record cannot affect any other.
 */
public class IndividualExtractor {
    private static final Logger logger = LoggerFactory.getLogger(IndividualExtractor.class);

    public static final String INDIVIDUAL_NOTE_ID = "INDI.NOTE";
    public static final String INDIVIDUAL_NOTE_DESCRIPTION = "individual note";

    private static final Set<String> SKIPPED_TOP_LEVEL = Set.of(
        "FAMC", "FAMS", "RIN", "_UID", "_UPD", "NAME", "SEX", "NOTE");
    private static final Set<String> SKIPPED_NESTED = Set.of("RIN", "_UID", "_UPD");

    private static final Pattern NAME_VALUE = Pattern.compile("^(.*?)\\s*/([^/]*)/(\\s*(.*))?$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final GedDocument document;
    private final ValueNormalizer normalizer;

    public IndividualExtractor(GedDocument document) {
        this(document, ValueNormalizer.RAW);
    }

    public IndividualExtractor(GedDocument document, ValueNormalizer normalizer) {
        this.document = document;
        this.normalizer = normalizer;
    }

    /**
     * Full view of one individual, or empty if the xref is not in the document.
     */
    public Optional<IndividualView> describe(String xref) {
        return document.individual(xref).map(range -> describe(xref, range));
    }

    public IndividualView describe(String xref, RecordRange range) {
        NameParts name = nameParts(range);
        String birthYear = eventYear(range, "BIRT");
        String deathYear = eventYear(range, "DEAT");
        String idNumber = GedLine.idNumber(xref);
        String header = formatHeader(name, birthYear, deathYear, idNumber);

        List<Field> fields = fields(range);
        fields.addAll(individualNotes(xref, range));

        return new IndividualView(xref, idNumber, name, birthYear, deathYear, header,
            fields, relations(xref));
    }

    /**
     * Header line of an individual: {@code "Given Nick Surname SYM YYYY-YYYY, 123"}.
     */
    public Optional<String> header(String xref) {
        return document.individual(xref).map(range -> formatHeader(
            nameParts(range),
            eventYear(range, "BIRT"),
            eventYear(range, "DEAT"),
            GedLine.idNumber(xref)));
    }

    // ========== NAME ==========

    /**
     * Name parts from the first level-1 NAME: its value is read as {@code given /surname/ suffix},
     * then GIVN, SURN, NICK, NPFX and NSFX subfields override the parsed parts. A value without
     * surname slashes contributes nothing.
     */
    public NameParts nameParts(RecordRange range) {
        List<String> lines = document.lines();
        for (int i = range.start() + 1; i < range.end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level == null || level != 1 || !"NAME".equals(GedLine.tagAndValue(lines.get(i)).tag())) {
                continue;
            }

            String given = "";
            String surname = "";
            String nickname = "";
            String prefix = "";
            String suffix = "";

            String full = GedLine.valueWithContinuation(lines, i).text().strip();
            Matcher m = NAME_VALUE.matcher(full);
            if (m.matches()) {
                given = m.group(1).strip();
                surname = m.group(2).strip();
                String trail = m.group(4) == null ? "" : m.group(4).strip();
                if (!trail.isEmpty()) {
                    suffix = trail;
                }
            }

            int j = i + 1;
            while (j < range.end() && GedLine.levelOrZero(lines.get(j)) > 1) {
                GedLine.TagValue tv = GedLine.tagAndValue(lines.get(j));
                String value = tv.value().strip();
                switch (tv.tag()) {
                    case "GIVN":
                        given = value.isEmpty() ? given : value;
                        break;
                    case "SURN":
                        surname = value.isEmpty() ? surname : value;
                        break;
                    case "NICK":
                        GedLine.Continuation nick = GedLine.valueWithContinuation(lines, j);
                        nickname = nick.text().strip();
                        j = nick.nextIndex() - 1;
                        break;
                    case "NPFX":
                        prefix = value.isEmpty() ? prefix : value;
                        break;
                    case "NSFX":
                        suffix = value.isEmpty() ? suffix : value;
                        break;
                    default:
                        break;
                }
                j++;
            }
            return new NameParts(given, stripQuotes(nickname), surname, prefix, suffix);
        }
        return NameParts.EMPTY;
    }

    public static String formatHeader(NameParts name, String birthYear, String deathYear, String idNumber) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, name.given());
        addIfPresent(parts, stripQuotes(name.nickname()));
        addIfPresent(parts, name.surname());
        StringBuilder header = new StringBuilder(String.join(" ", parts));

        String symbols = WHITESPACE.matcher(name.prefix() + name.suffix()).replaceAll("");
        if (!symbols.isEmpty()) {
            header.append(' ').append(symbols);
        }

        // the space before the years is kept when there are none; readers split on the last ", "
        header.append(' ').append(formatYears(birthYear, deathYear));
        header.append(", ").append(idNumber == null ? "" : idNumber);
        return header.toString().strip();
    }

    /**
     * {@code "1850-1920"}, {@code "1850-"}, {@code "-1920"} or empty.
     */
    public static String formatYears(String birthYear, String deathYear) {
        boolean hasBirth = birthYear != null && !birthYear.isEmpty();
        boolean hasDeath = deathYear != null && !deathYear.isEmpty();
        if (hasBirth && hasDeath) {
            return birthYear + "-" + deathYear;
        }
        if (hasBirth) {
            return birthYear + "-";
        }
        if (hasDeath) {
            return "-" + deathYear;
        }
        return "";
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.strip());
        }
    }

    private static String stripQuotes(String value) {
        if (value == null) {
            return "";
        }
        String s = value.strip();
        s = trimChar(s, '"');
        return trimChar(s, '\'');
    }

    private static String trimChar(String s, char c) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == c) {
            start++;
        }
        while (end > start && s.charAt(end - 1) == c) {
            end--;
        }
        return s.substring(start, end);
    }

    // ========== YEARS ==========

    /**
     * Year of the first DATE directly below a level-1 event tag (BIRT, DEAT), or empty.
     */
    public String eventYear(RecordRange range, String eventTag) {
        List<String> lines = document.lines();
        for (int i = range.start() + 1; i < range.end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level == null || level != 1 || !eventTag.equals(GedLine.tagAndValue(lines.get(i)).tag())) {
                continue;
            }
            int j = i + 1;
            while (j < range.end() && GedLine.levelOrZero(lines.get(j)) > 1) {
                if (GedLine.levelOrZero(lines.get(j)) == 2 && "DATE".equals(GedLine.tagAndValue(lines.get(j)).tag())) {
                    String year = Dates.yearFrom(normalizer.date(GedLine.valueWithContinuation(lines, j).text()));
                    if (!year.isEmpty()) {
                        return year;
                    }
                }
                j++;
            }
        }
        return "";
    }

    // ========== FIELDS ==========

    /**
     * Fields of every level-1 tag except names, sex, family links, record ids and top-level
     * notes. Each nested tag, at any depth, becomes {@code LEVEL1.TAG}; a level-1 tag with its
     * own value is also emitted under its own tag, after its children.
     */
    public List<Field> fields(RecordRange range) {
        List<String> lines = document.lines();
        List<Field> fields = new ArrayList<>();

        int i = range.start() + 1;
        while (i < range.end()) {
            Integer level = GedLine.levelOf(lines.get(i));
            String tag = GedLine.tagAndValue(lines.get(i)).tag();
            if (level == null || level != 1 || SKIPPED_TOP_LEVEL.contains(tag)) {
                i++;
                continue;
            }

            GedLine.Continuation own = GedLine.valueWithContinuation(lines, i);
            int next = walkChildren(tag, own.nextIndex(), range.end(), fields);

            String ownValue = own.text().strip();
            if (!ownValue.isEmpty()) {
                String content = topLevelContent(tag, ownValue);
                if (!content.isEmpty()) {
                    fields.add(new Field(tag, TagDescriptions.describe(tag), content));
                }
            }
            i = Math.max(next, i + 1);
        }
        return fields;
    }

    private int walkChildren(String topTag, int from, int end, List<Field> fields) {
        List<String> lines = document.lines();

        int j = from;
        while (j < end && GedLine.levelOrZero(lines.get(j)) > 1) {
            String tag = GedLine.tagAndValue(lines.get(j)).tag();
            if (GedLine.CONC.equals(tag) || GedLine.CONT.equals(tag) || SKIPPED_NESTED.contains(tag)) {
                j++;
                continue;
            }

            // every descendant is keyed by its level-1 tag, however deep it sits
            GedLine.Continuation value = GedLine.valueWithContinuation(lines, j);
            String fieldId = topTag + "." + tag;
            String content = content(FieldKind.of(tag), value.text(), fieldId);
            if (!content.isEmpty()) {
                fields.add(new Field(fieldId, TagDescriptions.describe(fieldId), content));
            }
            j = Math.max(value.nextIndex(), j + 1);
        }
        return j;
    }

    private String content(FieldKind kind, String raw, String fieldId) {
        return switch (kind) {
            case DATE -> normalizer.date(raw);
            case PLACE -> normalizer.place(raw.strip());
            case ADDRESS -> normalizer.text(raw.strip());
            case NOTE -> noteContent(raw, fieldId);
            case TEXT, GENERIC -> normalizer.text(raw.strip());
        };
    }

    private String topLevelContent(String tag, String raw) {
        return switch (FieldKind.of(tag)) {
            case PLACE, ADDRESS -> normalizer.place(raw);
            case DATE -> normalizer.date(raw);
            case NOTE, TEXT, GENERIC -> normalizer.text(raw);
        };
    }

    /**
     * A note value is either a reference to a NOTE record or literal text.
     */
    private String noteContent(String raw, String context) {
        String value = raw.strip();
        if (GedLine.isXref(value)) {
            Optional<String> resolved = document.note(value);
            if (resolved.isEmpty()) {
                logger.warn("Unresolved note reference {} in {}", value, context);
                return "";
            }
            return normalizer.text(resolved.get());
        }
        return normalizer.text(value);
    }

    /**
     * Level-1 NOTE lines of the individual as {@value #INDIVIDUAL_NOTE_ID} fields.
     */
    public List<Field> individualNotes(String xref, RecordRange range) {
        List<String> lines = document.lines();
        List<Field> notes = new ArrayList<>();
        int i = range.start() + 1;
        while (i < range.end()) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level != null && level == 1 && "NOTE".equals(GedLine.tagAndValue(lines.get(i)).tag())) {
                GedLine.Continuation note = GedLine.valueWithContinuation(lines, i);
                String content = noteContent(note.text(), xref);
                if (!content.isEmpty()) {
                    notes.add(new Field(INDIVIDUAL_NOTE_ID, INDIVIDUAL_NOTE_DESCRIPTION, content));
                }
                i = Math.max(note.nextIndex(), i + 1);
            } else {
                i++;
            }
        }
        return notes;
    }

    // ========== RELATIONS ==========

    /**
     * Parents from FAMC families (husband, then wife), then per FAMS family the other spouse
     * followed by the children, all in source order.
     */
    public List<Relation> relations(String xref) {
        List<Relation> relations = new ArrayList<>();

        for (String famXref : document.childFamilies(xref)) {
            Optional<FamilyRecord> family = document.family(famXref);
            if (family.isEmpty()) {
                logger.warn("Unresolved family {} referenced by {}", famXref, xref);
                continue;
            }
            addRelation(relations, RelationKind.PARENT, family.get().husband());
            addRelation(relations, RelationKind.PARENT, family.get().wife());
        }

        for (String famXref : document.spouseFamilies(xref)) {
            Optional<FamilyRecord> family = document.family(famXref);
            if (family.isEmpty()) {
                logger.warn("Unresolved family {} referenced by {}", famXref, xref);
                continue;
            }
            family.get().otherSpouse(xref)
                .ifPresent(spouse -> addRelation(relations, RelationKind.SPOUSE, spouse));
            for (String child : family.get().children()) {
                addRelation(relations, RelationKind.CHILD, child);
            }
        }
        return relations;
    }

    private void addRelation(List<Relation> relations, RelationKind kind, String targetXref) {
        if (targetXref == null || targetXref.isEmpty()) {
            return;
        }
        Optional<String> line = header(targetXref);
        if (line.isEmpty()) {
            logger.warn("Unresolved individual {} in {} relation", targetXref, kind.getDescription());
            return;
        }
        relations.add(new Relation(kind, kind.getDescription(), line.get()));
    }

    // ========== GENDER ==========

    /**
     * Gender from the first level-1 SEX line. Accepts {@code @I123@} or {@code 123}.
     */
    public Gender genderOf(String idOrXref) {
        Optional<String> xref = document.resolveIndividual(idOrXref);
        if (xref.isEmpty()) {
            return Gender.UNKNOWN;
        }
        RecordRange range = document.individual(xref.get()).orElseThrow();
        List<String> lines = document.lines();
        for (int i = range.start() + 1; i < range.end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            GedLine.TagValue tv = GedLine.tagAndValue(lines.get(i));
            if (level != null && level == 1 && "SEX".equalsIgnoreCase(tv.tag())) {
                return Gender.fromCode(tv.value());
            }
        }
        return Gender.UNKNOWN;
    }
}
