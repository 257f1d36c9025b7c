package im.arun.genreport.extract;

import java.util.Set;

/**
 * Content handling variants for extracted tags. Unrecognised tags are {@link #GENERIC}.
 */
public enum FieldKind {
    DATE,
    PLACE,
    ADDRESS,
    NOTE,
    TEXT,
    GENERIC;

    private static final Set<String> ADDRESS_TAGS = Set.of(
        "ADDR", "ADR1", "ADR2", "ADR3", "CITY", "STAE", "POST", "POSTAL_CODE", "CTRY");
    private static final Set<String> TEXT_TAGS = Set.of("CAUS", "TYPE", "TEXT");

    public static FieldKind of(String tag) {
        if (tag == null) {
            return GENERIC;
        }
        if ("DATE".equals(tag)) {
            return DATE;
        }
        if ("PLAC".equals(tag)) {
            return PLACE;
        }
        if ("NOTE".equals(tag)) {
            return NOTE;
        }
        if (ADDRESS_TAGS.contains(tag)) {
            return ADDRESS;
        }
        if (TEXT_TAGS.contains(tag)) {
            return TEXT;
        }
        return GENERIC;
    }
}
