package im.arun.genreport.extract;

import java.util.Map;

/**
 * Human-readable descriptions of field ids such as {@code BIRT.DATE} ("birth date").
 */
public final class TagDescriptions {

    private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
        Map.entry("NAME", "name"),
        Map.entry("GIVN", "given name"),
        Map.entry("SURN", "surname"),
        Map.entry("NICK", "nickname"),
        Map.entry("NPFX", "name prefix"),
        Map.entry("NSFX", "name suffix"),
        Map.entry("SEX", "sex"),
        Map.entry("BIRT", "birth"),
        Map.entry("DEAT", "death"),
        Map.entry("BURI", "burial"),
        Map.entry("RESI", "residence"),
        Map.entry("OCCU", "occupation"),
        Map.entry("EDUC", "education"),
        Map.entry("MILI", "military service"),
        Map.entry("EVEN", "event"),
        Map.entry("TITL", "title"),
        Map.entry("ALIA", "alias"),
        Map.entry("FACT", "fact"),
        Map.entry("DSCR", "description"),
        Map.entry("RELI", "religion"),
        Map.entry("NATI", "nationality"),
        Map.entry("IMMI", "immigration"),
        Map.entry("EMIG", "emigration"),
        Map.entry("BAPM", "baptism"),
        Map.entry("CHR", "christening"),
        Map.entry("CONF", "confirmation"),
        Map.entry("DATE", "date"),
        Map.entry("PLAC", "place"),
        Map.entry("ADDR", "address"),
        Map.entry("ADR1", "address line 1"),
        Map.entry("ADR2", "address line 2"),
        Map.entry("ADR3", "address line 3"),
        Map.entry("CITY", "city"),
        Map.entry("STAE", "state"),
        Map.entry("POST", "postal code"),
        Map.entry("POSTAL_CODE", "postal code"),
        Map.entry("CTRY", "country"),
        Map.entry("TYPE", "type"),
        Map.entry("CAUS", "cause"),
        Map.entry("NOTE", "note"),
        Map.entry("TEXT", "text")
    );

    private TagDescriptions() {
    }

    public static String describe(String fieldId) {
        if (fieldId == null || fieldId.isEmpty()) {
            return "";
        }
        String[] parts = fieldId.split("\\.");
        String base = describeTag(parts[0]);
        if (parts.length == 1) {
            return base;
        }
        return base + " " + describeTag(parts[1]);
    }

    private static String describeTag(String tag) {
        return DESCRIPTIONS.getOrDefault(tag, tag.toLowerCase());
    }
}
