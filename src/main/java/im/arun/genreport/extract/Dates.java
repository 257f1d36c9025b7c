package im.arun.genreport.extract;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort date handling for GEDCOM date values.
 */
public final class Dates {

    private static final Pattern ISO_FULL = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_IN_TEXT = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern FOUR_DIGITS = Pattern.compile("(\\d{4})");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> MONTHS = Map.ofEntries(
        Map.entry("JAN", "01"), Map.entry("FEB", "02"), Map.entry("MAR", "03"),
        Map.entry("APR", "04"), Map.entry("MAY", "05"), Map.entry("JUN", "06"),
        Map.entry("JUL", "07"), Map.entry("AUG", "08"), Map.entry("SEP", "09"),
        Map.entry("OCT", "10"), Map.entry("NOV", "11"), Map.entry("DEC", "12"),
        Map.entry("JANUARI", "01"), Map.entry("FEBRUARI", "02"), Map.entry("MARS", "03"),
        Map.entry("APRIL", "04"), Map.entry("MAJ", "05"), Map.entry("JUNI", "06"),
        Map.entry("JULI", "07"), Map.entry("AUGUSTI", "08"), Map.entry("SEPTEMBER", "09"),
        Map.entry("OKTOBER", "10"), Map.entry("NOVEMBER", "11"), Map.entry("DECEMBER", "12")
    );

    private Dates() {
    }

    /**
     * ISO dates are returned as-is; {@code "DD MON YYYY"} (English or Swedish month) becomes
     * {@code YYYY-MM-DD} with {@code ??} for a missing day; otherwise the first 4-digit year, or
     * the trimmed input when it has none.
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String s = value.strip();
        if (ISO_FULL.matcher(s).matches()) {
            return s;
        }

        Matcher first = FOUR_DIGITS.matcher(s);
        String year = first.find() ? first.group(1) : "";

        String[] parts = WHITESPACE.split(s.replace(",", " ").strip());
        if (parts.length >= 3) {
            String day = NON_DIGITS.matcher(parts[0]).replaceAll("");
            String month = MONTHS.get(parts[1].toUpperCase());
            Matcher y = FOUR_DIGITS.matcher(parts[parts.length - 1]);
            if (month != null && y.find()) {
                String dd = day.isEmpty() ? "??" : (day.length() < 2 ? "0" + day : day);
                return y.group(1) + "-" + month + "-" + dd;
            }
        }
        return year.isEmpty() ? s : year;
    }

    /**
     * Year of an ISO date in the text, else its first 4-digit run, else empty.
     */
    public static String yearFrom(String dateText) {
        if (dateText == null || dateText.isEmpty()) {
            return "";
        }
        Matcher iso = ISO_IN_TEXT.matcher(dateText);
        if (iso.find()) {
            return iso.group(1);
        }
        Matcher m = FOUR_DIGITS.matcher(dateText);
        return m.find() ? m.group(1) : "";
    }
}
