package im.arun.genreport.ged;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless helpers for single GEDCOM lines: nesting level, tag/value split and
 * CONC/CONT continuation reassembly.
 */
public final class GedLine {

    public static final String CONC = "CONC";
    public static final String CONT = "CONT";

    private static final Pattern LEVEL = Pattern.compile("^\\s*(\\d+)\\s");
    private static final Pattern INDI_NUMBER = Pattern.compile("^@I(\\d+)@$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private GedLine() {
    }

    /**
     * Tag and value of a line. Both are empty strings when the line has no tag.
     */
    public record TagValue(String tag, String value) {
        public static final TagValue EMPTY = new TagValue("", "");
    }

    /**
     * Reassembled continuation text and the index of the first line that was not consumed.
     */
    public record Continuation(String text, int nextIndex) {
    }

    /**
     * Leading nesting level of a line, or null for a line that has none (non-structural).
     */
    public static Integer levelOf(String line) {
        if (line == null) {
            return null;
        }
        Matcher m = LEVEL.matcher(line);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Level of a line with non-structural lines counted as 0, which ends any subtree walk.
     */
    public static int levelOrZero(String line) {
        Integer level = levelOf(line);
        return level == null ? 0 : level;
    }

    /**
     * Split a line into tag and value, skipping a leading {@code @XREF@} token.
     * {@code "0 @I1@ INDI"} gives {@code (INDI, "")}; {@code "1 NAME Anna /Karlsson/"} gives
     * {@code (NAME, "Anna /Karlsson/")}.
     */
    public static TagValue tagAndValue(String line) {
        if (line == null) {
            return TagValue.EMPTY;
        }
        String[] parts = line.strip().split(" ", 3);
        if (parts.length < 2) {
            return TagValue.EMPTY;
        }
        if (isXref(parts[1])) {
            if (parts.length < 3) {
                return TagValue.EMPTY;
            }
            String[] rest = parts[2].split(" ", 2);
            return new TagValue(rest[0], rest.length > 1 ? rest[1] : "");
        }
        return new TagValue(parts[1], parts.length > 2 ? parts[2] : "");
    }

    /**
     * Collect the CONC/CONT lines that follow the owner line at {@code ownerIndex}.
     * CONC appends verbatim, CONT appends after a line break. Stops at the first line that is
     * neither, has no level, or is not deeper than {@code ownerLevel}.
     */
    public static Continuation collectContinuation(List<String> lines, int ownerIndex, int ownerLevel) {
        StringBuilder text = new StringBuilder();
        int i = ownerIndex + 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            Integer level = levelOf(line);
            if (level == null || level <= ownerLevel) {
                break;
            }
            TagValue tv = tagAndValue(line);
            if (CONC.equals(tv.tag())) {
                text.append(tv.value());
            } else if (CONT.equals(tv.tag())) {
                text.append('\n').append(tv.value());
            } else {
                break;
            }
            i++;
        }
        return new Continuation(text.toString(), i);
    }

    /**
     * Value of the line at {@code index} with its continuation lines appended.
     */
    public static Continuation valueWithContinuation(List<String> lines, int index) {
        String line = lines.get(index);
        Continuation extra = collectContinuation(lines, index, levelOrZero(line));
        return new Continuation(tagAndValue(line).value() + extra.text(), extra.nextIndex());
    }

    public static boolean isXref(String token) {
        if (token == null) {
            return false;
        }
        String t = token.strip();
        return t.length() >= 2 && t.startsWith("@") && t.endsWith("@");
    }

    /**
     * Bare number of an individual xref: {@code @I123@ -> 123}. Falls back to all digits of the
     * token, and to the token without its {@code @} markers when it has no digits.
     */
    public static String idNumber(String xref) {
        if (xref == null) {
            return "";
        }
        Matcher m = INDI_NUMBER.matcher(xref);
        if (m.matches()) {
            return m.group(1);
        }
        String digits = NON_DIGITS.matcher(xref).replaceAll("");
        if (!digits.isEmpty()) {
            return digits;
        }
        return xref.replace("@", "");
    }
}
