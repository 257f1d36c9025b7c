package im.arun.genreport.extract;

import im.arun.genreport.config.GenReportConfig;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Report-oriented normalisation: light HTML to plain text, Swedish place cleaning with
 * configured abbreviations, and dates to ISO form where possible.
 */
public class StandardValueNormalizer implements ValueNormalizer {

    private static final int UNICODE = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern BR = Pattern.compile("(?i)<\\s*br\\s*/?\\s*>");
    private static final Pattern P_CLOSE = Pattern.compile("(?i)</\\s*p\\s*>");
    private static final Pattern LI_CLOSE = Pattern.compile("(?i)</\\s*li\\s*>");
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("[ \\t]{2,}");
    private static final int MAX_UNESCAPE_PASSES = 3;

    private static final Pattern SOCKEN = Pattern.compile("\\b[Ss]n\\b", UNICODE);
    private static final Pattern FORSAMLING = Pattern.compile("\\bfö\\b", UNICODE);
    private static final Pattern TRAILING_SVERIGE = Pattern.compile(",\\s*Sverige\\b", UNICODE);
    private static final Pattern MULTI_SPACE = Pattern.compile("[ ]{2,}");

    private final Map<String, String> countries;
    private final Pattern countryCode;
    private final Map<Pattern, String> provinces;

    public StandardValueNormalizer() {
        this(new GenReportConfig.Places());
    }

    public StandardValueNormalizer(GenReportConfig.Places places) {
        this.countries = new LinkedHashMap<>();
        places.getCountries().forEach((code, name) -> countries.put(code.toUpperCase(), name));
        this.countryCode = countries.isEmpty()
            ? null
            : Pattern.compile("(?<!\\w)\\.(" + countries.keySet().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + ")\\b", UNICODE);

        this.provinces = new LinkedHashMap<>();
        places.getProvinces().forEach((abbr, name) ->
            provinces.put(Pattern.compile("\\b" + Pattern.quote(abbr) + "\\b", UNICODE), name));
    }

    /**
     * {@code <br>}, {@code </p>} and {@code </li>} become line breaks, other tags are dropped,
     * entities are unescaped until stable (at most three passes), runs of spaces collapse and
     * blank lines at either end are removed.
     */
    @Override
    public String text(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String t = BR.matcher(raw).replaceAll("\n");
        t = P_CLOSE.matcher(t).replaceAll("\n");
        t = LI_CLOSE.matcher(t).replaceAll("\n");
        t = ANY_TAG.matcher(t).replaceAll("");

        String previous = null;
        for (int pass = 0; pass < MAX_UNESCAPE_PASSES && !t.equals(previous); pass++) {
            previous = t;
            t = Parser.unescapeEntities(t, false);
        }

        t = t.replace('\u00A0', ' ');
        t = SPACES.matcher(t).replaceAll(" ");

        List<String> lines = new ArrayList<>(Arrays.asList(t.split("\\R", -1)));
        lines.replaceAll(String::strip);
        int first = 0;
        int last = lines.size() - 1;
        while (first <= last && lines.get(first).isEmpty()) {
            first++;
        }
        while (last >= first && lines.get(last).isEmpty()) {
            last--;
        }
        return String.join("\n", lines.subList(first, last + 1));
    }

    /**
     * Expands {@code .DE}-style country codes and province abbreviations, writes out
     * "Sn"/"fö" as socken/församling and drops a trailing ", Sverige".
     */
    @Override
    public String place(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String txt = raw;

        if (countryCode != null) {
            Matcher m = countryCode.matcher(txt);
            txt = m.replaceAll(match -> Matcher.quoteReplacement(
                countries.getOrDefault(match.group(1).toUpperCase(), match.group())));
        }

        txt = SOCKEN.matcher(txt).replaceAll("socken");
        txt = FORSAMLING.matcher(txt).replaceAll("församling");

        for (Map.Entry<Pattern, String> province : provinces.entrySet()) {
            txt = province.getKey().matcher(txt).replaceAll(Matcher.quoteReplacement(province.getValue()));
        }

        txt = TRAILING_SVERIGE.matcher(txt).replaceAll("");
        txt = MULTI_SPACE.matcher(txt).replaceAll(" ");
        return txt.strip();
    }

    @Override
    public String date(String raw) {
        return Dates.normalize(raw);
    }
}
