package im.arun.genreport.report;

import im.arun.genreport.config.GenReportConfig.FieldRule;
import im.arun.genreport.model.Field;

import java.util.List;
import java.util.Locale;

/**
 * Ordered exclusion rules over extracted fields. The first rule that matches decides;
 * fields no rule matches are kept.
 */
public class FieldFilter {

    private final List<FieldRule> rules;

    public FieldFilter(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean excludes(Field field) {
        return excludes(field.getFieldId(), field.getContent());
    }

    public boolean excludes(String fieldId, String content) {
        String id = upper(fieldId);
        for (FieldRule rule : rules) {
            if (!upper(rule.getFieldId()).equals(id)) {
                continue;
            }
            String needle = rule.getContains();
            if (needle == null || needle.isBlank()) {
                return true;
            }
            if (lower(content).contains(needle.strip().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String upper(String s) {
        return s == null ? "" : s.strip().toUpperCase(Locale.ROOT);
    }

    private static String lower(String s) {
        return s == null ? "" : s.strip().toLowerCase(Locale.ROOT);
    }
}
