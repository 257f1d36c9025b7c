package im.arun.genreport.ged;

import im.arun.genreport.model.RecordRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates level-0 records in the line sequence with a single left-to-right scan.
 */
public class RecordIndexer {
    private static final Logger logger = LoggerFactory.getLogger(RecordIndexer.class);

    private static final Pattern LEVEL_ZERO = Pattern.compile("^\\s*0\\s+");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\s*\\n\\s*");

    /**
     * Ranges of every record matching {@code pattern}. Each range starts at the matching line
     * and ends at the next level-0 line or at the end of the file.
     */
    public List<RecordRange> findBlocks(List<String> lines, Pattern pattern) {
        List<RecordRange> blocks = new ArrayList<>();
        int n = lines.size();
        int i = 0;
        while (i < n) {
            if (pattern.matcher(lines.get(i)).find()) {
                int start = i;
                i++;
                while (i < n && !LEVEL_ZERO.matcher(lines.get(i)).find()) {
                    i++;
                }
                blocks.add(new RecordRange(start, i));
            } else {
                i++;
            }
        }
        return blocks;
    }

    /**
     * Ranges of one record type keyed by xref, in order of appearance.
     */
    public Map<String, RecordRange> index(List<String> lines, RecordType type) {
        Map<String, RecordRange> index = new LinkedHashMap<>();
        for (RecordRange range : findBlocks(lines, type.header())) {
            Matcher m = type.header().matcher(lines.get(range.start()));
            if (!m.find()) {
                continue;
            }
            String xref = m.group(1);
            if (index.put(xref, range) != null) {
                logger.warn("Duplicate {} record {} at line {}, later record wins",
                    type.name().toLowerCase(), xref, range.start() + 1);
            }
        }
        logger.debug("Indexed {} {} records", index.size(), type.name().toLowerCase());
        return index;
    }

    /**
     * Text of every NOTE record: the level-0 value with its continuations plus each level-1
     * TEXT, joined by single spaces with line breaks collapsed.
     */
    public Map<String, String> indexNotes(List<String> lines) {
        Map<String, String> notes = new LinkedHashMap<>();
        for (Map.Entry<String, RecordRange> entry : index(lines, RecordType.NOTE).entrySet()) {
            RecordRange range = entry.getValue();
            List<String> parts = new ArrayList<>();
            parts.add(GedLine.valueWithContinuation(lines, range.start()).text());

            int i = range.start() + 1;
            while (i < range.end()) {
                Integer level = GedLine.levelOf(lines.get(i));
                String tag = GedLine.tagAndValue(lines.get(i)).tag();
                if (level != null && level == 1 && "TEXT".equals(tag)) {
                    GedLine.Continuation text = GedLine.valueWithContinuation(lines, i);
                    parts.add(text.text());
                    i = Math.max(text.nextIndex(), i + 1);
                } else {
                    i++;
                }
            }

            StringBuilder joined = new StringBuilder();
            for (String part : parts) {
                String trimmed = part.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (joined.length() > 0) {
                    joined.append(' ');
                }
                joined.append(trimmed);
            }
            notes.put(entry.getKey(), LINE_BREAKS.matcher(joined).replaceAll(" "));
        }
        return notes;
    }
}
