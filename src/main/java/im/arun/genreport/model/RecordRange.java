package im.arun.genreport.model;

/**
 * Half-open interval {@code [start, end)} of line indices bounding one level-0 record.
 */
public record RecordRange(int start, int end) {

    public RecordRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid record range [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }
}
