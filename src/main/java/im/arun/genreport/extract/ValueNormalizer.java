package im.arun.genreport.extract;

/**
 * Content transforms applied to extracted values, one per value family.
 */
public interface ValueNormalizer {

    /**
     * Leaves values as extracted (continuation-joined), only trimming surrounding whitespace.
     */
    ValueNormalizer RAW = new ValueNormalizer() {
        @Override
        public String text(String raw) {
            return raw == null ? "" : raw.strip();
        }

        @Override
        public String place(String raw) {
            return raw == null ? "" : raw.strip();
        }

        @Override
        public String date(String raw) {
            return raw == null ? "" : raw.strip();
        }
    };

    String text(String raw);

    String place(String raw);

    String date(String raw);
}
