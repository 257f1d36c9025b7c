package im.arun.genreport.model;

import java.util.Comparator;

/**
 * Sort key for "oldest first" ordering. Unknown components are {@link #UNKNOWN}, so partial
 * or missing birth dates sort after fully known ones.
 */
public record BirthDateKey(int year, int month, int day) implements Comparable<BirthDateKey> {

    public static final int UNKNOWN = 9999;
    public static final BirthDateKey MISSING = new BirthDateKey(UNKNOWN, UNKNOWN, UNKNOWN);

    private static final Comparator<BirthDateKey> ORDER = Comparator
        .comparingInt(BirthDateKey::year)
        .thenComparingInt(BirthDateKey::month)
        .thenComparingInt(BirthDateKey::day);

    @Override
    public int compareTo(BirthDateKey other) {
        return ORDER.compare(this, other);
    }
}
