package im.arun.genreport.ged;

import java.util.regex.Pattern;

/**
 * Level-0 record kinds the indexer knows, each matched by xref prefix and type keyword.
 */
public enum RecordType {
    INDIVIDUAL("I", "INDI"),
    FAMILY("F", "FAM"),
    NOTE("N", "NOTE");

    private final Pattern header;

    RecordType(String xrefPrefix, String keyword) {
        this.header = Pattern.compile("^\\s*0\\s+(@" + xrefPrefix + "[^@]*@)\\s+" + keyword + "\\b");
    }

    /**
     * Pattern for the record's level-0 line; group 1 is the xref.
     */
    public Pattern header() {
        return header;
    }
}
