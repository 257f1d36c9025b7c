package im.arun.genreport.model;

import java.util.List;
import java.util.Optional;

/**
 * Members of one FAM record. Husband and wife are null when the record does not name them;
 * children keep the order of their CHIL lines.
 */
public record FamilyRecord(String xref, String husband, String wife, List<String> children) {

    public FamilyRecord {
        children = List.copyOf(children);
    }

    public boolean hasSpouse(String indiXref) {
        return indiXref != null && (indiXref.equals(husband) || indiXref.equals(wife));
    }

    /**
     * The spouse on the other side of {@code indiXref}, if {@code indiXref} is one of the two.
     */
    public Optional<String> otherSpouse(String indiXref) {
        if (indiXref == null) {
            return Optional.empty();
        }
        if (indiXref.equals(husband)) {
            return Optional.ofNullable(wife);
        }
        if (indiXref.equals(wife)) {
            return Optional.ofNullable(husband);
        }
        return Optional.empty();
    }
}
