package im.arun.genreport.model;

public enum RelationKind {
    PARENT("parent"),
    SPOUSE("spouse"),
    CHILD("child");

    private final String description;

    RelationKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
