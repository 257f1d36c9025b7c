package im.arun.genreport.model;

public enum Gender {
    MALE("M"),
    FEMALE("F"),
    UNKNOWN("");

    private final String code;

    Gender(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Gender fromCode(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value.trim().toUpperCase()) {
            case "M":
                return MALE;
            case "F":
                return FEMALE;
            default:
                return UNKNOWN;
        }
    }
}
