package im.arun.genreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Name components of an individual. Absent parts are empty strings, never null.
 */
public record NameParts(
    @JsonProperty("given") String given,
    @JsonProperty("nickname") String nickname,
    @JsonProperty("surname") String surname,
    @JsonProperty("prefix") String prefix,
    @JsonProperty("suffix") String suffix
) {
    public static final NameParts EMPTY = new NameParts("", "", "", "", "");

    public NameParts {
        given = given == null ? "" : given;
        nickname = nickname == null ? "" : nickname;
        surname = surname == null ? "" : surname;
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }
}
