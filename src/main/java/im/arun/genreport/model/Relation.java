package im.arun.genreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A parent, spouse or child of an individual. The target is carried as its header line
 * ("Name YYYY-YYYY, 123"), not as a reference.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Relation {

    @JsonProperty("kind")
    private RelationKind kind;

    @JsonProperty("description")
    private String description;

    @JsonProperty("target_line")
    private String targetLine;
}
