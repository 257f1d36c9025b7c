package im.arun.genreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One extracted value of an individual, e.g. {@code BIRT.DATE} or {@code SOUR.PAGE}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Field {

    @JsonProperty("field_id")
    private String fieldId;

    @JsonProperty("description")
    private String description;

    @JsonProperty("content")
    private String content;
}
