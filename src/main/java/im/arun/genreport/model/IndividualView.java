package im.arun.genreport.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything extracted for one individual. Computed on demand from the document, never cached.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndividualView {

    @JsonProperty("xref")
    private String xref;

    @JsonProperty("id_number")
    private String idNumber;

    @JsonProperty("name")
    private NameParts name;

    @JsonProperty("birth_year")
    private String birthYear;

    @JsonProperty("death_year")
    private String deathYear;

    @JsonProperty("header")
    private String header;

    @JsonProperty("fields")
    private List<Field> fields;

    @JsonProperty("relations")
    private List<Relation> relations;
}
