package im.arun.genreport.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Top-level structure of the JSON report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportExport {

    @JsonProperty("source")
    private String source;

    @JsonProperty("root")
    private String root;

    @JsonProperty("identifiers")
    private Map<String, Integer> identifiers;

    @JsonProperty("individuals")
    private List<IndividualView> individuals;
}
