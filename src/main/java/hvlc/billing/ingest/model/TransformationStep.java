package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit entry for one rule of a pipeline run: table shape before and after.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransformationStep {

    @JsonProperty("rule")
    private String rule;

    @JsonProperty("description")
    private String description;

    @JsonProperty("rows_before")
    private int rowsBefore;

    @JsonProperty("columns_before")
    private int columnsBefore;

    @JsonProperty("rows_after")
    private int rowsAfter;

    @JsonProperty("columns_after")
    private int columnsAfter;
}
