package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score of one sampled file against one registered profile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileMatch {

    @JsonProperty("format")
    private String formatName;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("column_map")
    private Map<String, String> columnMap = new LinkedHashMap<>();

    @JsonProperty("confidence_scores")
    private Map<String, Double> confidenceScores = new LinkedHashMap<>();

    @JsonProperty("matched_columns")
    private int matchedColumns;

    @JsonProperty("total_columns")
    private int totalColumns;
}
