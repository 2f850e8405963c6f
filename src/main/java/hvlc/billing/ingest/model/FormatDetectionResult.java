package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one format detection call. A null format name means the file
 * was not recognized; the metadata then explains why.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormatDetectionResult {

    @JsonProperty("format_name")
    private String formatName;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("column_map")
    private Map<String, String> columnMap = new LinkedHashMap<>();

    @JsonProperty("confidence_scores")
    private Map<String, Double> confidenceScores = new LinkedHashMap<>();

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static FormatDetectionResult unrecognized(double confidence, Map<String, Object> metadata) {
        return new FormatDetectionResult(null, confidence, new LinkedHashMap<>(), new LinkedHashMap<>(),
                new LinkedHashMap<>(metadata));
    }

    public static FormatDetectionResult failed(String error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", error);
        return unrecognized(0.0, metadata);
    }

    @JsonIgnore
    public boolean isRecognized() {
        return formatName != null;
    }

    /**
     * Human-readable summary, one line per mapped column.
     */
    @JsonIgnore
    public String getSummary() {
        if (formatName == null) {
            return "No format detected";
        }

        StringBuilder summary = new StringBuilder();
        summary.append(String.format(Locale.ROOT, "Detected format: %s (confidence: %.2f)%n", formatName, confidence));
        summary.append("Column mapping:").append(System.lineSeparator());
        for (Map.Entry<String, String> entry : columnMap.entrySet()) {
            double score = confidenceScores.getOrDefault(entry.getKey(), 0.0);
            summary.append(String.format(Locale.ROOT, "  %s -> %s (confidence: %.2f)%n",
                    entry.getKey(), entry.getValue(), score));
        }
        return summary.toString();
    }
}
