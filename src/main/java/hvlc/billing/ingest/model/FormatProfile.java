package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import hvlc.billing.ingest.util.StringSimilarity;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Descriptor of one known billing report layout.
 *
 * Serialized to the format registry as:
 * <pre>
 * {
 *   "name": "credit_card_payment",
 *   "description": "...",
 *   "header_patterns": {"transaction_date": ["trans.?\\s*date", "date"]},
 *   "column_mappings": {"Trans. Date": "transaction_date"},
 *   "sample_values": {}, "data_types": {}, "metadata": {}
 * }
 * </pre>
 *
 * Mapping order matters: header patterns are evaluated in insertion order and
 * the first matching canonical column wins.
 */
@Data
@NoArgsConstructor
@Slf4j
public class FormatProfile {

    public static final double EXACT_MATCH_SCORE = 1.0;
    public static final double PATTERN_MATCH_SCORE = 0.9;
    public static final double SIMILARITY_THRESHOLD = 0.7;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("header_patterns")
    private Map<String, List<String>> headerPatterns = new LinkedHashMap<>();

    @JsonProperty("column_mappings")
    private Map<String, String> columnMappings = new LinkedHashMap<>();

    @JsonProperty("sample_values")
    private Map<String, List<String>> sampleValues = new LinkedHashMap<>();

    @JsonProperty("data_types")
    private Map<String, String> dataTypes = new LinkedHashMap<>();

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public FormatProfile(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public FormatProfile(String name, String description,
                         Map<String, List<String>> headerPatterns,
                         Map<String, String> columnMappings) {
        this(name, description);
        setHeaderPatterns(headerPatterns);
        setColumnMappings(columnMappings);
    }

    /**
     * Deep copy of the mapping tables; metadata values are shared.
     */
    public FormatProfile(FormatProfile other) {
        this(other.name, other.description);
        other.headerPatterns.forEach((column, patterns) -> headerPatterns.put(column, copyOf(patterns)));
        columnMappings.putAll(other.columnMappings);
        other.sampleValues.forEach((column, values) -> sampleValues.put(column, copyOf(values)));
        dataTypes.putAll(other.dataTypes);
        metadata.putAll(other.metadata);
    }

    public String getDescription() {
        return description != null ? description : "Format profile for " + name;
    }

    public void setHeaderPatterns(Map<String, List<String>> headerPatterns) {
        this.headerPatterns = headerPatterns != null ? new LinkedHashMap<>(headerPatterns) : new LinkedHashMap<>();
    }

    public void setColumnMappings(Map<String, String> columnMappings) {
        this.columnMappings = columnMappings != null ? new LinkedHashMap<>(columnMappings) : new LinkedHashMap<>();
    }

    public void setSampleValues(Map<String, List<String>> sampleValues) {
        this.sampleValues = sampleValues != null ? new LinkedHashMap<>(sampleValues) : new LinkedHashMap<>();
    }

    public void setDataTypes(Map<String, String> dataTypes) {
        this.dataTypes = dataTypes != null ? new LinkedHashMap<>(dataTypes) : new LinkedHashMap<>();
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    /**
     * Match one source header to a canonical column.
     *
     * Priority (first hit wins, scores are not blended):
     * 1. exact entry in column_mappings → score 1.0
     * 2. any header pattern found in the header (case-insensitive) → score 0.9
     * 3. best similarity between the lowercased header and the pattern keys,
     *    accepted only above 0.7
     *
     * @param header source header as it appears in the file
     * @return the match, or {@link ColumnMatch#none()}
     */
    public ColumnMatch matchColumn(String header) {
        if (header == null) {
            return ColumnMatch.none();
        }

        String mapped = columnMappings.get(header);
        if (mapped != null) {
            return new ColumnMatch(mapped, EXACT_MATCH_SCORE);
        }

        for (Map.Entry<String, List<String>> entry : headerPatterns.entrySet()) {
            for (String pattern : entry.getValue()) {
                if (patternFound(pattern, header)) {
                    return new ColumnMatch(entry.getKey(), PATTERN_MATCH_SCORE);
                }
            }
        }

        String lowered = header.toLowerCase(Locale.ROOT);
        String bestColumn = null;
        double bestScore = 0.0;
        for (String canonicalColumn : headerPatterns.keySet()) {
            double similarity = StringSimilarity.ratio(lowered, canonicalColumn.toLowerCase(Locale.ROOT));
            if (similarity > bestScore) {
                bestScore = similarity;
                bestColumn = canonicalColumn;
            }
        }

        if (bestScore > SIMILARITY_THRESHOLD) {
            return new ColumnMatch(bestColumn, bestScore);
        }
        return ColumnMatch.none();
    }

    private static List<String> copyOf(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private boolean patternFound(String pattern, String header) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(header).find();
        } catch (PatternSyntaxException e) {
            log.warn("Skipping invalid header pattern '{}' in profile {}: {}", pattern, name, e.getDescription());
            return false;
        }
    }
}
