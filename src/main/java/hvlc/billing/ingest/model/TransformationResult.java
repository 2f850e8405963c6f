package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical table produced from one report file plus its diagnostics.
 *
 * Failures are encoded here rather than thrown: a failed transformation has
 * an empty table, a {@link FailureType} and an error message. A successful
 * transformation may still carry validation errors, in which case
 * {@code success} is false but the table is populated.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransformationResult {

    public enum FailureType {
        DETECTION_FAILED, // Format could not be recognized
        PIPELINE_NOT_FOUND, // Format known but no curated pipeline
        EXECUTION_FAILED // I/O, parse or rule failure
    }

    @JsonIgnore
    private ReportTable table = ReportTable.empty();

    @JsonProperty("format")
    private String format;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("detection_confidence")
    private Double detectionConfidence;

    @JsonProperty("failure_type")
    private FailureType failureType;

    @JsonProperty("error")
    private String error;

    @JsonProperty("transformation_log")
    private List<TransformationStep> transformationLog = new ArrayList<>();

    @JsonProperty("validation_errors")
    private List<ValidationError> validationErrors = new ArrayList<>();

    @JsonProperty("success")
    private boolean success;

    public static TransformationResult failure(String filePath, String format,
                                               FailureType failureType, String error) {
        TransformationResult result = new TransformationResult();
        result.setFilePath(filePath);
        result.setFormat(format);
        result.setFailureType(failureType);
        result.setError(error);
        result.setSuccess(false);
        return result;
    }

    @JsonIgnore
    public boolean isFailed() {
        return failureType != null;
    }

    @JsonProperty("row_count")
    public int getRowCount() {
        return table.getRowCount();
    }

    @JsonProperty("column_count")
    public int getColumnCount() {
        return table.getColumnCount();
    }
}
