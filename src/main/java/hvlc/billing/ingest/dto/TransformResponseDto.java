package hvlc.billing.ingest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import hvlc.billing.ingest.model.TransformationResult;
import hvlc.billing.ingest.model.TransformationStep;
import hvlc.billing.ingest.model.ValidationError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for an uploaded report transformation.
 * Carries the transformation metadata and the first rows of the canonical table.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransformResponseDto {

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("format")
    private String format;

    @JsonProperty("detection_confidence")
    private Double detectionConfidence;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("failure_type")
    private TransformationResult.FailureType failureType;

    @JsonProperty("error")
    private String error;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("column_count")
    private int columnCount;

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("transformation_log")
    private List<TransformationStep> transformationLog = new ArrayList<>();

    @JsonProperty("validation_errors")
    private List<ValidationError> validationErrors = new ArrayList<>();

    @JsonProperty("preview")
    private List<Map<String, Object>> preview = new ArrayList<>();

    /**
     * Build the response for a transformation result.
     *
     * @param result transformation outcome
     * @param fileName name of the uploaded file
     * @param previewRows number of canonical rows to include
     */
    public static TransformResponseDto from(TransformationResult result, String fileName, int previewRows) {
        TransformResponseDto dto = new TransformResponseDto();
        dto.setFileName(fileName);
        dto.setFormat(result.getFormat());
        dto.setDetectionConfidence(result.getDetectionConfidence());
        dto.setSuccess(result.isSuccess());
        dto.setFailureType(result.getFailureType());
        dto.setError(result.getError());
        dto.setRowCount(result.getRowCount());
        dto.setColumnCount(result.getColumnCount());
        dto.setColumns(result.getTable().getColumnNames());
        dto.setTransformationLog(result.getTransformationLog());
        dto.setValidationErrors(result.getValidationErrors());
        dto.setPreview(result.getTable().getRows(Math.max(previewRows, 0)));
        return dto;
    }
}
