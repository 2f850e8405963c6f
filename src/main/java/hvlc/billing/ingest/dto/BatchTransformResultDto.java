package hvlc.billing.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * DTO for a directory batch run
 * Counts per outcome plus one entry per file found
 */
@Data
@NoArgsConstructor
public class BatchTransformResultDto {

    @JsonProperty("directory")
    private String directory;

    @JsonProperty("processing_status")
    private String processingStatus; // SUCCESS, PARTIAL_SUCCESS, FAILED

    @JsonProperty("files_found")
    private int filesFound;

    @JsonProperty("files_recognized")
    private int filesRecognized;

    @JsonProperty("files_transformed")
    private int filesTransformed;

    @JsonProperty("files_validated")
    private int filesValidated;

    @JsonProperty("files_failed")
    private int filesFailed;

    @JsonProperty("total_rows")
    private long totalRows;

    @JsonProperty("processing_start_time")
    private LocalDateTime processingStartTime;

    @JsonProperty("processing_end_time")
    private LocalDateTime processingEndTime;

    @JsonProperty("processing_duration_ms")
    private long processingDurationMs;

    @JsonProperty("file_results")
    private List<FileTransformResult> fileResults = new ArrayList<>();

    // Inner class for individual file results
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileTransformResult {
        @JsonProperty("filename")
        private String filename;

        @JsonProperty("format")
        private String format;

        @JsonProperty("status")
        private String status; // SUCCESS, VALIDATION_ERRORS, FAILED

        @JsonProperty("detection_confidence")
        private Double detectionConfidence;

        @JsonProperty("row_count")
        private int rowCount;

        @JsonProperty("validation_error_count")
        private int validationErrorCount;

        @JsonProperty("processing_time_ms")
        private long processingTimeMs;

        @JsonProperty("error_message")
        private String errorMessage;
    }
}
