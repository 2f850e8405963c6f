package hvlc.billing.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hvlc.billing.ingest.util.CorrelationIdUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body for rejected uploads, unknown formats and processing failures.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponseDto {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    @JsonProperty("correlation_id")
    private String correlationId;

    /**
     * Stamped with the current time and the request's correlation ID, if any.
     */
    public ErrorResponseDto(String error, String message) {
        this(error, message, LocalDateTime.now(),
                CorrelationIdUtil.hasCorrelationId() ? CorrelationIdUtil.getCurrentCorrelationId() : null);
    }
}
