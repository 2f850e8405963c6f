package hvlc.billing.ingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data-quality finding on a transformed table.
 * Findings annotate a transformation, they never abort it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationError {

    public enum ErrorType {
        MISSING_REQUIRED("missing_required"), // Required column holds nulls
        NEGATIVE_VALUES("negative_values"), // Amount below zero
        DATE_FORMAT("date_format"); // Date column does not parse

        private final String code;

        ErrorType(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    @JsonProperty("type")
    private ErrorType type;

    @JsonProperty("column")
    private String column;

    @JsonProperty("count")
    private Long count;

    @JsonProperty("message")
    private String message;
}
