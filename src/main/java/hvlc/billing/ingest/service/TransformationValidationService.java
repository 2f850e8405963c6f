package hvlc.billing.ingest.service;

import hvlc.billing.ingest.model.CanonicalSchema;
import hvlc.billing.ingest.model.ReportTable;
import hvlc.billing.ingest.model.ValidationError;
import hvlc.billing.ingest.model.ValidationError.ErrorType;
import hvlc.billing.ingest.transformer.RuleUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Data-quality checks over a canonical table.
 *
 * Checks:
 * - missing_required: nulls in transaction_date, cash_applied or provider_name
 * - negative_values: cash_applied below zero
 * - date_format: text in a date column that does not parse as a date
 *
 * Findings annotate the result; they never stop a transformation. Each one is
 * also written to the DATA_QUALITY logger for the data-quality report.
 */
@Service
@Slf4j
public class TransformationValidationService {

    private static final Logger dataQualityLogger = LoggerFactory.getLogger("DATA_QUALITY");

    private static final String TABLE_NAME = "transformed_data";

    /**
     * Validate a canonical table.
     *
     * @param table table in canonical shape (missing columns are skipped)
     * @return findings, empty when the table is clean
     */
    public List<ValidationError> validate(ReportTable table) {
        List<ValidationError> errors = new ArrayList<>();

        for (String column : CanonicalSchema.REQUIRED_COLUMNS) {
            if (!table.hasColumn(column)) {
                continue;
            }
            long missing = table.getColumn(column).stream().filter(value -> value == null).count();
            if (missing > 0) {
                errors.add(new ValidationError(ErrorType.MISSING_REQUIRED, column, missing,
                        String.format("Missing %d values in required column %s", missing, column)));
            }
        }

        if (table.hasColumn(CanonicalSchema.CASH_APPLIED)) {
            long negative = table.getColumn(CanonicalSchema.CASH_APPLIED).stream()
                    .filter(this::isNegative)
                    .count();
            if (negative > 0) {
                errors.add(new ValidationError(ErrorType.NEGATIVE_VALUES, CanonicalSchema.CASH_APPLIED, negative,
                        String.format("Found %d negative values in cash_applied column", negative)));
            }
        }

        for (String column : CanonicalSchema.DATE_COLUMNS) {
            if (!table.hasColumn(column)) {
                continue;
            }
            ValidationError dateError = checkDates(table, column);
            if (dateError != null) {
                errors.add(dateError);
            }
        }

        for (ValidationError error : errors) {
            logDataQualityIssue(error, table.getRowCount());
        }
        if (!errors.isEmpty()) {
            log.warn("Validation found {} issues in {} rows", errors.size(), table.getRowCount());
        }

        return errors;
    }

    /**
     * Strict parse of the non-null text values; only the first failure is reported.
     */
    private ValidationError checkDates(ReportTable table, String column) {
        for (Object value : table.getColumn(column)) {
            if (value == null || value instanceof LocalDate) {
                continue;
            }
            try {
                RuleUtils.parseDateStrict(value.toString());
            } catch (DateTimeParseException e) {
                return new ValidationError(ErrorType.DATE_FORMAT, column, null,
                        String.format("Date format issues in %s: %s", column, e.getMessage()));
            }
        }
        return null;
    }

    private boolean isNegative(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() < 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() < 0;
        }
        return false;
    }

    private void logDataQualityIssue(ValidationError error, int rowCount) {
        long affected = error.getCount() != null ? error.getCount() : rowCount;
        dataQualityLogger.warn("{}.{}: {} ({} rows affected)", TABLE_NAME, error.getColumn(), error.getMessage(), affected);
    }
}
