package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalizes date columns to a single output layout.
 *
 * Each non-null value is tried against the automatic layouts first, then
 * against the explicit input formats in order; the first success wins.
 * Values nothing can parse become null. Already-normalized values parse back
 * to themselves, so applying the rule twice changes nothing.
 */
@Slf4j
public class DateFormatRule implements TransformationRule {

    public static final String DEFAULT_OUTPUT_FORMAT = "yyyy-MM-dd";

    public static final List<String> DEFAULT_INPUT_FORMATS = List.of(
            "M/d/yy", "M/d/yyyy", "M-d-yyyy", "M-d-yy",
            "yyyy-M-d", "yyyy/M/d", "d-M-yyyy", "d/M/yyyy");

    private final List<String> columns;
    private final List<String> inputFormats;
    private final String outputFormat;
    private final List<DateTimeFormatter> inputFormatters;
    private final DateTimeFormatter outputFormatter;

    public DateFormatRule(List<String> columns) {
        this(columns, DEFAULT_INPUT_FORMATS, DEFAULT_OUTPUT_FORMAT);
    }

    /**
     * @param columns columns to normalize
     * @param inputFormats java.time patterns tried after automatic parsing
     * @param outputFormat java.time pattern of the output strings
     * @throws IllegalArgumentException if a pattern is invalid
     */
    public DateFormatRule(List<String> columns, List<String> inputFormats, String outputFormat) {
        this.columns = List.copyOf(columns);
        this.inputFormats = List.copyOf(inputFormats);
        this.outputFormat = outputFormat;

        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String format : inputFormats) {
            formatters.add(RuleUtils.strictFormatter(format));
        }
        this.inputFormatters = Collections.unmodifiableList(formatters);
        this.outputFormatter = DateTimeFormatter.ofPattern(outputFormat);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getInputFormats() {
        return inputFormats;
    }

    @Override
    public String getName() {
        return "date_format";
    }

    @Override
    public String getDescription() {
        return "Format dates in " + columns + " as " + outputFormat;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();

        for (String column : RuleUtils.presentColumns(result, columns, getName())) {
            List<Object> values = result.getColumn(column);
            List<Object> formatted = new ArrayList<>(values.size());
            int failed = 0;

            for (Object value : values) {
                if (value == null) {
                    formatted.add(null);
                    continue;
                }
                LocalDate date = toDate(value);
                if (date == null) {
                    failed++;
                    formatted.add(null);
                } else {
                    formatted.add(date.format(outputFormatter));
                }
            }

            if (failed > 0) {
                log.warn("Could not parse {} values in date column '{}', set to null", failed, column);
            }
            result.setColumn(column, formatted);
        }

        return result;
    }

    private LocalDate toDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        String text = value.toString();
        if (text.trim().isEmpty()) {
            return null;
        }
        LocalDate date = RuleUtils.parseDateAutomatically(text);
        if (date == null) {
            date = RuleUtils.parseDate(text, inputFormatters);
        }
        return date;
    }
}
