package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts currency-like text ("$1,234.50", "(20)", "15%") to BigDecimal.
 * Values still unparseable after stripping become null.
 */
@Slf4j
public class NumberFormatRule implements TransformationRule {

    private static final Pattern FORMATTING_CHARACTERS = Pattern.compile("[$,()%]");

    private final List<String> columns;

    public NumberFormatRule(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String getName() {
        return "number_format";
    }

    @Override
    public String getDescription() {
        return "Convert " + columns + " to numbers";
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();

        for (String column : RuleUtils.presentColumns(result, columns, getName())) {
            List<Object> values = result.getColumn(column);
            if (RuleUtils.allValuesOfType(values, BigDecimal.class)) {
                continue;
            }

            List<Object> converted = new ArrayList<>(values.size());
            int failed = 0;
            for (Object value : values) {
                if (value == null || value instanceof BigDecimal) {
                    converted.add(value);
                    continue;
                }
                BigDecimal number = parseNumber(value.toString());
                if (number == null && !value.toString().trim().isEmpty()) {
                    failed++;
                }
                converted.add(number);
            }

            if (failed > 0) {
                log.warn("Could not convert {} values in column '{}' to numbers, set to null", failed, column);
            }
            result.setColumn(column, converted);
        }

        return result;
    }

    /**
     * @return the number, or null if the cleaned text is empty or not numeric
     */
    public static BigDecimal parseNumber(String text) {
        String cleaned = FORMATTING_CHARACTERS.matcher(text).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
