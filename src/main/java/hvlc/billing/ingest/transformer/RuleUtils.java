package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Helpers shared by the transformation rules and the validation service.
 *
 * Date handling: values are first tried against a fixed set of unambiguous or
 * US month-first layouts ("automatic" parsing), then against a rule's own
 * explicit formats. All parsing is strict: "yy" takes exactly two digits and
 * "yyyy" at least four, so 6/10/25 and 6/10/2025 never collide.
 */
@Slf4j
public final class RuleUtils {

    private static final List<DateTimeFormatter> AUTOMATIC_DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strictFormatter("yyyy/M/d"),
            strictFormatter("M/d/yyyy"),
            strictFormatter("M-d-yyyy"),
            strictFormatter("M/d/yy"),
            strictFormatter("M-d-yy"));

    private static final List<DateTimeFormatter> AUTOMATIC_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strictFormatter("yyyy-M-d H:mm[:ss]"),
            strictFormatter("M/d/yyyy H:mm[:ss]"),
            strictFormatter("M/d/yyyy h:mm[:ss] a"));

    private RuleUtils() {
    }

    /**
     * Build a strict formatter from a java.time pattern. Year letters are
     * read as proleptic years so strict resolution works without an era.
     */
    public static DateTimeFormatter strictFormatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern.replace('y', 'u'), Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Try the automatic layouts.
     *
     * @return the date, or null if no automatic layout fits
     */
    public static LocalDate parseDateAutomatically(String value) {
        String text = value.trim();
        for (DateTimeFormatter formatter : AUTOMATIC_DATE_FORMATS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                // next layout
            }
        }
        for (DateTimeFormatter formatter : AUTOMATIC_DATE_TIME_FORMATS) {
            try {
                return formatter.parse(text, LocalDateTime::from).toLocalDate();
            } catch (DateTimeParseException e) {
                // next layout
            }
        }
        return null;
    }

    /**
     * Try the given formatters in order.
     *
     * @return the date, or null if none fits
     */
    public static LocalDate parseDate(String value, List<DateTimeFormatter> formatters) {
        String text = value.trim();
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return null;
    }

    /**
     * Parse with the automatic layouts only.
     *
     * @throws DateTimeParseException if no layout fits
     */
    public static LocalDate parseDateStrict(String value) {
        LocalDate date = parseDateAutomatically(value);
        if (date == null) {
            throw new DateTimeParseException("Unknown date format: '" + value + "'", value, 0);
        }
        return date;
    }

    /**
     * @return the columns of {@code wanted} present in the table, in the given
     *         order; absent ones are logged
     */
    public static List<String> presentColumns(ReportTable table, List<String> wanted, String ruleName) {
        List<String> present = new ArrayList<>();
        for (String column : wanted) {
            if (table.hasColumn(column)) {
                present.add(column);
            } else {
                log.warn("{}: column '{}' not found, skipping", ruleName, column);
            }
        }
        return present;
    }

    /**
     * @return true if every non-null value is an instance of the type (and at
     *         least one value is non-null)
     */
    public static boolean allValuesOfType(List<Object> values, Class<?> type) {
        boolean seen = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!type.isInstance(value)) {
                return false;
            }
            seen = true;
        }
        return seen;
    }
}
