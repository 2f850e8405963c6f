package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DateFormatRuleTest {

    private ReportTable tableOf(String column, Object... values) {
        ReportTable table = new ReportTable();
        table.setColumn(column, new ArrayList<>(Arrays.asList(values)));
        return table;
    }

    @Test
    void testApply_UsMonthFirstLayouts() {
        ReportTable table = tableOf("transaction_date", "01-04-2025", "6/10/25", "5/14/2025");

        ReportTable result = new DateFormatRule(List.of("transaction_date")).apply(table);

        assertThat(result.getColumn("transaction_date")).containsExactly("2025-01-04", "2025-06-10", "2025-05-14");
    }

    @Test
    void testApply_DayFirstFallbackFormat() {
        // 31 is not a month, so the day-first input format is reached
        ReportTable table = tableOf("d", "31-12-2024");

        ReportTable result = new DateFormatRule(List.of("d")).apply(table);

        assertThat(result.getValue(0, "d")).isEqualTo("2024-12-31");
    }

    @Test
    void testApply_DateTimeValue() {
        ReportTable table = tableOf("d", "2025-03-01T10:15:30", "2025-3-1 16:05");

        ReportTable result = new DateFormatRule(List.of("d")).apply(table);

        assertThat(result.getColumn("d")).containsExactly("2025-03-01", "2025-03-01");
    }

    @Test
    void testApply_UnparseableBecomesNull() {
        ReportTable table = tableOf("d", "not a date", null, "2025-02-30");

        ReportTable result = new DateFormatRule(List.of("d")).apply(table);

        assertThat(result.getColumn("d")).containsExactly(null, null, null);
    }

    @Test
    void testApply_IsIdempotent() {
        DateFormatRule rule = new DateFormatRule(List.of("d"));
        ReportTable once = rule.apply(tableOf("d", "6/10/25", "01-04-2025"));

        ReportTable twice = rule.apply(once);

        assertThat(twice.getColumn("d")).isEqualTo(once.getColumn("d"));
    }

    @Test
    void testApply_LocalDateValueAndCustomOutput() {
        DateFormatRule rule = new DateFormatRule(List.of("d"), List.of("dd.MM.yyyy"), "MM/dd/yyyy");
        ReportTable table = tableOf("d", LocalDate.of(2025, 7, 4), "24.12.2024");

        ReportTable result = rule.apply(table);

        assertThat(result.getColumn("d")).containsExactly("07/04/2025", "12/24/2024");
    }

    @Test
    void testApply_MissingColumnSkippedAndInputUntouched() {
        ReportTable table = tableOf("other", "6/10/25");

        ReportTable result = new DateFormatRule(List.of("d")).apply(table);

        assertThat(result.getColumnNames()).containsExactly("other");
        assertThat(result).isNotSameAs(table);
        assertThat(table.getValue(0, "other")).isEqualTo("6/10/25");
    }
}
