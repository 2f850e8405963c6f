package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RenameColumnsRuleTest {

    @Test
    void testApply_RenamesPresentColumnsOnly() {
        ReportTable table = new ReportTable(List.of("Trans. Date", "Net Amt"), List.of(List.of("01-04-2025", "53.06")));
        Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("Trans. Date", "transaction_date");
        mappings.put("Gross Amt", "cash_applied");

        ReportTable result = new RenameColumnsRule(mappings).apply(table);

        assertThat(result.getColumnNames()).containsExactly("transaction_date", "Net Amt");
        assertThat(result.getValue(0, "transaction_date")).isEqualTo("01-04-2025");
        assertThat(table.getColumnNames()).containsExactly("Trans. Date", "Net Amt");
    }

    @Test
    void testApply_NothingToRename() {
        ReportTable table = new ReportTable(List.of("a"), List.of(List.of("1")));

        ReportTable result = new RenameColumnsRule(Map.of("b", "c")).apply(table);

        assertThat(result.getColumnNames()).containsExactly("a");
    }
}
