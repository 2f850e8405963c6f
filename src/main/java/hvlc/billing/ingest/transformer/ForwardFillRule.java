package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies the last non-null value down into following null cells. Used for
 * exports that print shared fields only on the first row of a group.
 */
@Slf4j
public class ForwardFillRule implements TransformationRule {

    private final List<String> columns;

    public ForwardFillRule(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public String getName() {
        return "forward_fill";
    }

    @Override
    public String getDescription() {
        return "Forward fill " + columns;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();

        for (String column : RuleUtils.presentColumns(result, columns, getName())) {
            List<Object> filled = new ArrayList<>(result.getColumn(column));
            Object last = null;
            for (int i = 0; i < filled.size(); i++) {
                if (filled.get(i) == null) {
                    filled.set(i, last);
                } else {
                    last = filled.get(i);
                }
            }
            result.setColumn(column, filled);
        }

        return result;
    }
}
