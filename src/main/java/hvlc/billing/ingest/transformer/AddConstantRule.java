package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;

/**
 * Stamps one value on every row of a column, creating it if needed.
 */
public class AddConstantRule implements TransformationRule {

    private final String column;
    private final Object value;

    public AddConstantRule(String column, Object value) {
        this.column = column;
        this.value = value;
    }

    @Override
    public String getName() {
        return "add_constant";
    }

    @Override
    public String getDescription() {
        return "Set " + column + " = " + value;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();
        result.setConstant(column, value);
        return result;
    }
}
