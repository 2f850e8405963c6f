package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Combines several source columns into one target column, row by row.
 *
 * The merge function receives the row's source values (source order, absent
 * columns as null). The default keeps the first non-null value, so source
 * order is priority order.
 */
@Slf4j
public class MergeColumnsRule implements TransformationRule {

    private final List<String> sourceColumns;
    private final String targetColumn;
    private final Function<Map<String, Object>, Object> mergeFunction;

    public MergeColumnsRule(List<String> sourceColumns, String targetColumn) {
        this(sourceColumns, targetColumn, MergeColumnsRule::firstNonNull);
    }

    public MergeColumnsRule(List<String> sourceColumns, String targetColumn,
                            Function<Map<String, Object>, Object> mergeFunction) {
        this.sourceColumns = List.copyOf(sourceColumns);
        this.targetColumn = targetColumn;
        this.mergeFunction = mergeFunction;
    }

    public List<String> getSourceColumns() {
        return sourceColumns;
    }

    public String getTargetColumn() {
        return targetColumn;
    }

    @Override
    public String getName() {
        return "merge_columns";
    }

    @Override
    public String getDescription() {
        return "Merge " + sourceColumns + " into " + targetColumn;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();

        List<String> present = new ArrayList<>();
        for (String column : sourceColumns) {
            if (result.hasColumn(column)) {
                present.add(column);
            }
        }
        if (present.isEmpty()) {
            log.warn("None of the merge source columns {} found, skipping", sourceColumns);
            return result;
        }

        List<Object> merged = new ArrayList<>(result.getRowCount());
        for (int row = 0; row < result.getRowCount(); row++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : sourceColumns) {
                values.put(column, present.contains(column) ? result.getValue(row, column) : null);
            }
            merged.add(mergeFunction.apply(values));
        }

        result.setColumn(targetColumn, merged);
        return result;
    }

    static Object firstNonNull(Map<String, Object> values) {
        for (Object value : values.values()) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
