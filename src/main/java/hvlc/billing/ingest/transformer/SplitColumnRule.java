package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one column into several using the capture groups of a regex.
 * Group i feeds target i; targets beyond the group count are not created.
 */
@Slf4j
public class SplitColumnRule implements TransformationRule {

    private final String sourceColumn;
    private final List<String> targetColumns;
    private final Pattern pattern;

    /**
     * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
     */
    public SplitColumnRule(String sourceColumn, List<String> targetColumns, String pattern) {
        this.sourceColumn = sourceColumn;
        this.targetColumns = List.copyOf(targetColumns);
        this.pattern = Pattern.compile(pattern);
    }

    @Override
    public String getName() {
        return "split_column";
    }

    @Override
    public String getDescription() {
        return "Split " + sourceColumn + " into " + targetColumns;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();
        if (!result.hasColumn(sourceColumn)) {
            log.warn("Split source column '{}' not found, skipping", sourceColumn);
            return result;
        }

        int targets = Math.min(targetColumns.size(), pattern.matcher("").groupCount());
        List<List<Object>> split = new ArrayList<>();
        for (int i = 0; i < targets; i++) {
            split.add(new ArrayList<>(result.getRowCount()));
        }

        for (Object value : result.getColumn(sourceColumn)) {
            Matcher matcher = value != null ? pattern.matcher(value.toString()) : null;
            boolean found = matcher != null && matcher.find();
            for (int i = 0; i < targets; i++) {
                split.get(i).add(found ? matcher.group(i + 1) : null);
            }
        }

        for (int i = 0; i < targets; i++) {
            result.setColumn(targetColumns.get(i), split.get(i));
        }
        return result;
    }
}
