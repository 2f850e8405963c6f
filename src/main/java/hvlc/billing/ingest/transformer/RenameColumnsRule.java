package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renames source headers to canonical column names. Mappings whose source
 * column is absent are ignored.
 */
@Slf4j
public class RenameColumnsRule implements TransformationRule {

    private final Map<String, String> mappings;

    public RenameColumnsRule(Map<String, String> mappings) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    public Map<String, String> getMappings() {
        return mappings;
    }

    @Override
    public String getName() {
        return "rename_columns";
    }

    @Override
    public String getDescription() {
        return "Rename columns " + mappings;
    }

    @Override
    public ReportTable apply(ReportTable table) {
        ReportTable result = table.copy();

        Map<String, String> applicable = new LinkedHashMap<>();
        mappings.forEach((source, target) -> {
            if (result.hasColumn(source)) {
                applicable.put(source, target);
            }
        });

        if (applicable.isEmpty()) {
            log.warn("No columns to rename, none of {} present in {}", mappings.keySet(), result.getColumnNames());
            return result;
        }

        result.renameColumns(applicable);
        log.debug("Renamed {} of {} mapped columns", applicable.size(), mappings.size());
        return result;
    }
}
