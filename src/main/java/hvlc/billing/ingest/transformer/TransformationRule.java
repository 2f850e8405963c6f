package hvlc.billing.ingest.transformer;

import hvlc.billing.ingest.model.ReportTable;

/**
 * One declarative cleaning step of a report pipeline.
 *
 * Rules are immutable and configured at construction. A pipeline is an
 * ordered list of rules bound to one format name, see
 * {@code TransformationPipelineFactory}.
 *
 * Implementations must never modify the table they are given: they work on
 * {@link ReportTable#copy()} and return the copy. A column a rule refers to
 * that is absent from the table is logged and skipped, never an error.
 */
public interface TransformationRule {

    /**
     * @return short machine name, e.g. "rename_columns"
     */
    String getName();

    /**
     * @return human-readable description used in the transformation log
     */
    String getDescription();

    /**
     * Apply the rule.
     *
     * @param table input table, left untouched
     * @return a new table with the rule applied
     */
    ReportTable apply(ReportTable table);
}
