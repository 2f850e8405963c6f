package hvlc.billing.ingest.service;

import hvlc.billing.ingest.model.CanonicalSchema;
import hvlc.billing.ingest.model.ReportTable;
import hvlc.billing.ingest.model.TransformationResult;
import hvlc.billing.ingest.model.TransformationResult.FailureType;
import hvlc.billing.ingest.model.TransformationStep;
import hvlc.billing.ingest.model.ValidationError;
import hvlc.billing.ingest.model.ValidationError.ErrorType;
import hvlc.billing.ingest.transformer.RenameColumnsRule;
import hvlc.billing.ingest.transformer.TransformationRule;
import hvlc.billing.ingest.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ReportTransformerTest {

    @TempDir
    Path tempDir;

    private FormatRegistry registry;
    private TransformationPipelineFactory pipelineFactory;
    private ReportTransformer transformer;

    @BeforeEach
    void setUp() {
        registry = new FormatRegistry(tempDir.resolve("format_registry.json"));
        pipelineFactory = new TransformationPipelineFactory();
        transformer = TestDataFactory.reportTransformer(registry, pipelineFactory);
    }

    @Test
    void testTransform_CreditCardReport() throws IOException {
        // Given
        Path file = TestDataFactory.writeCsv(tempDir, "cc.csv", TestDataFactory.CREDIT_CARD_CSV);

        // When
        TransformationResult result = transformer.transform(file);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFormat()).isEqualTo(FormatRegistry.CREDIT_CARD_PAYMENT);
        assertThat(result.getDetectionConfidence()).isGreaterThan(0.7);
        assertThat(result.getValidationErrors()).isEmpty();

        ReportTable table = result.getTable();
        assertThat(table.getColumnNames()).isEqualTo(CanonicalSchema.COLUMNS);
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getColumn("transaction_date")).containsOnly("2025-01-04");
        assertThat(table.getColumn("cash_applied"))
                .containsExactly(new BigDecimal("55"), new BigDecimal("50"), new BigDecimal("10"));
        assertThat(table.getColumn("payment_type")).containsOnly("credit_card");
        assertThat(table.getColumn("provider_name")).containsOnly("Tammy Maxey");
        assertThat(table.getValue(0, "transaction_id")).isEqualTo("9690");
        assertThat(table.getValue(0, "patient_id")).isEqualTo("Kate Martin");
        assertThat(table.getColumn("insurance_payment")).containsOnly((Object) null);
    }

    @Test
    void testTransform_CreditCardReportWithRepeatedHeader() throws IOException {
        // Given: "Acct Type" appears twice
        String csv = String.join("\n",
                "Trans. #,Trans. Date,Gross Amt,Acct Type,Acct Details,Acct Type,Client Name,Provider",
                "9690,01-04-2025,55,Visa,3563,Credit,Kate Martin,Tammy Maxey",
                "9691,01-04-2025,50,Visa,9416,Credit,Isabel Rehak,Tammy Maxey");
        Path file = TestDataFactory.writeCsv(tempDir, "cc-repeated.csv", csv);

        // When
        TransformationResult result = transformer.transform(file, FormatRegistry.CREDIT_CARD_PAYMENT);

        // Then: columns after the repeat are not shifted
        assertThat(result.isSuccess()).isTrue();
        ReportTable table = result.getTable();
        assertThat(table.getColumn("cash_applied")).containsExactly(new BigDecimal("55"), new BigDecimal("50"));
        assertThat(table.getColumn("provider_name")).containsOnly("Tammy Maxey");
        assertThat(table.getColumn("patient_id")).containsExactly("Kate Martin", "Isabel Rehak");
    }

    @Test
    void testTransform_CreditCardTransformationLog() throws IOException {
        Path file = TestDataFactory.writeCsv(tempDir, "cc.csv", TestDataFactory.CREDIT_CARD_CSV);

        TransformationResult result = transformer.transform(file);

        assertThat(result.getTransformationLog())
                .extracting(TransformationStep::getRule, TransformationStep::getRowsBefore, TransformationStep::getRowsAfter)
                .containsExactly(
                        tuple("rename_columns", 3, 3),
                        tuple("date_format", 3, 3),
                        tuple("number_format", 3, 3),
                        tuple("add_constant", 3, 3));
        TransformationStep constant = result.getTransformationLog().get(3);
        assertThat(constant.getColumnsBefore()).isEqualTo(13);
        assertThat(constant.getColumnsAfter()).isEqualTo(13);
    }

    @Test
    void testTransform_InsuranceReportMergesPayments() throws IOException {
        Path file = TestDataFactory.writeCsv(tempDir, "ins.csv", TestDataFactory.INSURANCE_CLAIMS_CSV);

        TransformationResult result = transformer.transform(file);

        assertThat(result.getFormat()).isEqualTo(FormatRegistry.INSURANCE_CLAIMS);
        assertThat(result.isFailed()).isFalse();
        ReportTable table = result.getTable();
        assertThat(table.getColumn("cash_applied")).containsExactly(
                new BigDecimal("138.61"), new BigDecimal("138.61"), new BigDecimal("20"));
        assertThat(table.getColumn("insurance_payment")).containsExactly(
                new BigDecimal("138.61"), null, new BigDecimal("20"));
        assertThat(table.getColumn("transaction_date")).containsExactly("2025-06-10", null, "2025-05-14");
        assertThat(table.getColumn("payer_name")).containsExactly("Aetna", "Aetna", "Ashley Shumaker");
        assertThat(table.getColumn("payment_type")).containsOnly("insurance");
    }

    @Test
    void testTransform_InsuranceReportFlagsMissingDate() throws IOException {
        // Given: second row has no check date
        Path file = TestDataFactory.writeCsv(tempDir, "ins.csv", TestDataFactory.INSURANCE_CLAIMS_CSV);

        TransformationResult result = transformer.transform(file);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getValidationErrors())
                .extracting(ValidationError::getType, ValidationError::getColumn, ValidationError::getCount)
                .containsExactly(tuple(ErrorType.MISSING_REQUIRED, "transaction_date", 1L));
    }

    @Test
    void testTransform_UnknownLayout() throws IOException {
        Path file = TestDataFactory.writeCsv(tempDir, "unknown.csv", TestDataFactory.UNKNOWN_FORMAT_CSV);

        TransformationResult result = transformer.transform(file);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.DETECTION_FAILED);
        assertThat(result.getError()).isEqualTo("Could not detect file format");
        assertThat(result.getRowCount()).isZero();
        assertThat(result.getDetectionConfidence()).isLessThan(0.5);
    }

    @Test
    void testTransform_FormatWithoutPipeline() throws IOException {
        Path file = TestDataFactory.writeCsv(tempDir, "cc.csv", TestDataFactory.CREDIT_CARD_CSV);

        TransformationResult result = transformer.transform(file, "clinic_export");

        assertThat(result.getFailureType()).isEqualTo(FailureType.PIPELINE_NOT_FOUND);
        assertThat(result.getError()).isEqualTo("No transformation pipeline defined for format clinic_export");
        assertThat(result.getTable().isEmpty()).isTrue();
    }

    @Test
    void testTransform_HendersonvilleContinuationRows() throws IOException {
        // Given: continuation row carries only reference and cash applied
        Path file = TestDataFactory.writeCsv(tempDir, "hvl.csv", TestDataFactory.HENDERSONVILLE_CSV);

        // When: format named explicitly, detection skipped
        TransformationResult result = transformer.transform(file, TransformationPipelineFactory.HENDERSONVILLE_PAYMENTS);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDetectionConfidence()).isNull();
        ReportTable table = result.getTable();
        assertThat(table.getColumn("transaction_date")).containsExactly("2025-06-10", "2025-06-10", "2025-06-12");
        assertThat(table.getColumn("provider_name")).containsExactly("Sidney Snipes", "Sidney Snipes", "Tammy Maxey");
        assertThat(table.getColumn("payer_name")).containsExactly("Aetna", "Aetna", "Cigna");
        assertThat(table.getColumn("cash_applied")).containsExactly(
                new BigDecimal("120.00"), new BigDecimal("80.00"), new BigDecimal("45.50"));
        assertThat(table.hasColumn("check_number")).isFalse();
    }

    @Test
    void testTransform_RuleFailure() throws IOException {
        Path file = TestDataFactory.writeCsv(tempDir, "cc.csv", TestDataFactory.CREDIT_CARD_CSV);
        pipelineFactory.registerPipeline("broken", List.of(
                new RenameColumnsRule(Map.of("Provider", "provider_name")),
                new FailingRule()));

        TransformationResult result = transformer.transform(file, "broken");

        assertThat(result.getFailureType()).isEqualTo(FailureType.EXECUTION_FAILED);
        assertThat(result.getError()).isEqualTo("rule exploded");
        assertThat(result.getFormat()).isEqualTo("broken");
    }

    @Test
    void testTransform_MissingFile() {
        TransformationResult result = transformer.transform(tempDir.resolve("missing.csv"),
                FormatRegistry.CREDIT_CARD_PAYMENT);

        assertThat(result.getFailureType()).isEqualTo(FailureType.EXECUTION_FAILED);
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void testToCanonical_AddsMissingAndDropsExtraColumns() {
        ReportTable table = new ReportTable(List.of("notes", "extra"), List.of(List.of("n", "x")));

        ReportTable canonical = transformer.toCanonical(table);

        assertThat(canonical.getColumnNames()).isEqualTo(CanonicalSchema.COLUMNS);
        assertThat(canonical.getValue(0, "notes")).isEqualTo("n");
        assertThat(canonical.getValue(0, "transaction_id")).isNull();
    }

    private static class FailingRule implements TransformationRule {

        @Override
        public String getName() {
            return "failing";
        }

        @Override
        public String getDescription() {
            return "Always fails";
        }

        @Override
        public ReportTable apply(ReportTable table) {
            throw new IllegalStateException("rule exploded");
        }
    }
}
