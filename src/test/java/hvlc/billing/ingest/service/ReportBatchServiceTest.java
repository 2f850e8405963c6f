package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.IngestConfig;
import hvlc.billing.ingest.dto.BatchTransformResultDto;
import hvlc.billing.ingest.dto.BatchTransformResultDto.FileTransformResult;
import hvlc.billing.ingest.util.CorrelationIdUtil;
import hvlc.billing.ingest.util.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ReportBatchServiceTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private ReportBatchService batchService;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("input"));
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));
        batchService = new ReportBatchService(TestDataFactory.reportTransformer(registry), new IngestConfig());
    }

    @AfterEach
    void tearDown() {
        CorrelationIdUtil.clearCorrelationId();
    }

    @Test
    void testTransformDirectory_MixedFiles() throws IOException {
        // Given
        TestDataFactory.writeCsv(inputDir, "a_credit_card.csv", TestDataFactory.CREDIT_CARD_CSV);
        TestDataFactory.writeCsv(inputDir, "b_insurance.csv", TestDataFactory.INSURANCE_CLAIMS_CSV);
        TestDataFactory.writeCsv(inputDir, "c_unknown.csv", TestDataFactory.UNKNOWN_FORMAT_CSV);
        TestDataFactory.writeCsv(inputDir, "notes.txt", "not a report");

        // When
        BatchTransformResultDto result = batchService.transformDirectory(inputDir);

        // Then
        assertThat(result.getFilesFound()).isEqualTo(3);
        assertThat(result.getFilesRecognized()).isEqualTo(2);
        assertThat(result.getFilesTransformed()).isEqualTo(2);
        assertThat(result.getFilesValidated()).isEqualTo(1);
        assertThat(result.getFilesFailed()).isEqualTo(1);
        assertThat(result.getTotalRows()).isEqualTo(6);
        assertThat(result.getProcessingStatus()).isEqualTo("PARTIAL_SUCCESS");
        assertThat(result.getFileResults())
                .extracting(FileTransformResult::getFilename, FileTransformResult::getFormat, FileTransformResult::getStatus)
                .containsExactly(
                        tuple("a_credit_card.csv", "credit_card_payment", "SUCCESS"),
                        tuple("b_insurance.csv", "insurance_claims", "VALIDATION_ERRORS"),
                        tuple("c_unknown.csv", null, "FAILED"));
        assertThat(result.getFileResults().get(2).getErrorMessage()).isEqualTo("Could not detect file format");
    }

    @Test
    void testTransformDirectory_Recursive() throws IOException {
        TestDataFactory.writeCsv(inputDir, "top.csv", TestDataFactory.CREDIT_CARD_CSV);
        TestDataFactory.writeCsv(inputDir, "nested/deep.CSV", TestDataFactory.CREDIT_CARD_CSV);

        BatchTransformResultDto flat = batchService.transformDirectory(inputDir, false, "csv");
        BatchTransformResultDto recursive = batchService.transformDirectory(inputDir, true, "csv");

        assertThat(flat.getFilesFound()).isEqualTo(1);
        assertThat(recursive.getFilesFound()).isEqualTo(2);
        assertThat(recursive.getProcessingStatus()).isEqualTo("SUCCESS");
    }

    @Test
    void testTransformDirectory_AllFailed() throws IOException {
        TestDataFactory.writeCsv(inputDir, "unknown.csv", TestDataFactory.UNKNOWN_FORMAT_CSV);

        BatchTransformResultDto result = batchService.transformDirectory(inputDir);

        assertThat(result.getProcessingStatus()).isEqualTo("FAILED");
    }

    @Test
    void testTransformDirectory_Empty() throws IOException {
        BatchTransformResultDto result = batchService.transformDirectory(inputDir);

        assertThat(result.getFilesFound()).isZero();
        assertThat(result.getProcessingStatus()).isEqualTo("SUCCESS");
        assertThat(result.getProcessingEndTime()).isNotNull();
    }

    @Test
    void testTransformDirectory_MissingDirectory() {
        assertThatThrownBy(() -> batchService.transformDirectory(tempDir.resolve("missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Directory not found");
    }

    @Test
    void testTransformDirectory_RestoresCallerCorrelationId() throws IOException {
        TestDataFactory.writeCsv(inputDir, "cc.csv", TestDataFactory.CREDIT_CARD_CSV);
        CorrelationIdUtil.setCorrelationId("request-1");

        batchService.transformDirectory(inputDir);

        assertThat(CorrelationIdUtil.getCurrentCorrelationId()).isEqualTo("request-1");
    }
}
