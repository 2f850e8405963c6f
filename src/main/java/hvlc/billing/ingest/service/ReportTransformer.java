package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.CsvProcessingConfig;
import hvlc.billing.ingest.model.CanonicalSchema;
import hvlc.billing.ingest.model.CsvDialect;
import hvlc.billing.ingest.model.FormatDetectionResult;
import hvlc.billing.ingest.model.ReportTable;
import hvlc.billing.ingest.model.TransformationResult;
import hvlc.billing.ingest.model.TransformationResult.FailureType;
import hvlc.billing.ingest.model.TransformationStep;
import hvlc.billing.ingest.model.ValidationError;
import hvlc.billing.ingest.transformer.TransformationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one report file into a canonical transaction table.
 *
 * Steps:
 * 1. Detect the format unless the caller names it
 * 2. Look up the curated pipeline of the format
 * 3. Load the file and run the pipeline rules in order
 * 4. Add missing canonical columns and project onto the canonical order
 * 5. Validate the result
 *
 * Never throws: every failure is returned as a {@link TransformationResult}
 * with an empty table and a {@link FailureType}.
 */
@Service
public class ReportTransformer {

    private static final Logger logger = LoggerFactory.getLogger(ReportTransformer.class);

    private final ReportFormatDetector formatDetector;
    private final TransformationPipelineFactory pipelineFactory;
    private final TransformationValidationService validationService;
    private final CsvDialectSniffer dialectSniffer;
    private final CsvParsingService csvParsingService;
    private final CsvProcessingConfig config;

    public ReportTransformer(ReportFormatDetector formatDetector,
                             TransformationPipelineFactory pipelineFactory,
                             TransformationValidationService validationService,
                             CsvDialectSniffer dialectSniffer,
                             CsvParsingService csvParsingService,
                             CsvProcessingConfig config) {
        this.formatDetector = formatDetector;
        this.pipelineFactory = pipelineFactory;
        this.validationService = validationService;
        this.dialectSniffer = dialectSniffer;
        this.csvParsingService = csvParsingService;
        this.config = config;
    }

    /**
     * Transform a file, detecting its format.
     */
    public TransformationResult transform(Path file) {
        return transform(file, null);
    }

    /**
     * Transform a file.
     *
     * @param file the report file
     * @param formatName known format, or null to detect it
     * @return the canonical table plus metadata, or a failure result
     */
    public TransformationResult transform(Path file, String formatName) {
        String filePath = file.toString();
        Double detectionConfidence = null;

        if (formatName == null || formatName.trim().isEmpty()) {
            FormatDetectionResult detection = formatDetector.detectFormat(file);
            if (!detection.isRecognized()) {
                logger.error("Could not detect file format of {}", file.getFileName());
                TransformationResult failure = TransformationResult.failure(filePath, null,
                        FailureType.DETECTION_FAILED, "Could not detect file format");
                failure.setDetectionConfidence(detection.getConfidence());
                return failure;
            }
            formatName = detection.getFormatName();
            detectionConfidence = detection.getConfidence();
            logger.info("Detected format {} (confidence: {}) for {}",
                    formatName, String.format("%.2f", detectionConfidence), file.getFileName());
        }

        Optional<List<TransformationRule>> pipeline = pipelineFactory.getPipeline(formatName);
        if (pipeline.isEmpty()) {
            logger.error("No transformation pipeline defined for format {}", formatName);
            TransformationResult failure = TransformationResult.failure(filePath, formatName,
                    FailureType.PIPELINE_NOT_FOUND, "No transformation pipeline defined for format " + formatName);
            failure.setDetectionConfidence(detectionConfidence);
            return failure;
        }

        try {
            ReportTable table = csvParsingService.readTable(file, resolveDialect(file));
            logger.info("Loaded {} rows x {} columns from {}",
                    table.getRowCount(), table.getColumnCount(), file.getFileName());

            List<TransformationStep> steps = new ArrayList<>();
            for (TransformationRule rule : pipeline.get()) {
                int rowsBefore = table.getRowCount();
                int columnsBefore = table.getColumnCount();

                table = rule.apply(table);

                steps.add(new TransformationStep(rule.getName(), rule.getDescription(),
                        rowsBefore, columnsBefore, table.getRowCount(), table.getColumnCount()));
                logger.debug("Applied {}: {} rows x {} columns -> {} rows x {} columns", rule.getName(),
                        rowsBefore, columnsBefore, table.getRowCount(), table.getColumnCount());
            }

            ReportTable canonical = toCanonical(table);
            List<ValidationError> validationErrors = validationService.validate(canonical);

            TransformationResult result = new TransformationResult();
            result.setTable(canonical);
            result.setFormat(formatName);
            result.setFilePath(filePath);
            result.setDetectionConfidence(detectionConfidence);
            result.setTransformationLog(steps);
            result.setValidationErrors(validationErrors);
            result.setSuccess(validationErrors.isEmpty());

            logger.info("Transformed {} as {}: {} rows, {} validation errors",
                    file.getFileName(), formatName, canonical.getRowCount(), validationErrors.size());
            return result;

        } catch (Exception e) {
            logger.error("Error transforming {} as {}: {}", file.getFileName(), formatName, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            TransformationResult failure = TransformationResult.failure(filePath, formatName,
                    FailureType.EXECUTION_FAILED, message);
            failure.setDetectionConfidence(detectionConfidence);
            return failure;
        }
    }

    /**
     * Null-fill absent canonical columns and drop everything else.
     */
    ReportTable toCanonical(ReportTable table) {
        ReportTable canonical = table.copy();
        for (String column : CanonicalSchema.COLUMNS) {
            if (!canonical.hasColumn(column)) {
                canonical.setConstant(column, null);
            }
        }
        return canonical.select(CanonicalSchema.COLUMNS);
    }

    private CsvDialect resolveDialect(Path file) throws IOException {
        try {
            return dialectSniffer.sniff(file);
        } catch (IllegalArgumentException e) {
            logger.warn("Could not sniff dialect of {} ({}), using configured delimiter",
                    file.getFileName(), e.getMessage());
            return new CsvDialect(config.getCsvDelimiter(), config.getCsvQuoteChar(), true);
        }
    }
}
