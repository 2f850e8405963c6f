package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.IngestConfig;
import hvlc.billing.ingest.dto.BatchTransformResultDto;
import hvlc.billing.ingest.dto.BatchTransformResultDto.FileTransformResult;
import hvlc.billing.ingest.model.TransformationResult;
import hvlc.billing.ingest.model.TransformationResult.FailureType;
import hvlc.billing.ingest.util.CorrelationIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transforms every report file of a directory with format auto-detection.
 * A failing file is recorded and the run goes on with the next one.
 */
@Service
public class ReportBatchService {

    private static final Logger logger = LoggerFactory.getLogger(ReportBatchService.class);

    private final ReportTransformer reportTransformer;
    private final IngestConfig ingestConfig;

    public ReportBatchService(ReportTransformer reportTransformer, IngestConfig ingestConfig) {
        this.reportTransformer = reportTransformer;
        this.ingestConfig = ingestConfig;
    }

    /**
     * Transform a directory using the configured recursion and extensions.
     */
    public BatchTransformResultDto transformDirectory(Path directory) throws IOException {
        return transformDirectory(directory, ingestConfig.getBatch().isRecursive(),
                ingestConfig.getBatchExtensionsArray());
    }

    /**
     * Transform every matching file of a directory.
     *
     * @param directory directory to scan
     * @param recursive descend into subdirectories
     * @param extensions accepted extensions without dot, matched case-insensitively
     * @return per-file results and totals
     * @throws IllegalArgumentException if the directory does not exist
     * @throws IOException if the directory cannot be listed
     */
    public BatchTransformResultDto transformDirectory(Path directory, boolean recursive, String... extensions)
            throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Directory not found: " + directory);
        }

        LocalDateTime startTime = LocalDateTime.now();
        logger.info("Transforming files in {} (recursive: {})", directory, recursive);

        List<Path> files = findFiles(directory, recursive, extensions);

        BatchTransformResultDto result = new BatchTransformResultDto();
        result.setDirectory(directory.toString());
        result.setProcessingStartTime(startTime);
        result.setFilesFound(files.size());

        if (files.isEmpty()) {
            logger.warn("No matching files found in {}", directory);
        } else {
            logger.info("Found {} files to transform", files.size());
        }

        for (Path file : files) {
            FileTransformResult fileResult = transformFile(file);
            result.getFileResults().add(fileResult);

            if (!"FAILED".equals(fileResult.getStatus())) {
                result.setFilesTransformed(result.getFilesTransformed() + 1);
                result.setTotalRows(result.getTotalRows() + fileResult.getRowCount());
            } else {
                result.setFilesFailed(result.getFilesFailed() + 1);
            }
            if (fileResult.getFormat() != null) {
                result.setFilesRecognized(result.getFilesRecognized() + 1);
            }
            if ("SUCCESS".equals(fileResult.getStatus())) {
                result.setFilesValidated(result.getFilesValidated() + 1);
            }
        }

        LocalDateTime endTime = LocalDateTime.now();
        result.setProcessingEndTime(endTime);
        result.setProcessingDurationMs(Duration.between(startTime, endTime).toMillis());
        result.setProcessingStatus(determineStatus(result));

        logger.info("Batch complete: {}/{} files transformed, {} failed",
                result.getFilesTransformed(), result.getFilesFound(), result.getFilesFailed());
        return result;
    }

    private FileTransformResult transformFile(Path file) {
        String parentCorrelationId = CorrelationIdUtil.hasCorrelationId()
                ? CorrelationIdUtil.getCurrentCorrelationId() : null;
        CorrelationIdUtil.setCorrelationId(CorrelationIdUtil.newCorrelationId());
        long start = System.currentTimeMillis();

        try {
            logger.info("Transforming {}", file);
            TransformationResult transformation = reportTransformer.transform(file);

            String status;
            if (transformation.isFailed()) {
                status = "FAILED";
            } else if (transformation.isSuccess()) {
                status = "SUCCESS";
            } else {
                status = "VALIDATION_ERRORS";
                logger.warn("{} transformed with {} validation errors",
                        file.getFileName(), transformation.getValidationErrors().size());
            }

            // an unrecognized file carries no format even though detection ran
            String format = transformation.getFailureType() == FailureType.DETECTION_FAILED
                    ? null : transformation.getFormat();

            return new FileTransformResult(
                    file.getFileName().toString(),
                    format,
                    status,
                    transformation.getDetectionConfidence(),
                    transformation.getRowCount(),
                    transformation.getValidationErrors().size(),
                    System.currentTimeMillis() - start,
                    transformation.getError());

        } finally {
            if (parentCorrelationId != null) {
                CorrelationIdUtil.setCorrelationId(parentCorrelationId);
            } else {
                CorrelationIdUtil.clearCorrelationId();
            }
        }
    }

    private List<Path> findFiles(Path directory, boolean recursive, String... extensions) throws IOException {
        try (Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> hasExtension(path, extensions))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean hasExtension(Path path, String... extensions) {
        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (filename.endsWith("." + extension.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String determineStatus(BatchTransformResultDto result) {
        if (result.getFilesFailed() == 0) {
            return "SUCCESS";
        }
        if (result.getFilesFailed() == result.getFilesFound()) {
            return "FAILED";
        }
        return "PARTIAL_SUCCESS";
    }
}
