package hvlc.billing.ingest.controller;

import hvlc.billing.ingest.config.IngestConfig;
import hvlc.billing.ingest.dto.BatchTransformResultDto;
import hvlc.billing.ingest.dto.ErrorResponseDto;
import hvlc.billing.ingest.dto.TransformResponseDto;
import hvlc.billing.ingest.model.FormatDetectionResult;
import hvlc.billing.ingest.model.FormatProfile;
import hvlc.billing.ingest.model.TransformationResult;
import hvlc.billing.ingest.service.FormatRegistry;
import hvlc.billing.ingest.service.ReportBatchService;
import hvlc.billing.ingest.service.ReportFormatDetector;
import hvlc.billing.ingest.service.ReportTransformer;
import hvlc.billing.ingest.util.FileValidationUtil;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for billing report detection, transformation and format registry maintenance
 */
@RestController
@RequestMapping("/api/v1/reports")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Billing Reports", description = "Report format detection and canonical transformation")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    @Autowired
    private ReportFormatDetector formatDetector;

    @Autowired
    private ReportTransformer reportTransformer;

    @Autowired
    private ReportBatchService batchService;

    @Autowired
    private FormatRegistry formatRegistry;

    @Autowired
    private IngestConfig ingestConfig;

    /**
     * Detect the format of an uploaded report
     */
    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Detect report format",
        description = "Score the uploaded report against every registered format profile"
    )
    @ApiResponse(responseCode = "200", description = "Detection ran; format_name is null when unrecognized")
    @ApiResponse(responseCode = "400", description = "Invalid file")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> detectFormat(
            @Parameter(
                description = "Report file to analyze",
                required = true,
                content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE)
            )
            @RequestParam("file") MultipartFile file) {

        logger.info("Detecting format of uploaded file: {}", file.getOriginalFilename());

        Path tempFile = null;
        try {
            FileValidationUtil.validateFile(file, ingestConfig.getApiExtensionsArray());
            tempFile = saveUpload(file);

            FormatDetectionResult result = formatDetector.detectFormat(tempFile);
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to detect format of {}", file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to detect format: " + e.getMessage()));

        } finally {
            deleteUpload(tempFile);
        }
    }

    /**
     * Transform an uploaded report into canonical transactions
     */
    @PostMapping(value = "/transform", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Transform report",
        description = "Detect (or use the given) format, run its pipeline and validate the canonical result"
    )
    @ApiResponse(responseCode = "200", description = "Transformed; validation errors may still be reported")
    @ApiResponse(responseCode = "400", description = "Invalid file")
    @ApiResponse(responseCode = "422", description = "Format not detected, no pipeline, or transformation failed")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> transformReport(
            @Parameter(
                description = "Report file to transform",
                required = true,
                content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE)
            )
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Known format name; detected when omitted")
            @RequestParam(value = "format", required = false) String format,
            @Parameter(description = "Number of canonical rows returned in the preview")
            @RequestParam(value = "previewRows", required = false) Integer previewRows) {

        logger.info("Transforming uploaded file: {} (format: {})", file.getOriginalFilename(),
                format != null ? format : "auto");

        Path tempFile = null;
        try {
            FileValidationUtil.validateFile(file, ingestConfig.getApiExtensionsArray());
            tempFile = saveUpload(file);

            TransformationResult result = reportTransformer.transform(tempFile, format);
            int rows = previewRows != null ? previewRows : ingestConfig.getApi().getPreviewRows();
            TransformResponseDto response = TransformResponseDto.from(result, file.getOriginalFilename(), rows);

            if (result.isFailed()) {
                logger.warn("Transformation of {} failed: {}", file.getOriginalFilename(), result.getError());
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
            }
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to transform {}", file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to transform file: " + e.getMessage()));

        } finally {
            deleteUpload(tempFile);
        }
    }

    @GetMapping("/formats")
    @Operation(summary = "List formats", description = "Names of all registered format profiles")
    @ApiResponse(responseCode = "200", description = "Format names in registration order")
    public ResponseEntity<List<String>> listFormats() {
        return ResponseEntity.ok(formatRegistry.listProfileNames());
    }

    @GetMapping("/formats/{name}")
    @Operation(summary = "Get format profile", description = "Full profile of one registered format")
    @ApiResponse(responseCode = "200", description = "Profile found")
    @ApiResponse(responseCode = "404", description = "Unknown format")
    public ResponseEntity<FormatProfile> getFormat(@PathVariable String name) {
        Optional<FormatProfile> profile = formatRegistry.getProfile(name);
        return profile.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Merge exact header mappings into a format profile
     */
    @PutMapping("/formats/{name}/mappings")
    @Operation(
        summary = "Update column mappings",
        description = "Merge source header → canonical column mappings into a registered profile"
    )
    @ApiResponse(responseCode = "200", description = "Mappings merged and registry saved")
    @ApiResponse(responseCode = "400", description = "No mappings given")
    @ApiResponse(responseCode = "404", description = "Unknown format")
    @ApiResponse(responseCode = "500", description = "Registry could not be saved")
    public ResponseEntity<?> updateMappings(@PathVariable String name,
                                            @RequestBody Map<String, String> mappings) {

        logger.info("Updating {} column mappings of format {}", mappings.size(), name);

        try {
            if (mappings.isEmpty()) {
                throw new IllegalArgumentException("No column mappings provided");
            }
            if (!formatDetector.updateMapping(name, mappings)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponseDto("Not Found", "Unknown format: " + name));
            }
            return ResponseEntity.ok(formatRegistry.getProfile(name).orElse(null));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to update mappings of format {}", name, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to update mappings: " + e.getMessage()));
        }
    }

    /**
     * Register a new format profile from a sample report
     */
    @PostMapping(value = "/formats/{name}/learn", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Learn format from sample",
        description = "Create a profile named after the sample's layout; mappings are added afterwards"
    )
    @ApiResponse(responseCode = "201", description = "Profile created and registry saved")
    @ApiResponse(responseCode = "400", description = "Invalid file")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> learnFormat(
            @PathVariable String name,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "description", required = false) String description) {

        logger.info("Learning format {} from uploaded file: {}", name, file.getOriginalFilename());

        Path tempFile = null;
        try {
            FileValidationUtil.validateFile(file, ingestConfig.getApiExtensionsArray());
            tempFile = saveUpload(file);

            FormatProfile profile = formatDetector.learnFromSample(tempFile, name, description);
            return ResponseEntity.status(HttpStatus.CREATED).body(profile);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to learn format {} from {}", name, file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to learn format: " + e.getMessage()));

        } finally {
            deleteUpload(tempFile);
        }
    }

    /**
     * Transform every report file of a server-side directory
     */
    @PostMapping("/batch")
    @Operation(
        summary = "Transform directory",
        description = "Auto-detect and transform every matching file of a directory, continuing past failures"
    )
    @ApiResponse(responseCode = "200", description = "Batch completed; see per-file results")
    @ApiResponse(responseCode = "400", description = "Directory not found")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> transformDirectory(
            @RequestParam("directory") String directory,
            @RequestParam(value = "recursive", required = false) Boolean recursive) {

        logger.info("Batch transforming directory: {}", directory);

        try {
            boolean descend = recursive != null ? recursive : ingestConfig.getBatch().isRecursive();
            BatchTransformResultDto result = batchService.transformDirectory(
                    Paths.get(directory), descend, ingestConfig.getBatchExtensionsArray());
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Batch transformation of {} failed", directory, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Batch transformation failed: " + e.getMessage()));
        }
    }

    private Path saveUpload(MultipartFile file) throws IOException {
        Path tempFile = Files.createTempFile("report-upload-", FileValidationUtil.extensionOf(file.getOriginalFilename()));
        try (InputStream inputStream = file.getInputStream()) {
            Files.copy(inputStream, tempFile, StandardCopyOption.REPLACE_EXISTING);
        }
        return tempFile;
    }

    private void deleteUpload(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Could not delete temporary upload {}", tempFile, e);
        }
    }
}
