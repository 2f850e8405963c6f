package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.CsvProcessingConfig;
import hvlc.billing.ingest.model.CanonicalSchema;
import hvlc.billing.ingest.model.ColumnMatch;
import hvlc.billing.ingest.model.CsvDialect;
import hvlc.billing.ingest.model.FormatDetectionResult;
import hvlc.billing.ingest.model.FormatProfile;
import hvlc.billing.ingest.model.ProfileMatch;
import hvlc.billing.ingest.model.ReportTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recognizes which registered report layout a file uses.
 *
 * Detection reads a leading sample of the file, maps every header against
 * every registered profile and keeps the profile with the highest confidence.
 * Detection never throws: problems come back as an unrecognized result whose
 * metadata carries the error.
 */
@Service
public class ReportFormatDetector {

    private static final Logger logger = LoggerFactory.getLogger(ReportFormatDetector.class);

    /** Minimum profile confidence for a file to count as recognized */
    public static final double DETECTION_THRESHOLD = 0.5;

    /** Header matches at or below this score are ignored when scoring a profile */
    public static final double COLUMN_MATCH_THRESHOLD = 0.5;

    /** Confidence given to a profile whose required columns are not all mapped */
    public static final double MISSING_REQUIRED_CONFIDENCE = 0.2;

    /** Canonical names that satisfy the required "amount" slot */
    public static final Set<String> AMOUNT_ALIASES =
            Set.of("amount", CanonicalSchema.CASH_APPLIED, CanonicalSchema.INSURANCE_PAYMENT);

    private static final int TOP_RESULTS = 3;
    private static final int LEARNED_SAMPLE_VALUES = 5;

    private final FormatRegistry formatRegistry;
    private final CsvDialectSniffer dialectSniffer;
    private final CsvParsingService csvParsingService;
    private final CsvProcessingConfig config;

    public ReportFormatDetector(FormatRegistry formatRegistry,
                                CsvDialectSniffer dialectSniffer,
                                CsvParsingService csvParsingService,
                                CsvProcessingConfig config) {
        this.formatRegistry = formatRegistry;
        this.dialectSniffer = dialectSniffer;
        this.csvParsingService = csvParsingService;
        this.config = config;
    }

    public FormatDetectionResult detectFormat(Path file) {
        return detectFormat(file, config.getSampleRows());
    }

    /**
     * Detect the format of a report file.
     *
     * @param file the report file
     * @param sampleRows number of data rows read with the header
     * @return detection result; format name is null when unrecognized
     */
    public FormatDetectionResult detectFormat(Path file, int sampleRows) {
        logger.info("Detecting format of {}", file.getFileName());

        try {
            CsvDialect dialect = dialectSniffer.sniff(file);
            if (!dialect.isHasHeader()) {
                logger.warn("No header row detected in {}", file.getFileName());
                return FormatDetectionResult.failed("No header detected");
            }

            ReportTable sample = csvParsingService.readTable(file, dialect, sampleRows);
            List<String> headers = sample.getColumnNames();

            List<ProfileMatch> matches = new ArrayList<>();
            for (FormatProfile profile : formatRegistry.listProfiles()) {
                matches.add(matchProfile(profile, headers));
            }
            // stable sort, ties keep registry order
            matches.sort(Comparator.comparingDouble(ProfileMatch::getConfidence).reversed());

            if (matches.isEmpty() || matches.get(0).getConfidence() < DETECTION_THRESHOLD) {
                double bestConfidence = matches.isEmpty() ? 0.0 : matches.get(0).getConfidence();
                List<Map<String, Object>> candidates = new ArrayList<>();
                for (ProfileMatch match : topResults(matches)) {
                    Map<String, Object> candidate = new LinkedHashMap<>();
                    candidate.put("format", match.getFormatName());
                    candidate.put("confidence", match.getConfidence());
                    candidates.add(candidate);
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("candidates", candidates);

                logger.info("No format recognized for {} (best confidence {})", file.getFileName(), bestConfidence);
                return FormatDetectionResult.unrecognized(bestConfidence, metadata);
            }

            ProfileMatch best = matches.get(0);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("full_results", topResults(matches));

            logger.info("Detected format {} for {} with confidence {}",
                    best.getFormatName(), file.getFileName(), String.format("%.2f", best.getConfidence()));
            return new FormatDetectionResult(best.getFormatName(), best.getConfidence(),
                    best.getColumnMap(), best.getConfidenceScores(), metadata);

        } catch (Exception e) {
            logger.error("Error detecting format of {}: {}", file.getFileName(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return FormatDetectionResult.failed(message);
        }
    }

    /**
     * Score a header row against one profile.
     *
     * Headers matching above 0.5 are mapped. The profile needs transaction_date,
     * provider_name and an amount column (amount, cash_applied or
     * insurance_payment), otherwise it scores 0.2. Otherwise the confidence is
     * half the mapped share of headers plus half the mean match score.
     */
    public ProfileMatch matchProfile(FormatProfile profile, List<String> headers) {
        Map<String, String> columnMap = new LinkedHashMap<>();
        Map<String, Double> confidenceScores = new LinkedHashMap<>();

        for (String header : headers) {
            ColumnMatch match = profile.matchColumn(header);
            if (match.isMatched() && match.getScore() > COLUMN_MATCH_THRESHOLD) {
                columnMap.put(header, match.getCanonicalColumn());
                confidenceScores.put(header, match.getScore());
            }
        }

        double confidence;
        if (!hasRequiredColumns(columnMap.values())) {
            confidence = MISSING_REQUIRED_CONFIDENCE;
        } else {
            double coverage = (double) columnMap.size() / headers.size();
            double meanScore = confidenceScores.values().stream()
                    .mapToDouble(Double::doubleValue)
                    .average()
                    .orElse(0.0);
            confidence = 0.5 * coverage + 0.5 * meanScore;
        }

        logger.debug("Profile {} scored {} ({} of {} headers mapped)",
                profile.getName(), confidence, columnMap.size(), headers.size());
        return new ProfileMatch(profile.getName(), confidence, columnMap, confidenceScores,
                columnMap.size(), headers.size());
    }

    /**
     * Register a new profile named after a sample file's layout. Column mappings
     * start empty and are filled in with {@link #updateMapping}; the first few
     * values of every column are kept as samples.
     *
     * @throws UncheckedIOException if the sample cannot be read
     * @throws IllegalArgumentException if the sample has no detectable layout
     */
    public FormatProfile learnFromSample(Path file, String formatName, String description) {
        logger.info("Learning format {} from {}", formatName, file.getFileName());

        try {
            CsvDialect dialect = dialectSniffer.sniff(file);
            ReportTable sample = csvParsingService.readTable(file, dialect, LEARNED_SAMPLE_VALUES);

            FormatProfile profile = new FormatProfile(formatName, description);
            Map<String, List<String>> sampleValues = new LinkedHashMap<>();
            for (String header : sample.getColumnNames()) {
                List<String> values = new ArrayList<>();
                for (Object value : sample.getColumn(header)) {
                    if (value != null) {
                        values.add(value.toString());
                    }
                }
                sampleValues.put(header, values);
            }
            profile.setSampleValues(sampleValues);
            profile.getMetadata().put("learned_at", LocalDateTime.now());
            profile.getMetadata().put("source_columns", sample.getColumnNames());

            formatRegistry.addProfile(profile);
            return profile;

        } catch (IOException e) {
            logger.error("Error learning format from {}: {}", file.getFileName(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Merge exact header mappings into a registered profile.
     *
     * @return false if the format is unknown
     */
    public boolean updateMapping(String formatName, Map<String, String> columnMappings) {
        return formatRegistry.updateMapping(formatName, columnMappings);
    }

    /**
     * @return source header → canonical column for the detected format, empty when unrecognized
     */
    public Map<String, String> getColumnMapping(Path file) {
        FormatDetectionResult result = detectFormat(file);
        return result.isRecognized() ? result.getColumnMap() : new LinkedHashMap<>();
    }

    private boolean hasRequiredColumns(Collection<String> mapped) {
        boolean hasAmount = mapped.stream().anyMatch(AMOUNT_ALIASES::contains);
        return hasAmount
                && mapped.contains(CanonicalSchema.TRANSACTION_DATE)
                && mapped.contains(CanonicalSchema.PROVIDER_NAME);
    }

    private List<ProfileMatch> topResults(List<ProfileMatch> matches) {
        return new ArrayList<>(matches.subList(0, Math.min(TOP_RESULTS, matches.size())));
    }
}
