package hvlc.billing.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the report format registry, batch runs and API uploads
 *
 * Maps directly to properties in application.properties:
 * - ingest.registry.path
 * - ingest.batch.extensions
 * - ingest.batch.recursive
 * - ingest.api.supported-extensions
 * - ingest.api.preview-rows
 */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestConfig {

    // ========================================
    // FORMAT REGISTRY (ingest.registry.*)
    // ========================================

    /** Nested config for ingest.registry.* properties */
    private Registry registry = new Registry();

    @Data
    public static class Registry {
        /** JSON file backing the format registry */
        private String path = "data/format_registry.json";
    }

    // ========================================
    // BATCH DIRECTORY RUNS (ingest.batch.*)
    // ========================================

    /** Nested config for ingest.batch.* properties */
    private Batch batch = new Batch();

    @Data
    public static class Batch {
        /** File extensions picked up from a directory (comma-separated) */
        private String extensions = "csv";

        /** Descend into subdirectories by default */
        private boolean recursive = false;
    }

    // ========================================
    // API UPLOAD SETTINGS (ingest.api.*)
    // ========================================

    /** Nested config for ingest.api.* properties */
    private Api api = new Api();

    @Data
    public static class Api {
        /** Accepted upload extensions (comma-separated) */
        private String supportedExtensions = "csv";

        /** Number of transformed rows echoed back by the transform endpoint */
        private int previewRows = 20;
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    /**
     * Split a comma-separated extension list, trimming whitespace and dots.
     *
     * @param extensions e.g. "csv, .txt"
     * @return e.g. ["csv", "txt"]
     */
    public static String[] splitExtensions(String extensions) {
        if (extensions == null || extensions.trim().isEmpty()) {
            return new String[0];
        }
        String[] parts = extensions.split(",");
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            parts[i] = part.startsWith(".") ? part.substring(1) : part;
        }
        return parts;
    }

    public String[] getBatchExtensionsArray() {
        return splitExtensions(batch.getExtensions());
    }

    public String[] getApiExtensionsArray() {
        return splitExtensions(api.getSupportedExtensions());
    }
}
