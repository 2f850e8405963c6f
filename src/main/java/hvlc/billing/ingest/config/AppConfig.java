package hvlc.billing.ingest.config;

import hvlc.billing.ingest.service.FormatRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Application configuration for shared, file-backed components
 */
@Configuration
public class AppConfig {

    /**
     * Format registry backed by the JSON file at ingest.registry.path.
     * Loaded (or seeded with the built-in profiles) once at startup.
     */
    @Bean
    public FormatRegistry formatRegistry(IngestConfig ingestConfig) {
        return new FormatRegistry(Paths.get(ingestConfig.getRegistry().getPath()));
    }
}
