package hvlc.billing.ingest.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import hvlc.billing.ingest.model.FormatProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of known report formats, mirrored to a JSON file.
 *
 * File layout:
 * <pre>
 * { "profiles": [ { "name": ..., "header_patterns": ..., ... } ] }
 * </pre>
 *
 * The registry is never empty: when the file is missing, unreadable or holds
 * no profiles, the built-in credit card and insurance profiles are used. A
 * missing file is created with the built-ins; an unreadable one is left alone
 * until the next mutation rewrites it.
 *
 * Every mutation rewrites the whole file through a temp file and a move.
 * Mutations are synchronized on the registry; writers in other processes
 * must be serialized by the caller. Profiles go in and come out as copies,
 * so changes to a returned profile only reach the registry through
 * {@link #addProfile} or {@link #updateMapping}.
 */
public class FormatRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FormatRegistry.class);

    public static final String CREDIT_CARD_PAYMENT = "credit_card_payment";
    public static final String INSURANCE_CLAIMS = "insurance_claims";

    private final Path registryPath;
    private final ObjectMapper objectMapper;
    private final Map<String, FormatProfile> profiles = new LinkedHashMap<>();

    public FormatRegistry(Path registryPath) {
        this.registryPath = registryPath;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        load();
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    public synchronized Optional<FormatProfile> getProfile(String name) {
        return Optional.ofNullable(profiles.get(name)).map(FormatProfile::new);
    }

    public synchronized boolean hasProfile(String name) {
        return profiles.containsKey(name);
    }

    /**
     * @return copies of the profiles in registration order
     */
    public synchronized List<FormatProfile> listProfiles() {
        List<FormatProfile> copies = new ArrayList<>(profiles.size());
        for (FormatProfile profile : profiles.values()) {
            copies.add(new FormatProfile(profile));
        }
        return copies;
    }

    public synchronized List<String> listProfileNames() {
        return new ArrayList<>(profiles.keySet());
    }

    /**
     * Add or replace a profile and persist the registry.
     *
     * @throws IllegalArgumentException if the profile has no name
     * @throws UncheckedIOException if the registry file cannot be written
     */
    public synchronized void addProfile(FormatProfile profile) {
        if (profile == null || profile.getName() == null || profile.getName().trim().isEmpty()) {
            throw new IllegalArgumentException("Format profile must have a name");
        }
        boolean replaced = profiles.put(profile.getName(), new FormatProfile(profile)) != null;
        save();
        logger.info("{} format profile: {}", replaced ? "Replaced" : "Added", profile.getName());
    }

    /**
     * Merge exact header mappings into a profile and persist the registry.
     *
     * @param name format name
     * @param mappings source header → canonical column
     * @return false if no profile has that name
     */
    public synchronized boolean updateMapping(String name, Map<String, String> mappings) {
        FormatProfile profile = profiles.get(name);
        if (profile == null) {
            logger.warn("Cannot update mappings, unknown format: {}", name);
            return false;
        }
        profile.getColumnMappings().putAll(mappings);
        save();
        logger.info("Updated {} column mappings for format {}", mappings.size(), name);
        return true;
    }

    private void load() {
        if (!Files.exists(registryPath)) {
            logger.info("Format registry not found at {}, creating it with the built-in profiles", registryPath);
            seedDefaults();
            save();
            return;
        }

        try {
            RegistryDocument document = objectMapper.readValue(registryPath.toFile(), RegistryDocument.class);
            if (document.getProfiles() != null) {
                for (FormatProfile profile : document.getProfiles()) {
                    if (profile.getName() != null) {
                        profiles.put(profile.getName(), profile);
                    }
                }
            }
        } catch (IOException e) {
            logger.error("Format registry {} could not be read, using the built-in profiles", registryPath, e);
            profiles.clear();
        }

        if (profiles.isEmpty()) {
            logger.warn("Format registry {} holds no profiles, using the built-in profiles", registryPath);
            seedDefaults();
        } else {
            logger.info("Loaded {} format profiles from {}", profiles.size(), registryPath);
        }
    }

    private void seedDefaults() {
        for (FormatProfile profile : defaultProfiles()) {
            profiles.put(profile.getName(), profile);
        }
    }

    private void save() {
        try {
            Path parent = registryPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tempFile = Files.createTempFile(parent, registryPath.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tempFile.toFile(), new RegistryDocument(new ArrayList<>(profiles.values())));
                try {
                    Files.move(tempFile, registryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tempFile, registryPath, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tempFile);
            }
            logger.debug("Saved {} format profiles to {}", profiles.size(), registryPath);
        } catch (IOException e) {
            logger.error("Failed to save format registry to {}", registryPath, e);
            throw new UncheckedIOException("Failed to save format registry: " + e.getMessage(), e);
        }
    }

    /**
     * Built-in profiles for the two report layouts every practice receives.
     */
    public static List<FormatProfile> defaultProfiles() {
        Map<String, List<String>> creditCardPatterns = new LinkedHashMap<>();
        creditCardPatterns.put("transaction_id", List.of("trans.?\\s*#", "transaction\\s*id", "id"));
        creditCardPatterns.put("transaction_date", List.of("trans.?\\s*date", "date"));
        creditCardPatterns.put("amount", List.of("gross\\s*amt", "amount", "payment"));
        creditCardPatterns.put("payment_type", List.of("acct\\s*type", "card\\s*type", "type"));
        creditCardPatterns.put("patient_name", List.of("client\\s*name", "patient", "name"));
        creditCardPatterns.put("provider_name", List.of("provider"));

        Map<String, String> creditCardMappings = new LinkedHashMap<>();
        creditCardMappings.put("Trans. #", "transaction_id");
        creditCardMappings.put("Trans. Date", "transaction_date");
        creditCardMappings.put("Gross Amt", "amount");
        creditCardMappings.put("Acct Type", "payment_type");
        creditCardMappings.put("Client Name", "patient_name");
        creditCardMappings.put("Provider", "provider_name");

        Map<String, List<String>> insurancePatterns = new LinkedHashMap<>();
        insurancePatterns.put("transaction_id", List.of("row\\s*id", "claim\\s*id", "id"));
        insurancePatterns.put("transaction_date", List.of("check\\s*date", "date"));
        insurancePatterns.put("amount", List.of("check\\s*amount", "amount", "payment"));
        insurancePatterns.put("cash_applied", List.of("cash\\s*applied", "applied\\s*amount"));
        insurancePatterns.put("payer_name", List.of("payment\\s*from", "payer", "insurance"));
        insurancePatterns.put("provider_name", List.of("provider"));

        Map<String, String> insuranceMappings = new LinkedHashMap<>();
        insuranceMappings.put("RowId", "transaction_id");
        insuranceMappings.put("Check Date", "transaction_date");
        insuranceMappings.put("Check Amount", "amount");
        insuranceMappings.put("Cash Applied", "cash_applied");
        insuranceMappings.put("Payment From", "payer_name");
        insuranceMappings.put("Provider", "provider_name");

        return List.of(
                new FormatProfile(CREDIT_CARD_PAYMENT, "Credit card payment settlement report",
                        creditCardPatterns, creditCardMappings),
                new FormatProfile(INSURANCE_CLAIMS, "Insurance claims and check payment report",
                        insurancePatterns, insuranceMappings));
    }

    /**
     * JSON shape of the registry file.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class RegistryDocument {

        @JsonProperty("profiles")
        private List<FormatProfile> profiles = new ArrayList<>();
    }
}
