package hvlc.billing.ingest.service;

import hvlc.billing.ingest.model.FormatProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void testConstructor_MissingFileSeedsAndCreatesIt() {
        // Given
        Path registryPath = tempDir.resolve("config/format_registry.json");

        // When
        FormatRegistry registry = new FormatRegistry(registryPath);

        // Then
        assertThat(registry.listProfileNames())
                .containsExactly(FormatRegistry.CREDIT_CARD_PAYMENT, FormatRegistry.INSURANCE_CLAIMS);
        assertThat(Files.exists(registryPath)).isTrue();
    }

    @Test
    void testAddProfile_PersistsAcrossInstances() {
        Path registryPath = tempDir.resolve("format_registry.json");
        FormatRegistry registry = new FormatRegistry(registryPath);

        FormatProfile profile = new FormatProfile("clinic_export", "Clinic export");
        profile.getColumnMappings().put("Visit Date", "transaction_date");
        registry.addProfile(profile);

        FormatRegistry reloaded = new FormatRegistry(registryPath);
        assertThat(reloaded.listProfileNames()).contains("clinic_export");
        assertThat(reloaded.getProfile("clinic_export").orElseThrow().getColumnMappings())
                .containsEntry("Visit Date", "transaction_date");
    }

    @Test
    void testGetProfile_ReturnsCopy() throws IOException {
        // Given
        Path registryPath = tempDir.resolve("format_registry.json");
        FormatRegistry registry = new FormatRegistry(registryPath);
        String savedJson = Files.readString(registryPath);

        // When: a returned profile is changed without going through the registry
        FormatProfile profile = registry.getProfile(FormatRegistry.CREDIT_CARD_PAYMENT).orElseThrow();
        profile.getColumnMappings().put("Settle Date", "transaction_date");
        profile.getHeaderPatterns().get("provider_name").add("clinician");
        registry.listProfiles().get(0).getColumnMappings().clear();

        // Then: neither the registry nor its file sees the change
        FormatProfile stored = registry.getProfile(FormatRegistry.CREDIT_CARD_PAYMENT).orElseThrow();
        assertThat(stored.getColumnMappings()).doesNotContainKey("Settle Date").containsKey("Trans. Date");
        assertThat(stored.getHeaderPatterns().get("provider_name")).containsExactly("provider");
        assertThat(Files.readString(registryPath)).isEqualTo(savedJson);
    }

    @Test
    void testAddProfile_LaterChangesToArgumentIgnored() {
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));
        FormatProfile profile = new FormatProfile("clinic_export", "Clinic export");
        registry.addProfile(profile);

        profile.getColumnMappings().put("Visit Date", "transaction_date");

        assertThat(registry.getProfile("clinic_export").orElseThrow().getColumnMappings()).isEmpty();
    }

    @Test
    void testAddProfile_ReplacesExisting() {
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));

        registry.addProfile(new FormatProfile(FormatRegistry.INSURANCE_CLAIMS, "Replaced"));

        assertThat(registry.listProfiles()).hasSize(2);
        assertThat(registry.getProfile(FormatRegistry.INSURANCE_CLAIMS).orElseThrow().getDescription())
                .isEqualTo("Replaced");
    }

    @Test
    void testAddProfile_MissingName() {
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));

        assertThatThrownBy(() -> registry.addProfile(new FormatProfile(" ", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUpdateMapping_MergesAndPersists() {
        Path registryPath = tempDir.resolve("format_registry.json");
        FormatRegistry registry = new FormatRegistry(registryPath);

        boolean updated = registry.updateMapping(FormatRegistry.CREDIT_CARD_PAYMENT, Map.of("Net Amt", "notes"));

        assertThat(updated).isTrue();
        FormatProfile reloaded = new FormatRegistry(registryPath)
                .getProfile(FormatRegistry.CREDIT_CARD_PAYMENT).orElseThrow();
        assertThat(reloaded.getColumnMappings())
                .containsEntry("Net Amt", "notes")
                .containsEntry("Trans. Date", "transaction_date");
    }

    @Test
    void testUpdateMapping_UnknownFormat() {
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));

        assertThat(registry.updateMapping("nope", Map.of("A", "notes"))).isFalse();
    }

    @Test
    void testConstructor_CorruptFileUsesBuiltInsWithoutOverwriting() throws IOException {
        // Given: unreadable registry file
        Path registryPath = tempDir.resolve("format_registry.json");
        Files.write(registryPath, "{ not json".getBytes(StandardCharsets.UTF_8));

        // When
        FormatRegistry registry = new FormatRegistry(registryPath);

        // Then: built-ins are served, the broken file is left for inspection
        assertThat(registry.listProfiles()).hasSize(2);
        assertThat(new String(Files.readAllBytes(registryPath), StandardCharsets.UTF_8)).isEqualTo("{ not json");
    }

    @Test
    void testConstructor_EmptyProfileListUsesBuiltIns() throws IOException {
        Path registryPath = tempDir.resolve("format_registry.json");
        Files.write(registryPath, "{\"profiles\": []}".getBytes(StandardCharsets.UTF_8));

        FormatRegistry registry = new FormatRegistry(registryPath);

        assertThat(registry.hasProfile(FormatRegistry.CREDIT_CARD_PAYMENT)).isTrue();
        assertThat(registry.hasProfile(FormatRegistry.INSURANCE_CLAIMS)).isTrue();
    }

    @Test
    void testSavedFile_UsesSnakeCaseKeys() throws IOException {
        Path registryPath = tempDir.resolve("format_registry.json");
        new FormatRegistry(registryPath);

        String json = new String(Files.readAllBytes(registryPath), StandardCharsets.UTF_8);
        assertThat(json).contains("\"profiles\"", "\"header_patterns\"", "\"column_mappings\"", "\"sample_values\"");
    }

    @Test
    void testGetProfile_Unknown() {
        FormatRegistry registry = new FormatRegistry(tempDir.resolve("format_registry.json"));

        assertThat(registry.getProfile("unknown")).isEmpty();
    }
}
