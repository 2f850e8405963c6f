package hvlc.billing.ingest.model;

import hvlc.billing.ingest.service.FormatRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FormatProfileTest {

    private FormatProfile creditCardProfile() {
        return FormatRegistry.defaultProfiles().get(0);
    }

    @Test
    void testMatchColumn_ExactMapping() {
        ColumnMatch match = creditCardProfile().matchColumn("Trans. Date");

        assertThat(match.getCanonicalColumn()).isEqualTo("transaction_date");
        assertThat(match.getScore()).isEqualTo(FormatProfile.EXACT_MATCH_SCORE);
    }

    @Test
    void testMatchColumn_PatternMatch() {
        // Given: header not in column_mappings but containing "date"
        ColumnMatch match = creditCardProfile().matchColumn("Settle Date");

        assertThat(match.getCanonicalColumn()).isEqualTo("transaction_date");
        assertThat(match.getScore()).isEqualTo(FormatProfile.PATTERN_MATCH_SCORE);
    }

    @Test
    void testMatchColumn_PatternIsCaseInsensitive() {
        ColumnMatch match = creditCardProfile().matchColumn("GROSS AMT");

        assertThat(match.getCanonicalColumn()).isEqualTo("amount");
        assertThat(match.getScore()).isEqualTo(0.9);
    }

    @Test
    void testMatchColumn_FirstPatternInOrderWins() {
        // only the generic "name" pattern of patient_name fits
        ColumnMatch match = creditCardProfile().matchColumn("Payer Name");

        assertThat(match.getCanonicalColumn()).isEqualTo("patient_name");
    }

    @Test
    void testMatchColumn_SimilarityFallback() {
        // Given: a profile whose only pattern never matches
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("transaction_date", List.of("zzz"));
        FormatProfile profile = new FormatProfile("custom", null, patterns, Map.of());

        ColumnMatch match = profile.matchColumn("Trans_Date");

        assertThat(match.getCanonicalColumn()).isEqualTo("transaction_date");
        assertThat(match.getScore()).isCloseTo(0.769, within(0.001));
    }

    @Test
    void testMatchColumn_NoMatch() {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("amount", List.of("xyz"));
        FormatProfile profile = new FormatProfile("custom", null, patterns, Map.of());

        ColumnMatch match = profile.matchColumn("Foo");

        assertThat(match.isMatched()).isFalse();
        assertThat(match.getScore()).isEqualTo(0.0);
    }

    @Test
    void testMatchColumn_InvalidPatternSkipped() {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("amount", List.of("[unclosed", "amount"));
        FormatProfile profile = new FormatProfile("custom", null, patterns, Map.of());

        ColumnMatch match = profile.matchColumn("Total Amount");

        assertThat(match.getCanonicalColumn()).isEqualTo("amount");
        assertThat(match.getScore()).isEqualTo(0.9);
    }

    @Test
    void testMatchColumn_NullHeader() {
        assertThat(creditCardProfile().matchColumn(null).isMatched()).isFalse();
    }

    @Test
    void testGetDescription_DefaultsFromName() {
        FormatProfile profile = new FormatProfile("clinic_export", null);

        assertThat(profile.getDescription()).isEqualTo("Format profile for clinic_export");
    }
}
