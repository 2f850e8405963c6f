package hvlc.billing.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Best canonical column for one source header, with its confidence score.
 * A null canonical column means no match cleared the acceptance threshold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMatch {

    private String canonicalColumn;
    private double score;

    public static ColumnMatch none() {
        return new ColumnMatch(null, 0.0);
    }

    public boolean isMatched() {
        return canonicalColumn != null;
    }
}
