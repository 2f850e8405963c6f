package hvlc.billing.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delimiter and quote character of a delimited text file, plus whether its
 * first row looks like a header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CsvDialect {

    private char delimiter = ',';
    private char quoteChar = '"';
    private boolean hasHeader = true;

    public static CsvDialect defaults() {
        return new CsvDialect(',', '"', true);
    }
}
