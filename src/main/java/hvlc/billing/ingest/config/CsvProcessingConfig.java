package hvlc.billing.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;

/**
 * Configuration properties for reading billing report files
 */
@Configuration
@ConfigurationProperties(prefix = "csv.processing")
public class CsvProcessingConfig {

    // Dialect sniffing settings
    private int sniffSampleSize = 4096;
    private int sampleRows = 10;
    private int headerCheckRows = 20;
    private String candidateDelimiters = ",\t;|";

    // Fallback dialect when sniffing fails
    private char csvDelimiter = ',';
    private char csvQuoteChar = '"';
    private String csvCharset = "UTF-8";

    // Getters and Setters
    public int getSniffSampleSize() {
        return sniffSampleSize;
    }

    public void setSniffSampleSize(int sniffSampleSize) {
        this.sniffSampleSize = sniffSampleSize;
    }

    public int getSampleRows() {
        return sampleRows;
    }

    public void setSampleRows(int sampleRows) {
        this.sampleRows = sampleRows;
    }

    public int getHeaderCheckRows() {
        return headerCheckRows;
    }

    public void setHeaderCheckRows(int headerCheckRows) {
        this.headerCheckRows = headerCheckRows;
    }

    public String getCandidateDelimiters() {
        return candidateDelimiters;
    }

    public void setCandidateDelimiters(String candidateDelimiters) {
        this.candidateDelimiters = candidateDelimiters;
    }

    public char getCsvDelimiter() {
        return csvDelimiter;
    }

    public void setCsvDelimiter(char csvDelimiter) {
        this.csvDelimiter = csvDelimiter;
    }

    public char getCsvQuoteChar() {
        return csvQuoteChar;
    }

    public void setCsvQuoteChar(char csvQuoteChar) {
        this.csvQuoteChar = csvQuoteChar;
    }

    public String getCsvCharset() {
        return csvCharset;
    }

    public void setCsvCharset(String csvCharset) {
        this.csvCharset = csvCharset;
    }

    /**
     * Get the configured charset, falling back to UTF-8 for unknown names
     */
    public Charset getCharset() {
        try {
            return Charset.forName(csvCharset);
        } catch (IllegalArgumentException e) {
            return Charset.forName("UTF-8");
        }
    }
}
