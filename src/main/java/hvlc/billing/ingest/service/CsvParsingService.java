package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.CsvProcessingConfig;
import hvlc.billing.ingest.model.CsvDialect;
import hvlc.billing.ingest.model.ReportTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for reading delimited billing report files.
 *
 * Features:
 * - Read a leading character sample for dialect sniffing
 * - Parse rows handling quoted fields, doubled quotes and delimiters within quotes
 * - Quoted fields may span several physical lines
 * - Load a whole file (or its first N rows) into a {@link ReportTable}
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvProcessingConfig config;

    public CsvParsingService(CsvProcessingConfig config) {
        this.config = config;
    }

    /**
     * Read up to {@code maxChars} characters from the start of the file.
     * A leading byte order mark is skipped and does not count toward the
     * limit, so a sample of exactly {@code maxChars} characters means the
     * file may continue past it.
     *
     * @param file the report file
     * @param maxChars sample size in characters
     * @return the sample, without a leading byte order mark
     * @throws IOException if the file cannot be read
     */
    public String readSample(Path file, int maxChars) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, config.getCharset())) {
            reader.mark(1);
            if (reader.read() != BYTE_ORDER_MARK) {
                reader.reset();
            }
            char[] buffer = new char[maxChars];
            int total = 0;
            int read;
            while (total < maxChars && (read = reader.read(buffer, total, maxChars - total)) != -1) {
                total += read;
            }
            return new String(buffer, 0, total);
        }
    }

    /**
     * Extract the header row of the file.
     *
     * @param file the report file
     * @param dialect delimiter and quote character to use
     * @return trimmed header names
     * @throws IOException if file cannot be read
     * @throws IllegalArgumentException if the file is empty or has no header
     */
    public List<String> extractHeaders(Path file, CsvDialect dialect) throws IOException {
        logger.debug("Extracting headers from file: {}", file.getFileName());

        try (BufferedReader reader = Files.newBufferedReader(file, config.getCharset())) {
            String headerRecord = readRecord(reader, dialect.getQuoteChar());
            if (headerRecord == null || headerRecord.trim().isEmpty()) {
                throw new IllegalArgumentException("CSV file is empty or has no header");
            }
            return parseCsvRow(stripByteOrderMark(headerRecord), dialect.getDelimiter(), dialect.getQuoteChar());
        }
    }

    /**
     * Load the whole file into a table. The first record is the header.
     */
    public ReportTable readTable(Path file, CsvDialect dialect) throws IOException {
        return readTable(file, dialect, -1);
    }

    /**
     * Load the header and at most {@code maxRows} data rows into a table.
     * Blank lines are skipped.
     *
     * @param file the report file
     * @param dialect delimiter and quote character to use
     * @param maxRows row limit, negative for no limit
     * @return the loaded table; all cells are strings or null
     * @throws IOException if file cannot be read
     * @throws IllegalArgumentException if the file is empty or has no header
     */
    public ReportTable readTable(Path file, CsvDialect dialect, int maxRows) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, config.getCharset())) {
            String headerRecord = readRecord(reader, dialect.getQuoteChar());
            if (headerRecord == null || headerRecord.trim().isEmpty()) {
                throw new IllegalArgumentException("CSV file is empty or has no header");
            }
            List<String> headers = parseCsvRow(stripByteOrderMark(headerRecord),
                    dialect.getDelimiter(), dialect.getQuoteChar());

            List<List<String>> rows = new ArrayList<>();
            String record;
            while ((maxRows < 0 || rows.size() < maxRows)
                    && (record = readRecord(reader, dialect.getQuoteChar())) != null) {
                if (record.trim().isEmpty()) {
                    continue;
                }
                List<String> row = parseCsvRow(record, dialect.getDelimiter(), dialect.getQuoteChar());
                if (row.size() != headers.size()) {
                    logger.debug("Row {} of {} has {} fields, header has {}",
                            rows.size() + 1, file.getFileName(), row.size(), headers.size());
                }
                rows.add(row);
            }

            logger.debug("Read {} rows x {} columns from {}", rows.size(), headers.size(), file.getFileName());
            return new ReportTable(headers, rows);
        }
    }

    /**
     * Parse a comma-separated, double-quoted row.
     */
    public List<String> parseCsvRow(String csvLine) {
        return parseCsvRow(csvLine, config.getCsvDelimiter(), config.getCsvQuoteChar());
    }

    /**
     * Parse a delimited row handling quoted fields and delimiters within quotes.
     * Follows RFC 4180 for quote handling, with a configurable delimiter.
     *
     * Examples (delimiter ',' quote '"'):
     *   "John,Smith,30" → ["John", "Smith", "30"]
     *   "John,\"Smith, Jr.\",30" → ["John", "Smith, Jr.", "30"]
     *   "\"Author \"\"John\"\" Doe\",50" → ["Author \"John\" Doe", "50"]
     *
     * @param csvLine the record to parse
     * @param delimiter field delimiter
     * @param quoteChar quote character
     * @return list of trimmed field values
     */
    public List<String> parseCsvRow(String csvLine, char delimiter, char quoteChar) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == quoteChar) {
                // Doubled quote inside a quoted field is a literal quote
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == quoteChar) {
                    currentValue.append(quoteChar);
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        values.add(currentValue.toString().trim());

        return values;
    }

    /**
     * Read one logical record: a physical line, extended with the following
     * lines while a quoted field is still open.
     */
    private String readRecord(BufferedReader reader, char quoteChar) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder record = new StringBuilder(line);
        while (hasOpenQuote(record, quoteChar)) {
            String next = reader.readLine();
            if (next == null) {
                break;
            }
            record.append('\n').append(next);
        }
        return record.toString();
    }

    private boolean hasOpenQuote(CharSequence text, char quoteChar) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == quoteChar) {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }

    private String stripByteOrderMark(String text) {
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            return text.substring(1);
        }
        return text;
    }
}
