package hvlc.billing.ingest.service;

import hvlc.billing.ingest.config.CsvProcessingConfig;
import hvlc.billing.ingest.model.CsvDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guesses the dialect of a delimited file from a leading sample.
 *
 * Delimiter: the candidate whose per-line count (outside quotes) is the most
 * consistent across the sample lines, ignoring candidates that never occur.
 *
 * Header: the first row is compared with the data rows below it. For every
 * column whose data values share one type (integer, decimal, or a fixed
 * length), the header cell votes "header" when it does not fit that type and
 * "data" when it does. More header votes than data votes means a header row.
 */
@Service
public class CsvDialectSniffer {

    private static final Logger logger = LoggerFactory.getLogger(CsvDialectSniffer.class);

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(nan|inf|infinity)",
            Pattern.CASE_INSENSITIVE);

    private static final String TYPE_INTEGER = "int";
    private static final String TYPE_DECIMAL = "float";
    private static final String TYPE_LENGTH_PREFIX = "len:";

    private final CsvProcessingConfig config;
    private final CsvParsingService csvParsingService;

    public CsvDialectSniffer(CsvProcessingConfig config, CsvParsingService csvParsingService) {
        this.config = config;
        this.csvParsingService = csvParsingService;
    }

    /**
     * Sniff the dialect of a file from its leading sample.
     *
     * @param file the report file
     * @return sniffed dialect including header presence
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if no delimiter can be determined
     */
    public CsvDialect sniff(Path file) throws IOException {
        String sample = csvParsingService.readSample(file, config.getSniffSampleSize());
        CsvDialect dialect = sniff(sample);
        dialect.setHasHeader(hasHeader(sample, dialect));
        logger.debug("Sniffed dialect for {}: delimiter='{}' quote='{}' header={}",
                file.getFileName(), printable(dialect.getDelimiter()), dialect.getQuoteChar(), dialect.isHasHeader());
        return dialect;
    }

    /**
     * Sniff the delimiter and quote character of a sample.
     *
     * @throws IllegalArgumentException if no candidate delimiter occurs consistently
     */
    public CsvDialect sniff(String sample) {
        List<String> lines = sampleLines(sample);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Could not determine delimiter: sample is empty");
        }

        char bestDelimiter = 0;
        double bestConsistency = 0.0;

        for (char candidate : config.getCandidateDelimiters().toCharArray()) {
            Map<Integer, Integer> frequencies = new HashMap<>();
            for (String line : lines) {
                frequencies.merge(countOutsideQuotes(line, candidate, '"'), 1, Integer::sum);
            }

            // Most common per-line count, ignoring lines without the candidate
            int modeCount = 0;
            int modeLines = 0;
            for (Map.Entry<Integer, Integer> entry : frequencies.entrySet()) {
                if (entry.getKey() > 0 && entry.getValue() > modeLines) {
                    modeCount = entry.getKey();
                    modeLines = entry.getValue();
                }
            }
            if (modeCount == 0) {
                continue;
            }

            double consistency = (double) modeLines / lines.size();
            if (consistency > bestConsistency) {
                bestConsistency = consistency;
                bestDelimiter = candidate;
            }
        }

        if (bestDelimiter == 0) {
            throw new IllegalArgumentException("Could not determine delimiter");
        }

        return new CsvDialect(bestDelimiter, guessQuoteChar(sample, bestDelimiter), true);
    }

    /**
     * Decide whether the first row of the sample is a header row.
     */
    public boolean hasHeader(String sample, CsvDialect dialect) {
        List<String> lines = sampleLines(sample);
        if (lines.isEmpty()) {
            return false;
        }

        List<String> header = csvParsingService.parseCsvRow(lines.get(0), dialect.getDelimiter(), dialect.getQuoteChar());
        int columns = header.size();

        // column index -> type shared by all data values (null until first seen)
        Map<Integer, String> columnTypes = new LinkedHashMap<>();
        for (int i = 0; i < columns; i++) {
            columnTypes.put(i, null);
        }

        int checked = 0;
        for (String line : lines.subList(1, lines.size())) {
            if (checked >= config.getHeaderCheckRows()) {
                break;
            }
            checked++;

            List<String> row = csvParsingService.parseCsvRow(line, dialect.getDelimiter(), dialect.getQuoteChar());
            if (row.size() != columns) {
                continue;
            }

            for (Integer column : new ArrayList<>(columnTypes.keySet())) {
                String type = classify(row.get(column));
                String known = columnTypes.get(column);
                if (known == null) {
                    columnTypes.put(column, type);
                } else if (!known.equals(type)) {
                    columnTypes.remove(column);
                }
            }
        }

        int votes = 0;
        for (Map.Entry<Integer, String> entry : columnTypes.entrySet()) {
            String type = entry.getValue();
            String headerCell = header.get(entry.getKey());
            if (type == null) {
                votes++;
            } else if (type.startsWith(TYPE_LENGTH_PREFIX)) {
                int length = Integer.parseInt(type.substring(TYPE_LENGTH_PREFIX.length()));
                votes += headerCell.length() != length ? 1 : -1;
            } else {
                votes += classify(headerCell).equals(type) ? -1 : 1;
            }
        }

        return votes > 0;
    }

    private String classify(String value) {
        String trimmed = value.trim();
        if (INTEGER_PATTERN.matcher(trimmed).matches()) {
            return TYPE_INTEGER;
        }
        if (DECIMAL_PATTERN.matcher(trimmed).matches()) {
            return TYPE_DECIMAL;
        }
        return TYPE_LENGTH_PREFIX + value.length();
    }

    /**
     * Non-blank lines of the sample. When the sample filled the whole sniff
     * buffer its last line may be cut short and is dropped.
     */
    private List<String> sampleLines(String sample) {
        String[] split = sample.split("\r?\n", -1);
        int end = split.length;
        boolean truncated = sample.length() >= config.getSniffSampleSize();
        if (truncated && end > 1 && !sample.endsWith("\n")) {
            end--;
        }
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < end; i++) {
            if (!split[i].trim().isEmpty()) {
                lines.add(split[i]);
            }
        }
        return lines;
    }

    private int countOutsideQuotes(String line, char delimiter, char quoteChar) {
        int count = 0;
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == quoteChar) {
                inQuotes = !inQuotes;
            } else if (c == delimiter && !inQuotes) {
                count++;
            }
        }
        return count;
    }

    private char guessQuoteChar(String sample, char delimiter) {
        int doubleQuoted = countQuotedBoundaries(sample, delimiter, '"');
        int singleQuoted = countQuotedBoundaries(sample, delimiter, '\'');
        return singleQuoted > doubleQuoted ? '\'' : '"';
    }

    private int countQuotedBoundaries(String sample, char delimiter, char quoteChar) {
        String opening = "" + delimiter + quoteChar;
        String closing = "" + quoteChar + delimiter;
        int count = 0;
        for (int i = sample.indexOf(opening); i >= 0; i = sample.indexOf(opening, i + 1)) {
            count++;
        }
        for (int i = sample.indexOf(closing); i >= 0; i = sample.indexOf(closing, i + 1)) {
            count++;
        }
        return count;
    }

    private String printable(char c) {
        return c == '\t' ? "\\t" : String.valueOf(c);
    }
}
