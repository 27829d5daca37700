package heartdisease.etl.service;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.ExtractionException;
import heartdisease.etl.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service responsible for CSV parsing operations.
 *
 * Features:
 * - Read a CSV document (header line + data lines) into a raw table of strings
 * - Parse CSV rows handling quoted fields, commas and line breaks within quotes
 * - Map configured missing markers (e.g. empty, "?") to missing cells
 *
 * Header names are kept as they appear; canonicalizing them is the column normalizer's job.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    private final EtlConfig etlConfig;

    public CsvParsingService(EtlConfig etlConfig) {
        this.etlConfig = etlConfig;
    }

    /**
     * Parse a CSV document into a raw table.
     *
     * @param csv full CSV content, first line is the header
     * @return table of String cells (null for missing)
     * @throws ExtractionException if the document is empty or has no header
     */
    public DataTable readTable(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new ExtractionException("CSV content is empty");
        }

        Set<String> missingMarkers = new HashSet<>(etlConfig.getExtract().getMissingMarkers());

        try (BufferedReader reader = new BufferedReader(new StringReader(stripBom(csv)))) {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.trim().isEmpty()) {
                throw new ExtractionException("CSV file is empty or has no header");
            }
            headerLine = readRecord(reader, headerLine);

            List<String> headers = parseCsvRow(headerLine);
            if (headers.stream().allMatch(String::isEmpty)) {
                throw new ExtractionException("No valid headers found in CSV file");
            }

            List<List<String>> rows = new ArrayList<>();
            String line;
            long lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                long recordStart = lineNumber;
                String record = readRecord(reader, line);
                lineNumber += record.chars().filter(c -> c == '\n').count();
                List<String> values = parseCsvRow(record);
                if (values.size() != headers.size()) {
                    logger.warn("Line {} has {} fields, expected {}", recordStart, values.size(), headers.size());
                }
                List<String> row = new ArrayList<>(values.size());
                for (String value : values) {
                    row.add(missingMarkers.contains(value) ? null : value);
                }
                rows.add(row);
            }

            logger.debug("Parsed {} rows with {} columns", rows.size(), headers.size());
            return DataTable.fromRows(headers, rows);

        } catch (IOException e) {
            throw new ExtractionException("Failed to read CSV content", e);
        }
    }

    /**
     * Parse CSV row handling quoted fields and commas within quotes.
     * Follows RFC 4180 CSV specification for quote handling.
     *
     * Examples:
     *   "63,1,1,145" → ["63", "1", "1", "145"]
     *   "63,\"a, b\",1" → ["63", "a, b", "1"]
     *   "\"say \"\"hi\"\"\",2" → ["say \"hi\"", "2"]
     *
     * @param csvLine the CSV line to parse
     * @return list of trimmed field values
     */
    public List<String> parseCsvRow(String csvLine) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == '"') {
                // Handle escaped quotes (double quotes "" represent a single quote)
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
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
     * Complete a record whose quoted field spans line breaks by appending
     * the following lines until the quote is closed.
     */
    private static String readRecord(BufferedReader reader, String firstLine) throws IOException {
        if (!hasOpenQuote(firstLine)) {
            return firstLine;
        }
        StringBuilder record = new StringBuilder(firstLine);
        String next;
        while (hasOpenQuote(record) && (next = reader.readLine()) != null) {
            record.append('\n').append(next);
        }
        if (hasOpenQuote(record)) {
            logger.warn("Unterminated quoted field at end of CSV content");
        }
        return record.toString();
    }

    // doubled quotes inside a field count twice, so an odd total means a field is still open
    private static boolean hasOpenQuote(CharSequence text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }

    private static String stripBom(String csv) {
        return csv.charAt(0) == '\uFEFF' ? csv.substring(1) : csv;
    }
}
