package org.tushareplus.rest.csv;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVParser;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.EndpointLimits;
import org.tushareplus.rest.interfaces.LimitStore;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link LimitStore} backed by a flat CSV table, one row per endpoint.
 *
 * <p><b>File format:</b></p>
 * <pre>
 * api_name,limit_per_request,rate_limit,last_updated
 * daily,6000,500,2025-05-06 10:15:00
 * stock_basic,0,200,2025-05-06 10:16:12
 * </pre>
 *
 * <p>Rows written by older clients may carry an infinity sentinel ({@code inf}) or decimal notation
 * ({@code 5000.0}); both are read back as the integer convention where {@code 0} means "no limit".
 * Rows that cannot be parsed are logged and ignored on read, and kept verbatim when the file is rewritten.
 * A record without a timestamp is stored with an empty {@code last_updated} cell.</p>
 *
 * <p>Thread-safety: all operations are synchronized on the store; writes replace the file atomically.</p>
 */
public class CsvLimitStore implements LimitStore {

    private static final Logger logger = LoggerFactory.getLogger(CsvLimitStore.class);

    static final String[] HEADER = {"api_name", "limit_per_request", "rate_limit", "last_updated"};
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path csvPath;

    /**
     * Opens the store, creating parent directories and a header-only file when missing.
     *
     * @throws UncheckedIOException if the file cannot be created
     */
    public CsvLimitStore(Path csvPath) {
        this.csvPath = csvPath;
        try {
            Path parent = csvPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(csvPath)) {
                writeAll(Collections.emptyList());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot initialize limits file " + csvPath, e);
        }
        logger.info("API limits file: {}", csvPath);
    }

    @Override
    public synchronized Optional<EndpointLimits> get(String endpointName) {
        List<StoredLine> lines;
        try {
            lines = readLines();
        } catch (IOException e) {
            logger.warn("Failed to read limits file {}: {}", csvPath, e.getMessage());
            return Optional.empty();
        }
        for (StoredLine line : lines) {
            if (line.belongsTo(endpointName)) {
                return parseRow(line.getFields());
            }
        }
        return Optional.empty();
    }

    /**
     * Inserts or replaces the endpoint's row. Other rows, including ones that cannot be parsed, are kept as they are.
     *
     * @throws UncheckedIOException if the file cannot be read or written; the file is left untouched
     */
    @Override
    public synchronized void put(EndpointLimits limits) {
        String endpointName = limits.getEndpointName();
        try {
            List<StoredLine> lines = readLines();
            String newLine = formatRow(toRow(limits));
            boolean replaced = false;
            List<String> updated = new ArrayList<>(lines.size() + 1);
            for (StoredLine line : lines) {
                if (line.belongsTo(endpointName)) {
                    if (!replaced) {
                        updated.add(newLine);
                        replaced = true;
                    }
                } else {
                    updated.add(line.getRaw());
                }
            }
            if (!replaced) {
                updated.add(newLine);
            }
            writeAll(updated);
            logger.info("Saved limits of {} to {}", endpointName, csvPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save limits of " + endpointName + " to " + csvPath, e);
        }
    }

    /**
     * @throws UncheckedIOException if the file cannot be read or written; the file is left untouched
     */
    @Override
    public synchronized void delete(String endpointName) {
        try {
            List<StoredLine> lines = readLines();
            List<String> remaining = new ArrayList<>(lines.size());
            for (StoredLine line : lines) {
                if (!line.belongsTo(endpointName)) {
                    remaining.add(line.getRaw());
                }
            }
            if (remaining.size() == lines.size()) {
                logger.info("No limits of {} found in {}, nothing to delete", endpointName, csvPath);
                return;
            }
            writeAll(remaining);
            logger.info("Deleted limits of {} from {}", endpointName, csvPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete limits of " + endpointName + " from " + csvPath, e);
        }
    }

    /**
     * Reads all data lines (header and blank lines excluded). Each line is parsed on its own, so a line that is
     * not valid CSV yields a {@link StoredLine} without fields instead of failing the whole read.
     *
     * @throws IOException if the file exists but cannot be read
     */
    private List<StoredLine> readLines() throws IOException {
        if (!Files.exists(csvPath)) {
            return new ArrayList<>();
        }
        ICSVParser parser = new CSVParserBuilder().build();
        List<String> raw = Files.readAllLines(csvPath, StandardCharsets.UTF_8);
        List<StoredLine> lines = new ArrayList<>(raw.size());
        boolean first = true;
        for (String text : raw) {
            if (text.isBlank()) {
                continue;
            }
            String[] fields;
            try {
                fields = parser.parseLine(text);
            } catch (IOException e) {
                logger.warn("Ignoring unparseable line in {}: {} ({})", csvPath, text, e.getMessage());
                fields = null;
            }
            if (first && fields != null && fields.length > 0 && HEADER[0].equals(fields[0].trim())) {
                first = false;
                continue;
            }
            first = false;
            lines.add(new StoredLine(text, fields));
        }
        return lines;
    }

    private void writeAll(List<String> lines) throws IOException {
        Path tmp = csvPath.resolveSibling(csvPath.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            writer.write(formatRow(HEADER));
            writer.write(CSVWriter.DEFAULT_LINE_END);
            for (String line : lines) {
                writer.write(line);
                writer.write(CSVWriter.DEFAULT_LINE_END);
            }
        }
        Files.move(tmp, csvPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static String formatRow(String[] row) throws IOException {
        StringWriter out = new StringWriter();
        try (CSVWriter csvWriter = new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.NO_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "")) {
            csvWriter.writeNext(row, false);
        }
        return out.toString();
    }

    private static String[] toRow(EndpointLimits limits) {
        LocalDateTime updated = limits.getLastUpdated();
        return new String[]{
                limits.getEndpointName(),
                Integer.toString(limits.getPerRequestCap()),
                Integer.toString(limits.getRatePerMinute()),
                updated == null ? "" : TIMESTAMP_FORMAT.format(updated)
        };
    }

    private Optional<EndpointLimits> parseRow(String[] row) {
        if (row.length < 3) {
            logger.warn("Ignoring malformed limits row in {}: {}", csvPath, String.join(",", row));
            return Optional.empty();
        }
        try {
            int cap = parseLimit(row[1]);
            int rate = parseLimit(row[2]);
            LocalDateTime updated = row.length > 3 ? parseTimestamp(row[3]) : null;
            return Optional.of(new EndpointLimits(row[0], cap, rate, updated));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring malformed limits row of {} in {}: {}", row[0], csvPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses a stored limit, mapping the legacy infinity sentinel to 0 ("no limit").
     */
    static int parseLimit(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        if (StringUtils.equalsAnyIgnoreCase(trimmed, "inf", "infinity", "+inf")) {
            return 0;
        }
        double parsed = Double.parseDouble(trimmed);
        if (Double.isInfinite(parsed)) {
            return 0;
        }
        if (Double.isNaN(parsed) || parsed < 0 || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("limit out of range: " + value);
        }
        return (int) parsed;
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Getter
    @AllArgsConstructor
    private static final class StoredLine {
        /** Line as found in the file, written back unchanged when another endpoint is updated. */
        private final String raw;
        /** Parsed cells, null if the line is not valid CSV. */
        private final String[] fields;

        boolean belongsTo(String endpointName) {
            return fields != null && fields.length > 0 && endpointName.equals(fields[0]);
        }
    }
}
