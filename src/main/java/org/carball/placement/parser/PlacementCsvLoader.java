package org.carball.placement.parser;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.carball.placement.model.placement.PlacementRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the placement statistics export of the ad network.
 * <p>
 * The export is a semicolon separated file. It starts with a preamble (client header, totals and a blank
 * line), followed by a header row and one row per placement. Numbers use a comma as decimal separator and
 * spaces as thousands separators; empty cells and {@code -} mean zero.
 */
@Slf4j
public class PlacementCsvLoader {

    public static final int DEFAULT_PREAMBLE_LINES = 4;

    private static final char SEPARATOR = ';';
    private static final char BOM = '\uFEFF';

    // Column positions in the export
    private static final int COL_PLACEMENT_TYPE = 0;
    private static final int COL_PLACEMENT = 1;
    private static final int COL_IMPRESSIONS = 2;
    private static final int COL_CLICKS = 3;
    private static final int COL_CTR = 4;
    private static final int COL_SPEND = 5;
    private static final int COL_AVERAGE_CPC = 6;
    private static final int COL_BOUNCE_RATE = 7;
    private static final int COL_DEPTH = 8;
    private static final int COL_COST_PER_CONVERSION = 9;
    private static final int COL_CONVERSIONS = 10;
    private static final int COLUMN_COUNT = 11;

    private final CsvMapper csvMapper;
    private final int preambleLines;

    public PlacementCsvLoader() {
        this(DEFAULT_PREAMBLE_LINES);
    }

    public PlacementCsvLoader(int preambleLines) {
        if (preambleLines < 0) {
            throw new IllegalArgumentException("Preamble line count must not be negative: " + preambleLines);
        }
        this.preambleLines = preambleLines;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public List<PlacementRecord> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Placement export file not found: " + file);
        }

        List<PlacementRecord> records = parse(Files.readString(file, StandardCharsets.UTF_8));
        log.info("Loaded {} placements from {}", records.size(), file);
        return records;
    }

    public List<PlacementRecord> parse(String content) throws IOException {
        String table = stripPreamble(stripBom(content));

        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(SEPARATOR);
        List<String[]> rows;
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).with(schema).readValues(table)) {
            rows = iterator.readAll();
        }

        if (rows.isEmpty()) {
            log.warn("Placement export contains no header row");
            return List.of();
        }

        log.debug("Columns: {}", Arrays.toString(rows.get(0)));

        List<PlacementRecord> records = new ArrayList<>();
        int discarded = 0;
        for (int i = 1; i < rows.size(); i++) {
            String[] row = pad(rows.get(i));
            String placement = row[COL_PLACEMENT].trim();
            if (placement.isEmpty()) {
                discarded++;
                continue;
            }
            records.add(toRecord(placement, row));
        }

        if (discarded > 0) {
            log.debug("Discarded {} rows without a placement name", discarded);
        }
        return records;
    }

    private PlacementRecord toRecord(String placement, String[] row) {
        return PlacementRecord.builder()
                .placementType(row[COL_PLACEMENT_TYPE].trim())
                .placement(placement)
                .impressions(parseCount(row[COL_IMPRESSIONS]))
                .clicks(parseCount(row[COL_CLICKS]))
                .ctr(parseNumber(row[COL_CTR]))
                .spend(parseNumber(row[COL_SPEND]))
                .averageCpc(parseNumber(row[COL_AVERAGE_CPC]))
                .bounceRate(parseNumber(row[COL_BOUNCE_RATE]))
                .depth(parseNumber(row[COL_DEPTH]))
                .costPerConversion(parseNumber(row[COL_COST_PER_CONVERSION]))
                .conversions(parseCount(row[COL_CONVERSIONS]))
                .build();
    }

    /**
     * Converts a locale formatted cell such as {@code "1 234,56"} to a number. Empty cells, {@code "-"}
     * and values that cannot be parsed become 0.
     */
    static double parseNumber(String raw) {
        if (raw == null) {
            return 0;
        }
        String value = raw.trim();
        if (value.isEmpty() || value.equals("-")) {
            return 0;
        }

        String normalized = value
                .replace(" ", "")
                .replace("\u00A0", "")
                .replace("\u202F", "")
                .replace(',', '.');
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            log.warn("Cannot parse numeric value '{}', using 0", raw);
            return 0;
        }
    }

    /**
     * Converts a count cell. Fractional values are rounded up so that any positive value stays positive.
     */
    static long parseCount(String raw) {
        double value = parseNumber(raw);
        if (value != Math.rint(value)) {
            log.warn("Count value '{}' is not a whole number, using {}", raw, (long) Math.ceil(value));
            return (long) Math.ceil(value);
        }
        return (long) value;
    }

    private String stripPreamble(String content) {
        if (preambleLines == 0) {
            return content;
        }
        String[] lines = content.split("\\R", -1);
        if (lines.length <= preambleLines) {
            return "";
        }
        return String.join("\n", Arrays.copyOfRange(lines, preambleLines, lines.length));
    }

    private static String stripBom(String content) {
        return !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;
    }

    private static String[] pad(String[] row) {
        if (row.length >= COLUMN_COUNT) {
            return row;
        }
        String[] padded = Arrays.copyOf(row, COLUMN_COUNT);
        Arrays.fill(padded, row.length, COLUMN_COUNT, "");
        return padded;
    }
}
