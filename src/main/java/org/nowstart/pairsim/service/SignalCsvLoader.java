package org.nowstart.pairsim.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.exception.SignalValidationException;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SignalCsvLoader {

    public static final String DATE_COLUMN = "Date";
    public static final String PAIR_COLUMN = "Pair_ID";
    public static final String Z_SCORE_COLUMN = "Z_Score";
    public static final String SPREAD_COLUMN = "Spread";
    public static final String TARGET_RETURN_COLUMN = "Target_Return";
    public static final String TARGET_DIRECTION_COLUMN = "Target_Direction";
    public static final String DEFAULT_PAIR_ID = "PAIR";

    public List<SignalRow> load(BacktestProperties properties) {
        return load(Path.of(properties.signalsCsv()), properties);
    }

    public List<SignalRow> load(Path path, BacktestProperties properties) {
        List<String> lines = readLines(path);
        if (lines.isEmpty()) {
            throw new SignalValidationException("empty_file", null, null, "header", "CSV has no header: " + path);
        }

        Map<String, Integer> header = parseHeader(lines.get(0), path);
        Set<String> predictionColumns = properties.resolvePredictionColumns();
        for (String column : requiredColumns(properties.mode(), predictionColumns)) {
            if (!header.containsKey(column)) {
                throw new SignalValidationException("missing_column", null, null, column, "Required column is missing from " + path);
            }
        }

        int dateIndex = header.getOrDefault(DATE_COLUMN, 0);
        Integer pairIndex = header.get(PAIR_COLUMN);
        List<SignalRow> rows = new ArrayList<>(lines.size());
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(",", -1);
            if (parts.length < header.size()) {
                throw new SignalValidationException("malformed_row", null, null, "line " + (i + 1),
                        "Expected " + header.size() + " cells but found " + parts.length);
            }

            LocalDate date = parseDate(parts[dateIndex], i + 1);
            String pairId = pairIndex == null ? DEFAULT_PAIR_ID : parts[pairIndex].trim();
            CellReader cells = new CellReader(header, parts, date, pairId);

            Map<String, Double> predictions = new LinkedHashMap<>();
            for (String column : predictionColumns) {
                predictions.put(column, cells.number(column));
            }
            rows.add(new SignalRow(
                    date,
                    pairId,
                    cells.number(Z_SCORE_COLUMN),
                    cells.number(SPREAD_COLUMN),
                    predictions,
                    cells.number(TARGET_RETURN_COLUMN),
                    cells.direction(TARGET_DIRECTION_COLUMN)
            ));
        }

        rows.sort(Comparator.comparing(SignalRow::date));
        log.info("event=signals_loaded path={} rows={}", path.toAbsolutePath(), rows.size());
        return rows;
    }

    private List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    private Map<String, Integer> parseHeader(String line, Path path) {
        String[] names = stripBom(line).split(",", -1);
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim();
            if (header.putIfAbsent(name, i) != null) {
                throw new SignalValidationException("malformed_header", null, null, name,
                        "Duplicate column name in header of " + path);
            }
        }
        return header;
    }

    private Set<String> requiredColumns(SimulationMode mode, Set<String> predictionColumns) {
        Set<String> required = new LinkedHashSet<>();
        required.add(Z_SCORE_COLUMN);
        if (mode == SimulationMode.SPREAD_PRICE) {
            required.add(SPREAD_COLUMN);
        } else {
            required.add(TARGET_RETURN_COLUMN);
            required.add(TARGET_DIRECTION_COLUMN);
        }
        required.addAll(predictionColumns);
        return required;
    }

    private LocalDate parseDate(String raw, int lineNumber) {
        String value = raw.trim();
        int timeSeparator = value.indexOf(value.contains("T") ? 'T' : ' ');
        if (timeSeparator > 0) {
            value = value.substring(0, timeSeparator);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new SignalValidationException("unparsable_value", DATE_COLUMN,
                    "line " + lineNumber + ": cannot parse date '" + raw + "'", e);
        }
    }

    private String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }

    private record CellReader(Map<String, Integer> header, String[] parts, LocalDate date, String pairId) {

        double number(String column) {
            Integer index = header.get(column);
            if (index == null) {
                return Double.NaN;
            }
            String raw = parts[index].trim();
            if (raw.isEmpty() || raw.toLowerCase(Locale.ROOT).equals("nan")) {
                return Double.NaN;
            }
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new SignalValidationException("unparsable_value", date, pairId, column, "Cannot parse number '" + raw + "'");
            }
        }

        int direction(String column) {
            double value = number(column);
            if (Double.isNaN(value)) {
                return SignalRow.UNKNOWN_DIRECTION;
            }
            if (value == 0.0 || value == 1.0) {
                return (int) value;
            }
            throw new SignalValidationException("unparsable_value", date, pairId, column, "Direction must be 0 or 1 but was " + value);
        }
    }
}
