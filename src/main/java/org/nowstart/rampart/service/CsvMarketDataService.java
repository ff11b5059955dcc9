package org.nowstart.rampart.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.ScheduledEngagement;
import org.nowstart.rampart.data.dto.TakeProfitLevel;
import org.nowstart.rampart.data.type.Direction;
import org.springframework.stereotype.Service;

/**
 * Reads bars and engagement schedules from CSV files. Rows are returned in file order and never deduplicated
 * or sorted: ordering problems must reach the simulation and fail it there.
 * <p>
 * Bars: {@code timestamp,open,high,low,close,volume}.
 * Engagements: {@code timestamp,id,direction,entry_price,stop_loss_pips,requested_size,take_profits} where
 * take-profits are {@code distancePips@fraction} joined by {@code |}.
 */
@Slf4j
@Service
public class CsvMarketDataService {

    private static final int BAR_COLUMNS = 6;
    private static final int ENGAGEMENT_COLUMNS = 7;

    public List<Bar> loadBars(Path path) {
        List<Bar> bars = new ArrayList<>();
        List<String> lines = readRows(path);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = splitCsvLine(line);
            requireColumns(path, i, parts, BAR_COLUMNS);
            try {
                bars.add(new Bar(
                        parseTs(parts[0]),
                        parseDouble(parts[1]),
                        parseDouble(parts[2]),
                        parseDouble(parts[3]),
                        parseDouble(parts[4]),
                        parseDouble(parts[5])
                ));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Malformed bar row " + (i + 1) + " in " + path, e);
            }
        }
        log.info("event=csv_bars_loaded path={} rows={}", path.toAbsolutePath(), bars.size());
        return List.copyOf(bars);
    }

    public List<ScheduledEngagement> loadEngagements(Path path) {
        List<ScheduledEngagement> engagements = new ArrayList<>();
        List<String> lines = readRows(path);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = splitCsvLine(line);
            requireColumns(path, i, parts, ENGAGEMENT_COLUMNS);
            try {
                Engagement engagement = new Engagement(
                        parts[1].trim(),
                        Direction.valueOf(parts[2].trim().toUpperCase(Locale.ROOT)),
                        parseDouble(parts[3]),
                        parseDouble(parts[4]),
                        parseTakeProfits(parts[6]),
                        parseDouble(parts[5])
                );
                engagements.add(new ScheduledEngagement(parseTs(parts[0]), engagement));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Malformed engagement row " + (i + 1) + " in " + path, e);
            }
        }
        log.info("event=csv_engagements_loaded path={} rows={}", path.toAbsolutePath(), engagements.size());
        return List.copyOf(engagements);
    }

    List<TakeProfitLevel> parseTakeProfits(String raw) {
        List<TakeProfitLevel> levels = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return levels;
        }
        for (String token : raw.trim().split("\\|")) {
            String[] pair = token.trim().split("@");
            if (pair.length != 2) {
                throw new IllegalArgumentException("take-profit must be distancePips@fraction, got: " + token);
            }
            levels.add(new TakeProfitLevel(parseDouble(pair[0]), parseDouble(pair[1])));
        }
        return levels;
    }

    private List<String> readRows(Path path) {
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (lines.size() < 2) {
                throw new IllegalArgumentException("CSV has no rows: " + path);
            }
            return lines;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    private void requireColumns(Path path, int index, String[] parts, int expected) {
        if (parts.length < expected) {
            throw new IllegalArgumentException(
                    "Row " + (index + 1) + " in " + path + " has " + parts.length + " columns, expected " + expected
            );
        }
    }

    private Instant parseTs(String raw) {
        String ts = raw.trim();
        if (ts.endsWith("Z") || ts.endsWith("z")) {
            return Instant.parse(ts.toUpperCase(Locale.ROOT));
        }
        return Instant.parse(ts + "Z");
    }

    private String[] splitCsvLine(String line) {
        return line.split(",", -1);
    }

    private double parseDouble(String raw) {
        return Double.parseDouble(raw.trim());
    }
}
