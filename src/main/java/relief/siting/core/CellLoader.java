package relief.siting.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import relief.siting.utils.Log;

/**
 * CSV loader for census cells.
 * - Reads data/cells.csv (header row required)
 * - Accepts common column aliases and derives need when the column is missing
 * - Rows with no population, or with values that do not parse, are left out
 */
public final class CellLoader {

    public static final String DEFAULT_FILE = "cells.csv";

    private CellLoader() {}

    private static String[] splitCsv(String line) {
        // Simple split on commas; trim cells and surrounding quotes
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            String s = parts[i].trim();
            if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) s = s.substring(1, s.length() - 1);
            parts[i] = s;
        }
        return parts;
    }

    public static List<Cell> load(Path cellsCsv) throws IOException {
        List<String> lines = Files.readAllLines(cellsCsv, StandardCharsets.UTF_8);
        if (lines.isEmpty()) throw new IOException("Empty CSV file: " + cellsCsv);

        String[] header = splitCsv(lines.get(0));
        int idxId = indexOf(header, "id", "geoid");
        int idxLat = indexOf(header, "lat", "latitude");
        int idxLon = indexOf(header, "lon", "longitude");
        int idxPopulation = indexOf(header, "population", "pop");
        int idxRisk = indexOf(header, "risk_score", "food_insecurity_score");
        int idxNeed = indexOfOptional(header, "need");
        int idxPoverty = indexOfOptional(header, "poverty_rate");
        int idxSnap = indexOfOptional(header, "snap_rate");
        int idxVehicle = indexOfOptional(header, "vehicle_access_rate");

        List<Cell> cells = new ArrayList<>();
        int skipped = 0;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            String[] row = splitCsv(line);
            String id = get(row, idxId);
            int population = (int) Math.round(parseDoubleSafe(get(row, idxPopulation), 0.0));
            if (id.isEmpty() || population <= 0) {
                skipped++;
                continue;
            }
            Cell cell = new Cell(
                    id,
                    parseDoubleSafe(get(row, idxLat), Double.NaN),
                    parseDoubleSafe(get(row, idxLon), Double.NaN),
                    population,
                    parseDoubleSafe(get(row, idxRisk), 0.0),
                    idxNeed >= 0 ? parseDoubleNullable(get(row, idxNeed)) : null,
                    parseDoubleSafe(get(row, idxPoverty), 0.0),
                    parseDoubleSafe(get(row, idxSnap), 0.0),
                    parseDoubleSafe(get(row, idxVehicle), 1.0));
            if (!cell.isWellFormed()) {
                Log.debug("[CellLoader] Line %d skipped: unparseable or out-of-range values", i + 1);
                skipped++;
                continue;
            }
            cells.add(cell);
        }
        if (skipped > 0) {
            Log.warn("[CellLoader] Skipped %d rows without id, population or valid values", skipped);
        }
        Log.info("[CellLoader] Loaded %d cells from %s", cells.size(), cellsCsv.getFileName());
        return cells;
    }

    private static int indexOf(String[] arr, String key, String alias) throws IOException {
        int idx = indexOfOptional(arr, key);
        if (idx < 0) idx = indexOfOptional(arr, alias);
        if (idx < 0) throw new IOException("Missing column: " + key + " (or " + alias + ")");
        return idx;
    }

    private static int indexOfOptional(String[] arr, String key) {
        for (int i = 0; i < arr.length; i++) {
            if (arr[i].equalsIgnoreCase(key)) return i;
        }
        return -1;
    }

    private static String get(String[] row, int idx) {
        if (idx < 0 || idx >= row.length) return "";
        return row[idx];
    }

    private static Double parseDoubleNullable(String s) {
        if (s == null) return null;
        s = s.trim();
        if (s.isEmpty()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double parseDoubleSafe(String s, double defVal) {
        Double v = parseDoubleNullable(s);
        return v == null ? defVal : v;
    }
}
