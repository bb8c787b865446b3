package com.fedround.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a flat, already-cleaned CSV table into a {@link Dataset}.
 * 
 * The first line is the header. The column named like the label column is the
 * categorical target, every other column must be numeric.
 */
public final class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    public static final String DEFAULT_LABEL_COLUMN = "label";

    private DatasetLoader() {
    }

    public static Dataset fromCsv(Path path) throws IOException {
        return fromCsv(path, DEFAULT_LABEL_COLUMN);
    }

    /**
     * @param path CSV file with header
     * @param labelColumn name of the label column
     * @return the loaded dataset
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the header lacks the label column or a row is malformed
     */
    public static Dataset fromCsv(Path path, String labelColumn) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Dataset dataset = parse(reader, labelColumn);
            log.info("[OK] Dataset loaded from {}: {}", path, dataset);
            return dataset;
        }
    }

    static Dataset parse(BufferedReader reader, String labelColumn) throws IOException {
        String header = reader.readLine();
        if (header == null) {
            throw new IllegalArgumentException("CSV is empty (no header)");
        }

        String[] columns = split(header);
        int labelIndex = -1;
        List<String> featureNames = new ArrayList<>();
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].equals(labelColumn)) {
                labelIndex = i;
            } else {
                featureNames.add(columns[i]);
            }
        }
        if (labelIndex < 0) {
            throw new IllegalArgumentException("Label column '" + labelColumn + "' not found in header");
        }

        List<Row> rows = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] cells = split(line);
            if (cells.length != columns.length) {
                throw new IllegalArgumentException(String.format(
                    "Line %d has %d cell(s), header has %d", lineNumber, cells.length, columns.length));
            }

            double[] features = new double[featureNames.size()];
            int f = 0;
            for (int i = 0; i < cells.length; i++) {
                if (i == labelIndex) {
                    continue;
                }
                try {
                    features[f++] = Double.parseDouble(cells[i]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(String.format(
                        "Line %d column '%s' is not numeric: %s", lineNumber, columns[i], cells[i]), e);
                }
            }
            rows.add(new Row(rows.size(), features, cells[labelIndex]));
        }

        return new Dataset(featureNames, rows);
    }

    private static String[] split(String line) {
        String[] cells = line.split(",", -1);
        for (int i = 0; i < cells.length; i++) {
            cells[i] = cells[i].trim();
        }
        return cells;
    }
}
