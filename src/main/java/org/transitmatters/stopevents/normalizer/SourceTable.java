package org.transitmatters.stopevents.normalizer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Raw tabular source: a header and the rows below it, all values kept as strings.
 */
public class SourceTable {
    private final String name;
    private final ImmutableList<String> header;
    private final ImmutableMap<String, Integer> columnIndexes;
    private final ImmutableList<String[]> rows;

    private SourceTable(String name, List<String> header, List<String[]> rows) {
        this.name = name;
        this.header = ImmutableList.copyOf(header);

        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            // first occurrence wins if a column name repeats
            indexes.putIfAbsent(header.get(i), i);
        }
        this.columnIndexes = ImmutableMap.copyOf(indexes);
        this.rows = ImmutableList.copyOf(rows);
    }

    public static SourceTable of(String name, List<String> header, List<String[]> rows) {
        return new SourceTable(name, header, rows);
    }

    /**
     * Reads a CSV file. Files ending in .gz are decompressed on the fly.
     */
    public static SourceTable fromFile(Path path) throws SourceReadException {
        if (!Files.isRegularFile(path)) {
            throw new SourceReadException(path + " is not a readable file");
        }
        try (InputStream in = open(path);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(path.getFileName().toString(), reader);
        } catch (IOException e) {
            throw new SourceReadException("Failed to read " + path, e);
        }
    }

    private static InputStream open(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        if (path.getFileName().toString().endsWith(".gz")) {
            return new GZIPInputStream(in);
        }
        return in;
    }

    public static SourceTable read(String name, Reader reader) throws SourceReadException {
        try (CSVReader csv = new CSVReaderBuilder(reader).build()) {
            String[] headerRow = csv.readNext();
            if (headerRow == null) {
                throw new SourceReadException("Source " + name + " is empty");
            }
            List<String> header = new ArrayList<>(headerRow.length);
            for (String column : headerRow) {
                header.add(column.replace("\uFEFF", "").trim());
            }

            List<String[]> rows = new ArrayList<>();
            String[] line;
            while ((line = csv.readNext()) != null) {
                if (isBlank(line)) {
                    continue;
                }
                if (line.length < header.size()) {
                    String[] padded = Arrays.copyOf(line, header.size());
                    Arrays.fill(padded, line.length, padded.length, "");
                    line = padded;
                }
                rows.add(line);
            }
            return new SourceTable(name, header, rows);
        } catch (IOException | CsvValidationException e) {
            throw new SourceReadException("Malformed CSV in " + name, e);
        }
    }

    private static boolean isBlank(String[] line) {
        for (String value : line) {
            if (value != null && !value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    public ImmutableList<String> getHeader() {
        return header;
    }

    public Optional<Integer> getColumnIndex(String column) {
        return Optional.ofNullable(columnIndexes.get(column));
    }

    public ImmutableList<String[]> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
