package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Reads entity or relationship records from CSV with a header row.
 *
 * <p>Relationship files use {@code HEAD_ENTITY,TAIL_ENTITY,EDGE_TYPE,CONFIDENCE}; entity
 * files use {@code ID,NAME,METADATA}. Header names are matched ignoring case, spaces and
 * dashes, columns may come in any order, and extra columns are ignored. Rows are read
 * lazily, {@code chunkSize} at a time.</p>
 */
public class CsvRecordSource implements RecordSource {

    private static final Logger logger = LoggerFactory.getLogger(CsvRecordSource.class);

    private static final Set<String> ENTITY_COLUMNS = Set.of(RawRecord.ID);
    private static final Set<String> RELATIONSHIP_COLUMNS =
        Set.of(RawRecord.HEAD_ENTITY, RawRecord.TAIL_ENTITY, RawRecord.EDGE_TYPE);

    private final ICsvListReader reader;
    private final RecordKind kind;
    private final String name;
    private final int chunkSize;
    private final String[] columns;
    private boolean iterated;

    /**
     * Opens the source and reads the header row.
     *
     * @param input CSV text, closed by {@link #close()}
     * @param kind record kind of every row
     * @param name label used in diagnostics, e.g. the file name
     * @param chunkSize rows per batch handed to the pipeline
     * @throws IOException when the header cannot be read
     * @throws IllegalArgumentException when the header is missing or lacks a required column
     */
    public CsvRecordSource(@NotNull Reader input, @NotNull RecordKind kind, @NotNull String name, int chunkSize)
            throws IOException {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.chunkSize = chunkSize;
        this.reader = new CsvListReader(Objects.requireNonNull(input, "input must not be null"),
            CsvPreference.STANDARD_PREFERENCE);

        String[] header = reader.getHeader(true);
        if (header == null) {
            reader.close();
            throw new IllegalArgumentException("CSV " + name + " does not contain a header row");
        }
        this.columns = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            columns[i] = header[i] == null ? null : RawRecord.normalizeFieldName(header[i]);
        }
        Set<String> required = kind == RecordKind.ENTITY ? ENTITY_COLUMNS : RELATIONSHIP_COLUMNS;
        for (String column : required) {
            if (!List.of(columns).contains(column)) {
                reader.close();
                throw new IllegalArgumentException("CSV " + name + " is missing column " + column.toUpperCase());
            }
        }
        logger.debug("Opened {} CSV {} with columns {}", kind.tag(), name, List.of(header));
    }

    public static CsvRecordSource relationships(@NotNull Path file, int chunkSize) throws IOException {
        return open(file, RecordKind.RELATIONSHIP, chunkSize);
    }

    public static CsvRecordSource entities(@NotNull Path file, int chunkSize) throws IOException {
        return open(file, RecordKind.ENTITY, chunkSize);
    }

    private static CsvRecordSource open(Path file, RecordKind kind, int chunkSize) throws IOException {
        return new CsvRecordSource(Files.newBufferedReader(file, StandardCharsets.UTF_8),
            kind, file.getFileName().toString(), chunkSize);
    }

    /**
     * Single-use: the rows can be iterated once.
     */
    @NotNull
    @Override
    public synchronized Iterator<List<RawRecord>> batches() {
        if (iterated) {
            throw new IllegalStateException("CSV " + name + " has already been read");
        }
        iterated = true;
        return new Iterator<>() {
            private List<RawRecord> pending;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (pending == null && !exhausted) {
                    pending = readChunk();
                    exhausted = pending.size() < chunkSize;
                    if (pending.isEmpty()) {
                        pending = null;
                    }
                }
                return pending != null;
            }

            @Override
            public List<RawRecord> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<RawRecord> chunk = pending;
                pending = null;
                return chunk;
            }
        };
    }

    private List<RawRecord> readChunk() {
        List<RawRecord> chunk = new ArrayList<>(chunkSize);
        try {
            List<String> row;
            while (chunk.size() < chunkSize && (row = reader.read()) != null) {
                chunk.add(toRecord(row, reader.getLineNumber()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV " + name + " at line " + reader.getLineNumber(), e);
        }
        return chunk;
    }

    private RawRecord toRecord(List<String> row, int line) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < columns.length; i++) {
            if (columns[i] != null) {
                fields.put(columns[i], i < row.size() ? row.get(i) : null);
            }
        }
        return new RawRecord(kind, fields, name + ":" + line);
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close CSV " + name, e);
        }
    }
}
