package org.calista.alchemist.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.ExprJson;
import org.calista.alchemist.io.FileIO;
import org.calista.alchemist.number.Rational;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * DictionarySnapshotStore — persist/load one base's dictionary.
 *
 * <p>
 * Format: JSONL. First line is the schema header
 * {@code {"_schema":"alchemist-dict-v1","base":"123"}}, then one {@code [value, node]} pair per line.
 * Written atomically through {@link FileIO}.
 * </p>
 *
 * <p>
 * Loading never fails on a single row: malformed rows, and rows whose expression does not
 * evaluate to their key, are skipped and counted.
 * </p>
 */
public final class DictionarySnapshotStore {

    private static final Logger log = LogManager.getLogger(DictionarySnapshotStore.class);

    public static final String SCHEMA = "alchemist-dict-v1";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path snapshotFile;

    public DictionarySnapshotStore(FileIO io, ObjectMapper mapper, Path snapshotFile) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    public static String fileName(String base) {
        return "dictionary-" + base + ".jsonl";
    }

    public Path snapshotFile() {
        return snapshotFile;
    }

    public boolean exists() {
        return io.exists(snapshotFile);
    }

    public void save(String base, ExpressionDictionary dict) throws IOException {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(dict, "dict");

        ObjectNode header = mapper.createObjectNode();
        header.put("_schema", SCHEMA);
        header.put("base", base);

        try (FileIO.PendingFile out = io.replace(snapshotFile)) {
            out.writeLine(mapper.writeValueAsString(header));
            for (Map.Entry<String, Expr> e : dict.entries().entrySet()) {
                out.writeLine(mapper.writeValueAsString(ExprJson.entryToJson(e.getKey(), e.getValue())));
            }
            out.commit();
        }
        log.info("Snapshot saved: {} ({} entries)", snapshotFile, dict.size());
    }

    /**
     * @return empty when the file does not exist
     * @throws IOException when the file cannot be read or was written for another base
     */
    public Optional<Loaded> load(String expectedBase) throws IOException {
        if (!io.exists(snapshotFile)) return Optional.empty();

        ExpressionDictionary dict = new ExpressionDictionary();
        int rows = 0;
        int skipped = 0;

        try (Stream<String> lines = io.jsonlStream(snapshotFile)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.contains("\"_schema\"")) {
                    checkHeader(line, expectedBase);
                    continue;
                }
                try {
                    Map.Entry<String, Expr> e = ExprJson.entryFromJson(mapper.readTree(line));
                    Rational key = Rational.parse(e.getKey());
                    if (!key.equals(e.getValue().evaluate())) {
                        throw new IllegalArgumentException("expression does not evaluate to " + e.getKey());
                    }
                    dict.put(key.toString(), e.getValue());
                    rows++;
                } catch (IOException | RuntimeException rowErr) {
                    skipped++;
                    log.warn("DictionarySnapshotStore: skip broken row in {}: {}", snapshotFile, rowErr.getMessage());
                }
            }
        }

        log.info("Snapshot loaded: {} ({} rows, {} skipped)", snapshotFile, rows, skipped);
        return Optional.of(new Loaded(dict, rows, skipped));
    }

    private void checkHeader(String line, String expectedBase) throws IOException {
        JsonNode header = mapper.readTree(line);
        String schema = header.path("_schema").asText("");
        if (!SCHEMA.equals(schema)) throw new IOException("Unsupported snapshot schema '" + schema + "' in " + snapshotFile);
        String base = header.path("base").asText("");
        if (expectedBase != null && !expectedBase.equals(base)) {
            throw new IOException("Snapshot " + snapshotFile + " belongs to base '" + base + "', expected '" + expectedBase + "'");
        }
    }

    public static final class Loaded {
        public final ExpressionDictionary dictionary;
        public final int rows;
        public final int skipped;

        Loaded(ExpressionDictionary dictionary, int rows, int skipped) {
            this.dictionary = dictionary;
            this.rows = rows;
            this.skipped = skipped;
        }
    }
}
