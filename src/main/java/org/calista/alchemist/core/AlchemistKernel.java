package org.calista.alchemist.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.alchemist.dictionary.DictionaryGenerator;
import org.calista.alchemist.dictionary.DictionarySnapshotStore;
import org.calista.alchemist.dictionary.ExpressionDictionary;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.ExpressionEvaluator;
import org.calista.alchemist.io.FileIO;
import org.calista.alchemist.number.Rational;
import org.calista.alchemist.prove.ProofEngine;
import org.calista.alchemist.prove.ProofListener;
import org.calista.alchemist.prove.ProofVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * AlchemistKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config) -> loadOrCreate config + IO under baseDir
 *   2) engine(base)  -> dictionary per base, from snapshot or freshly generated (LRU cached)
 *   3) prove(...)    -> serialized: one search at a time
 *   4) close()       -> save snapshots when configured
 */
public final class AlchemistKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AlchemistKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final AlchemistConfig cfg;

    /** base digits -> engine, access ordered. */
    private final LinkedHashMap<String, Slot> engines = new LinkedHashMap<>(16, 0.75f, true);

    private AlchemistKernel(FileIO io, ObjectMapper mapper, AlchemistConfig cfg) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Directory the config file lives in; a relative baseDir is resolved against it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public AlchemistKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            AlchemistConfig cfg = AlchemistConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : configRoot.resolve(base), charset);

            AlchemistKernel k = new AlchemistKernel(io, om, cfg);
            log.info("AlchemistKernel created: config={}, baseDir={}, split={}, maxDepth={}",
                    cfgPath, io.baseDir(), cfg.generation.splitPolicy, cfg.proving.maxDepth);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Engines
    // ---------------------------------------------------------------------

    /**
     * Engine for a base (non-digits stripped). Loaded from its snapshot when present and
     * enabled, generated otherwise. Evicting past {@code cacheCapacity} saves the evicted
     * dictionary when {@code saveOnClose} is set.
     */
    public synchronized ProofEngine engine(String rawBase) throws IOException {
        String base = DictionaryGenerator.digitsOf(Objects.requireNonNull(rawBase, "base"));
        if (base.isEmpty()) throw new IllegalArgumentException("Base has no digits: '" + rawBase + "'");

        Slot slot = engines.get(base);
        if (slot != null) return slot.engine;

        slot = open(base);
        engines.put(base, slot);
        evictOverflow();
        return slot.engine;
    }

    private Slot open(String base) throws IOException {
        DictionarySnapshotStore store = new DictionarySnapshotStore(io, mapper,
                io.resolve(cfg.snapshots.dir + "/" + DictionarySnapshotStore.fileName(base)));

        ExpressionDictionary dict = null;
        if (cfg.snapshots.loadOnStart) {
            Optional<DictionarySnapshotStore.Loaded> loaded = store.load(base);
            if (loaded.isPresent() && !loaded.get().dictionary.isEmpty()) dict = loaded.get().dictionary;
        }
        if (dict == null) {
            dict = new DictionaryGenerator(base, cfg.generation.policy(), cfg.generation.selfMergeRounds).bootstrap();
        }

        ProofEngine engine = new ProofEngine(dict, cfg.proving.engineConfig());
        return new Slot(base, engine, store, dict.size());
    }

    private void evictOverflow() throws IOException {
        Iterator<Slot> it = engines.values().iterator();
        while (engines.size() > cfg.generation.cacheCapacity && it.hasNext()) {
            Slot eldest = it.next();
            it.remove();
            if (cfg.snapshots.saveOnClose) save(eldest);
            log.debug("Engine for base {} evicted", eldest.base);
        }
    }

    public synchronized List<String> cachedBases() {
        return new ArrayList<>(engines.keySet());
    }

    // ---------------------------------------------------------------------
    // Proving
    // ---------------------------------------------------------------------

    /**
     * @param targetExpression arithmetic text evaluated exactly first ("2^10-1", "355/113")
     * @param progress         receives improving renderings; may be null
     */
    public synchronized Proof prove(String base, String targetExpression, Consumer<String> progress) throws IOException {
        Objects.requireNonNull(targetExpression, "targetExpression");
        ProofEngine engine = engine(base);
        Rational target = ExpressionEvaluator.evaluate(targetExpression);

        long t0 = System.nanoTime();
        ProofListener listener = (progress == null) ? ProofListener.NONE : (t, best) -> progress.accept(best.render());
        Expr proof = engine.proveAst(target, cfg.proving.effectiveMaxDepth(), listener);
        String rendered = cfg.proving.verify ? ProofVerifier.check(target, proof) : proof.render();
        long ms = (System.nanoTime() - t0) / 1_000_000L;

        log.info("base={} target={} -> {} ({} ms, dict={})", DictionaryGenerator.digitsOf(base), target, rendered, ms,
                engine.dictionary().size());
        return new Proof(DictionaryGenerator.digitsOf(base), target, rendered, proof.trace().steps, ms);
    }

    public static final class Proof {
        public final String base;
        public final Rational target;
        public final String expression;
        public final String steps;
        public final long elapsedMs;

        Proof(String base, Rational target, String expression, String steps, long elapsedMs) {
            this.base = base;
            this.target = target;
            this.expression = expression;
            this.steps = steps;
            this.elapsedMs = elapsedMs;
        }

        @Override
        public String toString() {
            return target + " = " + expression;
        }
    }

    // ---------------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------------

    /** Saves every cached dictionary that grew since it was loaded or last saved. */
    public synchronized int saveSnapshots() throws IOException {
        int saved = 0;
        for (Slot s : engines.values()) {
            if (save(s)) saved++;
        }
        return saved;
    }

    private boolean save(Slot s) throws IOException {
        int size = s.engine.dictionary().size();
        if (size == s.savedSize && s.store.exists()) return false;
        s.store.save(s.base, s.engine.dictionary());
        s.savedSize = size;
        return true;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public AlchemistConfig config() { return cfg; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public synchronized void close() throws IOException {
        if (cfg.snapshots.saveOnClose) {
            int saved = saveSnapshots();
            log.info("AlchemistKernel closed: {} snapshot(s) saved", saved);
        }
        engines.clear();
    }

    private static final class Slot {
        final String base;
        final ProofEngine engine;
        final DictionarySnapshotStore store;
        int savedSize;

        Slot(String base, ProofEngine engine, DictionarySnapshotStore store, int savedSize) {
            this.base = base;
            this.engine = engine;
            this.store = store;
            this.savedSize = savedSize;
        }
    }
}
