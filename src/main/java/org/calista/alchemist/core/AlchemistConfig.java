package org.calista.alchemist.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.alchemist.dictionary.SplitPolicy;
import org.calista.alchemist.io.FileIO;
import org.calista.alchemist.prove.ProofEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * AlchemistConfig — plain POJO config:
 * - defaults live in the fields
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() normalizes every knob
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlchemistConfig {

    private static final Logger log = LoggerFactory.getLogger(AlchemistConfig.class);

    public String baseDir = "data";
    public Generation generation = new Generation();
    public Snapshots snapshots = new Snapshots();
    public Proving proving = new Proving();
    public Console console = new Console();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Generation {
        /** "last" (only the last split point's merge survives) or "all" (union over split points). */
        public String splitPolicy = "last";
        public int selfMergeRounds = 1;
        /** Engines (dictionaries) kept in memory, one per base. */
        public int cacheCapacity = 8;

        public SplitPolicy policy() {
            return SplitPolicy.parse(splitPolicy);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Snapshots {
        public String dir = "dictionaries";
        public boolean loadOnStart = true;
        public boolean saveOnClose = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Proving {
        /** -1 => unbounded. */
        public int maxDepth = -1;
        public double continueProbability = 1.0 / 3.0;
        public int maxRestartsPerPass = 4;
        public boolean memoizeFailures = true;
        /** 0 => time based. */
        public long seed = 0L;
        /** Re-evaluate every rendered proof before returning it. */
        public boolean verify = true;

        public int effectiveMaxDepth() {
            return maxDepth < 0 ? ProofEngine.UNBOUNDED : maxDepth;
        }

        public ProofEngine.Config engineConfig() {
            ProofEngine.Config c = new ProofEngine.Config();
            c.continueProbability = continueProbability;
            c.maxRestartsPerPass = maxRestartsPerPass;
            c.memoizeFailures = memoizeFailures;
            c.seed = seed;
            return c.validate();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Console {
        public String defaultBase = "123";
        public boolean printSteps = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config; creates and writes the defaults when the file is missing or blank.
     */
    public static AlchemistConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            AlchemistConfig created = new AlchemistConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            AlchemistConfig created = new AlchemistConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        AlchemistConfig cfg = mapper.readValue(json, AlchemistConfig.class);
        if (cfg == null) cfg = new AlchemistConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, AlchemistConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, AlchemistConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (generation == null) generation = new Generation();
        generation.splitPolicy = (generation.policy() == SplitPolicy.ALL_SPLITS) ? "all" : "last";
        if (generation.selfMergeRounds < 0) generation.selfMergeRounds = 0;
        if (generation.selfMergeRounds > 2) generation.selfMergeRounds = 2; // each round squares the size
        if (generation.cacheCapacity < 1) generation.cacheCapacity = 1;

        if (snapshots == null) snapshots = new Snapshots();
        if (snapshots.dir == null || snapshots.dir.isBlank()) snapshots.dir = "dictionaries";

        if (proving == null) proving = new Proving();
        if (proving.maxDepth < -1) proving.maxDepth = -1;
        if (!Double.isFinite(proving.continueProbability)) proving.continueProbability = 1.0 / 3.0;
        if (proving.continueProbability < 0.0) proving.continueProbability = 0.0;
        if (proving.continueProbability > 1.0) proving.continueProbability = 1.0;
        if (proving.maxRestartsPerPass < 0) proving.maxRestartsPerPass = 0;

        if (console == null) console = new Console();
        if (console.defaultBase == null || console.defaultBase.chars().noneMatch(Character::isDigit)) console.defaultBase = "123";
    }
}
