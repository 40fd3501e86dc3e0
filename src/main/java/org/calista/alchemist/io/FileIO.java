package org.calista.alchemist.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * FileIO — the data directory of one kernel: config file and dictionary snapshots.
 *
 * <p>
 * Every file is replaced as a whole. Content goes into a {@value #PENDING_SUFFIX} sibling first
 * and is moved over the target on {@link PendingFile#commit()}, so a reader never sees a
 * half-written snapshot.
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    public static final String PENDING_SUFFIX = ".pending";

    private final Path root;
    private final Charset charset;

    public FileIO(Path root) {
        this(root, StandardCharsets.UTF_8);
    }

    public FileIO(Path root, Charset charset) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + this.root, e);
        }
    }

    public Path baseDir() {
        return root;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * Path of {@code relative} under the data directory; {@code \} counts as a separator.
     *
     * @throws IllegalArgumentException for absolute paths and paths leaving the data directory
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Absolute path not allowed: " + relative);

        Path p = root.resolve(rel).normalize();
        if (!p.startsWith(root)) throw new IllegalArgumentException("Path leaves " + root + ": " + relative);
        return p;
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    /** @throws java.nio.file.NoSuchFileException when the file is missing */
    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        try (PendingFile out = replace(file)) {
            out.writer().write(content);
            out.commit();
        }
    }

    /** Trimmed non-blank lines; close the stream. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        return Files.lines(Objects.requireNonNull(file, "file"), charset)
                .map(String::trim)
                .filter(line -> !line.isEmpty());
    }

    /**
     * Starts replacing {@code file}. Use with try-with-resources: closing without
     * {@link PendingFile#commit()} discards everything written and leaves the old file untouched.
     */
    public PendingFile replace(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path pending = file.resolveSibling(file.getFileName() + PENDING_SUFFIX);
        return new PendingFile(file, pending, Files.newBufferedWriter(pending, charset));
    }

    public static final class PendingFile implements Closeable {
        private final Path target;
        private final Path pending;
        private final BufferedWriter writer;
        private boolean done;

        private PendingFile(Path target, Path pending, BufferedWriter writer) {
            this.target = target;
            this.pending = pending;
            this.writer = writer;
        }

        public Path target() {
            return target;
        }

        public Path pendingFile() {
            return pending;
        }

        public BufferedWriter writer() {
            return writer;
        }

        public void writeLine(String line) throws IOException {
            writer.write(line);
            writer.newLine();
        }

        /** Publishes the written content under the target name. */
        public void commit() throws IOException {
            if (done) throw new IllegalStateException("Already finished: " + target);
            writer.close();
            try {
                Files.move(pending, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, replacing in place", target);
                Files.move(pending, target, StandardCopyOption.REPLACE_EXISTING);
            }
            done = true;
        }

        /** Discards the pending content unless {@link #commit()} succeeded. */
        @Override
        public void close() throws IOException {
            if (done) return;
            done = true;
            try {
                writer.close();
            } finally {
                Files.deleteIfExists(pending);
                log.debug("Discarded pending write to {}", target);
            }
        }
    }
}
