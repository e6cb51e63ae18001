package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.serializer.StatusRecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps a JSON copy of the status record on disk.
 *
 * Every committed snapshot is written to a temp file in the same directory
 * and moved over the target, so readers of the file never see a partial record.
 */
public class StatusFileMirror implements CommitListener {

    private static final Logger log = LoggerFactory.getLogger(StatusFileMirror.class);

    private final Path file;
    private final StatusRecordCodec codec;

    public StatusFileMirror(Path file, StatusRecordCodec codec) {
        this.file = file;
        this.codec = codec;
    }

    /**
     * Record previously written to disk, if the file exists.
     *
     * @throws UncheckedIOException if the file exists but cannot be parsed
     */
    public Optional<StatusRecord> load() {
        if (!Files.isRegularFile(file)) {
            log.info("No status file at {}", file);
            return Optional.empty();
        }
        try (var in = Files.newInputStream(file)) {
            StatusRecord record = codec.read(in);
            log.info("Loaded status file {} at revision {}", file, record.revision());
            return Optional.of(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read status file " + file, e);
        }
    }

    @Override
    public void onCommit(StatusRecord committed) {
        try {
            write(committed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write status file " + file, e);
        }
    }

    void write(StatusRecord record) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                codec.write(record, out);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("Wrote status file {} at revision {}", file, record.revision());
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public Path file() {
        return file;
    }
}
