package com.questrail.tao.protocol.command;

import com.questrail.tao.internal.time.SystemWallClock;
import com.questrail.tao.internal.time.WallClock;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * WriterCommandLog
 * -----------------------------------------------------------------------------
 * {@link CommandLog} that appends one line per command to a {@link Writer}:
 *
 * <pre>
 *   2024-05-01T10:15:30.125Z	python -noprint lat_general
 * </pre>
 *
 * <p>The timestamp is the ISO-8601 instant from the injected {@link WallClock},
 * followed by a tab and the command text. The writer is flushed after every
 * entry so the log survives an engine crash.</p>
 */
public final class WriterCommandLog implements CommandLog, Closeable
{
    private final Writer writer;
    private final WallClock clock;

    public WriterCommandLog(Writer writer, WallClock clock) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens (or creates) {@code file} in append mode, UTF-8 encoded.
     */
    public static WriterCommandLog append(Path file) throws IOException {
        return append(file, SystemWallClock.INSTANCE);
    }

    public static WriterCommandLog append(Path file, WallClock clock) throws IOException {
        Objects.requireNonNull(file, "file");
        Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return new WriterCommandLog(writer, clock);
    }

    @Override
    public void record(String command) {
        Objects.requireNonNull(command, "command");
        try {
            writer.write(clock.now().toString());
            writer.write('\t');
            writer.write(command);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write command log entry", e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
