package com.questrail.tao.protocol.command;

import com.questrail.tao.internal.time.ManualWallClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class WriterCommandLogTest
{
    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2024-05-01T10:15:30Z"));

    @Test
    void writesTimestampTabCommandPerLine()
    {
        StringWriter out = new StringWriter();
        WriterCommandLog log = new WriterCommandLog(out, clock);

        log.record("use var *");
        clock.advance(Duration.ofMillis(125));
        log.record("python -noprint lat_general");

        assertEquals("2024-05-01T10:15:30Z\tuse var *\n"
                + "2024-05-01T10:15:30.125Z\tpython -noprint lat_general\n", out.toString());
    }

    @Test
    void flushesAfterEveryEntry()
    {
        FlushCountingWriter out = new FlushCountingWriter();
        WriterCommandLog log = new WriterCommandLog(out, clock);

        log.record("a");
        log.record("b");

        assertEquals(2, out.flushes);
    }

    @Test
    void appendsToAnExistingFile(@TempDir Path dir) throws IOException
    {
        Path file = dir.resolve("tao-commands.log");
        Files.writeString(file, "earlier\n", StandardCharsets.UTF_8);

        try (WriterCommandLog log = WriterCommandLog.append(file, clock)) {
            log.record("show top10");
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of("earlier", "2024-05-01T10:15:30Z\tshow top10"), lines);
    }

    @Test
    void ioFailureSurfacesAsUncheckedIoException()
    {
        Writer broken = new Writer() {
            @Override public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }
            @Override public void flush() {}
            @Override public void close() {}
        };

        WriterCommandLog log = new WriterCommandLog(broken, clock);
        assertThrows(UncheckedIOException.class, () -> log.record("x"));
    }

    private static final class FlushCountingWriter extends StringWriter {
        int flushes;

        @Override
        public void flush() {
            flushes++;
            super.flush();
        }
    }
}
