package com.questrail.tao.capture;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * CaptureScope
 * -----------------------------------------------------------------------------
 * One acquisition of a pipe substituted for a {@link CapturedStream}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #open(CapturedStream)} creates the pipe and installs a stream
 *       writing into its sink.</li>
 *   <li>{@link #restore()} reinstalls the original stream. Idempotent.</li>
 *   <li>{@link #drain()} reads everything currently buffered in the pipe
 *       without blocking.</li>
 *   <li>{@link #close()} restores (if still needed) and releases both pipe ends.</li>
 * </ol>
 *
 * <p>A scope is owned by exactly one thread for its whole lifetime and must not
 * be shared between concurrent captures of the same stream.</p>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>Bytes written after {@link #restore()} go to the original stream.</li>
 *   <li>The pipe is drained only after the operation, so an operation writing
 *       more than the OS pipe buffer blocks.</li>
 * </ul>
 */
final class CaptureScope implements AutoCloseable
{
    private static final int READ_CHUNK = 1024;

    private final CapturedStream stream;
    private final PrintStream original;
    private final Pipe pipe;
    private final PrintStream redirected;

    private boolean restored;

    private CaptureScope(CapturedStream stream, PrintStream original, Pipe pipe, PrintStream redirected) {
        this.stream = stream;
        this.original = original;
        this.pipe = pipe;
        this.redirected = redirected;
    }

    static CaptureScope open(CapturedStream stream) {
        Objects.requireNonNull(stream, "stream");

        final Pipe pipe;
        try {
            pipe = Pipe.open();
            pipe.source().configureBlocking(false);
        } catch (IOException e) {
            throw new CaptureException("Unable to open capture pipe for " + stream, e);
        }

        PrintStream redirected = new PrintStream(
                Channels.newOutputStream(pipe.sink()), true, StandardCharsets.UTF_8);

        PrintStream original = stream.current();
        CaptureScope scope = new CaptureScope(stream, original, pipe, redirected);
        try {
            stream.install(redirected);
        } catch (RuntimeException e) {
            scope.releasePipe();
            throw new CaptureException("Unable to redirect " + stream, e);
        }
        return scope;
    }

    /**
     * Reinstalls the original stream. Safe to call more than once.
     *
     * @throws CaptureException if the original stream could not be reinstalled
     */
    void restore() {
        if (restored) {
            return;
        }
        redirected.flush();
        try {
            stream.install(original);
        } catch (RuntimeException e) {
            throw new CaptureException("Unable to restore " + stream, e);
        }
        restored = true;
    }

    /**
     * Reads every byte currently available from the pipe and decodes it as UTF-8.
     */
    String drain() {
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
        try {
            int read;
            while ((read = pipe.source().read(buffer)) > 0) {
                collected.write(buffer.array(), 0, read);
                buffer.clear();
            }
        } catch (IOException e) {
            throw new CaptureException("Unable to drain capture pipe for " + stream, e);
        }
        return collected.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        try {
            restore();
        } finally {
            releasePipe();
        }
    }

    private void releasePipe() {
        try {
            pipe.sink().close();
            pipe.source().close();
        } catch (IOException e) {
            throw new CaptureException("Unable to release capture pipe for " + stream, e);
        }
    }
}
