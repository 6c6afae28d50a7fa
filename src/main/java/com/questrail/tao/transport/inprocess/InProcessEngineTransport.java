package com.questrail.tao.transport.inprocess;

import com.questrail.tao.capture.CaptureException;
import com.questrail.tao.capture.StdoutCapture;
import com.questrail.tao.transport.EngineTransport;
import com.questrail.tao.transport.TransportClosedException;
import com.questrail.tao.transport.TransportCrashedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * InProcessEngineTransport
 * =============================================================================
 * {@link EngineTransport} over an {@link EngineLibrary} loaded in this JVM.
 *
 * <h2>Capture path</h2>
 * {@link #sendAndCapture(String)} runs the command inside a
 * {@link StdoutCapture}, because the engine reports such results only by
 * printing them.
 *
 * <h2>State</h2>
 * <pre>
 *   OPEN ──engine failure / capture failure──▶ CRASHED
 *   OPEN ──close()──────────────────────────▶ CLOSED
 * </pre>
 * Once crashed, every call fails with {@link TransportCrashedException}
 * carrying the original failure. Once closed, every call fails with
 * {@link TransportClosedException}. Nothing is retried.
 *
 * <p>Not thread-safe. Process-wide stdout is redirected during capture, so only
 * one capture may be in flight per JVM.</p>
 */
public final class InProcessEngineTransport implements EngineTransport
{
    private static final Logger log = LoggerFactory.getLogger(InProcessEngineTransport.class);

    private enum State { OPEN, CRASHED, CLOSED }

    private final EngineLibrary library;
    private final StdoutCapture capture;

    private State state = State.OPEN;
    private RuntimeException crashCause;

    public InProcessEngineTransport(EngineLibrary library) {
        this(library, new StdoutCapture());
    }

    public InProcessEngineTransport(EngineLibrary library, StdoutCapture capture) {
        this.library = Objects.requireNonNull(library, "library");
        this.capture = Objects.requireNonNull(capture, "capture");
    }

    @Override
    public void setInitArgs(String initArgs) {
        Objects.requireNonNull(initArgs, "initArgs");
        call("setInitArgs", () -> {
            library.setInitArgs(initArgs);
            return null;
        });
    }

    @Override
    public void send(String command) {
        Objects.requireNonNull(command, "command");
        call(command, () -> {
            library.command(command);
            return null;
        });
    }

    @Override
    public String sendAndCapture(String command) {
        Objects.requireNonNull(command, "command");
        return call(command, () -> capture.capture(() -> library.command(command)));
    }

    @Override
    public int queryLineCount() {
        return call("scratchLineCount", library::scratchLineCount);
    }

    @Override
    public String queryLine(int index) {
        return call("scratchLine " + index, () -> library.scratchLine(index));
    }

    @Override
    public String workingDirectory() {
        return call("getcwd", library::getcwd);
    }

    @Override
    public void changeDirectory(String path) {
        Objects.requireNonNull(path, "path");
        call("chdir " + path, () -> {
            library.chdir(path);
            return null;
        });
    }

    @Override
    public void close() {
        state = State.CLOSED;
    }

    private <T> T call(String what, Supplier<T> body) {
        switch (state) {
            case CLOSED -> throw new TransportClosedException("Engine transport is closed");
            case CRASHED -> throw new TransportCrashedException("Engine crashed earlier", crashCause);
            case OPEN -> { }
        }

        try {
            return body.get();
        } catch (CaptureException e) {
            throw crashed(what, "stdout capture failed; stream state unknown", e);
        } catch (RuntimeException e) {
            throw crashed(what, e.getMessage(), e);
        }
    }

    private TransportCrashedException crashed(String what, String reason, RuntimeException cause) {
        state = State.CRASHED;
        crashCause = cause;
        log.error("Engine failed during '{}': {}", what, reason, cause);
        return new TransportCrashedException("Engine failed during '" + what + "': " + reason, cause);
    }
}
