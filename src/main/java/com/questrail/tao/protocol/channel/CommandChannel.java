package com.questrail.tao.protocol.channel;

import com.questrail.tao.internal.time.WallClock;
import com.questrail.tao.observability.CommandEvent;
import com.questrail.tao.observability.TaoErrorEvent;
import com.questrail.tao.observability.TaoObservabilitySink;
import com.questrail.tao.protocol.command.CommandLog;
import com.questrail.tao.transport.EngineTransport;
import com.questrail.tao.transport.TransportException;

import java.util.Objects;

/**
 * CommandChannel
 * =============================================================================
 * The single path by which serialized commands reach the engine.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #command(String)}: one send, no reads.</li>
 *   <li>{@link #capture(String)}: one send with the engine's printed output
 *       captured and returned.</li>
 *   <li>{@link #lineCount()} / {@link #line(int)}: scratch-line reads used by
 *       {@code StructuredQuery}.</li>
 * </ul>
 *
 * <p>Every command is written to the {@link CommandLog} before it is sent.</p>
 *
 * <h2>Failure policy</h2>
 * Transport failures are reported to the observability sink and rethrown
 * unchanged. The channel never retries: after a crash the engine state is
 * undefined.
 *
 * <h2>Threading</h2>
 * Not thread-safe. One outstanding call at a time; callers sharing a channel
 * across threads must serialize access themselves.
 */
public final class CommandChannel
{
    private final EngineTransport transport;
    private final CommandLog commandLog;
    private final TaoObservabilitySink sink;
    private final WallClock clock;

    public CommandChannel(EngineTransport transport,
                          CommandLog commandLog,
                          TaoObservabilitySink sink,
                          WallClock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.commandLog = Objects.requireNonNull(commandLog, "commandLog");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sends a command and discards its printed output.
     */
    public void command(String text) {
        Objects.requireNonNull(text, "text");
        announce(CommandEvent.Mode.COMMAND, text);
        try {
            transport.send(text);
        } catch (TransportException e) {
            throw reported("Command failed: " + text, e);
        }
    }

    /**
     * Sends a command and returns the text the engine printed while executing it.
     *
     * @return captured output; may be empty
     */
    public String capture(String text) {
        Objects.requireNonNull(text, "text");
        announce(CommandEvent.Mode.CAPTURE, text);
        try {
            return transport.sendAndCapture(text);
        } catch (TransportException e) {
            throw reported("Capture failed: " + text, e);
        }
    }

    /**
     * Returns the number of scratch lines buffered by the last structured command.
     */
    public int lineCount() {
        try {
            return transport.queryLineCount();
        } catch (TransportException e) {
            throw reported("Scratch line count failed", e);
        }
    }

    /**
     * Returns the scratch line at the given 1-based index.
     */
    public String line(int index) {
        try {
            return transport.queryLine(index);
        } catch (TransportException e) {
            throw reported("Scratch line " + index + " failed", e);
        }
    }

    private void announce(CommandEvent.Mode mode, String text) {
        commandLog.record(text);
        sink.onCommand(new CommandEvent(clock.now(), mode, text));
    }

    private TransportException reported(String message, TransportException failure) {
        sink.onError(new TaoErrorEvent(clock.now(), message, failure));
        return failure;
    }
}
