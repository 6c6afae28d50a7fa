package com.questrail.tao.runtime;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.api.NumericMatrix;
import com.questrail.tao.api.Parameter;
import com.questrail.tao.api.PropertyMap;
import com.questrail.tao.api.ProtocolIssue;
import com.questrail.tao.config.TaoSessionConfig;
import com.questrail.tao.observability.ProtocolIssueEvent;
import com.questrail.tao.observability.TaoObservabilitySink;
import com.questrail.tao.protocol.channel.CommandChannel;
import com.questrail.tao.protocol.command.CommandSerializer;
import com.questrail.tao.protocol.decode.ResponseDecoder;
import com.questrail.tao.protocol.query.ResponseLine;
import com.questrail.tao.protocol.query.StructuredQuery;
import com.questrail.tao.transport.EngineTransport;

import java.util.List;
import java.util.Objects;

/**
 * TaoSession
 * =============================================================================
 * Composition root and caller-facing facade for one engine.
 *
 * <pre>
 *   TaoSession tao = TaoSession.open(transport, TaoSessionConfig.builder()
 *           .withInitArgs("-lat", "ring.bmad", "-noplot")
 *           .withStrictness(DecodeStrictness.STRICT)
 *           .build());
 *
 *   tao.command("use var *");                          // nothing returned
 *   String top = tao.capture("show top10");            // printed output
 *   PropertyMap&lt;DecodedValue&gt; p = tao.properties("lat_general");
 *   NumericMatrix xy = tao.matrix("plot_line r11.g.a"); // (x, y) rows
 * </pre>
 *
 * <h2>Threading</h2>
 * A session is single-threaded and strictly synchronous. Each call blocks until
 * the engine has answered. Callers sharing a session between threads must
 * guard it with their own lock.
 *
 * <h2>Failures</h2>
 * Transport failures propagate unchanged and are never retried. Decode failures
 * follow the configured {@link com.questrail.tao.protocol.decode.DecodeStrictness};
 * issues reported by lenient decoding are also forwarded to the observability sink.
 */
public final class TaoSession implements AutoCloseable
{
    private final EngineTransport transport;
    private final TaoSessionConfig config;
    private final CommandChannel channel;
    private final StructuredQuery query;
    private final ResponseDecoder decoder;

    private TaoSession(EngineTransport transport, TaoSessionConfig config) {
        this.transport = transport;
        this.config = config;
        this.channel = new CommandChannel(
                transport,
                config.commandLog(),
                config.observabilitySink(),
                config.wallClock());
        this.query = new StructuredQuery(channel);
        this.decoder = new ResponseDecoder(config.strictness());
    }

    /**
     * Wires a session over {@code transport} and hands the engine its init arguments.
     */
    public static TaoSession open(EngineTransport transport, TaoSessionConfig config) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(config, "config");

        TaoSession session = new TaoSession(transport, config);
        transport.setInitArgs(CommandSerializer.join(config.initArgs()));
        return session;
    }

    // =========================================================================
    // Raw commands
    // =========================================================================

    /**
     * Sends a command without returning its output.
     */
    public void command(Object... args) {
        channel.command(CommandSerializer.join(args));
    }

    /**
     * Sends a command and returns what the engine printed.
     */
    public String capture(Object... args) {
        return channel.capture(CommandSerializer.join(args));
    }

    // =========================================================================
    // Structured queries
    // =========================================================================

    /**
     * Runs a python-mode command and returns its raw response lines.
     */
    public List<ResponseLine> python(Object... args) {
        return query.python(CommandSerializer.join(args));
    }

    /**
     * Runs a python-mode command and decodes the result as typed properties.
     */
    public PropertyMap<DecodedValue> properties(Object... args) {
        final String command = CommandSerializer.join(args);
        return reported(command, decoder.properties(query.python(command)));
    }

    /**
     * Like {@link #properties(Object...)}, but keeps every field's vary flag.
     */
    public PropertyMap<Parameter> parameters(Object... args) {
        final String command = CommandSerializer.join(args);
        return reported(command, decoder.parameters(query.python(command)));
    }

    /**
     * Runs a python-mode command whose result is an {@code index;value} list.
     */
    public List<String> list(Object... args) {
        return decoder.list(python(args));
    }

    /**
     * Runs a python-mode command whose result is numeric rows, using the
     * configured default column count.
     */
    public NumericMatrix matrix(Object... args) {
        return matrixWithColumns(config.defaultMatrixColumns(), args);
    }

    public NumericMatrix matrixWithColumns(int columns, Object... args) {
        return decoder.matrix(python(args), columns);
    }

    // =========================================================================
    // Session
    // =========================================================================

    /**
     * Changes the engine's working directory until the returned scope is closed.
     */
    public ChangeDirectory chdir(String path) {
        return new ChangeDirectory(transport, path);
    }

    public TaoSessionConfig config() {
        return config;
    }

    @Override
    public void close() {
        transport.close();
    }

    private <T> PropertyMap<T> reported(String command, PropertyMap<T> result) {
        TaoObservabilitySink sink = config.observabilitySink();
        for (ProtocolIssue issue : result.issues()) {
            sink.onProtocolIssue(new ProtocolIssueEvent(config.wallClock().now(), command, issue));
        }
        return result;
    }
}
