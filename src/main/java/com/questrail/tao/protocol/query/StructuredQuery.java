package com.questrail.tao.protocol.query;

import com.questrail.tao.protocol.ProtocolException;
import com.questrail.tao.protocol.channel.CommandChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * StructuredQuery
 * =============================================================================
 * Runs an engine command in "python" mode and collects its structured result.
 *
 * <h2>Exchange</h2>
 * The engine buffers structured results server-side as numbered scratch lines
 * instead of streaming them. One query of N lines therefore costs N + 2 blocking
 * round trips:
 *
 * <pre>
 *   command  "python -noprint &lt;cmd&gt;"    (fills the scratch buffer)
 *   lineCount()                          → N
 *   line(1) .. line(N)                   → raw lines, split on ';'
 * </pre>
 *
 * <h2>Failure</h2>
 * There are no partial results: if any of the round trips fails, the exception
 * propagates and nothing collected so far is returned.
 */
public final class StructuredQuery
{
    /** Prefix that switches a command to non-interactive structured output. */
    public static final String PYTHON_PREFIX = "python -noprint ";

    private final CommandChannel channel;

    public StructuredQuery(CommandChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Executes {@code command} in python mode and returns all result lines in order.
     *
     * @param command the engine command, without the python prefix
     * @return the result lines; empty if the engine buffered none
     */
    public List<ResponseLine> python(String command) {
        Objects.requireNonNull(command, "command");

        channel.command(PYTHON_PREFIX + command);

        final int count = channel.lineCount();
        if (count < 0) {
            throw new ProtocolException("Engine reported a negative scratch line count: " + count);
        }

        List<ResponseLine> lines = new ArrayList<>(count);
        for (int index = 1; index <= count; index++) {
            lines.add(ResponseLine.parse(channel.line(index)));
        }
        return List.copyOf(lines);
    }
}
