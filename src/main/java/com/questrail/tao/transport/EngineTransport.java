package com.questrail.tao.transport;

/**
 * EngineTransport
 * -----------------------------------------------------------------------------
 * Minimal port for reaching the engine process.
 *
 * <p>Everything above this port sees the engine only as a blocking
 * request/response surface:</p>
 * <ul>
 *   <li>commands go in as complete strings</li>
 *   <li>structured results come back as numbered scratch lines</li>
 *   <li>raw printed output comes back as captured text</li>
 * </ul>
 *
 * <p>Implementations may be backed by an engine loaded in-process, an RPC
 * subprocess, or a test double. Each call blocks until the engine has answered.
 * Implementations are not required to be thread-safe; callers serialize access.</p>
 *
 * <h2>Failure signaling</h2>
 * <ul>
 *   <li>{@link TransportCrashedException}: the engine died or is in an unknown state</li>
 *   <li>{@link TransportClosedException}: the transport was closed in an orderly way</li>
 * </ul>
 * Both are detected at the next call attempt. Neither is retryable.
 */
public interface EngineTransport extends AutoCloseable
{
    /**
     * Hands the engine its start-up switches. Called once, before any command.
     *
     * @param initArgs space-joined command line switches
     */
    void setInitArgs(String initArgs);

    /**
     * Executes a command and discards any printed output.
     */
    void send(String command);

    /**
     * Executes a command and returns what the engine printed while running it.
     *
     * @return captured output; may be empty, never {@code null}
     */
    String sendAndCapture(String command);

    /**
     * Returns the number of scratch lines buffered by the last structured command.
     */
    int queryLineCount();

    /**
     * Returns one buffered scratch line.
     *
     * @param index 1-based line index
     */
    String queryLine(int index);

    /**
     * Returns the engine's current working directory.
     */
    String workingDirectory();

    /**
     * Changes the engine's working directory.
     */
    void changeDirectory(String path);

    /**
     * Releases the engine. Further calls fail with {@link TransportClosedException}.
     */
    @Override
    void close();
}
