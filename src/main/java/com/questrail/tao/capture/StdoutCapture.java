package com.questrail.tao.capture;

import java.util.Objects;

/**
 * StdoutCapture
 * =============================================================================
 * Captures what an operation prints to a process-wide output stream.
 *
 * <p>Some engine commands report their result only as printed text. This
 * utility substitutes a pipe for the stream while the operation runs, restores
 * the original stream on every exit path (including when the operation throws),
 * and then returns whatever the pipe holds.</p>
 *
 * <pre>
 *   String text = new StdoutCapture().capture(() -> engine.command("show top10"));
 * </pre>
 *
 * <h2>Known limitation</h2>
 * Capture is only correct for operations that finish writing before they
 * return. Output produced later, from another thread, or still buffered inside
 * the operation's own writer when draining starts, is lost.
 */
public final class StdoutCapture
{
    private final CapturedStream stream;

    public StdoutCapture() {
        this(CapturedStream.STDOUT);
    }

    public StdoutCapture(CapturedStream stream) {
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    /**
     * Runs {@code operation} with the stream redirected and returns the captured text.
     *
     * @return captured text; empty if nothing was printed
     * @throws E                if the operation throws; the stream is restored first
     * @throws CaptureException if the pipe could not be managed or the stream restored
     */
    public <E extends Exception> String capture(CapturedOperation<E> operation) throws E {
        Objects.requireNonNull(operation, "operation");

        try (CaptureScope scope = CaptureScope.open(stream)) {
            try {
                operation.run();
            } finally {
                scope.restore();
            }
            return scope.drain();
        }
    }

    public CapturedStream stream() {
        return stream;
    }
}
