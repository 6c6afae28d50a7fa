package com.questrail.tao.runtime;

import com.questrail.tao.transport.EngineTransport;

import java.util.Objects;

/**
 * Scoped change of the engine's working directory.
 *
 * <pre>
 *   try (ChangeDirectory ignored = session.chdir("lattices")) {
 *       session.command("read", "lattice", "ring.bmad");
 *   }
 * </pre>
 *
 * Closing restores the directory that was current when the scope was opened.
 */
public final class ChangeDirectory implements AutoCloseable
{
    private final EngineTransport transport;
    private final String previous;
    private boolean restored;

    ChangeDirectory(EngineTransport transport, String path) {
        this.transport = Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(path, "path");
        this.previous = transport.workingDirectory();
        transport.changeDirectory(path);
    }

    /**
     * Directory that will be restored on close.
     */
    public String previous() {
        return previous;
    }

    @Override
    public void close() {
        if (!restored) {
            restored = true;
            transport.changeDirectory(previous);
        }
    }
}
