package com.questrail.tao.transport;

/**
 * The engine terminated abnormally, or failed in a way that leaves its state unknown.
 */
public final class TransportCrashedException extends TransportException
{
    public TransportCrashedException(String message) {
        super(message);
    }

    public TransportCrashedException(String message, Throwable cause) {
        super(message, cause);
    }
}
