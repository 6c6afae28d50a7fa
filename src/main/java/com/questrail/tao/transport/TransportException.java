package com.questrail.tao.transport;

/**
 * Base type for failures raised by an {@link EngineTransport}.
 *
 * <p>Transport failures are propagated unchanged by the protocol layers above
 * the port and are never retried there: after a failure the engine state is
 * undefined.</p>
 */
public abstract class TransportException extends RuntimeException
{
    protected TransportException(String message) {
        super(message);
    }

    protected TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
