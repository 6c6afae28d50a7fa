package com.questrail.tao.transport;

/**
 * A call was attempted on a transport that has already been closed.
 */
public final class TransportClosedException extends TransportException
{
    public TransportClosedException(String message) {
        super(message);
    }
}
