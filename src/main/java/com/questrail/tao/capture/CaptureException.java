package com.questrail.tao.capture;

/**
 * The capture pipe could not be set up, drained or released, or the original
 * stream could not be restored.
 *
 * <p>After this exception the state of the intercepted stream is unknown.
 * Owners of a capture should treat it as fatal for their session.</p>
 */
public final class CaptureException extends RuntimeException
{
    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
