package com.questrail.tao.protocol;

/**
 * Indicates that an engine response could not be interpreted.
 *
 * This typically reflects:
 * <ul>
 *   <li>A record with fewer fields than its kind requires</li>
 *   <li>A list record that is not an {@code index;value} pair</li>
 *   <li>An array key whose index is not a number</li>
 *   <li>A negative scratch line count</li>
 * </ul>
 *
 * More specific failures are signaled by the subclasses in
 * {@code com.questrail.tao.protocol.decode}.
 */
public class ProtocolException extends RuntimeException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
