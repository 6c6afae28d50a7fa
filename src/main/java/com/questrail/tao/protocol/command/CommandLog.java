package com.questrail.tao.protocol.command;

/**
 * Receives every command sent to the engine, in send order.
 *
 * <p>A command log is handed to the channel that uses it. There is no
 * process-wide log.</p>
 */
@FunctionalInterface
public interface CommandLog
{
    /**
     * Records one command. Must be durable when this method returns.
     */
    void record(String command);
}
