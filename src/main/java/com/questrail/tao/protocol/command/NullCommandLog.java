package com.questrail.tao.protocol.command;

/**
 * Command log that records nothing.
 */
public final class NullCommandLog implements CommandLog {
    public static final NullCommandLog INSTANCE = new NullCommandLog();

    private NullCommandLog() {}

    @Override
    public void record(String command) {}
}
