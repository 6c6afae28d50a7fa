package com.questrail.tao.observability;

/**
 * No-op implementation of TaoObservabilitySink.
 */
public final class NullObservabilitySink implements TaoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommand(CommandEvent event) {}

    @Override
    public void onProtocolIssue(ProtocolIssueEvent event) {}

    @Override
    public void onError(TaoErrorEvent event) {}
}
