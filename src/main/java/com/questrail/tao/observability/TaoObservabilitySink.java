package com.questrail.tao.observability;

/**
 * Receives observability events from a Tao session.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are delivered on the caller's thread, synchronously with the
 * session call that produced them.</p>
 */
public interface TaoObservabilitySink {
    /**
     * Called before a command is handed to the transport.
     * @param event the command details
     */
    void onCommand(CommandEvent event);

    /**
     * Called for every issue reported by lenient decoding.
     * @param event the issue and the query it came from
     */
    void onProtocolIssue(ProtocolIssueEvent event);

    /**
     * Called when a transport call fails. The failure is rethrown unchanged afterwards.
     * @param event the error event
     */
    void onError(TaoErrorEvent event);
}
