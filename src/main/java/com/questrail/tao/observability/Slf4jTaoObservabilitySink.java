package com.questrail.tao.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TaoObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTaoObservabilitySink implements TaoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTaoObservabilitySink.class);

    @Override
    public void onCommand(CommandEvent event) {
        log.debug("Tao {}: {}", event.mode(), event.command());
    }

    @Override
    public void onProtocolIssue(ProtocolIssueEvent event) {
        log.warn("Tao protocol issue in '{}': {} [{}] {}",
            event.query(),
            event.issue().kind(),
            event.issue().key(),
            event.issue().message());
    }

    @Override
    public void onError(TaoErrorEvent event) {
        log.error("Tao error: {}", event.message(), event.cause());
    }
}
