package com.questrail.tao.observability;

import com.questrail.tao.api.ProtocolIssue;

import java.time.Instant;

/**
 * Record representing an inconsistency that lenient decoding reported instead of raised.
 *
 * @param query the structured query whose response contained the issue
 */
public record ProtocolIssueEvent(
    Instant timestamp,
    String query,
    ProtocolIssue issue
) {
}
