package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.ProtocolIssue;
import com.questrail.tao.protocol.ProtocolException;

import java.util.Objects;

/**
 * An array reconstructed from indexed keys contradicts the protocol: an index
 * was skipped or reordered, or the length differs from {@code num_<name>s}.
 */
public final class ConsistencyException extends ProtocolException
{
    private final ProtocolIssue issue;

    public ConsistencyException(ProtocolIssue issue) {
        super(Objects.requireNonNull(issue, "issue").message());
        this.issue = issue;
    }

    public ProtocolIssue issue() {
        return issue;
    }

    public ProtocolIssue.Kind kind() {
        return issue.kind();
    }

    /**
     * Name of the affected array.
     */
    public String arrayName() {
        return issue.key();
    }
}
