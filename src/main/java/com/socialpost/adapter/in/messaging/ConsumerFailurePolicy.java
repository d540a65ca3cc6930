package com.socialpost.adapter.in.messaging;

/**
 * What the consumption loop does with a message whose processing failed.
 * Undecodable messages are always skipped, whatever the policy.
 */
public enum ConsumerFailurePolicy {
    /** Leave the offset uncommitted and move on to the next message. */
    SKIP,
    /** Seek back to the failed message after a back-off and try it again. */
    RETRY
}
