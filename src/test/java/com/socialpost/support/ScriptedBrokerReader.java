package com.socialpost.support;

import com.socialpost.application.port.out.BrokerReader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Hands out a fixed list of messages, then runs {@code onDrained} on every further poll.
 * Rewinding puts the message back at the head of the queue. Polls and commits can be
 * scripted to fail, as can rewinds.
 */
public class ScriptedBrokerReader implements BrokerReader {

    private final Deque<BrokerMessage> pending;
    private final List<BrokerMessage> committed = new ArrayList<>();
    private final List<BrokerMessage> rewound = new ArrayList<>();
    private final Deque<RuntimeException> commitFailures = new ArrayDeque<>();
    private final Deque<RuntimeException> pollFailures = new ArrayDeque<>();
    private final Deque<RuntimeException> rewindFailures = new ArrayDeque<>();
    private Runnable onDrained = () -> { };
    private String subscribedTopic;
    private boolean closed;

    public ScriptedBrokerReader(List<BrokerMessage> messages) {
        this.pending = new ArrayDeque<>(messages);
    }

    public void onDrained(Runnable onDrained) {
        this.onDrained = onDrained;
    }

    /**
     * The next {@code commit} throws the given exception instead of recording the message.
     */
    public void failNextCommit(RuntimeException failure) {
        commitFailures.addLast(failure);
    }

    /**
     * The next {@code receiveNext} throws the given exception without consuming a message.
     */
    public void failNextPoll(RuntimeException failure) {
        pollFailures.addLast(failure);
    }

    /**
     * The next {@code rewind} throws the given exception and leaves the queue untouched.
     */
    public void failNextRewind(RuntimeException failure) {
        rewindFailures.addLast(failure);
    }

    @Override
    public void subscribe(String topic) {
        this.subscribedTopic = topic;
    }

    @Override
    public Optional<BrokerMessage> receiveNext() {
        RuntimeException failure = pollFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }
        BrokerMessage next = pending.pollFirst();
        if (next == null) {
            onDrained.run();
        }
        return Optional.ofNullable(next);
    }

    @Override
    public void commit(BrokerMessage message) {
        RuntimeException failure = commitFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }
        committed.add(message);
    }

    @Override
    public void rewind(BrokerMessage message) {
        RuntimeException failure = rewindFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }
        rewound.add(message);
        pending.addFirst(message);
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<BrokerMessage> committed() {
        return committed;
    }

    public List<BrokerMessage> rewound() {
        return rewound;
    }

    public String subscribedTopic() {
        return subscribedTopic;
    }

    public boolean isClosed() {
        return closed;
    }
}
