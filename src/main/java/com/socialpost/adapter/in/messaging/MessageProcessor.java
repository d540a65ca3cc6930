package com.socialpost.adapter.in.messaging;

import com.socialpost.application.port.out.BrokerReader.BrokerMessage;

@FunctionalInterface
public interface MessageProcessor {

    void process(BrokerMessage message);
}
