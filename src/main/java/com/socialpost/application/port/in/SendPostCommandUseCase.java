package com.socialpost.application.port.in;

import com.socialpost.application.command.PostCommand;

public interface SendPostCommandUseCase {
    void send(PostCommand command);
}
