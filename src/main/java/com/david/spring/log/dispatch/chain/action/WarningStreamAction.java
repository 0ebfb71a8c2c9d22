package com.david.spring.log.dispatch.chain.action;

import com.david.spring.log.dispatch.model.LogMessage;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.PrintStream;

/** Writes the message text, followed by a line terminator, to the diagnostic stream. */
@Getter
@RequiredArgsConstructor
public class WarningStreamAction implements LogAction {

    private final PrintStream stream;

    @Override
    public void perform(LogMessage message) {
        stream.println(message.text());
        stream.flush();
    }
}
