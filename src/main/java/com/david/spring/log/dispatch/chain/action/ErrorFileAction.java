package com.david.spring.log.dispatch.chain.action;

import com.david.spring.log.dispatch.model.LogMessage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.util.Assert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Overwrites the target file with the message text and a line terminator.
 * <p>
 * The file is truncated (or created) as soon as the action is constructed, so
 * it starts out empty. A file that cannot be opened is not an error: the write
 * is skipped and a warning is logged.
 * </p>
 */
@Slf4j
@Getter
public class ErrorFileAction implements LogAction {

    private final Path target;

    public ErrorFileAction(Path target) {
        Assert.notNull(target, "Error file path must not be null");
        this.target = target;
        overwrite("", "truncate");
    }

    @Override
    public void perform(LogMessage message) {
        overwrite(message.text() + System.lineSeparator(), "write");
    }

    private void overwrite(String content, String operation) {
        try {
            Files.writeString(
                    target,
                    content,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.warn("Skipping error file {}: file={}, reason={}", operation, target, e.toString());
        }
    }
}
