package com.david.spring.log.dispatch.demo;

import com.david.spring.log.dispatch.chain.LogHandlerChain;
import com.david.spring.log.dispatch.config.LogDispatchProperties;
import com.david.spring.log.dispatch.exception.LogDispatchException;
import com.david.spring.log.dispatch.model.LogMessage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Replays one message of each kind through the configured chain at startup.
 * Enabled with {@code log.dispatch.demo.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "log.dispatch.demo", name = "enabled", havingValue = "true")
public class LogDispatchDemoRunner implements CommandLineRunner {

    private final LogHandlerChain logHandlerChain;

    private final LogDispatchProperties properties;

    @Override
    public void run(String... args) throws IOException {
        executeReportingFailure(LogMessage.unclassified("some unknown message"));

        logHandlerChain.execute(LogMessage.warning("real warning"));

        logHandlerChain.execute(LogMessage.error("some_error"));
        log.info("Severity ERROR = {}", readErrorFile());

        executeReportingFailure(LogMessage.fatalError("fatal error"));
    }

    private void executeReportingFailure(LogMessage message) {
        try {
            logHandlerChain.execute(message);
        } catch (LogDispatchException e) {
            log.info("{}", e.getMessage());
        }
    }

    /** First whitespace-delimited word of the error file, empty when missing or blank. */
    String readErrorFile() throws IOException {
        Path errorFile = Path.of(properties.getErrorFile());
        if (!Files.exists(errorFile)) {
            return "";
        }
        String content = Files.readString(errorFile, StandardCharsets.UTF_8).strip();
        return content.isEmpty() ? "" : content.split("\\s+", 2)[0];
    }
}
