package com.david.spring.log.dispatch.config;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "log.dispatch")
public class LogDispatchProperties {

    /**
     * File overwritten by every ERROR message. Required, no default.
     */
    private String errorFile;

    /**
     * Whether the standard chain ends with the catch-all handler that fails on
     * unclassified messages. Without it they are silently dropped.
     */
    private boolean catchAll = true;

    /**
     * Diagnostic stream receiving WARNING messages.
     */
    private WarningTarget warningTarget = WarningTarget.STDERR;

    private Demo demo = new Demo();

    public enum WarningTarget {
        STDERR,
        STDOUT
    }

    @Data
    public static class Demo {

        /**
         * Replay the sample messages at startup.
         */
        private boolean enabled = false;
    }
}
