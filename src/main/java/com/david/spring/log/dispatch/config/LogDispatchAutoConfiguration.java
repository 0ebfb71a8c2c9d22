package com.david.spring.log.dispatch.config;

import com.david.spring.log.dispatch.chain.LogHandlerChain;
import com.david.spring.log.dispatch.chain.LogHandlerChainFactory;
import com.david.spring.log.dispatch.event.listener.DispatchStatisticsListener;

import jakarta.annotation.PostConstruct;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.PrintStream;

/**
 * Log dispatch auto-configuration.
 *
 * <p>Provides the diagnostic stream, the chain factory, the statistics listener and the
 * standard chain built from {@code log.dispatch.*}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(LogDispatchProperties.class)
public class LogDispatchAutoConfiguration {

    public static final String DIAGNOSTIC_STREAM_BEAN_NAME = "logDispatchDiagnosticStream";

    @PostConstruct
    public void init() {
        log.info("Initializing Log Dispatch Configuration");
    }

    @Bean(name = DIAGNOSTIC_STREAM_BEAN_NAME)
    @ConditionalOnMissingBean(name = DIAGNOSTIC_STREAM_BEAN_NAME)
    public PrintStream logDispatchDiagnosticStream(LogDispatchProperties properties) {
        return switch (properties.getWarningTarget()) {
            case STDOUT -> System.out;
            case STDERR -> System.err;
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public LogHandlerChainFactory logHandlerChainFactory(
            LogDispatchProperties properties,
            @Qualifier(DIAGNOSTIC_STREAM_BEAN_NAME) PrintStream diagnosticStream) {
        return new LogHandlerChainFactory(properties, diagnosticStream);
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchStatisticsListener dispatchStatisticsListener() {
        return new DispatchStatisticsListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogHandlerChain logHandlerChain(
            LogHandlerChainFactory logHandlerChainFactory,
            DispatchStatisticsListener dispatchStatisticsListener) {
        LogHandlerChain chain = logHandlerChainFactory.createChain();
        chain.addListener(dispatchStatisticsListener);
        return chain;
    }
}
