package com.david.spring.log.dispatch.config;

import static org.assertj.core.api.Assertions.*;

import com.david.spring.log.dispatch.chain.LogHandlerChain;
import com.david.spring.log.dispatch.chain.LogHandlerChainFactory;
import com.david.spring.log.dispatch.event.listener.DispatchStatisticsListener;
import com.david.spring.log.dispatch.model.Severity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;

class LogDispatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LogDispatchAutoConfiguration.class));

    @TempDir Path tempDir;

    @Test
    @DisplayName("Default wiring builds the four-handler chain writing warnings to stderr")
    void testDefaultWiring() {
        contextRunner
                .withPropertyValues("log.dispatch.error-file=" + tempDir.resolve("error.txt"))
                .run(context -> {
                    assertThat(context).hasSingleBean(LogHandlerChainFactory.class);
                    assertThat(context).hasSingleBean(DispatchStatisticsListener.class);
                    assertThat(context.getBean(LogHandlerChain.class).getSeverities()).containsExactly(
                            Severity.FATAL_ERROR, Severity.ERROR, Severity.WARNING, Severity.UNCLASSIFIED);
                    assertThat(context.getBean(LogDispatchAutoConfiguration.DIAGNOSTIC_STREAM_BEAN_NAME))
                            .isSameAs(System.err);
                });
    }

    @Test
    @DisplayName("Properties switch off the catch-all and redirect warnings to stdout")
    void testPropertyOverrides() {
        contextRunner
                .withPropertyValues(
                        "log.dispatch.error-file=" + tempDir.resolve("error.txt"),
                        "log.dispatch.catch-all=false",
                        "log.dispatch.warning-target=stdout")
                .run(context -> {
                    LogDispatchProperties properties = context.getBean(LogDispatchProperties.class);
                    assertThat(properties.isCatchAll()).isFalse();
                    assertThat(properties.getWarningTarget()).isEqualTo(LogDispatchProperties.WarningTarget.STDOUT);
                    assertThat(context.getBean(LogHandlerChain.class).getSeverities())
                            .doesNotContain(Severity.UNCLASSIFIED);
                    assertThat(context.getBean(LogDispatchAutoConfiguration.DIAGNOSTIC_STREAM_BEAN_NAME))
                            .isSameAs(System.out);
                });
    }

    @Test
    @DisplayName("A user supplied diagnostic stream replaces the default")
    void testCustomDiagnosticStream() {
        PrintStream custom = new PrintStream(new ByteArrayOutputStream());
        contextRunner
                .withPropertyValues("log.dispatch.error-file=" + tempDir.resolve("error.txt"))
                .withBean(LogDispatchAutoConfiguration.DIAGNOSTIC_STREAM_BEAN_NAME, PrintStream.class, () -> custom)
                .run(context -> assertThat(context.getBean(LogDispatchAutoConfiguration.DIAGNOSTIC_STREAM_BEAN_NAME))
                        .isSameAs(custom));
    }

    @Test
    @DisplayName("Startup fails without an error file")
    void testErrorFileRequired() {
        contextRunner.run(context -> assertThat(context)
                .hasFailed()
                .getFailure()
                .hasRootCauseInstanceOf(IllegalArgumentException.class)
                .rootCause()
                .hasMessageContaining("log.dispatch.error-file"));
    }
}
