package com.david.spring.log.dispatch.event.listener;

import static org.assertj.core.api.Assertions.*;

import com.david.spring.log.dispatch.chain.DispatchResult;
import com.david.spring.log.dispatch.event.listener.DispatchStatisticsListener.DispatchStats;
import com.david.spring.log.dispatch.exception.FatalLogMessageException;
import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Dispatch statistics listener test */
class DispatchStatisticsListenerTest {

    private DispatchStatisticsListener listener;

    @BeforeEach
    void setUp() {
        listener = new DispatchStatisticsListener();
    }

    @Test
    void testCountsByOutcome() {
        LogMessage warning = LogMessage.warning("w");
        LogMessage fatal = LogMessage.fatalError("f");

        listener.onDispatch(DispatchResult.handled(warning, "WarningHandler"));
        listener.onDispatch(DispatchResult.handled(warning, "WarningHandler"));
        listener.onDispatch(DispatchResult.handled(LogMessage.error("e"), "ErrorHandler"));
        listener.onDispatch(DispatchResult.dropped(LogMessage.unclassified("u")));
        listener.onDispatch(DispatchResult.failed(fatal, new FatalLogMessageException(fatal)));

        DispatchStats stats = listener.getStats();
        assertThat(stats.handled(Severity.WARNING)).isEqualTo(2);
        assertThat(stats.handled(Severity.ERROR)).isEqualTo(1);
        assertThat(stats.handled(Severity.FATAL_ERROR)).isZero();
        assertThat(stats.dropped()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.total()).isEqualTo(5);
    }

    @Test
    void testSnapshotIsDetached() {
        DispatchStats before = listener.getStats();

        listener.onDispatch(DispatchResult.handled(LogMessage.warning("w"), "WarningHandler"));

        assertThat(before.total()).isZero();
        assertThat(listener.getStats().total()).isEqualTo(1);
        assertThatThrownBy(() -> before.handled().put(Severity.ERROR, 1L))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testReset() {
        listener.onDispatch(DispatchResult.dropped(LogMessage.unclassified("u")));
        listener.logStats();

        listener.reset();

        assertThat(listener.getStats().total()).isZero();
    }
}
