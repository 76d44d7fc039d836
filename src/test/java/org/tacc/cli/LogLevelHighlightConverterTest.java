package org.tacc.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.LoggingEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void wrapsTextInLevelColor() {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.ERROR);

        String out = new LogLevelHighlightConverter(true).transform(event, "ERROR");

        assertThat(out).isEqualTo("\u001B[31mERROR\u001B[0m");
    }

    @Test
    void leavesTextUntouchedWhenDisabled() {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);

        assertThat(new LogLevelHighlightConverter(false).transform(event, "WARN")).isEqualTo("WARN");
    }

    @Test
    void debugAndTraceShareTheDimColor() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.DEBUG))
                .isEqualTo(LogLevelHighlightConverter.colorFor(Level.TRACE))
                .isNotEqualTo(LogLevelHighlightConverter.colorFor(Level.INFO));
    }
}
