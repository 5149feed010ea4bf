package ai.ideaforge.sim.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "hello \"world\"");
        event.setMDCPropertyMap(Map.of());

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00");
        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesMockCallContextAndNestsOtherMdcEntries() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "Mock request analyzeIdea completed");
        Map<String, String> mdc = new LinkedHashMap<>();
        mdc.put("operation", "analyzeIdea");
        mdc.put("scenario", "success");
        mdc.put("suite", "smoke");
        event.setMDCPropertyMap(mdc);

        String json = layout.doLayout(event);

        assertThat(json).contains("\"operation\":\"analyzeIdea\"");
        assertThat(json).contains("\"scenario\":\"success\"");
        assertThat(json).contains("\"mdc\":{\"suite\":\"smoke\"}");
    }

    @Test
    void includesErrorSummaryForThrowable() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "failed");
        event.setMDCPropertyMap(Map.of());
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("fixture missing")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"error\":\"java.lang.IllegalStateException: fixture missing\"");
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
