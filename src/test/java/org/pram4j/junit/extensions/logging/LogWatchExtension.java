package org.pram4j.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without declaring it via {@link AllowLog} or
 * {@link ExpectLog}, and when an {@link ExpectLog} event does not occur. Allowed and expected events
 * are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingTurboFilter filter = new CapturingTurboFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingTurboFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.setRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<CapturedEvent> events = filter.getEvents();
        filter.clearEvents();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.permits(e)) {
                    problems.add("Unexpected log: " + e);
                }
            }
        }
        for (ExpectLog exp : rules.expects) {
            long count = events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingTurboFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        Optional<AnnotatedElement> element = context.getElement();
        Optional<Class<?>> testClass = context.getTestClass();

        FailOnLog fail = element.map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        testClass.ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        // For class-level contexts the element is the class itself; do not count it twice.
        if (element.isPresent() && !(element.get() instanceof Class<?>)) {
            allows.addAll(List.of(element.get().getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.get().getAnnotationsByType(ExpectLog.class)));
        }

        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean permits(CapturedEvent e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog exp : expects) {
                if (matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        void setRules(Rules rules) {
            this.rules = rules;
        }

        List<CapturedEvent> getEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            LogLevel lowest = current.expects.stream().map(ExpectLog::level).min(Enum::compareTo).orElse(current.minLevel);
            if (lowest.compareTo(current.minLevel) > 0) {
                lowest = current.minLevel;
            }
            if (!level.isGreaterOrEqual(toLogback(lowest))) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message);
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
