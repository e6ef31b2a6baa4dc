package org.plcore.junit.extensions.logging;

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
import java.util.stream.Stream;

/**
 * Fails a test that logs at or above the {@link FailOnLog} level (WARN by default) unless the
 * event is covered by {@link AllowLog} or {@link ExpectLog}, and fails it when an
 * {@link ExpectLog} is not met. Covered events are kept out of the test output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : filter.events()) {
                if (event.level.isGreaterOrEqual(rules.failLevel) && !rules.covers(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (Rule expected : rules.expects) {
            long count = filter.events().stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("Expected %d x %s, but found %d.", expected.occurrences, expected, count));
            }
        }
        filter.clear();
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rule(Level level, Pattern logger, Pattern message, int occurrences) {
        static Rule of(AllowLog allow) {
            return new Rule(toLogback(allow.level()), Pattern.compile(allow.loggerPattern()),
                    Pattern.compile(allow.messagePattern()), 0);
        }

        static Rule of(ExpectLog expect) {
            return new Rule(toLogback(expect.level()), Pattern.compile(expect.loggerPattern()),
                    Pattern.compile(expect.messagePattern()), expect.occurrences());
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, logger, message);
        }
    }

    private static final class Rules {
        static final Rules DEFAULT = new Rules(Level.WARN, false, List.of(), List.of());

        final Level failLevel;
        final boolean disabled;
        final List<Rule> allows;
        final List<Rule> expects;

        Rules(Level failLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
            this.failLevel = failLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        // Method annotations come on top of class annotations; FailOnLog on the method wins.
        static Rules resolve(ExtensionContext context) {
            Optional<? extends AnnotatedElement> method = context.getTestMethod();
            Optional<? extends AnnotatedElement> type = context.getTestClass();
            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                    .orElseGet(() -> type.map(t -> t.getAnnotation(FailOnLog.class)).orElse(null));
            List<Rule> allows = Stream.concat(annotations(type, AllowLog.class), annotations(method, AllowLog.class))
                    .map(Rule::of).toList();
            List<Rule> expects = Stream.concat(annotations(type, ExpectLog.class), annotations(method, ExpectLog.class))
                    .map(Rule::of).toList();
            Level failLevel = fail != null ? toLogback(fail.level()) : Level.WARN;
            return new Rules(failLevel, fail != null && fail.disabled(), allows, expects);
        }

        private static <A extends java.lang.annotation.Annotation> Stream<A> annotations(
                Optional<? extends AnnotatedElement> element, Class<A> annotation) {
            return element.map(e -> Stream.of(e.getAnnotationsByType(annotation))).orElseGet(Stream::empty);
        }

        boolean covers(Event event) {
            return allows.stream().anyMatch(r -> r.matches(event)) || expects.stream().anyMatch(r -> r.matches(event));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules = Rules.DEFAULT;

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}
