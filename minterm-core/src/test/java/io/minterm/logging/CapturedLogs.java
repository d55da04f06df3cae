package io.minterm.logging;

import org.slf4j.event.Level;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public final class CapturedLogs {

    public record Event(String loggerName, Level level, String message) {
    }

    private static final List<Event> EVENTS = new CopyOnWriteArrayList<>();

    private CapturedLogs() {
    }

    static void record(Event event) {
        EVENTS.add(event);
    }

    public static void clear() {
        EVENTS.clear();
    }

    public static List<Event> forLogger(Class<?> type) {
        return EVENTS.stream()
                .filter(event -> event.loggerName().equals(type.getName()))
                .collect(Collectors.toList());
    }
}
