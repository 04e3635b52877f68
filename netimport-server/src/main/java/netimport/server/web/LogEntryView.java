package netimport.server.web;

import netimport.model.LogEntry;

import java.time.Instant;

public record LogEntryView(long sequence, Instant timestamp, String level, String message, String source) {

    public static LogEntryView of(LogEntry entry) {
        return new LogEntryView(entry.sequence(), entry.timestamp(), entry.level().name(),
                entry.message(), entry.source());
    }
}
