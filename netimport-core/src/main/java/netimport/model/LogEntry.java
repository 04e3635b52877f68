package netimport.model;

import java.time.Instant;

/**
 * One persisted line of a job's log stream.
 *
 * @param jobId     owning job
 * @param sequence  per-job position, starting at 1 with no gaps
 * @param level     severity
 * @param message   text as emitted
 * @param source    logical emitter, e.g. {@code network-importer}
 * @param timestamp when the line was recorded
 */
public record LogEntry(
    String jobId,
    long sequence,
    LogLevel level,
    String message,
    String source,
    Instant timestamp
) {
}
