package netimport.server.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import netimport.model.Job;
import netimport.model.JobStats;

import java.time.Instant;

/**
 * Job as rendered by the API.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobView(
        String id,
        String siteCode,
        String mode,
        String status,
        Boolean success,
        boolean hasErrors,
        String principal,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String taskRef,
        long logsCount,
        long errorLogsCount
) {

    public static JobView of(Job job, JobStats stats) {
        return new JobView(
                job.id(),
                job.siteCode(),
                job.mode().value(),
                job.status().value(),
                job.success(),
                stats.hasErrors(),
                job.principal(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.taskRef(),
                stats.logCount(),
                stats.errorLogCount());
    }
}
