package netimport.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Network import job server.
 *
 * <p>The starter auto-configures job storage, dispatch and workers from {@code netimport.*}
 * properties; this application adds the HTTP API and the command-line import executor.
 *
 * <p>Endpoints:
 * GET  /api/                    - endpoints and worker status
 * POST /api/execute/            - submit an import job
 * GET  /api/jobs/               - list jobs
 * GET  /api/jobs/{id}/          - job detail
 * GET  /api/jobs/{id}/logs/     - job log entries
 * GET  /api/jobs/{id}/status/   - job detail with worker status
 *
 * <p>Start a worker-only node with {@code --netimport.role=WORKER}.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
