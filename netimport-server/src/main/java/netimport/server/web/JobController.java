package netimport.server.web;

import jakarta.servlet.http.HttpServletRequest;
import netimport.InvalidRequestException;
import netimport.dispatch.BackendProbe;
import netimport.dispatch.ExecutionMode;
import netimport.dispatch.JobDispatcher;
import netimport.dispatch.JobHandle;
import netimport.model.Job;
import netimport.model.JobFilter;
import netimport.model.JobMode;
import netimport.model.JobOrdering;
import netimport.model.JobStatus;
import netimport.model.LogLevel;
import netimport.query.JobQueries;
import netimport.spring.boot.NetImportProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class JobController {

    static final int DEFAULT_PAGE_SIZE = 50;

    private final JobDispatcher dispatcher;
    private final JobQueries queries;
    private final String principalHeader;

    /**
     * @param dispatcher absent on worker-only nodes; submissions are then refused
     */
    public JobController(@Nullable JobDispatcher dispatcher, JobQueries queries, NetImportProperties props) {
        this.dispatcher = dispatcher;
        this.queries = queries;
        this.principalHeader = props.getServer().getPrincipalHeader();
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        String base = ServletUriComponentsBuilder.fromCurrentContextPath().path("/api/").toUriString();
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("execute", base + "execute/");
        endpoints.put("jobs", base + "jobs/");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("endpoints", endpoints);
        if (dispatcher != null) {
            BackendProbe probe = dispatcher.probe();
            Map<String, Object> workers = new LinkedHashMap<>();
            workers.put("workers_available", probe.available());
            workers.put("worker_count", probe.workerCount());
            workers.put("execution_mode",
                    (probe.available() ? ExecutionMode.QUEUED : ExecutionMode.IMMEDIATE).value());
            workers.put("reason", probe.reason());
            body.put("worker_status", workers);
        }
        return body;
    }

    @PostMapping("/execute/")
    public ResponseEntity<Map<String, Object>> execute(@RequestBody ExecuteRequest request,
            HttpServletRequest httpRequest) {
        if (dispatcher == null) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "This node does not accept jobs");
        }
        String principal = Principals.resolve(httpRequest, principalHeader);
        JobHandle handle = dispatcher.submit(request.toJobRequest(), principal);
        Job job = handle.job();
        String mode = job.mode().value();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job", view(job));
        body.put("execution_mode", handle.executionMode().value());
        body.put("worker_count", handle.workerCount());
        body.put("status", job.status().value());
        if (handle.executionMode() == ExecutionMode.QUEUED) {
            body.put("task_id", job.taskRef());
            body.put("message", "Network import " + mode + " job queued for worker execution");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("message", "Network import " + mode + " job executed immediately (" + handle.reason() + ")");
        boolean succeeded = job.status() == JobStatus.COMPLETED && Boolean.TRUE.equals(job.success());
        return ResponseEntity.status(succeeded ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @GetMapping("/jobs/")
    public Map<String, Object> listJobs(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String mode,
            @RequestParam(name = "site_code", required = false) String siteCode,
            @RequestParam(required = false) String ordering,
            @RequestParam(defaultValue = "" + DEFAULT_PAGE_SIZE) int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit <= 0) {
            throw new InvalidRequestException("limit must be > 0");
        }
        if (offset < 0) {
            throw new InvalidRequestException("offset must be >= 0");
        }
        JobFilter filter = JobFilter.all();
        if (status != null && !status.isBlank()) {
            filter = filter.withStatus(parseStatus(status));
        }
        if (mode != null && !mode.isBlank()) {
            filter = filter.withMode(JobMode.fromValue(mode.trim())
                    .orElseThrow(() -> new InvalidRequestException("Unknown mode: " + mode)));
        }
        if (siteCode != null && !siteCode.isBlank()) {
            filter = filter.withSiteCode(siteCode.trim());
        }
        List<JobView> results = queries.listJobs(filter, parseOrdering(ordering), limit, offset)
                .stream()
                .map(this::view)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", queries.countJobs(filter));
        body.put("results", results);
        return body;
    }

    private static JobStatus parseStatus(String status) {
        try {
            return JobStatus.parse(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    private static JobOrdering parseOrdering(String ordering) {
        try {
            return JobOrdering.parse(ordering);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    @GetMapping("/jobs/{id}/")
    public JobView getJob(@PathVariable String id) {
        return view(queries.getJob(id));
    }

    @GetMapping("/jobs/{id}/logs/")
    public List<LogEntryView> getLogs(@PathVariable String id,
            @RequestParam(required = false) String level) {
        LogLevel filter = null;
        if (level != null && !level.isBlank()) {
            filter = LogLevel.lookup(level)
                    .orElseThrow(() -> new InvalidRequestException("Unknown log level: " + level));
        }
        return queries.getLogs(id, filter).stream().map(LogEntryView::of).toList();
    }

    @GetMapping("/jobs/{id}/status/")
    public Map<String, Object> getStatus(@PathVariable String id) {
        JobView job = view(queries.getJob(id));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job", job);
        body.put("task_ref", job.taskRef());
        if (dispatcher != null) {
            BackendProbe probe = dispatcher.probe();
            body.put("worker_count", probe.workerCount());
            body.put("has_workers", probe.available());
        }
        return body;
    }

    private JobView view(Job job) {
        return JobView.of(job, queries.stats(job.id()));
    }
}
