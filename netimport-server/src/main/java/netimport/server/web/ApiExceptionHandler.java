package netimport.server.web;

import netimport.ConcurrentExecutionException;
import netimport.DispatchFailureException;
import netimport.InvalidRequestException;
import netimport.JobNotFoundException;
import netimport.JobStoreException;
import netimport.dispatch.ExecutionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps job errors to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidRequestException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", "Request body is not valid JSON");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.NOT_FOUND, "Job not found", e.getMessage());
        response.getBody().put("job_id", e.jobId());
        return response;
    }

    @ExceptionHandler(ConcurrentExecutionException.class)
    public ResponseEntity<Map<String, Object>> conflict(ConcurrentExecutionException e) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, "Job is not queued", e.getMessage());
        response.getBody().put("job_id", e.jobId());
        response.getBody().put("status", e.observedStatus().value());
        return response;
    }

    @ExceptionHandler(DispatchFailureException.class)
    public ResponseEntity<Map<String, Object>> dispatchFailure(DispatchFailureException e) {
        log.error("Dispatch of job {} failed", e.jobId(), e);
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to execute job", e.getMessage());
        response.getBody().put("job_id", e.jobId());
        response.getBody().put("execution_mode", ExecutionMode.QUEUED.value());
        return response;
    }

    @ExceptionHandler(JobStoreException.class)
    public ResponseEntity<Map<String, Object>> storeFailure(JobStoreException e) {
        log.error("Job store failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Job store unavailable", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return ResponseEntity.status(status).body(body);
    }
}
