package netimport.dispatch;

import netimport.model.JobSettings;

/**
 * An unvalidated request to run an import.
 *
 * @param site     site code, trimmed during validation
 * @param mode     {@code check} or {@code apply}
 * @param settings named settings selectors and options
 */
public record JobRequest(String site, String mode, JobSettings settings) {
}
