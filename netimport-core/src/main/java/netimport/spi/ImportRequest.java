package netimport.spi;

import netimport.model.JobMode;
import netimport.settings.ResolvedSettings;

import java.util.Map;

/**
 * Everything an {@link ImportExecutor} needs to run one import.
 *
 * @param jobId    the job being executed
 * @param siteCode site to import
 * @param mode     check or apply
 * @param settings resolved settings
 * @param config   generated {@code section.key} configuration, secrets included
 */
public record ImportRequest(
    String jobId,
    String siteCode,
    JobMode mode,
    ResolvedSettings settings,
    Map<String, String> config
) {
  public ImportRequest {
    config = Map.copyOf(config);
  }
}
