package netimport.model;

/**
 * Optional equality filters for listing jobs. {@code null} components match everything.
 */
public record JobFilter(JobStatus status, JobMode mode, String siteCode) {

  private static final JobFilter ALL = new JobFilter(null, null, null);

  public static JobFilter all() {
    return ALL;
  }

  public JobFilter withStatus(JobStatus status) {
    return new JobFilter(status, mode, siteCode);
  }

  public JobFilter withMode(JobMode mode) {
    return new JobFilter(status, mode, siteCode);
  }

  public JobFilter withSiteCode(String siteCode) {
    return new JobFilter(status, mode, siteCode);
  }
}
