package dev.konduit.crawl;

/**
 * Outcome of a robots.txt check for one URL. Only {@link #ALLOWED} permits a fetch;
 * {@link #UNREADABLE} is kept apart from {@link #BLOCKED} so the audit log can tell them apart.
 */
public enum PolicyDecision {
  /** robots.txt permits the path for the wildcard agent (or the origin has no robots.txt) */
  ALLOWED("ALLOWED"),
  /** robots.txt disallows the path, or access to robots.txt itself is forbidden */
  BLOCKED("BLOCKED"),
  /** robots.txt could not be fetched or parsed; treated as a denial */
  UNREADABLE("FAILED TO READ robots.txt");

  private final String auditLabel;

  PolicyDecision(String auditLabel) {
    this.auditLabel = auditLabel;
  }

  public String auditLabel() {
    return auditLabel;
  }

  public boolean permitsFetch() {
    return this == ALLOWED;
  }
}
