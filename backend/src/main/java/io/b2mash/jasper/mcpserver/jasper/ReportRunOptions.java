package io.b2mash.jasper.mcpserver.jasper;

/** Optional rendering settings forwarded with a run. Null members are not sent. */
public record ReportRunOptions(
    String pages,
    String locale,
    String timezone,
    Boolean freshData,
    Boolean saveDataSnapshot,
    Boolean ignorePagination) {

  public static ReportRunOptions none() {
    return new ReportRunOptions(null, null, null, null, null, null);
  }
}
