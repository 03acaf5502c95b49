package ca.gc.cra.dualtap.domain.capture;

/**
 * Kinds of persisted capture rows and the table each kind lives in.
 *
 * @since 0.1.0
 */
public enum RecordKind {
  /** Intercepted HTTP request and response rows. */
  NETWORK_TRAFFIC("network_traffic"),
  /** Runtime hook events. */
  HOOK("frida_hooks"),
  /** Titles extracted from HTML responses. */
  SCRAPED_ARTIFACT("scraped_articles");

  private final String tableName;

  RecordKind(String tableName) {
    this.tableName = tableName;
  }

  /**
   * Returns the table backing this kind.
   *
   * @return SQL table name
   */
  public String tableName() {
    return tableName;
  }
}
