package ca.gc.cra.dualtap.infrastructure.persistence.jdbc;

import ca.gc.cra.dualtap.domain.capture.RecordKind;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;

/**
 * DDL and timestamp encoding for the three capture tables.
 * <p>Timestamps are ISO-8601 UTC text with a fixed nine digit fraction so that lexical order equals time order.</p>
 *
 * @since 0.1.0
 */
final class CaptureSchema {

  static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder().appendInstant(9).toFormatter();

  static final String NETWORK_TRAFFIC_DDL = "CREATE TABLE IF NOT EXISTS " + RecordKind.NETWORK_TRAFFIC.tableName()
      + " (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
      + " \"timestamp\" VARCHAR(40) NOT NULL,"
      + " method VARCHAR NOT NULL,"
      + " url CLOB NOT NULL,"
      + " status_code INT,"
      + " request_headers CLOB,"
      + " response_headers CLOB,"
      + " request_body CLOB,"
      + " response_body CLOB,"
      + " source VARCHAR(32) DEFAULT 'mitm')";

  static final String HOOK_DDL = "CREATE TABLE IF NOT EXISTS " + RecordKind.HOOK.tableName()
      + " (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
      + " \"timestamp\" VARCHAR(40) NOT NULL,"
      + " hook_type VARCHAR NOT NULL,"
      + " function_name VARCHAR NOT NULL,"
      + " parameters CLOB,"
      + " return_value CLOB,"
      + " additional_data CLOB)";

  static final String ARTIFACT_DDL = "CREATE TABLE IF NOT EXISTS " + RecordKind.SCRAPED_ARTIFACT.tableName()
      + " (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
      + " \"timestamp\" VARCHAR(40) NOT NULL,"
      + " title VARCHAR NOT NULL,"
      + " url CLOB,"
      + " content CLOB,"
      + " metadata CLOB,"
      + " extraction_method VARCHAR(64) NOT NULL)";

  static final List<String> ALL_DDL = List.of(NETWORK_TRAFFIC_DDL, HOOK_DDL, ARTIFACT_DDL);

  private CaptureSchema() {}

  static String format(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }

  static Instant parse(String text) {
    return Instant.parse(text);
  }
}
