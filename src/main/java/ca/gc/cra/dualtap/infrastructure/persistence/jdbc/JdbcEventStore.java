package ca.gc.cra.dualtap.infrastructure.persistence.jdbc;

import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.domain.capture.HookRecord;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.RecordKind;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.domain.capture.StoredArtifact;
import ca.gc.cra.dualtap.infrastructure.json.JsonSupport;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> H2-backed {@link EventStorePort} holding traffic, hook and artifact rows.
 * <p><strong>Why:</strong> The proxy thread and the instrumentation delivery thread append concurrently; every append
 * goes through one fair {@link ReentrantLock} and runs as its own open-insert-commit-close unit, so a failure never
 * leaves a half written row and {@code N} appends yield {@code N} rows.</p>
 * <p><strong>Thread-safety:</strong> Appends are serialized by the write lock. Reads take no lock; H2 MVCC gives each
 * statement a consistent snapshot.</p>
 * <p><strong>Performance:</strong> One connection per append. Capture rates are bounded by human-driven browsing, not
 * by the store.</p>
 * <p><strong>Observability:</strong> Emits {@code store.append.success}, {@code store.append.error} and
 * {@code store.append.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class JdbcEventStore implements EventStorePort {
  private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

  private static final String INSERT_TRAFFIC = "INSERT INTO " + RecordKind.NETWORK_TRAFFIC.tableName()
      + " (\"timestamp\", method, url, status_code, request_headers, response_headers, request_body, response_body,"
      + " source) VALUES (?,?,?,?,?,?,?,?,?)";
  private static final String INSERT_HOOK = "INSERT INTO " + RecordKind.HOOK.tableName()
      + " (\"timestamp\", hook_type, function_name, parameters, return_value, additional_data)"
      + " VALUES (?,?,?,?,?,?)";
  private static final String INSERT_ARTIFACT = "INSERT INTO " + RecordKind.SCRAPED_ARTIFACT.tableName()
      + " (\"timestamp\", title, url, content, metadata, extraction_method) VALUES (?,?,?,?,?,?)";
  private static final String SELECT_RECENT_ARTIFACTS = "SELECT id, \"timestamp\", title, url, content, metadata,"
      + " extraction_method FROM " + RecordKind.SCRAPED_ARTIFACT.tableName()
      + " ORDER BY \"timestamp\" DESC, id DESC LIMIT ?";

  private static final JdbcTemplate.RowMapper<StoredArtifact> ARTIFACT_ROW_MAPPER = rs -> new StoredArtifact(
      rs.getLong("id"),
      new ScrapedArtifactRecord(
          CaptureSchema.parse(rs.getString("timestamp")),
          rs.getString("title"),
          rs.getString("url"),
          rs.getString("content"),
          rs.getString("metadata"),
          rs.getString("extraction_method")));

  private final DataSource dataSource;
  private final boolean shutdownOnClose;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();
  private final ReentrantLock writeLock = new ReentrantLock(true);
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a store over an existing data source.
   *
   * @param dataSource connection source; each operation opens and closes its own connection
   * @param shutdownOnClose whether {@link #close()} issues {@code SHUTDOWN} to the database
   * @param metrics metrics sink
   */
  public JdbcEventStore(DataSource dataSource, boolean shutdownOnClose, MetricsPort metrics) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.shutdownOnClose = shutdownOnClose;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Opens (or creates) an H2 file database.
   *
   * @param file database path without the {@code .mv.db} suffix
   * @param metrics metrics sink
   * @return store; call {@link #initialize()} before use
   */
  public static JdbcEventStore forFile(Path file, MetricsPort metrics) {
    return new JdbcEventStore(h2("jdbc:h2:file:" + file.toAbsolutePath() + ";DB_CLOSE_DELAY=-1"), true, metrics);
  }

  /**
   * Opens a named in-memory H2 database that lives until {@link #close()}.
   *
   * @param name database name
   * @param metrics metrics sink
   * @return store; call {@link #initialize()} before use
   */
  public static JdbcEventStore inMemory(String name, MetricsPort metrics) {
    return new JdbcEventStore(h2("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1"), true, metrics);
  }

  private static DataSource h2(String url) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(url);
    ds.setUser("sa");
    ds.setPassword("");
    return ds;
  }

  @Override
  public void initialize() {
    ensureOpen();
    withWriteLock(conn -> {
      for (String ddl : CaptureSchema.ALL_DDL) {
        JdbcTemplate.update(conn, ddl);
      }
      return null;
    });
    log.info("Capture store ready (tables {}, {}, {})",
        RecordKind.NETWORK_TRAFFIC.tableName(), RecordKind.HOOK.tableName(), RecordKind.SCRAPED_ARTIFACT.tableName());
  }

  @Override
  public long append(NetworkTrafficRecord record) {
    Objects.requireNonNull(record, "record");
    return timedAppend(conn -> JdbcTemplate.insert(conn, INSERT_TRAFFIC,
        CaptureSchema.format(record.timestamp()),
        record.method(),
        record.url(),
        record.statusCode(),
        json.write(record.requestHeaders()),
        record.responseHeaders() == null ? null : json.write(record.responseHeaders()),
        record.requestBody(),
        record.responseBody(),
        record.source()));
  }

  @Override
  public long append(HookRecord record) {
    Objects.requireNonNull(record, "record");
    return timedAppend(conn -> JdbcTemplate.insert(conn, INSERT_HOOK,
        CaptureSchema.format(record.timestamp()),
        record.hookType(),
        record.functionName(),
        record.parameters() == null ? null : json.write(record.parameters()),
        record.returnValue(),
        record.additionalData() == null ? null : json.write(record.additionalData())));
  }

  @Override
  public long append(ScrapedArtifactRecord record) {
    Objects.requireNonNull(record, "record");
    return timedAppend(conn -> JdbcTemplate.insert(conn, INSERT_ARTIFACT,
        CaptureSchema.format(record.timestamp()),
        record.title(),
        record.url(),
        record.content(),
        record.metadata(),
        record.extractionMethod()));
  }

  @Override
  public long count(RecordKind kind) {
    Objects.requireNonNull(kind, "kind");
    return read(conn -> JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + kind.tableName()));
  }

  @Override
  public List<StoredArtifact> recentArtifacts(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return read(conn -> JdbcTemplate.query(conn, SELECT_RECENT_ARTIFACTS, ARTIFACT_ROW_MAPPER, limit));
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (!shutdownOnClose) {
      return;
    }
    writeLock.lock();
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("SHUTDOWN");
      log.info("Capture store closed");
    } catch (SQLException ex) {
      throw new StorageFault("Failed to shut down capture store", ex);
    } finally {
      writeLock.unlock();
    }
  }

  private long timedAppend(Function<Connection, Long> insert) {
    ensureOpen();
    long start = System.nanoTime();
    try {
      long id = withWriteLock(insert);
      metrics.increment("store.append.success");
      metrics.observe("store.append.latencyNanos", System.nanoTime() - start);
      return id;
    } catch (StorageFault fault) {
      metrics.increment("store.append.error");
      throw fault;
    }
  }

  private <T> T withWriteLock(Function<Connection, T> work) {
    writeLock.lock();
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (RuntimeException ex) {
        rollbackQuietly(conn, ex);
        throw ex;
      }
    } catch (SQLException ex) {
      throw new StorageFault("Capture store unavailable", ex);
    } finally {
      writeLock.unlock();
    }
  }

  private <T> T read(Function<Connection, T> work) {
    ensureOpen();
    try (Connection conn = dataSource.getConnection()) {
      return work.apply(conn);
    } catch (SQLException ex) {
      throw new StorageFault("Capture store unavailable", ex);
    }
  }

  private static void rollbackQuietly(Connection conn, RuntimeException cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackEx) {
      cause.addSuppressed(rollbackEx);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StorageFault("Capture store is closed");
    }
  }
}
