package io.github.stratum.dbu.connection;

import io.github.stratum.dbu.exception.DatabaseException;
import java.sql.SQLException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection provider that opens a fresh {@link Handle} from a {@link Jdbi} instance per request.
 */
@Singleton
public class JdbiConnectionProvider implements ConnectionProvider {

  /**
   * Seconds the driver may take to validate a connection in {@link #checkConnection()}.
   */
  public static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private static final Logger log = LoggerFactory.getLogger(JdbiConnectionProvider.class);

  private final Jdbi jdbi;

  /**
   * Instantiates a new Jdbi connection provider.
   *
   * @param jdbi the jdbi
   */
  @Inject
  public JdbiConnectionProvider(final Jdbi jdbi) {
    this.jdbi = jdbi;
  }

  @Override
  public Handle acquire() {
    try {
      return jdbi.open();
    } catch (ConnectionException e) {
      throw new DatabaseException("Unable to acquire a database connection", e);
    }
  }

  @Override
  public void release(final Handle handle) {
    if (handle == null) {
      return;
    }
    log.trace("release({})", handle);
    handle.close();
  }

  @Override
  public boolean checkConnection() {
    final Handle handle;
    try {
      handle = acquire();
    } catch (DatabaseException e) {
      log.warn("Connection check failed: {}", e.getMessage());
      return false;
    }
    try {
      final boolean valid = handle.getConnection().isValid(VALIDATION_TIMEOUT_SECONDS);
      log.debug("checkConnection(): {}", valid);
      return valid;
    } catch (SQLException e) {
      log.warn("Connection check failed: {}", e.getMessage());
      return false;
    } finally {
      release(handle);
    }
  }
}
