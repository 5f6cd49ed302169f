package io.github.stratum.dbu.connection;

import org.jdbi.v3.core.Handle;

/**
 * Supplies live database handles and takes them back.
 *
 * <p>Implementations decide what release means: a pooled provider returns the connection to its
 * pool, a plain factory closes it. Callers must release every handle they acquire.
 */
public interface ConnectionProvider {

  /**
   * Acquire a handle.
   *
   * @return an open handle
   * @throws io.github.stratum.dbu.exception.DatabaseException if no connection could be obtained
   */
  Handle acquire();

  /**
   * Release a handle previously returned by {@link #acquire()}.
   *
   * @param handle the handle
   */
  void release(Handle handle);

  /**
   * Whether a working connection can be obtained right now. Failures are reported as false, not
   * thrown.
   *
   * @return true if the database answered
   */
  boolean checkConnection();

}
