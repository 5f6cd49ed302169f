package io.github.stratum.migration;

import java.util.Arrays;
import org.jdbi.v3.core.Handle;

/**
 * Runs a SQL script declared in a migration artifact. Statements are separated by semicolons.
 * A script holding nothing but blank lines and line comments does nothing.
 */
public class SqlScriptAction implements MigrationAction {

  private final String sql;

  /**
   * Instantiates a new Sql script action.
   *
   * @param sql the sql
   */
  public SqlScriptAction(final String sql) {
    this.sql = sql;
  }

  /**
   * The script text.
   *
   * @return the sql
   */
  public String sql() {
    return sql;
  }

  /**
   * Whether the script has any executable content.
   *
   * @return true if there is nothing to run
   */
  public boolean isEmpty() {
    return Arrays.stream(sql.split("\\R"))
        .map(String::trim)
        .allMatch(line -> line.isEmpty() || line.startsWith("--"));
  }

  @Override
  public void apply(final Handle handle) {
    if (isEmpty()) {
      return;
    }
    handle.createScript(sql).execute();
  }

  @Override
  public String toString() {
    return "SqlScriptAction{" + sql.length() + " chars}";
  }
}
