package io.github.stratum.dbu.factory;

import io.github.stratum.dbu.model.Database;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link Jdbi} instance for a configured database.
 */
@Singleton
public class JdbiFactory {

  /**
   * Qualifier for the set of Immutables value types registered as row results.
   */
  public static final String IMMUTABLES = "JdbiFactory.immutables";

  private static final Logger log = LoggerFactory.getLogger(JdbiFactory.class);

  private final Database database;
  private final Set<Class<?>> immutableClasses;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database         the database
   * @param immutableClasses the immutable classes
   */
  @Inject
  public JdbiFactory(final Database database,
                     @Named(IMMUTABLES) final Set<Class<?>> immutableClasses) {
    this.database = database;
    this.immutableClasses = immutableClasses;
  }

  /**
   * Create jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.info("createJdbi({})", database.url());
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password());
    jdbi.installPlugin(new SqlObjectPlugin());
    jdbi.getConfig(JdbiImmutables.class).registerImmutable(immutableClasses.toArray(new Class<?>[0]));
    return jdbi;
  }

}
