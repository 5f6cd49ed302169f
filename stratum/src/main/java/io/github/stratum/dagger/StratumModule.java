package io.github.stratum.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import io.github.stratum.dbu.connection.ConnectionProvider;
import io.github.stratum.dbu.connection.JdbiConnectionProvider;
import io.github.stratum.dbu.factory.JdbiFactory;
import io.github.stratum.ledger.LedgerEntry;
import io.github.stratum.migration.MigrationScanner;
import java.time.Clock;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The type Stratum module.
 */
@Module(includes = StratumModule.Binder.class)
public class StratumModule {

  /**
   * Instantiates a new Stratum module.
   */
  public StratumModule() {
    // Default constructor
  }

  /**
   * Jdbi.
   *
   * @param factory the factory
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory) {
    return factory.createJdbi();
  }

  /**
   * Immutable classes mapped from query results.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(LedgerEntry.class);
  }

  /**
   * Object mapper for migration artifacts.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  @Named(MigrationScanner.YAML_MAPPER)
  public ObjectMapper yamlMapper() {
    return new ObjectMapper(new YAMLFactory());
  }

  /**
   * Clock for ledger timestamps.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Connection provider.
     *
     * @param provider the provider
     * @return the connection provider
     */
    @Binds
    ConnectionProvider connectionProvider(JdbiConnectionProvider provider);

  }
}
