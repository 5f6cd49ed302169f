package io.github.stratum.dagger;

import dagger.Component;
import io.github.stratum.dbu.connection.ConnectionProvider;
import io.github.stratum.ledger.Ledger;
import io.github.stratum.model.Configuration;
import io.github.stratum.runner.MigrationRunner;
import javax.inject.Singleton;

/**
 * The interface Stratum component.
 */
@Singleton
@Component(modules = {StratumModule.class, ConfigurationModule.class})
public interface StratumComponent {

  /**
   * Instance stratum component.
   *
   * @param configuration the configuration
   * @return the stratum component
   */
  static StratumComponent instance(final Configuration configuration) {
    return DaggerStratumComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Migration runner.
   *
   * @return the migration runner
   */
  MigrationRunner migrationRunner();

  /**
   * Connection provider (for testing).
   *
   * @return the connection provider
   */
  ConnectionProvider connectionProvider();

  /**
   * Ledger (for testing).
   *
   * @return the ledger
   */
  Ledger ledger();
}
