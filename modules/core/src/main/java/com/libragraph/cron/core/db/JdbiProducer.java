package com.libragraph.cron.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

/**
 * Builds the Jdbi instance over the Agroal pool. Postgres-specific mappings are only
 * installed when the datasource actually is PostgreSQL, so the H2 test profile runs the same DAOs.
 */
@ApplicationScoped
public class JdbiProducer {

    private static final Logger log = Logger.getLogger(JdbiProducer.class);

    @ConfigProperty(name = "quarkus.datasource.db-kind", defaultValue = "postgresql")
    String dbKind;

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        Jdbi jdbi = Jdbi.create(dataSource)
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
        if (isPostgres(dbKind)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        log.infof("Jdbi configured for %s", dbKind);
        return jdbi;
    }

    static boolean isPostgres(String dbKind) {
        return dbKind != null && (dbKind.equalsIgnoreCase("postgresql") || dbKind.equalsIgnoreCase("postgres")
                || dbKind.equalsIgnoreCase("pgsql"));
    }
}
