package eu.optima.listino.jpa;

import java.util.HashMap;
import java.util.Map;

import org.hibernate.jpa.HibernatePersistenceProvider;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.persistence.EntityManagerFactory;

/**
 * Programmatic Hibernate bootstrap for the mapping store:
 * - Hikari DataSource
 * - credentials from PG_URL / PG_USER / PG_PASS unless {@link #configure} was called
 * - schema owned by schema.sql, Hibernate only validates it by default
 */
public final class HibernateUtil {
    public static final String PERSISTENCE_UNIT = "listinoPU";

    private static EntityManagerFactory emf;
    private static HikariDataSource dataSource;

    private HibernateUtil() {
    }

    public static synchronized EntityManagerFactory emf() {
        if (emf == null) {
            String url = System.getenv("PG_URL");
            String user = System.getenv("PG_USER");
            String pass = System.getenv("PG_PASS");
            if (url == null || user == null || pass == null) {
                throw new IllegalStateException("Missing PG_URL/PG_USER/PG_PASS");
            }
            configure(url, user, pass, "validate");
        }
        return emf;
    }

    /**
     * (Re)initializes the factory against the given database.
     *
     * @param ddlMode value for hibernate.hbm2ddl.auto ("validate", "none", ...)
     */
    public static synchronized void configure(String url, String user, String pass, String ddlMode) {
        shutdown();
        dataSource = dataSource(url, user, pass);

        Map<String, Object> p = new HashMap<>();
        p.put("hibernate.connection.datasource", dataSource);
        p.put("hibernate.hbm2ddl.auto", ddlMode);
        p.put("hibernate.show_sql", "false");
        p.put("hibernate.format_sql", "false");
        p.put("hibernate.jdbc.time_zone", "UTC");
        p.put("hibernate.archive.autodetection", "none"); // we explicitly list classes
        p.put(org.hibernate.cfg.AvailableSettings.LOADED_CLASSES, java.util.List.of(
                eu.optima.listino.model.SupplierMapping.class));

        emf = new HibernatePersistenceProvider().createEntityManagerFactory(PERSISTENCE_UNIT, p);
        if (emf == null) {
            dataSource.close();
            dataSource = null;
            throw new IllegalStateException("Hibernate EMF bootstrap failed (persistence unit " + PERSISTENCE_UNIT
                    + " not found).");
        }
    }

    public static synchronized void shutdown() {
        if (emf != null) {
            emf.close();
            emf = null;
        }
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
    }

    private static HikariDataSource dataSource(String url, String user, String pass) {
        var cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(5);
        cfg.setPoolName("listino-hikari");
        return new HikariDataSource(cfg);
    }
}
