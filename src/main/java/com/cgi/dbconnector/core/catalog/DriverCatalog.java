package com.cgi.dbconnector.core.catalog;

import com.cgi.dbconnector.exception.UnsupportedEngineException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of the JDBC drivers that can be downloaded.
 * Also knows the DBMS aliases and the embedded engines that need no driver jar.
 */
@Component
public class DriverCatalog {
    /**
     * Selector that expands to every known engine.
     */
    public static final String ALL = "all";

    private static final Map<String, DriverDescriptor> DESCRIPTORS;

    private static final Map<String, String> ALIASES = Map.of(
            "pdw", "sql server",
            "synapse", "sql server");

    private static final Set<String> EMBEDDED = Set.of("sqlite", "sqlite extended");

    static {
        Map<String, DriverDescriptor> table = new LinkedHashMap<>();
        register(table, new DriverDescriptor("postgresql", "postgresqlV42.2.18.zip", "42.2.18",
                "org.postgresql.Driver", "postgresql"));
        register(table, new DriverDescriptor("redshift", "redShiftV2.1.0.9.zip", "2.1.0.9",
                "com.amazon.redshift.jdbc.Driver", "(?i)redshift"));
        register(table, new DriverDescriptor("sql server", "sqlServerV9.2.0.zip", "9.2.0",
                "com.microsoft.sqlserver.jdbc.SQLServerDriver", "mssql-jdbc"));
        register(table, new DriverDescriptor("oracle", "oracleV19.8.zip", "19.8",
                "oracle.jdbc.driver.OracleDriver", "ojdbc"));
        register(table, new DriverDescriptor("spark", "SimbaSparkV2.6.21.zip", "2.6.21",
                "com.simba.spark.jdbc.Driver", "(?i)spark"));
        register(table, new DriverDescriptor("snowflake", "SnowflakeV3.13.22.zip", "3.13.22",
                "net.snowflake.client.jdbc.SnowflakeDriver", "(?i)snowflake"));
        DESCRIPTORS = Collections.unmodifiableMap(table);
    }

    private static void register(Map<String, DriverDescriptor> table, DriverDescriptor descriptor) {
        table.put(descriptor.dbmsKey(), descriptor);
    }

    /**
     * Normalizes a DBMS name: trims, lower-cases and maps aliases onto their canonical key.
     *
     * @param dbms DBMS name as given by the caller
     * @return Canonical key, or the lower-cased input when it is not an alias
     */
    public String normalize(String dbms) {
        if (dbms == null) {
            return "";
        }
        String key = dbms.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }

    /**
     * Resolves a DBMS name (or alias) to its descriptor.
     *
     * @param dbms DBMS name
     * @return The descriptor
     * @throws UnsupportedEngineException If the name is not in the table
     */
    public DriverDescriptor resolve(String dbms) {
        DriverDescriptor descriptor = DESCRIPTORS.get(normalize(dbms));
        if (descriptor == null) {
            throw new UnsupportedEngineException(dbms, supportedSelectors());
        }
        return descriptor;
    }

    /**
     * Expands a selector into the descriptors to process.
     * {@code "all"} yields every engine once, in table order.
     *
     * @param selector DBMS key, alias or "all"
     * @return Descriptors to process
     */
    public List<DriverDescriptor> expand(String selector) {
        if (ALL.equals(normalize(selector))) {
            return List.copyOf(DESCRIPTORS.values());
        }
        return List.of(resolve(selector));
    }

    /**
     * Checks whether an engine is embedded and therefore needs no external driver.
     *
     * @param dbms DBMS name, may be null
     * @return true for embedded engines
     */
    public boolean isEmbedded(String dbms) {
        return dbms != null && EMBEDDED.contains(normalize(dbms));
    }

    public Collection<DriverDescriptor> descriptors() {
        return DESCRIPTORS.values();
    }

    /**
     * Gets every selector accepted by {@link #expand(String)}.
     *
     * @return Keys, aliases and "all"
     */
    public List<String> supportedSelectors() {
        List<String> selectors = new ArrayList<>(DESCRIPTORS.keySet());
        selectors.addAll(ALIASES.keySet().stream().sorted().toList());
        selectors.add(ALL);
        return selectors;
    }
}
