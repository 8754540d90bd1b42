package com.cgi.dbconnector.core.driver;

import com.cgi.dbconnector.exception.DriverClassNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Driver;
import java.util.Set;

/**
 * Default {@link DriverRegistry}.
 * The cache makes the lookup and the load a single atomic step.
 */
@Slf4j
public class DefaultDriverRegistry implements DriverRegistry {
    private final DriverRuntime runtime;
    private final DriverCache cache;

    /**
     * Constructor.
     *
     * @param runtime Class loading operations
     * @param cache Handle cache
     */
    public DefaultDriverRegistry(DriverRuntime runtime, DriverCache cache) {
        this.runtime = runtime;
        this.cache = cache;
    }

    @Override
    public DriverHandle getOrLoadDriver(String driverClassName, String classPath) {
        RegistryKey key = new RegistryKey(driverClassName, classPath);
        return cache.getOrLoad(key, this::load);
    }

    @Override
    public boolean isLoaded(RegistryKey key) {
        return cache.contains(key);
    }

    @Override
    public Set<RegistryKey> loadedKeys() {
        return cache.keys();
    }

    private DriverHandle load(RegistryKey key) {
        log.debug("Loading driver {} from '{}'", key.driverClassName(), key.classPath());
        key.classPathEntries().forEach(runtime::addToClassPath);

        if (!key.hasDriverClass()) {
            if (!key.classPath().isEmpty()) {
                int registered = runtime.loadServiceDrivers().size();
                log.debug("Registered {} service-loaded driver(s) from '{}'", registered, key.classPath());
            }
            return new DriverHandle(key, null);
        }
        if (!runtime.resolveClass(key.driverClassName())) {
            log.error("Cannot find JDBC driver class {} in '{}'", key.driverClassName(), key.classPath());
            throw new DriverClassNotFoundException(key.driverClassName(), key.classPath());
        }
        Driver driver = runtime.instantiate(key.driverClassName());
        return new DriverHandle(key, driver);
    }
}
