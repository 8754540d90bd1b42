package com.cgi.dbconnector.core.driver;

import com.cgi.dbconnector.exception.DriverLoadException;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Driver;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * {@link DriverRuntime} backed by a single growing {@link DriverClassLoader}.
 * Instantiated drivers are registered with {@link DriverManager} through a {@link DriverShim}.
 */
@Slf4j
public class UrlClassLoaderDriverRuntime implements DriverRuntime {
    private final DriverClassLoader classLoader;
    private final Set<String> serviceDrivers = new HashSet<>();

    public UrlClassLoaderDriverRuntime() {
        this(UrlClassLoaderDriverRuntime.class.getClassLoader());
    }

    /**
     * Constructor.
     *
     * @param parent Parent of the driver class loader
     */
    public UrlClassLoaderDriverRuntime(ClassLoader parent) {
        this.classLoader = new DriverClassLoader(parent);
    }

    @Override
    public void addToClassPath(Path path) {
        if (!Files.isRegularFile(path) && !Files.isDirectory(path)) {
            // URLClassLoader drops entries it cannot open and never retries them
            log.warn("Skipping missing driver class path entry: {}", path);
            return;
        }
        URL url;
        try {
            url = path.toAbsolutePath().toUri().toURL();
        } catch (MalformedURLException e) {
            throw new DriverLoadException("Invalid class path entry: " + path, e);
        }
        if (Arrays.asList(classLoader.getURLs()).contains(url)) {
            return;
        }
        classLoader.addURL(url);
        log.debug("Added to driver class path: {}", url);
    }

    @Override
    public boolean resolveClass(String className) {
        try {
            Class.forName(className, false, classLoader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("Driver class {} not resolvable: {}", className, e.toString());
            return false;
        }
    }

    @Override
    public Driver instantiate(String className) {
        Object instance;
        try {
            Class<?> driverClass = Class.forName(className, true, classLoader);
            instance = driverClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new DriverLoadException("Failed to instantiate driver class: " + className, e);
        }
        if (!(instance instanceof Driver driver)) {
            throw new DriverLoadException("Class " + className + " is not a java.sql.Driver");
        }

        DriverShim.register(driver);
        log.info("Successfully loaded driver: {} (version {}.{})",
                className, driver.getMajorVersion(), driver.getMinorVersion());
        return driver;
    }

    @Override
    public synchronized List<Driver> loadServiceDrivers() {
        List<Driver> loaded = new ArrayList<>();
        try {
            // Drivers from parent loaders are already visible to DriverManager
            List<ServiceLoader.Provider<Driver>> providers = ServiceLoader.load(Driver.class, classLoader).stream()
                    .filter(provider -> provider.type().getClassLoader() == classLoader)
                    .filter(provider -> !serviceDrivers.contains(provider.type().getName()))
                    .toList();
            for (ServiceLoader.Provider<Driver> provider : providers) {
                Driver driver = provider.get();
                DriverShim.register(driver);
                serviceDrivers.add(provider.type().getName());
                loaded.add(driver);
                log.info("Registered service-loaded driver: {} (version {}.{})",
                        provider.type().getName(), driver.getMajorVersion(), driver.getMinorVersion());
            }
        } catch (ServiceConfigurationError e) {
            throw new DriverLoadException("Failed to load drivers declared on the driver class path", e);
        }
        return loaded;
    }
}
