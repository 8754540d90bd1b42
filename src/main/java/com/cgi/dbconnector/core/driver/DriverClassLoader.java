package com.cgi.dbconnector.core.driver;

import java.net.URL;
import java.net.URLClassLoader;

/**
 * Class loader whose search path grows as driver jars are added.
 * It is never closed; loaded driver classes stay reachable for the lifetime of the registry.
 */
class DriverClassLoader extends URLClassLoader {

    DriverClassLoader(ClassLoader parent) {
        super("jdbc-drivers", new URL[0], parent);
    }

    @Override
    protected void addURL(URL url) {
        super.addURL(url);
    }
}
