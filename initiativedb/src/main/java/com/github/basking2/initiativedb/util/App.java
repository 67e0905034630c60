package com.github.basking2.initiativedb.util;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

/**
 * A class to capture the notion of an application.
 *
 * Configuration is looked up, first match wins, in system properties, {@code ./name.properties},
 * {@code /etc/name.properties}, {@code /etc/name/name.properties}, {@code /opt/name/conf/name.properties}
 * and finally {@code /name.properties} on the classpath.
 */
public class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    final protected String name;

    public App(final String name){
        this.name = name;
    }
    public App(final Class<?> clazz){
        this(clazz.getSimpleName().toLowerCase());
    }

    public String getName() {
        return name;
    }

    public Configuration buildConfiguration() throws ConfigurationException {

        final Configurations configurations = new Configurations();

        final List<Configuration> configs = new ArrayList<>();

        // Check system first to allow overridding on the command line.
        configs.add(new SystemConfiguration());

        addOptional(configs, configurations, new File("./"+name+".properties"));
        addOptional(configs, configurations, new File("/etc/"+name+".properties"));
        addOptional(configs, configurations, new File("/etc/"+name+"/"+name+".properties"));
        addOptional(configs, configurations, new File("/opt/"+name+"/conf/"+name+".properties"));

        // Embedded is last.
        final URL embedded = getClass().getResource("/"+name+".properties");
        if (embedded != null) {
            configs.add(configurations.properties(embedded));
        }
        else {
            LOG.warn("No embedded configuration /{}.properties found.", name);
        }

        return new CompositeConfiguration(configs);
    }

    private static void addOptional(final List<Configuration> configs, final Configurations configurations, final File file)
            throws ConfigurationException
    {
        if (file.canRead()) {
            LOG.info("Loading configuration {}.", file.getAbsolutePath());
            configs.add(configurations.properties(file));
        }
    }
}
