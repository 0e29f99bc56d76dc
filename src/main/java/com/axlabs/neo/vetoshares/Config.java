package com.axlabs.neo.vetoshares;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Reads the configuration from the classpath file {@value #PROPS_FILE}. If a profile is set, the file
 * {@code [profile].vetoshares.properties} is read instead.
 */
public class Config {

    static final String PROPS_FILE = "vetoshares.properties";

    private static String profile;
    private static Properties props;

    public static synchronized void setProfile(String profileName) {
        profile = profileName;
        props = null;
    }

    public static synchronized String getProfile() {
        return profile;
    }

    public static synchronized String getProperty(String name) {
        if (props == null) {
            props = load();
        }
        return props.getProperty(name);
    }

    public static long getLongProperty(String name) {
        String value = getProperty(name);
        if (value == null) {
            throw new IllegalStateException("Missing property '" + name + "' in " + getFileName());
        }
        return Long.parseLong(value.trim());
    }

    private static Properties load() {
        String fileName = getFileName();
        Properties p = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file " + fileName + " not found on the classpath");
            }
            p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + fileName, e);
        }
        return p;
    }

    private static String getFileName() {
        return profile == null ? PROPS_FILE : profile + "." + PROPS_FILE;
    }
}
