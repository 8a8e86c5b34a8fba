package com.sankeydsl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/** Build version, filled in from the Maven project version when resources are processed. */
public final class Version {
    private static final String RESOURCE = "version.properties";

    public static final String FULL = load();

    private Version() {}

    static String load() {
        try (InputStream in = Version.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            Properties properties = new Properties();
            properties.load(in);
            String version = properties.getProperty("version");
            if (version == null || version.isBlank()) {
                throw new IllegalStateException("No version in " + RESOURCE);
            }
            return version.trim();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, ex);
        }
    }
}
