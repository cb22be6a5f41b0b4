package eu.fbk.ebes.internal;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.io.Resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    /**
     * Resolves a location to a URL, trying in order a classpath resource, a file and an URL.
     *
     * @param location
     *            the location
     * @return the resolved URL
     * @throws IllegalArgumentException
     *             if the location cannot be resolved
     */
    public static URL getURL(final String location) {
        try {
            final URL url = Resources.getResource(location.startsWith("/") ? location
                    .substring(1) : location);
            if (url != null) {
                return url;
            }
        } catch (final IllegalArgumentException ex) {
            // not a classpath resource - ignore
        }
        try {
            final File file = new File(location);
            if (file.exists() && file.isFile()) {
                return file.toURI().toURL();
            }
        } catch (final IOException ex) {
            // not a file - ignore
        }
        try {
            return new URL(location);
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Cannot extract a URL from: " + location, ex);
        }
    }

    /**
     * Loads a properties file from the location specified (see {@link #getURL(String)}).
     *
     * @param location
     *            the location of the properties file
     * @return the loaded properties
     * @throws IOException
     *             on failure
     */
    public static Properties loadProperties(final String location) throws IOException {
        final URL url = getURL(location);
        final InputStream stream = url.openStream();
        try {
            final Properties properties = new Properties();
            properties.load(stream);
            LOGGER.debug("Loaded {} properties from {}", properties.size(), url);
            return properties;
        } finally {
            stream.close();
        }
    }

    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final URL url = Util.class.getClassLoader().getResource(
                "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties");
        String version = defaultValue;
        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version").trim();
                } finally {
                    stream.close();
                }
            } catch (final IOException ex) {
                version = "unknown";
            }
        }
        return version;
    }

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof Closeable) {
            try {
                ((Closeable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
        return object;
    }

}
