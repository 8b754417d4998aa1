package eu.fbk.graphstore.internal;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.URL;
import java.util.Properties;
import java.util.concurrent.ThreadFactory;

import javax.annotation.Nullable;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    /** The MDC key holding the context (e.g., the peer address) of the current activity. */
    public static final String MDC_CONTEXT = "context";

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
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

    public static ThreadFactory newThreadFactory(final String nameFormat, final boolean daemon) {
        return new ThreadFactoryBuilder().setDaemon(daemon).setNameFormat(nameFormat)
                .setUncaughtExceptionHandler(new UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread thread, final Throwable ex) {
                        LOGGER.error("Uncaught exception in thread " + thread.getName(), ex);
                    }

                }).build();
    }

}
