package eu.fbk.graphstore.runtime;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.net.URL;
import java.util.Properties;
import java.util.ServiceConfigurationError;
import java.util.concurrent.CountDownLatch;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.net.HostAndPort;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;

import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.Datastores;
import eu.fbk.graphstore.datastore.LoggingDatastore;
import eu.fbk.graphstore.internal.Util;
import eu.fbk.graphstore.server.Server;

/**
 * Command line launcher of a GraphStore {@link Server}.
 * <p>
 * The {@code Launcher} class provides the {@link #main(String...)} method for configuring,
 * starting and stopping a server. Configuration is read from an optional Java properties file and
 * from command line options, the latter taking precedence. The following options are recognized:
 * </p>
 * <ul>
 * <li>{@code -c, --config} - the properties file / classpath resource to read;</li>
 * <li>{@code -d, --datastore} - the datastore location, e.g. {@code memory://},
 * {@code rocksdb:///var/lib/graphstore?ids=long} (property {@code graphstore.datastore}, default
 * {@code memory://});</li>
 * <li>{@code -b, --bind} - the {@code host:port} address to listen on (property
 * {@code graphstore.bind}, default {@code 127.0.0.1:27615});</li>
 * <li>{@code -w, --workers} - the number of worker threads (property {@code graphstore.workers},
 * default 8);</li>
 * <li>{@code -t, --idle-timeout} - the milliseconds a client with an open transaction may stay
 * silent before being disconnected (property {@code graphstore.idleTimeout}, default 60000);</li>
 * <li>{@code -v, --version} - display version information, then exit;</li>
 * <li>{@code -h, --help} - display the help message, then exit.</li>
 * </ul>
 * <p>
 * Logging is configured via the Logback file / classpath resource given by system property
 * {@code launcher.logging} (default {@code logback.xml}). Once started, the server runs until
 * the JVM is terminated (e.g., via CTRL-C) or key {@code q} is entered on the console; key
 * {@code i} displays status information.
 * </p>
 * <p>
 * The {@code main()} method returns as exit codes the following 'pseudo' standard values (see
 * {@code sysexit.h}):
 * </p>
 * <ul>
 * <li>0 - success;</li>
 * <li>64 - command line syntax errors;</li>
 * <li>78 - configuration errors;</li>
 * <li>74 - I/O errors during server initialization;</li>
 * <li>69 - other error.</li>
 * </ul>
 */
public final class Launcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Launcher.class);

    static final int EX_OK = 0; // success (sysexit.h)

    static final int EX_USAGE = 64; // command used incorrectly (sysexit.h)

    static final int EX_CONFIG = 78; // something unconfigured/misconfigured (sysexit.h)

    static final int EX_IOERR = 74; // some error occurred while doing I/O (sysexit.h)

    static final int EX_UNAVAILABLE = 69; // catch-all when something fails (sysexit.h)

    static final String PROPERTY_DATASTORE = "graphstore.datastore";

    static final String PROPERTY_BIND = "graphstore.bind";

    static final String PROPERTY_WORKERS = "graphstore.workers";

    static final String PROPERTY_IDLE_TIMEOUT = "graphstore.idleTimeout";

    private static final String PROGRAM_EXECUTABLE = System.getProperty("launcher.executable",
            "graphstore");

    private static final String PROGRAM_VERSION = Util.getVersion("eu.fbk.graphstore",
            "gs-server", "devel");

    private static final String DEFAULT_DATASTORE = "memory://";

    private static final String DEFAULT_BIND = Server.DEFAULT_HOST + ":" + Server.DEFAULT_PORT;

    private static final String DEFAULT_LOG_CONFIG = System.getProperty("launcher.logging",
            "logback.xml");

    private static final int WIDTH = 80;

    /**
     * Program entry point. See class documentation for the supported features.
     * 
     * @param args
     *            command line arguments
     */
    public static void main(final String... args) {
        final int status = execute(args);

        // Display exit status for convenience
        if (status != EX_OK) {
            System.err.println("[exit status: " + status + "]");
        } else {
            System.out.println("[exit status: " + status + "]");
        }

        // Flush STDIN and STDOUT before exiting (we noted truncated outputs otherwise)
        System.out.flush();
        System.err.flush();

        // Force exiting (in case there are threads still running)
        System.exit(status);
    }

    static Options newOptions() {
        final Options options = new Options();
        options.addOption("c", "config", true, "use configuration properties file / classpath "
                + "resource");
        options.addOption("d", "datastore", true, "the datastore location (default '"
                + DEFAULT_DATASTORE + "')");
        options.addOption("b", "bind", true, "the host:port address to listen on (default '"
                + DEFAULT_BIND + "')");
        options.addOption("w", "workers", true, "the number of worker threads (default "
                + Server.DEFAULT_WORKERS + ")");
        options.addOption("t", "idle-timeout", true, "the milliseconds a client may stay idle "
                + "within a transaction (default " + Server.DEFAULT_IDLE_TIMEOUT + ")");
        options.addOption("v", "version", false,
                "display version and copyright information, then exit");
        options.addOption("h", "help", false, "display usage information, then exit");
        return options;
    }

    static int execute(final String... args) {

        final Options options = newOptions();
        int status = EX_OK;

        try {
            // Parse command line and handle different commands
            final CommandLine cmd = new DefaultParser().parse(options, args);
            if (cmd.hasOption("v")) {
                System.out.println(String.format("%s (FBK GraphStore) %s\njava %s (%s) %s",
                        PROGRAM_EXECUTABLE, PROGRAM_VERSION, System.getProperty("os.arch"),
                        System.getProperty("java.vendor"), System.getProperty("java.version")));

            } else if (cmd.hasOption("h")) {
                // Show usage (done later) and terminate
                status = EX_USAGE;

            } else if (!cmd.getArgList().isEmpty()) {
                throw new ParseException("Unexpected arguments " + cmd.getArgList());

            } else {
                run(newServer(cmd));
            }

        } catch (final ParseException ex) {
            // Display error message and then usage on syntax error
            System.err.println("SYNTAX ERROR: " + ex.getMessage());
            status = EX_USAGE;

        } catch (final ServiceConfigurationError ex) {
            // Display error message and stack trace and terminate on configuration error
            System.err.println("INVALID CONFIGURATION: " + ex.getMessage());
            Throwables.getRootCause(ex).printStackTrace();
            status = EX_CONFIG;

        } catch (final Throwable ex) {
            // Display error message and stack trace on generic error
            System.err.print("EXECUTION FAILED: ");
            ex.printStackTrace();
            status = ex instanceof IOException ? EX_IOERR : EX_UNAVAILABLE;
        }

        // Display usage information if necessary
        if (status == EX_USAGE) {
            final PrintWriter out = new PrintWriter(System.out);
            final HelpFormatter formatter = new HelpFormatter();
            formatter.printUsage(out, WIDTH, PROGRAM_EXECUTABLE, options);
            formatter.printWrapped(out, WIDTH, "\nRuns a GraphStore server exposing a datastore "
                    + "over TCP.");
            out.println("\nOptions");
            formatter.printOptions(out, WIDTH, options, 2, 2);
            out.flush();
        }

        return status;
    }

    /**
     * Creates a (non initialized) server based on the configuration properties file and the
     * options specified on the command line.
     * 
     * @param cmd
     *            the parsed command line
     * @return the configured server
     * @throws ServiceConfigurationError
     *             if the configuration is missing or invalid
     */
    static Server newServer(final CommandLine cmd) throws ServiceConfigurationError {

        final Properties properties = new Properties();
        final String configLocation = cmd.getOptionValue('c');
        if (configLocation != null) {
            try {
                final InputStream stream = retrieveURL(configLocation).openStream();
                try {
                    properties.load(stream);
                } finally {
                    stream.close();
                }
            } catch (final Throwable ex) {
                throw new ServiceConfigurationError("Cannot load configuration '"
                        + configLocation + "': " + ex.getMessage(), ex);
            }
        }

        final String location = setting(cmd, 'd', properties, PROPERTY_DATASTORE,
                DEFAULT_DATASTORE);
        final String bind = setting(cmd, 'b', properties, PROPERTY_BIND, DEFAULT_BIND);
        final String workers = setting(cmd, 'w', properties, PROPERTY_WORKERS,
                Integer.toString(Server.DEFAULT_WORKERS));
        final String idleTimeout = setting(cmd, 't', properties, PROPERTY_IDLE_TIMEOUT,
                Long.toString(Server.DEFAULT_IDLE_TIMEOUT));

        try {
            final Datastore<?> datastore = withLogging(Datastores.create(location));
            return Server.builder(datastore).bind(HostAndPort.fromString(bind))
                    .workers(Integer.valueOf(workers.trim()))
                    .idleTimeout(Long.valueOf(idleTimeout.trim())).build();
        } catch (final IllegalArgumentException ex) {
            throw new ServiceConfigurationError("Configuration failed: " + ex.getMessage(), ex);
        }
    }

    private static <I> Datastore<I> withLogging(final Datastore<I> datastore) {
        return new LoggingDatastore<I>(datastore);
    }

    private static String setting(final CommandLine cmd, final char option,
            final Properties properties, final String property, final String defaultValue) {
        final String value = cmd.getOptionValue(option);
        if (value != null) {
            return value;
        }
        return properties.getProperty(property, defaultValue).trim();
    }

    private static void run(final Server server) throws Throwable {

        Preconditions.checkNotNull(server);

        configureLogging(DEFAULT_LOG_CONFIG);

        final String header = String.format("%s %s / java %s / %s", PROGRAM_EXECUTABLE,
                PROGRAM_VERSION, System.getProperty("java.version"),
                System.getProperty("os.name")).toLowerCase();
        final String line = Strings.repeat("-", header.length());
        LOGGER.info(line);
        LOGGER.info(header);
        LOGGER.info(line);
        LOGGER.info("Using: {}", server.getDatastore());
        LOGGER.info("Using: {} workers, {} ms idle timeout", server.getWorkers(),
                server.getIdleTimeout());

        final CountDownLatch shutdownCompleted = new CountDownLatch(1);
        final Thread mainThread = Thread.currentThread();
        final Thread shutdownHandler = new Thread("shutdown") {

            @Override
            public void run() {
                mainThread.interrupt(); // delegate processing to main thread
                try {
                    shutdownCompleted.await();
                } catch (final InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }

        };

        try {
            server.init();
            LOGGER.info("Service started, listening on {}", server.getAddress());
            java.lang.Runtime.getRuntime().addShutdownHook(shutdownHandler);
            LOGGER.info("Issue q\\n/SIGINT to end, i\\n to show info");

            // Enter loop where terminal input is checked and processed
            boolean running = true;
            while (running) {
                try {
                    while (System.in.available() > 0) {
                        final char ch = (char) System.in.read();
                        if (ch == 'q' || ch == 'Q') {
                            running = false;
                        } else if (ch == 'i' || ch == 'I') {
                            LOGGER.info(status());
                        }
                    }
                } catch (final IOException ex) {
                    LOGGER.debug("Console not available: {}", ex.getMessage());
                }
                try {
                    if (running) {
                        Thread.sleep(1000);
                    }
                } catch (final InterruptedException ex) {
                    running = false;
                }
            }

        } finally {
            try {
                LOGGER.info("Stopping service ...");
                server.close();
                LOGGER.info("Service stopped");
            } finally {
                try {
                    java.lang.Runtime.getRuntime().removeShutdownHook(shutdownHandler);
                } catch (final IllegalStateException ex) {
                    LOGGER.debug("Shutdown in progress");
                }
                shutdownCompleted.countDown();
                ((LoggerContext) LoggerFactory.getILoggerFactory()).stop();
            }
        }
    }

    private static void configureLogging(final String logConfig) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(retrieveURL(logConfig));
        } catch (final JoranException je) {
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        }
    }

    private static String status() {
        final long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        final MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        final long mb = 1024 * 1024;
        return String.format("running, %d s uptime; %d/%d MB heap used/committed; %d threads",
                uptime / 1000, heap.getUsed() / mb, heap.getCommitted() / mb, ManagementFactory
                        .getThreadMXBean().getThreadCount());
    }

    private static URL retrieveURL(final String name) {
        try {
            URL url = Launcher.class.getClassLoader().getResource(name);
            if (url == null) {
                final File file = new File(name);
                if (file.exists() && !file.isDirectory()) {
                    url = file.toURI().toURL();
                }
            }
            return Preconditions.checkNotNull(url);
        } catch (final Throwable ex) {
            throw new IllegalArgumentException("Invalid path: " + name, ex);
        }
    }

    private Launcher() {
    }

}
