package eu.fbk.graphstore.server;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import com.google.common.net.HostAndPort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.DatastoreException;
import eu.fbk.graphstore.internal.Protocol;
import eu.fbk.graphstore.internal.Util;
import eu.fbk.graphstore.runtime.Component;

/**
 * A TCP server exposing a {@code Datastore} to remote clients.
 * <p>
 * The server listens on a configurable address and serves each accepted connection using a
 * fixed pool of worker threads (named {@code worker-%02d}): the worker assigned to a connection
 * repeatedly reads a request, dispatches it to the datastore and writes back the response, until
 * the client closes the connection. Requests and responses follow {@link Protocol}. A malformed
 * request is answered with a {@code SERIALIZATION} error, after which the connection is closed;
 * other connections are not affected. A connection with an open transaction on which no request
 * arrives within the idle timeout is closed as well, so that an unresponsive client cannot hold
 * the locks of its transaction; idle connections with no transaction rely on TCP keep-alive. A transaction left open when its connection ends is rolled back. No
 * locking is added on top of the one performed by the datastore.
 * </p>
 * <p>
 * The server initializes the wrapped datastore in {@link #init()} and closes it in
 * {@link #close()}, unless some worker is still running after the stop timeout.
 * </p>
 */
public final class Server implements Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(Server.class);

    public static final String DEFAULT_HOST = "127.0.0.1";

    public static final int DEFAULT_PORT = 27615;

    public static final int DEFAULT_WORKERS = 8;

    public static final long DEFAULT_IDLE_TIMEOUT = 60000; // 1 minute

    private static final String WORKER_NAME = "worker-%02d";

    private static final long STOP_TIMEOUT = 1000; // wait 1 s before abandoning workers

    private final Datastore<?> datastore;

    private final HostAndPort bind;

    private final int workers;

    private final long idleTimeout;

    private final Set<Socket> connections;

    @Nullable
    private ServerSocket serverSocket;

    @Nullable
    private ExecutorService executor;

    @Nullable
    private Thread acceptor;

    private boolean initialized;

    private volatile boolean closed;

    private Server(final Builder builder) {
        this.datastore = Preconditions.checkNotNull(builder.datastore);
        this.bind = MoreObjects.firstNonNull(builder.bind, HostAndPort.fromParts(DEFAULT_HOST,
                DEFAULT_PORT));
        this.workers = MoreObjects.firstNonNull(builder.workers, DEFAULT_WORKERS);
        this.idleTimeout = MoreObjects.firstNonNull(builder.idleTimeout, DEFAULT_IDLE_TIMEOUT);
        Preconditions.checkArgument(this.bind.hasPort(), "No port in bind address %s",
                this.bind);
        Preconditions.checkArgument(this.workers > 0, "Invalid number of workers %s",
                this.workers);
        Preconditions.checkArgument(this.idleTimeout > 0
                && this.idleTimeout <= Integer.MAX_VALUE, "Invalid idle timeout %s",
                this.idleTimeout);
        this.connections = Sets.newConcurrentHashSet();
        LOGGER.debug("{} configured, bind={}, workers={}, idleTimeout={} ms", getClass()
                .getSimpleName(), this.bind, this.workers, this.idleTimeout);
    }

    public static Builder builder(final Datastore<?> datastore) {
        return new Builder(datastore);
    }

    public Datastore<?> getDatastore() {
        return this.datastore;
    }

    public int getWorkers() {
        return this.workers;
    }

    public long getIdleTimeout() {
        return this.idleTimeout;
    }

    /**
     * Returns the address the server has been configured to bind to.
     * 
     * @return the configured address, possibly with port 0
     */
    public HostAndPort getBindAddress() {
        return this.bind;
    }

    /**
     * Returns the address the server is listening on, which differs from the configured one if
     * port 0 was requested.
     * 
     * @return the actual address
     * @throws IllegalStateException
     *             if the server has not been initialized
     */
    public synchronized HostAndPort getAddress() throws IllegalStateException {
        Preconditions.checkState(this.serverSocket != null, "Server not initialized");
        return HostAndPort.fromParts(this.bind.getHost(), this.serverSocket.getLocalPort());
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.initialized = true;

        this.datastore.init();

        final ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(this.bind.getHost(), this.bind.getPort()));
        } catch (final IOException ex) {
            Util.closeQuietly(socket);
            throw ex;
        }
        this.serverSocket = socket;
        this.executor = Executors.newFixedThreadPool(this.workers,
                Util.newThreadFactory(WORKER_NAME, true));
        this.acceptor = Util.newThreadFactory("acceptor", true).newThread(new Runnable() {

            @Override
            public void run() {
                accept(socket);
            }

        });
        this.acceptor.start();

        LOGGER.info("{} listening on {}:{} with {} workers, serving {}", getClass()
                .getSimpleName(), this.bind.getHost(), socket.getLocalPort(), this.workers,
                this.datastore);
    }

    @Override
    public void close() {
        final ExecutorService executor;
        synchronized (this) {
            if (this.closed) {
                return;
            }
            this.closed = true;
            executor = this.executor;
            Util.closeQuietly(this.serverSocket);
        }
        for (final Socket connection : this.connections) {
            Util.closeQuietly(connection);
        }
        boolean terminated = true;
        if (executor != null) {
            executor.shutdownNow();
            try {
                terminated = executor.awaitTermination(STOP_TIMEOUT, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException ex) {
                terminated = false;
                Thread.currentThread().interrupt();
            }
        }
        if (terminated) {
            this.datastore.close();
            LOGGER.info("{} stopped", getClass().getSimpleName());
        } else {
            // workers may still be using transactions of the datastore
            LOGGER.warn("{} stopped, but some workers did not terminate in {} ms: {} left open",
                    getClass().getSimpleName(), STOP_TIMEOUT, this.datastore);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private void accept(final ServerSocket socket) {
        while (!this.closed) {
            final Socket connection;
            try {
                connection = socket.accept();
            } catch (final IOException ex) {
                if (!this.closed) {
                    LOGGER.error("Accept failed, no more connections will be served", ex);
                }
                return;
            }
            try {
                connection.setTcpNoDelay(true);
                connection.setKeepAlive(true);
                this.connections.add(connection);
                this.executor.execute(new Runnable() {

                    @Override
                    public void run() {
                        serve(connection);
                    }

                });
            } catch (final Throwable ex) {
                if (!this.closed || !(ex instanceof RejectedExecutionException)) {
                    LOGGER.warn("Could not serve connection from "
                            + connection.getRemoteSocketAddress(), ex);
                }
                this.connections.remove(connection);
                Util.closeQuietly(connection);
            }
        }
    }

    private void serve(final Socket connection) {
        final String peer = String.valueOf(connection.getRemoteSocketAddress());
        MDC.put(Util.MDC_CONTEXT, peer);
        final Connection<?> handler = newConnection(this.datastore);
        try {
            LOGGER.debug("Connection opened");
            final DataInputStream in = new DataInputStream(new BufferedInputStream(
                    connection.getInputStream()));
            final DataOutputStream out = new DataOutputStream(new BufferedOutputStream(
                    connection.getOutputStream()));
            while (true) {
                ObjectNode response;
                boolean fatal = false;
                try {
                    connection.setSoTimeout(handler.inTransaction() ? (int) this.idleTimeout : 0);
                    final ObjectNode request = Protocol.readFrame(in);
                    if (request == null) {
                        break;
                    }
                    response = handler.handle(request);
                } catch (final DatastoreException ex) {
                    // only framing, decoding and protocol state failures get here
                    LOGGER.warn("Malformed request, closing connection: {}", ex.getMessage());
                    fatal = true;
                    response = Protocol.newError(ex);
                }
                Protocol.writeFrame(out, response);
                if (fatal) {
                    break;
                }
            }
        } catch (final SocketTimeoutException ex) {
            LOGGER.info("No request received in {} ms within transaction, closing connection",
                    this.idleTimeout);
        } catch (final SocketException ex) {
            if (!this.closed) {
                LOGGER.debug("Connection reset: {}", ex.getMessage());
            }
        } catch (final Throwable ex) {
            if (!this.closed) {
                LOGGER.error("Connection failed", ex);
            }
        } finally {
            handler.close();
            this.connections.remove(connection);
            Util.closeQuietly(connection);
            LOGGER.debug("Connection closed");
            MDC.remove(Util.MDC_CONTEXT);
        }
    }

    private static <I> Connection<I> newConnection(final Datastore<I> datastore) {
        return new Connection<I>(datastore);
    }

    public static final class Builder {

        final Datastore<?> datastore;

        @Nullable
        HostAndPort bind;

        @Nullable
        Integer workers;

        @Nullable
        Long idleTimeout;

        Builder(final Datastore<?> datastore) {
            this.datastore = Preconditions.checkNotNull(datastore);
        }

        public Builder bind(@Nullable final HostAndPort bind) {
            this.bind = bind;
            return this;
        }

        public Builder workers(@Nullable final Integer workers) {
            this.workers = workers;
            return this;
        }

        /**
         * Sets the maximum time a connection with an open transaction may wait for the next
         * request, after which the connection is closed and the transaction rolled back.
         *
         * @param idleTimeout
         *            the timeout in milliseconds, null for the default of one minute
         * @return this builder
         */
        public Builder idleTimeout(@Nullable final Long idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Server build() {
            return new Server(this);
        }

    }

}
