package eu.fbk.graphstore.client;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.UUID;

import com.google.common.net.HostAndPort;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import eu.fbk.graphstore.data.IdSpaces;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.datastore.AbstractDatastoreTest;
import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.DatastoreException;
import eu.fbk.graphstore.datastore.Datastores;
import eu.fbk.graphstore.datastore.MemoryDatastore;
import eu.fbk.graphstore.datastore.Transaction;
import eu.fbk.graphstore.server.Server;

public class RemoteDatastoreTest extends AbstractDatastoreTest<UUID> {

    private Server server;

    @Override
    protected Datastore<UUID> createDatastore() throws IOException {
        this.server = Server.builder(new MemoryDatastore<UUID>(IdSpaces.UUID))
                .bind(HostAndPort.fromParts("127.0.0.1", 0)).workers(2).build();
        this.server.init();
        return new RemoteDatastore<UUID>(this.server.getAddress(), IdSpaces.UUID);
    }

    @After
    public void tearDownServer() {
        this.server.close();
    }

    @Test
    public void testIdSpaceMismatch() throws IOException {
        final RemoteDatastore<Long> datastore = new RemoteDatastore<Long>(
                this.server.getAddress(), IdSpaces.LONG);
        datastore.init();
        try {
            for (int i = 0; i < 2; ++i) {
                try {
                    datastore.begin(true);
                    Assert.fail();
                } catch (final DatastoreException ex) {
                    // the second attempt goes through a new connection
                    Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
                }
            }
        } finally {
            datastore.close();
        }
    }

    @Test
    public void testSingleTransaction() throws IOException {
        final Transaction<UUID> tx = getDatastore().begin(true);
        try {
            getDatastore().begin(true);
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        } finally {
            tx.end(true);
        }
        getDatastore().begin(false).end(false);
    }

    @Test
    public void testConnectionLost() throws IOException {
        final Transaction<UUID> tx = getDatastore().begin(false);
        tx.createVertex(new Vertex<UUID>(id(1), this.person));
        this.server.close();
        try {
            tx.getVertexCount();
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.STORAGE, ex.getKind());
        }
        try {
            tx.end(true);
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.STORAGE, ex.getKind());
        }
        tx.end(false); // no effect
    }

    @Test
    public void testServerUnavailable() throws IOException {
        final int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        final RemoteDatastore<UUID> datastore = new RemoteDatastore<UUID>(
                HostAndPort.fromParts("127.0.0.1", port), IdSpaces.UUID);
        try {
            datastore.init();
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.STORAGE, ex.getKind());
        } finally {
            datastore.close();
        }
    }

    @Test
    public void testProvider() {
        final Datastore<?> datastore = Datastores.create("tcp://localhost:27615?ids=long");
        Assert.assertTrue(datastore instanceof RemoteDatastore);
        Assert.assertSame(IdSpaces.LONG, datastore.getIdSpace());
        Assert.assertEquals(HostAndPort.fromParts("localhost", 27615),
                ((RemoteDatastore<?>) datastore).getAddress());
        for (final String location : new String[] { "tcp://", "tcp://localhost",
                "tcp://:27615" }) {
            try {
                Datastores.create(location);
                Assert.fail("Accepted '" + location + "'");
            } catch (final IllegalArgumentException ex) {
                // ok
            }
        }
    }

}
