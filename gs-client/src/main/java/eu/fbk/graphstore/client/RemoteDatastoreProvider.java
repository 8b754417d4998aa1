package eu.fbk.graphstore.client;

import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;

import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.DatastoreProvider;

/**
 * Provider of {@link RemoteDatastore}s for locations of the form {@code tcp://<host>:<port>}.
 */
public final class RemoteDatastoreProvider implements DatastoreProvider {

    @Override
    public String getScheme() {
        return "tcp";
    }

    @Override
    public <I> Datastore<I> create(final String location, final IdSpace<I> idSpace) {
        final HostAndPort address = HostAndPort.fromString(location);
        Preconditions.checkArgument(!address.getHost().isEmpty() && address.hasPort(),
                "Invalid server address '%s', expected host:port", location);
        return new RemoteDatastore<I>(address, idSpace);
    }

}
