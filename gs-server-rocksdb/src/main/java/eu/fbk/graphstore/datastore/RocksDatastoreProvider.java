package eu.fbk.graphstore.datastore;

import java.nio.file.Paths;

import com.google.common.base.Preconditions;

import eu.fbk.graphstore.data.IdSpace;

/**
 * Provider of {@link RocksDatastore}s for locations of the form {@code rocksdb://<directory>}.
 */
public final class RocksDatastoreProvider implements DatastoreProvider {

    @Override
    public String getScheme() {
        return "rocksdb";
    }

    @Override
    public <I> Datastore<I> create(final String location, final IdSpace<I> idSpace) {
        Preconditions.checkArgument(!location.isEmpty(), "No RocksDB directory specified");
        return new RocksDatastore<I>(Paths.get(location), idSpace);
    }

}
