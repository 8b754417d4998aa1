package eu.fbk.graphstore.datastore;

import com.google.common.base.Preconditions;

import eu.fbk.graphstore.data.IdSpace;

/**
 * Provider of {@link MemoryDatastore}s for locations of the form {@code memory://}.
 */
public final class MemoryDatastoreProvider implements DatastoreProvider {

    @Override
    public String getScheme() {
        return "memory";
    }

    @Override
    public <I> Datastore<I> create(final String location, final IdSpace<I> idSpace) {
        Preconditions.checkArgument(location.isEmpty(),
                "No location expected for in-memory datastore, got '%s'", location);
        return new MemoryDatastore<I>(idSpace);
    }

}
