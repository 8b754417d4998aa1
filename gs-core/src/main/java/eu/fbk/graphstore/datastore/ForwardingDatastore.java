package eu.fbk.graphstore.datastore;

import java.io.IOException;

import com.google.common.collect.ForwardingObject;

import eu.fbk.graphstore.data.IdSpace;

/**
 * A {@code Datastore} forwarding all its method calls to another {@code Datastore}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code Datastore} interface. Subclasses must implement method {@link #delegate()} and override
 * the methods of {@code Datastore} they want to decorate.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public abstract class ForwardingDatastore<I> extends ForwardingObject implements Datastore<I> {

    @Override
    protected abstract Datastore<I> delegate();

    @Override
    public IdSpace<I> getIdSpace() {
        return delegate().getIdSpace();
    }

    @Override
    public void init() throws IOException {
        delegate().init();
    }

    @Override
    public Transaction<I> begin(final boolean readOnly) throws DatastoreException,
            IllegalStateException {
        return delegate().begin(readOnly);
    }

    @Override
    public void close() {
        delegate().close();
    }

}
