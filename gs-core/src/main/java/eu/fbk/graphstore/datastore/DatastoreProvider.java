package eu.fbk.graphstore.datastore;

import eu.fbk.graphstore.data.IdSpace;

/**
 * A factory of {@code Datastore}s for a given location scheme, looked up via
 * {@link java.util.ServiceLoader}.
 * <p>
 * Implementations are registered in {@code META-INF/services} under the name of this interface
 * and are selected by {@link Datastores#create(String)} based on the scheme of the location
 * string.
 * </p>
 */
public interface DatastoreProvider {

    /**
     * Returns the location scheme handled by this provider, e.g. {@code memory}.
     * 
     * @return the scheme, lowercase and without the {@code ://} separator
     */
    String getScheme();

    /**
     * Creates a new, uninitialized {@code Datastore}.
     * 
     * @param location
     *            the part of the location string between {@code ://} and the query string,
     *            possibly empty
     * @param idSpace
     *            the identifier space of the datastore
     * @param <I>
     *            the identifier type
     * @return the created datastore
     * @throws IllegalArgumentException
     *             if the location is not valid for this provider
     */
    <I> Datastore<I> create(String location, IdSpace<I> idSpace) throws IllegalArgumentException;

}
