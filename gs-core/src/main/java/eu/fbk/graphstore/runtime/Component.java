package eu.fbk.graphstore.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A GraphStore component.
 * <p>
 * This interface defines the basic API and lifecycle of a generic GraphStore component, and is
 * specialized for specific types of components (datastores, servers).
 * </p>
 * <p>
 * The <i>lifecycle</i> of a {@code Component} is the following:
 * <ul>
 * <li>The {@code Component} instance is created and configured, either via its constructor, a
 * builder or a factory (e.g., {@code Datastores}). In case the configuration is incorrect, an
 * exception is thrown; otherwise, the component is configured but still inactive, meaning that
 * no resource that needs to be later freed has been allocated.</li>
 * <li>Method {@link #init()} is called to make the component operational; differently from the
 * constructor, {@code init()} is allowed to open files, bind sockets, establish connections and
 * start threads.</li>
 * <li>The methods specific to the type of component are called by external code. Whether they
 * can be called concurrently depends on the type of component, as documented in its
 * Javadoc.</li>
 * <li>Method {@link #close()} is called to dispose the component, freeing allocated resources in
 * an orderly way. {@code close()} can be called at any time after instantiation, even before
 * initialization, and has no effect if called again.</li>
 * </ul>
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}, allocating the resources it needs to become
     * operational.
     * 
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component}, freeing allocated resources and aborting pending
     * operations. Closing a component has no impact on persisted data nor on remote services
     * the component relies on. Calling this method on a closed component has no effect.
     */
    @Override
    void close();

}
