package eu.fbk.graphstore.datastore;

import java.util.Map;
import java.util.ServiceLoader;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.IdSpaces;

/**
 * Creation of {@code Datastore}s from location strings.
 * <p>
 * A location string has the form {@code scheme://location[?ids=uuid|long|string]}, where the
 * scheme selects a {@link DatastoreProvider} among the ones available on the classpath (e.g.,
 * {@code memory://}, {@code rocksdb:///var/lib/graphstore}, {@code tcp://localhost:27615}) and
 * the optional {@code ids} parameter selects the identifier space ({@code uuid} by default).
 * </p>
 */
public final class Datastores {

    private static final Logger LOGGER = LoggerFactory.getLogger(Datastores.class);

    private static final String SEPARATOR = "://";

    private static final String IDS_PARAM = "ids";

    private Datastores() {
    }

    /**
     * Creates a new, uninitialized {@code Datastore} for the location string specified.
     * 
     * @param uri
     *            the location string
     * @return the created datastore
     * @throws IllegalArgumentException
     *             if the location string is malformed, names an unknown scheme or identifier
     *             space, or is rejected by the selected provider
     */
    public static Datastore<?> create(final String uri) throws IllegalArgumentException {

        final int index = uri.indexOf(SEPARATOR);
        if (index <= 0) {
            throw new IllegalArgumentException("Invalid datastore location '" + uri
                    + "': missing scheme");
        }
        final String scheme = uri.substring(0, index).toLowerCase();
        final String rest = uri.substring(index + SEPARATOR.length());
        final int queryIndex = rest.indexOf('?');
        final String location = queryIndex < 0 ? rest : rest.substring(0, queryIndex);
        final Map<String, String> params = queryIndex < 0 ? ImmutableMap.<String, String>of()
                : parseParams(uri, rest.substring(queryIndex + 1));

        IdSpace<?> idSpace = IdSpaces.UUID;
        for (final Map.Entry<String, String> entry : params.entrySet()) {
            if (IDS_PARAM.equals(entry.getKey())) {
                idSpace = IdSpaces.forName(entry.getValue());
            } else {
                throw new IllegalArgumentException("Unknown parameter '" + entry.getKey()
                        + "' in datastore location '" + uri + "'");
            }
        }

        final DatastoreProvider provider = getProvider(scheme);
        final Datastore<?> datastore = provider.create(location, idSpace);
        LOGGER.debug("Created {} for '{}' ({} identifiers)", datastore.getClass()
                .getSimpleName(), uri, idSpace.getName());
        return datastore;
    }

    /**
     * Returns the {@code DatastoreProvider} registered for the scheme specified.
     * 
     * @param scheme
     *            the scheme, e.g. {@code memory}
     * @return the provider
     * @throws IllegalArgumentException
     *             if no provider handles the scheme
     */
    public static DatastoreProvider getProvider(final String scheme)
            throws IllegalArgumentException {
        for (final DatastoreProvider provider : ServiceLoader.load(DatastoreProvider.class)) {
            if (provider.getScheme().equalsIgnoreCase(scheme)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unsupported datastore scheme '" + scheme + "'");
    }

    private static Map<String, String> parseParams(final String uri, final String query) {
        try {
            return Splitter.on('&').omitEmptyStrings().withKeyValueSeparator('=').split(query);
        } catch (final IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid query string in datastore location '"
                    + uri + "'", ex);
        }
    }

}
