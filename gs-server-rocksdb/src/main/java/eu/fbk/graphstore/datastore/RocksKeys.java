package eu.fbk.graphstore.datastore;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Arrays;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;

import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.ValidationException;
import eu.fbk.graphstore.data.Weight;

/**
 * Encoding of the keys and values stored by {@link RocksDatastore}.
 * <p>
 * Every key starts with a one-byte prefix identifying the kind of entry:
 * </p>
 * <ul>
 * <li>{@code V id} &rarr; type, for vertices;</li>
 * <li>{@code T type 0x00 id} &rarr; empty, indexing vertices by type;</li>
 * <li>{@code E len(out) out type 0x00 in} &rarr; weight and timestamp, for edges;</li>
 * <li>{@code I len(in) in type 0x00 out} &rarr; empty, indexing edges by inbound vertex;</li>
 * <li>{@code Y type 0x00 len(out) out type 0x00 in} &rarr; empty, indexing edges by type.</li>
 * </ul>
 * <p>
 * Identifiers trailing a key are stored as returned by {@link IdSpace#toBytes(Object)}, so that
 * the key order matches the identifier order; identifiers followed by other components carry a
 * four-byte length prefix. Types never contain the 0x00 terminator.
 * </p>
 *
 * @param <I>
 *            the identifier type
 */
final class RocksKeys<I> {

    static final byte VERTEX = 'V';

    static final byte VERTEX_TYPE = 'T';

    static final byte EDGE = 'E';

    static final byte INBOUND = 'I';

    static final byte EDGE_TYPE = 'Y';

    static final byte[] NO_VALUE = new byte[0];

    private static final byte TERMINATOR = 0x00;

    private static final int EDGE_VALUE_LENGTH = 4 + 8 + 4;

    private final IdSpace<I> idSpace;

    RocksKeys(final IdSpace<I> idSpace) {
        this.idSpace = Preconditions.checkNotNull(idSpace);
    }

    // vertices

    byte[] vertex(@Nullable final I id) {
        return id == null ? new byte[] { VERTEX } : Bytes.concat(new byte[] { VERTEX },
                this.idSpace.toBytes(id));
    }

    I vertexId(final byte[] key) throws DatastoreException {
        return decodeId(key, 1, key.length);
    }

    byte[] vertexType(final Type type, @Nullable final I id) {
        final byte[] prefix = Bytes.concat(new byte[] { VERTEX_TYPE }, encodeType(type),
                new byte[] { TERMINATOR });
        return id == null ? prefix : Bytes.concat(prefix, this.idSpace.toBytes(id));
    }

    I vertexTypeId(final byte[] key) throws DatastoreException {
        return decodeId(key, indexOfTerminator(key, 1) + 1, key.length);
    }

    // edges

    byte[] edge(final EdgeKey<I> key) {
        return composite(EDGE, key.getOutboundId(), key.getType(), key.getInboundId());
    }

    byte[] edgePrefix(final I outboundId, @Nullable final Type type) {
        return composite(EDGE, outboundId, type, null);
    }

    byte[] inbound(final EdgeKey<I> key) {
        return composite(INBOUND, key.getInboundId(), key.getType(), key.getOutboundId());
    }

    byte[] inboundPrefix(final I inboundId, @Nullable final Type type) {
        return composite(INBOUND, inboundId, type, null);
    }

    byte[] edgeType(final EdgeKey<I> key) {
        final byte[] edge = edge(key);
        return Bytes.concat(edgeTypePrefix(key.getType()), Arrays.copyOfRange(edge, 1,
                edge.length));
    }

    byte[] edgeTypePrefix(final Type type) {
        return Bytes.concat(new byte[] { EDGE_TYPE }, encodeType(type),
                new byte[] { TERMINATOR });
    }

    /**
     * Decodes the edge key embedded in an edge, inbound index or type index key.
     *
     * @param key
     *            the stored key
     * @return the decoded edge key
     * @throws DatastoreException
     *             with kind {@code SERIALIZATION}, if the key is malformed
     */
    EdgeKey<I> edgeKey(final byte[] key) throws DatastoreException {
        try {
            int offset = 1;
            if (key[0] == EDGE_TYPE) {
                offset = indexOfTerminator(key, 1) + 1;
            }
            final int length = Ints.fromBytes(key[offset], key[offset + 1], key[offset + 2],
                    key[offset + 3]);
            offset += 4;
            final I first = decodeId(key, offset, offset + length);
            offset += length;
            final int terminator = indexOfTerminator(key, offset);
            final Type type = decodeType(Arrays.copyOfRange(key, offset, terminator));
            final I second = decodeId(key, terminator + 1, key.length);
            return key[0] == INBOUND ? new EdgeKey<I>(second, type, first) : new EdgeKey<I>(
                    first, type, second);
        } catch (final IndexOutOfBoundsException ex) {
            throw DatastoreException.serialization("Malformed edge key " + Arrays.toString(key),
                    ex);
        }
    }

    // values

    byte[] encodeType(final Type type) {
        return type.getValue().getBytes(StandardCharsets.UTF_8);
    }

    Type decodeType(final byte[] bytes) throws DatastoreException {
        try {
            return Type.valueOf(new String(bytes, StandardCharsets.UTF_8));
        } catch (final ValidationException ex) {
            throw DatastoreException.serialization("Invalid stored type", ex);
        }
    }

    byte[] encodeEdge(final Edge<I> edge) {
        final Instant updated = edge.getUpdated();
        return ByteBuffer.allocate(EDGE_VALUE_LENGTH).putFloat(edge.getWeight().getValue())
                .putLong(updated.getEpochSecond()).putInt(updated.getNano()).array();
    }

    Edge<I> decodeEdge(final EdgeKey<I> key, final byte[] value) throws DatastoreException {
        if (value.length != EDGE_VALUE_LENGTH) {
            throw DatastoreException.serialization("Invalid stored edge length " + value.length
                    + " for " + key, null);
        }
        final ByteBuffer buffer = ByteBuffer.wrap(value);
        try {
            final Weight weight = Weight.valueOf(buffer.getFloat());
            final Instant updated = Instant.ofEpochSecond(buffer.getLong(), buffer.getInt());
            return Edge.create(key, weight, updated);
        } catch (final ValidationException ex) {
            throw DatastoreException.serialization("Invalid stored weight for " + key, ex);
        } catch (final DateTimeException ex) {
            throw DatastoreException.serialization("Invalid stored timestamp for " + key, ex);
        }
    }

    static boolean hasPrefix(final byte[] key, final byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; ++i) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private byte[] composite(final byte prefix, final I first, @Nullable final Type type,
            @Nullable final I second) {
        final byte[] firstBytes = this.idSpace.toBytes(first);
        final byte[] head = Bytes.concat(new byte[] { prefix },
                Ints.toByteArray(firstBytes.length), firstBytes);
        if (type == null) {
            return head;
        }
        final byte[] typed = Bytes.concat(head, encodeType(type), new byte[] { TERMINATOR });
        return second == null ? typed : Bytes.concat(typed, this.idSpace.toBytes(second));
    }

    private I decodeId(final byte[] key, final int from, final int to)
            throws DatastoreException {
        try {
            return this.idSpace.fromBytes(Arrays.copyOfRange(key, from, to));
        } catch (final IllegalArgumentException ex) {
            throw DatastoreException.serialization("Invalid stored identifier", ex);
        } catch (final IndexOutOfBoundsException ex) {
            throw DatastoreException.serialization("Invalid stored identifier", ex);
        }
    }

    private static int indexOfTerminator(final byte[] key, final int from)
            throws DatastoreException {
        for (int i = from; i < key.length; ++i) {
            if (key[i] == TERMINATOR) {
                return i;
            }
        }
        throw DatastoreException.serialization("Missing type terminator in stored key", null);
    }

}
