package eu.fbk.graphstore.datastore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import com.google.common.primitives.Bytes;

import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.OptimisticTransactionOptions;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;

/**
 * A persistent {@code Datastore} backed by a RocksDB {@code OptimisticTransactionDB}.
 * <p>
 * Each {@link Transaction} maps to a RocksDB optimistic transaction reading from the snapshot
 * taken when it began, plus its own writes. Writes are buffered until commit, which is a single
 * atomic write; vertices and edges read for update are validated at commit time, so that
 * conflicting concurrent transactions fail with a {@code STORAGE} error. The key layout is
 * described in {@link RocksKeys}.
 * </p>
 *
 * @param <I>
 *            the identifier type
 */
public class RocksDatastore<I> implements Datastore<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RocksDatastore.class);

    static final int MAX_GENERATE_ATTEMPTS = 16;

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;

    private final IdSpace<I> idSpace;

    private final RocksKeys<I> keys;

    private final Ordering<Edge<I>> edgeOrdering;

    private final Set<RocksTransaction> transactions;

    @Nullable
    private Options options;

    @Nullable
    private WriteOptions writeOptions;

    @Nullable
    private OptimisticTransactionDB db;

    private boolean initialized;

    private boolean closed;

    /**
     * Creates a new {@code RocksDatastore} storing data in the directory specified, which is
     * created on initialization if missing.
     *
     * @param path
     *            the database directory
     * @param idSpace
     *            the identifier space
     */
    public RocksDatastore(final Path path, final IdSpace<I> idSpace) {
        this.path = Preconditions.checkNotNull(path);
        this.idSpace = Preconditions.checkNotNull(idSpace);
        this.keys = new RocksKeys<I>(idSpace);
        this.edgeOrdering = Ordering.from(EdgeKey.comparator(idSpace)).onResultOf(
                new Function<Edge<I>, EdgeKey<I>>() {

                    @Override
                    public EdgeKey<I> apply(final Edge<I> edge) {
                        return edge.getKey();
                    }

                });
        this.transactions = Sets.newConcurrentHashSet();
        this.initialized = false;
        this.closed = false;
        LOGGER.info("{} configured, path {}, {} identifiers", getClass().getSimpleName(), path,
                idSpace.getName());
    }

    /**
     * Returns the directory holding the database files.
     *
     * @return the database directory
     */
    public Path getPath() {
        return this.path;
    }

    @Override
    public IdSpace<I> getIdSpace() {
        return this.idSpace;
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        Files.createDirectories(this.path);
        final Options options = new Options().setCreateIfMissing(true);
        try {
            this.db = OptimisticTransactionDB.open(options, this.path.toString());
        } catch (final RocksDBException ex) {
            options.close();
            throw DatastoreException.storage("Cannot open RocksDB database at " + this.path
                    + ": " + ex.getMessage(), ex);
        }
        this.options = options;
        this.writeOptions = new WriteOptions();
        this.initialized = true;
        LOGGER.info("{} initialized", getClass().getSimpleName());
    }

    @Override
    public Transaction<I> begin(final boolean readOnly) throws IllegalStateException {
        final RocksTransaction transaction;
        synchronized (this) {
            Preconditions.checkState(this.initialized && !this.closed,
                    "Datastore not initialized or closed");
            transaction = new RocksTransaction(readOnly, this.db, this.writeOptions);
            this.transactions.add(transaction);
        }
        return transaction;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (!this.initialized) {
            return;
        }
        for (final RocksTransaction transaction : ImmutableList.copyOf(this.transactions)) {
            LOGGER.warn("Rolling back {} still active on close", transaction);
            try {
                transaction.end(false);
            } catch (final DatastoreException ex) {
                LOGGER.error("Rollback of " + transaction + " failed", ex);
            }
        }
        this.db.close();
        this.writeOptions.close();
        this.options.close();
        LOGGER.info("{} closed", getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.path + ")";
    }

    private static DatastoreException storage(final String operation,
            final RocksDBException ex) {
        return DatastoreException.storage(operation + " failed: " + ex.getMessage(), ex);
    }

    private class RocksTransaction implements Transaction<I> {

        private final boolean readOnly;

        private final OptimisticTransactionOptions transactionOptions;

        private final org.rocksdb.Transaction transaction;

        private final Snapshot snapshot;

        private final ReadOptions readOptions;

        private volatile boolean ended;

        RocksTransaction(final boolean readOnly, final OptimisticTransactionDB db,
                final WriteOptions writeOptions) {
            this.readOnly = readOnly;
            this.transactionOptions = new OptimisticTransactionOptions().setSetSnapshot(true);
            this.transaction = db.beginTransaction(writeOptions, this.transactionOptions);
            this.snapshot = this.transaction.getSnapshot();
            this.readOptions = new ReadOptions().setSnapshot(this.snapshot);
            this.ended = false;
        }

        private void checkReadable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
        }

        private void checkWritable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            Preconditions.checkState(!this.readOnly, "Read-only transaction");
        }

        // primitive accesses

        @Nullable
        private byte[] get(final byte[] key) throws DatastoreException {
            try {
                return this.transaction.get(this.readOptions, key);
            } catch (final RocksDBException ex) {
                throw storage("Get", ex);
            }
        }

        @Nullable
        private byte[] getForUpdate(final byte[] key) throws DatastoreException {
            try {
                return this.transaction.getForUpdate(this.readOptions, key, true);
            } catch (final RocksDBException ex) {
                throw storage("Get for update", ex);
            }
        }

        private void put(final byte[] key, final byte[] value) throws DatastoreException {
            try {
                this.transaction.put(key, value);
            } catch (final RocksDBException ex) {
                throw storage("Put", ex);
            }
        }

        private void delete(final byte[] key) throws DatastoreException {
            try {
                this.transaction.delete(key);
            } catch (final RocksDBException ex) {
                throw storage("Delete", ex);
            }
        }

        private List<Map.Entry<byte[], byte[]>> scan(final byte[] from, final byte[] prefix,
                final int limit) throws DatastoreException {
            final List<Map.Entry<byte[], byte[]>> entries = Lists.newArrayList();
            try (RocksIterator iterator = this.transaction.getIterator(this.readOptions)) {
                for (iterator.seek(from); iterator.isValid() && entries.size() < limit; iterator
                        .next()) {
                    final byte[] key = iterator.key();
                    if (!RocksKeys.hasPrefix(key, prefix)) {
                        break;
                    }
                    entries.add(Maps.immutableEntry(key, iterator.value()));
                }
                iterator.status();
            } catch (final RocksDBException ex) {
                throw storage("Scan", ex);
            }
            return entries;
        }

        private List<Map.Entry<byte[], byte[]>> scan(final byte[] prefix)
                throws DatastoreException {
            return scan(prefix, prefix, Integer.MAX_VALUE);
        }

        private long count(final byte[] prefix) throws DatastoreException {
            long count = 0;
            try (RocksIterator iterator = this.transaction.getIterator(this.readOptions)) {
                for (iterator.seek(prefix); iterator.isValid(); iterator.next()) {
                    if (!RocksKeys.hasPrefix(iterator.key(), prefix)) {
                        break;
                    }
                    ++count;
                }
                iterator.status();
            } catch (final RocksDBException ex) {
                throw storage("Count", ex);
            }
            return count;
        }

        // vertex operations

        @Override
        public boolean createVertex(final Vertex<I> vertex) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final byte[] key = RocksDatastore.this.keys.vertex(vertex.getId());
            if (getForUpdate(key) != null) {
                throw DatastoreException.uuidTaken(vertex.getId());
            }
            putVertex(key, vertex.getId(), vertex.getType());
            return true;
        }

        @Override
        public I createVertexFromType(final Type type) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            I id = null;
            for (int i = 0; i < MAX_GENERATE_ATTEMPTS; ++i) {
                id = RocksDatastore.this.idSpace.generate();
                final byte[] key = RocksDatastore.this.keys.vertex(id);
                if (getForUpdate(key) == null) {
                    putVertex(key, id, type);
                    return id;
                }
            }
            throw DatastoreException.uuidTaken(id);
        }

        private void putVertex(final byte[] key, final I id, final Type type)
                throws DatastoreException {
            put(key, RocksDatastore.this.keys.encodeType(type));
            put(RocksDatastore.this.keys.vertexType(type, id), RocksKeys.NO_VALUE);
        }

        @Override
        public List<Vertex<I>> getVertices(final VertexQuery<I> query)
                throws DatastoreException, IllegalStateException {
            checkReadable();
            return ImmutableList.copyOf(select(query));
        }

        @Override
        public void deleteVertices(final VertexQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            for (final Vertex<I> vertex : select(query)) {
                final Set<EdgeKey<I>> edgeKeys = Sets.newLinkedHashSet();
                for (final Map.Entry<byte[], byte[]> entry : scan(keys.edgePrefix(vertex.getId(),
                        null))) {
                    edgeKeys.add(keys.edgeKey(entry.getKey()));
                }
                for (final Map.Entry<byte[], byte[]> entry : scan(keys.inboundPrefix(
                        vertex.getId(), null))) {
                    edgeKeys.add(keys.edgeKey(entry.getKey()));
                }
                for (final EdgeKey<I> edgeKey : edgeKeys) {
                    removeEdge(edgeKey);
                }
                delete(keys.vertex(vertex.getId()));
                delete(keys.vertexType(vertex.getType(), vertex.getId()));
            }
        }

        @Override
        public long getVertexCount() throws DatastoreException, IllegalStateException {
            checkReadable();
            return count(RocksDatastore.this.keys.vertex(null));
        }

        private List<Vertex<I>> select(final VertexQuery<I> query) throws DatastoreException {
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            final List<Vertex<I>> result = new ArrayList<Vertex<I>>();
            if (query.getKind() == VertexQuery.Kind.IDS) {
                final NavigableSet<I> ids = new TreeSet<I>(RocksDatastore.this.idSpace);
                ids.addAll(query.getIds());
                for (final I id : ids) {
                    final byte[] value = get(keys.vertex(id));
                    if (value != null) {
                        result.add(new Vertex<I>(id, keys.decodeType(value)));
                    }
                }
                return result;
            }
            final Type type = query.getType();
            final I after = query.getAfter();
            final byte[] prefix = type == null ? keys.vertex(null) : keys.vertexType(type, null);
            byte[] from = prefix;
            if (after != null) {
                // smallest key following the one of the 'after' vertex
                from = Bytes.concat(type == null ? keys.vertex(after) : keys.vertexType(type,
                        after), new byte[] { 0 });
            }
            for (final Map.Entry<byte[], byte[]> entry : scan(from, prefix, query.getLimit())) {
                if (type == null) {
                    result.add(new Vertex<I>(keys.vertexId(entry.getKey()), keys
                            .decodeType(entry.getValue())));
                } else {
                    result.add(new Vertex<I>(keys.vertexTypeId(entry.getKey()), type));
                }
            }
            return result;
        }

        // edge operations

        @Override
        public boolean createEdge(final Edge<I> edge) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            final byte[] outboundKey = keys.vertex(edge.getOutboundId());
            final byte[] inboundKey = keys.vertex(edge.getInboundId());
            final byte[] outboundType = getForUpdate(outboundKey);
            final byte[] inboundType = getForUpdate(inboundKey);
            if (outboundType == null || inboundType == null) {
                return false;
            }
            // rewrite the endpoints so that a concurrent deletion of either fails on commit
            put(outboundKey, outboundType);
            put(inboundKey, inboundType);
            final EdgeKey<I> key = edge.getKey();
            final byte[] edgeKey = keys.edge(key);
            final byte[] previousValue = getForUpdate(edgeKey);
            Edge<I> stored = edge;
            if (previousValue != null) {
                final Edge<I> previous = keys.decodeEdge(key, previousValue);
                if (previous.getUpdated().isAfter(edge.getUpdated())) {
                    stored = Edge.create(key, edge.getWeight(), previous.getUpdated());
                }
            }
            put(edgeKey, keys.encodeEdge(stored));
            if (previousValue == null) {
                put(keys.inbound(key), RocksKeys.NO_VALUE);
                put(keys.edgeType(key), RocksKeys.NO_VALUE);
            }
            return true;
        }

        private void removeEdge(final EdgeKey<I> key) throws DatastoreException {
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            delete(keys.edge(key));
            delete(keys.inbound(key));
            delete(keys.edgeType(key));
        }

        @Override
        public List<Edge<I>> getEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkReadable();
            return ImmutableList.copyOf(select(query));
        }

        @Override
        public void deleteEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            for (final Edge<I> edge : select(query)) {
                removeEdge(edge.getKey());
            }
        }

        @Override
        public long getEdgeCount(final I id, @Nullable final Type type,
                final Direction direction) throws DatastoreException, IllegalStateException {
            checkReadable();
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            return count(direction == Direction.OUTBOUND ? keys.edgePrefix(id, type) : keys
                    .inboundPrefix(id, type));
        }

        private List<Edge<I>> select(final EdgeQuery<I> query) throws DatastoreException {
            final RocksKeys<I> keys = RocksDatastore.this.keys;
            final List<Edge<I>> candidates = new ArrayList<Edge<I>>();
            if (query.getKind() == EdgeQuery.Kind.KEYS) {
                for (final EdgeKey<I> key : Sets.newLinkedHashSet(query.getKeys())) {
                    final byte[] value = get(keys.edge(key));
                    if (value != null) {
                        candidates.add(keys.decodeEdge(key, value));
                    }
                }
            } else if (query.getOutboundId() != null || query.getInboundId() == null
                    && query.getType() == null) {
                final byte[] prefix = query.getOutboundId() == null ? new byte[] {
                        RocksKeys.EDGE } : keys.edgePrefix(query.getOutboundId(), query.getType());
                for (final Map.Entry<byte[], byte[]> entry : scan(prefix)) {
                    candidates.add(keys.decodeEdge(keys.edgeKey(entry.getKey()),
                            entry.getValue()));
                }
            } else {
                final byte[] prefix = query.getInboundId() != null ? keys.inboundPrefix(
                        query.getInboundId(), query.getType()) : keys.edgeTypePrefix(query
                        .getType());
                for (final Map.Entry<byte[], byte[]> entry : scan(prefix)) {
                    final EdgeKey<I> key = keys.edgeKey(entry.getKey());
                    final byte[] value = get(keys.edge(key));
                    if (value == null) {
                        throw DatastoreException.storage("Index entry without edge for " + key,
                                null);
                    }
                    candidates.add(keys.decodeEdge(key, value));
                }
            }

            // composite keys with variable-length identifiers do not follow the edge order
            Collections.sort(candidates, RocksDatastore.this.edgeOrdering);
            final List<Edge<I>> result = new ArrayList<Edge<I>>();
            for (final Edge<I> edge : candidates) {
                if (result.size() >= query.getLimit()) {
                    break;
                }
                if (query.matches(edge)) {
                    result.add(edge);
                }
            }
            return result;
        }

        @Override
        public synchronized void end(final boolean commit) throws DatastoreException {
            if (this.ended) {
                return;
            }
            this.ended = true;
            RocksDatastore.this.transactions.remove(this);
            try {
                if (commit && !this.readOnly) {
                    this.transaction.commit();
                } else {
                    this.transaction.rollback();
                }
            } catch (final RocksDBException ex) {
                throw storage(commit ? "Commit" : "Rollback", ex);
            } finally {
                this.readOptions.close();
                this.snapshot.close();
                this.transaction.close();
                this.transactionOptions.close();
            }
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + Integer.toHexString(hashCode());
        }

    }

}
