package eu.fbk.graphstore.datastore;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

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
 * A {@code Datastore} implementation that keeps all data in memory, with no persistence.
 * <p>
 * Vertices are kept in a map sorted according to the {@code IdSpace} of the datastore, with an
 * additional index from types to vertex identifiers; edges are kept in a map sorted by
 * {@link EdgeKey}, indexed by outbound and inbound vertex. Concurrency control relies on a
 * read/write lock: read-only transactions hold the read lock and read-write transactions hold
 * the write lock for their whole duration, so that transactions are serializable (read-write
 * transactions are executed one at a time). Each read-write transaction records an undo journal
 * that is replayed in reverse order on rollback.
 * </p>
 * <p>
 * As locks are owned by threads, a transaction must be ended by the same thread that began it,
 * and a thread must not begin a read-write transaction while holding a read-only one.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public class MemoryDatastore<I> implements Datastore<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryDatastore.class);

    static final int MAX_GENERATE_ATTEMPTS = 16;

    private final IdSpace<I> idSpace;

    private final ReentrantReadWriteLock lock;

    private final NavigableMap<I, Type> vertices;

    private final Map<Type, NavigableSet<I>> vertexTypes;

    private final NavigableMap<EdgeKey<I>, Edge<I>> edges;

    private final Map<I, NavigableSet<EdgeKey<I>>> outboundEdges;

    private final Map<I, NavigableSet<EdgeKey<I>>> inboundEdges;

    private boolean initialized;

    private boolean closed;

    /**
     * Creates a new {@code MemoryDatastore} for the identifier space specified.
     * 
     * @param idSpace
     *            the identifier space
     */
    public MemoryDatastore(final IdSpace<I> idSpace) {
        this.idSpace = Preconditions.checkNotNull(idSpace);
        this.lock = new ReentrantReadWriteLock(true);
        this.vertices = new TreeMap<I, Type>(idSpace);
        this.vertexTypes = new HashMap<Type, NavigableSet<I>>();
        this.edges = new TreeMap<EdgeKey<I>, Edge<I>>(EdgeKey.comparator(idSpace));
        this.outboundEdges = new HashMap<I, NavigableSet<EdgeKey<I>>>();
        this.inboundEdges = new HashMap<I, NavigableSet<EdgeKey<I>>>();
        this.initialized = false;
        this.closed = false;
        LOGGER.info("{} configured, {} identifiers", getClass().getSimpleName(),
                idSpace.getName());
    }

    @Override
    public IdSpace<I> getIdSpace() {
        return this.idSpace;
    }

    @Override
    public synchronized void init() throws IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.initialized = true;
        LOGGER.info("{} initialized", getClass().getSimpleName());
    }

    @Override
    public Transaction<I> begin(final boolean readOnly) throws IllegalStateException {
        synchronized (this) {
            Preconditions.checkState(this.initialized && !this.closed,
                    "Datastore not initialized or closed");
        }
        final Lock transactionLock = readOnly ? this.lock.readLock() : this.lock.writeLock();
        transactionLock.lock();
        return new MemoryTransaction(readOnly, transactionLock);
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        LOGGER.info("{} closed", getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private static <K, V> NavigableSet<V> indexGet(final Map<K, NavigableSet<V>> index,
            final K key) {
        final NavigableSet<V> values = index.get(key);
        return values != null ? values : Collections.<V>emptyNavigableSet();
    }

    private static <K, V> void indexAdd(final Map<K, NavigableSet<V>> index, final K key,
            final V value, final Comparator<? super V> comparator) {
        NavigableSet<V> values = index.get(key);
        if (values == null) {
            values = new TreeSet<V>(comparator);
            index.put(key, values);
        }
        values.add(value);
    }

    private static <K, V> void indexRemove(final Map<K, NavigableSet<V>> index, final K key,
            final V value) {
        final NavigableSet<V> values = index.get(key);
        if (values != null) {
            values.remove(value);
            if (values.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private class MemoryTransaction implements Transaction<I> {

        private final boolean readOnly;

        private final Lock transactionLock;

        private final Deque<Runnable> journal;

        private boolean ended;

        MemoryTransaction(final boolean readOnly, final Lock transactionLock) {
            this.readOnly = readOnly;
            this.transactionLock = transactionLock;
            this.journal = new ArrayDeque<Runnable>();
            this.ended = false;
        }

        private void checkReadable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
        }

        private void checkWritable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            Preconditions.checkState(!this.readOnly, "Read-only transaction");
        }

        // primitive modifications, each one recording its inverse in the journal

        private void putVertex(final I id, final Type type) {
            MemoryDatastore.this.vertices.put(id, type);
            indexAdd(MemoryDatastore.this.vertexTypes, type, id, MemoryDatastore.this.idSpace);
            this.journal.push(new Runnable() {

                @Override
                public void run() {
                    MemoryDatastore.this.vertices.remove(id);
                    indexRemove(MemoryDatastore.this.vertexTypes, type, id);
                }

            });
        }

        private void removeVertex(final I id) {
            final Type type = MemoryDatastore.this.vertices.remove(id);
            if (type == null) {
                return;
            }
            indexRemove(MemoryDatastore.this.vertexTypes, type, id);
            this.journal.push(new Runnable() {

                @Override
                public void run() {
                    MemoryDatastore.this.vertices.put(id, type);
                    indexAdd(MemoryDatastore.this.vertexTypes, type, id,
                            MemoryDatastore.this.idSpace);
                }

            });
        }

        private void putEdge(final Edge<I> edge) {
            final EdgeKey<I> key = edge.getKey();
            final Edge<I> previous = MemoryDatastore.this.edges.put(key, edge);
            if (previous == null) {
                addToIndexes(key);
            }
            this.journal.push(new Runnable() {

                @Override
                public void run() {
                    if (previous == null) {
                        MemoryDatastore.this.edges.remove(key);
                        removeFromIndexes(key);
                    } else {
                        MemoryDatastore.this.edges.put(key, previous);
                    }
                }

            });
        }

        private void removeEdge(final EdgeKey<I> key) {
            final Edge<I> previous = MemoryDatastore.this.edges.remove(key);
            if (previous == null) {
                return;
            }
            removeFromIndexes(key);
            this.journal.push(new Runnable() {

                @Override
                public void run() {
                    MemoryDatastore.this.edges.put(key, previous);
                    addToIndexes(key);
                }

            });
        }

        private void addToIndexes(final EdgeKey<I> key) {
            final Comparator<? super EdgeKey<I>> comparator = MemoryDatastore.this.edges
                    .comparator();
            indexAdd(MemoryDatastore.this.outboundEdges, key.getOutboundId(), key, comparator);
            indexAdd(MemoryDatastore.this.inboundEdges, key.getInboundId(), key, comparator);
        }

        private void removeFromIndexes(final EdgeKey<I> key) {
            indexRemove(MemoryDatastore.this.outboundEdges, key.getOutboundId(), key);
            indexRemove(MemoryDatastore.this.inboundEdges, key.getInboundId(), key);
        }

        // vertex operations

        @Override
        public boolean createVertex(final Vertex<I> vertex) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            if (MemoryDatastore.this.vertices.containsKey(vertex.getId())) {
                throw DatastoreException.uuidTaken(vertex.getId());
            }
            putVertex(vertex.getId(), vertex.getType());
            return true;
        }

        @Override
        public I createVertexFromType(final Type type) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            I id = null;
            for (int i = 0; i < MAX_GENERATE_ATTEMPTS; ++i) {
                id = MemoryDatastore.this.idSpace.generate();
                if (!MemoryDatastore.this.vertices.containsKey(id)) {
                    putVertex(id, type);
                    return id;
                }
            }
            throw DatastoreException.uuidTaken(id);
        }

        @Override
        public List<Vertex<I>> getVertices(final VertexQuery<I> query)
                throws IllegalStateException {
            checkReadable();
            final ImmutableList.Builder<Vertex<I>> builder = ImmutableList.builder();
            for (final I id : select(query)) {
                builder.add(new Vertex<I>(id, MemoryDatastore.this.vertices.get(id)));
            }
            return builder.build();
        }

        @Override
        public void deleteVertices(final VertexQuery<I> query) throws IllegalStateException {
            checkWritable();
            for (final I id : select(query)) {
                final List<EdgeKey<I>> keys = new ArrayList<EdgeKey<I>>();
                keys.addAll(indexGet(MemoryDatastore.this.outboundEdges, id));
                keys.addAll(indexGet(MemoryDatastore.this.inboundEdges, id));
                for (final EdgeKey<I> key : keys) {
                    removeEdge(key);
                }
                removeVertex(id);
            }
        }

        @Override
        public long getVertexCount() throws IllegalStateException {
            checkReadable();
            return MemoryDatastore.this.vertices.size();
        }

        private List<I> select(final VertexQuery<I> query) {
            final List<I> result = new ArrayList<I>();
            if (query.getKind() == VertexQuery.Kind.IDS) {
                final NavigableSet<I> ids = new TreeSet<I>(MemoryDatastore.this.idSpace);
                ids.addAll(query.getIds());
                for (final I id : ids) {
                    if (MemoryDatastore.this.vertices.containsKey(id)) {
                        result.add(id);
                    }
                }
                return result;
            }
            NavigableSet<I> ids = query.getType() == null ? MemoryDatastore.this.vertices
                    .navigableKeySet() : indexGet(MemoryDatastore.this.vertexTypes,
                    query.getType());
            if (query.getAfter() != null) {
                ids = ids.tailSet(query.getAfter(), false);
            }
            for (final I id : ids) {
                if (result.size() >= query.getLimit()) {
                    break;
                }
                result.add(id);
            }
            return result;
        }

        // edge operations

        @Override
        public boolean createEdge(final Edge<I> edge) throws IllegalStateException {
            checkWritable();
            if (!MemoryDatastore.this.vertices.containsKey(edge.getOutboundId())
                    || !MemoryDatastore.this.vertices.containsKey(edge.getInboundId())) {
                return false;
            }
            final Edge<I> previous = MemoryDatastore.this.edges.get(edge.getKey());
            if (previous != null && previous.getUpdated().isAfter(edge.getUpdated())) {
                putEdge(Edge.create(edge.getKey(), edge.getWeight(), previous.getUpdated()));
            } else {
                putEdge(edge);
            }
            return true;
        }

        @Override
        public List<Edge<I>> getEdges(final EdgeQuery<I> query) throws IllegalStateException {
            checkReadable();
            return ImmutableList.copyOf(select(query));
        }

        @Override
        public void deleteEdges(final EdgeQuery<I> query) throws IllegalStateException {
            checkWritable();
            for (final Edge<I> edge : select(query)) {
                removeEdge(edge.getKey());
            }
        }

        @Override
        public long getEdgeCount(final I id, @Nullable final Type type,
                final Direction direction) throws IllegalStateException {
            checkReadable();
            final Set<EdgeKey<I>> keys = indexGet(
                    direction == Direction.OUTBOUND ? MemoryDatastore.this.outboundEdges
                            : MemoryDatastore.this.inboundEdges, id);
            if (type == null) {
                return keys.size();
            }
            long count = 0;
            for (final EdgeKey<I> key : keys) {
                if (key.getType().equals(type)) {
                    ++count;
                }
            }
            return count;
        }

        private List<Edge<I>> select(final EdgeQuery<I> query) {
            final Collection<EdgeKey<I>> candidates;
            if (query.getKind() == EdgeQuery.Kind.KEYS) {
                candidates = new TreeSet<EdgeKey<I>>(MemoryDatastore.this.edges.comparator());
                candidates.addAll(query.getKeys());
            } else if (query.getOutboundId() != null) {
                candidates = indexGet(MemoryDatastore.this.outboundEdges, query.getOutboundId());
            } else if (query.getInboundId() != null) {
                candidates = indexGet(MemoryDatastore.this.inboundEdges, query.getInboundId());
            } else {
                candidates = MemoryDatastore.this.edges.navigableKeySet();
            }
            final List<Edge<I>> result = new ArrayList<Edge<I>>();
            for (final EdgeKey<I> key : candidates) {
                if (result.size() >= query.getLimit()) {
                    break;
                }
                final Edge<I> edge = MemoryDatastore.this.edges.get(key);
                if (edge != null && query.matches(edge)) {
                    result.add(edge);
                }
            }
            return result;
        }

        @Override
        public void end(final boolean commit) {
            if (this.ended) {
                return;
            }
            this.ended = true;
            try {
                if (!commit) {
                    while (!this.journal.isEmpty()) {
                        this.journal.pop().run();
                    }
                }
                this.journal.clear();
            } finally {
                this.transactionLock.unlock();
            }
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + Integer.toHexString(hashCode());
        }

    }

}
