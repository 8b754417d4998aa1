package eu.fbk.graphstore.data;

/**
 * The direction of the edges attached to a vertex.
 */
public enum Direction {

    /** Edges leaving the vertex. */
    OUTBOUND,

    /** Edges pointing to the vertex. */
    INBOUND

}
