package eu.fbk.graphstore.data;

import java.util.Comparator;

/**
 * The capability an identifier type must provide to address vertices.
 * <p>
 * A datastore does not assume a specific identifier representation: numeric, textual and random
 * 128-bit identifiers are all valid choices, each with different collision and ordering
 * properties. An {@code IdSpace} captures what a datastore needs from the identifier type
 * {@code I}:
 * </p>
 * <ul>
 * <li>a total order, exposed via the {@code Comparator} interface, used to order query results;</li>
 * <li>a byte encoding ({@link #toBytes(Object)}, {@link #fromBytes(byte[])}) whose unsigned
 * lexicographical order matches the {@code Comparator} order, so that ordered key-value engines
 * can scan identifier ranges directly;</li>
 * <li>a lossless textual encoding ({@link #toText(Object)}, {@link #fromText(String)}) used on
 * the wire;</li>
 * <li>the derivation of successive identifiers ({@link #successor(Object)}) and the generation
 * of fresh ones ({@link #generate()}).</li>
 * </ul>
 * <p>
 * Implementations must be immutable and thread safe. Standard spaces are provided by
 * {@link IdSpaces}.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public interface IdSpace<I> extends Comparator<I> {

    /**
     * Returns the name of this space, used in configuration strings and to check that the two
     * ends of a connection agree on the identifier type.
     * 
     * @return the name
     */
    String getName();

    /**
     * Returns the Java class of the identifiers of this space.
     * 
     * @return the identifier class
     */
    Class<I> getIdClass();

    /**
     * Encodes an identifier into bytes, preserving the identifier order.
     * 
     * @param id
     *            the identifier
     * @return the encoded bytes, never shared with the caller
     * @throws IllegalArgumentException
     *             if the identifier is not valid in this space
     */
    byte[] toBytes(I id) throws IllegalArgumentException;

    /**
     * Decodes an identifier previously encoded with {@link #toBytes(Object)}.
     * 
     * @param bytes
     *            the encoded bytes
     * @return the decoded identifier
     * @throws IllegalArgumentException
     *             if the bytes are not a valid encoding
     */
    I fromBytes(byte[] bytes) throws IllegalArgumentException;

    /**
     * Encodes an identifier as text, without loss of information.
     * 
     * @param id
     *            the identifier
     * @return the textual form
     */
    String toText(I id);

    /**
     * Parses the textual form of an identifier.
     * 
     * @param text
     *            the textual form
     * @return the parsed identifier
     * @throws ValidationException
     *             with reason {@code INVALID_VALUE} if the text is not a valid identifier
     */
    I fromText(String text) throws ValidationException;

    /**
     * Returns the smallest identifier greater than the one specified.
     * 
     * @param id
     *            the identifier
     * @return the successor identifier
     * @throws ValidationException
     *             with reason {@code CANNOT_INCREMENT_UUID} if {@code id} is the greatest
     *             identifier of the space
     */
    I successor(I id) throws ValidationException;

    /**
     * Generates a fresh identifier. Generation is randomized: callers storing the identifier
     * must be prepared to retry on collision.
     * 
     * @return a new identifier
     */
    I generate();

}
