/**
 * Graph data model: vertices, edges, their types and weights, identifier spaces and queries.
 * <p>
 * All the classes of this package are immutable value objects, validated at construction time:
 * {@link eu.fbk.graphstore.data.Type} and {@link eu.fbk.graphstore.data.Weight} factories throw a
 * {@link eu.fbk.graphstore.data.ValidationException} for unacceptable input. Identifiers are
 * generic: their representation is abstracted by {@link eu.fbk.graphstore.data.IdSpace}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.data;
