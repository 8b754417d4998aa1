/**
 * The datastore capability contract: {@link eu.fbk.graphstore.datastore.Datastore} and
 * {@link eu.fbk.graphstore.datastore.Transaction}, the error taxonomy, decorators, atomic
 * batches and backend selection.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.datastore;
