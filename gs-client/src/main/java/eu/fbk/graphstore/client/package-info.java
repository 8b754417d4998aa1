/**
 * Client side of the GraphStore protocol: a {@code Datastore} forwarding every operation to a
 * remote server.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.client;
