/**
 * TCP server exposing a datastore to remote clients.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.server;
