/**
 * Runtime support: the {@link eu.fbk.graphstore.runtime.Component} lifecycle shared by
 * datastores and servers.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.runtime;
