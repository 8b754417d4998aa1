@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.graphstore.internal;
