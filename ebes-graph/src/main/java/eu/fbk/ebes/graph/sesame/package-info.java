/**
 * {@link eu.fbk.ebes.graph.GraphAccess} backends built on Sesame repositories.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.graph.sesame;
