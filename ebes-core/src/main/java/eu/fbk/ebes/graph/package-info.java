/**
 * Graph access API ({@code ebes-core}).
 * <p>
 * This package defines how the ranking engine reads the knowledge graph: the
 * {@link eu.fbk.ebes.graph.GraphAccess} interface returning the statements of one entity, the
 * {@link eu.fbk.ebes.graph.GraphUnavailableException} signalling backend failures, and the
 * decorators {@link eu.fbk.ebes.graph.ForwardingGraphAccess} and
 * {@link eu.fbk.ebes.graph.LoggingGraphAccess}. Concrete backends built on Sesame repositories
 * are provided by module {@code ebes-graph}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.graph;
