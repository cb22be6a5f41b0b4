/**
 * Entity representations and collection statistics.
 * <p>
 * An entity is represented by three bags of terms ({@link eu.fbk.ebes.model.Field}) and by a set
 * of anonymized {@link eu.fbk.ebes.model.StructuralTriple}s, computed by
 * {@link eu.fbk.ebes.model.RepresentationBuilder} from the triples of a
 * {@link eu.fbk.ebes.graph.GraphAccess}. {@link eu.fbk.ebes.model.CollectionModel} aggregates term
 * statistics over a set of entities and acts as smoothing background for text-based scoring.
 * </p>
 * <p>
 * Note that keeping only URI far endpoints in structural triples (literal endpoints being
 * replaced by a wildcard) is a deliberate deviation from a plain set-of-triples representation:
 * it makes triples with literal objects comparable across entities.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.model;
