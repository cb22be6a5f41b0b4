package eu.fbk.ebes.scoring;

/**
 * The background probability <tt>Pc</tt> used for Dirichlet smoothing.
 */
public enum Background {

    /**
     * Uniform background <tt>1 / ni</tt>, <tt>ni</tt> being the number of entities of the
     * collection, irrespective of the term.
     */
    UNIFORM,

    /**
     * Relative frequency of the term in the field over the whole collection, falling back to
     * {@link #UNIFORM} for terms never seen in that field.
     */
    COLLECTION

}
