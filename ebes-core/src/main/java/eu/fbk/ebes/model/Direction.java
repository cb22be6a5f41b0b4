package eu.fbk.ebes.model;

/**
 * Direction of a statement with respect to the entity it was collected for.
 */
public enum Direction {

    /** The entity is the object of the statement. */
    IN,

    /** The entity is the subject of the statement. */
    OUT

}
