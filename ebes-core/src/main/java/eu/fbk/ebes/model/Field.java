package eu.fbk.ebes.model;

/**
 * The textual surrogates an entity is represented with.
 */
public enum Field {

    /** Terms from literal objects of outgoing statements. */
    ATTRIBUTES("attributes"),

    /** Terms from the local names of the types (and subjects) of the entity. */
    TYPES("types"),

    /** Terms from the local names of the entities linked to or from the entity. */
    LINKS("links");

    private final String name;

    private Field(final String name) {
        this.name = name;
    }

    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return this.name;
    }

}
