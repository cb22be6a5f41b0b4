/**
 * Internal utilities shared by the modules of the project (logging, command line parsing,
 * resource handling). Not part of the public API.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.internal;
