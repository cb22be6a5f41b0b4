/**
 * Command line programs: {@link eu.fbk.ebes.tool.Ranker} (<tt>ebes-rank</tt>),
 * {@link eu.fbk.ebes.tool.Evaluator} (<tt>ebes-evaluate</tt>) and
 * {@link eu.fbk.ebes.tool.Dumper} (<tt>ebes-dump</tt>).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.tool;
