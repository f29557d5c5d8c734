/**
 * Command line front end ({@code s2dm-tool}).
 * <p>
 * Entry point is {@link org.covesa.s2dm.tool.Materialize}; run it without arguments or with
 * {@code -h} for the list of options.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.covesa.s2dm.tool;
