/**
 * Read-only schema model consumed by the materializer, and field type classification.
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.covesa.s2dm.schema;
