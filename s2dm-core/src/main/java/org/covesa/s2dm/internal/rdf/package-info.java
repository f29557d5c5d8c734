@javax.annotation.ParametersAreNonnullByDefault
package org.covesa.s2dm.internal.rdf;
