/**
 * GraphQL SDL loading ({@code s2dm-graphql}), based on graphql-java.
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.covesa.s2dm.graphql;
