package org.spatial.text;

/**
 * Two coordinates read from text, in input order.
 */
public record NumericPair(double x, double y) {
}
