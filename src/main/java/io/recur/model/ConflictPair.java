package io.recur.model;

/**
 * Two directly overlapping occurrences.
 *
 * @param first the occurrence id that comes first in group order
 * @param second the other occurrence id
 * @param kind HARD if the spans are identical, SOFT otherwise
 */
public record ConflictPair(String first, String second, ConflictKind kind) {}
