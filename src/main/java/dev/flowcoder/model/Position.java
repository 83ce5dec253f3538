package dev.flowcoder.model;

/**
 * Canvas position of a block. Display-only; carried through serialization.
 */
public record Position(double x, double y) {}
