package org.gridiron.lineup;

/**
 * One entry of a league's slot template as declared by the provider, e.g. {@code WR x 3}.
 */
public record RosterPosition(String position, int count) {}
