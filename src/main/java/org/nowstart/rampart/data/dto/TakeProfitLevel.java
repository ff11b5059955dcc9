package org.nowstart.rampart.data.dto;

/**
 * One partial-close target, expressed as a distance from entry in pips and the fraction of the
 * initial size closed when the level trades.
 */
public record TakeProfitLevel(
        double distancePips,
        double fraction
) {
}
