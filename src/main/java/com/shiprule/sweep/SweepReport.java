package com.shiprule.sweep;

/**
 * Counts of one sweep pass.
 *
 * @param examined   Orders found without a stored calculation
 * @param calculated Orders calculated and stored
 * @param failed     Orders whose calculation failed
 */
public record SweepReport(int examined, int calculated, int failed) {

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0);
    }

    public boolean isEmpty() {
        return examined == 0;
    }
}
