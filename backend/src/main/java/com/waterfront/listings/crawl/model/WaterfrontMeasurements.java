package com.waterfront.listings.crawl.model;

/**
 * Measurements read from listing free text. Lengths and depths are in feet.
 */
public record WaterfrontMeasurements(
    Integer waterfrontLinearFt,
    Integer dockLinearFt,
    Integer slipCount,
    Integer depthAtMlwFt,
    Integer bridgeClearanceFt,
    Integer canalWidthFt,
    boolean noFixedBridges
) {
    public static WaterfrontMeasurements none() {
        return new WaterfrontMeasurements(null, null, null, null, null, null, false);
    }

    public boolean isEmpty() {
        return waterfrontLinearFt == null
            && dockLinearFt == null
            && slipCount == null
            && depthAtMlwFt == null
            && bridgeClearanceFt == null
            && canalWidthFt == null
            && !noFixedBridges;
    }
}
