package io.stocktake.model;

public record ItemSeed(String itemId, Long baselineQuantity, String shelfLocation) {
}
