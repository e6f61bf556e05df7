package io.stocktake.catalog;

import java.util.OptionalLong;

/** Source of recorded stock quantities, consulted once per item when a session starts. */
public interface ItemCatalog {
    ItemCatalog EMPTY = (branchId, itemId) -> OptionalLong.empty();

    OptionalLong baselineQuantity(String branchId, String itemId);
}
