package io.stocktake.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import io.stocktake.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Catalog backed by a {@code {branchId: {itemId: quantity}}} map, typically loaded from
 * {@code item-catalog.json} under the data root.
 */
public final class MapItemCatalog implements ItemCatalog {
    private static final TypeReference<Map<String, Map<String, Long>>> FILE_TYPE = new TypeReference<>() {
    };

    private final Map<String, Map<String, Long>> quantities;

    public MapItemCatalog(Map<String, Map<String, Long>> quantities) {
        Map<String, Map<String, Long>> copy = new HashMap<>();
        if (quantities != null) {
            quantities.forEach((branch, items) -> {
                Map<String, Long> known = new HashMap<>();
                if (items != null) {
                    items.forEach((item, qty) -> {
                        if (qty != null) {
                            known.put(item, qty);
                        }
                    });
                }
                copy.put(branch, Map.copyOf(known));
            });
        }
        this.quantities = Map.copyOf(copy);
    }

    /** A missing file yields an empty catalog. */
    public static MapItemCatalog load(Path file) {
        if (file == null || !Files.exists(file)) {
            return new MapItemCatalog(Map.of());
        }
        try {
            return new MapItemCatalog(Jsons.mapper().readValue(file.toFile(), FILE_TYPE));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load item catalog: " + file, e);
        }
    }

    @Override
    public OptionalLong baselineQuantity(String branchId, String itemId) {
        Map<String, Long> branch = quantities.get(branchId);
        if (branch == null) {
            return OptionalLong.empty();
        }
        Long qty = branch.get(itemId);
        return qty == null ? OptionalLong.empty() : OptionalLong.of(qty);
    }

    public int size() {
        return quantities.values().stream().mapToInt(Map::size).sum();
    }
}
