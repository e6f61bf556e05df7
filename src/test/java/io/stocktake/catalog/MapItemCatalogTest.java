package io.stocktake.catalog;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

final class MapItemCatalogTest {

    @Test
    void lookupIsScopedByBranch() {
        Map<String, Long> north = new HashMap<>();
        north.put("sku-1", 12L);
        north.put("sku-2", null);
        MapItemCatalog catalog = new MapItemCatalog(Map.of("north", north, "south", Map.of("sku-1", 3L)));

        Assertions.assertEquals(OptionalLong.of(12L), catalog.baselineQuantity("north", "sku-1"));
        Assertions.assertEquals(OptionalLong.of(3L), catalog.baselineQuantity("south", "sku-1"));
        Assertions.assertTrue(catalog.baselineQuantity("north", "sku-2").isEmpty());
        Assertions.assertTrue(catalog.baselineQuantity("east", "sku-1").isEmpty());
        Assertions.assertEquals(2, catalog.size());
        Assertions.assertTrue(ItemCatalog.EMPTY.baselineQuantity("north", "sku-1").isEmpty());
    }

    @Test
    void loadsFromJsonFile() throws Exception {
        Path file = Files.createTempFile("item-catalog-", ".json");
        try {
            Files.writeString(file, "{\"north\": {\"sku-1\": 4, \"sku-9\": 0}}", StandardCharsets.UTF_8);
            MapItemCatalog catalog = MapItemCatalog.load(file);
            Assertions.assertEquals(OptionalLong.of(4L), catalog.baselineQuantity("north", "sku-1"));
            Assertions.assertEquals(OptionalLong.of(0L), catalog.baselineQuantity("north", "sku-9"));
        } finally {
            Files.deleteIfExists(file);
        }
        Assertions.assertEquals(0, MapItemCatalog.load(file).size());
    }
}
