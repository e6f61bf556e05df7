package io.stocktake.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.ItemSeed;
import io.stocktake.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class StockTakeCommandTest {

    @Test
    void parseItemAcceptsOptionalBaselineAndShelf() {
        Assertions.assertEquals(new ItemSeed("sku-1", null, null), StockTakeCommand.CreateSessionCommand.parseItem("sku-1"));
        Assertions.assertEquals(new ItemSeed("sku-1", 12L, null), StockTakeCommand.CreateSessionCommand.parseItem("sku-1:12"));
        Assertions.assertEquals(new ItemSeed("sku-1", null, "B4"), StockTakeCommand.CreateSessionCommand.parseItem("sku-1::B4"));
        StockTakeException e = Assertions.assertThrows(StockTakeException.class,
                () -> StockTakeCommand.CreateSessionCommand.parseItem("sku-1:lots"));
        Assertions.assertEquals("VALIDATION_ERROR", e.kind().name());
    }

    @Test
    void sessionLifecycleFromTheCommandLine() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").exit());

            Run created = run(root, "create-session", "--branch", "br-1", "--created-by", "mgr", "--multi-user",
                    "--item", "item1:10:A1", "--item", "item2:5:A2");
            Assertions.assertEquals(0, created.exit());
            JsonNode session = created.json();
            String sessionId = session.path("sessionId").asText();
            Assertions.assertEquals(2, session.path("itemCount").asInt());

            Assertions.assertEquals(0, run(root, "start", sessionId, "--actor", "mgr").exit());

            Run counted = run(root, "count", sessionId, "--item", "item1", "--counter", "A", "--quantity", "7");
            Assertions.assertEquals(0, counted.exit());
            Assertions.assertEquals(-3L, counted.json().path("variance").asLong());

            Run refused = run(root, "complete", sessionId, "--actor", "mgr");
            Assertions.assertEquals(StockTakeCommand.EXIT_REJECTED, refused.exit());
            Assertions.assertEquals("INCOMPLETE_ITEMS", refused.json().path("error").asText());

            Run progress = run(root, "progress", sessionId);
            Assertions.assertEquals(50.0d, progress.json().path("progressPercent").asDouble());

            Run forced = run(root, "complete", sessionId, "--actor", "mgr", "--force");
            Assertions.assertEquals(0, forced.exit());
            Assertions.assertEquals("COMPLETED", forced.json().path("status").asText());

            Run report = run(root, "variance-report", sessionId, "--save");
            Assertions.assertEquals(0, report.exit());
            String code = report.json().path("sessionCode").asText();
            Assertions.assertTrue(Files.exists(root.resolve("reports").resolve(code + "-variance.json")));

            Run verify = run(root, "audit-verify");
            Assertions.assertTrue(verify.json().path("ok").asBoolean());

            Run migrations = run(root, "schema-migrations");
            Assertions.assertTrue(migrations.json().size() >= 2);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shelfReviewFromTheCommandLine() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-cli-shelves-");
        try {
            Run created = run(root, "create-session", "--branch", "br-9", "--created-by", "mgr", "--multi-user",
                    "--item", "item1:3:A1", "--item", "item2:4:A1", "--item", "item3:1:B2");
            String sessionId = created.json().path("sessionId").asText();
            Assertions.assertEquals(0, run(root, "start", sessionId, "--actor", "mgr").exit());
            Assertions.assertEquals(0, run(root, "count", sessionId, "--item", "item1", "--counter", "A", "--quantity", "3").exit());
            Assertions.assertEquals(0, run(root, "count", sessionId, "--item", "item2", "--counter", "B", "--quantity", "4").exit());

            Run shelves = run(root, "shelves", sessionId);
            Assertions.assertEquals(1, shelves.json().size());
            Assertions.assertEquals(2, shelves.json().path(0).path("itemsCounted").asInt());
            Assertions.assertEquals("B", shelves.json().path(0).path("counters").path(1).asText());

            Run missing = run(root, "shelf-counts", sessionId, "--shelf", "B2");
            Assertions.assertEquals(StockTakeCommand.EXIT_REJECTED, missing.exit());
            Assertions.assertEquals("NOT_FOUND", missing.json().path("error").asText());

            Run rejected = run(root, "reject-shelf", sessionId, "--shelf", "A1", "--actor", "sup", "--reason", "labels swapped");
            Assertions.assertEquals(0, rejected.exit());
            Assertions.assertEquals("REJECTED", rejected.json().path("status").asText());

            Run approved = run(root, "approve-shelf", sessionId, "--shelf", "A1", "--actor", "sup");
            Assertions.assertEquals("APPROVED", approved.json().path("status").asText());
            Assertions.assertTrue(approved.json().path("rejectionReason").isNull());

            Run detail = run(root, "shelf-counts", sessionId, "--shelf", "A1");
            Assertions.assertEquals(2, detail.json().path("entries").size());
            Assertions.assertEquals("APPROVED", detail.json().path("shelf").path("status").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run run(Path root, String... args) {
        List<String> argv = new ArrayList<>(List.of("--root", root.toString()));
        argv.addAll(List.of(args));
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int exit = StockTakeCommand.commandLine().execute(argv.toArray(new String[0]));
            return new Run(exit, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Run(int exit, String stdout) {
        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(stdout);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
