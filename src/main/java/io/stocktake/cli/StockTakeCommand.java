package io.stocktake.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.stocktake.config.StockTakeConfig;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.CountEntry;
import io.stocktake.model.ItemSeed;
import io.stocktake.model.NewSession;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.VarianceReport;
import io.stocktake.runtime.SessionCoordinator;
import io.stocktake.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "stocktake",
        mixinStandardHelpOptions = true,
        description = "Stock take session coordination CLI",
        subcommands = {
                StockTakeCommand.InitCommand.class,
                StockTakeCommand.CreateSessionCommand.class,
                StockTakeCommand.StartCommand.class,
                StockTakeCommand.PauseCommand.class,
                StockTakeCommand.ResumeCommand.class,
                StockTakeCommand.CompleteCommand.class,
                StockTakeCommand.CancelCommand.class,
                StockTakeCommand.UpdateSessionCommand.class,
                StockTakeCommand.JoinCommand.class,
                StockTakeCommand.CountCommand.class,
                StockTakeCommand.ProgressCommand.class,
                StockTakeCommand.SessionsCommand.class,
                StockTakeCommand.SessionCommand.class,
                StockTakeCommand.CountsCommand.class,
                StockTakeCommand.VarianceReportCommand.class,
                StockTakeCommand.ShelvesCommand.class,
                StockTakeCommand.ShelfCountsCommand.class,
                StockTakeCommand.ApproveShelfCommand.class,
                StockTakeCommand.RejectShelfCommand.class,
                StockTakeCommand.ReloadSettingsCommand.class,
                StockTakeCommand.AuditTailCommand.class,
                StockTakeCommand.AuditVerifyCommand.class,
                StockTakeCommand.SchemaMigrationsCommand.class,
                StockTakeCommand.ServeWebCommand.class
        }
)
public final class StockTakeCommand implements Runnable {
    static final int EXIT_REJECTED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create-session | start | pause | resume | complete | cancel | update-session | join | count | progress | sessions | session | counts | variance-report | shelves | shelf-counts | approve-shelf | reject-shelf | reload-settings | audit-tail | audit-verify | schema-migrations | serve-web");
    }

    /**
     * Command line with rejections printed as JSON error bodies (exit code 2) instead of
     * stack traces.
     */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new StockTakeCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof StockTakeException) {
                System.out.println(Jsons.toJson(StockTakeWebServer.errorBody((StockTakeException) ex)));
                return EXIT_REJECTED;
            }
            throw ex;
        });
        return cli;
    }

    StockTakeConfig config() {
        return StockTakeConfig.fromRoot(root, namespace);
    }

    SessionCoordinator coordinator() {
        SessionCoordinator coordinator = new SessionCoordinator(config());
        coordinator.init();
        return coordinator;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Override
        public Integer call() {
            parent.coordinator();
            System.out.println("Initialized stock take data at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create-session", description = "Create a DRAFT stock take session for a branch")
    static final class CreateSessionCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Option(names = {"--branch"}, required = true, description = "Owning branch id")
        String branch;

        @Option(names = {"--created-by"}, required = true, description = "Creator user id")
        String createdBy;

        @Option(names = {"--multi-user"}, defaultValue = "false", description = "Allow several counters")
        boolean multiUser;

        @Option(names = {"--counter"}, description = "Allowed counter id (repeatable; none means unrestricted)")
        List<String> counters;

        @Option(names = {"--shelf"}, description = "Shelf assignment COUNTER=SHELF1,SHELF2 (repeatable)")
        Map<String, String> shelves;

        @Option(names = {"--notes"}, description = "Free-text notes")
        String notes;

        @Option(names = {"--item"}, description = "Item ITEM_ID[:BASELINE[:SHELF]] (repeatable)")
        List<String> items;

        @Option(names = {"--items-file"}, description = "JSON array of {itemId, baselineQuantity, shelfLocation}")
        String itemsFile;

        @Override
        public Integer call() throws Exception {
            List<ItemSeed> seeds = new ArrayList<>();
            if (itemsFile != null && !itemsFile.isBlank()) {
                seeds.addAll(Jsons.mapper().readValue(Path.of(itemsFile).toFile(), new TypeReference<List<ItemSeed>>() {
                }));
            }
            if (items != null) {
                for (String raw : items) {
                    seeds.add(parseItem(raw));
                }
            }
            Map<String, List<String>> shelfMap = new LinkedHashMap<>();
            if (shelves != null) {
                shelves.forEach((counter, list) -> shelfMap.put(counter, Arrays.asList(list.split(","))));
            }
            SessionView session = parent.coordinator().createSession(new NewSession(
                    branch,
                    createdBy,
                    multiUser,
                    counters == null ? List.of() : counters,
                    shelfMap,
                    notes,
                    seeds
            ));
            System.out.println(Jsons.toJson(session));
            return 0;
        }

        static ItemSeed parseItem(String raw) {
            String[] parts = raw.split(":", 3);
            Long baseline = null;
            if (parts.length > 1 && !parts[1].isBlank()) {
                try {
                    baseline = Long.parseLong(parts[1].trim());
                } catch (NumberFormatException e) {
                    throw StockTakeException.validation("baseline must be a whole number in --item " + raw);
                }
            }
            String shelf = parts.length > 2 ? parts[2] : null;
            return new ItemSeed(parts[0], baseline, shelf);
        }
    }

    @Command(name = "start", description = "Start a DRAFT session (freezes baselines)")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().startSession(sessionId, actor)));
            return 0;
        }
    }

    @Command(name = "pause", description = "Pause an ACTIVE session and release its locks")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().pauseSession(sessionId, actor)));
            return 0;
        }
    }

    @Command(name = "resume", description = "Resume a PAUSED session")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().resumeSession(sessionId, actor)));
            return 0;
        }
    }

    @Command(name = "complete", description = "Complete a session; --force accepts uncounted items")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Option(names = {"--force"}, defaultValue = "false", description = "Complete with uncounted items")
        boolean force;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().completeSession(sessionId, actor, force)));
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a non-terminal session; counts are kept")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().cancelSession(sessionId, actor)));
            return 0;
        }
    }

    @Command(name = "update-session", description = "Change counters, shelf map or notes of an open session")
    static final class UpdateSessionCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting user id")
        String actor;

        @Option(names = {"--counter"}, description = "Replacement allowed counter list (repeatable)")
        List<String> counters;

        @Option(names = {"--clear-counters"}, defaultValue = "false", description = "Lift the counter restriction")
        boolean clearCounters;

        @Option(names = {"--shelf"}, description = "Replacement shelf map COUNTER=SHELF1,SHELF2 (repeatable)")
        Map<String, String> shelves;

        @Option(names = {"--notes"}, description = "Replacement notes")
        String notes;

        @Override
        public Integer call() {
            List<String> allowed = clearCounters ? List.of() : counters;
            Map<String, List<String>> shelfMap = null;
            if (shelves != null) {
                shelfMap = new LinkedHashMap<>();
                for (Map.Entry<String, String> e : shelves.entrySet()) {
                    shelfMap.put(e.getKey(), Arrays.asList(e.getValue().split(",")));
                }
            }
            SessionView out = parent.coordinator().updateSession(sessionId, actor,
                    new SessionUpdate(allowed, shelfMap, notes));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "join", description = "Join an ACTIVE multi-user session by its code")
    static final class JoinCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session code, e.g. ST-MAR25A")
        String code;

        @Option(names = {"--counter"}, required = true, description = "Counter id")
        String counter;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().joinSession(code, counter)));
            return 0;
        }
    }

    /**
     * Locks live in the serving process, so a one-shot CLI count claims the item and
     * submits within the same invocation.
     */
    @Command(name = "count", description = "Lock an item and submit its counted quantity")
    static final class CountCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--item"}, required = true, description = "Item id")
        String item;

        @Option(names = {"--counter"}, required = true, description = "Counter id")
        String counter;

        @Option(names = {"--quantity"}, required = true, description = "Counted quantity")
        long quantity;

        @Option(names = {"--shelf"}, description = "Shelf where the item was counted")
        String shelf;

        @Option(names = {"--notes"}, description = "Count notes")
        String notes;

        @Override
        public Integer call() {
            SessionCoordinator coordinator = parent.coordinator();
            coordinator.acquireLock(sessionId, item, counter);
            CountEntry entry = coordinator.submitCount(sessionId, item, counter, quantity, shelf, notes);
            System.out.println(Jsons.toJson(entry));
            return 0;
        }
    }

    @Command(name = "progress", description = "Show the progress snapshot of a session")
    static final class ProgressCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().getProgress(sessionId)));
            return 0;
        }
    }

    @Command(name = "sessions", description = "List sessions, newest first")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Option(names = {"--branch"}, description = "Filter by branch id")
        String branch;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().listSessions(branch, status, limit)));
            return 0;
        }
    }

    @Command(name = "session", description = "Show one session by id or --code")
    static final class SessionCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Session id")
        String sessionId;

        @Option(names = {"--code"}, description = "Session code instead of id")
        String code;

        @Override
        public Integer call() {
            SessionCoordinator coordinator = parent.coordinator();
            SessionView session = code != null && !code.isBlank()
                    ? coordinator.getSessionByCode(code)
                    : coordinator.getSession(sessionId);
            System.out.println(Jsons.toJson(session));
            return 0;
        }
    }

    @Command(name = "counts", description = "List count entries of a session, newest first")
    static final class CountsCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--counter"}, description = "Only this counter's entries")
        String counter;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().listCounts(sessionId, counter, limit)));
            return 0;
        }
    }

    @Command(name = "variance-report", description = "Per-item baseline, counted quantity and variance")
    static final class VarianceReportCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--save"}, defaultValue = "false", description = "Also write the report under <root>/reports")
        boolean save;

        @Override
        public Integer call() throws Exception {
            VarianceReport report = parent.coordinator().varianceReport(sessionId);
            String json = Jsons.toJson(report);
            if (save) {
                Path out = parent.config().reportsRoot().resolve(report.sessionCode() + "-variance.json");
                Files.createDirectories(out.getParent());
                Files.writeString(out, json, StandardCharsets.UTF_8);
                System.err.println("Saved variance report: " + out);
            }
            System.out.println(json);
            return 0;
        }
    }

    @Command(name = "shelves", description = "List counted shelves with their review status")
    static final class ShelvesCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().listShelves(sessionId)));
            return 0;
        }
    }

    @Command(name = "shelf-counts", description = "Show the count entries of one shelf, oldest first")
    static final class ShelfCountsCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--shelf"}, required = true, description = "Shelf location")
        String shelf;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().shelfCounts(sessionId, shelf)));
            return 0;
        }
    }

    @Command(name = "approve-shelf", description = "Approve the counts of a shelf")
    static final class ApproveShelfCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--shelf"}, required = true, description = "Shelf location")
        String shelf;

        @Option(names = {"--actor"}, required = true, description = "Reviewer")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().approveShelf(sessionId, shelf, actor)));
            return 0;
        }
    }

    @Command(name = "reject-shelf", description = "Return a shelf to its counters with a reason")
    static final class RejectShelfCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--shelf"}, required = true, description = "Shelf location")
        String shelf;

        @Option(names = {"--actor"}, required = true, description = "Reviewer")
        String actor;

        @Option(names = {"--reason"}, required = true, description = "What needs recounting")
        String reason;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().rejectShelf(sessionId, shelf, actor, reason)));
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload stocktake-settings.json and print effective values")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().reloadSettings()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (JsonNode row : parent.coordinator().auditTail(lines)) {
                System.out.println(row.toString());
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Override
        public Integer call() {
            SessionCoordinator.AuditIntegrityOutcome out = parent.coordinator().verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.coordinator().schemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "serve-web", description = "Serve the JSON API (locks are held by this process)")
    static final class ServeWebCommand implements Callable<Integer> {
        @ParentCommand
        StockTakeCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Default list limit")
        int limit;

        @Option(names = {"--sweep-ms"}, defaultValue = "30000",
                description = "Interval for dropping expired locks; 0 disables the sweep")
        long sweepMs;

        @Override
        public Integer call() throws Exception {
            SessionCoordinator coordinator = parent.coordinator();
            StockTakeWebServer server = new StockTakeWebServer(coordinator, limit);
            int bound = server.start(host, port);
            System.out.println("Stock take API: http://" + host + ":" + bound + "/api/health");
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                stopped.countDown();
            }, "stocktake-shutdown-hook"));
            if (sweepMs <= 0) {
                stopped.await();
                return 0;
            }
            while (!stopped.await(sweepMs, TimeUnit.MILLISECONDS)) {
                coordinator.sweepExpiredLocks();
            }
            return 0;
        }
    }
}
