package io.stocktake.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class StockTakeConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE = "stocktake-settings.json";
    public static final String CATALOG_FILE = "item-catalog.json";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public StockTakeConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static StockTakeConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static StockTakeConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new StockTakeConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_NAMESPACE;
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("stocktake.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path catalogFile() {
        return rootDir.resolve(CATALOG_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }
}
