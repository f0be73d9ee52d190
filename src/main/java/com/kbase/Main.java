package com.kbase;

import com.kbase.models.RebuildReport;

import java.util.Map;

/**
 * Rebuilds the secondary index from the Markdown files: every type, or the one named with {@code --type}.
 */
public class Main {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                .parseArgs(args)
                .build();
            AppLogger.initialize(config.getLogPath(), config.isConsoleEnabled());
        } catch (Exception e) {
            System.err.println("Failed to load configuration: " + e.getMessage());
            return 2;
        }
        AppLogger logger = AppLogger.get();
        printBanner(logger, config);

        try (KnowledgeBase kb = KnowledgeBase.open(config)) {
            RebuildReport report = config.getRebuildType() != null
                ? kb.rebuilder().rebuild(config.getRebuildType())
                : kb.rebuilder().rebuildAll();
            printReport(report);
            return report.getFailedTypes().isEmpty() ? 0 : 1;
        } catch (KnowledgeBaseException e) {
            logger.error("Rebuild failed (" + e.getKind() + "): " + e.getMessage(), e);
            System.err.println("Rebuild failed: " + e.getMessage());
            return 1;
        } finally {
            AppLogger.shutdown();
        }
    }

    private static void printBanner(AppLogger logger, AppConfig config) {
        logger.console("kbase " + VERSION + " index rebuild");
        logger.console("  Data directory: " + config.getDataDirectory());
        logger.console("  Index:          " + config.getDatabasePath());
        logger.console("  Log file:       " + config.getLogPath());
    }

    private static void printReport(RebuildReport report) {
        for (String type : report.getRegisteredTypes()) {
            System.out.println("Registered type: " + type);
        }
        for (Map.Entry<String, Integer> entry : report.getSyncedByType().entrySet()) {
            System.out.println(entry.getKey() + ": " + entry.getValue());
        }
        for (String type : report.getFailedTypes()) {
            System.out.println(type + ": FAILED");
        }
        System.out.println("Total: " + report.getTotalSynced());
    }
}
