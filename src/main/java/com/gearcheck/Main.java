package com.gearcheck;

import com.gearcheck.inventory.EquippableContainers;
import com.gearcheck.inventory.InventoryLoadException;
import com.gearcheck.inventory.InventoryLoader;
import com.gearcheck.matching.MatchEngine;
import com.gearcheck.matching.ReferenceExtractor;
import com.gearcheck.matching.ScriptSources;
import com.gearcheck.models.ComparisonReport;
import com.gearcheck.models.OrphanResult;
import com.gearcheck.storage.JsonStorage;

public class Main {

    private static final String VERSION = "1.0.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        } catch (Exception e) {
            System.err.println("Failed to start: " + e.getMessage());
            System.exit(1);
            return;
        }

        int status = run(config);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one comparison and returns the process exit status. The logger is closed on every path.
     */
    static int run(AppConfig config) {
        try {
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            EquippableContainers containers = config.getContainersPath() != null
                ? EquippableContainers.fromJson(config.getContainersPath())
                : EquippableContainers.defaults();

            ComparisonService service = new ComparisonService(
                new ScriptSources(new ReferenceExtractor()),
                new InventoryLoader(containers),
                new MatchEngine()
            );

            logger.console("Orphan Gear Checker v" + VERSION);
            logger.info("Scripts: " + config.getScriptsPath());
            logger.info("Inventory: " + config.getInventoryPath());
            ComparisonReport report = service.run(
                config.getScriptsPath(), config.getInventoryPath(), config.isEquippableOnly());

            printSummary(report);

            if (config.getOutputPath() != null) {
                JsonStorage.writeJson(config.getOutputPath(), report);
                logger.console("Report saved to: " + config.getOutputPath());
            }
            return 0;
        } catch (InventoryLoadException e) {
            logger.error("Inventory load failed [" + e.getErrorCode() + "]: " + e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            if (logger != null) {
                logger.error("Comparison failed: " + e.getMessage(), e);
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            if (logger != null) {
                logger.close();
                logger = null;
            }
        }
    }

    private static void printSummary(ComparisonReport report) {
        logger.console("");
        logger.console("  Script files checked: " + report.getScriptSources().size());
        if (!report.getFailedSources().isEmpty()) {
            logger.console("  Script files skipped: " + report.getFailedSources());
        }
        logger.console("  Script references:    " + report.getReferenceCount()
            + " (" + report.getAugmentedReferenceCount() + " with augments)");
        logger.console("  Inventory items:      " + report.getEntryCount()
            + " (" + report.getAugmentedEntryCount() + " with augments)");
        logger.console("  Orphaned items:       " + report.getOrphanCount());
        logger.console("");
        for (OrphanResult orphan : report.getOrphans()) {
            logger.console("  " + orphan.getEntry());
        }
    }

    private static void printUsage() {
        System.err.println("Usage: orphan-gear-checker <scripts folder or file> <inventory csv> [options]");
        System.err.println("  --all-containers      compare every container, not just wardrobes");
        System.err.println("  --containers=<file>   JSON map of equippable container id to label");
        System.err.println("  --out=<file>          write the comparison report as JSON");
        System.err.println("  --dev                 mirror log output to the console");
    }
}
