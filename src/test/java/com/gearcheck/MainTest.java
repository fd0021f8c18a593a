package com.gearcheck;

import com.gearcheck.inventory.InventoryLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Path scripts;
    private Path log;

    @BeforeEach
    void setUp() throws IOException {
        scripts = Files.writeString(tempDir.resolve("PLD.lua"), "main=\"Aeneas\"\n");
        log = tempDir.resolve("run.log");
    }

    private AppConfig config(Path inventory, String... extra) throws IOException {
        String[] args = new String[2 + extra.length];
        args[0] = scripts.toString();
        args[1] = inventory.toString();
        System.arraycopy(extra, 0, args, 2, extra.length);
        return new AppConfig.Builder().logPath(log).parseArgs(args).build();
    }

    @Test
    void successfulRunWritesReportAndClosesLogger() throws IOException {
        Path inventory = Files.writeString(tempDir.resolve("inventory.csv"),
            "item_id,item_name,container_id,container_name\n"
            + "20695,Aeneas,8,wardrobe\n"
            + "11111,Old Ring,13,wardrobe5\n");
        Path out = tempDir.resolve("report.json");

        int status = Main.run(config(inventory, "--out=" + out));

        assertEquals(0, status);
        assertTrue(Files.readString(out).contains("Old Ring"));
        assertNull(AppLogger.get());
    }

    @Test
    void failedRunLogsErrorAndClosesLogger() throws IOException {
        Path inventory = Files.writeString(tempDir.resolve("broken.csv"),
            "item_id,item_name,container_id,container_name\n"
            + "x,Aeneas,8,wardrobe\n");

        int status = Main.run(config(inventory));

        assertEquals(1, status);
        assertNull(AppLogger.get());
        String logged = Files.readString(log);
        assertTrue(logged.contains("Inventory load failed [" + InventoryLoadException.ERR_MALFORMED_ROW + "]"));
    }
}
