package netimport.server.exec;

import netimport.model.JobMode;
import netimport.model.LogLevel;
import netimport.settings.InventorySetting;
import netimport.settings.NetworkCredentials;
import netimport.settings.ResolvedSettings;
import netimport.spi.ImportLog;
import netimport.spi.ImportRequest;
import netimport.spi.ImportResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandImportExecutorTest {

    @TempDir
    Path tmp;

    @Test
    void substitutesModeAndSite() {
        CommandImportExecutor executor = new CommandImportExecutor(
                "network-importer {mode}  --limit site={site}", Duration.ofMinutes(1));
        assertEquals(List.of("network-importer", "check", "--limit", "site=lab01"),
                executor.command(request(Map.of())));
    }

    @Test
    void configBecomesEnvironment() {
        Map<String, String> env = CommandImportExecutor.environment(Map.of(
                "inventory.address", "https://nautobot.lab",
                "main.import_ips", "true",
                "batfish.port-v1", "9996"));
        assertEquals("https://nautobot.lab", env.get("NETWORK_IMPORTER_INVENTORY_ADDRESS"));
        assertEquals("true", env.get("NETWORK_IMPORTER_MAIN_IMPORT_IPS"));
        assertEquals("9996", env.get("NETWORK_IMPORTER_BATFISH_PORT_V1"));
    }

    @Test
    void levelTokensAreParsed() {
        RecordingLog log = new RecordingLog();
        CommandImportExecutor.forward("ERROR: device unreachable", log);
        CommandImportExecutor.forward("[WARNING] no hosts", log);
        CommandImportExecutor.forward("WARN - deprecated option", log);
        CommandImportExecutor.forward("plain progress line", log);
        CommandImportExecutor.forward("INFORMATION is not a level", log);

        assertEquals(List.of(
                "ERROR device unreachable",
                "WARNING no hosts",
                "WARNING deprecated option",
                "INFO plain progress line",
                "INFO INFORMATION is not a level"), log.lines);
    }

    @Test
    void rejectsBlankTemplate() {
        assertThrows(IllegalArgumentException.class, () -> new CommandImportExecutor(" ", Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> new CommandImportExecutor("x", Duration.ZERO));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void streamsOutputAndSucceedsOnZeroExit() throws Exception {
        Path script = script("""
                echo "INFO: importing $2 in $1 mode"
                echo "WARNING: inventory at $NETWORK_IMPORTER_INVENTORY_ADDRESS"
                echo "diff computed" 1>&2
                exit 0
                """);
        RecordingLog log = new RecordingLog();
        ImportResult result = new CommandImportExecutor("sh " + script + " {mode} {site}", Duration.ofMinutes(1))
                .execute(request(Map.of("inventory.address", "https://nautobot.lab")), log);

        assertTrue(result.success());
        assertEquals(List.of(
                "INFO importing lab01 in check mode",
                "WARNING inventory at https://nautobot.lab",
                "INFO diff computed"), log.lines);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFails() throws Exception {
        Path script = script("""
                echo "ERROR: authentication failed"
                exit 3
                """);
        RecordingLog log = new RecordingLog();
        ImportResult result = new CommandImportExecutor("sh " + script, Duration.ofMinutes(1))
                .execute(request(Map.of()), log);

        assertFalse(result.success());
        assertEquals("exit status 3", result.summary());
        assertEquals("ERROR authentication failed", log.lines.get(0));
        assertEquals("ERROR Import command exited with status 3", log.lines.get(log.lines.size() - 1));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void timeoutKillsTheCommand() throws Exception {
        Path script = script("""
                echo "INFO: starting"
                exec sleep 30
                """);
        RecordingLog log = new RecordingLog();
        ImportResult result = new CommandImportExecutor("sh " + script, Duration.ofMillis(500))
                .execute(request(Map.of()), log);

        assertFalse(result.success());
        assertTrue(result.summary().startsWith("timed out"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failingLogSinkKillsTheCommand() throws Exception {
        Path pidFile = tmp.resolve("import.pid");
        Path script = script("echo $$ > " + pidFile + "\n"
                + "echo \"INFO: starting\"\n"
                + "exec sleep 60\n");
        ImportLog storeDown = (level, message) -> {
            throw new IllegalStateException("store down");
        };
        CommandImportExecutor executor = new CommandImportExecutor("sh " + script, Duration.ofMinutes(5));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> executor.execute(request(Map.of()), storeDown));
        assertEquals("store down", thrown.getMessage());

        long pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim());
        Optional<ProcessHandle> child = ProcessHandle.of(pid);
        if (child.isPresent()) {
            child.get().onExit().get(5, TimeUnit.SECONDS);
            assertFalse(child.get().isAlive());
        }
    }

    private Path script(String body) throws Exception {
        Path file = tmp.resolve("import.sh");
        Files.writeString(file, body, StandardCharsets.UTF_8);
        return file;
    }

    private static ImportRequest request(Map<String, String> config) {
        ResolvedSettings settings = new ResolvedSettings(
                new InventorySetting("lab", "https://nautobot.lab", null, true),
                new NetworkCredentials("ops", "netops", "secret"),
                null,
                Map.of());
        return new ImportRequest("job-1", "lab01", JobMode.CHECK, settings, config);
    }

    private static final class RecordingLog implements ImportLog {
        final List<String> lines = new ArrayList<>();

        @Override
        public void log(LogLevel level, String message) {
            lines.add(level + " " + message);
        }
    }
}
