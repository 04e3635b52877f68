package netimport.server.exec;

import netimport.model.LogLevel;
import netimport.spi.ImportExecutor;
import netimport.spi.ImportLog;
import netimport.spi.ImportRequest;
import netimport.spi.ImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the import as an external command.
 *
 * <p>The command template is split on whitespace and {@code {mode}} / {@code {site}} are
 * substituted in each argument. The generated configuration is passed through the
 * environment: key {@code section.key} becomes {@code NETWORK_IMPORTER_SECTION_KEY}.
 *
 * <p>Standard output and standard error are merged and streamed into the job log line by
 * line. A leading level token ({@code ERROR:}, {@code [WARNING]}, {@code INFO -} ...) sets
 * the entry level and is stripped; other lines are logged at INFO. The import succeeds
 * when the command exits with status 0.
 */
public class CommandImportExecutor implements ImportExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandImportExecutor.class);

    static final String ENV_PREFIX = "NETWORK_IMPORTER_";

    private static final Pattern LEVEL_PREFIX = Pattern.compile(
            "^\\[?(DEBUG|INFO|WARN|WARNING|ERROR|CRITICAL|FATAL)\\]?(?:[:\\s-]+|$)(.*)$");

    private final String commandTemplate;
    private final Duration timeout;

    public CommandImportExecutor(String commandTemplate, Duration timeout) {
        Objects.requireNonNull(commandTemplate, "commandTemplate");
        Objects.requireNonNull(timeout, "timeout");
        if (commandTemplate.isBlank()) {
            throw new IllegalArgumentException("commandTemplate must not be blank");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.commandTemplate = commandTemplate;
        this.timeout = timeout;
    }

    @Override
    public ImportResult execute(ImportRequest request, ImportLog importLog) throws IOException, InterruptedException {
        List<String> command = command(request);
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(environment(request.config()));

        log.info("Job {}: running {}", request.jobId(), command);
        Process process = builder.start();
        AtomicBoolean timedOut = new AtomicBoolean();
        CompletableFuture<Void> watchdog = CompletableFuture.runAsync(() -> {
            if (process.isAlive()) {
                timedOut.set(true);
                process.destroyForcibly();
            }
        }, CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    forward(line, importLog);
                }
            }
            int exitCode = process.waitFor();
            log.info("Job {}: command exited with status {}", request.jobId(), exitCode);
            if (timedOut.get()) {
                importLog.error("Import command timed out after " + timeout);
                return ImportResult.failed("timed out after " + timeout);
            }
            if (exitCode != 0) {
                importLog.error("Import command exited with status " + exitCode);
                return ImportResult.failed("exit status " + exitCode);
            }
            return ImportResult.succeeded();
        } finally {
            watchdog.cancel(false);
            if (process.isAlive()) {
                log.warn("Job {}: killing import command left running", request.jobId());
                process.destroyForcibly();
            }
        }
    }

    List<String> command(ImportRequest request) {
        List<String> args = new ArrayList<>();
        for (String part : commandTemplate.trim().split("\\s+")) {
            args.add(part.replace("{mode}", request.mode().value()).replace("{site}", request.siteCode()));
        }
        return args;
    }

    static Map<String, String> environment(Map<String, String> config) {
        Map<String, String> env = new LinkedHashMap<>();
        config.forEach((key, value) -> {
            if (value != null) {
                env.put(ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT), value);
            }
        });
        return env;
    }

    static void forward(String line, ImportLog importLog) {
        Matcher m = LEVEL_PREFIX.matcher(line);
        if (m.matches()) {
            LogLevel level = LogLevel.lookup(m.group(1)).orElse(LogLevel.INFO);
            String message = m.group(2).isBlank() ? line : m.group(2);
            importLog.log(level, message);
        } else {
            importLog.log(LogLevel.INFO, line);
        }
    }
}
