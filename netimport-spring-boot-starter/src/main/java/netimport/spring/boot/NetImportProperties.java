package netimport.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for network import jobs.
 *
 * @see NetImportAutoConfiguration
 */
@ConfigurationProperties(prefix = "netimport")
public class NetImportProperties {

    /**
     * Node role: an API node accepts submissions, a worker node only executes queued jobs.
     */
    private Role role = Role.API;

    /**
     * Prefix of the four job tables ({@code job}, {@code job_log}, {@code job_queue}, {@code worker}).
     */
    private String tablePrefix = "ni_";

    private final Execution execution = new Execution();
    private final Probe probe = new Probe();
    private final Worker worker = new Worker();
    private final Runner runner = new Runner();
    private final Lease lease = new Lease();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();
    private final Settings settings = new Settings();
    private final Server server = new Server();

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Execution getExecution() {
        return execution;
    }

    public Probe getProbe() {
        return probe;
    }

    public Worker getWorker() {
        return worker;
    }

    public Runner getRunner() {
        return runner;
    }

    public Lease getLease() {
        return lease;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Settings getSettings() {
        return settings;
    }

    public Server getServer() {
        return server;
    }

    public enum Role {
        API,
        WORKER
    }

    public static class Execution {
        /**
         * Run every submission inline, even when workers are live.
         */
        private boolean forceImmediate = false;

        public boolean isForceImmediate() {
            return forceImmediate;
        }

        public void setForceImmediate(boolean forceImmediate) {
            this.forceImmediate = forceImmediate;
        }
    }

    public static class Probe {
        /**
         * Upper bound on the worker-availability probe made for each submission.
         */
        private Duration timeout = Duration.ofSeconds(2);

        /**
         * How recently a worker must have heart-beaten to count as live.
         */
        private Duration livenessWindow = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getLivenessWindow() {
            return livenessWindow;
        }

        public void setLivenessWindow(Duration livenessWindow) {
            this.livenessWindow = livenessWindow;
        }
    }

    public static class Worker {
        /**
         * Also consume the queue on an API node.
         */
        private boolean enabled = false;
        private String id;
        private int concurrency = 2;
        private long pollIntervalMs = 1000;
        private long heartbeatIntervalMs = 5000;
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Runner {
        private long heartbeatIntervalMs = 10000;

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }
    }

    public static class Lease {
        /**
         * Fail RUNNING jobs whose runner stopped heart-beating.
         */
        private boolean enabled = true;
        private Duration timeout = Duration.ofMinutes(5);
        private long intervalSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Purge {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(30);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "netimport";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    /**
     * Named inventories, credentials and Batfish services that jobs select by name.
     */
    public static class Settings {
        private final Map<String, Inventory> inventories = new LinkedHashMap<>();
        private final Map<String, Credentials> credentials = new LinkedHashMap<>();
        private final Map<String, Batfish> batfish = new LinkedHashMap<>();

        public Map<String, Inventory> getInventories() {
            return inventories;
        }

        public Map<String, Credentials> getCredentials() {
            return credentials;
        }

        public Map<String, Batfish> getBatfish() {
            return batfish;
        }
    }

    public static class Inventory {
        private String address;
        private String token;
        private boolean verifySsl = true;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isVerifySsl() {
            return verifySsl;
        }

        public void setVerifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
        }
    }

    public static class Credentials {
        private String login;
        private String password;

        public String getLogin() {
            return login;
        }

        public void setLogin(String login) {
            this.login = login;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Batfish {
        private String address;
        private Integer portV1;
        private Integer portV2;
        private Boolean useSsl;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public Integer getPortV1() {
            return portV1;
        }

        public void setPortV1(Integer portV1) {
            this.portV1 = portV1;
        }

        public Integer getPortV2() {
            return portV2;
        }

        public void setPortV2(Integer portV2) {
            this.portV2 = portV2;
        }

        public Boolean getUseSsl() {
            return useSsl;
        }

        public void setUseSsl(Boolean useSsl) {
            this.useSsl = useSsl;
        }
    }

    /**
     * Settings read by the HTTP layer and the command import executor.
     */
    public static class Server {
        /**
         * Header naming the caller when the request carries no authenticated principal.
         */
        private String principalHeader = "X-Remote-User";

        /**
         * Import command; {@code {mode}} and {@code {site}} are substituted per job.
         */
        private String command = "network-importer {mode} --limit site={site}";

        /**
         * Upper bound on one import command run; the process is killed when it is exceeded.
         */
        private Duration commandTimeout = Duration.ofHours(1);

        public String getPrincipalHeader() {
            return principalHeader;
        }

        public void setPrincipalHeader(String principalHeader) {
            this.principalHeader = principalHeader;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public Duration getCommandTimeout() {
            return commandTimeout;
        }

        public void setCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
        }
    }
}
