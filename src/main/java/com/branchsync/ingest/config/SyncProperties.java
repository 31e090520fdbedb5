package com.branchsync.ingest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /**
     * Run the per-branch continuous sync loop. Manual triggers work either way.
     */
    private boolean schedulerEnabled = true;

    /**
     * Delay between the end of one cycle and the start of the next, per branch.
     */
    @NotNull
    private Duration interval = Duration.ofMinutes(5);

    /**
     * Records handed to the sink per ingest call.
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * How far back the first cycle for a branch without a cursor reaches.
     */
    @NotNull
    private Duration initialLookback = Duration.ofHours(24);

    /**
     * Write absent records for roster members with no punches on a day the cycle touched.
     */
    private boolean synthesizeAbsences = false;

    /**
     * Zone applied to branches that do not declare their own.
     */
    @NotBlank
    private String defaultTimezone = "UTC";

    /**
     * Where cursors are kept: "file" or "jdbc".
     */
    @NotBlank
    private String cursorStore = "file";

    private String cursorPath = "branch-sync-cursor.json";

    /**
     * Bearer tokens accepted on the sync API.
     */
    private List<String> apiTokens = new ArrayList<>();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private IdentityCache identityCache = new IdentityCache();

    @Valid
    private List<Branch> branches = new ArrayList<>();

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getInitialLookback() {
        return initialLookback;
    }

    public void setInitialLookback(Duration initialLookback) {
        this.initialLookback = initialLookback;
    }


    public boolean isSynthesizeAbsences() {
        return synthesizeAbsences;
    }

    public void setSynthesizeAbsences(boolean synthesizeAbsences) {
        this.synthesizeAbsences = synthesizeAbsences;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public String getCursorStore() {
        return cursorStore;
    }

    public void setCursorStore(String cursorStore) {
        this.cursorStore = cursorStore;
    }

    public String getCursorPath() {
        return cursorPath;
    }

    public void setCursorPath(String cursorPath) {
        this.cursorPath = cursorPath;
    }

    public List<String> getApiTokens() {
        return apiTokens;
    }

    public void setApiTokens(List<String> apiTokens) {
        this.apiTokens = apiTokens == null ? new ArrayList<>() : new ArrayList<>(apiTokens);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public IdentityCache getIdentityCache() {
        return identityCache;
    }

    public void setIdentityCache(IdentityCache identityCache) {
        this.identityCache = identityCache;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public void setBranches(List<Branch> branches) {
        this.branches = branches == null ? new ArrayList<>() : new ArrayList<>(branches);
    }

    public Optional<Branch> findBranch(String branchId) {
        return branches.stream().filter(branch -> branch.getId().equals(branchId)).findFirst();
    }

    public ZoneId zoneFor(Branch branch) {
        String zone = branch.getTimezone() == null || branch.getTimezone().isBlank() ? defaultTimezone : branch.getTimezone();
        return ZoneId.of(zone);
    }

    public enum SourceType {
        DATABASE,
        DEVICE
    }

    public static class Branch {
        @NotBlank
        private String id;

        private String name;

        /**
         * IANA zone the branch's devices keep their clocks in.
         */
        private String timezone;

        @NotNull
        private SourceType source = SourceType.DATABASE;

        /**
         * Identifier recorded as the source device of extracted punches.
         */
        private String deviceId;

        @Valid
        private Device device = new Device();

        @Valid
        private Datasource datasource = new Datasource();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name == null || name.isBlank() ? id : name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public SourceType getSource() {
            return source;
        }

        public void setSource(SourceType source) {
            this.source = source;
        }

        public String getDeviceId() {
            if (deviceId != null && !deviceId.isBlank()) {
                return deviceId;
            }
            return source == SourceType.DEVICE ? device.getHost() + ":" + device.getPort() : id + "-db";
        }

        public void setDeviceId(String deviceId) {
            this.deviceId = deviceId;
        }

        public Device getDevice() {
            return device;
        }

        public void setDevice(Device device) {
            this.device = device;
        }

        public Datasource getDatasource() {
            return datasource;
        }

        public void setDatasource(Datasource datasource) {
            this.datasource = datasource;
        }
    }

    public static class Device {
        private String host;

        @Min(1)
        private int port = 4370;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration commandTimeout = Duration.ofSeconds(30);

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getCommandTimeout() {
            return commandTimeout;
        }

        public void setCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
        }
    }

    public static class Datasource {
        /**
         * JDBC url of the vendor attendance database, e.g. jdbc:sqlserver://host:1433;databaseName=att2000.
         */
        private String url;
        private String username;
        private String password;
        private String driverClassName;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDriverClassName() {
            return driverClassName;
        }

        public void setDriverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
        }
    }

    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(15);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class IdentityCache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(10);

        @Min(1)
        private long maximumSize = 10_000;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }
}
