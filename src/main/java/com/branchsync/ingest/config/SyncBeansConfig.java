package com.branchsync.ingest.config;

import com.branchsync.ingest.extract.DeviceLogExtractor;
import com.branchsync.ingest.extract.JdbcCheckInOutExtractor;
import com.branchsync.ingest.extract.RemoteLogExtractor;
import com.branchsync.ingest.jdbc.JdbcAttendanceRoster;
import com.branchsync.ingest.jdbc.JdbcSyncCursorStore;
import com.branchsync.ingest.jdbc.JdbcUserDirectory;
import com.branchsync.ingest.service.AttendanceRoster;
import com.branchsync.ingest.service.BranchContext;
import com.branchsync.ingest.service.BranchRegistry;
import com.branchsync.ingest.service.CachingUserDirectory;
import com.branchsync.ingest.service.FileSyncCursorStore;
import com.branchsync.ingest.service.RetryPolicy;
import com.branchsync.ingest.service.SyncCursorStore;
import com.branchsync.ingest.service.UserDirectory;
import com.branchsync.ingest.zk.DeviceSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Beans that need setup beyond constructor injection: per-branch extractors and pools,
 * the cursor store choice, the roster toggle and the cached identity lookup.
 */
@Configuration
@EnableConfigurationProperties(WorkingHoursProperties.class)
public class SyncBeansConfig {
    private static final Logger log = LoggerFactory.getLogger(SyncBeansConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(SyncProperties properties) {
        return RetryPolicy.from(properties.getRetry());
    }

    @Bean
    public DeviceSessionFactory deviceSessionFactory() {
        return DeviceSessionFactory.tcp();
    }

    @Bean
    public BranchRegistry branchRegistry(SyncProperties properties,
                                         DeviceSessionFactory sessionFactory,
                                         RetryPolicy retryPolicy) {
        List<BranchContext> branches = new ArrayList<>();
        for (SyncProperties.Branch branch : properties.getBranches()) {
            ZoneId zone = properties.zoneFor(branch);
            branches.add(new BranchContext(branch.getId(), branch.getName(), zone,
                    extractorFor(branch, zone, sessionFactory, retryPolicy)));
            log.info("Branch {} ({}) source={} zone={}", branch.getId(), branch.getName(), branch.getSource(), zone);
        }
        return new BranchRegistry(branches, ZoneId.of(properties.getDefaultTimezone()));
    }

    @Bean
    public UserDirectory userDirectory(JdbcTemplate jdbcTemplate, SyncProperties properties) {
        SyncProperties.IdentityCache cache = properties.getIdentityCache();
        return new CachingUserDirectory(new JdbcUserDirectory(jdbcTemplate), cache.getTtl(), cache.getMaximumSize());
    }

    @Bean
    public AttendanceRoster attendanceRoster(JdbcTemplate jdbcTemplate, SyncProperties properties) {
        return properties.isSynthesizeAbsences() ? new JdbcAttendanceRoster(jdbcTemplate) : AttendanceRoster.none();
    }

    @Bean
    public SyncCursorStore syncCursorStore(SyncProperties properties,
                                           ObjectMapper objectMapper,
                                           JdbcTemplate jdbcTemplate,
                                           Clock clock) {
        String store = properties.getCursorStore().trim().toLowerCase(Locale.ROOT);
        return switch (store) {
            case "jdbc" -> new JdbcSyncCursorStore(jdbcTemplate, clock);
            case "file" -> new FileSyncCursorStore(Path.of(properties.getCursorPath()), objectMapper, clock);
            default -> throw new IllegalStateException("Unknown sync.cursor-store " + properties.getCursorStore());
        };
    }

    private RemoteLogExtractor extractorFor(SyncProperties.Branch branch,
                                            ZoneId zone,
                                            DeviceSessionFactory sessionFactory,
                                            RetryPolicy retryPolicy) {
        if (branch.getSource() == SyncProperties.SourceType.DEVICE) {
            SyncProperties.Device device = branch.getDevice();
            if (!StringUtils.hasText(device.getHost())) {
                throw new IllegalStateException("Branch " + branch.getId() + " reads a device but sync.branches[].device.host is empty");
            }
            return new DeviceLogExtractor(sessionFactory, branch.getDeviceId(), device.getHost(), device.getPort(),
                    device.getConnectTimeout(), device.getCommandTimeout(), zone, retryPolicy);
        }
        SyncProperties.Datasource datasource = branch.getDatasource();
        if (!StringUtils.hasText(datasource.getUrl())) {
            throw new IllegalStateException("Branch " + branch.getId() + " reads a database but sync.branches[].datasource.url is empty");
        }
        DataSourceBuilder<HikariDataSource> builder = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(datasource.getUrl())
                .username(datasource.getUsername())
                .password(datasource.getPassword());
        if (StringUtils.hasText(datasource.getDriverClassName())) {
            builder.driverClassName(datasource.getDriverClassName());
        }
        HikariDataSource pool = builder.build();
        pool.setPoolName("branch-" + branch.getId());
        pool.setMaximumPoolSize(2);
        return JdbcCheckInOutExtractor.owning(pool, zone, branch.getDeviceId());
    }
}
