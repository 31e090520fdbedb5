package com.branchsync.ingest;

import com.branchsync.ingest.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
public class BranchSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BranchSyncApplication.class, args);
    }
}
