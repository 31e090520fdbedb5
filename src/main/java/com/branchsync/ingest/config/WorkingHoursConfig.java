package com.branchsync.ingest.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@PropertySource(value = "classpath:working-hours.yml", factory = YamlPropertySourceFactory.class)
public class WorkingHoursConfig {
}
