package com.branchsync.ingest.config;

import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.model.WorkingHours;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.EncodedResource;

import java.io.IOException;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkingHoursPropertiesTest {

    @Test
    void bundledWorkingHoursBindPerUserType() throws IOException {
        PropertySource<?> source = new YamlPropertySourceFactory()
                .createPropertySource("working-hours", new EncodedResource(new ClassPathResource("working-hours.yml")));
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(source);

        WorkingHoursProperties properties = new Binder(ConfigurationPropertySources.get(environment))
                .bind("working-hours", WorkingHoursProperties.class)
                .get();
        Map<UserType, WorkingHours> hours = properties.toWorkingHours();

        assertThat(hours).containsOnlyKeys(UserType.STUDENT, UserType.TEACHER, UserType.STAFF);
        assertThat(hours.get(UserType.TEACHER).start()).isEqualTo(LocalTime.of(7, 30));
        assertThat(hours.get(UserType.STAFF).lateThreshold()).isEqualTo(LocalTime.of(8, 15));
        assertThat(hours.get(UserType.STUDENT).end()).isEqualTo(LocalTime.of(16, 0));
    }

    @Test
    void missingSideFileYieldsEmptySource() throws IOException {
        PropertySource<?> source = new YamlPropertySourceFactory()
                .createPropertySource(null, new EncodedResource(new ClassPathResource("no-such-file.yml")));

        assertThat(source.getName()).isEqualTo("no-such-file.yml");
        assertThat(source.getProperty("working-hours.types.student.start")).isNull();
    }
}
