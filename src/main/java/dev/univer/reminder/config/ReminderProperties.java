package dev.univer.reminder.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "reminder")
@Getter @Setter
public class ReminderProperties {
    // key the job snapshot is stored under
    private String storageKey = "jobs";
}
