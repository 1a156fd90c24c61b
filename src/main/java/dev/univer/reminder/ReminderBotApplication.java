package dev.univer.reminder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReminderBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReminderBotApplication.class, args);
    }
}
