package dev.univer.reminder.config;

import dev.univer.reminder.schedule.SchedulerState;
import dev.univer.reminder.schedule.SchedulerTimer;
import dev.univer.reminder.schedule.TaskSchedulerTimer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulerState schedulerState() {
        return new SchedulerState();
    }

    // one thread: the store and the loop are not synchronized
    @Bean
    public ThreadPoolTaskScheduler reminderTaskScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reminder-scheduler-");
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public SchedulerTimer schedulerTimer(ThreadPoolTaskScheduler reminderTaskScheduler, Clock clock) {
        return new TaskSchedulerTimer(reminderTaskScheduler, clock);
    }
}
