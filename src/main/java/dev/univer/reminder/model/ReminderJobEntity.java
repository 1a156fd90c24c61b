package dev.univer.reminder.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "reminder_job", indexes = {
        @Index(name = "idx_reminder_job_key_order", columnList = "storageKey, queueOrder")
})
public class ReminderJobEntity {

    public enum Kind { SINGLE, WEEKLY, MONTHLY }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long rowId;

    @Column(nullable = false, length = 64)
    private String storageKey;

    @Column(nullable = false)
    private Long jobId;

    @Column(nullable = false)
    private int queueOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Kind kind;

    // comma separated, e.g. "1,2,3,4,5"
    @Column(length = 64)
    private String daysOfWeek;

    private Integer repeatInterval;
    private Integer dayOfMonth;

    private int hourOfDay;
    private int minuteOfHour;

    @Column(nullable = false)
    private String userId;
    @Column(nullable = false)
    private String room;
    private String threadId;

    @Column(length = 4096, nullable = false)
    private String message;

    @Column(nullable = false)
    private Instant nextRun;

    public static ReminderJobEntity fromJob(String storageKey, Job job, int queueOrder) {
        JobMessageInfo info = job.getMessageInfo();
        ReminderJobEntity.ReminderJobEntityBuilder b = ReminderJobEntity.builder()
                .storageKey(storageKey)
                .jobId(job.getId())
                .queueOrder(queueOrder)
                .hourOfDay(job.getSpec().getHour())
                .minuteOfHour(job.getSpec().getMinute())
                .userId(info.getUserId())
                .room(info.getRoom())
                .threadId(info.getThreadId())
                .message(info.getMessage())
                .nextRun(job.getNext());

        RecurrenceDefinition spec = job.getSpec();
        if (spec instanceof MonthlyDefinition monthly) {
            b.kind(Kind.MONTHLY).dayOfMonth(monthly.getDayOfMonth());
        } else if (spec instanceof WeeklyDefinition weekly) {
            b.kind(Kind.WEEKLY).daysOfWeek(joinDays(weekly.getDaysOfWeek())).repeatInterval(weekly.getInterval());
        } else if (spec instanceof SingleShotDefinition single) {
            b.kind(Kind.SINGLE).daysOfWeek(joinDays(single.getDaysOfWeek()));
        } else {
            throw new IllegalArgumentException("Unsupported recurrence definition: " + spec);
        }
        return b.build();
    }

    public Job toJob() {
        RecurrenceDefinition spec = switch (kind) {
            case SINGLE -> new SingleShotDefinition(splitDays(daysOfWeek), hourOfDay, minuteOfHour);
            case WEEKLY -> new WeeklyDefinition(splitDays(daysOfWeek), repeatInterval == null ? 1 : repeatInterval, hourOfDay, minuteOfHour);
            case MONTHLY -> new MonthlyDefinition(dayOfMonth, hourOfDay, minuteOfHour);
        };
        return Job.builder()
                .id(jobId)
                .messageInfo(JobMessageInfo.builder()
                        .userId(userId)
                        .room(room)
                        .threadId(threadId)
                        .message(message)
                        .build())
                .spec(spec)
                .next(nextRun)
                .build();
    }

    private static String joinDays(List<Integer> days) {
        return days.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static List<Integer> splitDays(String days) {
        if (days == null || days.isBlank()) return List.of();
        return Arrays.stream(days.split(",")).map(String::trim).map(Integer::valueOf).toList();
    }
}
