package dev.univer.reminder.repo;

import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.JobMessageInfo;
import dev.univer.reminder.model.MonthlyDefinition;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.model.SingleShotDefinition;
import dev.univer.reminder.model.WeeklyDefinition;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaJobStorage.class)
class JpaJobStorageTest {

    @Autowired
    private JpaJobStorage storage;

    @Autowired
    private ReminderJobRepository repo;

    private static Job job(long id, RecurrenceDefinition spec, String next, String threadId) {
        return Job.builder()
                .id(id)
                .messageInfo(JobMessageInfo.builder()
                        .userId("@alice")
                        .room("-100")
                        .threadId(threadId)
                        .message("@alice, line one\nline two")
                        .build())
                .spec(spec)
                .next(Instant.parse(next))
                .build();
    }

    @Test
    void roundTripsEveryKindInQueueOrder() {
        List<Job> jobs = List.of(
                job(3, SingleShotDefinition.of(11, 16, 33), "2022-12-08T16:33:00Z", null),
                job(1, new WeeklyDefinition(List.of(1, 3, 5), 2, 9, 0), "2022-12-09T09:00:00Z", "42"),
                job(2, new MonthlyDefinition(31, 23, 30), "2022-12-31T23:30:00Z", null));

        storage.save("jobs", jobs);

        assertThat(storage.load("jobs")).contains(jobs);
    }

    @Test
    void nothingSavedIsEmpty() {
        assertThat(storage.load("jobs")).isEmpty();
    }

    @Test
    void saveReplacesOnlyItsOwnKey() {
        storage.save("jobs", List.of(job(1, SingleShotDefinition.of(2, 9, 0), "2024-01-02T09:00:00Z", null)));
        storage.save("other", List.of(job(9, SingleShotDefinition.of(3, 9, 0), "2024-01-03T09:00:00Z", null)));

        Job replacement = job(2, new MonthlyDefinition(5, 0, 0), "2024-02-05T00:00:00Z", null);
        storage.save("jobs", List.of(replacement));

        assertThat(storage.load("jobs")).contains(List.of(replacement));
        assertThat(repo.countByStorageKey("jobs")).isEqualTo(1);
        assertThat(repo.countByStorageKey("other")).isEqualTo(1);
    }

    @Test
    void emptySnapshotClearsTheKey() {
        storage.save("jobs", List.of(job(1, SingleShotDefinition.of(2, 9, 0), "2024-01-02T09:00:00Z", null)));

        storage.save("jobs", List.of());

        assertThat(storage.load("jobs")).isEmpty();
    }
}
