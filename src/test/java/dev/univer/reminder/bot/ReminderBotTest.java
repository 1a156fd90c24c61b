package dev.univer.reminder.bot;

import dev.univer.reminder.format.JobFormatter;
import dev.univer.reminder.model.ChatSettings;
import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.JobMessageInfo;
import dev.univer.reminder.model.SingleShotDefinition;
import dev.univer.reminder.parser.ParseFailure;
import dev.univer.reminder.parser.ParseResult;
import dev.univer.reminder.schedule.JobPersistenceException;
import dev.univer.reminder.schedule.SpecUpdateException;
import dev.univer.reminder.service.ChatSettingsService;
import dev.univer.reminder.service.ReminderService;
import dev.univer.reminder.service.TelegramSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderBotTest {

    private static final long CHAT = -100L;
    private static final ZoneId UTC = ZoneId.of("UTC");

    @Mock
    private ChatSettingsService settingsService;
    @Mock
    private ReminderService reminderService;
    @Mock
    private TelegramSender sender;

    private ReminderBot bot;

    @BeforeEach
    void setUp() {
        bot = new ReminderBot(settingsService, reminderService, new JobFormatter(), sender);
        ChatSettings settings = ChatSettings.builder().chatId(CHAT).zoneId("UTC").build();
        when(settingsService.ensure(eq(CHAT), any())).thenReturn(settings);
        when(settingsService.zoneFor(settings)).thenReturn(UTC);
    }

    private static Update update(String text) {
        return update(text, new Chat(CHAT, "supergroup"));
    }

    private static Update update(String text, Chat chat) {
        User user = new User(42L, "Alice", false);
        user.setUserName("alice");
        Message msg = new Message();
        msg.setChat(chat);
        msg.setFrom(user);
        msg.setText(text);
        Update update = new Update();
        update.setMessage(msg);
        return update;
    }

    private static Job job(long id, String room) {
        return job(id, room, "@alice");
    }

    private static Job job(long id, String room, String userId) {
        return Job.builder()
                .id(id)
                .messageInfo(JobMessageInfo.builder().userId(userId).room(room).message(userId + ", stretch").build())
                .spec(SingleShotDefinition.of(1, 10, 5))
                .next(Instant.parse("2024-01-01T10:05:00Z"))
                .build();
    }

    @Test
    void createsReminderFromPlainText() throws Exception {
        String text = "remind me in 5 minutes to stretch";
        when(reminderService.addJobFromText(text, new Envelope("@alice", "-100", null), UTC))
                .thenReturn(ParseResult.success(job(1, "-100")));

        bot.onUpdate(update(text));

        verify(sender).send(eq(CHAT), isNull(), startsWith("✅ Scheduled:\nID 1: Mon, Jan 1, 2024 10:05 AM UTC"));
    }

    @Test
    void slashRemindAddsTheLeadIn() throws Exception {
        when(reminderService.addJobFromText(eq("remind team every Monday to plan"), any(), eq(UTC)))
                .thenReturn(ParseResult.success(job(2, "-100")));

        bot.onUpdate(update("/remind@reminder_bot team every Monday to plan"));

        verify(sender).send(eq(CHAT), isNull(), startsWith("✅ Scheduled:"));
    }

    @Test
    void repliesWithParseFailure() throws Exception {
        when(reminderService.addJobFromText(any(), any(), any()))
                .thenReturn(ParseResult.failure(ParseFailure.of(ParseFailure.Reason.NO_SCHEDULE)));

        bot.onUpdate(update("remind me to do it"));

        verify(sender).send(eq(CHAT), isNull(), startsWith("❌ I couldn't find a schedule"));
    }

    @Test
    void interactiveRemindWaitsForTheNextMessage() throws Exception {
        when(reminderService.addJobFromText(eq("remind me in 5 minutes to stretch"), any(), eq(UTC)))
                .thenReturn(ParseResult.success(job(1, "-100")));

        bot.onUpdate(update("/remind"));
        bot.onUpdate(update("me in 5 minutes to stretch"));

        verify(sender).send(eq(CHAT), isNull(), contains("waiting for your next message"));
        verify(sender).send(eq(CHAT), isNull(), startsWith("✅ Scheduled:"));
    }

    @Test
    void listsOnlyThisChatsReminders() throws Exception {
        when(reminderService.jobsForRooms("-100")).thenReturn(List.of(job(1, "-100")));

        bot.onUpdate(update("/reminders"));

        verify(sender).send(eq(CHAT), isNull(), startsWith("ID 1:"));
    }

    @Test
    void listAllOnlyAnswersInPrivateWithTheCallersReminders() throws Exception {
        ChatSettings dm = ChatSettings.builder().chatId(42L).zoneId("UTC").build();
        when(settingsService.ensure(eq(42L), any())).thenReturn(dm);
        when(settingsService.zoneFor(dm)).thenReturn(UTC);
        when(reminderService.jobsForRooms()).thenReturn(List.of(
                job(1, "-100"), job(2, "-200", "@bob"), job(3, "-300")));

        bot.onUpdate(update("/reminders all"));
        bot.onUpdate(update("/reminders all", new Chat(42L, "private")));

        verify(sender).send(eq(CHAT), isNull(), contains("private chat"));
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(sender).send(eq(42L), isNull(), text.capture());
        assertThat(text.getValue()).contains("ID 1:", "ID 3:").doesNotContain("ID 2:");
        verify(reminderService).jobsForRooms();
    }

    @Test
    void emptyList() throws Exception {
        when(reminderService.jobsForRooms("-100")).thenReturn(List.of());

        bot.onUpdate(update("/reminders"));

        verify(sender).send(CHAT, null, "No reminders in this chat.");
    }

    @Test
    void cannotCancelAnotherChatsReminder() throws Exception {
        when(reminderService.findJob(5L)).thenReturn(Optional.of(job(5, "-999")));

        bot.onUpdate(update("/reminder_cancel 5"));

        verify(sender).send(CHAT, null, "No reminder with ID 5 in this chat.");
        verify(reminderService, never()).removeJob(anyLong());
    }

    @Test
    void cancelAliases() throws Exception {
        Job job = job(5, "-100");
        when(reminderService.findJob(5L)).thenReturn(Optional.of(job));
        when(reminderService.removeJob(5L)).thenReturn(Optional.of(job));

        bot.onUpdate(update("/reminder_delete 5"));

        verify(sender).send(eq(CHAT), isNull(), startsWith("Cancelled:\nID 5:"));
    }

    @Test
    void updateMessage() throws Exception {
        Job job = job(5, "-100");
        when(reminderService.findJob(5L)).thenReturn(Optional.of(job));
        when(reminderService.updateJobMessage(5L, "drink water"))
                .thenReturn(Optional.of(job.withMessageInfo(job.getMessageInfo().withMessage("drink water"))));

        bot.onUpdate(update("/reminder_update 5 drink water"));

        verify(sender).send(eq(CHAT), isNull(), contains(">drink water"));
    }

    @Test
    void badRescheduleKeepsTheReminder() throws Exception {
        when(reminderService.findJob(5L)).thenReturn(Optional.of(job(5, "-100")));
        when(reminderService.updateJobSpec(5L, "every blorf", UTC))
                .thenThrow(new SpecUpdateException(5L, ParseFailure.of(ParseFailure.Reason.NO_SCHEDULE)));

        bot.onUpdate(update("/reminder_reschedule 5 every blorf"));

        verify(sender).send(eq(CHAT), isNull(), contains("Reminder 5 is unchanged."));
    }

    @Test
    void saveFailureIsReported() throws Exception {
        when(reminderService.addJobFromText(any(), any(), any()))
                .thenThrow(new JobPersistenceException("Failed to save", new IllegalStateException("disk full")));

        bot.onUpdate(update("remind me in 5 minutes to stretch"));

        verify(sender).send(eq(CHAT), isNull(), startsWith("❌ Sorry, I couldn't save that."));
    }

    @Test
    void setsTimezone() throws Exception {
        bot.onUpdate(update("/tz Europe/Berlin"));

        verify(settingsService).updateTimezone(CHAT, ZoneId.of("Europe/Berlin"));
        verify(sender).send(CHAT, null, "Timezone for this chat: Europe/Berlin");
    }

    @Test
    void rejectsUnknownTimezone() throws Exception {
        bot.onUpdate(update("/tz Mars/Olympus"));

        verify(settingsService, never()).updateTimezone(anyLong(), any());
        verify(sender).send(eq(CHAT), isNull(), startsWith("Unknown timezone"));
    }
}
