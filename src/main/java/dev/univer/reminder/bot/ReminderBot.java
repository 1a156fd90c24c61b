package dev.univer.reminder.bot;

import dev.univer.reminder.format.JobFormatter;
import dev.univer.reminder.model.ChatSettings;
import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.parser.ParseResult;
import dev.univer.reminder.schedule.JobPersistenceException;
import dev.univer.reminder.schedule.SpecUpdateException;
import dev.univer.reminder.service.ChatSettingsService;
import dev.univer.reminder.service.ReminderService;
import dev.univer.reminder.service.TelegramSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderBot {

    private final ChatSettingsService settingsService;
    private final ReminderService reminderService;
    private final JobFormatter formatter;
    private final TelegramSender sender;

    // ====== waiting for the next message of an interactive command ======
    private enum Action { REMIND, TZ }
    private record Pending(Action action, Long userId) {}
    private final Map<Long, Pending> pendingByChat = new ConcurrentHashMap<>();

    private static final String MENTION_OPT = "(?:@\\w+)?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern HELP         = Pattern.compile("^/(start|help)" + MENTION_OPT + "\\s*$", FLAGS);
    private static final Pattern REMIND_TEXT  = Pattern.compile("^remind\\s+(?:me|team|here|room)\\b.*$", FLAGS);
    private static final Pattern REMIND_CMD   = Pattern.compile("^/remind" + MENTION_OPT + "\\s+(.+)$", FLAGS);
    private static final Pattern REMIND_EMPTY = Pattern.compile("^/remind" + MENTION_OPT + "\\s*$", FLAGS);
    private static final Pattern LIST         = Pattern.compile("^/reminders" + MENTION_OPT + "\\s*$", FLAGS);
    private static final Pattern LIST_ALL     = Pattern.compile("^/reminders" + MENTION_OPT + "\\s+all\\s*$", FLAGS);
    private static final Pattern UPDATE       = Pattern.compile("^/reminder_update" + MENTION_OPT + "\\s+(\\d+)\\s+(.+)$", FLAGS);
    private static final Pattern RESCHEDULE   = Pattern.compile("^/reminder_reschedule" + MENTION_OPT + "\\s+(\\d+)\\s+(.+)$", FLAGS);
    private static final Pattern CANCEL       = Pattern.compile("^/reminder_(?:cancel|del|delete|remove)" + MENTION_OPT + "\\s+(\\d+)\\s*$", FLAGS);
    private static final Pattern TZ           = Pattern.compile("^/tz" + MENTION_OPT + "\\s+(\\S+)\\s*$", FLAGS);
    private static final Pattern TZ_EMPTY     = Pattern.compile("^/tz" + MENTION_OPT + "\\s*$", FLAGS);

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    private void handle(Update update) throws TelegramApiException {
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        Chat chat = msg.getChat();
        if (chat == null || !msg.hasText()) return;

        Long chatId = chat.getId();
        Integer threadId = Boolean.TRUE.equals(msg.getIsTopicMessage()) ? msg.getMessageThreadId() : null;
        ChatSettings s = settingsService.ensure(chatId, chat.getTitle());
        ZoneId zone = settingsService.zoneFor(s);
        String text = msg.getText().trim();
        Long fromId = msg.getFrom() != null ? msg.getFrom().getId() : null;
        Reply reply = new Reply(chatId, threadId);

        try {
            Pending pending = pendingByChat.get(chatId);
            if (pending != null && !text.startsWith("/")) {
                // answers from anyone but the initiator are ignored
                if (fromId == null || !fromId.equals(pending.userId())) return;
                pendingByChat.remove(chatId);
                switch (pending.action()) {
                    case REMIND -> remind(reply, msg.getFrom(), "remind " + text, zone);
                    case TZ -> setTimezone(reply, chatId, text);
                }
                return;
            }

            if (HELP.matcher(text).matches()) { reply.send(helpText(zone)); return; }

            if (REMIND_TEXT.matcher(text).matches()) { remind(reply, msg.getFrom(), text, zone); return; }
            Matcher m = REMIND_CMD.matcher(text);
            if (m.matches()) { remind(reply, msg.getFrom(), "remind " + m.group(1).trim(), zone); return; }
            if (REMIND_EMPTY.matcher(text).matches()) {
                ask(reply, fromId, Action.REMIND, "What should I remind, and when? E.g. \"me every Monday at 9 to send the report\"");
                return;
            }

            if (LIST.matcher(text).matches()) {
                List<Job> jobs = reminderService.jobsForRooms(chatId.toString());
                reply.send(jobs.isEmpty() ? "No reminders in this chat." : formatter.formatList(jobs, zone));
                return;
            }
            if (LIST_ALL.matcher(text).matches()) {
                if (!Boolean.TRUE.equals(chat.isUserChat())) {
                    reply.send("/reminders all lists your reminders from every chat. Send it to me in a private chat.");
                    return;
                }
                String me = userTag(msg.getFrom());
                List<Job> jobs = reminderService.jobsForRooms().stream()
                        .filter(j -> me.equals(j.getMessageInfo().getUserId()))
                        .toList();
                reply.send(jobs.isEmpty() ? "You have no reminders." : formatter.formatList(jobs, zone));
                return;
            }

            m = UPDATE.matcher(text);
            if (m.matches()) {
                long id = Long.parseLong(m.group(1));
                if (jobInChat(id, chatId).isEmpty()) { reply.send(notFound(id)); return; }
                reminderService.updateJobMessage(id, m.group(2).trim())
                        .ifPresentOrElse(j -> reply.sendQuietly("Updated:\n" + formatter.format(j, zone)),
                                () -> reply.sendQuietly(notFound(id)));
                return;
            }

            m = RESCHEDULE.matcher(text);
            if (m.matches()) {
                long id = Long.parseLong(m.group(1));
                if (jobInChat(id, chatId).isEmpty()) { reply.send(notFound(id)); return; }
                try {
                    reminderService.updateJobSpec(id, m.group(2).trim(), zone)
                            .ifPresentOrElse(j -> reply.sendQuietly("Rescheduled:\n" + formatter.format(j, zone)),
                                    () -> reply.sendQuietly(notFound(id)));
                } catch (SpecUpdateException e) {
                    reply.send("❌ " + e.getFailure().message() + " Reminder " + id + " is unchanged.");
                }
                return;
            }

            m = CANCEL.matcher(text);
            if (m.matches()) {
                long id = Long.parseLong(m.group(1));
                if (jobInChat(id, chatId).isEmpty()) { reply.send(notFound(id)); return; }
                reminderService.removeJob(id)
                        .ifPresentOrElse(j -> reply.sendQuietly("Cancelled:\n" + formatter.format(j, zone)),
                                () -> reply.sendQuietly(notFound(id)));
                return;
            }

            if (TZ_EMPTY.matcher(text).matches()) {
                ask(reply, fromId, Action.TZ, "Send a timezone in Area/City form, e.g. Europe/Berlin");
                return;
            }
            m = TZ.matcher(text);
            if (m.matches()) { setTimezone(reply, chatId, m.group(1)); }
        } catch (JobPersistenceException e) {
            log.error("Could not save reminders for chat {}", chatId, e);
            reply.send("❌ Sorry, I couldn't save that. Nothing was changed, please try again.");
        }
    }

    private void remind(Reply reply, User from, String text, ZoneId zone) throws TelegramApiException {
        Envelope envelope = new Envelope(userTag(from), reply.chatId().toString(),
                reply.threadId() == null ? null : reply.threadId().toString());
        ParseResult<Job> result = reminderService.addJobFromText(text, envelope, zone);
        if (!result.isSuccess()) {
            reply.send("❌ " + result.getFailure().message());
            return;
        }
        reply.send("✅ Scheduled:\n" + formatter.format(result.getValue(), zone));
    }

    private void setTimezone(Reply reply, Long chatId, String raw) throws TelegramApiException {
        ZoneId zone;
        try {
            zone = ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            reply.send("Unknown timezone \"" + raw.trim() + "\". Use Area/City, e.g. Europe/Berlin");
            return;
        }
        settingsService.updateTimezone(chatId, zone);
        reply.send("Timezone for this chat: " + zone.getId());
    }

    private Optional<Job> jobInChat(long id, Long chatId) {
        return reminderService.findJob(id).filter(j -> j.getMessageInfo().getRoom().equals(chatId.toString()));
    }

    private void ask(Reply reply, Long fromId, Action action, String prompt) throws TelegramApiException {
        pendingByChat.put(reply.chatId(), new Pending(action, fromId));
        reply.send(prompt + "\n(waiting for your next message)");
    }

    private static String userTag(User from) {
        if (from == null) return "someone";
        return from.getUserName() != null ? "@" + from.getUserName() : from.getId().toString();
    }

    private static String notFound(long id) {
        return "No reminder with ID " + id + " in this chat.";
    }

    private String helpText(ZoneId zone) {
        return String.join("\n", List.of(
                "I send reminders to this chat.",
                "",
                "Write: remind me|team|here|room <when> <what>, for example:",
                "• remind me in 5 minutes to stretch",
                "• remind me on Tuesday at 16:00 to ship",
                "• remind team every 2nd Friday at 09:00 to review",
                "• remind here every weekday at 9am to post standup notes",
                "• remind me every 5th to pay rent",
                "",
                "/reminders — list reminders in this chat",
                "/reminders all — in a private chat, your reminders from every chat",
                "/reminder_update <id> <text> — change the text",
                "/reminder_reschedule <id> <when> — change the schedule",
                "/reminder_cancel <id> — cancel",
                "/tz <Area/City> — timezone, now " + zone.getId()
        ));
    }

    private final class Reply {
        private final Long chatId;
        private final Integer threadId;

        Reply(Long chatId, Integer threadId) {
            this.chatId = chatId;
            this.threadId = threadId;
        }

        Long chatId() { return chatId; }
        Integer threadId() { return threadId; }

        void send(String text) throws TelegramApiException {
            sender.send(chatId, threadId, text);
        }

        void sendQuietly(String text) {
            try {
                send(text);
            } catch (TelegramApiException e) {
                log.warn("Failed to reply in chat {}: {}", chatId, e.getMessage());
            }
        }
    }
}
