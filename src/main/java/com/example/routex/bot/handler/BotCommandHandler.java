package com.example.routex.bot.handler;

import com.example.routex.bot.service.AdminRegistry;
import com.example.routex.model.BroadcastSchedule;
import com.example.routex.model.segment.Segment;
import com.example.routex.service.BroadcastEngine;
import com.example.routex.service.EngineConfigurationException;
import com.example.routex.service.SubscriberService;
import com.example.routex.service.delivery.DeliveryReport;
import com.example.routex.service.schedule.InvalidScheduleException;
import com.example.routex.service.segment.InvalidSegmentException;
import com.example.routex.service.segment.SegmentCodec;
import com.example.routex.service.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Service
@Slf4j
public class BotCommandHandler {

    private static final DateTimeFormatter NEXT_RUN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int STATS_SCHEDULE_LIMIT = 5;

    private final BroadcastEngine broadcastEngine;
    private final SubscriberService subscriberService;
    private final ScheduleStore scheduleStore;
    private final SegmentCodec segmentCodec;
    private final AdminRegistry adminRegistry;
    private final String donateUrl;

    public BotCommandHandler(BroadcastEngine broadcastEngine,
                             SubscriberService subscriberService,
                             ScheduleStore scheduleStore,
                             SegmentCodec segmentCodec,
                             AdminRegistry adminRegistry,
                             @Value("${app.donate.url:}") String donateUrl) {
        this.broadcastEngine = broadcastEngine;
        this.subscriberService = subscriberService;
        this.scheduleStore = scheduleStore;
        this.segmentCodec = segmentCodec;
        this.adminRegistry = adminRegistry;
        this.donateUrl = donateUrl;
    }

    public void handle(Message message, String command, String commandArgs,
                       TelegramMessageHelper messageHelper, ExecutorService taskExecutor) {
        long chatId = message.getChatId();
        Long telegramId = message.getFrom().getId();

        switch (command) {
            case "/start":
                handleStartCommand(chatId, message.getFrom().getFirstName(), messageHelper);
                return;
            case "/help":
                handleHelpCommand(chatId, messageHelper);
                return;
            case "/optout":
                subscriberService.setSubscription(telegramId, false);
                messageHelper.sendPlainTextMessage(chatId, "You have unsubscribed from broadcasts. Come back any time with /optin.");
                return;
            case "/optin":
                subscriberService.setSubscription(telegramId, true);
                messageHelper.sendPlainTextMessage(chatId, "Great! You will receive important news and reminders again.");
                return;
            case "/donate":
                handleDonateCommand(chatId, telegramId, messageHelper);
                return;
            default:
                break;
        }

        if (!isAdminCommand(command)) {
            messageHelper.sendMessage(chatId, "Sorry, I don't understand that command\\. Try `/help`\\.");
            return;
        }
        if (!adminRegistry.isAdmin(telegramId)) {
            log.warn("Non-admin user {} tried admin command {}", telegramId, command);
            messageHelper.sendPlainTextMessage(chatId, "⛔ This command is available to administrators only.");
            return;
        }

        try {
            switch (command) {
                case "/admin":
                    handleAdminCommand(chatId, messageHelper);
                    break;
                case "/schedules":
                    handleListSchedulesCommand(chatId, messageHelper);
                    break;
                case "/schedule_add":
                    handleScheduleAddCommand(chatId, telegramId, commandArgs, messageHelper);
                    break;
                case "/broadcast":
                    handleBroadcastCommand(chatId, telegramId, commandArgs, messageHelper, taskExecutor);
                    break;
                case "/event_template":
                    handleEventTemplateCommand(chatId, telegramId, commandArgs, messageHelper);
                    break;
                case "/stats":
                    handleStatsCommand(chatId, messageHelper);
                    break;
                default:
                    break;
            }
        } catch (InvalidScheduleException | InvalidSegmentException | EngineConfigurationException e) {
            log.info("Admin command {} rejected: {}", command, e.getMessage());
            messageHelper.sendPlainTextMessage(chatId, "❌ " + e.getMessage());
        }
    }

    static boolean isAdminCommand(String command) {
        switch (command) {
            case "/admin":
            case "/schedules":
            case "/schedule_add":
            case "/broadcast":
            case "/event_template":
            case "/stats":
                return true;
            default:
                return false;
        }
    }

    private void handleStartCommand(long chatId, String firstName, TelegramMessageHelper messageHelper) {
        String name = firstName != null ? firstName : "friend";
        messageHelper.sendMessage(chatId, "Hello, " + messageHelper.escapeMarkdownV2(name) + "\\! Welcome to RouteX VPN\\.\n" +
                                          "You are subscribed to service news\\.\n" +
                                          "➡️ Use `/optout` to stop broadcasts, `/optin` to get them back\\.\n" +
                                          "➡️ Use `/donate` to support the project\\.");
    }

    private void handleHelpCommand(long chatId, TelegramMessageHelper messageHelper) {
        messageHelper.sendPlainTextMessage(chatId, "Available commands:\n" +
                                                   "/start - Start interaction\n" +
                                                   "/optout - Stop receiving broadcasts\n" +
                                                   "/optin - Receive broadcasts again\n" +
                                                   "/donate - Support the project\n" +
                                                   "/help - Show this help");
    }

    private void handleDonateCommand(long chatId, Long telegramId, TelegramMessageHelper messageHelper) {
        subscriberService.markDonor(telegramId);
        String text = "Thank you for supporting RouteX! Every donation keeps the servers running.";
        if (donateUrl == null || donateUrl.isBlank()) {
            messageHelper.sendPlainTextMessage(chatId, text);
            return;
        }
        SendMessage donateMessage = SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .replyMarkup(InlineKeyboardMarkup.builder()
                        .keyboardRow(List.of(InlineKeyboardButton.builder().text("💳 Donate").url(donateUrl).build()))
                        .build())
                .build();
        messageHelper.sendWithFallbacks(donateMessage);
    }

    private void handleAdminCommand(long chatId, TelegramMessageHelper messageHelper) {
        messageHelper.sendPlainTextMessage(chatId, "Admin commands:\n" +
                                                   "/schedules - List schedules (pause, resume, delete)\n" +
                                                   "/schedule_add name | cron|interval | spec | segment | text\n" +
                                                   "    cron spec: 0 10 * * 1\n" +
                                                   "    interval spec: hours=2, minutes=30\n" +
                                                   "/broadcast segment | text - Send right now\n" +
                                                   "/event_template type | text - Template for webhook events\n" +
                                                   "/stats - Subscriber and delivery statistics\n\n" +
                                                   "Segments: all_subscribed, no_key, inactive_for:14, inactive_30d, donors,\n" +
                                                   "or JSON such as {\"type\":\"custom_filter\",\"expression\":\"is_donor = true\"}\n" +
                                                   "Placeholders: {username}, {key}");
    }

    private void handleListSchedulesCommand(long chatId, TelegramMessageHelper messageHelper) {
        List<BroadcastSchedule> schedules = broadcastEngine.listSchedules();
        if (schedules.isEmpty()) {
            messageHelper.sendMessage(chatId, "There are no schedules yet\\. Use `/schedule_add` to create one\\.");
            return;
        }

        messageHelper.sendMessage(chatId, "Schedules \\(tap to manage\\):");

        for (BroadcastSchedule schedule : schedules) {
            String status = schedule.isEnabled() ? "✅ Active" : "⏸️ Paused";
            String text = String.format(
                    "*Name:* `%s` \\(%s\\)\n" +
                    "*ID:* `%d`\n" +
                    "*Trigger:* `%s %s`\n" +
                    "*Segment:* `%s`\n" +
                    "*Next Run \\(UTC\\):* `%s`",
                    messageHelper.escapeMarkdownV2(schedule.getName()),
                    status,
                    schedule.getId(),
                    messageHelper.escapeMarkdownV2(schedule.getTriggerKind()),
                    messageHelper.escapeMarkdownV2(schedule.getTriggerSpec()),
                    messageHelper.escapeMarkdownV2(schedule.getSegmentJson()),
                    messageHelper.escapeMarkdownV2(schedule.getNextRunAt() != null ? schedule.getNextRunAt().format(NEXT_RUN_FORMAT) : "N/A")
            );

            List<InlineKeyboardButton> rowButtons = new ArrayList<>();
            if (schedule.isEnabled()) {
                rowButtons.add(InlineKeyboardButton.builder()
                        .text("⏸️ Pause")
                        .callbackData(BotCallbackHandler.PAUSE_PREFIX + schedule.getId())
                        .build());
            } else {
                rowButtons.add(InlineKeyboardButton.builder()
                        .text("▶️ Resume")
                        .callbackData(BotCallbackHandler.RESUME_PREFIX + schedule.getId())
                        .build());
            }
            rowButtons.add(InlineKeyboardButton.builder()
                    .text("❌ Delete")
                    .callbackData(BotCallbackHandler.DELETE_PREFIX + schedule.getId())
                    .build());

            SendMessage scheduleMessage = SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode("MarkdownV2")
                    .replyMarkup(InlineKeyboardMarkup.builder().keyboardRow(rowButtons).build())
                    .build();
            messageHelper.sendWithFallbacks(scheduleMessage);
        }
    }

    private void handleScheduleAddCommand(long chatId, Long telegramId, String commandArgs, TelegramMessageHelper messageHelper) {
        String[] parts = splitArgs(commandArgs, 5);
        if (parts == null) {
            messageHelper.sendPlainTextMessage(chatId, "Usage: /schedule_add name | cron|interval | spec | segment | text");
            return;
        }
        Segment segment = segmentCodec.parse(parts[3]);
        BroadcastSchedule schedule = broadcastEngine.addSchedule(parts[0], parts[1], parts[2], parts[4], segment, telegramId);
        messageHelper.sendPlainTextMessage(chatId, String.format("✅ Schedule #%d '%s' created (%s %s, segment %s).",
                schedule.getId(), schedule.getName(), schedule.getTriggerKind(), schedule.getTriggerSpec(), segment.tag()));
    }

    private void handleBroadcastCommand(long chatId, Long telegramId, String commandArgs,
                                        TelegramMessageHelper messageHelper, ExecutorService taskExecutor) {
        String[] parts = splitArgs(commandArgs, 2);
        if (parts == null) {
            messageHelper.sendPlainTextMessage(chatId, "Usage: /broadcast segment | text");
            return;
        }
        Segment segment = segmentCodec.parse(parts[0]);
        String text = parts[1];
        messageHelper.sendPlainTextMessage(chatId, "📣 Broadcast to segment '" + segment.tag() + "' started.");
        taskExecutor.submit(() -> {
            try {
                DeliveryReport report = broadcastEngine.broadcastNow(text, segment, telegramId);
                messageHelper.sendPlainTextMessage(chatId, String.format("✅ Broadcast finished. Queued: %d, sent: %d, failed: %d.",
                        report.queued(), report.sent(), report.failed()));
            } catch (InvalidSegmentException | InvalidScheduleException e) {
                messageHelper.sendPlainTextMessage(chatId, "❌ " + e.getMessage());
            } catch (Exception e) {
                log.error("Broadcast requested by {} failed", telegramId, e);
                messageHelper.sendPlainTextMessage(chatId, "❌ Broadcast failed: " + e.getMessage());
            }
        });
    }

    private void handleEventTemplateCommand(long chatId, Long telegramId, String commandArgs, TelegramMessageHelper messageHelper) {
        String[] parts = splitArgs(commandArgs, 2);
        if (parts == null) {
            messageHelper.sendPlainTextMessage(chatId, "Usage: /event_template type | text\nPlaceholders: {greeting}, {payload_message}");
            return;
        }
        broadcastEngine.setEventTemplate(parts[0], parts[1], telegramId);
        messageHelper.sendPlainTextMessage(chatId, "✅ Template for event '" + parts[0] + "' saved.");
    }

    private void handleStatsCommand(long chatId, TelegramMessageHelper messageHelper) {
        SubscriberService.SubscriberTotals totals = subscriberService.totals();
        StringBuilder sb = new StringBuilder();
        sb.append("📊 Statistics\n")
                .append("Users: ").append(totals.total()).append('\n')
                .append("Subscribed: ").append(totals.subscribed()).append('\n')
                .append("Unsubscribed: ").append(totals.unsubscribed()).append('\n')
                .append("Donors: ").append(totals.donors()).append('\n');
        List<ScheduleStore.ScheduleDeliveryCounts> recent = scheduleStore.recentScheduleDeliveryCounts(STATS_SCHEDULE_LIMIT);
        if (!recent.isEmpty()) {
            sb.append("\nRecent schedules:\n");
            for (ScheduleStore.ScheduleDeliveryCounts counts : recent) {
                sb.append("#").append(counts.scheduleId())
                        .append(": sent ").append(counts.sent())
                        .append(", failed ").append(counts.failed()).append('\n');
            }
        }
        messageHelper.sendPlainTextMessage(chatId, sb.toString());
    }

    /**
     * Splits "a | b | c" into exactly {@code count} trimmed parts; the last part keeps any further '|'.
     *
     * @return {@code null} if there are fewer parts or one of them is empty
     */
    static String[] splitArgs(String commandArgs, int count) {
        if (commandArgs == null) {
            return null;
        }
        String[] parts = commandArgs.split("\\|", count);
        if (parts.length != count) {
            return null;
        }
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
            if (parts[i].isEmpty()) {
                return null;
            }
        }
        return parts;
    }
}
