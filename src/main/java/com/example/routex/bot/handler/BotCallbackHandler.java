package com.example.routex.bot.handler;

import com.example.routex.bot.service.AdminRegistry;
import com.example.routex.service.BroadcastEngine;
import com.example.routex.service.EngineConfigurationException;
import com.example.routex.service.schedule.InvalidScheduleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;

/**
 * Inline-button actions on the schedule list.
 */
@Service
@Slf4j
public class BotCallbackHandler {

    static final String PAUSE_PREFIX = "pause_sched:";
    static final String RESUME_PREFIX = "resume_sched:";
    static final String DELETE_PREFIX = "delete_sched:";

    private final BroadcastEngine broadcastEngine;
    private final AdminRegistry adminRegistry;

    public BotCallbackHandler(BroadcastEngine broadcastEngine, AdminRegistry adminRegistry) {
        this.broadcastEngine = broadcastEngine;
        this.adminRegistry = adminRegistry;
    }

    public void handle(CallbackQuery callbackQuery, TelegramMessageHelper messageHelper) {
        String callbackData = callbackQuery.getData();
        Long telegramId = callbackQuery.getFrom().getId();
        String callbackQueryId = callbackQuery.getId();

        String answerText;
        boolean showAlert = false;

        try {
            log.info("Received callback query from user {}: {}", telegramId, callbackData);

            if (callbackData == null) {
                answerText = "Error: Empty callback data.";
                showAlert = true;
            } else if (!adminRegistry.isAdmin(telegramId)) {
                answerText = "Error: Administrators only.";
                showAlert = true;
            } else if (callbackData.startsWith(PAUSE_PREFIX)) {
                answerText = handleToggle(callbackQuery, parseId(callbackData, PAUSE_PREFIX), false, telegramId, messageHelper);
                showAlert = answerText.startsWith("Error:");
            } else if (callbackData.startsWith(RESUME_PREFIX)) {
                answerText = handleToggle(callbackQuery, parseId(callbackData, RESUME_PREFIX), true, telegramId, messageHelper);
                showAlert = answerText.startsWith("Error:");
            } else if (callbackData.startsWith(DELETE_PREFIX)) {
                answerText = handleDelete(callbackQuery, parseId(callbackData, DELETE_PREFIX), telegramId, messageHelper);
                showAlert = answerText.startsWith("Error:");
            } else {
                log.warn("Received unknown callback data: {}", callbackData);
                answerText = "Unknown action";
                showAlert = true;
            }
        } catch (NumberFormatException e) {
            log.warn("Malformed schedule id in callback data: {}", callbackData);
            answerText = "Error: Invalid schedule ID.";
            showAlert = true;
        } catch (InvalidScheduleException | EngineConfigurationException e) {
            answerText = "Error: " + e.getMessage();
            showAlert = true;
        } catch (Exception e) {
            log.error("Error processing callback query: " + callbackData, e);
            answerText = "Error processing action";
            showAlert = true;
        }
        messageHelper.sendAnswerCallbackQuery(callbackQueryId, answerText, showAlert);
    }

    private String handleToggle(CallbackQuery callbackQuery, long scheduleId, boolean enabled, Long actorId,
                                TelegramMessageHelper messageHelper) {
        if (!broadcastEngine.toggle(scheduleId, enabled, actorId)) {
            return "Error: Schedule not found.";
        }
        markMessage(callbackQuery, "Schedule #" + scheduleId + (enabled ? " resumed." : " paused."), messageHelper);
        return enabled ? "Resumed." : "Paused.";
    }

    private String handleDelete(CallbackQuery callbackQuery, long scheduleId, Long actorId, TelegramMessageHelper messageHelper) {
        if (!broadcastEngine.delete(scheduleId, actorId)) {
            return "Error: Schedule not found.";
        }
        markMessage(callbackQuery, "Schedule #" + scheduleId + " deleted.", messageHelper);
        return "Deleted.";
    }

    private void markMessage(CallbackQuery callbackQuery, String text, TelegramMessageHelper messageHelper) {
        if (callbackQuery.getMessage() == null) return;
        EditMessageText edit = EditMessageText.builder()
                .chatId(String.valueOf(callbackQuery.getMessage().getChatId()))
                .messageId(callbackQuery.getMessage().getMessageId())
                .text(text)
                .build();
        messageHelper.editMessage(edit);
    }

    private static long parseId(String callbackData, String prefix) {
        return Long.parseLong(callbackData.substring(prefix.length()));
    }
}
