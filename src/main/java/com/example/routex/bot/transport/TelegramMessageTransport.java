package com.example.routex.bot.transport;

import com.example.routex.service.delivery.MessageTransport;
import com.example.routex.service.delivery.SendOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.List;
import java.util.Locale;

/**
 * Sends broadcast messages through the Bot API and maps API errors onto {@link SendOutcome}s.
 * The bot attaches itself once it is registered; until then every send is a transient failure.
 */
@Component
@Slf4j
public class TelegramMessageTransport implements MessageTransport {

    private static final int DEFAULT_RETRY_AFTER_SECONDS = 1;
    private static final List<String> UNREACHABLE_CHAT_MARKERS = List.of(
            "chat not found", "user not found", "user is deactivated", "bot was blocked", "bot was kicked");

    private volatile AbsSender sender;

    public void attach(AbsSender sender) {
        this.sender = sender;
    }

    @Override
    public SendOutcome send(long chatId, String text) {
        AbsSender current = sender;
        if (current == null) {
            return SendOutcome.transientFailure("Telegram bot is not registered yet");
        }
        SendMessage message = SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .parseMode(ParseMode.HTML)
                .build();
        try {
            current.execute(message);
            return SendOutcome.delivered();
        } catch (TelegramApiRequestException e) {
            ResponseParameters parameters = e.getParameters();
            Integer retryAfter = parameters != null ? parameters.getRetryAfter() : null;
            return classify(e.getErrorCode(), e.getApiResponse() != null ? e.getApiResponse() : e.getMessage(), retryAfter);
        } catch (TelegramApiException e) {
            return SendOutcome.transientFailure(e.getMessage());
        }
    }

    static SendOutcome classify(Integer errorCode, String description, Integer retryAfter) {
        String reason = description != null ? description : "Telegram API error " + errorCode;
        if (errorCode == null) {
            return SendOutcome.transientFailure(reason);
        }
        if (errorCode == 429) {
            int seconds = retryAfter != null && retryAfter > 0 ? retryAfter : DEFAULT_RETRY_AFTER_SECONDS;
            return SendOutcome.rateLimited(seconds);
        }
        if (errorCode == 403 || errorCode == 404) {
            return SendOutcome.permanentFailure(reason);
        }
        if (errorCode == 400 && mentionsUnreachableChat(reason)) {
            return SendOutcome.permanentFailure(reason);
        }
        return SendOutcome.transientFailure(reason);
    }

    private static boolean mentionsUnreachableChat(String description) {
        String lower = description.toLowerCase(Locale.ROOT);
        return UNREACHABLE_CHAT_MARKERS.stream().anyMatch(lower::contains);
    }
}
