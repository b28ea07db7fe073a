package com.example.routex.bot.handler;

import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replies to users and administrators. Failures are logged and never thrown back into update handling.
 */
@Slf4j
public class TelegramMessageHelper {

    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final Pattern MARKDOWN_V2_SPECIAL = Pattern.compile("[\\\\_*\\[\\]()~`>#+\\-=|{}.!]");

    private final AbsSender bot;

    public TelegramMessageHelper(AbsSender bot) {
        this.bot = bot;
    }

    /**
     * Sends MarkdownV2 text; if Telegram rejects the markup the same text goes out unformatted.
     */
    public void sendMessage(long chatId, String markdownText) {
        SendMessage message = SendMessage.builder()
                .chatId(chatId)
                .text(markdownText)
                .parseMode(ParseMode.MARKDOWNV2)
                .build();
        if (!execute(message, chatId)) {
            message.setParseMode(null);
            execute(message, chatId);
        }
    }

    /**
     * Sends plain text, split on line boundaries when it exceeds Telegram's message size.
     */
    public void sendPlainTextMessage(long chatId, String text) {
        for (String chunk : split(text, MAX_MESSAGE_LENGTH)) {
            execute(new SendMessage(String.valueOf(chatId), chunk), chatId);
        }
    }

    /**
     * Sends a prepared message, dropping the inline keyboard and then the parse mode if Telegram rejects it.
     */
    public void sendWithFallbacks(SendMessage message) {
        if (execute(message, message.getChatId())) {
            return;
        }
        if (message.getReplyMarkup() != null) {
            message.setReplyMarkup(null);
            if (execute(message, message.getChatId())) {
                return;
            }
        }
        if (message.getParseMode() != null) {
            message.setParseMode(null);
            if (execute(message, message.getChatId())) {
                return;
            }
        }
        log.error("Giving up on message to chat {} after all fallbacks", message.getChatId());
    }

    public void editMessage(EditMessageText editMessage) {
        execute(editMessage, editMessage.getChatId());
    }

    public void sendAnswerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        execute(AnswerCallbackQuery.builder()
                .callbackQueryId(callbackQueryId)
                .text(text)
                .showAlert(showAlert)
                .build(), "callback " + callbackQueryId);
    }

    public String escapeMarkdownV2(String text) {
        if (text == null) return "";
        return MARKDOWN_V2_SPECIAL.matcher(text).replaceAll(match -> Matcher.quoteReplacement("\\" + match.group()));
    }

    private <T extends Serializable> boolean execute(BotApiMethod<T> method, Object target) {
        try {
            bot.execute(method);
            return true;
        } catch (TelegramApiException e) {
            log.warn("{} to {} failed: {}", method.getMethod(), target, e.getMessage());
            return false;
        }
    }

    static List<String> split(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        String rest = text;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit);
            if (cut <= 0) {
                cut = limit;
            }
            chunks.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty() || chunks.isEmpty()) {
            chunks.add(rest);
        }
        return chunks;
    }
}
