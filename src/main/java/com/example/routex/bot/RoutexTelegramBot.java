package com.example.routex.bot;

import com.example.routex.bot.handler.BotCallbackHandler;
import com.example.routex.bot.handler.BotCommandHandler;
import com.example.routex.bot.handler.TelegramMessageHelper;
import com.example.routex.bot.transport.TelegramMessageTransport;
import com.example.routex.service.SubscriberService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Component
@Slf4j
public class RoutexTelegramBot extends TelegramLongPollingBot {

    private final String botUsername;
    private final SubscriberService subscriberService;
    private final BotCommandHandler botCommandHandler;
    private final BotCallbackHandler botCallbackHandler;
    private final TelegramMessageTransport messageTransport;
    private final TelegramMessageHelper messageHelper;

    // Executor for admin broadcasts, which take as long as the batches need
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool();

    public RoutexTelegramBot(
            @Value("${telegram.bot.token}") String botToken,
            @Value("${telegram.bot.username}") String botUsername,
            SubscriberService subscriberService,
            BotCommandHandler botCommandHandler,
            BotCallbackHandler botCallbackHandler,
            TelegramMessageTransport messageTransport
    ) {
        super(botToken);
        this.botUsername = botUsername;
        this.subscriberService = subscriberService;
        this.botCommandHandler = botCommandHandler;
        this.botCallbackHandler = botCallbackHandler;
        this.messageTransport = messageTransport;
        this.messageHelper = new TelegramMessageHelper(this);
        log.info("Telegram Bot initialized. Username: {}", botUsername);
    }

    @PostConstruct
    public void init() {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(this);
            log.info("Telegram Bot registered successfully!");
            this.messageTransport.attach(this);
            setBotCommands();
        } catch (TelegramApiException e) {
            log.error("Error registering Telegram Bot or setting commands", e);
        }
    }

    @PreDestroy
    public void shutdownExecutor() {
        log.info("Shutting down task executor service...");
        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                taskExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task executor service shut down.");
    }

    private void setBotCommands() {
        List<BotCommand> commands = new ArrayList<>();
        commands.add(new BotCommand("start", "Start interaction"));
        commands.add(new BotCommand("optout", "Stop receiving broadcasts"));
        commands.add(new BotCommand("optin", "Receive broadcasts again"));
        commands.add(new BotCommand("donate", "Support the project"));
        commands.add(new BotCommand("help", "Show available commands"));
        try {
            this.execute(new SetMyCommands(commands, new BotCommandScopeDefault(), null));
            log.info("Successfully set bot commands menu.");
        } catch (TelegramApiException e) {
            log.error("Failed to set bot commands menu", e);
        }
    }

    @Override
    public String getBotUsername() {
        return this.botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery callbackQuery = update.getCallbackQuery();
            MDC.put("telegramId", String.valueOf(callbackQuery.getFrom().getId()));
            try {
                botCallbackHandler.handle(callbackQuery, messageHelper);
            } catch (Exception e) {
                log.error("Unhandled exception during callback query processing: " + callbackQuery.getData(), e);
                messageHelper.sendAnswerCallbackQuery(callbackQuery.getId(), "Error processing action.", true);
            } finally {
                MDC.remove("telegramId");
            }
            return;
        }

        if (!update.hasMessage() || !update.getMessage().hasText() || update.getMessage().getFrom() == null) {
            return;
        }
        Message message = update.getMessage();
        long chatId = message.getChatId();
        Long telegramId = message.getFrom().getId();
        MDC.put("telegramId", String.valueOf(telegramId));
        try {
            subscriberService.registerActivity(telegramId, message.getFrom().getUserName());

            String text = message.getText().trim();
            if (!text.startsWith("/")) {
                messageHelper.sendMessage(chatId, "Send `/help` to see what I can do\\.");
                return;
            }
            String[] parts = text.split("\\s+", 2);
            String command = stripBotMention(parts[0].toLowerCase());
            String commandArgs = parts.length > 1 ? parts[1].trim() : null;
            log.info("Processing command '{}' from user {}", command, telegramId);
            botCommandHandler.handle(message, command, commandArgs, messageHelper, taskExecutor);
        } catch (Exception e) {
            log.error("Unhandled exception during message processing", e);
            messageHelper.sendPlainTextMessage(chatId, "An unexpected error occurred. Please try again later.");
        } finally {
            MDC.remove("telegramId");
        }
    }

    // "/stats@RoutexBot" -> "/stats"
    private static String stripBotMention(String command) {
        int at = command.indexOf('@');
        return at > 0 ? command.substring(0, at) : command;
    }
}
