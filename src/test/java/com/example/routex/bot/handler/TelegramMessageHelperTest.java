package com.example.routex.bot.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramMessageHelperTest {

    @Mock
    private AbsSender bot;

    private TelegramMessageHelper helper;

    @BeforeEach
    void setUp() {
        helper = new TelegramMessageHelper(bot);
    }

    @Test
    void escapeMarkdownV2_escapesEverySpecialCharacter() {
        assertThat(helper.escapeMarkdownV2("v2.0 (beta) - 50% off!")).isEqualTo("v2\\.0 \\(beta\\) \\- 50% off\\!");
        assertThat(helper.escapeMarkdownV2("a_b*c\\d")).isEqualTo("a\\_b\\*c\\\\d");
        assertThat(helper.escapeMarkdownV2(null)).isEmpty();
    }

    @Test
    void split_prefersLineBoundaries() {
        String text = "a".repeat(6) + "\n" + "b".repeat(6);

        assertThat(TelegramMessageHelper.split(text, 10)).containsExactly("aaaaaa", "bbbbbb");
        assertThat(TelegramMessageHelper.split("c".repeat(25), 10)).containsExactly("c".repeat(10), "c".repeat(10), "c".repeat(5));
        assertThat(TelegramMessageHelper.split("", 10)).containsExactly("");
    }

    @Test
    void sendMessage_fallsBackToPlainText() throws TelegramApiException {
        List<String> parseModes = new ArrayList<>();
        when(bot.execute(any(SendMessage.class))).thenAnswer(invocation -> {
            SendMessage message = invocation.getArgument(0);
            parseModes.add(message.getParseMode());
            if (message.getParseMode() != null) {
                throw new TelegramApiException("can't parse entities");
            }
            return new Message();
        });

        helper.sendMessage(1L, "*bold");

        assertThat(parseModes).containsExactly("MarkdownV2", null);
    }

    @Test
    void sendWithFallbacks_dropsKeyboardFirst() throws TelegramApiException {
        when(bot.execute(any(SendMessage.class)))
                .thenThrow(new TelegramApiException("BUTTON_URL_INVALID"))
                .thenReturn(new Message());
        SendMessage message = SendMessage.builder()
                .chatId(5L)
                .text("Thanks")
                .replyMarkup(InlineKeyboardMarkup.builder()
                        .keyboardRow(List.of(InlineKeyboardButton.builder().text("Donate").url("bad url").build()))
                        .build())
                .build();

        helper.sendWithFallbacks(message);

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(bot, times(2)).execute(captor.capture());
        assertThat(captor.getValue().getReplyMarkup()).isNull();
    }

    @Test
    void sendPlainTextMessage_neverThrows() throws TelegramApiException {
        when(bot.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("Forbidden"));

        helper.sendPlainTextMessage(1L, "hello");

        verify(bot).execute(any(SendMessage.class));
    }
}
