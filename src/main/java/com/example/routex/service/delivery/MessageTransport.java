package com.example.routex.service.delivery;

/**
 * Delivers one text to one chat and classifies the outcome. Implementations report failures through
 * {@link SendOutcome}; an exception escaping {@link #send} is treated as a transient failure.
 */
public interface MessageTransport {

    SendOutcome send(long chatId, String text);
}
