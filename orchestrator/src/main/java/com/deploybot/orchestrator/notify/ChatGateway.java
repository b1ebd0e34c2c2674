package com.deploybot.orchestrator.notify;

import java.util.Collection;

/**
 * Outbound side of the chat platform the workflows originate from.
 *
 * Texts are HTML-formatted. Implementations block on network I/O.
 */
public interface ChatGateway {

    /**
     * Post a new message.
     *
     * @param mentions user names to mention below the text, without the leading '@'; may be empty
     * @return id of the posted message
     * @throws NotifyDeliveryException if the platform did not accept the message
     */
    String sendMessage(String chatId, String text, Collection<String> mentions);

    /**
     * Replace the text of an earlier message.
     *
     * @throws NotifyDeliveryException if the platform did not accept the edit
     */
    void updateMessage(String chatId, String messageId, String text);
}
