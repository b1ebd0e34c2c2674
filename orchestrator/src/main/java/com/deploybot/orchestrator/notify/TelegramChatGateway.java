package com.deploybot.orchestrator.notify;

import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.HttpClients;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ChatGateway over the Telegram Bot API (sendMessage / editMessageText).
 *
 * Mentions are appended as a last line of {@code @name} tokens, which
 * Telegram turns into notifications for those users.
 */
@Component
public class TelegramChatGateway implements ChatGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramChatGateway.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       botToken;

    public TelegramChatGateway(DeployProperties properties, ObjectMapper objectMapper) {
        DeployProperties.Chat chat = properties.chat();
        this.json     = objectMapper;
        this.baseUrl  = chat.telegramBaseUrl().endsWith("/")
                ? chat.telegramBaseUrl().substring(0, chat.telegramBaseUrl().length() - 1)
                : chat.telegramBaseUrl();
        this.botToken = chat.botToken();
        this.http     = HttpClients.build(chat.proxy(), Duration.ofSeconds(10));
    }

    @Override
    public String sendMessage(String chatId, String text, Collection<String> mentions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", withMentions(text, mentions));
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);

        JsonNode result = call("sendMessage", body);
        String messageId = result.path("result").path("message_id").asText("");
        log.debug("Telegram message {} sent to chat {}", messageId, chatId);
        return messageId;
    }

    @Override
    public void updateMessage(String chatId, String messageId, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("message_id", messageId);
        body.put("text", text);
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);
        call("editMessageText", body);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    static String withMentions(String text, Collection<String> mentions) {
        if (mentions == null || mentions.isEmpty()) {
            return text;
        }
        return text + "\n\n" + mentions.stream()
                .map(m -> m.startsWith("@") ? m : "@" + m)
                .collect(Collectors.joining(" "));
    }

    private JsonNode call(String method, Map<String, Object> body) {
        if (botToken == null || botToken.isBlank()) {
            throw new NotifyDeliveryException("Telegram bot token is not configured");
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/bot" + botToken + "/" + method))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            JsonNode parsed = json.readTree(resp.body() == null || resp.body().isBlank() ? "{}" : resp.body());
            if (resp.statusCode() == 200 && parsed.path("ok").asBoolean(false)) {
                return parsed;
            }
            String description = parsed.path("description").asText(resp.body());
            if (description.contains("message is not modified")) {
                return parsed;
            }
            throw new NotifyDeliveryException(
                    "Telegram " + method + " failed: HTTP " + resp.statusCode() + ": " + description);
        } catch (JsonProcessingException e) {
            throw new NotifyDeliveryException("Telegram " + method + " returned malformed JSON", e);
        } catch (IOException e) {
            throw new NotifyDeliveryException("Telegram " + method + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyDeliveryException("Telegram " + method + " interrupted", e);
        }
    }
}
