package com.mouse.keeper.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.model.SiteSwitchedEvent;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
@Slf4j
@ConditionalOnProperty(name = "keeper.alerts.telegram.enabled", havingValue = "true")
public class TelegramAlertService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final KeeperProperties.Telegram config;

    public TelegramAlertService(OkHttpClient okHttpClient, ObjectMapper objectMapper, KeeperProperties properties) {
        this.client = okHttpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getAlerts().getTelegram();
    }

    @Async
    @EventListener
    public void onSiteSwitched(SiteSwitchedEvent event) {
        if (event.getTo() == null) {
            sendBackupsExhaustedAlert(event.getFrom().getName(), event.getReason());
        } else {
            sendSiteSwitchAlert(event.getFrom().getName(), event.getTo().getName(), event.getReason());
        }
    }

    public void sendSiteSwitchAlert(String from, String to, String reason) {
        String message = String.format(
                "🔀 SITE SWITCH\n\n" +
                        "From: %s\n" +
                        "To: %s\n" +
                        "Reason: %s",
                from, to, reason
        );

        sendTelegramMessage(message);
    }

    public void sendBackupsExhaustedAlert(String lastSite, String reason) {
        String message = String.format(
                "🚨 ALL SITES FAILING 🚨\n\n" +
                        "Last site: %s\n" +
                        "Reason: %s\n\n" +
                        "⚠️ MANUAL INTERVENTION REQUIRED",
                lastSite, reason
        );

        sendTelegramMessage(message);
    }

    private void sendTelegramMessage(String message) {
        ObjectNode payload = objectMapper.createObjectNode()
                .put("chat_id", config.getChatId())
                .put("text", message);
        Request request = new Request.Builder()
                .url(config.getApiBase() + "/bot" + config.getBotToken() + "/sendMessage")
                .post(RequestBody.create(payload.toString(), JSON))
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Telegram alert rejected: HTTP {}", response.code());
                return;
            }
            log.info("Sent Telegram alert: {}", message.lines().findFirst().orElse(""));
        } catch (IOException e) {
            log.error("Failed to send Telegram alert: {}", e.getMessage());
        }
    }
}
