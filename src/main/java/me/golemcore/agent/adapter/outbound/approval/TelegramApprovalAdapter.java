/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.adapter.outbound.approval;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ApprovalAnswer;
import me.golemcore.agent.domain.model.ApprovalCallbackEvent;
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.domain.service.PendingApprovalRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ApprovalPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram implementation of {@link ApprovalPort}.
 *
 * <p>
 * Sends an inline keyboard with Approve / Deny / Trust buttons. The inbound
 * Telegram adapter turns a button press into an {@link ApprovalCallbackEvent}
 * (see {@link #parseCallbackData}); the {@link PendingApprovalRegistry}
 * resolves the request and this adapter edits the prompt to show the answer.
 *
 * <p>
 * Fails closed: a prompt that cannot be sent counts as a denial.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.channels.telegram.enabled} / {@code token}
 * <li>{@code agent.approval.timeout-seconds}
 * </ul>
 */
@Component
@Slf4j
public class TelegramApprovalAdapter implements ApprovalPort {

    static final String CHANNEL_TYPE = "telegram";
    static final String CALLBACK_PREFIX = "approval:";

    private final AgentProperties properties;
    private final PendingApprovalRegistry registry;

    private volatile TelegramClient telegramClient;

    public TelegramApprovalAdapter(AgentProperties properties, PendingApprovalRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    /**
     * Set the TelegramClient instance. Package-private for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isAvailable() {
        return getOrCreateClient() != null;
    }

    private TelegramClient getOrCreateClient() {
        TelegramClient client = this.telegramClient;
        if (client != null) {
            return client;
        }
        AgentProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        if (channel == null || !channel.isEnabled()) {
            return null;
        }
        String token = channel.getToken();
        if (token == null || token.isBlank()) {
            return null;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        log.debug("TelegramClient lazily initialized for approval adapter");
        return this.telegramClient;
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(ApprovalRequest request) {
        TelegramClient client = getOrCreateClient();
        String chatId = request.session() != null ? request.session().getTransportChatId() : null;
        if (client == null || chatId == null) {
            log.warn("[Approval] Telegram prompt not possible, denying '{}'", request.toolName());
            return CompletableFuture.completedFuture(false);
        }

        Duration timeout = Duration.ofSeconds(properties.getApproval().getTimeoutSeconds());
        PendingApprovalRegistry.PendingApproval pending = registry.open(
                request.session().getId(), request.toolName(), request.riskLevel(), timeout);

        try {
            client.execute(buildPrompt(chatId, pending.id(), request));
            log.debug("Sent approval prompt for id: {}", pending.id());
        } catch (TelegramApiException | RuntimeException e) {
            log.error("Failed to send approval prompt, denying", e);
            registry.resolve(pending.id(), ApprovalAnswer.DENY);
        }
        return pending.future();
    }

    SendMessage buildPrompt(String chatId, String approvalId, ApprovalRequest request) {
        String text = "⚠️ <b>Approval required</b>\n\n"
                + "<b>Tool:</b> " + escapeHtml(request.toolName()) + "\n"
                + "<b>Risk:</b> " + request.riskLevel() + "\n"
                + "<b>Action:</b> " + escapeHtml(request.description());

        InlineKeyboardMarkup keyboard = InlineKeyboardMarkup.builder()
                .keyboardRow(new InlineKeyboardRow(
                        InlineKeyboardButton.builder()
                                .text("✅ Approve")
                                .callbackData(CALLBACK_PREFIX + approvalId + ":yes")
                                .build(),
                        InlineKeyboardButton.builder()
                                .text("❌ Deny")
                                .callbackData(CALLBACK_PREFIX + approvalId + ":no")
                                .build(),
                        InlineKeyboardButton.builder()
                                .text("🔓 Trust")
                                .callbackData(CALLBACK_PREFIX + approvalId + ":trust")
                                .build()))
                .build();

        return SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .parseMode("HTML")
                .replyMarkup(keyboard)
                .build();
    }

    /**
     * Parses {@code approval:<id>:yes|no|trust} callback data from a button
     * press.
     */
    public static Optional<ApprovalCallbackEvent> parseCallbackData(String data, String chatId, String messageId) {
        if (data == null || !data.startsWith(CALLBACK_PREFIX)) {
            return Optional.empty();
        }
        String[] parts = data.substring(CALLBACK_PREFIX.length()).split(":");
        if (parts.length != 2 || parts[0].isBlank()) {
            return Optional.empty();
        }
        ApprovalAnswer answer = switch (parts[1]) {
        case "yes" -> ApprovalAnswer.APPROVE;
        case "trust" -> ApprovalAnswer.TRUST;
        case "no" -> ApprovalAnswer.DENY;
        default -> null;
        };
        if (answer == null) {
            return Optional.empty();
        }
        return Optional.of(new ApprovalCallbackEvent(parts[0], answer, chatId, messageId));
    }

    /**
     * Replaces the prompt with the answer once the user pressed a button.
     */
    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        if (event.chatId() == null || event.messageId() == null) {
            return;
        }
        TelegramClient client = getOrCreateClient();
        if (client == null) {
            return;
        }
        String statusText = switch (event.answer()) {
        case APPROVE -> "✅ Approved";
        case TRUST -> "🔓 Approved, session trusted";
        case DENY -> "❌ Denied";
        };
        try {
            EditMessageText edit = EditMessageText.builder()
                    .chatId(event.chatId())
                    .messageId(Integer.parseInt(event.messageId()))
                    .text(statusText)
                    .build();
            client.execute(edit);
        } catch (TelegramApiException | NumberFormatException e) {
            log.error("Failed to update approval message", e);
        }
    }

    private String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
