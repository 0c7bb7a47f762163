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

package me.golemcore.walletbot.adapter.inbound.telegram;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.walletbot.domain.model.Button;
import me.golemcore.walletbot.domain.model.Reply;
import me.golemcore.walletbot.domain.model.WalletEvent;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.port.inbound.ChannelPort;
import me.golemcore.walletbot.port.outbound.ChatRenderPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements {@link LongPollingSingleThreadUpdateConsumer} for
 * inbound updates and {@link ChatRenderPort} for outbound messages.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Each update is handed to a bounded worker pool, so one slow user does
 * not hold up the others</li>
 * <li>Slash commands, button presses and free text become {@link WalletEvent}s
 * published to the application context</li>
 * <li>Only private chats are served; key material never goes to groups</li>
 * <li>Callback queries are answered right away to stop the client spinner</li>
 * <li>Replies are sent as HTML with inline keyboards</li>
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.telegram.enabled=true} and a token is configured. In a private
 * chat the chat id equals the user id, which is how replies are addressed.
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, ChatRenderPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String PARSE_MODE = "HTML";
    private static final String NOT_MODIFIED = "message is not modified";
    static final int MAX_TRACKED_CHATS = 10_000;

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;

    private TelegramClient telegramClient;
    private Executor workers;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();
    private final Map<String, Integer> lastPressedMessage = Collections.synchronizedMap(
            new LinkedHashMap<>(256, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                    return size() > MAX_TRACKED_CHATS;
                }
            });

    public TelegramAdapter(BotProperties properties, ApplicationEventPublisher eventPublisher,
            TelegramBotsLongPollingApplication botsApplication) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.botsApplication = botsApplication;
        this.workers = newWorkerPool(properties.getTelegram().getWorkerThreads());
    }

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    /**
     * Package-private setter for testing, allows running updates inline.
     */
    void setWorkers(Executor executor) {
        shutdownWorkers();
        this.workers = executor;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "telegram-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
        shutdownWorkers();
    }

    private void shutdownWorkers() {
        if (workers instanceof ExecutorService pool) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ===== Inbound =====

    @Override
    public void consume(Update update) {
        try {
            workers.execute(() -> process(update));
        } catch (RejectedExecutionException e) {
            log.warn("[Telegram] Dropping update {}: workers unavailable", update.getUpdateId());
        }
    }

    private void process(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to process update", e);
        }
    }

    private void handleCallback(CallbackQuery callback) {
        answer(callback);
        if (callback.getMessage() == null) {
            log.warn("[Telegram] Callback query without associated message, ignoring");
            return;
        }
        User from = callback.getFrom();
        String chatId = callback.getMessage().getChatId().toString();
        String userId = from != null ? from.getId().toString() : chatId;
        if (!userId.equals(chatId)) {
            log.debug("[Telegram] Ignoring callback outside private chat {}", chatId);
            return;
        }
        Integer messageId = callback.getMessage().getMessageId();
        rememberPressedMessage(userId, messageId);

        log.debug("[Telegram] Callback: {}", callback.getData());
        publish(WalletEvent.button(userId, chatId, messageId, callback.getData()), from);
    }

    private void handleMessage(org.telegram.telegrambots.meta.api.objects.message.Message message) {
        if (!message.hasText()) {
            return;
        }
        String chatId = message.getChatId().toString();
        User from = message.getFrom();
        String userId = from != null ? from.getId().toString() : chatId;
        if (!userId.equals(chatId)) {
            log.debug("[Telegram] Ignoring message outside private chat {}", chatId);
            return;
        }

        String text = message.getText();
        Integer messageId = message.getMessageId();
        if (text.startsWith("/")) {
            String cmd = text.split("\\s+", 2)[0].substring(1).split("@")[0]; // strip / and @botname
            publish(WalletEvent.command(userId, chatId, messageId, cmd), from);
            return;
        }
        publish(WalletEvent.text(userId, chatId, messageId, text), from);
    }

    private void publish(WalletEvent event, User from) {
        WalletEvent withSender = from != null ? event.withSender(from.getUserName(), from.getLanguageCode()) : event;
        eventPublisher.publishEvent(withSender);
    }

    private void answer(CallbackQuery callback) {
        try {
            telegramClient.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callback.getId())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Failed to answer callback query: {}", e.getMessage());
        }
    }

    // ===== Outbound =====

    @Override
    public CompletableFuture<Integer> render(String userId, Reply reply) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                SendMessage.SendMessageBuilder<?, ?> builder = SendMessage.builder()
                        .chatId(userId)
                        .text(reply.text())
                        .parseMode(PARSE_MODE);
                if (reply.hasKeyboard()) {
                    builder.replyMarkup(toMarkup(reply));
                }
                return telegramClient.execute(builder.build()).getMessageId();
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send message to chat: {}", userId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    /**
     * Remember the message whose button the user pressed last. Only the most
     * recently active chats are kept.
     */
    void rememberPressedMessage(String userId, Integer messageId) {
        lastPressedMessage.put(userId, messageId);
    }

    int trackedChats() {
        return lastPressedMessage.size();
    }

    @Override
    public CompletableFuture<Integer> editLast(String userId, Reply reply) {
        Integer messageId = lastPressedMessage.get(userId);
        if (messageId == null) {
            return render(userId, reply);
        }
        return edit(userId, messageId, reply)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(messageId);
                    }
                    log.debug("[Telegram] Cannot edit message {}, sending new one", messageId);
                    lastPressedMessage.remove(userId, messageId);
                    return render(userId, reply);
                })
                .thenCompose(future -> future);
    }

    @Override
    public CompletableFuture<Void> edit(String userId, Integer messageId, Reply reply) {
        return CompletableFuture.runAsync(() -> {
            try {
                EditMessageText.EditMessageTextBuilder<?, ?> builder = EditMessageText.builder()
                        .chatId(userId)
                        .messageId(messageId)
                        .text(reply.text())
                        .parseMode(PARSE_MODE);
                if (reply.hasKeyboard()) {
                    builder.replyMarkup(toMarkup(reply));
                }
                telegramClient.execute(builder.build());
            } catch (TelegramApiException e) {
                if (isNotModified(e)) {
                    return;
                }
                throw new IllegalStateException("Failed to edit message " + messageId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> delete(String userId, Integer messageId) {
        return CompletableFuture.runAsync(() -> {
            try {
                telegramClient.execute(DeleteMessage.builder()
                        .chatId(userId)
                        .messageId(messageId)
                        .build());
            } catch (TelegramApiException e) {
                throw new IllegalStateException("Failed to delete message " + messageId, e);
            }
        });
    }

    static InlineKeyboardMarkup toMarkup(Reply reply) {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (List<Button> row : reply.keyboard()) {
            InlineKeyboardRow keyboardRow = new InlineKeyboardRow();
            for (Button button : row) {
                keyboardRow.add(InlineKeyboardButton.builder()
                        .text(button.label())
                        .callbackData(button.action())
                        .build());
            }
            rows.add(keyboardRow);
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private static boolean isNotModified(TelegramApiException e) {
        return e instanceof TelegramApiRequestException request
                && request.getApiResponse() != null
                && request.getApiResponse().contains(NOT_MODIFIED);
    }
}
