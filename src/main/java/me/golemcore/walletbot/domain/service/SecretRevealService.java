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

package me.golemcore.walletbot.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.walletbot.domain.model.Button;
import me.golemcore.walletbot.domain.model.Reply;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.infrastructure.i18n.MessageService;
import me.golemcore.walletbot.port.outbound.ChatRenderPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Shows exported key material in a self-destructing chat message.
 *
 * <p>
 * The message is edited with a countdown every
 * {@code bot.vault.reveal-countdown-interval} and deleted once
 * {@code bot.vault.reveal-ttl} has passed. When Telegram refuses the deletion
 * (messages older than 48 hours, for instance) the text is replaced with a
 * redacted placeholder instead. Display is best effort and independent of the
 * conversation state.
 */
@Service
@Slf4j
public class SecretRevealService {

    static final String HIDE_ACTION = "wallet:hide";

    private final ChatRenderPort chat;
    private final MessageService messages;
    private final BotProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Map<String, List<ScheduledFuture<?>>> timers = new ConcurrentHashMap<>();
    private final Set<String> dismissedEarly = ConcurrentHashMap.newKeySet();

    public SecretRevealService(ChatRenderPort chat, MessageService messages, BotProperties properties) {
        this(chat, messages, properties, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "secret-reveal");
            t.setDaemon(true);
            return t;
        }));
    }

    SecretRevealService(ChatRenderPort chat, MessageService messages, BotProperties properties,
            ScheduledExecutorService scheduler) {
        this.chat = chat;
        this.messages = messages;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Send {@code body} and schedule its countdown and removal.
     *
     * @return future completing with the id of the sent message
     */
    public CompletableFuture<Integer> show(String userId, String lang, String body) {
        Duration ttl = properties.getVault().getRevealTtl();
        return chat.render(userId, withCountdown(body, lang, ttl))
                .thenApply(messageId -> {
                    schedule(userId, messageId, lang, body, ttl);
                    log.info("[Reveal] Secret shown to user {} (message {}), expires in {}s", userId, messageId,
                            ttl.toSeconds());
                    return messageId;
                });
    }

    /**
     * Remove a revealed message right away. A dismissal that arrives before
     * the timers of the message are registered keeps them from being
     * scheduled.
     */
    public void dismiss(String userId, Integer messageId, String lang) {
        String key = key(userId, messageId);
        dismissedEarly.add(key);
        List<ScheduledFuture<?>> futures = timers.remove(key);
        if (futures != null) {
            futures.forEach(future -> future.cancel(false));
            dismissedEarly.remove(key);
        }
        expire(userId, messageId, lang);
    }

    int pendingCount() {
        return timers.size();
    }

    private void schedule(String userId, Integer messageId, String lang, String body, Duration ttl) {
        String key = key(userId, messageId);
        if (dismissedEarly.remove(key)) {
            log.debug("[Reveal] Message {} of user {} was hidden before its timers started", messageId, userId);
            return;
        }
        Duration interval = properties.getVault().getRevealCountdownInterval();
        List<ScheduledFuture<?>> futures = new ArrayList<>();
        if (!interval.isZero() && !interval.isNegative()) {
            for (Duration at = interval; at.compareTo(ttl) < 0; at = at.plus(interval)) {
                Duration remaining = ttl.minus(at);
                Runnable tick = () -> chat.edit(userId, messageId, withCountdown(body, lang, remaining))
                        .exceptionally(e -> {
                            log.debug("[Reveal] Countdown edit failed for message {}: {}", messageId,
                                    e.getMessage());
                            return null;
                        });
                futures.add(scheduler.schedule(tick, at.toMillis(), TimeUnit.MILLISECONDS));
            }
        }
        futures.add(scheduler.schedule(() -> {
            timers.remove(key);
            expire(userId, messageId, lang);
        }, ttl.toMillis(), TimeUnit.MILLISECONDS));
        timers.put(key, futures);
        if (dismissedEarly.remove(key)) {
            cancelTimers(key);
        }
    }

    private void expire(String userId, Integer messageId, String lang) {
        chat.delete(userId, messageId)
                .thenRun(() -> log.debug("[Reveal] Deleted secret message {} of user {}", messageId, userId))
                .exceptionally(e -> {
                    log.warn("[Reveal] Could not delete message {} of user {}, redacting", messageId, userId);
                    chat.edit(userId, messageId, Reply.text(messages.getMessage("wallet.export.redacted", lang)))
                            .exceptionally(editError -> {
                                log.error("[Reveal] Secret message {} of user {} could not be redacted",
                                        messageId, userId, editError);
                                return null;
                            });
                    return null;
                });
    }

    private void cancelTimers(String key) {
        List<ScheduledFuture<?>> futures = timers.remove(key);
        if (futures != null) {
            futures.forEach(future -> future.cancel(false));
        }
    }

    private Reply withCountdown(String body, String lang, Duration remaining) {
        long minutes = Math.max(1, (remaining.toSeconds() + 59) / 60);
        String text = body + "\n\n" + messages.getMessage("wallet.export.countdown", lang, minutes);
        return Reply.builder(text)
                .row(new Button(messages.getMessage("button.hide", lang), HIDE_ACTION))
                .build();
    }

    private static String key(String userId, Integer messageId) {
        return userId + ":" + messageId;
    }

    @PreDestroy
    public void destroy() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
