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

package me.golemcore.walletbot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - Telegram channel</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link VaultProperties} - master secret, wallet limits, secret
 * display</li>
 * <li>{@link ConversationProperties} - pending input expiry</li>
 * <li>{@link RateLimitProperties} - per-user throttling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private StorageProperties storage = new StorageProperties();
    private VaultProperties vault = new VaultProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private int workerThreads = 8;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/wallet-bot";
    }

    @Data
    public static class VaultProperties {
        /** Secret the AES master key is derived from. Never logged. */
        private String masterSecret;
        private String kdfSalt = "golemcore-wallet-vault";
        private int maxWallets = 6;
        private Duration revealTtl = Duration.ofMinutes(5);
        private Duration revealCountdownInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class ConversationProperties {
        private Duration stateTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int requestsPerWindow = 5;
        private Duration window = Duration.ofSeconds(5);
        /** Security PIN guesses allowed per user within {@code pinWindow}. */
        private int pinAttempts = 3;
        private Duration pinWindow = Duration.ofMinutes(5);
    }
}
