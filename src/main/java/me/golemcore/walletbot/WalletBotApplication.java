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

package me.golemcore.walletbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Wallet Bot.
 *
 * <p>
 * A Telegram bot that holds Solana keypairs on behalf of its users. Private keys
 * and recovery phrases are encrypted at rest with AES-GCM under a master key
 * derived once per process, and every multi-step operation (import, rename,
 * export, delete) is driven by a durable per-user conversation state.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter (long polling)
 * Domain Layer       → WalletFlowService, WalletVaultService, ConversationStateService
 * Infrastructure     → SecretCipher, JsonUserAccountRepository, LocalStorageAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix. {@code bot.vault.master-secret} must be set before any wallet can be
 * created.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WalletBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletBotApplication.class, args);
    }

}
