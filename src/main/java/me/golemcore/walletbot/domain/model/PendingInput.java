package me.golemcore.walletbot.domain.model;

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

/**
 * What the bot is waiting for from a user between two chat events.
 */
public enum PendingInput {
    IMPORTING_WALLET, RENAMING_WALLET, CHANGING_ADDRESS, EXPORT_CONFIRM_PENDING, SETTING_PIN, AWAITING_CODE;

    /**
     * Whether the user's reply to this prompt is sensitive and should be removed
     * from the chat after processing.
     */
    public boolean isSecretInput() {
        return this == IMPORTING_WALLET || this == SETTING_PIN || this == AWAITING_CODE;
    }
}
