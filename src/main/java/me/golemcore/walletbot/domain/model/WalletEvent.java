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
 * Inbound chat event delivered to the wallet flow.
 *
 * <p>
 * Published by the Telegram adapter after an update has been accepted. For
 * {@link Kind#BUTTON} the payload is the callback data, for
 * {@link Kind#COMMAND} the command name without slash or bot suffix, for
 * {@link Kind#TEXT} the raw message text.
 */
public record WalletEvent(String userId, String chatId, Integer messageId, Kind kind, String payload,
        String username, String languageCode) {

    public enum Kind {
        TEXT, BUTTON, COMMAND
    }

    public static WalletEvent text(String userId, String chatId, Integer messageId, String text) {
        return new WalletEvent(userId, chatId, messageId, Kind.TEXT, text, null, null);
    }

    public static WalletEvent button(String userId, String chatId, Integer messageId, String data) {
        return new WalletEvent(userId, chatId, messageId, Kind.BUTTON, data, null, null);
    }

    public static WalletEvent command(String userId, String chatId, Integer messageId, String command) {
        return new WalletEvent(userId, chatId, messageId, Kind.COMMAND, command, null, null);
    }

    public WalletEvent withSender(String senderUsername, String senderLanguage) {
        return new WalletEvent(userId, chatId, messageId, kind, payload, senderUsername, senderLanguage);
    }

    @Override
    public String toString() {
        // text payloads may carry key material
        String shown = kind == Kind.TEXT ? "<" + (payload != null ? payload.length() : 0) + " chars>" : payload;
        return "WalletEvent[userId=" + userId + ", kind=" + kind + ", payload=" + shown + "]";
    }
}
