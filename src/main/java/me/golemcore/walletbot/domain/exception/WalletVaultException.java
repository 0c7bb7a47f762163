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

package me.golemcore.walletbot.domain.exception;

/**
 * Base of all wallet-vault failures that the chat flow reports to the user.
 *
 * <p>
 * Carries the i18n key of the user-facing message; the exception message is
 * for logs only and never contains key material.
 */
public class WalletVaultException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String messageKey;

    public WalletVaultException(String messageKey, String message) {
        super(message);
        this.messageKey = messageKey;
    }

    public WalletVaultException(String messageKey, String message, Throwable cause) {
        super(message, cause);
        this.messageKey = messageKey;
    }

    public String getMessageKey() {
        return messageKey;
    }
}
