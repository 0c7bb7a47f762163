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
 * Stored secret could not be opened with the current master key. Treated as
 * a security event.
 */
public class DecryptionFailedException extends WalletVaultException {

    private static final long serialVersionUID = 1L;

    private final String walletId;

    public DecryptionFailedException(String walletId, Throwable cause) {
        super("wallet.error.decryption", "Unable to decrypt secret of wallet " + walletId, cause);
        this.walletId = walletId;
    }

    public String getWalletId() {
        return walletId;
    }
}
