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
 * Decrypted key material of one wallet, handed to the chat only for the
 * export flow.
 *
 * @param privateKey
 *            hex-encoded 64-byte secret key
 * @param recoveryPhrase
 *            BIP39 words, or {@code null} for wallets imported from a raw key
 */
public record RevealedSecret(String address, String privateKey, String recoveryPhrase) {

    public boolean hasRecoveryPhrase() {
        return recoveryPhrase != null && !recoveryPhrase.isEmpty();
    }

    @Override
    public String toString() {
        return "RevealedSecret[address=" + address + "]";
    }
}
