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
 * Secret-free projection of a {@link Wallet} returned by vault reads.
 */
public record WalletView(String id, String name, String address, boolean active, boolean watchOnly,
        boolean hasRecoveryPhrase) {

    public static WalletView of(Wallet wallet) {
        return new WalletView(wallet.getId(), wallet.getName(), wallet.getAddress(), wallet.isActive(),
                wallet.isWatchOnly(),
                wallet.getEncryptedMnemonic() != null && !wallet.getEncryptedMnemonic().isEmpty());
    }

    /**
     * Address shortened for buttons, e.g. {@code 7xKX...9fQz}.
     */
    public String shortAddress() {
        if (address == null || address.length() <= 12) {
            return address;
        }
        return address.substring(0, 4) + "..." + address.substring(address.length() - 4);
    }
}
