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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted document of one chat user: the wallet collection, the pending
 * conversation step and the optional security PIN.
 *
 * <p>
 * The top-level {@code walletAddress}, {@code encryptedPrivateKey} and
 * {@code mnemonic} properties are written as a view of the active wallet so
 * older readers keep working. When a document without a {@code wallets} list
 * is read, those properties land in {@link #getLegacyWallet()} instead, until
 * the vault migrates them on the next change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    private String userId;
    private String username;

    @Builder.Default
    private List<Wallet> wallets = new ArrayList<>();

    /** Null while idle. */
    private StateRecord conversationState;

    private String securityPinHash;
    private String securityPinSalt;

    /** Optimistic concurrency token, bumped by every successful save. */
    private long version;

    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    private LegacyWallet legacyWallet;

    /**
     * The wallet flagged active, or {@code null} when none is.
     */
    public Wallet findActiveWallet() {
        if (wallets == null) {
            return null;
        }
        for (Wallet wallet : wallets) {
            if (wallet.isActive()) {
                return wallet;
            }
        }
        return null;
    }

    public Wallet findWallet(String walletId) {
        if (wallets == null || walletId == null) {
            return null;
        }
        for (Wallet wallet : wallets) {
            if (walletId.equals(wallet.getId())) {
                return wallet;
            }
        }
        return null;
    }

    @JsonIgnore
    public boolean isPinSet() {
        return securityPinHash != null && !securityPinHash.isEmpty();
    }

    @JsonProperty("walletAddress")
    public String getWalletAddress() {
        Wallet active = findActiveWallet();
        if (active != null) {
            return active.getAddress();
        }
        return legacyWallet != null ? legacyWallet.getWalletAddress() : null;
    }

    @JsonProperty("walletAddress")
    public void setWalletAddress(String walletAddress) {
        legacy().setWalletAddress(walletAddress);
    }

    @JsonProperty("encryptedPrivateKey")
    public String getEncryptedPrivateKey() {
        Wallet active = findActiveWallet();
        if (active != null) {
            return active.getEncryptedPrivateKey();
        }
        return legacyWallet != null ? legacyWallet.getEncryptedPrivateKey() : null;
    }

    @JsonProperty("encryptedPrivateKey")
    public void setEncryptedPrivateKey(String encryptedPrivateKey) {
        legacy().setEncryptedPrivateKey(encryptedPrivateKey);
    }

    @JsonProperty("mnemonic")
    public String getMnemonic() {
        Wallet active = findActiveWallet();
        if (active != null) {
            return active.getEncryptedMnemonic();
        }
        return legacyWallet != null ? legacyWallet.getMnemonic() : null;
    }

    @JsonProperty("mnemonic")
    public void setMnemonic(String mnemonic) {
        legacy().setMnemonic(mnemonic);
    }

    private LegacyWallet legacy() {
        if (legacyWallet == null) {
            legacyWallet = new LegacyWallet();
        }
        return legacyWallet;
    }
}
