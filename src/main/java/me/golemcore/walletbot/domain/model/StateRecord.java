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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Pending conversation step of one user.
 *
 * <p>
 * Records are built through the static factories, which enforce the payload
 * each {@link PendingInput} needs: renaming and export confirmation carry the
 * target wallet id, a code prompt carries its {@link CodePurpose}. Timestamps
 * are stamped when the record is stored.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class StateRecord {

    private final PendingInput kind;
    private final String walletId;
    private final CodePurpose purpose;
    private final Instant createdAt;
    private final Instant expiresAt;

    @JsonCreator
    StateRecord(@JsonProperty("kind") PendingInput kind,
            @JsonProperty("walletId") String walletId,
            @JsonProperty("purpose") CodePurpose purpose,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("expiresAt") Instant expiresAt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        switch (kind) {
        case RENAMING_WALLET, EXPORT_CONFIRM_PENDING -> {
            requireWalletId(kind, walletId);
            requireNoPurpose(kind, purpose);
        }
        case AWAITING_CODE -> {
            if (purpose == null) {
                throw new IllegalArgumentException(kind + " requires a purpose");
            }
            if (purpose != CodePurpose.CHANGE_PIN) {
                requireWalletId(kind, walletId);
            }
        }
        default -> {
            if (walletId != null) {
                throw new IllegalArgumentException(kind + " takes no wallet id");
            }
            requireNoPurpose(kind, purpose);
        }
        }
        this.walletId = walletId;
        this.purpose = purpose;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public static StateRecord importing() {
        return new StateRecord(PendingInput.IMPORTING_WALLET, null, null, null, null);
    }

    public static StateRecord renaming(String walletId) {
        return new StateRecord(PendingInput.RENAMING_WALLET, walletId, null, null, null);
    }

    public static StateRecord changingAddress() {
        return new StateRecord(PendingInput.CHANGING_ADDRESS, null, null, null, null);
    }

    public static StateRecord exportConfirm(String walletId) {
        return new StateRecord(PendingInput.EXPORT_CONFIRM_PENDING, walletId, null, null, null);
    }

    public static StateRecord settingPin() {
        return new StateRecord(PendingInput.SETTING_PIN, null, null, null, null);
    }

    public static StateRecord awaitingCode(CodePurpose purpose, String walletId) {
        return new StateRecord(PendingInput.AWAITING_CODE, walletId, purpose, null, null);
    }

    /**
     * Copy of this record valid from {@code now} for {@code ttl}.
     */
    public StateRecord stamped(Instant now, Duration ttl) {
        return new StateRecord(kind, walletId, purpose, now, now.plus(ttl));
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    private static void requireWalletId(PendingInput kind, String walletId) {
        if (walletId == null || walletId.isBlank()) {
            throw new IllegalArgumentException(kind + " requires a wallet id");
        }
    }

    private static void requireNoPurpose(PendingInput kind, CodePurpose purpose) {
        if (purpose != null) {
            throw new IllegalArgumentException(kind + " takes no purpose");
        }
    }
}
