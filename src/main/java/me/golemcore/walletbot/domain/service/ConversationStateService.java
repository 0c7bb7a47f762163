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

package me.golemcore.walletbot.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.walletbot.domain.exception.VaultConflictException;
import me.golemcore.walletbot.domain.exception.WalletNotFoundException;
import me.golemcore.walletbot.domain.model.StateRecord;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.port.outbound.UserAccountPort;
import me.golemcore.walletbot.port.outbound.VersionConflictException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Durable per-user conversation step, stored on the {@link UserAccount}.
 *
 * <p>
 * A user has at most one pending record. Starting a new flow replaces it, and
 * a record past its expiry reads as idle. {@link #consume(String)} reads and
 * clears in one compare-and-set, so two overlapping messages cannot both act
 * on the same pending step.
 */
@Service
@Slf4j
public class ConversationStateService {

    private static final int MAX_ATTEMPTS = 3;

    private final UserAccountPort accounts;
    private final BotProperties properties;
    private final Clock clock;

    public ConversationStateService(UserAccountPort accounts, BotProperties properties, Clock clock) {
        this.accounts = accounts;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<StateRecord> current(String userId) {
        return accounts.load(userId)
                .map(UserAccount::getConversationState)
                .filter(this::isLive);
    }

    /**
     * Store {@code record} as the user's pending step, replacing any previous
     * one.
     */
    public StateRecord begin(String userId, StateRecord record) {
        StateRecord stamped = record.stamped(clock.instant(), properties.getConversation().getStateTtl());
        for (int attempt = 1;; attempt++) {
            UserAccount account = requireAccount(userId);
            long expected = account.getVersion();
            account.setConversationState(stamped);
            try {
                accounts.save(account, expected);
                log.debug("[State] User {} -> {}", userId, stamped.getKind());
                return stamped;
            } catch (VersionConflictException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new VaultConflictException("Unable to store conversation state", e);
                }
            }
        }
    }

    /**
     * Atomically take the pending step. Returns empty when idle, when the
     * record expired, or when a concurrent event consumed it first.
     */
    public Optional<StateRecord> consume(String userId) {
        return take(userId).filter(this::isLive);
    }

    /**
     * Atomically take the pending step, expired or not. Callers that must
     * react to the kind of an expired step (deleting a pasted secret, for
     * instance) use this and check {@link #isLive(StateRecord)} themselves.
     */
    public Optional<StateRecord> take(String userId) {
        for (int attempt = 1;; attempt++) {
            UserAccount account = accounts.load(userId).orElse(null);
            if (account == null || account.getConversationState() == null) {
                return Optional.empty();
            }
            StateRecord state = account.getConversationState();
            long expected = account.getVersion();
            account.setConversationState(null);
            try {
                accounts.save(account, expected);
            } catch (VersionConflictException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new VaultConflictException("Unable to consume conversation state", e);
                }
                continue;
            }
            if (!isLive(state)) {
                log.debug("[State] Dropped expired {} of user {}", state.getKind(), userId);
            }
            return Optional.of(state);
        }
    }

    /**
     * The stored step, expired or not, without clearing it.
     */
    public Optional<StateRecord> peek(String userId) {
        return accounts.load(userId).map(UserAccount::getConversationState);
    }

    public boolean isLive(StateRecord state) {
        return !state.isExpiredAt(clock.instant());
    }

    /**
     * Return the user to idle.
     */
    public void clear(String userId) {
        consume(userId);
    }

    private UserAccount requireAccount(String userId) {
        return accounts.load(userId)
                .orElseThrow(() -> new WalletNotFoundException("No account for user " + userId));
    }
}
