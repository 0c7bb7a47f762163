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

package me.golemcore.walletbot.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.port.outbound.StoragePort;
import me.golemcore.walletbot.port.outbound.UserAccountPort;
import me.golemcore.walletbot.port.outbound.VersionConflictException;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each {@link UserAccount} as {@code users/<userId>.json} through
 * {@link StoragePort}.
 *
 * <p>
 * Writes are compare-and-set on the document version: the stored version is
 * re-read under a per-user lock and the write goes through only if it still
 * equals the version the caller started from. Users share a fixed set of lock
 * stripes, so contention between different users is rare and the lock table
 * does not grow with the user base.
 */
@Repository
@Slf4j
public class JsonUserAccountRepository implements UserAccountPort {

    static final String USERS_DIR = "users";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public JsonUserAccountRepository(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public Optional<UserAccount> load(String userId) {
        String json = storagePort.getText(USERS_DIR, fileName(userId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, UserAccount.class));
        } catch (JsonProcessingException e) {
            // never replace an unreadable document, it may hold the only copy of a key
            throw new IllegalStateException("Corrupted account document for user " + userId, e);
        }
    }

    @Override
    public UserAccount save(UserAccount account, long expectedVersion) {
        String userId = account.getUserId();
        synchronized (lockFor(userId)) {
            long actual = load(userId).map(UserAccount::getVersion)
                    .orElseThrow(() -> new VersionConflictException(userId, expectedVersion, -1));
            if (actual != expectedVersion) {
                log.debug("[Storage] Rejected stale write for user {}: expected v{}, found v{}",
                        userId, expectedVersion, actual);
                throw new VersionConflictException(userId, expectedVersion, actual);
            }
            write(account, expectedVersion + 1);
            return account;
        }
    }

    @Override
    public UserAccount create(UserAccount account) {
        String userId = account.getUserId();
        synchronized (lockFor(userId)) {
            if (Boolean.TRUE.equals(storagePort.exists(USERS_DIR, fileName(userId)).join())) {
                throw new VersionConflictException(userId, 0, load(userId).map(UserAccount::getVersion).orElse(0L));
            }
            if (account.getCreatedAt() == null) {
                account.setCreatedAt(clock.instant());
            }
            write(account, 1);
            log.info("[Storage] Created account for user {}", userId);
            return account;
        }
    }

    private void write(UserAccount account, long newVersion) {
        long previousVersion = account.getVersion();
        Instant previousUpdatedAt = account.getUpdatedAt();
        account.setVersion(newVersion);
        account.setUpdatedAt(clock.instant());
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(account);
            storagePort.putTextAtomic(USERS_DIR, fileName(account.getUserId()), json, true).join();
        } catch (JsonProcessingException | RuntimeException e) {
            account.setVersion(previousVersion);
            account.setUpdatedAt(previousUpdatedAt);
            throw new IllegalStateException("Failed to persist account " + account.getUserId(), e);
        }
    }

    Object lockFor(String userId) {
        return locks[Math.floorMod(Objects.hashCode(userId), LOCK_STRIPES)];
    }

    private static String fileName(String userId) {
        if (userId == null || !SAFE_ID.matcher(userId).matches()) {
            throw new IllegalArgumentException("Invalid user id: " + userId);
        }
        return userId + ".json";
    }
}
