package me.golemcore.walletbot.port.outbound;

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

import me.golemcore.walletbot.domain.model.UserAccount;

import java.util.Optional;

/**
 * Document store for {@link UserAccount}s keyed by chat user id, with
 * optimistic concurrency on {@link UserAccount#getVersion()}.
 */
public interface UserAccountPort {

    Optional<UserAccount> load(String userId);

    /**
     * Store the account if the persisted version still equals
     * {@code expectedVersion}. On success the account's version is bumped.
     *
     * @throws VersionConflictException
     *             if another writer saved in between
     */
    UserAccount save(UserAccount account, long expectedVersion);

    /**
     * Store a new account.
     *
     * @throws VersionConflictException
     *             if an account for the user already exists
     */
    UserAccount create(UserAccount account);
}
