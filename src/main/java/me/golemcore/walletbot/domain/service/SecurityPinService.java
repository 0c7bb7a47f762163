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
import me.golemcore.walletbot.domain.exception.InvalidPinException;
import me.golemcore.walletbot.domain.exception.VaultConflictException;
import me.golemcore.walletbot.domain.exception.WalletNotFoundException;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.port.outbound.UserAccountPort;
import me.golemcore.walletbot.port.outbound.VersionConflictException;
import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Optional per-user security PIN guarding export, delete and PIN change.
 * Stored as a salted SCrypt hash; the PIN itself is never persisted.
 */
@Service
@Slf4j
public class SecurityPinService {

    private static final Pattern PIN_FORMAT = Pattern.compile("^[0-9]{4,8}$");
    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final int SCRYPT_N = 1 << 14;
    private static final int SCRYPT_R = 8;
    private static final int SCRYPT_P = 1;

    private final UserAccountPort accounts;
    private final SecureRandom random = new SecureRandom();

    public SecurityPinService(UserAccountPort accounts) {
        this.accounts = accounts;
    }

    public boolean isValidFormat(String pin) {
        return pin != null && PIN_FORMAT.matcher(pin.trim()).matches();
    }

    public boolean hasPin(String userId) {
        return accounts.load(userId).map(UserAccount::isPinSet).orElse(false);
    }

    /**
     * Set or replace the user's PIN.
     *
     * @throws InvalidPinException
     *             if the PIN is not 4 to 8 digits
     */
    public void setPin(String userId, String pin) {
        if (!isValidFormat(pin)) {
            throw new InvalidPinException("PIN must be 4 to 8 digits");
        }
        UserAccount account = accounts.load(userId)
                .orElseThrow(() -> new WalletNotFoundException("No account for user " + userId));
        long expected = account.getVersion();
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        account.setSecurityPinSalt(Base64.getEncoder().encodeToString(salt));
        account.setSecurityPinHash(Base64.getEncoder().encodeToString(hash(pin.trim(), salt)));
        try {
            accounts.save(account, expected);
        } catch (VersionConflictException e) {
            throw new VaultConflictException("Account changed while setting PIN", e);
        }
        log.info("[Pin] Security PIN set for user {}", userId);
    }

    /**
     * Check a PIN attempt against the stored hash. A user without a PIN never
     * matches.
     */
    public boolean verify(String userId, String pin) {
        UserAccount account = accounts.load(userId).orElse(null);
        if (account == null || !account.isPinSet() || !isValidFormat(pin)) {
            return false;
        }
        byte[] salt = Base64.getDecoder().decode(account.getSecurityPinSalt());
        byte[] expected = Base64.getDecoder().decode(account.getSecurityPinHash());
        boolean matches = MessageDigest.isEqual(expected, hash(pin.trim(), salt));
        if (!matches) {
            log.warn("[Pin] Wrong PIN entered by user {}", userId);
        }
        return matches;
    }

    private static byte[] hash(String pin, byte[] salt) {
        return SCrypt.generate(pin.getBytes(StandardCharsets.UTF_8), salt, SCRYPT_N, SCRYPT_R, SCRYPT_P,
                HASH_LENGTH);
    }
}
