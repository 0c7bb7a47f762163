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

package me.golemcore.walletbot.crypto;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Process-wide holder of the AES master key.
 *
 * <p>
 * The key is derived lazily from {@code bot.vault.master-secret} with SCrypt on
 * first use and cached for the life of the process. Derivation runs at most
 * once even when several threads ask for the key concurrently; after that the
 * key is read without locking.
 */
@Component
@Slf4j
public class MasterKeyProvider {

    static final int SCRYPT_N = 1 << 15;
    static final int SCRYPT_R = 8;
    static final int SCRYPT_P = 1;
    static final int KEY_LENGTH_BYTES = 32;

    private final BotProperties properties;

    private volatile SecretKey masterKey;

    public MasterKeyProvider(BotProperties properties) {
        this.properties = properties;
    }

    /**
     * Get the master key, deriving it on first call.
     *
     * @throws IllegalStateException
     *             if no master secret is configured
     */
    public SecretKey getKey() {
        SecretKey key = masterKey;
        if (key == null) {
            synchronized (this) {
                key = masterKey;
                if (key == null) {
                    key = derive();
                    masterKey = key;
                }
            }
        }
        return key;
    }

    private SecretKey derive() {
        BotProperties.VaultProperties vault = properties.getVault();
        String secret = vault.getMasterSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("bot.vault.master-secret is not configured");
        }
        long started = System.nanoTime();
        byte[] keyBytes = SCrypt.generate(
                secret.getBytes(StandardCharsets.UTF_8),
                vault.getKdfSalt().getBytes(StandardCharsets.UTF_8),
                SCRYPT_N, SCRYPT_R, SCRYPT_P, KEY_LENGTH_BYTES);
        log.info("[Vault] Master key derived in {} ms", (System.nanoTime() - started) / 1_000_000);
        return new SecretKeySpec(keyBytes, "AES");
    }
}
