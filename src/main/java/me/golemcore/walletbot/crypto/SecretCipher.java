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

import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Authenticated encryption of single secrets (private keys, recovery phrases)
 * with AES-256-GCM under the process master key.
 *
 * <p>
 * Sealed layout: {@code nonce(12) || tag(16) || ciphertext}. Every call to
 * {@link #encrypt(byte[])} draws a fresh nonce, so sealing the same plaintext
 * twice never yields the same bytes. Empty input maps to an empty sentinel and
 * never reaches the cipher.
 */
@Component
public class SecretCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int NONCE_LENGTH = 12;
    static final int TAG_LENGTH = 16;
    private static final byte[] EMPTY = new byte[0];

    private final MasterKeyProvider keyProvider;
    private final SecureRandom random = new SecureRandom();

    public SecretCipher(MasterKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    public byte[] encrypt(byte[] plaintext) {
        if (plaintext == null || plaintext.length == 0) {
            return EMPTY;
        }
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyProvider.getKey(), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            // JCE appends the tag after the ciphertext
            byte[] out = cipher.doFinal(plaintext);
            int cipherLength = out.length - TAG_LENGTH;
            return ByteBuffer.allocate(NONCE_LENGTH + out.length)
                    .put(nonce)
                    .put(out, cipherLength, TAG_LENGTH)
                    .put(out, 0, cipherLength)
                    .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    /**
     * Open a sealed blob.
     *
     * @throws IntegrityException
     *             if the blob is malformed or its tag does not verify
     */
    public byte[] decrypt(byte[] sealed) {
        if (sealed == null || sealed.length == 0) {
            return EMPTY;
        }
        if (sealed.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new IntegrityException("Sealed data too short: " + sealed.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(sealed);
        byte[] nonce = new byte[NONCE_LENGTH];
        buffer.get(nonce);
        byte[] tag = new byte[TAG_LENGTH];
        buffer.get(tag);
        byte[] joined = new byte[buffer.remaining() + TAG_LENGTH];
        int cipherLength = buffer.remaining();
        buffer.get(joined, 0, cipherLength);
        System.arraycopy(tag, 0, joined, cipherLength, TAG_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyProvider.getKey(), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(joined);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Unable to open sealed data", e);
        }
    }

    /**
     * Seal a UTF-8 string to Base64 text for storage. {@code null} and empty map
     * to the empty string.
     */
    public String seal(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        return Base64.getEncoder().encodeToString(encrypt(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Open Base64 text produced by {@link #seal(String)}. {@code null} stays
     * {@code null}; the empty sentinel opens to the empty string.
     *
     * @throws IntegrityException
     *             if the text is not valid sealed data for the current key
     */
    public String open(String sealed) {
        if (sealed == null) {
            return null;
        }
        if (sealed.isEmpty()) {
            return "";
        }
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(sealed);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Sealed text is not Base64", e);
        }
        return new String(decrypt(blob), StandardCharsets.UTF_8);
    }
}
