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

import org.bitcoinj.core.Base58;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * An ed25519 keypair in Solana's layout: the 64-byte secret key is the 32-byte
 * private seed followed by the 32-byte public key. The address is the base58
 * public key.
 *
 * @param secretKey
 *            64-byte secret key
 * @param mnemonic
 *            recovery phrase the key was derived from, or {@code null}
 */
public record SolanaKeypair(byte[] secretKey, String mnemonic) {

    public static final int SEED_LENGTH = 32;
    public static final int SECRET_KEY_LENGTH = 64;

    public SolanaKeypair {
        if (secretKey == null || secretKey.length != SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("Secret key must be 64 bytes");
        }
        secretKey = secretKey.clone();
    }

    /**
     * Build a keypair from a 32-byte private seed.
     */
    public static SolanaKeypair fromSeed(byte[] seed, String mnemonic) {
        if (seed == null || seed.length != SEED_LENGTH) {
            throw new IllegalArgumentException("Seed must be 32 bytes");
        }
        byte[] publicKey = new Ed25519PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded();
        byte[] secret = new byte[SECRET_KEY_LENGTH];
        System.arraycopy(seed, 0, secret, 0, SEED_LENGTH);
        System.arraycopy(publicKey, 0, secret, SEED_LENGTH, publicKey.length);
        return new SolanaKeypair(secret, mnemonic);
    }

    /**
     * Whether the public half of the secret key matches the key its seed
     * produces.
     */
    public boolean isConsistent() {
        byte[] seed = Arrays.copyOfRange(secretKey, 0, SEED_LENGTH);
        byte[] derived = new Ed25519PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded();
        return Arrays.equals(derived, publicKey());
    }

    public byte[] publicKey() {
        return Arrays.copyOfRange(secretKey, SEED_LENGTH, SECRET_KEY_LENGTH);
    }

    public String address() {
        return Base58.encode(publicKey());
    }

    public String secretKeyHex() {
        return Hex.toHexString(secretKey);
    }

    @Override
    public byte[] secretKey() {
        return secretKey.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SolanaKeypair that && Arrays.equals(secretKey, that.secretKey);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(secretKey);
    }

    @Override
    public String toString() {
        return "SolanaKeypair[address=" + address() + "]";
    }
}
