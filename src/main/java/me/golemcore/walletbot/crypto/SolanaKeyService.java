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
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generates and parses Solana keypairs.
 *
 * <p>
 * New wallets get a 12-word BIP39 phrase; the keypair is derived from the first
 * 32 bytes of the BIP39 seed along {@code m/44'/501'/0'/0'}. Imported material
 * is auto-detected:
 * <ul>
 * <li>text with whitespace is a recovery phrase</li>
 * <li>128 hex characters are a 64-byte secret key</li>
 * <li>anything else is tried as a base58 64-byte secret key</li>
 * </ul>
 */
@Component
@Slf4j
public class SolanaKeyService {

    private static final int ENTROPY_BYTES = 16;
    private static final int PUBLIC_KEY_LENGTH = 32;
    private static final Pattern HEX_SECRET = Pattern.compile("^[0-9a-fA-F]{128}$");
    private static final Pattern ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SecureRandom random = new SecureRandom();

    /**
     * Generate a fresh keypair together with its recovery phrase.
     */
    public SolanaKeypair generate() {
        byte[] entropy = new byte[ENTROPY_BYTES];
        random.nextBytes(entropy);
        try {
            List<String> words = MnemonicCode.INSTANCE.toMnemonic(entropy);
            return fromMnemonic(words);
        } catch (MnemonicException e) {
            throw new IllegalStateException("Unable to encode mnemonic", e);
        }
    }

    /**
     * Parse user-supplied secret material.
     *
     * @return the keypair, or empty when the text is neither a valid phrase nor a
     *         valid 64-byte secret key
     */
    public Optional<SolanaKeypair> parse(String secretMaterial) {
        if (secretMaterial == null || secretMaterial.isBlank()) {
            return Optional.empty();
        }
        String text = secretMaterial.trim();
        if (WHITESPACE.matcher(text).find()) {
            return parseMnemonic(text);
        }
        byte[] secret = decodeSecretKey(text);
        if (secret == null || secret.length != SolanaKeypair.SECRET_KEY_LENGTH) {
            return Optional.empty();
        }
        SolanaKeypair keypair = new SolanaKeypair(secret, null);
        if (!keypair.isConsistent()) {
            log.debug("[Keys] Secret key rejected: public half does not match seed");
            return Optional.empty();
        }
        return Optional.of(keypair);
    }

    /**
     * Whether the text is a plausible Solana address: base58, 32 to 44
     * characters, decoding to a 32-byte public key.
     */
    public boolean isAddress(String text) {
        if (text == null || !ADDRESS.matcher(text.trim()).matches()) {
            return false;
        }
        try {
            return Base58.decode(text.trim()).length == PUBLIC_KEY_LENGTH;
        } catch (AddressFormatException e) {
            return false;
        }
    }

    private Optional<SolanaKeypair> parseMnemonic(String text) {
        List<String> words = Arrays.asList(WHITESPACE.split(text.toLowerCase(Locale.ROOT)));
        try {
            MnemonicCode.INSTANCE.check(words);
        } catch (MnemonicException e) {
            log.debug("[Keys] Recovery phrase rejected: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of(fromMnemonic(words));
    }

    private SolanaKeypair fromMnemonic(List<String> words) {
        byte[] seed = MnemonicCode.toSeed(words, "");
        byte[] derived = Slip10Ed25519.derive(Arrays.copyOfRange(seed, 0, SolanaKeypair.SEED_LENGTH),
                Slip10Ed25519.SOLANA_PATH);
        return SolanaKeypair.fromSeed(derived, String.join(" ", words));
    }

    private byte[] decodeSecretKey(String text) {
        if (HEX_SECRET.matcher(text).matches()) {
            return Hex.decode(text);
        }
        try {
            return Base58.decode(text);
        } catch (AddressFormatException e) {
            return null;
        }
    }
}
