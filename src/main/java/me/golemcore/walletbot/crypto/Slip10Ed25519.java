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

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * SLIP-0010 hierarchical derivation for ed25519. Only hardened children exist
 * on this curve, so every path index is hardened.
 */
final class Slip10Ed25519 {

    private static final byte[] CURVE_KEY = "ed25519 seed".getBytes(StandardCharsets.US_ASCII);
    private static final int HARDENED_OFFSET = 0x80000000;

    /** Solana default account: m/44'/501'/0'/0' */
    static final int[] SOLANA_PATH = { 44, 501, 0, 0 };

    private Slip10Ed25519() {
    }

    /**
     * Derive the 32-byte private seed at {@code path} from a master seed.
     */
    static byte[] derive(byte[] seed, int... path) {
        byte[] node = hmacSha512(CURVE_KEY, seed);
        byte[] key = Arrays.copyOfRange(node, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(node, 32, 64);

        for (int index : path) {
            byte[] data = ByteBuffer.allocate(1 + 32 + 4)
                    .put((byte) 0)
                    .put(key)
                    .putInt(index | HARDENED_OFFSET)
                    .array();
            node = hmacSha512(chainCode, data);
            key = Arrays.copyOfRange(node, 0, 32);
            chainCode = Arrays.copyOfRange(node, 32, 64);
        }
        return key;
    }

    private static byte[] hmacSha512(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }
}
