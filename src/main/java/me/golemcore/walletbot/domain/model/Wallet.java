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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stored keypair. Secrets are held only in sealed form; a watch-only wallet
 * has an address and no secret at all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wallet {

    private String id;
    private String name;

    /** Base58 public key, never changes after creation. */
    private String address;

    private String encryptedPrivateKey;

    /** Sealed recovery phrase, empty when the wallet was imported from a raw key. */
    private String encryptedMnemonic;

    private boolean active;
    private boolean watchOnly;
    private Instant createdAt;
}
