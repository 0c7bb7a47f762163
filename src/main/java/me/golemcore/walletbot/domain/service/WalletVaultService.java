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
import me.golemcore.walletbot.crypto.IntegrityException;
import me.golemcore.walletbot.crypto.SecretCipher;
import me.golemcore.walletbot.crypto.SolanaKeyService;
import me.golemcore.walletbot.crypto.SolanaKeypair;
import me.golemcore.walletbot.domain.exception.DecryptionFailedException;
import me.golemcore.walletbot.domain.exception.DuplicateWalletException;
import me.golemcore.walletbot.domain.exception.InvalidCredentialException;
import me.golemcore.walletbot.domain.exception.InvalidWalletNameException;
import me.golemcore.walletbot.domain.exception.LastWalletException;
import me.golemcore.walletbot.domain.exception.SecretUnavailableException;
import me.golemcore.walletbot.domain.exception.VaultConflictException;
import me.golemcore.walletbot.domain.exception.WalletLimitReachedException;
import me.golemcore.walletbot.domain.exception.WalletNotFoundException;
import me.golemcore.walletbot.domain.model.LegacyWallet;
import me.golemcore.walletbot.domain.model.RevealedSecret;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.domain.model.Wallet;
import me.golemcore.walletbot.domain.model.WalletView;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.port.outbound.UserAccountPort;
import me.golemcore.walletbot.port.outbound.VersionConflictException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Per-user collection of Solana keypairs.
 *
 * <p>
 * Invariants kept by every operation:
 * <ul>
 * <li>a user holds at most {@code bot.vault.max-wallets} wallets</li>
 * <li>a non-empty collection has exactly one active wallet</li>
 * <li>addresses are unique within a user's collection</li>
 * <li>private keys and recovery phrases are stored sealed by
 * {@link SecretCipher} only</li>
 * </ul>
 *
 * <p>
 * Mutations are read-modify-write cycles saved against the version that was
 * read. All validation runs before the loaded document is touched; on failure
 * the document is discarded, so an operation either applies completely or not
 * at all. A concurrent writer surfaces as {@link VaultConflictException}.
 */
@Service
@Slf4j
public class WalletVaultService {

    public static final String FIRST_WALLET_NAME = "Main Wallet";
    private static final String DEFAULT_NAME_PREFIX = "Wallet ";
    private static final Pattern WALLET_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 ]{1,18}[A-Za-z0-9]$");

    private final UserAccountPort accounts;
    private final SecretCipher cipher;
    private final SolanaKeyService keyService;
    private final BotProperties properties;
    private final Clock clock;

    public WalletVaultService(UserAccountPort accounts, SecretCipher cipher, SolanaKeyService keyService,
            BotProperties properties, Clock clock) {
        this.accounts = accounts;
        this.cipher = cipher;
        this.keyService = keyService;
        this.properties = properties;
        this.clock = clock;
    }

    // ===== Account =====

    public boolean hasAccount(String userId) {
        return accounts.load(userId).isPresent();
    }

    /**
     * Load the user's account, creating it with a freshly generated
     * "{@value #FIRST_WALLET_NAME}" when the user is new.
     */
    public UserAccount ensureAccount(String userId, String username) {
        UserAccount existing = accounts.load(userId).orElse(null);
        if (existing != null) {
            return existing;
        }
        Wallet first = newWallet(keyService.generate(), FIRST_WALLET_NAME, true);
        List<Wallet> wallets = new ArrayList<>();
        wallets.add(first);
        UserAccount account = UserAccount.builder()
                .userId(userId)
                .username(username)
                .wallets(wallets)
                .createdAt(clock.instant())
                .build();
        try {
            accounts.create(account);
            log.info("[Vault] Opened account for user {} with wallet {}", userId, first.getId());
            return account;
        } catch (VersionConflictException e) {
            // a parallel /start won the race
            return accounts.load(userId).orElseThrow(() -> new VaultConflictException("Account vanished", e));
        }
    }

    // ===== Reads =====

    public List<WalletView> listWallets(String userId) {
        UserAccount account = requireAccount(userId);
        if (account.getWallets().isEmpty()) {
            Wallet legacy = fromLegacy(account);
            return legacy != null ? List.of(WalletView.of(legacy)) : List.of();
        }
        return account.getWallets().stream().map(WalletView::of).toList();
    }

    public WalletView getActive(String userId) {
        UserAccount account = requireAccount(userId);
        Wallet active = account.getWallets().isEmpty() ? fromLegacy(account) : account.findActiveWallet();
        if (active == null) {
            throw new WalletNotFoundException("User " + userId + " has no active wallet");
        }
        return WalletView.of(active);
    }

    public WalletView getWallet(String userId, String walletId) {
        return WalletView.of(requireWallet(requireAccount(userId), walletId));
    }

    // ===== Mutations =====

    /**
     * Generate a new keypair with a recovery phrase and make it active.
     *
     * @param displayName
     *            name to give the wallet, or {@code null} for "Wallet N"
     */
    public WalletView createWallet(String userId, String displayName) {
        if (displayName != null) {
            validateName(displayName);
        }
        Wallet created = mutate(userId, account -> {
            requireCapacity(account);
            Wallet wallet = newWallet(keyService.generate(),
                    displayName != null ? displayName.trim() : defaultName(account), false);
            activateNew(account, wallet);
            return wallet;
        });
        log.info("[Vault] Created wallet {} for user {}", created.getId(), userId);
        return WalletView.of(created);
    }

    /**
     * Import a recovery phrase or a 64-byte secret key (hex or base58) and make
     * it active.
     */
    public WalletView importWallet(String userId, String secretMaterial) {
        SolanaKeypair keypair = keyService.parse(secretMaterial)
                .orElseThrow(() -> new InvalidCredentialException("Unrecognized secret material"));
        String address = keypair.address();
        Wallet imported = mutate(userId, account -> {
            Wallet existing = findByAddress(account, address);
            if (existing != null && !existing.isWatchOnly()) {
                throw new DuplicateWalletException("Address already stored: " + address);
            }
            if (existing != null) {
                // importing the key of a tracked address upgrades it in place
                existing.setEncryptedPrivateKey(cipher.seal(keypair.secretKeyHex()));
                existing.setEncryptedMnemonic(cipher.seal(keypair.mnemonic()));
                existing.setWatchOnly(false);
                makeActive(account, existing);
                return existing;
            }
            requireCapacity(account);
            Wallet wallet = newWallet(keypair, defaultName(account), false);
            activateNew(account, wallet);
            return wallet;
        });
        log.info("[Vault] Imported wallet {} for user {}", imported.getId(), userId);
        return WalletView.of(imported);
    }

    public WalletView switchActive(String userId, String walletId) {
        Wallet target = mutate(userId, account -> {
            Wallet wallet = requireWallet(account, walletId);
            makeActive(account, wallet);
            return wallet;
        });
        log.debug("[Vault] User {} switched to wallet {}", userId, walletId);
        return WalletView.of(target);
    }

    public WalletView rename(String userId, String walletId, String newName) {
        validateName(newName);
        Wallet renamed = mutate(userId, account -> {
            Wallet wallet = requireWallet(account, walletId);
            wallet.setName(newName.trim());
            return wallet;
        });
        return WalletView.of(renamed);
    }

    /**
     * Remove a wallet. When the active wallet is removed the first remaining one
     * becomes active.
     */
    public void deleteWallet(String userId, String walletId) {
        mutate(userId, account -> {
            Wallet wallet = requireWallet(account, walletId);
            if (account.getWallets().size() <= 1) {
                throw new LastWalletException("Cannot delete the only wallet of user " + userId);
            }
            account.getWallets().remove(wallet);
            if (wallet.isActive()) {
                account.getWallets().get(0).setActive(true);
            }
            return wallet;
        });
        log.info("[Vault] Deleted wallet {} of user {}", walletId, userId);
    }

    /**
     * Track an address without key material. An address already in the
     * collection just becomes active.
     */
    public WalletView trackAddress(String userId, String address) {
        String trimmed = address == null ? "" : address.trim();
        if (!keyService.isAddress(trimmed)) {
            throw new InvalidCredentialException("Not a Solana address");
        }
        Wallet tracked = mutate(userId, account -> {
            Wallet existing = findByAddress(account, trimmed);
            if (existing != null) {
                makeActive(account, existing);
                return existing;
            }
            requireCapacity(account);
            Wallet wallet = Wallet.builder()
                    .id(UUID.randomUUID().toString())
                    .name(defaultName(account))
                    .address(trimmed)
                    .encryptedPrivateKey("")
                    .encryptedMnemonic("")
                    .watchOnly(true)
                    .createdAt(clock.instant())
                    .build();
            activateNew(account, wallet);
            return wallet;
        });
        return WalletView.of(tracked);
    }

    // ===== Secrets =====

    /**
     * Decrypt the key material of one wallet.
     *
     * @throws DecryptionFailedException
     *             if the stored secret does not open under the current master
     *             key
     * @throws SecretUnavailableException
     *             for watch-only wallets
     */
    public RevealedSecret revealSecret(String userId, String walletId) {
        Wallet wallet = requireWallet(requireAccount(userId), walletId);
        if (wallet.isWatchOnly() || wallet.getEncryptedPrivateKey() == null
                || wallet.getEncryptedPrivateKey().isEmpty()) {
            throw new SecretUnavailableException("Wallet " + walletId + " has no stored secret");
        }
        try {
            String privateKey = cipher.open(wallet.getEncryptedPrivateKey());
            String phrase = cipher.open(wallet.getEncryptedMnemonic());
            return new RevealedSecret(wallet.getAddress(), privateKey,
                    phrase == null || phrase.isEmpty() ? null : phrase);
        } catch (IntegrityException e) {
            throw new DecryptionFailedException(walletId, e);
        }
    }

    // ===== Internals =====

    private <T> T mutate(String userId, Function<UserAccount, T> change) {
        UserAccount account = requireAccount(userId);
        long expectedVersion = account.getVersion();
        migrateLegacy(account);
        T result = change.apply(account);
        try {
            accounts.save(account, expectedVersion);
        } catch (VersionConflictException e) {
            log.warn("[Vault] Concurrent update of user {} (expected v{})", userId, expectedVersion);
            throw new VaultConflictException("Account changed concurrently", e);
        }
        return result;
    }

    private UserAccount requireAccount(String userId) {
        return accounts.load(userId)
                .orElseThrow(() -> new WalletNotFoundException("No account for user " + userId));
    }

    private Wallet requireWallet(UserAccount account, String walletId) {
        Wallet wallet = account.getWallets().isEmpty() ? fromLegacy(account) : account.findWallet(walletId);
        if (wallet == null || !wallet.getId().equals(walletId)) {
            throw new WalletNotFoundException("Wallet " + walletId + " not found");
        }
        return wallet;
    }

    private void requireCapacity(UserAccount account) {
        int max = properties.getVault().getMaxWallets();
        if (account.getWallets().size() >= max) {
            throw new WalletLimitReachedException("User " + account.getUserId() + " already has " + max
                    + " wallets");
        }
    }

    private static void validateName(String name) {
        if (name == null || !WALLET_NAME.matcher(name.trim()).matches()) {
            throw new InvalidWalletNameException("Invalid wallet name");
        }
    }

    private Wallet newWallet(SolanaKeypair keypair, String name, boolean active) {
        return Wallet.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .address(keypair.address())
                .encryptedPrivateKey(cipher.seal(keypair.secretKeyHex()))
                .encryptedMnemonic(cipher.seal(keypair.mnemonic()))
                .active(active)
                .createdAt(clock.instant())
                .build();
    }

    private static void activateNew(UserAccount account, Wallet wallet) {
        account.getWallets().add(wallet);
        makeActive(account, wallet);
    }

    private static void makeActive(UserAccount account, Wallet target) {
        for (Wallet wallet : account.getWallets()) {
            wallet.setActive(wallet == target);
        }
    }

    private static Wallet findByAddress(UserAccount account, String address) {
        return account.getWallets().stream()
                .filter(wallet -> address.equals(wallet.getAddress()))
                .findFirst()
                .orElse(null);
    }

    private static String defaultName(UserAccount account) {
        int n = account.getWallets().size() + 1;
        while (hasName(account, DEFAULT_NAME_PREFIX + n)) {
            n++;
        }
        return DEFAULT_NAME_PREFIX + n;
    }

    private static boolean hasName(UserAccount account, String name) {
        return account.getWallets().stream().anyMatch(wallet -> name.equals(wallet.getName()));
    }

    /**
     * Synthesize the wallet described by legacy single-wallet fields. The id is
     * derived from the address so it survives migration.
     */
    private Wallet fromLegacy(UserAccount account) {
        LegacyWallet legacy = account.getLegacyWallet();
        if (legacy == null || !legacy.isPresent()) {
            return null;
        }
        String encryptedKey = legacy.getEncryptedPrivateKey();
        return Wallet.builder()
                .id(UUID.nameUUIDFromBytes(("legacy:" + legacy.getWalletAddress())
                        .getBytes(StandardCharsets.UTF_8)).toString())
                .name(FIRST_WALLET_NAME)
                .address(legacy.getWalletAddress())
                .encryptedPrivateKey(encryptedKey)
                .encryptedMnemonic(legacy.getMnemonic())
                .active(true)
                .watchOnly(encryptedKey == null || encryptedKey.isEmpty())
                .createdAt(account.getCreatedAt())
                .build();
    }

    private void migrateLegacy(UserAccount account) {
        if (!account.getWallets().isEmpty()) {
            return;
        }
        Wallet migrated = fromLegacy(account);
        if (migrated != null) {
            account.getWallets().add(migrated);
            log.info("[Vault] Migrated legacy wallet of user {}", account.getUserId());
        }
    }
}
