package me.golemcore.walletbot.domain.service;

import me.golemcore.walletbot.adapter.outbound.storage.JsonUserAccountRepository;
import me.golemcore.walletbot.crypto.MasterKeyProvider;
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
import me.golemcore.walletbot.domain.model.RevealedSecret;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.domain.model.Wallet;
import me.golemcore.walletbot.domain.model.WalletView;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.port.outbound.UserAccountPort;
import me.golemcore.walletbot.port.outbound.VersionConflictException;
import me.golemcore.walletbot.testsupport.MutableClock;
import me.golemcore.walletbot.testsupport.TestVault;
import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WalletVaultServiceTest {

    private static final String USER_ID = "1001";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private JsonUserAccountRepository repository;
    private SecretCipher cipher;
    private SolanaKeyService keyService;
    private MutableClock clock;
    private WalletVaultService vault;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        properties = TestVault.properties(tempDir);
        repository = TestVault.repository(properties, clock);
        cipher = TestVault.cipher((byte) 1);
        keyService = new SolanaKeyService();
        vault = new WalletVaultService(repository, cipher, keyService, properties, clock);
    }

    private static long activeCount(List<WalletView> wallets) {
        return wallets.stream().filter(WalletView::active).count();
    }

    // ===== Account =====

    @Test
    void shouldOpenAccountWithOneActiveWallet() {
        assertFalse(vault.hasAccount(USER_ID));

        vault.ensureAccount(USER_ID, "alice");

        List<WalletView> wallets = vault.listWallets(USER_ID);
        assertEquals(1, wallets.size());
        assertEquals(WalletVaultService.FIRST_WALLET_NAME, wallets.get(0).name());
        assertTrue(wallets.get(0).active());
        assertTrue(wallets.get(0).hasRecoveryPhrase());
        assertTrue(vault.hasAccount(USER_ID));
    }

    @Test
    void shouldKeepExistingAccountOnRepeatedStart() {
        vault.ensureAccount(USER_ID, "alice");
        String address = vault.getActive(USER_ID).address();

        vault.ensureAccount(USER_ID, "alice");

        assertEquals(address, vault.getActive(USER_ID).address());
        assertEquals(1, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldNeverStoreSecretsInPlaintext() throws Exception {
        vault.ensureAccount(USER_ID, "alice");
        RevealedSecret secret = vault.revealSecret(USER_ID, vault.getActive(USER_ID).id());

        String document = Files.readString(tempDir.resolve("users").resolve(USER_ID + ".json"),
                StandardCharsets.UTF_8);

        assertFalse(document.contains(secret.privateKey()));
        assertFalse(document.contains(secret.recoveryPhrase()));
        assertTrue(document.contains(secret.address()));
    }

    @Test
    void shouldFailReadsForUnknownUser() {
        assertThrows(WalletNotFoundException.class, () -> vault.listWallets("nobody"));
        assertThrows(WalletNotFoundException.class, () -> vault.createWallet("nobody", null));
    }

    // ===== Create =====

    @Test
    void shouldCreateAndActivateNewWallet() {
        vault.ensureAccount(USER_ID, "alice");

        WalletView created = vault.createWallet(USER_ID, null);

        assertEquals("Wallet 2", created.name());
        assertTrue(created.active());
        List<WalletView> wallets = vault.listWallets(USER_ID);
        assertEquals(2, wallets.size());
        assertEquals(1, activeCount(wallets));
        assertEquals(created.id(), vault.getActive(USER_ID).id());
    }

    @Test
    void shouldCreateWithDisplayName() {
        vault.ensureAccount(USER_ID, "alice");

        WalletView created = vault.createWallet(USER_ID, " Savings ");

        assertEquals("Savings", created.name());
    }

    @Test
    void shouldEnforceCapacity() {
        vault.ensureAccount(USER_ID, "alice");
        int max = properties.getVault().getMaxWallets();
        for (int i = 1; i < max; i++) {
            vault.createWallet(USER_ID, null);
        }

        assertThrows(WalletLimitReachedException.class, () -> vault.createWallet(USER_ID, null));
        assertEquals(max, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldEnforceCapacityOnImport() {
        vault.ensureAccount(USER_ID, "alice");
        int max = properties.getVault().getMaxWallets();
        for (int i = 1; i < max; i++) {
            vault.createWallet(USER_ID, null);
        }
        SolanaKeypair external = keyService.generate();

        assertThrows(WalletLimitReachedException.class, () -> vault.importWallet(USER_ID, external.mnemonic()));
        List<WalletView> wallets = vault.listWallets(USER_ID);
        assertEquals(max, wallets.size());
        assertTrue(wallets.stream().noneMatch(w -> w.address().equals(external.address())));
    }

    @Test
    void shouldKeepExactlyOneActiveWalletAcrossMixedOperations() {
        vault.ensureAccount(USER_ID, "alice");
        WalletView created = vault.createWallet(USER_ID, null);
        assertEquals(1, activeCount(vault.listWallets(USER_ID)));
        WalletView imported = vault.importWallet(USER_ID, keyService.generate().mnemonic());
        assertEquals(1, activeCount(vault.listWallets(USER_ID)));
        vault.switchActive(USER_ID, created.id());
        assertEquals(1, activeCount(vault.listWallets(USER_ID)));
        vault.deleteWallet(USER_ID, created.id());
        assertEquals(1, activeCount(vault.listWallets(USER_ID)));
        vault.deleteWallet(USER_ID, imported.id());

        List<WalletView> wallets = vault.listWallets(USER_ID);
        assertEquals(1, wallets.size());
        assertEquals(1, activeCount(wallets));
    }

    @Test
    void shouldNotLoseUpdatesUnderConcurrentCreates() throws Exception {
        WalletVaultService shared = new WalletVaultService(repository,
                new SecretCipher(new MasterKeyProvider(properties)), keyService, properties, clock);
        shared.ensureAccount(USER_ID, "alice");
        int max = properties.getVault().getMaxWallets();
        int tasks = 24;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < tasks; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    while (true) {
                        try {
                            shared.createWallet(USER_ID, null);
                            return true;
                        } catch (VaultConflictException e) {
                            Thread.onSpinWait();
                        } catch (WalletLimitReachedException e) {
                            return false;
                        }
                    }
                }));
            }
            start.countDown();
            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get(60, TimeUnit.SECONDS)) {
                    created++;
                }
            }

            List<WalletView> wallets = shared.listWallets(USER_ID);
            assertEquals(max - 1, created);
            assertEquals(max, wallets.size());
            assertEquals(1, activeCount(wallets));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldPickUnusedDefaultName() {
        vault.ensureAccount(USER_ID, "alice");
        WalletView second = vault.createWallet(USER_ID, null);
        vault.rename(USER_ID, second.id(), "Wallet 3");

        WalletView third = vault.createWallet(USER_ID, null);

        assertEquals("Wallet 4", third.name());
    }

    // ===== Import =====

    @Test
    void shouldImportPhraseAndRevealIt() {
        vault.ensureAccount(USER_ID, "alice");
        SolanaKeypair external = keyService.generate();

        WalletView imported = vault.importWallet(USER_ID, external.mnemonic());

        assertEquals(external.address(), imported.address());
        assertTrue(imported.active());
        RevealedSecret secret = vault.revealSecret(USER_ID, imported.id());
        assertEquals(external.secretKeyHex(), secret.privateKey());
        assertEquals(external.mnemonic(), secret.recoveryPhrase());
    }

    @Test
    void shouldImportPrivateKeyWithoutPhrase() {
        vault.ensureAccount(USER_ID, "alice");
        SolanaKeypair external = keyService.generate();

        WalletView imported = vault.importWallet(USER_ID, Base58.encode(external.secretKey()));

        assertFalse(imported.hasRecoveryPhrase());
        assertNull(vault.revealSecret(USER_ID, imported.id()).recoveryPhrase());
    }

    @Test
    void shouldRejectDuplicateImport() {
        vault.ensureAccount(USER_ID, "alice");
        SolanaKeypair external = keyService.generate();
        vault.importWallet(USER_ID, external.secretKeyHex());

        assertThrows(DuplicateWalletException.class, () -> vault.importWallet(USER_ID, external.mnemonic()));
        assertEquals(2, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldRejectUnrecognizedMaterial() {
        vault.ensureAccount(USER_ID, "alice");

        assertThrows(InvalidCredentialException.class, () -> vault.importWallet(USER_ID, "hello world"));
        assertEquals(1, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldUpgradeTrackedAddressOnImport() {
        vault.ensureAccount(USER_ID, "alice");
        SolanaKeypair external = keyService.generate();
        WalletView tracked = vault.trackAddress(USER_ID, external.address());
        assertTrue(tracked.watchOnly());

        WalletView imported = vault.importWallet(USER_ID, external.mnemonic());

        assertEquals(tracked.id(), imported.id());
        assertFalse(imported.watchOnly());
        assertEquals(2, vault.listWallets(USER_ID).size());
        assertEquals(external.secretKeyHex(), vault.revealSecret(USER_ID, imported.id()).privateKey());
    }

    // ===== Switch / rename =====

    @Test
    void shouldSwitchActiveWallet() {
        vault.ensureAccount(USER_ID, "alice");
        String firstId = vault.getActive(USER_ID).id();
        vault.createWallet(USER_ID, null);

        WalletView active = vault.switchActive(USER_ID, firstId);

        assertEquals(firstId, active.id());
        assertEquals(firstId, vault.getActive(USER_ID).id());
        assertEquals(1, activeCount(vault.listWallets(USER_ID)));
    }

    @Test
    void shouldFailSwitchToUnknownWallet() {
        vault.ensureAccount(USER_ID, "alice");

        assertThrows(WalletNotFoundException.class, () -> vault.switchActive(USER_ID, "missing"));
    }

    @Test
    void shouldRenameWithValidName() {
        vault.ensureAccount(USER_ID, "alice");
        String id = vault.getActive(USER_ID).id();

        WalletView renamed = vault.rename(USER_ID, id, "Trading 2");

        assertEquals("Trading 2", renamed.name());
        assertEquals("Trading 2", vault.getWallet(USER_ID, id).name());
    }

    @Test
    void shouldRejectInvalidNames() {
        vault.ensureAccount(USER_ID, "alice");
        String id = vault.getActive(USER_ID).id();

        assertThrows(InvalidWalletNameException.class, () -> vault.rename(USER_ID, id, "ab"));
        assertThrows(InvalidWalletNameException.class, () -> vault.rename(USER_ID, id, "Wallet_2"));
        assertThrows(InvalidWalletNameException.class, () -> vault.rename(USER_ID, id, "A name far too long 123"));
        assertThrows(InvalidWalletNameException.class, () -> vault.rename(USER_ID, id, null));
        assertEquals(WalletVaultService.FIRST_WALLET_NAME, vault.getWallet(USER_ID, id).name());
    }

    // ===== Delete =====

    @Test
    void shouldRefuseToDeleteLastWallet() {
        vault.ensureAccount(USER_ID, "alice");
        String id = vault.getActive(USER_ID).id();

        assertThrows(LastWalletException.class, () -> vault.deleteWallet(USER_ID, id));
        assertEquals(1, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldPromoteRemainingWalletWhenActiveDeleted() {
        vault.ensureAccount(USER_ID, "alice");
        String firstId = vault.getActive(USER_ID).id();
        WalletView second = vault.createWallet(USER_ID, null);

        vault.deleteWallet(USER_ID, second.id());

        List<WalletView> wallets = vault.listWallets(USER_ID);
        assertEquals(1, wallets.size());
        assertEquals(firstId, vault.getActive(USER_ID).id());
    }

    @Test
    void shouldKeepActiveWhenInactiveDeleted() {
        vault.ensureAccount(USER_ID, "alice");
        String firstId = vault.getActive(USER_ID).id();
        WalletView second = vault.createWallet(USER_ID, null);

        vault.deleteWallet(USER_ID, firstId);

        assertEquals(second.id(), vault.getActive(USER_ID).id());
        assertThrows(WalletNotFoundException.class, () -> vault.getWallet(USER_ID, firstId));
    }

    // ===== Address tracking =====

    @Test
    void shouldTrackAddressAsWatchOnly() {
        vault.ensureAccount(USER_ID, "alice");
        String address = keyService.generate().address();

        WalletView tracked = vault.trackAddress(USER_ID, address);

        assertTrue(tracked.watchOnly());
        assertTrue(tracked.active());
        assertThrows(SecretUnavailableException.class, () -> vault.revealSecret(USER_ID, tracked.id()));
    }

    @Test
    void shouldSwitchToKnownAddress() {
        vault.ensureAccount(USER_ID, "alice");
        WalletView first = vault.getActive(USER_ID);
        vault.createWallet(USER_ID, null);

        WalletView tracked = vault.trackAddress(USER_ID, first.address());

        assertEquals(first.id(), tracked.id());
        assertFalse(tracked.watchOnly());
        assertEquals(2, vault.listWallets(USER_ID).size());
    }

    @Test
    void shouldRejectInvalidAddress() {
        vault.ensureAccount(USER_ID, "alice");

        assertThrows(InvalidCredentialException.class, () -> vault.trackAddress(USER_ID, "not-an-address"));
        assertThrows(InvalidCredentialException.class, () -> vault.trackAddress(USER_ID, null));
    }

    // ===== Secrets =====

    @Test
    void shouldReportTamperedSecretAsDecryptionFailure() {
        vault.ensureAccount(USER_ID, "alice");
        String id = vault.getActive(USER_ID).id();
        UserAccount account = repository.load(USER_ID).orElseThrow();
        account.findWallet(id).setEncryptedPrivateKey(TestVault.cipher((byte) 2).seal("foreign"));
        repository.save(account, account.getVersion());

        DecryptionFailedException error = assertThrows(DecryptionFailedException.class,
                () -> vault.revealSecret(USER_ID, id));
        assertEquals(id, error.getWalletId());
    }

    // ===== Legacy documents =====

    @Test
    void shouldExposeLegacyWalletAndMigrateOnFirstWrite() throws Exception {
        SolanaKeypair legacyKey = keyService.generate();
        String json = "{\"userId\":\"" + USER_ID + "\",\"version\":3,"
                + "\"walletAddress\":\"" + legacyKey.address() + "\","
                + "\"encryptedPrivateKey\":\"" + cipher.seal(legacyKey.secretKeyHex()) + "\","
                + "\"mnemonic\":\"" + cipher.seal(legacyKey.mnemonic()) + "\"}";
        Files.writeString(tempDir.resolve("users").resolve(USER_ID + ".json"), json, StandardCharsets.UTF_8);

        List<WalletView> before = vault.listWallets(USER_ID);
        assertEquals(1, before.size());
        assertEquals(legacyKey.address(), before.get(0).address());
        assertTrue(before.get(0).active());
        String legacyId = before.get(0).id();
        assertEquals(legacyId, vault.listWallets(USER_ID).get(0).id());
        assertEquals(legacyKey.mnemonic(), vault.revealSecret(USER_ID, legacyId).recoveryPhrase());

        WalletView created = vault.createWallet(USER_ID, null);

        UserAccount stored = repository.load(USER_ID).orElseThrow();
        assertEquals(2, stored.getWallets().size());
        assertEquals(legacyId, stored.getWallets().get(0).getId());
        assertEquals(4, stored.getVersion());
        assertEquals(created.address(), stored.getWalletAddress());
    }

    @Test
    void shouldMirrorActiveWalletIntoLegacyFields() {
        vault.ensureAccount(USER_ID, "alice");
        WalletView second = vault.createWallet(USER_ID, null);

        UserAccount stored = repository.load(USER_ID).orElseThrow();
        Wallet active = stored.findActiveWallet();

        assertEquals(second.address(), stored.getWalletAddress());
        assertEquals(active.getEncryptedPrivateKey(), stored.getEncryptedPrivateKey());
        assertEquals(active.getEncryptedMnemonic(), stored.getMnemonic());
    }

    // ===== Concurrency =====

    @Test
    void shouldReportConcurrentUpdateAsConflict() {
        vault.ensureAccount(USER_ID, "alice");
        UserAccount account = repository.load(USER_ID).orElseThrow();
        UserAccountPort racing = mock(UserAccountPort.class);
        when(racing.load(USER_ID)).thenReturn(Optional.of(account));
        when(racing.save(any(UserAccount.class), anyLong()))
                .thenThrow(new VersionConflictException(USER_ID, 1, 2));
        WalletVaultService racingVault = new WalletVaultService(racing, cipher, keyService, properties, clock);

        assertThrows(VaultConflictException.class, () -> racingVault.createWallet(USER_ID, null));
    }

    @Test
    void shouldReturnWinnerWhenCreateRaces() {
        UserAccount winner = UserAccount.builder().userId(USER_ID).version(1).build();
        UserAccountPort racing = mock(UserAccountPort.class);
        when(racing.load(USER_ID)).thenReturn(Optional.empty(), Optional.of(winner));
        when(racing.create(any(UserAccount.class))).thenThrow(new VersionConflictException(USER_ID, 0, 1));
        WalletVaultService racingVault = new WalletVaultService(racing, cipher, keyService, properties, clock);

        assertSame(winner, racingVault.ensureAccount(USER_ID, "alice"));
    }
}
