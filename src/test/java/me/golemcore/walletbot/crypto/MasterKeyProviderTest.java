package me.golemcore.walletbot.crypto;

import me.golemcore.walletbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class MasterKeyProviderTest {

    private static BotProperties properties(String secret) {
        BotProperties properties = new BotProperties();
        properties.getVault().setMasterSecret(secret);
        return properties;
    }

    @Test
    void shouldFailWhenSecretMissing() {
        MasterKeyProvider provider = new MasterKeyProvider(properties(null));

        IllegalStateException error = assertThrows(IllegalStateException.class, provider::getKey);
        assertTrue(error.getMessage().contains("master-secret"));
    }

    @Test
    void shouldFailWhenSecretBlank() {
        MasterKeyProvider provider = new MasterKeyProvider(properties("   "));

        assertThrows(IllegalStateException.class, provider::getKey);
    }

    @Test
    void shouldDeriveAes256KeyOnce() {
        MasterKeyProvider provider = new MasterKeyProvider(properties("correct horse battery staple"));

        SecretKey first = provider.getKey();
        SecretKey second = provider.getKey();

        assertSame(first, second);
        assertEquals("AES", first.getAlgorithm());
        assertEquals(MasterKeyProvider.KEY_LENGTH_BYTES, first.getEncoded().length);
    }

    @Test
    void shouldDeriveSameKeyFromSameSecret() {
        SecretKey a = new MasterKeyProvider(properties("same-secret")).getKey();
        SecretKey b = new MasterKeyProvider(properties("same-secret")).getKey();
        SecretKey c = new MasterKeyProvider(properties("other-secret")).getKey();

        assertArrayEquals(a.getEncoded(), b.getEncoded());
        assertFalse(java.util.Arrays.equals(a.getEncoded(), c.getEncoded()));
    }

    @Test
    void shouldHandOutSingleKeyUnderConcurrentFirstUse() throws Exception {
        MasterKeyProvider provider = new MasterKeyProvider(properties("concurrent-secret"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<SecretKey>> calls = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                calls.add(provider::getKey);
            }
            List<Future<SecretKey>> results = pool.invokeAll(calls);

            SecretKey first = results.get(0).get();
            for (Future<SecretKey> result : results) {
                assertSame(first, result.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
