package me.golemcore.walletbot.domain.service;

import me.golemcore.walletbot.adapter.outbound.storage.JsonUserAccountRepository;
import me.golemcore.walletbot.domain.exception.InvalidPinException;
import me.golemcore.walletbot.domain.exception.WalletNotFoundException;
import me.golemcore.walletbot.domain.model.UserAccount;
import me.golemcore.walletbot.testsupport.TestVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SecurityPinServiceTest {

    private static final String USER_ID = "1001";

    @TempDir
    Path tempDir;

    private JsonUserAccountRepository repository;
    private SecurityPinService pins;

    @BeforeEach
    void setUp() {
        repository = TestVault.repository(TestVault.properties(tempDir), Clock.systemUTC());
        repository.create(UserAccount.builder().userId(USER_ID).wallets(new ArrayList<>()).build());
        pins = new SecurityPinService(repository);
    }

    @Test
    void shouldValidateFormat() {
        assertTrue(pins.isValidFormat("1234"));
        assertTrue(pins.isValidFormat("12345678"));
        assertTrue(pins.isValidFormat(" 2468 "));
        assertFalse(pins.isValidFormat("123"));
        assertFalse(pins.isValidFormat("123456789"));
        assertFalse(pins.isValidFormat("12a4"));
        assertFalse(pins.isValidFormat(null));
    }

    @Test
    void shouldStoreOnlySaltedHash() {
        assertFalse(pins.hasPin(USER_ID));

        pins.setPin(USER_ID, "4321");

        UserAccount account = repository.load(USER_ID).orElseThrow();
        assertTrue(pins.hasPin(USER_ID));
        assertNotNull(account.getSecurityPinSalt());
        assertNotEquals("4321", account.getSecurityPinHash());
        assertFalse(account.getSecurityPinHash().contains("4321"));
    }

    @Test
    void shouldVerifyCorrectPinOnly() {
        pins.setPin(USER_ID, "4321");

        assertTrue(pins.verify(USER_ID, "4321"));
        assertFalse(pins.verify(USER_ID, "1234"));
        assertFalse(pins.verify(USER_ID, "abcd"));
        assertFalse(pins.verify(USER_ID, null));
    }

    @Test
    void shouldReplacePinOnChange() {
        pins.setPin(USER_ID, "4321");
        String firstSalt = repository.load(USER_ID).orElseThrow().getSecurityPinSalt();

        pins.setPin(USER_ID, "98765");

        assertFalse(pins.verify(USER_ID, "4321"));
        assertTrue(pins.verify(USER_ID, "98765"));
        assertNotEquals(firstSalt, repository.load(USER_ID).orElseThrow().getSecurityPinSalt());
    }

    @Test
    void shouldRejectMalformedPin() {
        assertThrows(InvalidPinException.class, () -> pins.setPin(USER_ID, "12"));
        assertFalse(pins.hasPin(USER_ID));
    }

    @Test
    void shouldFailWithoutAccount() {
        assertThrows(WalletNotFoundException.class, () -> pins.setPin("nobody", "1234"));
        assertFalse(pins.verify("nobody", "1234"));
        assertFalse(pins.hasPin("nobody"));
    }
}
