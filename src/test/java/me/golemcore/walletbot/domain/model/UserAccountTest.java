package me.golemcore.walletbot.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.walletbot.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserAccountTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = AutoConfiguration.objectMapper();
    }

    private static Wallet wallet(String id, String address, boolean active) {
        return Wallet.builder()
                .id(id)
                .name("Wallet " + id)
                .address(address)
                .encryptedPrivateKey("key-" + id)
                .encryptedMnemonic("phrase-" + id)
                .active(active)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void shouldMirrorActiveWalletIntoLegacyFields() throws Exception {
        List<Wallet> wallets = new ArrayList<>(List.of(wallet("a", "AddrA", false), wallet("b", "AddrB", true)));
        UserAccount account = UserAccount.builder().userId("42").wallets(wallets).build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(account));

        assertEquals("AddrB", json.get("walletAddress").asText());
        assertEquals("key-b", json.get("encryptedPrivateKey").asText());
        assertEquals("phrase-b", json.get("mnemonic").asText());
        assertEquals(2, json.get("wallets").size());
        assertFalse(json.has("legacyWallet"));
        assertFalse(json.has("pinSet"));
    }

    @Test
    void shouldReadLegacySingleWalletDocument() throws Exception {
        String json = "{\"userId\":\"42\",\"walletAddress\":\"LegacyAddr\","
                + "\"encryptedPrivateKey\":\"sealed-key\",\"mnemonic\":\"sealed-phrase\"}";

        UserAccount account = mapper.readValue(json, UserAccount.class);

        assertTrue(account.getWallets().isEmpty());
        assertNotNull(account.getLegacyWallet());
        assertTrue(account.getLegacyWallet().isPresent());
        assertEquals("LegacyAddr", account.getWalletAddress());
        assertEquals("sealed-key", account.getEncryptedPrivateKey());
        assertEquals("sealed-phrase", account.getMnemonic());
    }

    @Test
    void shouldIgnoreUnknownFields() throws Exception {
        String json = "{\"userId\":\"42\",\"wallets\":[],\"futureField\":true}";

        UserAccount account = mapper.readValue(json, UserAccount.class);

        assertEquals("42", account.getUserId());
    }

    @Test
    void shouldFindWalletsById() {
        UserAccount account = UserAccount.builder()
                .wallets(new ArrayList<>(List.of(wallet("a", "AddrA", true), wallet("b", "AddrB", false))))
                .build();

        assertEquals("AddrB", account.findWallet("b").getAddress());
        assertNull(account.findWallet("missing"));
        assertNull(account.findWallet(null));
        assertEquals("a", account.findActiveWallet().getId());
    }

    @Test
    void shouldReportPinOnlyWhenHashPresent() {
        UserAccount account = new UserAccount();
        assertFalse(account.isPinSet());

        account.setSecurityPinHash("hash");

        assertTrue(account.isPinSet());
    }

    @Test
    void shouldShortenAddressInView() {
        WalletView view = WalletView.of(wallet("a", "7EcDhSYGxXyscszYEp35KHN8vvw3svAuLKTzXwCFLtV", true));

        assertEquals("7EcD...FLtV", view.shortAddress());
        assertTrue(view.hasRecoveryPhrase());
    }

    @Test
    void shouldNotExposeSecretsInToString() {
        RevealedSecret secret = new RevealedSecret("Addr", "private-key-hex", "word word word");

        assertFalse(secret.toString().contains("private-key-hex"));
        assertFalse(secret.toString().contains("word"));
        assertTrue(secret.hasRecoveryPhrase());
        assertFalse(new RevealedSecret("Addr", "k", null).hasRecoveryPhrase());
    }

    @Test
    void shouldNotExposeTextPayloadInEventToString() {
        WalletEvent event = WalletEvent.text("1", "1", 5, "my secret phrase");

        assertFalse(event.toString().contains("secret"));
        assertTrue(WalletEvent.button("1", "1", 5, "wallet:menu").toString().contains("wallet:menu"));
    }
}
