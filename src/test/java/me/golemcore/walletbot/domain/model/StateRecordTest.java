package me.golemcore.walletbot.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import me.golemcore.walletbot.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StateRecordTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String WALLET_ID = "w-1";

    @Test
    void shouldCarryWalletIdForRenaming() {
        StateRecord state = StateRecord.renaming(WALLET_ID);

        assertEquals(PendingInput.RENAMING_WALLET, state.getKind());
        assertEquals(WALLET_ID, state.getWalletId());
        assertNull(state.getPurpose());
    }

    @Test
    void shouldRequireWalletIdWhereKindNeedsOne() {
        assertThrows(IllegalArgumentException.class, () -> StateRecord.renaming(null));
        assertThrows(IllegalArgumentException.class, () -> StateRecord.exportConfirm(" "));
        assertThrows(IllegalArgumentException.class,
                () -> StateRecord.awaitingCode(CodePurpose.EXPORT_SECRET, null));
        assertThrows(IllegalArgumentException.class,
                () -> StateRecord.awaitingCode(CodePurpose.DELETE_WALLET, null));
    }

    @Test
    void shouldRequirePurposeForAwaitingCode() {
        assertThrows(IllegalArgumentException.class, () -> StateRecord.awaitingCode(null, WALLET_ID));
    }

    @Test
    void shouldAllowPinChangeWithoutWallet() {
        StateRecord state = StateRecord.awaitingCode(CodePurpose.CHANGE_PIN, null);

        assertEquals(CodePurpose.CHANGE_PIN, state.getPurpose());
        assertNull(state.getWalletId());
    }

    @Test
    void shouldRejectPayloadOnKindsWithoutOne() {
        assertThrows(IllegalArgumentException.class,
                () -> new StateRecord(PendingInput.IMPORTING_WALLET, WALLET_ID, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new StateRecord(PendingInput.SETTING_PIN, null, CodePurpose.CHANGE_PIN, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new StateRecord(PendingInput.RENAMING_WALLET, WALLET_ID, CodePurpose.EXPORT_SECRET, null,
                        null));
    }

    @Test
    void shouldExpireAtDeadline() {
        StateRecord state = StateRecord.importing().stamped(NOW, Duration.ofMinutes(10));

        assertEquals(NOW, state.getCreatedAt());
        assertFalse(state.isExpiredAt(NOW.plus(Duration.ofMinutes(9))));
        assertTrue(state.isExpiredAt(NOW.plus(Duration.ofMinutes(10))));
        assertTrue(state.isExpiredAt(NOW.plus(Duration.ofHours(1))));
    }

    @Test
    void shouldNeverExpireWhenUnstamped() {
        assertFalse(StateRecord.settingPin().isExpiredAt(NOW.plus(Duration.ofDays(365))));
    }

    @Test
    void shouldSurviveJsonRoundTrip() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        StateRecord state = StateRecord.awaitingCode(CodePurpose.DELETE_WALLET, WALLET_ID)
                .stamped(NOW, Duration.ofMinutes(10));

        StateRecord restored = mapper.readValue(mapper.writeValueAsString(state), StateRecord.class);

        assertEquals(state, restored);
    }

    @Test
    void shouldRejectInvalidDocumentOnRead() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        String json = "{\"kind\":\"RENAMING_WALLET\"}";

        assertThrows(ValueInstantiationException.class, () -> mapper.readValue(json, StateRecord.class));
    }

    @Test
    void shouldFlagSecretInputs() {
        assertTrue(PendingInput.IMPORTING_WALLET.isSecretInput());
        assertTrue(PendingInput.SETTING_PIN.isSecretInput());
        assertTrue(PendingInput.AWAITING_CODE.isSecretInput());
        assertFalse(PendingInput.RENAMING_WALLET.isSecretInput());
        assertFalse(PendingInput.CHANGING_ADDRESS.isSecretInput());
        assertFalse(PendingInput.EXPORT_CONFIRM_PENDING.isSecretInput());
    }
}
