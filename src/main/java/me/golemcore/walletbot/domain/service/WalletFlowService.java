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
import me.golemcore.walletbot.domain.exception.DecryptionFailedException;
import me.golemcore.walletbot.domain.exception.InvalidPinException;
import me.golemcore.walletbot.domain.exception.SecretUnavailableException;
import me.golemcore.walletbot.domain.exception.VaultConflictException;
import me.golemcore.walletbot.domain.exception.WalletLimitReachedException;
import me.golemcore.walletbot.domain.exception.WalletVaultException;
import me.golemcore.walletbot.domain.model.CodePurpose;
import me.golemcore.walletbot.domain.model.PendingInput;
import me.golemcore.walletbot.domain.model.RateLimitResult;
import me.golemcore.walletbot.domain.model.Reply;
import me.golemcore.walletbot.domain.model.RevealedSecret;
import me.golemcore.walletbot.domain.model.StateRecord;
import me.golemcore.walletbot.domain.model.WalletEvent;
import me.golemcore.walletbot.domain.model.WalletView;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.infrastructure.i18n.MessageService;
import me.golemcore.walletbot.port.outbound.ChatRenderPort;
import me.golemcore.walletbot.port.outbound.RateLimitPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives the wallet conversation: for each inbound {@link WalletEvent} it
 * checks the event against the user's pending step, calls the vault, moves the
 * conversation state and renders the outcome.
 *
 * <p>
 * Every failure is caught here. Vault errors are shown through their message
 * key, anything unexpected as a generic error; the user always ends up idle
 * with a way back to the menu. A {@link VaultConflictException} is retried
 * once before it is reported.
 *
 * <p>
 * Button actions ({@code wallet:*} callback data):
 * <ul>
 * <li>{@code menu}, {@code cancel}, {@code hide}</li>
 * <li>{@code create}, {@code create:yes}</li>
 * <li>{@code import}, {@code address}, {@code pin}</li>
 * <li>{@code switch[:id]}, {@code rename[:id]}</li>
 * <li>{@code export[:id]}, {@code export:yes}</li>
 * <li>{@code delete[:id]}, {@code delete:yes:id}</li>
 * </ul>
 */
@Service
@Slf4j
public class WalletFlowService {

    private static final String CMD_START = "start";
    private static final String CMD_WALLETS = "wallets";
    private static final String CMD_MENU = "menu";
    private static final String CMD_CANCEL = "cancel";
    private static final String YES = "yes";
    private static final String PREFIX = WalletMenuRenderer.PREFIX;

    private final WalletVaultService vault;
    private final ConversationStateService conversation;
    private final SecurityPinService pins;
    private final SecretRevealService reveals;
    private final WalletMenuRenderer menus;
    private final ChatRenderPort chat;
    private final RateLimitPort rateLimiter;
    private final MessageService messages;
    private final BotProperties properties;

    public WalletFlowService(WalletVaultService vault, ConversationStateService conversation,
            SecurityPinService pins, SecretRevealService reveals, WalletMenuRenderer menus, ChatRenderPort chat,
            RateLimitPort rateLimiter, MessageService messages, BotProperties properties) {
        this.vault = vault;
        this.conversation = conversation;
        this.pins = pins;
        this.reveals = reveals;
        this.menus = menus;
        this.chat = chat;
        this.rateLimiter = rateLimiter;
        this.messages = messages;
        this.properties = properties;
    }

    @EventListener
    public void onWalletEvent(WalletEvent event) {
        handle(event);
    }

    /**
     * Process one inbound event. Never throws.
     */
    public void handle(WalletEvent event) {
        String lang = messages.resolveLanguage(event.languageCode());
        RateLimitResult limit = rateLimiter.tryConsume(event.userId());
        if (!limit.isAllowed()) {
            log.debug("[Flow] Throttled user {}", event.userId());
            long seconds = Math.max(1, (limit.getWaitTime().toMillis() + 999) / 1000);
            if (event.kind() == WalletEvent.Kind.TEXT) {
                deleteIfAnsweringSecretPrompt(event);
            }
            send(event, Reply.text(msg(lang, "error.rate-limited", seconds)));
            return;
        }
        try {
            switch (event.kind()) {
            case COMMAND -> onCommand(event, lang);
            case BUTTON -> onButton(event, lang);
            case TEXT -> onText(event, lang);
            default -> log.warn("[Flow] Unsupported event kind: {}", event.kind());
            }
        } catch (RuntimeException e) {
            fail(event, lang, e, null);
        }
    }

    // ===== Commands =====

    private void onCommand(WalletEvent event, String lang) {
        String userId = event.userId();
        switch (event.payload()) {
        case CMD_START -> {
            boolean isNew = !vault.hasAccount(userId);
            vault.ensureAccount(userId, event.username());
            conversation.clear(userId);
            String notice = msg(lang, isNew ? "start.welcome-new" : "start.welcome-back");
            send(event, menus.menu(notice, vault.listWallets(userId), lang));
        }
        case CMD_WALLETS, CMD_MENU -> {
            if (requireAccount(event, lang)) {
                conversation.clear(userId);
                send(event, menus.menu(vault.listWallets(userId), lang));
            }
        }
        case CMD_CANCEL -> {
            if (requireAccount(event, lang)) {
                conversation.clear(userId);
                send(event, menus.notice(msg(lang, "flow.cancelled"), null, lang));
            }
        }
        default -> send(event, menus.notice(msg(lang, "error.unknown-command"), null, lang));
        }
    }

    // ===== Buttons =====

    private void onButton(WalletEvent event, String lang) {
        String data = event.payload();
        if (data == null || !data.startsWith(PREFIX)) {
            log.warn("[Flow] Ignoring foreign callback: {}", data);
            return;
        }
        if (!requireAccount(event, lang)) {
            return;
        }
        String[] parts = data.substring(PREFIX.length()).split(":");
        String action = parts[0];
        String arg = parts.length > 1 ? parts[1] : null;
        String userId = event.userId();

        switch (action) {
        case "menu" -> {
            conversation.clear(userId);
            send(event, menus.menu(vault.listWallets(userId), lang));
        }
        case "cancel" -> {
            conversation.clear(userId);
            send(event, menus.notice(msg(lang, "flow.cancelled"), null, lang));
        }
        case "hide" -> reveals.dismiss(userId, event.messageId(), lang);
        case "create" -> onCreate(event, arg, lang);
        case "import" -> {
            conversation.begin(userId, StateRecord.importing());
            send(event, menus.prompt(msg(lang, "import.prompt"), lang));
        }
        case "switch" -> onSwitch(event, arg, lang);
        case "rename" -> onRename(event, arg, lang);
        case "export" -> onExport(event, arg, lang);
        case "delete" -> onDelete(event, arg, parts.length > 2 ? parts[2] : null, lang);
        case "address" -> {
            conversation.begin(userId, StateRecord.changingAddress());
            send(event, menus.prompt(msg(lang, "address.prompt"), lang));
        }
        case "pin" -> {
            if (pins.hasPin(userId)) {
                conversation.begin(userId, StateRecord.awaitingCode(CodePurpose.CHANGE_PIN, null));
                send(event, menus.prompt(msg(lang, "pin.prompt-current"), lang));
            } else {
                conversation.begin(userId, StateRecord.settingPin());
                send(event, menus.prompt(msg(lang, "pin.prompt-new"), lang));
            }
        }
        default -> log.warn("[Flow] Unknown wallet action: {}", action);
        }
    }

    private void onCreate(WalletEvent event, String arg, String lang) {
        String userId = event.userId();
        if (!YES.equals(arg)) {
            if (vault.listWallets(userId).size() >= properties.getVault().getMaxWallets()) {
                throw new WalletLimitReachedException("Wallet limit reached");
            }
            send(event, menus.confirm(msg(lang, "create.confirm"), PREFIX + "create:yes", lang));
            return;
        }
        conversation.clear(userId);
        WalletView created = withRetry(() -> vault.createWallet(userId, null));
        send(event, menus.menu(msg(lang, "create.success", created.name(), created.address()),
                vault.listWallets(userId), lang));
    }

    private void onSwitch(WalletEvent event, String walletId, String lang) {
        String userId = event.userId();
        if (walletId == null) {
            send(event, menus.picker("switch.pick", "switch", vault.listWallets(userId), w -> true, lang));
            return;
        }
        WalletView active = withRetry(() -> vault.switchActive(userId, walletId));
        send(event, menus.menu(msg(lang, "switch.success", active.name()), vault.listWallets(userId), lang));
    }

    private void onRename(WalletEvent event, String walletId, String lang) {
        String userId = event.userId();
        if (walletId == null) {
            send(event, menus.picker("rename.pick", "rename", vault.listWallets(userId), w -> true, lang));
            return;
        }
        WalletView wallet = vault.getWallet(userId, walletId);
        conversation.begin(userId, StateRecord.renaming(wallet.id()));
        send(event, menus.prompt(msg(lang, "rename.prompt", wallet.name()), lang));
    }

    private void onExport(WalletEvent event, String arg, String lang) {
        String userId = event.userId();
        if (arg == null) {
            send(event, menus.picker("export.pick", "export", vault.listWallets(userId), w -> !w.watchOnly(), lang));
            return;
        }
        if (!YES.equals(arg)) {
            WalletView wallet = vault.getWallet(userId, arg);
            if (wallet.watchOnly()) {
                throw new SecretUnavailableException("Watch-only wallet " + wallet.id());
            }
            conversation.begin(userId, StateRecord.exportConfirm(wallet.id()));
            send(event, menus.confirm(msg(lang, "export.warning", wallet.name()), PREFIX + "export:yes", lang));
            return;
        }
        Optional<StateRecord> pending = conversation.consume(userId)
                .filter(state -> state.getKind() == PendingInput.EXPORT_CONFIRM_PENDING);
        if (pending.isEmpty()) {
            send(event, menus.notice(msg(lang, "error.expired"), PREFIX + "export", lang));
            return;
        }
        String walletId = pending.get().getWalletId();
        if (pins.hasPin(userId)) {
            conversation.begin(userId, StateRecord.awaitingCode(CodePurpose.EXPORT_SECRET, walletId));
            send(event, menus.prompt(msg(lang, "pin.prompt-unlock"), lang));
            return;
        }
        reveal(event, walletId, lang);
    }

    private void onDelete(WalletEvent event, String arg, String walletIdAfterYes, String lang) {
        String userId = event.userId();
        if (arg == null) {
            send(event, menus.picker("delete.pick", "delete", vault.listWallets(userId), w -> true, lang));
            return;
        }
        if (!YES.equals(arg)) {
            WalletView wallet = vault.getWallet(userId, arg);
            send(event, menus.confirm(msg(lang, "delete.confirm", wallet.name(), wallet.address()),
                    PREFIX + "delete:yes:" + wallet.id(), lang));
            return;
        }
        if (walletIdAfterYes == null) {
            log.warn("[Flow] Delete confirmation without wallet id from user {}", userId);
            return;
        }
        if (pins.hasPin(userId)) {
            vault.getWallet(userId, walletIdAfterYes);
            conversation.begin(userId, StateRecord.awaitingCode(CodePurpose.DELETE_WALLET, walletIdAfterYes));
            send(event, menus.prompt(msg(lang, "pin.prompt-unlock"), lang));
            return;
        }
        deleteWallet(event, walletIdAfterYes, lang);
    }

    // ===== Free text =====

    private void onText(WalletEvent event, String lang) {
        if (!requireAccount(event, lang)) {
            return;
        }
        Optional<StateRecord> taken = conversation.take(event.userId());
        if (taken.isPresent() && taken.get().getKind().isSecretInput()) {
            deleteUserMessage(event);
        }
        Optional<StateRecord> pending = taken.filter(conversation::isLive);
        if (pending.isEmpty()) {
            onIdleText(event, lang);
            return;
        }
        StateRecord state = pending.get();
        try {
            onPendingText(event, state, lang);
        } catch (RuntimeException e) {
            fail(event, lang, e, retryAction(state));
        }
    }

    private void onPendingText(WalletEvent event, StateRecord state, String lang) {
        String userId = event.userId();
        String text = event.payload() == null ? "" : event.payload().trim();
        switch (state.getKind()) {
        case IMPORTING_WALLET -> {
            WalletView imported = withRetry(() -> vault.importWallet(userId, text));
            sendAfterSecret(event, menus.menu(msg(lang, "import.success", imported.name(), imported.address()),
                    vault.listWallets(userId), lang));
        }
        case RENAMING_WALLET -> {
            WalletView renamed = withRetry(() -> vault.rename(userId, state.getWalletId(), text));
            send(event, menus.menu(msg(lang, "rename.success", renamed.name()), vault.listWallets(userId), lang));
        }
        case CHANGING_ADDRESS -> {
            WalletView tracked = withRetry(() -> vault.trackAddress(userId, text));
            String key = tracked.watchOnly() ? "address.tracked" : "address.switched";
            send(event, menus.menu(msg(lang, key, tracked.name()), vault.listWallets(userId), lang));
        }
        case EXPORT_CONFIRM_PENDING -> send(event, menus.notice(msg(lang, "export.aborted"), null, lang));
        case SETTING_PIN -> {
            withRetry(() -> {
                pins.setPin(userId, text);
                return null;
            });
            sendAfterSecret(event, menus.notice(msg(lang, "pin.set"), null, lang));
        }
        case AWAITING_CODE -> onCode(event, state, text, lang);
        default -> log.warn("[Flow] Unhandled pending input {}", state.getKind());
        }
    }

    private void onCode(WalletEvent event, StateRecord state, String pin, String lang) {
        String userId = event.userId();
        RateLimitResult attempt = rateLimiter.tryConsumePinAttempt(userId);
        if (!attempt.isAllowed()) {
            long minutes = Math.max(1, (attempt.getWaitTime().toSeconds() + 59) / 60);
            sendAfterSecret(event, menus.notice(msg(lang, "pin.locked", minutes), null, lang));
            return;
        }
        if (!pins.verify(userId, pin)) {
            throw new InvalidPinException("Wrong PIN");
        }
        switch (state.getPurpose()) {
        case EXPORT_SECRET -> reveal(event, state.getWalletId(), lang);
        case DELETE_WALLET -> deleteWallet(event, state.getWalletId(), lang);
        case CHANGE_PIN -> {
            conversation.begin(userId, StateRecord.settingPin());
            sendAfterSecret(event, menus.prompt(msg(lang, "pin.prompt-new"), lang));
        }
        default -> log.warn("[Flow] Unhandled code purpose {}", state.getPurpose());
        }
    }

    private void onIdleText(WalletEvent event, String lang) {
        String text = event.payload() == null ? "" : event.payload().trim();
        if (text.matches("^[1-9A-HJ-NP-Za-km-z]{32,44}$")) {
            send(event, menus.confirm(msg(lang, "idle.address"), PREFIX + "address", lang));
            return;
        }
        send(event, menus.notice(msg(lang, "idle.unknown"), null, lang));
    }

    // ===== Shared steps =====

    private void reveal(WalletEvent event, String walletId, String lang) {
        String userId = event.userId();
        RevealedSecret secret = vault.revealSecret(userId, walletId);
        StringBuilder body = new StringBuilder()
                .append(msg(lang, "export.address", secret.address())).append("\n\n")
                .append(msg(lang, "export.private-key", secret.privateKey()));
        if (secret.hasRecoveryPhrase()) {
            body.append("\n\n").append(msg(lang, "export.phrase", secret.recoveryPhrase()));
        }
        sendOrEdit(event, menus.notice(msg(lang, "export.sent"), null, lang));
        reveals.show(userId, lang, body.toString())
                .exceptionally(e -> {
                    log.error("[Flow] Failed to show exported secret to user {}", userId, e);
                    return null;
                });
    }

    private void deleteWallet(WalletEvent event, String walletId, String lang) {
        String userId = event.userId();
        WalletView wallet = vault.getWallet(userId, walletId);
        withRetry(() -> {
            vault.deleteWallet(userId, walletId);
            return null;
        });
        sendOrEdit(event, menus.menu(msg(lang, "delete.success", wallet.name()), vault.listWallets(userId), lang));
    }

    private void fail(WalletEvent event, String lang, RuntimeException error, String retryAction) {
        String userId = event.userId();
        String key;
        if (error instanceof DecryptionFailedException decryption) {
            log.error("[Security] Stored secret of wallet {} (user {}) failed authentication",
                    decryption.getWalletId(), userId);
            key = decryption.getMessageKey();
        } else if (error instanceof WalletVaultException vaultError) {
            log.info("[Flow] {} for user {}: {}", error.getClass().getSimpleName(), userId, error.getMessage());
            key = vaultError.getMessageKey();
        } else {
            log.error("[Flow] Unexpected failure handling {} ", event, error);
            key = "error.unexpected";
        }
        try {
            conversation.clear(userId);
        } catch (RuntimeException clearError) {
            log.warn("[Flow] Could not reset state of user {}: {}", userId, clearError.getMessage());
        }
        send(event, menus.notice(msg(lang, key), retryAction, lang));
    }

    private static String retryAction(StateRecord state) {
        return switch (state.getKind()) {
        case IMPORTING_WALLET -> PREFIX + "import";
        case RENAMING_WALLET -> PREFIX + "rename:" + state.getWalletId();
        case CHANGING_ADDRESS -> PREFIX + "address";
        case SETTING_PIN -> PREFIX + "pin";
        case AWAITING_CODE -> switch (state.getPurpose()) {
            case EXPORT_SECRET -> PREFIX + "export:" + state.getWalletId();
            case DELETE_WALLET -> PREFIX + "delete:yes:" + state.getWalletId();
            case CHANGE_PIN -> PREFIX + "pin";
            };
        case EXPORT_CONFIRM_PENDING -> null;
        };
    }

    private <T> T withRetry(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (VaultConflictException e) {
            log.info("[Flow] Retrying after concurrent update: {}", e.getMessage());
            return operation.get();
        }
    }

    private boolean requireAccount(WalletEvent event, String lang) {
        if (vault.hasAccount(event.userId())) {
            return true;
        }
        send(event, Reply.text(msg(lang, "error.no-account")));
        return false;
    }

    /**
     * A throttled message may still carry a phrase, key or PIN typed in reply
     * to a prompt; it is removed even though it is not processed.
     */
    private void deleteIfAnsweringSecretPrompt(WalletEvent event) {
        try {
            if (conversation.peek(event.userId()).map(state -> state.getKind().isSecretInput()).orElse(false)) {
                deleteUserMessage(event);
            }
        } catch (RuntimeException e) {
            log.warn("[Flow] Could not check pending input of throttled user {}: {}", event.userId(),
                    e.getMessage());
        }
    }

    private void deleteUserMessage(WalletEvent event) {
        if (event.messageId() == null) {
            return;
        }
        chat.delete(event.userId(), event.messageId())
                .exceptionally(e -> {
                    log.warn("[Flow] Could not delete sensitive message of user {}", event.userId());
                    return null;
                });
    }

    /**
     * Buttons edit the message they belong to; commands and text get a new
     * message.
     */
    private void send(WalletEvent event, Reply reply) {
        if (event.kind() == WalletEvent.Kind.BUTTON && event.messageId() != null) {
            sendOrEdit(event, reply);
            return;
        }
        chat.render(event.userId(), reply).exceptionally(e -> logSendFailure(event, e));
    }

    private void sendOrEdit(WalletEvent event, Reply reply) {
        if (event.kind() != WalletEvent.Kind.BUTTON || event.messageId() == null) {
            sendAfterSecret(event, reply);
            return;
        }
        chat.edit(event.userId(), event.messageId(), reply).exceptionally(e -> {
            logSendFailure(event, e);
            return null;
        });
    }

    /**
     * The user's message was removed, so replace the prompt they answered
     * instead of adding a new message.
     */
    private void sendAfterSecret(WalletEvent event, Reply reply) {
        chat.editLast(event.userId(), reply).exceptionally(e -> logSendFailure(event, e));
    }

    private Integer logSendFailure(WalletEvent event, Throwable e) {
        log.error("[Flow] Failed to reply to user {}", event.userId(), e);
        return null;
    }

    private String msg(String lang, String key, Object... args) {
        return messages.getMessage(key, lang, args);
    }
}
