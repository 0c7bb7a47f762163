package me.golemcore.walletbot.domain.service;

import me.golemcore.walletbot.domain.model.Button;
import me.golemcore.walletbot.domain.model.Reply;
import me.golemcore.walletbot.domain.model.WalletView;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WalletMenuRendererTest {

    private static final WalletView MAIN = new WalletView("w1", "Main Wallet",
            "7EcDhSYGxXyscszYEp35KHN8vvw3svAuLKTzXwCFLtV", true, false, true);
    private static final WalletView TRACKED = new WalletView("w2", "Wallet 2",
            "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM", false, true, false);

    private MessageService messages;
    private WalletMenuRenderer menus;

    @BeforeEach
    void setUp() {
        messages = new MessageService();
        menus = new WalletMenuRenderer(messages, new BotProperties());
    }

    private static List<String> actions(Reply reply) {
        return reply.keyboard().stream().flatMap(List::stream).map(Button::action).toList();
    }

    @Test
    void shouldListWalletsWithActiveAndWatchOnlyMarks() {
        Reply menu = menus.menu(List.of(MAIN, TRACKED), "en");

        assertTrue(menu.text().contains(messages.getMessage("menu.title", "en", 2, 6)));
        assertTrue(menu.text().contains("✅ <b>Main Wallet</b>"));
        assertTrue(menu.text().contains("<b>Wallet 2</b> " + messages.getMessage("menu.watch-only", "en")));
        assertEquals(4, menu.keyboard().size());
        assertTrue(actions(menu).containsAll(List.of("wallet:create", "wallet:import", "wallet:switch",
                "wallet:rename", "wallet:export", "wallet:delete", "wallet:address", "wallet:pin")));
    }

    @Test
    void shouldPrefixNotice() {
        Reply menu = menus.menu("Done", List.of(MAIN), "en");

        assertTrue(menu.text().startsWith("Done\n\n<b>"));
    }

    @Test
    void shouldOfferOnlySelectableWalletsInPicker() {
        Reply picker = menus.picker("export.pick", "export", List.of(MAIN, TRACKED), w -> !w.watchOnly(), "en");

        assertEquals(List.of("wallet:export:w1", WalletMenuRenderer.ACTION_MENU), actions(picker));
        assertTrue(picker.keyboard().get(0).get(0).label().contains(MAIN.shortAddress()));
    }

    @Test
    void shouldBuildConfirmPromptAndNotice() {
        assertEquals(List.of("wallet:create:yes", WalletMenuRenderer.ACTION_CANCEL),
                actions(menus.confirm("Sure?", "wallet:create:yes", "en")));
        assertEquals(List.of(WalletMenuRenderer.ACTION_CANCEL), actions(menus.prompt("Send it", "en")));
        assertEquals(List.of("wallet:import", WalletMenuRenderer.ACTION_MENU),
                actions(menus.notice("Oops", "wallet:import", "en")));
        assertEquals(List.of(WalletMenuRenderer.ACTION_MENU), actions(menus.notice("Ok", null, "en")));
    }
}
