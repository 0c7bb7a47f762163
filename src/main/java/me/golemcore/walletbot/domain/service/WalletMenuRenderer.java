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

import me.golemcore.walletbot.domain.model.Button;
import me.golemcore.walletbot.domain.model.Reply;
import me.golemcore.walletbot.domain.model.WalletView;
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Builds the wallet menu, pickers, prompts and dialogs as {@link Reply}
 * objects. Text is HTML as understood by Telegram.
 */
@Component
public class WalletMenuRenderer {

    static final String PREFIX = "wallet:";
    static final String ACTION_MENU = PREFIX + "menu";
    static final String ACTION_CANCEL = PREFIX + "cancel";

    private static final String HTML_BOLD_OPEN = "<b>";
    private static final String HTML_BOLD_CLOSE_NL = "</b>\n\n";
    private static final String ACTIVE_MARK = "✅ ";

    private final MessageService messages;
    private final BotProperties properties;

    public WalletMenuRenderer(MessageService messages, BotProperties properties) {
        this.messages = messages;
        this.properties = properties;
    }

    public Reply menu(List<WalletView> wallets, String lang) {
        return menu(null, wallets, lang);
    }

    /**
     * Wallet list with the management keyboard, optionally preceded by a
     * one-line notice such as "Wallet renamed".
     */
    public Reply menu(String notice, List<WalletView> wallets, String lang) {
        StringBuilder sb = new StringBuilder();
        if (notice != null) {
            sb.append(notice).append("\n\n");
        }
        sb.append(HTML_BOLD_OPEN)
                .append(msg(lang, "menu.title", wallets.size(), properties.getVault().getMaxWallets()))
                .append(HTML_BOLD_CLOSE_NL);
        for (WalletView wallet : wallets) {
            sb.append(wallet.active() ? ACTIVE_MARK : "")
                    .append(HTML_BOLD_OPEN).append(wallet.name()).append("</b>");
            if (wallet.watchOnly()) {
                sb.append(' ').append(msg(lang, "menu.watch-only"));
            }
            sb.append("\n<code>").append(wallet.address()).append("</code>\n\n");
        }
        return Reply.builder(sb.toString().trim())
                .row(button(lang, "button.create", "create"), button(lang, "button.import", "import"))
                .row(button(lang, "button.switch", "switch"), button(lang, "button.rename", "rename"))
                .row(button(lang, "button.export", "export"), button(lang, "button.delete", "delete"))
                .row(button(lang, "button.address", "address"), button(lang, "button.pin", "pin"))
                .build();
    }

    /**
     * One button per wallet leading to {@code wallet:<verb>:<id>}, plus a back
     * button.
     */
    public Reply picker(String titleKey, String verb, List<WalletView> wallets, Predicate<WalletView> selectable,
            String lang) {
        Reply.Builder builder = Reply.builder(msg(lang, titleKey));
        for (WalletView wallet : wallets) {
            if (selectable.test(wallet)) {
                String label = (wallet.active() ? ACTIVE_MARK : "") + wallet.name() + " · " + wallet.shortAddress();
                builder.row(new Button(label, PREFIX + verb + ":" + wallet.id()));
            }
        }
        return builder.row(back(lang)).build();
    }

    /**
     * Yes/cancel dialog.
     */
    public Reply confirm(String text, String yesAction, String lang) {
        return Reply.builder(text)
                .row(new Button(msg(lang, "button.yes"), yesAction),
                        new Button(msg(lang, "button.cancel"), ACTION_CANCEL))
                .build();
    }

    /**
     * Request for free text, with a cancel button.
     */
    public Reply prompt(String text, String lang) {
        return Reply.builder(text)
                .row(new Button(msg(lang, "button.cancel"), ACTION_CANCEL))
                .build();
    }

    /**
     * Outcome or error message with a way back to the menu and, when given, a
     * retry button.
     */
    public Reply notice(String text, String retryAction, String lang) {
        Reply.Builder builder = Reply.builder(text);
        if (retryAction != null) {
            builder.row(new Button(msg(lang, "button.retry"), retryAction), back(lang));
        } else {
            builder.row(back(lang));
        }
        return builder.build();
    }

    private Button back(String lang) {
        return new Button(msg(lang, "button.menu"), ACTION_MENU);
    }

    private Button button(String lang, String key, String verb) {
        return new Button(msg(lang, key), PREFIX + verb);
    }

    private String msg(String lang, String key, Object... args) {
        return messages.getMessage(key, lang, args);
    }
}
