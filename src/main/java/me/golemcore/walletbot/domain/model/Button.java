package me.golemcore.walletbot.domain.model;

/**
 * Inline keyboard button: visible label plus callback data.
 */
public record Button(String label, String action) {
}
