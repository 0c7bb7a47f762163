package me.golemcore.walletbot.domain.model;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Outgoing chat message: text plus rows of inline buttons.
 */
public record Reply(String text, List<List<Button>> keyboard) {

    public Reply {
        keyboard = keyboard == null ? List.of() : List.copyOf(keyboard.stream().map(List::copyOf).toList());
    }

    public static Reply text(String text) {
        return new Reply(text, List.of());
    }

    public static Builder builder(String text) {
        return new Builder(text);
    }

    public boolean hasKeyboard() {
        return !keyboard.isEmpty();
    }

    public static final class Builder {

        private final String text;
        private final List<List<Button>> rows = new ArrayList<>();

        private Builder(String text) {
            this.text = text;
        }

        public Builder row(Button... buttons) {
            rows.add(List.of(buttons));
            return this;
        }

        public Builder row(List<Button> buttons) {
            if (!buttons.isEmpty()) {
                rows.add(List.copyOf(buttons));
            }
            return this;
        }

        public Reply build() {
            return new Reply(text, rows);
        }
    }
}
