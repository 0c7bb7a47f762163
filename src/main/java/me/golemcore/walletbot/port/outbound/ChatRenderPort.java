package me.golemcore.walletbot.port.outbound;

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

import me.golemcore.walletbot.domain.model.Reply;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound chat rendering. Replies are addressed by user id; the adapter maps
 * it to the private chat with that user.
 */
public interface ChatRenderPort {

    /**
     * Send a new message.
     *
     * @return future completing with the sent message id
     */
    CompletableFuture<Integer> render(String userId, Reply reply);

    /**
     * Replace the last message the bot sent to the user, or send a new one when
     * there is none to edit.
     */
    CompletableFuture<Integer> editLast(String userId, Reply reply);

    CompletableFuture<Void> edit(String userId, Integer messageId, Reply reply);

    CompletableFuture<Void> delete(String userId, Integer messageId);
}
