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

package me.golemcore.chatbridge.plugin.context;

/**
 * The ten extension points, in invocation order around one exchange
 * ({@link #ON_SESSION_START} aside).
 */
public enum ExchangeHook {
    PRE_USER_TEXT("pre_user_text"),
    POST_USER_TEXT("post_user_text"),
    PRE_USER_IMAGES("pre_user_images"),
    POST_USER_IMAGES("post_user_images"),
    PRE_ASSISTANT_TEXT("pre_assistant_text"),
    POST_ASSISTANT_TEXT("post_assistant_text"),
    PRE_ASSISTANT_IMAGES("pre_assistant_images"),
    POST_ASSISTANT_IMAGES("post_assistant_images"),
    ON_SESSION_START("on_session_start"),
    ON_MESSAGE_COMPLETE("on_message_complete");

    private final String hookName;

    ExchangeHook(String hookName) {
        this.hookName = hookName;
    }

    /**
     * Name used as the health counter key.
     */
    public String hookName() {
        return hookName;
    }
}
