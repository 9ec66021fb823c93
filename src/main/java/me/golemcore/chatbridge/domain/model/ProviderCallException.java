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

package me.golemcore.chatbridge.domain.model;

import lombok.Getter;

/**
 * Failed provider call, classified for the user-facing reply.
 */
@Getter
public class ProviderCallException extends RuntimeException {

    private final ExchangeFailureKind kind;
    private final transient ProviderError providerError;

    public ProviderCallException(ExchangeFailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public ProviderCallException(ExchangeFailureKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ProviderCallException(ExchangeFailureKind kind, String message, ProviderError providerError,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerError = providerError;
    }
}
