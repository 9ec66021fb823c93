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

package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ImagePayload;

/**
 * Secondary duplicate check applied after exact fingerprint matching fails.
 */
@FunctionalInterface
public interface DuplicateImagePolicy {

    /**
     * Returns true if {@code candidate} should be treated as another copy of
     * the already accepted image.
     */
    boolean isDuplicate(ImagePayload candidate, ImagePayload accepted);

    static DuplicateImagePolicy none() {
        return (candidate, accepted) -> false;
    }
}
