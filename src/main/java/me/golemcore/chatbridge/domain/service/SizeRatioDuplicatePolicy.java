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
 * Treats two images as the same picture when their byte lengths differ by
 * less than {@code ratio} of the larger one. Catches re-encoded copies that a
 * provider returns through a second response path.
 */
public class SizeRatioDuplicatePolicy implements DuplicateImagePolicy {

    private final double ratio;

    public SizeRatioDuplicatePolicy(double ratio) {
        if (ratio < 0 || ratio >= 1) {
            throw new IllegalArgumentException("Near-duplicate ratio must be in [0, 1): " + ratio);
        }
        this.ratio = ratio;
    }

    @Override
    public boolean isDuplicate(ImagePayload candidate, ImagePayload accepted) {
        int a = candidate.size();
        int b = accepted.size();
        int larger = Math.max(a, b);
        if (larger == 0) {
            return true;
        }
        double difference = Math.abs(a - b) / (double) larger;
        return difference < ratio;
    }

    public double getRatio() {
        return ratio;
    }
}
