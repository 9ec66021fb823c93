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
import lombok.extern.slf4j.Slf4j;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses repeated images. An exact SHA-256 match is always a duplicate; the
 * configured {@link DuplicateImagePolicy} decides about everything else.
 * Accepted images keep their first-seen order.
 */
@Slf4j
public class ImageDeduplicator {

    private final DuplicateImagePolicy policy;

    public ImageDeduplicator(DuplicateImagePolicy policy) {
        this.policy = policy != null ? policy : DuplicateImagePolicy.none();
    }

    public List<ImagePayload> deduplicate(List<ImagePayload> images) {
        List<ImagePayload> accepted = new ArrayList<>();
        Set<String> fingerprints = new HashSet<>();
        for (ImagePayload image : images) {
            if (image == null) {
                continue;
            }
            String fingerprint = fingerprint(image.bytes());
            if (!fingerprints.add(fingerprint)) {
                log.debug("[Images] Dropped exact duplicate ({} bytes)", image.size());
                continue;
            }
            if (isNearDuplicate(image, accepted)) {
                log.debug("[Images] Dropped near-duplicate ({} bytes)", image.size());
                continue;
            }
            accepted.add(image);
        }
        return accepted;
    }

    private boolean isNearDuplicate(ImagePayload image, List<ImagePayload> accepted) {
        for (ImagePayload existing : accepted) {
            if (policy.isDuplicate(image, existing)) {
                return true;
            }
        }
        return false;
    }

    static String fingerprint(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(bytes);
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
