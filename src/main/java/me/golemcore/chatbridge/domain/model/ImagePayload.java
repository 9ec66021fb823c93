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

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Raw image bytes with an explicit mime type. This is the shape images travel
 * in through plugin hooks, response normalization and delivery.
 */
public record ImagePayload(byte[] bytes, String mimeType) {

    public static final String DEFAULT_MIME_TYPE = "image/jpeg";

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_SUFFIX = ";base64";

    public ImagePayload {
        Objects.requireNonNull(bytes, "bytes");
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("Image mime type is required");
        }
    }

    public static ImagePayload of(byte[] bytes, String mimeType) {
        return new ImagePayload(bytes, mimeType);
    }

    /**
     * Decodes a {@code data:<mime>;base64,<data>} URL.
     *
     * @throws ImageProcessingException
     *             if the URL is not a base64 image data URL or the payload is
     *             not valid base64
     */
    public static ImagePayload fromDataUrl(String dataUrl) {
        if (dataUrl == null || !dataUrl.startsWith(DATA_URL_PREFIX)) {
            throw new ImageProcessingException("Not a data URL");
        }
        int comma = dataUrl.indexOf(',');
        if (comma < 0) {
            throw new ImageProcessingException("Data URL has no payload");
        }
        String header = dataUrl.substring(DATA_URL_PREFIX.length(), comma);
        if (!header.endsWith(BASE64_SUFFIX)) {
            throw new ImageProcessingException("Data URL is not base64 encoded");
        }
        String mimeType = header.substring(0, header.length() - BASE64_SUFFIX.length());
        if (!mimeType.startsWith("image/")) {
            throw new ImageProcessingException("Unsupported data URL type: " + mimeType);
        }
        String data = dataUrl.substring(comma + 1).replaceAll("\\s", "");
        if (data.isEmpty()) {
            throw new ImageProcessingException("Data URL has an empty payload");
        }
        try {
            return new ImagePayload(Base64.getDecoder().decode(data), mimeType);
        } catch (IllegalArgumentException e) {
            throw new ImageProcessingException("Malformed base64 image data", e);
        }
    }

    public int size() {
        return bytes.length;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    public String toDataUrl() {
        return "data:" + mimeType + ";base64," + toBase64();
    }

    /**
     * File extension for delivery filenames.
     */
    public String extension() {
        int slash = mimeType.indexOf('/');
        String subtype = slash >= 0 ? mimeType.substring(slash + 1) : mimeType;
        return "jpeg".equals(subtype) ? "jpg" : subtype;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImagePayload other)) {
            return false;
        }
        return mimeType.equals(other.mimeType) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * mimeType.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ImagePayload[" + mimeType + ", " + bytes.length + " bytes]";
    }
}
