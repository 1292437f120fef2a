package dev.mars.s3kit.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */


import java.util.Objects;

/**
 * Immutable connection credentials for one S3-compatible endpoint.
 *
 * <p>The endpoint is a bare {@code host[:port]} without scheme; the scheme follows
 * {@link #isSecure()}. The secret key never appears in {@link #toString()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Credentials {

    public static final String DEFAULT_REGION = "us-east-1";

    private final String accessKey;
    private final String secretKey;
    private final String region;
    private final String endpoint;
    private final boolean secure;

    public Credentials(String endpoint, String accessKey, String secretKey, String region, boolean secure) {
        this.endpoint = normalizeEndpoint(endpoint);
        this.accessKey = accessKey;
        this.secretKey = secretKey;
        this.region = region == null || region.isBlank() ? DEFAULT_REGION : region.trim();
        this.secure = secure;
    }

    public String getAccessKey() { return accessKey; }
    public String getSecretKey() { return secretKey; }
    public String getRegion() { return region; }
    public String getEndpoint() { return endpoint; }
    public boolean isSecure() { return secure; }

    public boolean hasKeys() {
        return accessKey != null && !accessKey.isBlank()
                && secretKey != null && !secretKey.isBlank();
    }

    /**
     * Host header value: the endpoint without a port when the port is the scheme default.
     */
    public String getHost() {
        if (endpoint == null) {
            return null;
        }
        String defaultPortSuffix = secure ? ":443" : ":80";
        return endpoint.endsWith(defaultPortSuffix)
                ? endpoint.substring(0, endpoint.length() - defaultPortSuffix.length())
                : endpoint;
    }

    public String getBaseUrl() {
        return (secure ? "https://" : "http://") + endpoint;
    }

    private static String normalizeEndpoint(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        String value = endpoint.trim();
        if (value.startsWith("https://")) {
            value = value.substring("https://".length());
        } else if (value.startsWith("http://")) {
            value = value.substring("http://".length());
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Credentials that = (Credentials) o;
        return secure == that.secure
                && Objects.equals(accessKey, that.accessKey)
                && Objects.equals(secretKey, that.secretKey)
                && Objects.equals(region, that.region)
                && Objects.equals(endpoint, that.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessKey, secretKey, region, endpoint, secure);
    }

    @Override
    public String toString() {
        return "Credentials{" +
                "endpoint='" + endpoint + '\'' +
                ", accessKey='" + accessKey + '\'' +
                ", region='" + region + '\'' +
                ", secure=" + secure +
                '}';
    }
}
