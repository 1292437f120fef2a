package dev.mars.s3kit.signer;

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


import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * Output of the signer: the headers to send (or, for presigned requests, the query
 * parameters to append) together with the intermediate strings for diagnostics.
 */
public final class SignedRequest {

    private final String method;
    private final String canonicalUri;
    private final SortedMap<String, String> queryParameters;
    private final Map<String, String> headers;
    private final String canonicalQueryString;
    private final String canonicalRequest;
    private final String stringToSign;
    private final String signature;

    SignedRequest(String method, String canonicalUri, SortedMap<String, String> queryParameters,
                  Map<String, String> headers, String canonicalQueryString,
                  String canonicalRequest, String stringToSign, String signature) {
        this.method = method;
        this.canonicalUri = canonicalUri;
        this.queryParameters = Collections.unmodifiableSortedMap(queryParameters);
        this.headers = Collections.unmodifiableMap(headers);
        this.canonicalQueryString = canonicalQueryString;
        this.canonicalRequest = canonicalRequest;
        this.stringToSign = stringToSign;
        this.signature = signature;
    }

    public String getMethod() { return method; }
    public String getCanonicalUri() { return canonicalUri; }
    public SortedMap<String, String> getQueryParameters() { return queryParameters; }

    /**
     * Headers to put on the wire, including {@code Authorization} for header-signed requests.
     */
    public Map<String, String> getHeaders() { return headers; }

    /**
     * The encoded, sorted query string. For presigned requests this includes the signature.
     */
    public String getCanonicalQueryString() { return canonicalQueryString; }

    public String getCanonicalRequest() { return canonicalRequest; }
    public String getStringToSign() { return stringToSign; }
    public String getSignature() { return signature; }

    public String getAuthorization() {
        return headers.get(RequestSigner.AUTHORIZATION);
    }
}
