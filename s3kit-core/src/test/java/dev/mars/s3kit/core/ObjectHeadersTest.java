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


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ObjectHeaders")
class ObjectHeadersTest {

    @Test
    void testNoneProducesNoHeaders() {
        assertTrue(ObjectHeaders.none().isEmpty());
        assertTrue(ObjectHeaders.none().toHeaders().isEmpty());
    }

    @Test
    void testHeaderNamesAndValues() {
        Map<String, String> headers = ObjectHeaders.builder()
                .cacheControl("no-store")
                .contentEncoding("gzip")
                .expires(Instant.parse("2026-03-05T08:09:10Z"))
                .storageClass("GLACIER")
                .build()
                .toHeaders();

        assertEquals(List.of("Cache-Control", "Content-Encoding", "Expires", "x-amz-storage-class"),
                List.copyOf(headers.keySet()));
        assertEquals("Thu, 5 Mar 2026 08:09:10 GMT", headers.get("Expires"));
        assertEquals("GLACIER", headers.get("x-amz-storage-class"));
    }

    @Test
    @DisplayName("Tags are URL encoded into a single header")
    void testTagEncoding() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("project", "alpha & beta");
        tags.put("cost centre", "42=x");

        ObjectHeaders headers = ObjectHeaders.builder().tags(tags).build();

        assertEquals("project=alpha%20%26%20beta&cost%20centre=42%3Dx", headers.toHeaders().get("x-amz-tagging"));
        assertEquals(tags, headers.getTags());
    }

    @Test
    void testContentDispositionWithFileName() {
        assertEquals("attachment; filename=\"my \\\"best\\\" file.txt\"",
                ObjectHeaders.builder().contentDisposition("attachment", "my \"best\" file.txt").build()
                        .getContentDisposition());
        assertEquals("inline", ObjectHeaders.builder().contentDisposition("inline", null).build()
                .getContentDisposition());
    }

    @Test
    void testKmsKeyImpliesKmsEncryption() {
        Map<String, String> headers = ObjectHeaders.builder().kmsKeyId("arn:aws:kms:key/1").build().toHeaders();

        assertEquals("aws:kms", headers.get("x-amz-server-side-encryption"));
        assertEquals("arn:aws:kms:key/1", headers.get("x-amz-server-side-encryption-aws-kms-key-id"));
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> ObjectHeaders.builder().storageClass("COLD"));
        assertThrows(IllegalArgumentException.class, () -> ObjectHeaders.builder().serverSideEncryption("DES"));
        assertThrows(IllegalArgumentException.class, () -> ObjectHeaders.builder().tag(" ", "x"));
    }

    @Test
    void testBlankValuesAreLeftOut() {
        assertTrue(ObjectHeaders.builder().cacheControl(" ").contentLanguage("").build().isEmpty());
    }

    @Test
    void testEquality() {
        ObjectHeaders a = ObjectHeaders.builder().cacheControl("no-cache").tag("k", "v").build();
        ObjectHeaders b = ObjectHeaders.builder().tag("k", "v").cacheControl("no-cache").build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(ObjectHeaders.none(), a);
    }
}
