package dev.mars.s3kit.client;

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


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * XML documents exchanged with the S3 REST API, mapped with Jackson XML.
 *
 * <p>Timestamps are kept as strings and parsed with {@link #parseTimestamp(String)}
 * because backends differ in how they write the offset.</p>
 */
final class S3XmlModels {

    private S3XmlModels() {
    }

    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value.trim()).toInstant();
        }
    }

    @JacksonXmlRootElement(localName = "ListAllMyBucketsResult")
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ListAllMyBucketsResult {
        @JacksonXmlElementWrapper(localName = "Buckets")
        @JacksonXmlProperty(localName = "Bucket")
        public List<Bucket> buckets = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Bucket {
        @JsonProperty("Name")
        public String name;

        @JsonProperty("CreationDate")
        public String creationDate;
    }

    @JacksonXmlRootElement(localName = "ListBucketResult")
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ListBucketResult {
        @JsonProperty("Name")
        public String name;

        @JsonProperty("Prefix")
        public String prefix;

        @JsonProperty("KeyCount")
        public Integer keyCount;

        @JsonProperty("IsTruncated")
        public boolean truncated;

        @JsonProperty("NextContinuationToken")
        public String nextContinuationToken;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "Contents")
        public List<Contents> contents = new ArrayList<>();

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "CommonPrefixes")
        public List<CommonPrefix> commonPrefixes = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Contents {
        @JsonProperty("Key")
        public String key;

        @JsonProperty("LastModified")
        public String lastModified;

        @JsonProperty("ETag")
        public String eTag;

        @JsonProperty("Size")
        public long size;

        @JsonProperty("StorageClass")
        public String storageClass;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CommonPrefix {
        @JsonProperty("Prefix")
        public String prefix;
    }

    @JacksonXmlRootElement(localName = "CreateBucketConfiguration")
    static class CreateBucketConfiguration {
        @JsonProperty("LocationConstraint")
        public String locationConstraint;

        CreateBucketConfiguration() {
        }

        CreateBucketConfiguration(String locationConstraint) {
            this.locationConstraint = locationConstraint;
        }
    }

    @JacksonXmlRootElement(localName = "InitiateMultipartUploadResult")
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class InitiateMultipartUploadResult {
        @JsonProperty("Bucket")
        public String bucket;

        @JsonProperty("Key")
        public String key;

        @JsonProperty("UploadId")
        public String uploadId;
    }

    @JacksonXmlRootElement(localName = "CompleteMultipartUpload")
    static class CompleteMultipartUpload {
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "Part")
        public List<Part> parts = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Part {
        @JsonProperty("PartNumber")
        public int partNumber;

        @JsonProperty("ETag")
        public String eTag;

        Part() {
        }

        Part(int partNumber, String eTag) {
            this.partNumber = partNumber;
            this.eTag = eTag;
        }
    }

    @JacksonXmlRootElement(localName = "CompleteMultipartUploadResult")
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CompleteMultipartUploadResult {
        @JsonProperty("Location")
        public String location;

        @JsonProperty("Bucket")
        public String bucket;

        @JsonProperty("Key")
        public String key;

        @JsonProperty("ETag")
        public String eTag;
    }

    @JacksonXmlRootElement(localName = "CopyObjectResult")
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CopyObjectResult {
        @JsonProperty("LastModified")
        public String lastModified;

        @JsonProperty("ETag")
        public String eTag;
    }
}
