package dev.mars.s3kit.http;

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
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * The {@code <Error>} document S3 returns with non-2xx responses.
 */
@JacksonXmlRootElement(localName = "Error")
@JsonIgnoreProperties(ignoreUnknown = true)
public class S3ErrorDocument {

    @JsonProperty("Code")
    public String code;

    @JsonProperty("Message")
    public String message;

    @JsonProperty("Resource")
    public String resource;

    @JsonProperty("RequestId")
    public String requestId;
}
