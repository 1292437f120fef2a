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

/**
 * Direction of a chunked transfer relative to the local filesystem.
 *
 * <ul>
 *   <li><b>UPLOAD:</b> local file to an object, using multipart upload</li>
 *   <li><b>DOWNLOAD:</b> object to a local file, using ranged GETs</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TransferDirection {

    UPLOAD("Local -> Remote"),

    DOWNLOAD("Remote -> Local");

    private final String description;

    TransferDirection(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
