package dev.mars.s3kit.util;

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


import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ContentTypesTest {

    @ParameterizedTest
    @CsvSource({
            "notes.txt, text/plain",
            "INDEX.HTML, text/html",
            "photo.final.JPeG, image/jpeg",
            "sheet.xlsx, application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "archive.tar.gz, application/octet-stream",
            "Makefile, application/octet-stream",
            "trailing., application/octet-stream"
    })
    void testForFile(String name, String expected) {
        assertEquals(expected, ContentTypes.forFile(Path.of("dir", name)));
    }
}
