/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rugo.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * Resolves required units relative to a base directory, adding the {@code .rugo} extension
 * when the path has none.
 */
@RequiredArgsConstructor
public class DirectorySourceResolver implements SourceResolver {

    private final Path baseDir;

    @Override
    public Optional<String> resolve(final String path) throws IOException {
        String file = path.endsWith(".rugo") ? path : path + ".rugo";
        Path unit = baseDir.resolve(file).normalize();
        if (!Files.isRegularFile(unit)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(unit, StandardCharsets.UTF_8));
    }
}
