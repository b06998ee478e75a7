package io.chkfs.command.chk;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.chkfs.source.SizedInput;
import io.chkfs.source.SizedInputOpener;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/// Opens local files for encoding. The size is taken from the file system when the file is opened.
public class PathInputOpener implements SizedInputOpener<Path> {

    private static final int BUFFER_SIZE = 1 << 20;

    @Override
    public SizedInput open(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        long size = Files.size(path);
        return new SizedInput(new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE), size, path.toString());
    }
}
