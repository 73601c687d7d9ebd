/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.rms.core;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Exception for file-related errors while reading or rewriting scripts.
 */
public class RmsFileException extends RmsException {

    public RmsFileException(RmsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    public RmsFileException(RmsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    /**
     * Factory: File not found
     */
    public static RmsFileException notFound(Path path) {
        return new RmsFileException(RmsErrorCode.FILE_NOT_FOUND, Map.of("path", path.toString()));
    }

    /**
     * Factory: File exists but cannot be read
     */
    public static RmsFileException notReadable(Path path, Throwable cause) {
        return new RmsFileException(RmsErrorCode.FILE_NOT_READABLE, Map.of("path", path.toString()), cause);
    }

    /**
     * Factory: File contains NUL bytes
     */
    public static RmsFileException binary(Path path) {
        return new RmsFileException(RmsErrorCode.FILE_IS_BINARY, Map.of("path", path.toString()));
    }

    /**
     * Factory: Fixed text cannot be encoded back
     */
    public static RmsFileException encoding(Path path, Charset charset, Throwable cause) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("path", path.toString());
        ctx.put("charset", charset.name());
        return new RmsFileException(RmsErrorCode.FILE_ENCODING_ERROR, ctx, cause);
    }

    /**
     * Factory: Write or backup failed
     */
    public static RmsFileException writeFailed(Path path, Throwable cause) {
        return new RmsFileException(RmsErrorCode.FILE_WRITE_FAILED, Map.of("path", path.toString()), cause);
    }
}
