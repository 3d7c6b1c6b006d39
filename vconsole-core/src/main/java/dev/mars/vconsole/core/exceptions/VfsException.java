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

package dev.mars.vconsole.core.exceptions;

/**
 * Exception thrown when a virtual filesystem operation fails.
 * Every failure maps to exactly one {@link VfsErrorCode}, either from a storage
 * provider or from a filesystem-level invariant check.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class VfsException extends ShellException {

    private final VfsErrorCode code;
    private final String path;

    public VfsException(VfsErrorCode code, String message, String path) {
        super(message);
        this.code = code;
        this.path = path;
    }

    public VfsException(VfsErrorCode code, String message, String path, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.path = path;
    }

    public static VfsException notFound(String path) {
        return new VfsException(VfsErrorCode.NOT_FOUND, "No such file or directory", path);
    }

    public static VfsException accessDenied(String path) {
        return new VfsException(VfsErrorCode.ACCESS_DENIED, "Permission denied", path);
    }

    public static VfsException isDirectory(String path) {
        return new VfsException(VfsErrorCode.IS_DIRECTORY, "Is a directory", path);
    }

    public static VfsException notAFile(String path) {
        return new VfsException(VfsErrorCode.NOT_A_FILE, "Not a directory", path);
    }

    public static VfsException fileExists(String path) {
        return new VfsException(VfsErrorCode.FILE_EXISTS, "File exists", path);
    }

    public static VfsException notEmpty(String path) {
        return new VfsException(VfsErrorCode.NOT_EMPTY, "Directory not empty", path);
    }

    public static VfsException invalidPath(String path) {
        return new VfsException(VfsErrorCode.INVALID_PATH, "Invalid path", path);
    }

    public static VfsException noSpace(String path) {
        return new VfsException(VfsErrorCode.NO_SPACE, "No space left on device", path);
    }

    public static VfsException tooManyLinks(String path) {
        return new VfsException(VfsErrorCode.TOO_MANY_LINKS, "Too many levels of symbolic links", path);
    }

    public VfsErrorCode getCode() {
        return code;
    }

    public int getErrno() {
        return code.getErrno();
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns the message without the path prefix, as shown after a tool name.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (path == null) {
            return super.getMessage();
        }
        return String.format("%s: %s", path, super.getMessage());
    }
}
