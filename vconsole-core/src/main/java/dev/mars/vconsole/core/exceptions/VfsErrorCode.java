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
 * Filesystem error conditions with their POSIX errno values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum VfsErrorCode {
    NOT_FOUND("ENOENT", -2),
    ACCESS_DENIED("EACCES", -13),
    IS_DIRECTORY("EISDIR", -21),
    NOT_A_FILE("ENOTDIR", -20),
    FILE_EXISTS("EEXIST", -17),
    NOT_EMPTY("ENOTEMPTY", -39),
    INVALID_PATH("EINVAL", -22),
    NO_SPACE("ENOSPC", -28),
    TOO_MANY_LINKS("EMLINK", -31);

    private final String symbol;
    private final int errno;

    VfsErrorCode(String symbol, int errno) {
        this.symbol = symbol;
        this.errno = errno;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getErrno() {
        return errno;
    }
}
