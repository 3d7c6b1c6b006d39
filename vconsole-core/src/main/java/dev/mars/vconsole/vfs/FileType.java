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

package dev.mars.vconsole.vfs;

/**
 * Kinds of filesystem objects an inode can describe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public enum FileType {
    FILE('-'),
    DIRECTORY('d'),
    SYMLINK('l'),
    HARDLINK('h'),
    BLOCK_DEVICE('b'),
    CHAR_DEVICE('c'),
    FIFO('p');

    private final char listingChar;

    FileType(char listingChar) {
        this.listingChar = listingChar;
    }

    /**
     * Returns the type character used in the first column of a long listing.
     */
    public char getListingChar() {
        return listingChar;
    }
}
