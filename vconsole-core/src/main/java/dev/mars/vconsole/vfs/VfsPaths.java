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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Path algebra over absolute, {@code /}-rooted path strings. No I/O.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class VfsPaths {

    public static final String ROOT = "/";
    public static final String SEPARATOR = "/";

    private VfsPaths() {
        // Utility class
    }

    /**
     * Normalizes an absolute path: drops empty and {@code .} segments and pops
     * the previous segment on {@code ..}, never going above the root.
     *
     * @param path an absolute path
     * @return the normalized path, always starting with {@code /}
     * @throws IllegalArgumentException if the path is null or relative
     */
    public static String resolve(String path) {
        if (path == null || !path.startsWith(SEPARATOR)) {
            throw new IllegalArgumentException("Only absolute paths are supported: " + path);
        }
        Deque<String> resolved = new ArrayDeque<>();
        for (String part : path.split(SEPARATOR)) {
            if (part.isEmpty() || ".".equals(part)) {
                continue;
            }
            if ("..".equals(part)) {
                resolved.pollLast();
            } else {
                resolved.addLast(part);
            }
        }
        return SEPARATOR + String.join(SEPARATOR, resolved);
    }

    /**
     * Resolves {@code path} against {@code base} when it is relative.
     */
    public static String resolve(String base, String path) {
        if (path == null || path.isEmpty()) {
            return resolve(base);
        }
        if (path.startsWith(SEPARATOR)) {
            return resolve(path);
        }
        return resolve(base + SEPARATOR + path);
    }

    public static String join(String... parts) {
        return resolve(String.join(SEPARATOR, parts));
    }

    public static String dirname(String path) {
        String resolved = resolve(path);
        int lastSlash = resolved.lastIndexOf('/');
        return lastSlash <= 0 ? ROOT : resolved.substring(0, lastSlash);
    }

    public static String basename(String path) {
        String resolved = resolve(path);
        return resolved.substring(resolved.lastIndexOf('/') + 1);
    }

    /**
     * Returns the last segment with {@code extension} stripped when it ends with it.
     */
    public static String basename(String path, String extension) {
        String name = basename(path);
        if (extension != null && !extension.isEmpty() && name.endsWith(extension) && !name.equals(extension)) {
            return name.substring(0, name.length() - extension.length());
        }
        return name;
    }

    /**
     * Returns the extension of the last segment including the dot, or an empty
     * string. Dot files such as {@code .profile} have no extension.
     */
    public static String extname(String path) {
        String name = basename(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }

    public static List<String> segments(String path) {
        String resolved = resolve(path);
        List<String> segments = new ArrayList<>();
        for (String part : resolved.split(SEPARATOR)) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        return segments;
    }

    /**
     * Returns true if {@code path} equals {@code ancestor} or is nested under it.
     */
    public static boolean isWithin(String ancestor, String path) {
        String a = resolve(ancestor);
        String p = resolve(path);
        return ROOT.equals(a) || p.equals(a) || p.startsWith(a + SEPARATOR);
    }

    /**
     * Returns {@code path} relative to {@code base}, or the absolute path when it
     * is not nested under {@code base}.
     */
    public static String relativize(String base, String path) {
        String b = resolve(base);
        String p = resolve(path);
        if (p.equals(b)) {
            return ".";
        }
        String prefix = ROOT.equals(b) ? ROOT : b + SEPARATOR;
        return p.startsWith(prefix) ? p.substring(prefix.length()) : p;
    }

    public static boolean isRoot(String path) {
        return ROOT.equals(resolve(path));
    }
}
