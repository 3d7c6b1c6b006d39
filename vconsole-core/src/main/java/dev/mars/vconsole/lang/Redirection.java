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

package dev.mars.vconsole.lang;

/**
 * A stream redirection attached to a pipeline segment.
 *
 * <p>The target is either a file name or, when it parses as an integer, a file
 * descriptor to duplicate ({@code 2>&1}, {@code > 2}).</p>
 *
 * @param type the redirection kind
 * @param target the file name, or {@code null} for descriptor targets
 * @param descriptor the target descriptor, or {@code null} for file targets
 * @param sourceDescriptor the stream being redirected (0 stdin, 1 stdout, 2 stderr)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record Redirection(RedirectionType type, String target, Integer descriptor, int sourceDescriptor) {

    public static Redirection toFile(RedirectionType type, String target) {
        return new Redirection(type, target, null, type.getSourceDescriptor());
    }

    public static Redirection toDescriptor(RedirectionType type, int descriptor) {
        return new Redirection(type, null, descriptor, type.getSourceDescriptor());
    }

    public boolean isDescriptor() {
        return descriptor != null;
    }

    @Override
    public String toString() {
        return type.getOperator() + (isDescriptor() ? "&" + descriptor : target);
    }
}
