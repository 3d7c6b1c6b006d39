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

import java.util.List;
import java.util.Map;

/**
 * One command of a {@code |}-separated pipeline.
 *
 * @param command the command name
 * @param words the unexpanded arguments in order
 * @param redirections the redirections in order of appearance
 * @param environment assignments that apply to this segment only
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record PipelineSegment(String command,
                              List<Word> words,
                              List<Redirection> redirections,
                              Map<String, String> environment) {

    public PipelineSegment {
        words = List.copyOf(words);
        redirections = List.copyOf(redirections);
        environment = Map.copyOf(environment);
    }

    /**
     * Returns the argument texts as written.
     */
    public List<String> args() {
        return words.stream().map(Word::text).toList();
    }
}
