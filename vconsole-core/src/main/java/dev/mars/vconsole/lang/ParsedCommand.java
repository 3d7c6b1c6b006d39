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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed pipeline.
 *
 * @param segments the pipeline segments in execution order, empty for assignment-only input
 * @param background whether the pipeline ended with {@code &}
 * @param environment leading assignments applying to every segment, in input order
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record ParsedCommand(List<PipelineSegment> segments, boolean background, Map<String, String> environment) {

    public ParsedCommand {
        segments = List.copyOf(segments);
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public boolean isPipeline() {
        return segments.size() > 1;
    }
}
