/*
 * Copyright 2026 Netflix, Inc.
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

package io.kubettl.controller.ttl;

public final class TtlAnnotations {

    /**
     * Time to live of a report, counted from the report's update timestamp. The value is a duration string,
     * like "24h" or "1h30m".
     */
    public static final String TTL_REPORT_ANNOTATION = "starboard.aquasecurity.github.io/report-ttl";

    private TtlAnnotations() {
    }
}
