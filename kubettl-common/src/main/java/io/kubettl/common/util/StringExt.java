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

package io.kubettl.common.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A set of string manipulation related functions.
 */
public final class StringExt {

    private static final Pattern COMMA_SPLIT_RE = Pattern.compile("\\s*,\\s*");

    private StringExt() {
    }

    /**
     * Return true if the string value is null or an empty string.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Returns a list of comma separated values from the parameter. The white space characters around each value
     * is removed as well.
     */
    public static List<String> splitByComma(String value) {
        if (isEmpty(value)) {
            return Collections.emptyList();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(COMMA_SPLIT_RE.split(trimmed));
    }

    /**
     * See {@link #splitByComma(String)}. Empty entries are dropped, and the declaration order is kept.
     */
    public static Set<String> splitByCommaIntoSet(String value) {
        Set<String> result = new LinkedHashSet<>();
        for (String item : splitByComma(value)) {
            if (!item.isEmpty()) {
                result.add(item);
            }
        }
        return result;
    }
}
