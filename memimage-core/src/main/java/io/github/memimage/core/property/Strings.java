package io.github.memimage.core.property;

/*-
 * #%L
 * memimage
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Normalizers and validations for String properties.
 */
public final class Strings {
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private Strings() {
    }

    /**
     * Replace every run of whitespace with single space and strip the value. Unicode whitespace (e. g. em space,
     * ideographic space) counts as whitespace too.
     * @param value value to normalize
     * @return normalized value, empty when value consisted of whitespace only
     */
    public static String normalizeSpace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").strip();
    }

    public static Predicate<String> nonEmpty() {
        return s -> !s.isEmpty();
    }

    /**
     * Accept strings with length in inclusive range.
     * @param min minimal length
     * @param max maximal length
     * @return predicate checking length of a string
     */
    public static Predicate<String> lengthRange(int min, int max) {
        if (min < 0 || min > max) {
            throw new IllegalArgumentException("Invalid length range " + min + ".." + max);
        }
        return s -> s.length() >= min && s.length() <= max;
    }
}
