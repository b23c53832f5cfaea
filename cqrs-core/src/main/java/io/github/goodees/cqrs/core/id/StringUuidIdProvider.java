package io.github.goodees.cqrs.core.id;

/*-
 * #%L
 * cqrs-core
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

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifiers kept as canonical UUID strings. Parsing accepts plain UUIDs, UUIDs in braces and URNs
 * ({@code urn:uuid:...}). The empty identifier is the empty string.
 */
public class StringUuidIdProvider implements IdProvider {
    private static final Pattern UUID_FORMAT = Pattern.compile(
            "^(?:urn:uuid:)?\\{?([0-9a-f]{8})-?([0-9a-f]{4})-?([0-9a-f]{4})-?([0-9a-f]{4})-?([0-9a-f]{12})\\}?$",
            Pattern.CASE_INSENSITIVE);
    private static final StringId EMPTY = new StringId("");

    @Override
    public ID newId() {
        return new StringId(UUID.randomUUID().toString());
    }

    @Override
    public ID emptyId() {
        return EMPTY;
    }

    @Override
    public ID parse(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        Matcher m = UUID_FORMAT.matcher(value);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid UUID: " + value);
        }
        String canonical = String.join("-", m.group(1), m.group(2), m.group(3), m.group(4), m.group(5));
        return new StringId(canonical.toLowerCase(Locale.ROOT));
    }

    static final class StringId implements ID {
        private final String value;

        StringId(String value) {
            this.value = value;
        }

        @Override
        public boolean isEmpty() {
            return value.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StringId && value.equals(((StringId) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
