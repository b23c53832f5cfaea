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

import java.util.UUID;

/**
 * Identifiers backed by {@link UUID}. The empty identifier is the nil UUID.
 */
public class UuidIdProvider implements IdProvider {
    private static final UuidId EMPTY = new UuidId(new UUID(0, 0));

    @Override
    public ID newId() {
        return new UuidId(UUID.randomUUID());
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
        try {
            return new UuidId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid UUID: " + value, e);
        }
    }

    static final class UuidId implements ID {
        private final UUID uuid;

        UuidId(UUID uuid) {
            this.uuid = uuid;
        }

        @Override
        public boolean isEmpty() {
            return uuid.getMostSignificantBits() == 0 && uuid.getLeastSignificantBits() == 0;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UuidId && uuid.equals(((UuidId) o).uuid);
        }

        @Override
        public int hashCode() {
            return uuid.hashCode();
        }

        @Override
        public String toString() {
            return uuid.toString();
        }
    }
}
