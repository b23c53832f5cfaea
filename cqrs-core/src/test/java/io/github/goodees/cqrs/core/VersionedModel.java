package io.github.goodees.cqrs.core;

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

import io.github.goodees.cqrs.core.id.ID;

/**
 * Read model with a version and a line of text.
 */
public class VersionedModel implements Entity, Versionable {
    private final ID id;
    private final int version;
    private final String content;

    public VersionedModel(ID id) {
        this(id, 0, "");
    }

    public VersionedModel(ID id, int version, String content) {
        this.id = id;
        this.version = version;
        this.content = content;
    }

    @Override
    public ID entityId() {
        return id;
    }

    @Override
    public int aggregateVersion() {
        return version;
    }

    public String getContent() {
        return content;
    }
}
