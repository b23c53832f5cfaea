package io.github.goodees.cqrs.example.todo;

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

import io.github.goodees.cqrs.core.Entity;
import io.github.goodees.cqrs.core.Versionable;
import io.github.goodees.cqrs.core.id.ID;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read model of a todo list. Instances are never mutated once saved.
 */
public class TodoListView implements Entity, Versionable {
    private final ID id;
    private final int version;
    private final List<String> open;
    private final List<String> done;

    public TodoListView(ID id) {
        this(id, 0, Collections.emptyList(), Collections.emptyList());
    }

    TodoListView(ID id, int version, List<String> open, List<String> done) {
        this.id = id;
        this.version = version;
        this.open = Collections.unmodifiableList(new ArrayList<>(open));
        this.done = Collections.unmodifiableList(new ArrayList<>(done));
    }

    @Override
    public ID entityId() {
        return id;
    }

    @Override
    public int aggregateVersion() {
        return version;
    }

    public List<String> getOpen() {
        return open;
    }

    public List<String> getDone() {
        return done;
    }
}
