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

import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.id.ID;

public class TodoCommands {
    private TodoCommands() {
    }

    abstract static class TodoCommand implements Command {
        ID id;

        TodoCommand(ID id) {
            this.id = id;
        }

        @Override
        public ID aggregateId() {
            return id;
        }

        @Override
        public String aggregateType() {
            return TodoList.TYPE;
        }
    }

    public static class Create extends TodoCommand {
        public Create(ID id) {
            super(id);
        }

        @Override
        public String commandType() {
            return "CreateTodoList";
        }
    }

    public static class AddItem extends TodoCommand {
        String description;

        public AddItem(ID id, String description) {
            super(id);
            this.description = description;
        }

        @Override
        public String commandType() {
            return "AddItem";
        }
    }

    public static class CompleteItem extends TodoCommand {
        int itemId;

        public CompleteItem(ID id, int itemId) {
            super(id);
            this.itemId = itemId;
        }

        @Override
        public String commandType() {
            return "CompleteItem";
        }
    }

    public static class RemoveItem extends TodoCommand {
        int itemId;

        public RemoveItem(ID id, int itemId) {
            super(id);
            this.itemId = itemId;
        }

        @Override
        public String commandType() {
            return "RemoveItem";
        }
    }
}
