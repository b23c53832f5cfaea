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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingCommandHandler implements CommandHandler {
    private final List<Command> commands = new CopyOnWriteArrayList<>();
    private final List<Context> contexts = new CopyOnWriteArrayList<>();
    private volatile Exception failure;

    public RecordingCommandHandler failingWith(Exception failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public void handleCommand(Context ctx, Command command) throws Exception {
        commands.add(command);
        contexts.add(ctx);
        if (failure != null) {
            throw failure;
        }
    }

    public List<Command> commands() {
        return commands;
    }

    public List<Context> contexts() {
        return contexts;
    }
}
