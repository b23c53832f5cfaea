package io.github.goodees.cqrs.core.aggregate;

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
import io.github.goodees.cqrs.core.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Dispatch table of command handling methods of an aggregate, matched by command class. First matching branch
 * handles the command, unmatched commands fail with {@link AggregateException#unknownCommand(Command)}.
 *
 * <pre>{@code
 * private final CommandSwitch commands = CommandSwitch.builder()
 *         .on(Create.class, this::create)
 *         .on(AddItem.class, this::addItem)
 *         .build();
 * }</pre>
 */
public final class CommandSwitch {
    private final List<Branch<?>> branches;

    private CommandSwitch(Builder b) {
        this.branches = new ArrayList<>(b.branches);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void dispatch(Context ctx, Command command) throws Exception {
        for (Branch<?> branch : branches) {
            if (branch.matches(command)) {
                branch.apply(ctx, command);
                return;
            }
        }
        throw AggregateException.unknownCommand(command);
    }

    public boolean handles(Command command) {
        for (Branch<?> branch : branches) {
            if (branch.matches(command)) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    public interface Handler<C extends Command> {
        void handle(Context ctx, C command) throws Exception;
    }

    public static class Builder {
        private final List<Branch<?>> branches = new ArrayList<>();

        public <C extends Command> Builder on(Class<C> clazz, Handler<? super C> handler) {
            return on(clazz, null, handler);
        }

        public <C extends Command> Builder on(Class<C> clazz, Predicate<? super C> predicate,
                                              Handler<? super C> handler) {
            branches.add(new Branch<>(clazz, predicate, handler));
            return this;
        }

        public CommandSwitch build() {
            return new CommandSwitch(this);
        }
    }

    private static class Branch<C extends Command> {
        private final Class<C> caseClass;
        private final Predicate<? super C> check;
        private final Handler<? super C> handler;

        Branch(Class<C> caseClass, Predicate<? super C> check, Handler<? super C> handler) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.check = check;
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        boolean matches(Command command) {
            return caseClass.isInstance(command) && (check == null || check.test(caseClass.cast(command)));
        }

        void apply(Context ctx, Command command) throws Exception {
            handler.handle(ctx, caseClass.cast(command));
        }
    }
}
