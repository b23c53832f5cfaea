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

/**
 * Composition of handler middleware.
 * <p>Middleware is applied in reverse order of the arguments, so that the first middleware is the outermost one:
 * {@code useEventHandlerMiddleware(h, m1, m2)} yields {@code m1(m2(h))} and an event passes {@code m1} first.</p>
 */
public final class Middlewares {
    private Middlewares() {
    }

    public static CommandHandler useCommandHandlerMiddleware(CommandHandler handler,
                                                             CommandHandlerMiddleware... middleware) {
        CommandHandler result = handler;
        for (int i = middleware.length - 1; i >= 0; i--) {
            result = middleware[i].apply(result);
        }
        return result;
    }

    public static EventHandler useEventHandlerMiddleware(EventHandler handler, EventHandlerMiddleware... middleware) {
        EventHandler result = handler;
        for (int i = middleware.length - 1; i >= 0; i--) {
            result = middleware[i].apply(result);
        }
        return result;
    }
}
