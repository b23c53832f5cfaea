package io.github.goodees.cqrs.core.middleware.command;

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

import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.MockCommand;
import io.github.goodees.cqrs.core.id.Ids;
import org.junit.AfterClass;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class AsyncMiddlewareTest {
    static ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterClass
    public static void shutdown() {
        executor.shutdown();
    }

    @Test
    public void issuer_does_not_wait_for_handler() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch handled = new CountDownLatch(1);
        AsyncMiddleware async = new AsyncMiddleware(executor);
        CommandHandler handler = async.apply((ctx, cmd) -> {
            release.await(5, TimeUnit.SECONDS);
            handled.countDown();
        });
        handler.handleCommand(Context.background(), new MockCommand(Ids.newId(), "x"));
        assertEquals("Handler still waits", 1, handled.getCount());
        release.countDown();
        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertTrue(async.errors().isEmpty());
    }

    @Test
    public void failures_are_published() throws Exception {
        AsyncMiddleware async = new AsyncMiddleware(executor);
        CommandHandler handler = async.apply((ctx, cmd) -> {
            throw new IllegalStateException("down");
        });
        MockCommand command = new MockCommand(Ids.newId(), "x");
        handler.handleCommand(Context.background(), command);

        CommandException error = async.errors().poll(5, TimeUnit.SECONDS);
        assertNotNull(error);
        assertEquals(CommandException.Fault.ASYNC_FAILED, error.getFault());
        assertSame(command, error.getCommand());
        assertEquals("down", error.getCause().getMessage());
    }

    @Test
    public void errors_are_published() throws Exception {
        AsyncMiddleware async = new AsyncMiddleware(executor);
        CommandHandler handler = async.apply((ctx, cmd) -> {
            throw new AssertionError("broken invariant");
        });
        handler.handleCommand(Context.background(), new MockCommand(Ids.newId(), "x"));

        CommandException error = async.errors().poll(5, TimeUnit.SECONDS);
        assertNotNull(error);
        assertTrue(error.getCause() instanceof AssertionError);
    }
}
