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
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LockMiddlewareTest {
    private final LocalLock lock = new LocalLock();

    @Test
    public void concurrent_command_for_same_aggregate_is_refused() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CommandHandler handler = new LockMiddleware(lock).apply((ctx, cmd) -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        ID id = Ids.newId();
        CompletableFuture<Void> first = CompletableFuture.runAsync(() -> {
            try {
                handler.handleCommand(Context.background(), new MockCommand(id, "first"));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        try {
            handler.handleCommand(Context.background(), new MockCommand(id, "second"));
            fail("Aggregate is locked");
        } catch (CommandException e) {
            assertEquals(CommandException.Fault.LOCKED, e.getFault());
        }
        release.countDown();
        first.get(5, TimeUnit.SECONDS);

        handler.handleCommand(Context.background(), new MockCommand(id, "third"));
    }

    @Test
    public void lock_is_released_after_failure() throws Exception {
        CommandHandler handler = new LockMiddleware(lock).apply((ctx, cmd) -> {
            throw new IllegalStateException("failed");
        });
        ID id = Ids.newId();
        for (int i = 0; i < 2; i++) {
            try {
                handler.handleCommand(Context.background(), new MockCommand(id, "x"));
                fail("Handler fails");
            } catch (IllegalStateException e) {
                assertEquals("failed", e.getMessage());
            }
        }
        assertTrue(lock.tryLock(id.toString()));
    }

    @Test(expected = IllegalStateException.class)
    public void unlocking_free_resource_fails() {
        lock.unlock("free");
    }
}
