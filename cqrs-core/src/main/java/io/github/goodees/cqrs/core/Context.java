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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Invocation context passed to every store, bus and handler operation.
 * <p>A context is immutable. It carries a namespace, arbitrary typed values and a cancellation scope. Derived
 * contexts share the cancellation scope of their parent, unless created by {@link #withCancel()}, which opens a
 * child scope. Cancelling a scope cancels all of its child scopes, never its parent.</p>
 * <p>Absence of namespace means the {@link #DEFAULT_NAMESPACE}.</p>
 */
public class Context {
    public static final String DEFAULT_NAMESPACE = "default";

    private static final Context BACKGROUND = new Context(DEFAULT_NAMESPACE, Collections.emptyMap(), Scope.NEVER);

    private final String namespace;
    private final Map<Key<?>, Object> values;
    final Scope scope;

    Context(String namespace, Map<Key<?>, Object> values, Scope scope) {
        this.namespace = namespace;
        this.values = values;
        this.scope = scope;
    }

    /**
     * Root context that is never cancelled, with default namespace and no values.
     * @return the background context
     */
    public static Context background() {
        return BACKGROUND;
    }

    public String namespace() {
        return namespace;
    }

    public Context withNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            namespace = DEFAULT_NAMESPACE;
        }
        return new Context(namespace, values, scope);
    }

    public <T> Context withValue(Key<T> key, T value) {
        Objects.requireNonNull(key, "Key must be specified");
        Map<Key<?>, Object> copy = new HashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new Context(namespace, Collections.unmodifiableMap(copy), scope);
    }

    public <T> T value(Key<T> key) {
        return key.type.cast(values.get(key));
    }

    public <T> T value(Key<T> key, T defaultValue) {
        T value = value(key);
        return value == null ? defaultValue : value;
    }

    /**
     * Create a context with new cancellation scope, that is cancelled when this context is cancelled, or when
     * {@link CancellableContext#cancel()} is called on it.
     * @return new cancellable context with same namespace and values
     */
    public CancellableContext withCancel() {
        Scope child = new Scope(scope);
        return new CancellableContext(namespace, values, child);
    }

    public boolean isCancelled() {
        return scope.isCancelled();
    }

    /**
     * Register a callback to run when this context gets cancelled. If it already is, the callback runs immediately
     * on calling thread.
     * @param callback the callback
     */
    public void onCancel(Runnable callback) {
        scope.onCancel(callback);
    }

    /**
     * Deregister a callback registered by {@link #onCancel(Runnable)}. Callbacks are matched by equality, so pass
     * the same instance.
     * @param callback the callback
     * @return true if the callback was registered and has not run yet
     */
    public boolean removeOnCancel(Runnable callback) {
        return scope.removeOnCancel(callback);
    }

    /**
     * Wait until this context is cancelled.
     * @param timeout maximum time to wait
     * @param unit unit of timeout
     * @return true if context got cancelled, false if the timeout elapsed
     * @throws InterruptedException when interrupted while waiting
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return scope.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "Context[namespace=" + namespace + ", values=" + values + (isCancelled() ? ", cancelled" : "") + "]";
    }

    /**
     * Typed key of a context value. Keys are compared by identity.
     * @param <T> type of the value
     */
    public static final class Key<T> {
        private final String name;
        private final Class<T> type;

        private Key(String name, Class<T> type) {
            this.name = Objects.requireNonNull(name, "Key name must be specified");
            this.type = Objects.requireNonNull(type, "Key type must be specified");
        }

        public static <T> Key<T> of(String name, Class<T> type) {
            return new Key<>(name, type);
        }

        public String name() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static class Scope {
        static final Scope NEVER = new Scope(null) {
            @Override
            void onCancel(Runnable callback) {
                // never fires
            }

            @Override
            void cancel() {
                throw new UnsupportedOperationException("Background context cannot be cancelled");
            }
        };

        private final Scope parent;
        private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
        private final CountDownLatch cancelled = new CountDownLatch(1);
        private final Runnable parentCallback = this::cancel;

        Scope(Scope parent) {
            this.parent = parent;
            if (parent != null) {
                parent.onCancel(parentCallback);
            }
        }

        boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        void onCancel(Runnable callback) {
            callbacks.add(callback);
            // cancel might have fired in between
            if (isCancelled() && callbacks.remove(callback)) {
                callback.run();
            }
        }

        boolean removeOnCancel(Runnable callback) {
            return callbacks.remove(callback);
        }

        void cancel() {
            synchronized (this) {
                if (isCancelled()) {
                    return;
                }
                cancelled.countDown();
            }
            if (parent != null) {
                parent.callbacks.remove(parentCallback);
            }
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }

        boolean await(long timeout, TimeUnit unit) throws InterruptedException {
            return cancelled.await(timeout, unit);
        }
    }
}
