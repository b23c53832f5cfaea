package io.github.goodees.cqrs.json;

/*-
 * #%L
 * cqrs-json
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

import io.github.goodees.cqrs.core.Context;

/**
 * Decoded value together with the context it was sent with.
 * @param <T> type of value
 */
public final class Decoded<T> {
    private final Context context;
    private final T value;

    Decoded(Context context, T value) {
        this.context = context;
        this.value = value;
    }

    public Context context() {
        return context;
    }

    public T value() {
        return value;
    }
}
