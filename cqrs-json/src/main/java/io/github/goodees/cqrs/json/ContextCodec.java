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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transfer of context values over the wire. Only the namespace is transferred.
 */
final class ContextCodec {
    static final String NAMESPACE = "namespace";

    private ContextCodec() {
    }

    static Map<String, Object> marshal(Context ctx) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(NAMESPACE, ctx.namespace());
        return values;
    }

    static Context unmarshal(Map<String, Object> values) {
        Context ctx = Context.background();
        if (values != null && values.get(NAMESPACE) instanceof String) {
            ctx = ctx.withNamespace((String) values.get(NAMESPACE));
        }
        return ctx;
    }
}
