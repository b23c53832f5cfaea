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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;

import java.io.IOException;

/**
 * Writes {@link ID}s as strings, reads them with the active {@link io.github.goodees.cqrs.core.id.IdProvider}.
 */
public class IdModule extends SimpleModule {

    public IdModule() {
        super("cqrs-id");
        addSerializer(ID.class, new IdSerializer());
        addDeserializer(ID.class, new IdDeserializer());
    }

    static class IdSerializer extends JsonSerializer<ID> {
        @Override
        public void serialize(ID value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static class IdDeserializer extends JsonDeserializer<ID> {
        @Override
        public ID deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            try {
                return Ids.parse(text);
            } catch (IllegalArgumentException e) {
                throw ctxt.weirdStringException(text, ID.class, e.getMessage());
            }
        }

        @Override
        public ID getNullValue(DeserializationContext ctxt) {
            return Ids.emptyId();
        }
    }
}
