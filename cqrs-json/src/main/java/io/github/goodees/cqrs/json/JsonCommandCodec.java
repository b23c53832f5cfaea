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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.registry.CommandRegistry;
import io.github.goodees.cqrs.core.registry.TypeNotRegisteredException;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON codec of commands. Commands are written field by field, and read into the class created by the
 * {@link CommandRegistry} for the command type.
 */
public class JsonCommandCodec {
    private final ObjectMapper mapper;
    private final ObjectMapper commandMapper;
    private final CommandRegistry registry;

    public JsonCommandCodec() {
        this(JsonMappers.createMapper(), CommandRegistry.defaultRegistry());
    }

    public JsonCommandCodec(ObjectMapper mapper, CommandRegistry registry) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.registry = Objects.requireNonNull(registry, "Command registry must be specified");
        this.commandMapper = mapper.copy()
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    }

    public byte[] marshalCommand(Context ctx, Command command) throws IOException {
        CommandEnvelope envelope = new CommandEnvelope();
        envelope.commandType = command.commandType();
        envelope.command = commandMapper.valueToTree(command);
        envelope.context = ContextCodec.marshal(ctx);
        return mapper.writeValueAsBytes(envelope);
    }

    /**
     * Decode command.
     * @param bytes the JSON
     * @return command with its context
     * @throws IOException when the JSON is malformed
     * @throws TypeNotRegisteredException when command type is not registered
     */
    public Decoded<Command> unmarshalCommand(byte[] bytes) throws IOException, TypeNotRegisteredException {
        CommandEnvelope envelope = mapper.readValue(bytes, CommandEnvelope.class);
        if (envelope.commandType == null || envelope.commandType.isEmpty()) {
            throw new IOException("Command without command_type");
        }
        Command prototype = registry.create(envelope.commandType);
        Command command = envelope.command == null ? prototype
                : commandMapper.readerForUpdating(prototype).readValue(envelope.command);
        return new Decoded<>(ContextCodec.unmarshal(envelope.context), command);
    }
}
