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
 * Failure of command handling infrastructure: invalid command, missing handler or failed asynchronous execution.
 * Failures of the domain logic itself are propagated as they were thrown.
 */
public class CommandException extends Exception {
    private final Fault fault;
    private final transient Command command;

    public enum Fault {
        MISSING_FIELD, HANDLER_NOT_FOUND, HANDLER_ALREADY_SET, INVALID_AGGREGATE_TYPE, LOCKED, ASYNC_FAILED,
        SCHEDULED_FAILED
    }

    protected CommandException(Fault fault, Command command, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.command = command;
    }

    public Fault getFault() {
        return fault;
    }

    public Command getCommand() {
        return command;
    }

    public static CommandException missingField(Command command, String fieldName) {
        return new CommandException(Fault.MISSING_FIELD, command, "missing field: " + fieldName, null);
    }

    public static CommandException handlerNotFound(Command command) {
        return new CommandException(Fault.HANDLER_NOT_FOUND, command,
                "no handler for command type " + command.commandType(), null);
    }

    public static CommandException handlerAlreadySet(String commandType) {
        return new CommandException(Fault.HANDLER_ALREADY_SET, null,
                "handler already set for command type " + commandType, null);
    }

    public static CommandException invalidAggregateType(Command command, String expectedType) {
        return new CommandException(Fault.INVALID_AGGREGATE_TYPE, command, "command " + command.commandType()
                + " targets aggregate type " + command.aggregateType() + ", handler serves " + expectedType, null);
    }

    public static CommandException locked(Command command) {
        return new CommandException(Fault.LOCKED, command,
                "aggregate " + command.aggregateId() + " is locked by another command", null);
    }

    public static CommandException asyncFailed(Command command, Throwable cause) {
        return new CommandException(Fault.ASYNC_FAILED, command,
                "async command " + command.commandType() + " failed: " + cause.getMessage(), cause);
    }

    public static CommandException scheduledFailed(Command command, Throwable cause) {
        return new CommandException(Fault.SCHEDULED_FAILED, command,
                "scheduled command " + command.commandType() + " failed: " + cause.getMessage(), cause);
    }
}
