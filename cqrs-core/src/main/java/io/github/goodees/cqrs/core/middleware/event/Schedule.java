package io.github.goodees.cqrs.core.middleware.event;

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

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Recurrence of scheduled events.
 */
@FunctionalInterface
public interface Schedule {

    /**
     * Time of the next run.
     * @param previous time of previous run, or time of scheduling for the first run
     * @return time of next run, or null when there are no more runs
     */
    Instant next(Instant previous);

    /**
     * Run with fixed period. Runs are planned relative to previous plan, so they do not drift.
     * @param period the period
     * @return new schedule
     */
    static Schedule every(Duration period) {
        Objects.requireNonNull(period, "Period must be specified");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive, was " + period);
        }
        return previous -> previous.plus(period);
    }

    /**
     * Run according to cron expression, evaluated in system default zone.
     * @param expression six field cron expression, starting with seconds
     * @return new schedule
     * @throws IllegalArgumentException for invalid expressions
     * @see CronExpression#parse(String)
     */
    static Schedule cron(String expression) {
        return cron(expression, ZoneId.systemDefault());
    }

    static Schedule cron(String expression, ZoneId zone) {
        CronExpression cron = CronExpression.parse(expression);
        Objects.requireNonNull(zone, "Zone must be specified");
        return previous -> {
            ZonedDateTime next = cron.next(previous.atZone(zone));
            return next == null ? null : next.toInstant();
        };
    }
}
