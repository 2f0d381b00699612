/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package harness.core;

import java.util.Objects;

import harness.assertions.AssertSummary;
import harness.assertions.AssertTracker;
import harness.clock.Clock;
import harness.generators.Fuzzer;
import harness.generators.PcgFuzzer;
import harness.timer.ScheduledTimer;
import harness.timer.Terminator;
import harness.timer.Timer;

/**
 * Configuration snapshot of a run together with the collaborators the harness drives.
 */
public class Run implements AutoCloseable
{
    public final Configuration snapshot;
    public final LogFormat format;

    public final Clock clock;
    public final Fuzzer fuzzer;
    public final AssertTracker asserts;
    public final Timer timer;
    public final Terminator terminator;

    private Run(Configuration snapshot,
                LogFormat format,
                Clock clock,
                Fuzzer fuzzer,
                AssertTracker asserts,
                Timer timer,
                Terminator terminator)
    {
        this.snapshot = snapshot;
        this.format = format;
        this.clock = clock;
        this.fuzzer = fuzzer;
        this.asserts = asserts;
        this.timer = timer;
        this.terminator = terminator;
    }

    public void close()
    {
        timer.close();
    }

    /**
     * Collaborators that are not set explicitly get their default implementation.
     */
    public static class Builder
    {
        private final Configuration snapshot;
        private Clock clock;
        private Fuzzer fuzzer;
        private AssertTracker asserts;
        private Timer timer;
        private Terminator terminator;

        public Builder(Configuration snapshot)
        {
            this.snapshot = Objects.requireNonNull(snapshot, "Configuration should not be null");
        }

        public Builder setClock(Clock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder setFuzzer(Fuzzer fuzzer)
        {
            this.fuzzer = fuzzer;
            return this;
        }

        public Builder setAsserts(AssertTracker asserts)
        {
            this.asserts = asserts;
            return this;
        }

        public Builder setTimer(Timer timer)
        {
            this.timer = timer;
            return this;
        }

        public Builder setTerminator(Terminator terminator)
        {
            this.terminator = terminator;
            return this;
        }

        public Run build()
        {
            Configuration.validate(snapshot);
            LogFormat format = LogFormat.of(snapshot.colored_output);
            return new Run(snapshot,
                           format,
                           clock == null ? Clock.NANO : clock,
                           fuzzer == null ? new PcgFuzzer() : fuzzer,
                           asserts == null ? new AssertSummary(format) : asserts,
                           timer == null ? new ScheduledTimer() : timer,
                           terminator == null ? Terminator.HALT : terminator);
        }
    }
}
