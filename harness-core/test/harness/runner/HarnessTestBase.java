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

package harness.runner;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Before;
import org.slf4j.LoggerFactory;

import harness.assertions.AssertSummary;
import harness.clock.Clock;
import harness.core.Configuration;
import harness.core.LogFormat;
import harness.core.Run;
import harness.generators.PcgFuzzer;
import harness.timer.Timer;

/**
 * Recording collaborators and log capture shared by the runner tests.
 */
public abstract class HarnessTestBase
{
    protected RecordingTimer timer;
    protected RecordingFuzzer fuzzer;
    protected CountingAsserts asserts;
    protected ManualClock clock;
    protected List<Integer> terminations;

    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUpHarness()
    {
        timer = new RecordingTimer();
        fuzzer = new RecordingFuzzer();
        asserts = new CountingAsserts();
        clock = new ManualClock();
        terminations = new ArrayList<>();

        appender = new ListAppender<>();
        appender.start();
        harnessLogger().addAppender(appender);
    }

    @After
    public void tearDownHarness()
    {
        harnessLogger().detachAppender(appender);
    }

    protected Run run()
    {
        return run(new Configuration.ConfigurationBuilder().setColoredOutput(false).build());
    }

    protected Run run(Configuration configuration)
    {
        return new Run.Builder(configuration).setTimer(timer)
                                             .setFuzzer(fuzzer)
                                             .setAsserts(asserts)
                                             .setClock(clock)
                                             .setTerminator(terminations::add)
                                             .build();
    }

    protected List<String> logLines()
    {
        return appender.list.stream()
                            .map(ILoggingEvent::getFormattedMessage)
                            .collect(Collectors.toList());
    }

    protected List<String> logLinesStartingWith(String prefix)
    {
        return logLines().stream()
                         .filter(line -> line.startsWith(prefix))
                         .collect(Collectors.toList());
    }

    private static Logger harnessLogger()
    {
        return (Logger) LoggerFactory.getLogger("harness");
    }

    public static class RecordingTimer implements Timer
    {
        public final List<Long> scheduledDelays = new ArrayList<>();
        public final List<Runnable> pending = new ArrayList<>();
        public int cancelled;
        public boolean refuse;
        public boolean closed;

        public Handle schedule(long delayMillis, Runnable callback)
        {
            if (refuse)
                throw new IllegalStateException("Timer refused to schedule");

            scheduledDelays.add(delayMillis);
            pending.add(callback);
            return () -> {
                if (pending.remove(callback))
                    cancelled++;
            };
        }

        /**
         * Runs all callbacks that are still armed, as if their delay elapsed.
         */
        public void fireAll()
        {
            List<Runnable> due = new ArrayList<>(pending);
            pending.clear();
            due.forEach(Runnable::run);
        }

        public void close()
        {
            closed = true;
        }
    }

    public static class RecordingFuzzer extends PcgFuzzer
    {
        public final List<Long> keys = new ArrayList<>();

        public void init(long execKey)
        {
            keys.add(execKey);
            super.init(execKey);
        }
    }

    public static class CountingAsserts extends AssertSummary
    {
        public int resets;

        public CountingAsserts()
        {
            super(LogFormat.PLAIN);
        }

        public void reset()
        {
            resets++;
            super.reset();
        }
    }

    /**
     * Clock that only moves when told to.
     */
    public static class ManualClock implements Clock
    {
        private long ticks;

        public long ticks()
        {
            return ticks;
        }

        public long ticksPerSecond()
        {
            return 1000;
        }

        public void advanceMillis(long millis)
        {
            ticks += millis;
        }
    }
}
