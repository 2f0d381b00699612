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

package harness.timer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;

import harness.core.ExitCode;

public class TimeoutGuardTest
{
    @Test
    public void armsWithTimeoutInMillis()
    {
        List<Long> delays = new ArrayList<>();
        TimeoutGuard guard = new TimeoutGuard(recording(delays));

        Assert.assertNotNull(guard.arm(30, () -> {}));
        Assert.assertNotNull(guard.arm(0, () -> {}));
        Assert.assertEquals(Arrays.asList(30_000L, 0L), delays);
    }

    @Test
    public void invalidArgumentsLeaveTheCaseUnguarded()
    {
        List<Long> delays = new ArrayList<>();
        TimeoutGuard guard = new TimeoutGuard(recording(delays));

        Assert.assertNull(guard.arm(10, null));
        Assert.assertNull(guard.arm(-1, () -> {}));
        Assert.assertTrue(delays.isEmpty());
    }

    @Test
    public void schedulingFailureIsNotFatal()
    {
        TimeoutGuard guard = new TimeoutGuard(new Timer()
        {
            public Handle schedule(long delayMillis, Runnable callback)
            {
                throw new IllegalStateException("no threads left");
            }

            public void close()
            {
            }
        });

        Assert.assertNull(guard.arm(10, () -> {}));
        guard.disarm(null);
    }

    @Test
    public void bailOutTerminatesWithAbortedStatus()
    {
        List<Integer> statuses = new ArrayList<>();
        TimeoutGuard.bailOut(statuses::add).run();
        Assert.assertEquals(Collections.singletonList(ExitCode.ABORTED), statuses);
    }

    @Test
    public void scheduledTimerFires() throws InterruptedException
    {
        CountDownLatch fired = new CountDownLatch(1);
        try (ScheduledTimer timer = new ScheduledTimer())
        {
            TimeoutGuard guard = new TimeoutGuard(timer);
            Assert.assertNotNull(guard.arm(0, fired::countDown));
            Assert.assertTrue(fired.await(10, TimeUnit.SECONDS));
        }
    }

    @Test
    public void disarmedTimerDoesNotFire() throws InterruptedException
    {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch later = new CountDownLatch(1);
        try (ScheduledTimer timer = new ScheduledTimer())
        {
            TimeoutGuard guard = new TimeoutGuard(timer);
            Timer.Handle handle = guard.arm(1, () -> fired.add("cancelled"));
            guard.disarm(handle);
            guard.disarm(handle);

            // single timer thread: once a later callback ran, the earlier one would have run too
            timer.schedule(1500, later::countDown);
            Assert.assertTrue(later.await(10, TimeUnit.SECONDS));
            Assert.assertTrue(fired.isEmpty());
        }
    }

    private static Timer recording(List<Long> delays)
    {
        return new Timer()
        {
            public Handle schedule(long delayMillis, Runnable callback)
            {
                delays.add(delayMillis);
                return () -> {};
            }

            public void close()
            {
            }
        };
    }
}
