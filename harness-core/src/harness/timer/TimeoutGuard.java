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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import harness.core.ExitCode;

/**
 * Watchdog for a single test case execution.
 *
 * A hung test body cannot be interrupted safely, so when the timeout elapses the whole process is terminated
 * from the timer thread. There is no way to recover from a fired watchdog: counters and logs of the running
 * case are never finalized.
 */
public class TimeoutGuard
{
    private static final Logger logger = LoggerFactory.getLogger(TimeoutGuard.class);

    private final Timer timer;

    public TimeoutGuard(Timer timer)
    {
        this.timer = timer;
    }

    /**
     * @return handle of the armed timer, or {@code null} if it could not be armed; the case then runs
     *         without a watchdog
     */
    public Timer.Handle arm(int timeoutSeconds, Runnable onTimeout)
    {
        if (onTimeout == null)
        {
            logger.error("Timeout callback can't be null");
            return null;
        }

        if (timeoutSeconds < 0)
        {
            logger.error("Timeout value must be bigger than zero.");
            return null;
        }

        try
        {
            return timer.schedule(TimeUnit.SECONDS.toMillis(timeoutSeconds), onTimeout);
        }
        catch (RuntimeException e)
        {
            logger.error("Creation of timeout timer failed: {}", e.getMessage(), e);
            return null;
        }
    }

    /**
     * Safe to call with a {@code null} handle, or with a timer that already fired or was already cancelled.
     */
    public void disarm(Timer.Handle handle)
    {
        if (handle != null)
            handle.cancel();
    }

    /**
     * Timeout callback that logs and terminates the process with {@link ExitCode#ABORTED}.
     */
    public static Runnable bailOut(Terminator terminator)
    {
        return () -> {
            logger.error("TestCaseTimeout timer expired. Aborting test run.");
            terminator.terminate(ExitCode.ABORTED);
        };
    }
}
