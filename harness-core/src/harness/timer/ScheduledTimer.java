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

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * {@link Timer} backed by a single daemon thread. The thread is only started when the first callback is
 * scheduled, and is started again if the timer is used after {@link #close()}.
 */
public class ScheduledTimer implements Timer
{
    private ScheduledThreadPoolExecutor executor;

    public synchronized Handle schedule(long delayMillis, Runnable callback)
    {
        if (executor == null)
        {
            executor = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder().setNameFormat("harness-timeout-%d")
                                                                                     .setDaemon(true)
                                                                                     .build());
            executor.setRemoveOnCancelPolicy(true);
        }

        ScheduledFuture<?> future = executor.schedule(callback, delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    public synchronized void close()
    {
        if (executor != null)
        {
            executor.shutdownNow();
            executor = null;
        }
    }
}
