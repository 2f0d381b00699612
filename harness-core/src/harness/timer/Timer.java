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

/**
 * One-shot timer facility.
 */
public interface Timer extends AutoCloseable
{
    interface Handle
    {
        /**
         * Cancels the callback. Has no effect if it already ran or was already cancelled.
         */
        void cancel();
    }

    /**
     * Schedules {@code callback} to run once, on a timer thread, after {@code delayMillis}.
     *
     * @throws RuntimeException if the timer cannot be initialized or refuses the callback
     */
    Handle schedule(long delayMillis, Runnable callback);

    void close();
}
