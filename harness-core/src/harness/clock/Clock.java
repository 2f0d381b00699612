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

package harness.clock;

/**
 * High resolution monotonic clock used both for seeding and for measuring runtimes.
 */
public interface Clock
{
    Clock NANO = new Clock()
    {
        public long ticks()
        {
            return System.nanoTime();
        }

        public long ticksPerSecond()
        {
            return 1_000_000_000L;
        }
    };

    long ticks();

    long ticksPerSecond();

    default double seconds()
    {
        return ticks() / (double) ticksPerSecond();
    }

    /**
     * Seconds elapsed since {@code startSeconds}; never negative, measurement noise is clamped to zero.
     */
    default double elapsedSince(double startSeconds)
    {
        return Math.max(0.0, seconds() - startSeconds);
    }
}
