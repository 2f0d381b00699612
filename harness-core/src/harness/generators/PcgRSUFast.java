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

package harness.generators;

/**
 * PCG generator with a 64 bit state and RXS M XS output permutation.
 *
 * Two generators created with the same seed and stream number produce the same sequence.
 */
public class PcgRSUFast implements RandomGenerator
{
    private static final long MULTIPLIER = 6364136223846793005L;

    private long state;

    /**
     * Stream number of the rng.
     */
    private final long stream;

    public PcgRSUFast(long seed, long streamNumber)
    {
        this.stream = (streamNumber << 1) | 1; // 2* + 1
        seed(seed);
    }

    public void seed(long seed)
    {
        state = xorshift64star(seed) + stream;
    }

    protected void nextStep()
    {
        state = state * MULTIPLIER + stream;
    }

    public long next()
    {
        nextStep();
        return shuffle(state);
    }

    static long shuffle(long state)
    {
        long word = ((state >>> ((state >>> 59) + 5)) ^ state) * 0xAEF17502108EF2D9L;
        return (word >>> 43) ^ word;
    }

    static long xorshift64star(long input)
    {
        input ^= input >> 12;
        input ^= input << 25;
        input ^= input >> 27;
        return input * 2685821657736338717L;
    }
}
