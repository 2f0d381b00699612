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

package harness.seed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import harness.clock.Clock;
import harness.generators.PcgRSUFast;
import harness.generators.RandomGenerator;

/**
 * Generates human-shareable run seeds made of the characters 0-9 and A-Z.
 *
 * Seeds are not meant to be unpredictable: the generator is seeded from the clock. Only the execution keys
 * derived from a seed have to be reproducible, not the seed itself.
 */
public class SeedGenerator
{
    private static final Logger logger = LoggerFactory.getLogger(SeedGenerator.class);

    public static final int DEFAULT_LENGTH = 16;

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final long STREAM = 2;

    private final RandomGenerator rng;

    public SeedGenerator(Clock clock)
    {
        this(new PcgRSUFast(clock.ticks(), STREAM));
    }

    public SeedGenerator(RandomGenerator rng)
    {
        this.rng = rng;
    }

    public String generate()
    {
        return generate(DEFAULT_LENGTH);
    }

    public String generate(int length)
    {
        if (length <= 0)
        {
            logger.error("The length of the harness seed must be >0.");
            throw new IllegalArgumentException("Seed length should be positive, but was " + length);
        }

        StringBuilder seed = new StringBuilder(length);
        for (int i = 0; i < length; i++)
            seed.append(ALPHABET.charAt(rng.nextInt(ALPHABET.length())));
        return seed.toString();
    }
}
