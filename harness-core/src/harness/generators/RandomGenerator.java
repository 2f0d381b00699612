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

public interface RandomGenerator
{
    long next();

    void seed(long seed);

    /**
     * Uniformly distributed value in [0, max).
     */
    default int nextInt(int max)
    {
        if (max <= 0)
            throw new IllegalArgumentException("Upper bound should be positive, but was " + max);
        return (int) Long.remainderUnsigned(next(), max);
    }

    /**
     * Uniformly distributed value in [min, max], both ends inclusive.
     */
    default int nextInt(int min, int max)
    {
        if (min > max)
            throw new IllegalArgumentException(String.format("Lower bound %d is greater than upper bound %d", min, max));
        long range = (long) max - min + 1;
        return (int) (min + Long.remainderUnsigned(next(), range));
    }

    default boolean nextBoolean()
    {
        return (next() & 1) == 1;
    }

    /**
     * Uniformly distributed value in [0, 1).
     */
    default double nextDouble()
    {
        return (next() >>> 11) * 0x1.0p-53;
    }
}
