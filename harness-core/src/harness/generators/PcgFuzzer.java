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

import com.google.common.base.Preconditions;

public class PcgFuzzer implements Fuzzer
{
    private static final long STREAM = 1;

    private final PcgRSUFast rng;
    private int invocations;

    public PcgFuzzer()
    {
        this.rng = new PcgRSUFast(0, STREAM);
    }

    public void init(long execKey)
    {
        rng.seed(execKey);
        invocations = 0;
    }

    public int invocationCount()
    {
        return invocations;
    }

    public long randomLong()
    {
        invocations++;
        return rng.next();
    }

    public int randomInt()
    {
        invocations++;
        return (int) rng.next();
    }

    public boolean randomBoolean()
    {
        invocations++;
        return rng.nextBoolean();
    }

    public double randomDouble()
    {
        invocations++;
        return rng.nextDouble();
    }

    public int randomIntegerInRange(int min, int max)
    {
        invocations++;
        // allow callers to pass the bounds in either order
        return min <= max ? rng.nextInt(min, max) : rng.nextInt(max, min);
    }

    public String randomAsciiString(int length)
    {
        Preconditions.checkArgument(length >= 0, "String length should not be negative, but was %s", length);
        invocations++;
        char[] chars = new char[length];
        for (int i = 0; i < length; i++)
            chars[i] = (char) rng.nextInt(32, 126);
        return new String(chars);
    }
}
