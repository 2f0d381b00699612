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

import org.junit.Assert;
import org.junit.Test;

public class PcgRSUFastTest
{
    @Test
    public void knownSequence()
    {
        PcgRSUFast rng = new PcgRSUFast(0, 1);
        Assert.assertEquals(4621998813460412808L, rng.next());
        Assert.assertEquals(696912861044077356L, rng.next());
        Assert.assertEquals(-7771054616555506842L, rng.next());

        rng.seed(42);
        Assert.assertEquals(7108032998005633143L, rng.next());
        Assert.assertEquals(3784016177160216508L, rng.next());
        Assert.assertEquals(8725768181923870554L, rng.next());
    }

    @Test
    public void reseedingReplaysTheSequence()
    {
        PcgRSUFast rng = new PcgRSUFast(12345, 7);
        long[] first = new long[100];
        for (int i = 0; i < first.length; i++)
            first[i] = rng.next();

        rng.seed(12345);
        for (long expected : first)
            Assert.assertEquals(expected, rng.next());
    }

    @Test
    public void streamsDiverge()
    {
        PcgRSUFast a = new PcgRSUFast(12345, 1);
        PcgRSUFast b = new PcgRSUFast(12345, 2);
        int same = 0;
        for (int i = 0; i < 100; i++)
        {
            if (a.next() == b.next())
                same++;
        }
        Assert.assertEquals(0, same);
    }

    @Test
    public void boundedValues()
    {
        RandomGenerator rng = new PcgRSUFast(1, 1);
        boolean[] seen = new boolean[6];
        for (int i = 0; i < 10_000; i++)
        {
            int v = rng.nextInt(6);
            Assert.assertTrue(v >= 0 && v < 6);
            seen[v] = true;

            int ranged = rng.nextInt(-3, 3);
            Assert.assertTrue(ranged >= -3 && ranged <= 3);

            double d = rng.nextDouble();
            Assert.assertTrue(d >= 0.0 && d < 1.0);
        }
        for (boolean b : seen)
            Assert.assertTrue(b);
    }
}
