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

public class PcgFuzzerTest
{
    @Test
    public void sameKeySameValues()
    {
        PcgFuzzer a = new PcgFuzzer();
        PcgFuzzer b = new PcgFuzzer();
        a.init(0xCAFEL);
        b.init(0xCAFEL);

        Assert.assertEquals(a.randomLong(), b.randomLong());
        Assert.assertEquals(a.randomInt(), b.randomInt());
        Assert.assertEquals(a.randomBoolean(), b.randomBoolean());
        Assert.assertEquals(a.randomDouble(), b.randomDouble(), 0.0);
        Assert.assertEquals(a.randomIntegerInRange(1, 100), b.randomIntegerInRange(1, 100));
        Assert.assertEquals(a.randomAsciiString(32), b.randomAsciiString(32));
    }

    @Test
    public void initResetsSequenceAndCount()
    {
        PcgFuzzer fuzzer = new PcgFuzzer();
        fuzzer.init(7);
        long first = fuzzer.randomLong();
        fuzzer.randomInt();
        Assert.assertEquals(2, fuzzer.invocationCount());

        fuzzer.init(7);
        Assert.assertEquals(0, fuzzer.invocationCount());
        Assert.assertEquals(first, fuzzer.randomLong());
        Assert.assertEquals(1, fuzzer.invocationCount());
    }

    @Test
    public void rangesAcceptEitherOrder()
    {
        PcgFuzzer fuzzer = new PcgFuzzer();
        fuzzer.init(99);
        for (int i = 0; i < 1000; i++)
        {
            int v = fuzzer.randomIntegerInRange(10, -10);
            Assert.assertTrue(v >= -10 && v <= 10);
        }
        Assert.assertEquals(5, fuzzer.randomIntegerInRange(5, 5));
        fuzzer.randomIntegerInRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Test
    public void asciiStringsArePrintable()
    {
        PcgFuzzer fuzzer = new PcgFuzzer();
        fuzzer.init(3);
        String s = fuzzer.randomAsciiString(500);
        Assert.assertEquals(500, s.length());
        for (char c : s.toCharArray())
            Assert.assertTrue(c >= 32 && c <= 126);
        Assert.assertEquals("", fuzzer.randomAsciiString(0));
        Assert.assertEquals(2, fuzzer.invocationCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeStringLength()
    {
        new PcgFuzzer().randomAsciiString(-1);
    }
}
