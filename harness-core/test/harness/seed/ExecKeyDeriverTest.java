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

import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

public class ExecKeyDeriverTest
{
    private static final String SEED = "ABCDEFGHIJKLMNOP";

    @Test
    public void knownKey()
    {
        Assert.assertEquals(5888782356521418543L, ExecKeyDeriver.derive(SEED, "Suite", "case", 1));
    }

    @Test
    public void derivationIsDeterministic()
    {
        Assert.assertEquals(ExecKeyDeriver.derive(SEED, "Suite", "case", 7),
                            ExecKeyDeriver.derive(SEED, "Suite", "case", 7));
    }

    @Test
    public void distinctInputsGiveDistinctKeys()
    {
        Set<Long> keys = new HashSet<>();
        int inputs = 0;
        for (String seed : new String[]{ SEED, "0123456789ABCDEF" })
        {
            for (String suite : new String[]{ "Network", "Storage", "Timer" })
            {
                for (String testCase : new String[]{ "open", "close", "read" })
                {
                    for (int iteration = 1; iteration <= 3; iteration++)
                    {
                        long key = ExecKeyDeriver.derive(seed, suite, testCase, iteration);
                        Assert.assertNotEquals(ExecKeyDeriver.NO_KEY, key);
                        keys.add(key);
                        inputs++;
                    }
                }
            }
        }
        Assert.assertEquals(54, inputs);
        Assert.assertEquals(inputs, keys.size());
    }

    @Test
    public void fieldsAreConcatenatedWithoutSeparators()
    {
        long key = ExecKeyDeriver.derive("AB", "C", "D", 1);
        Assert.assertEquals(-243498093221761226L, key);
        Assert.assertEquals(key, ExecKeyDeriver.derive("A", "BC", "D", 1));
    }

    @Test
    public void invalidArguments()
    {
        assertInvalid(null, "suite", "case", 1);
        assertInvalid("", "suite", "case", 1);
        assertInvalid(SEED, null, "case", 1);
        assertInvalid(SEED, "", "case", 1);
        assertInvalid(SEED, "suite", null, 1);
        assertInvalid(SEED, "suite", "", 1);
        assertInvalid(SEED, "suite", "case", 0);
        assertInvalid(SEED, "suite", "case", -1);
    }

    private static void assertInvalid(String seed, String suite, String testCase, int iteration)
    {
        Assert.assertEquals(String.format("(%s, %s, %s, %d)", seed, suite, testCase, iteration),
                            ExecKeyDeriver.NO_KEY,
                            ExecKeyDeriver.derive(seed, suite, testCase, iteration));
    }
}
