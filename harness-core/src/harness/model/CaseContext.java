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

package harness.model;

import harness.assertions.AssertTracker;
import harness.generators.Fuzzer;

/**
 * What a test body or suite fixture gets to see of the execution it is part of.
 */
public final class CaseContext
{
    private final TestSuite suite;
    private final TestCase testCase;
    private final long execKey;
    private final AssertTracker asserts;
    private final Fuzzer fuzzer;

    public CaseContext(TestSuite suite, TestCase testCase, long execKey, AssertTracker asserts, Fuzzer fuzzer)
    {
        this.suite = suite;
        this.testCase = testCase;
        this.execKey = execKey;
        this.asserts = asserts;
        this.fuzzer = fuzzer;
    }

    public TestSuite suite()
    {
        return suite;
    }

    public TestCase testCase()
    {
        return testCase;
    }

    public long execKey()
    {
        return execKey;
    }

    public AssertTracker asserts()
    {
        return asserts;
    }

    public Fuzzer fuzzer()
    {
        return fuzzer;
    }
}
