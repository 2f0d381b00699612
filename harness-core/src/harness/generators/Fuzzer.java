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
 * Randomized input source for test case bodies.
 *
 * Before every execution, the harness re-initializes the fuzzer with the execution key of that execution,
 * so the sequence of values a test body observes only depends on the run seed, suite name, case name and
 * iteration number.
 */
public interface Fuzzer
{
    /**
     * Re-seeds the fuzzer and resets its invocation counter.
     */
    void init(long execKey);

    /**
     * Number of values handed out since the last {@link #init(long)}.
     */
    int invocationCount();

    long randomLong();

    int randomInt();

    boolean randomBoolean();

    /**
     * Value in [0, 1).
     */
    double randomDouble();

    /**
     * Value in [min, max], both ends inclusive.
     */
    int randomIntegerInRange(int min, int max);

    /**
     * Printable ASCII string (characters 32 to 126) of the given length.
     */
    String randomAsciiString(int length);
}
