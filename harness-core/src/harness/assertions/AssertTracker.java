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

package harness.assertions;

import harness.model.TestResult;

/**
 * Records assertions made by test bodies and suite fixtures during one execution.
 *
 * Assertions do not throw: a failed check is recorded and the body keeps running. The harness resets the
 * tracker before every execution and asks it for a verdict once the body returns.
 */
public interface AssertTracker
{
    /**
     * Records the outcome of a check and returns the condition, so callers can bail out on failure.
     */
    boolean check(boolean condition, String format, Object... args);

    /**
     * Records an assertion that unconditionally passed.
     */
    default void pass(String format, Object... args)
    {
        check(true, format, args);
    }

    int passed();

    int failed();

    void reset();

    /**
     * {@link TestResult#FAILED} if any assertion failed, {@link TestResult#PASSED} if at least one passed,
     * {@link TestResult#NO_ASSERT} otherwise.
     */
    default TestResult summary()
    {
        if (failed() > 0)
            return TestResult.FAILED;
        if (passed() > 0)
            return TestResult.PASSED;
        return TestResult.NO_ASSERT;
    }

    void logSummary();
}
