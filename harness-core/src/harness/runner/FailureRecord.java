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

package harness.runner;

import harness.model.TestCase;

/**
 * A failed execution, kept for the reproduction instructions printed at the end of the run.
 */
public final class FailureRecord
{
    public final TestCase testCase;
    public final String runSeed;

    public FailureRecord(TestCase testCase, String runSeed)
    {
        this.testCase = testCase;
        this.runSeed = runSeed;
    }

    /**
     * Command line arguments that re-run just this case with the same seed.
     */
    public String reproArguments()
    {
        return String.format("--seed %s --filter %s", runSeed, testCase.name());
    }

    public String toString()
    {
        return reproArguments();
    }
}
