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

import harness.model.TestResult;

/**
 * Passed / failed / skipped tallies of either a suite or a whole run.
 */
public class Counters
{
    private int passed;
    private int failed;
    private int skipped;

    /**
     * Anything that is neither passed nor skipped counts as failed.
     */
    public void record(TestResult result)
    {
        switch (result)
        {
            case PASSED:
                passed++;
                break;
            case SKIPPED:
                skipped++;
                break;
            default:
                failed++;
        }
    }

    public int passed()
    {
        return passed;
    }

    public int failed()
    {
        return failed;
    }

    public int skipped()
    {
        return skipped;
    }

    public int total()
    {
        return passed + failed + skipped;
    }

    public String toString()
    {
        return String.format("Counters{total=%d, passed=%d, failed=%d, skipped=%d}", total(), passed, failed, skipped);
    }
}
