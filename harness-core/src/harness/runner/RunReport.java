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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import harness.model.TestSuite;

/**
 * Outcome of {@link RunOrchestrator#execute}: counters, failures and the exit code.
 */
public class RunReport
{
    public static class SuiteResult
    {
        public final TestSuite suite;
        public final Counters counters = new Counters();

        SuiteResult(TestSuite suite)
        {
            this.suite = suite;
        }
    }

    private final List<SuiteResult> suites = new ArrayList<>();
    private final List<FailureRecord> failures = new ArrayList<>();
    private final Counters total = new Counters();

    private String runSeed;
    private FilterSelection selection = FilterSelection.ALL;
    private int exitCode;

    SuiteResult startSuite(TestSuite suite)
    {
        SuiteResult result = new SuiteResult(suite);
        suites.add(result);
        return result;
    }

    void addFailure(FailureRecord failure)
    {
        failures.add(failure);
    }

    void setRunSeed(String runSeed)
    {
        this.runSeed = runSeed;
    }

    void setSelection(FilterSelection selection)
    {
        this.selection = selection;
    }

    RunReport withExitCode(int exitCode)
    {
        this.exitCode = exitCode;
        return this;
    }

    /**
     * {@code null} if the run ended before a seed was resolved.
     */
    public String runSeed()
    {
        return runSeed;
    }

    public FilterSelection selection()
    {
        return selection;
    }

    /**
     * Results of the suites that were executed, in execution order. Suites excluded by the filter are absent.
     */
    public List<SuiteResult> suites()
    {
        return Collections.unmodifiableList(suites);
    }

    public Counters total()
    {
        return total;
    }

    /**
     * One record per failed execution, in the order they happened.
     */
    public List<FailureRecord> failures()
    {
        return Collections.unmodifiableList(failures);
    }

    public int exitCode()
    {
        return exitCode;
    }
}
