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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import harness.assertions.AssertTracker;
import harness.core.LogFormat;
import harness.core.Run;
import harness.generators.Fuzzer;
import harness.model.CaseContext;
import harness.model.CaseOutcome;
import harness.model.TestCase;
import harness.model.TestResult;
import harness.model.TestSuite;
import harness.timer.TimeoutGuard;
import harness.timer.Timer;

/**
 * Executes one test case once, for one execution key.
 *
 * The steps are: seed the fuzzer and reset the assertion tracker, arm the timeout watchdog, run the suite
 * setup, run the body, run the suite teardown, disarm the watchdog, and classify the outcome. A failing setup
 * short-circuits to {@link TestResult#SETUP_FAILURE}: neither body nor teardown runs, but the watchdog is still
 * disarmed. Disabled cases are skipped before any of this happens unless the run is forced.
 */
public class CaseExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(CaseExecutor.class);

    private final Run run;
    private final TimeoutGuard timeoutGuard;
    private final Runnable bailOut;

    public CaseExecutor(Run run)
    {
        this.run = run;
        this.timeoutGuard = new TimeoutGuard(run.timer);
        this.bailOut = TimeoutGuard.bailOut(run.terminator);
    }

    public TestResult execute(TestSuite suite, TestCase testCase, long execKey, boolean forceRun)
    {
        LogFormat format = run.format;

        if (!testCase.enabled() && !forceRun)
        {
            logger.info(format.finalResult("Test", testCase.name(), format.blue("Skipped (Disabled)")));
            return TestResult.SKIPPED;
        }

        Fuzzer fuzzer = run.fuzzer;
        AssertTracker asserts = run.asserts;
        fuzzer.init(execKey);
        asserts.reset();
        CaseContext context = new CaseContext(suite, testCase, execKey, asserts, fuzzer);

        Timer.Handle timer = timeoutGuard.arm(run.snapshot.test_case_timeout_seconds, bailOut);

        if (suite.setUp() != null)
        {
            boolean completed = runFixture(suite.setUp(), context, "setup");
            if (!completed || asserts.summary() == TestResult.FAILED)
            {
                logger.error(format.finalResult("Suite Setup", suite.name(), format.red("Failed")));
                timeoutGuard.disarm(timer);
                return TestResult.SETUP_FAILURE;
            }
        }

        CaseOutcome outcome = runBody(testCase, context);
        TestResult result = classify(outcome, asserts);

        if (suite.tearDown() != null)
        {
            int failedBefore = asserts.failed();
            runFixture(suite.tearDown(), context, "teardown");
            if (asserts.failed() > failedBefore)
                logger.warn("Suite teardown '{}' recorded {} failed assertion(s); they do not affect the result of '{}'",
                            suite.name(), asserts.failed() - failedBefore, testCase.name());
        }

        timeoutGuard.disarm(timer);

        int fuzzerCount = fuzzer.invocationCount();
        if (fuzzerCount > 0)
            logger.info("Fuzzer invocations: {}", fuzzerCount);

        switch (outcome)
        {
            case SKIPPED:
                logger.info(format.finalResult("Test", testCase.name(), format.blue("Skipped (Programmatically)")));
                break;
            case STARTED:
                logger.error(format.finalResult("Test", testCase.name(), format.red("Failed (test started, but did not return TEST_COMPLETED)")));
                break;
            case ABORTED:
                logger.error(format.finalResult("Test", testCase.name(), format.red("Failed (Aborted)")));
                break;
            default:
                asserts.logSummary();
        }

        return result;
    }

    @VisibleForTesting
    static TestResult classify(CaseOutcome outcome, AssertTracker asserts)
    {
        switch (outcome)
        {
            case SKIPPED:
                return TestResult.SKIPPED;
            case STARTED:
            case ABORTED:
                // only an explicit completion counts; anything else is a failure regardless of assertions
                return TestResult.FAILED;
            default:
                return asserts.summary();
        }
    }

    private static CaseOutcome runBody(TestCase testCase, CaseContext context)
    {
        try
        {
            CaseOutcome outcome = testCase.body().run(context);
            return outcome == null ? CaseOutcome.STARTED : outcome;
        }
        catch (Throwable t)
        {
            Throwables.throwIfInstanceOf(t, OutOfMemoryError.class);
            if (t instanceof InterruptedException)
                Thread.currentThread().interrupt();
            logger.error("Test '{}' threw an exception", testCase.name(), t);
            return CaseOutcome.ABORTED;
        }
    }

    /**
     * @return false if the fixture threw
     */
    private static boolean runFixture(TestSuite.Fixture fixture, CaseContext context, String kind)
    {
        try
        {
            fixture.run(context);
            return true;
        }
        catch (Throwable t)
        {
            Throwables.throwIfInstanceOf(t, OutOfMemoryError.class);
            if (t instanceof InterruptedException)
                Thread.currentThread().interrupt();
            logger.warn("Suite {} of '{}' threw an exception", kind, context.suite().name(), t);
            return false;
        }
    }
}
