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

import java.util.List;
import java.util.Locale;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import harness.core.Configuration;
import harness.core.ExitCode;
import harness.core.LogFormat;
import harness.core.Run;
import harness.model.TestCase;
import harness.model.TestResult;
import harness.model.TestSuite;
import harness.seed.ExecKeyDeriver;
import harness.seed.SeedGenerator;

/**
 * Runs a list of test suites and reports the outcome as a process exit code.
 *
 * A run resolves its seed (or generates one), resolves the name filter, then walks suites, cases and
 * iterations strictly in order. Every execution gets its own execution key, derived from the run seed, the
 * suite and case names and the iteration number, unless a fixed key is forced for all of them. The same seed
 * and filter therefore replay exactly the same executions, which is what the reproduction lines printed at
 * the end of a failing run rely on.
 *
 * Exit codes are listed in {@link ExitCode}.
 */
public class RunOrchestrator
{
    private static final Logger logger = LoggerFactory.getLogger(RunOrchestrator.class);

    private final Run run;
    private final CaseExecutor executor;

    public RunOrchestrator(Run run)
    {
        this.run = run;
        this.executor = new CaseExecutor(run);
    }

    public int runSuites(List<TestSuite> suites, String runSeed, long execKey, String filter, int iterations)
    {
        return execute(suites, runSeed, execKey, filter, iterations).exitCode();
    }

    /**
     * Runs with the seed, key, filter and iteration count of the run configuration.
     */
    public RunReport execute(List<TestSuite> suites)
    {
        Configuration config = run.snapshot;
        return execute(suites, config.seed, config.exec_key, config.filter, config.iterations);
    }

    /**
     * Closes the timer of the run before returning.
     *
     * @param userRunSeed seed to use, or {@code null}/empty to generate one
     * @param userExecKey key to use for every execution, or {@link ExecKeyDeriver#NO_KEY} to derive them
     * @param filter      suite or case name to run, or {@code null}/empty to run everything
     * @param iterations  number of times every case runs; values below 1 are treated as 1
     */
    public RunReport execute(List<TestSuite> suites, String userRunSeed, long userExecKey, String filter, int iterations)
    {
        try
        {
            return executeRun(suites, userRunSeed, userExecKey, filter, iterations);
        }
        finally
        {
            run.timer.close();
        }
    }

    private RunReport executeRun(List<TestSuite> suites, String userRunSeed, long userExecKey, String filter, int iterations)
    {
        LogFormat format = run.format;
        RunReport report = new RunReport();
        iterations = Math.max(1, iterations);

        String runSeed = userRunSeed;
        if (Strings.isNullOrEmpty(runSeed))
        {
            try
            {
                runSeed = new SeedGenerator(run.clock).generate(SeedGenerator.DEFAULT_LENGTH);
            }
            catch (RuntimeException e)
            {
                logger.error("Generating a random seed failed", e);
                return report.withExitCode(ExitCode.SETUP_FAILURE);
            }
        }
        report.setRunSeed(runSeed);

        double runStart = run.clock.seconds();
        logger.info("::::: Test Run /w seed '{}' started", runSeed);

        if (countTests(suites) == 0)
        {
            logger.error("No tests to run?");
            return report.withExitCode(ExitCode.NO_TESTS);
        }

        FilterSelection selection = FilterSelection.resolve(suites, filter);
        report.setSelection(selection);
        if (!selection.matched())
        {
            logger.error("Filter '{}' did not match any test suite/case.", filter);
            listSuites(suites);
            logger.info("Exit code: {}", ExitCode.SETUP_FAILURE);
            return report.withExitCode(ExitCode.SETUP_FAILURE);
        }

        if (selection.kind == FilterSelection.Kind.SUITE)
            logger.info("Filtering: running only suite '{}'", selection.suite.name());
        else if (selection.kind == FilterSelection.Kind.CASE)
            logger.info("Filtering: running only test '{}' in suite '{}'", selection.testCase.name(), selection.suite.name());

        int suiteCounter = 0;
        for (TestSuite suite : suites)
        {
            suiteCounter++;
            if (!selection.includes(suite))
            {
                logger.info("===== Test Suite {}: '{}' {}", suiteCounter, suite.name(), format.blue("skipped"));
                continue;
            }

            runSuite(suite, suiteCounter, runSeed, userExecKey, iterations, selection, report);
        }

        logger.info("Total Run runtime: {} sec", seconds("%.1f", run.clock.elapsedSince(runStart)));

        Counters total = report.total();
        int runResult;
        if (total.failed() == 0)
        {
            runResult = ExitCode.PASSED;
            logger.info(format.summary("Run", total.total(), total.passed(), total.failed(), total.skipped()));
            logger.info(format.finalResult("Run /w seed", runSeed, format.green("Passed")));
        }
        else
        {
            runResult = ExitCode.FAILED;
            logger.error(format.summary("Run", total.total(), total.passed(), total.failed(), total.skipped()));
            logger.error(format.finalResult("Run /w seed", runSeed, format.red("Failed")));
        }

        if (!report.failures().isEmpty())
        {
            logger.info("Harness input to repro failures:");
            for (FailureRecord failure : report.failures())
                logger.info(format.reproduction(failure.runSeed, failure.testCase.name()));
        }

        logger.info("Exit code: {}", runResult);
        return report.withExitCode(runResult);
    }

    private void runSuite(TestSuite suite,
                          int suiteCounter,
                          String runSeed,
                          long userExecKey,
                          int iterations,
                          FilterSelection selection,
                          RunReport report)
    {
        LogFormat format = run.format;
        Counters counters = report.startSuite(suite).counters;
        double suiteStart = run.clock.seconds();
        logger.info("===== Test Suite {}: '{}' started", suiteCounter, suite.name());

        int testCounter = 0;
        for (TestCase testCase : suite.cases())
        {
            testCounter++;
            if (!selection.includes(testCase))
            {
                logger.info("===== Test Case {}.{}: '{}' {}", suiteCounter, testCounter, testCase.name(), format.blue("skipped"));
                continue;
            }

            boolean forceRun = selection.forceRun();
            if (forceRun && !testCase.enabled())
                logger.info("Force run of disabled test since test filter was set");

            double testStart = run.clock.seconds();
            logger.info(format.yellow(String.format("----- Test Case %d.%d: '%s' started", suiteCounter, testCounter, testCase.name())));
            if (!testCase.description().isEmpty())
                logger.info("Test Description: '{}'", testCase.description());

            TestResult testResult = null;
            for (int iteration = 1; iteration <= iterations; iteration++)
            {
                long execKey = userExecKey != ExecKeyDeriver.NO_KEY
                               ? userExecKey
                               : ExecKeyDeriver.derive(runSeed, suite.name(), testCase.name(), iteration);

                logger.info("Test Iteration {}: execKey {}", iteration, Long.toUnsignedString(execKey));
                testResult = executor.execute(suite, testCase, execKey, forceRun);

                counters.record(testResult);
                report.total().record(testResult);
                if (testResult.isFailure())
                    report.addFailure(new FailureRecord(testCase, runSeed));
            }

            double runtime = run.clock.elapsedSince(testStart);
            if (iterations > 1)
            {
                logger.info("Runtime of {} iterations: {} sec", iterations, seconds("%.1f", runtime));
                logger.info("Average Test runtime: {} sec", seconds("%.5f", runtime / iterations));
            }
            else
            {
                logger.info("Total Test runtime: {} sec", seconds("%.1f", runtime));
            }

            // result of the last iteration; skips were already reported by the executor
            switch (testResult)
            {
                case PASSED:
                    logger.info(format.finalResult("Test", testCase.name(), format.green("Passed")));
                    break;
                case FAILED:
                case SETUP_FAILURE:
                    logger.error(format.finalResult("Test", testCase.name(), format.red("Failed")));
                    break;
                case NO_ASSERT:
                    logger.error(format.finalResult("Test", testCase.name(), format.blue("No Asserts")));
                    break;
                default:
                    break;
            }
        }

        logger.info("Total Suite runtime: {} sec", seconds("%.1f", run.clock.elapsedSince(suiteStart)));

        if (counters.failed() == 0)
        {
            logger.info(format.summary("Suite", counters.total(), counters.passed(), counters.failed(), counters.skipped()));
            logger.info(format.finalResult("Suite", suite.name(), format.green("Passed")));
        }
        else
        {
            logger.error(format.summary("Suite", counters.total(), counters.passed(), counters.failed(), counters.skipped()));
            logger.error(format.finalResult("Suite", suite.name(), format.red("Failed")));
        }
    }

    /**
     * Logs every suite and its cases, marking disabled ones.
     */
    public void listSuites(List<TestSuite> suites)
    {
        for (TestSuite suite : suites)
        {
            logger.info("Test suite: {}", suite.name());
            for (TestCase testCase : suite.cases())
                logger.info("      test: {}{}", testCase.name(), testCase.enabled() ? "" : " (disabled)");
        }
    }

    static int countTests(List<TestSuite> suites)
    {
        int total = 0;
        for (TestSuite suite : suites)
            total += suite.cases().size();
        return total;
    }

    private static String seconds(String pattern, double seconds)
    {
        return String.format(Locale.ROOT, pattern, seconds);
    }
}
