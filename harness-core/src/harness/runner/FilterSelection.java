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

import com.google.common.base.Strings;

import harness.model.TestCase;
import harness.model.TestSuite;

/**
 * Which suites and cases of a run are selected by a name filter.
 *
 * A filter is compared, ignoring case, with every suite name first. Only if no suite matches is it compared
 * with case names, in traversal order; the first matching case wins. Selecting a case also selects its suite
 * and forces the case to run even if it is disabled.
 */
public final class FilterSelection
{
    public enum Kind
    {
        ALL, SUITE, CASE, NO_MATCH
    }

    public static final FilterSelection ALL = new FilterSelection(Kind.ALL, null, null, null);

    public final Kind kind;
    public final String filter;
    public final TestSuite suite;
    public final TestCase testCase;

    private FilterSelection(Kind kind, String filter, TestSuite suite, TestCase testCase)
    {
        this.kind = kind;
        this.filter = filter;
        this.suite = suite;
        this.testCase = testCase;
    }

    public static FilterSelection resolve(List<TestSuite> suites, String filter)
    {
        if (Strings.isNullOrEmpty(filter))
            return ALL;

        for (TestSuite suite : suites)
        {
            if (filter.equalsIgnoreCase(suite.name()))
                return new FilterSelection(Kind.SUITE, filter, suite, null);
        }

        for (TestSuite suite : suites)
        {
            for (TestCase testCase : suite.cases())
            {
                if (filter.equalsIgnoreCase(testCase.name()))
                    return new FilterSelection(Kind.CASE, filter, suite, testCase);
            }
        }

        return new FilterSelection(Kind.NO_MATCH, filter, null, null);
    }

    public boolean matched()
    {
        return kind != Kind.NO_MATCH;
    }

    public boolean includes(TestSuite candidate)
    {
        switch (kind)
        {
            case ALL:
                return true;
            case SUITE:
            case CASE:
                return suite == candidate;
            default:
                return false;
        }
    }

    public boolean includes(TestCase candidate)
    {
        switch (kind)
        {
            case ALL:
            case SUITE:
                return true;
            case CASE:
                return testCase == candidate;
            default:
                return false;
        }
    }

    /**
     * Disabled cases run when they were picked out by name.
     */
    public boolean forceRun()
    {
        return kind == Kind.CASE;
    }

    public String toString()
    {
        switch (kind)
        {
            case SUITE:
                return "suite '" + suite.name() + '\'';
            case CASE:
                return "test '" + testCase.name() + "' in suite '" + suite.name() + '\'';
            default:
                return kind.name();
        }
    }
}
