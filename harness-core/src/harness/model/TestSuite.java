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

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Named, ordered group of test cases with optional per-case setup and teardown fixtures.
 *
 * Case order is execution order, and the 1-based position of a case is its display index.
 */
public final class TestSuite
{
    /**
     * Runs before (setup) or after (teardown) every execution of every case in the suite. Failures are
     * reported through {@link CaseContext#asserts()}.
     */
    @FunctionalInterface
    public interface Fixture
    {
        void run(CaseContext context) throws Exception;
    }

    private final String name;
    private final List<TestCase> cases;
    private final Fixture setUp;
    private final Fixture tearDown;

    private TestSuite(String name, List<TestCase> cases, Fixture setUp, Fixture tearDown)
    {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Test suite name should not be empty");
        this.name = name;
        this.cases = ImmutableList.copyOf(cases);
        this.setUp = setUp;
        this.tearDown = tearDown;
    }

    public static Builder builder(String name)
    {
        return new Builder(name);
    }

    public String name()
    {
        return name;
    }

    public List<TestCase> cases()
    {
        return cases;
    }

    /**
     * @return setup fixture, or {@code null} if the suite declares none
     */
    public Fixture setUp()
    {
        return setUp;
    }

    /**
     * @return teardown fixture, or {@code null} if the suite declares none
     */
    public Fixture tearDown()
    {
        return tearDown;
    }

    public String toString()
    {
        return name;
    }

    public static class Builder
    {
        private final String name;
        private final ImmutableList.Builder<TestCase> cases = ImmutableList.builder();
        private Fixture setUp;
        private Fixture tearDown;

        private Builder(String name)
        {
            this.name = name;
        }

        public Builder setSetUp(Fixture setUp)
        {
            this.setUp = setUp;
            return this;
        }

        public Builder setTearDown(Fixture tearDown)
        {
            this.tearDown = tearDown;
            return this;
        }

        public Builder addCase(TestCase testCase)
        {
            cases.add(Objects.requireNonNull(testCase, "Test case should not be null"));
            return this;
        }

        public Builder addCase(String name, String description, TestCase.Body body)
        {
            return addCase(TestCase.of(name, description, body));
        }

        public Builder addDisabledCase(String name, String description, TestCase.Body body)
        {
            return addCase(TestCase.disabled(name, description, body));
        }

        public TestSuite build()
        {
            return new TestSuite(name, cases.build(), setUp, tearDown);
        }
    }
}
