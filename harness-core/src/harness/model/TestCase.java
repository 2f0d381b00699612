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

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A single named test. Disabled cases are only executed when explicitly selected with a filter.
 */
public final class TestCase
{
    @FunctionalInterface
    public interface Body
    {
        CaseOutcome run(CaseContext context) throws Exception;
    }

    private final String name;
    private final String description;
    private final boolean enabled;
    private final Body body;

    public TestCase(String name, String description, boolean enabled, Body body)
    {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Test case name should not be empty");
        this.name = name;
        this.description = Strings.nullToEmpty(description);
        this.enabled = enabled;
        this.body = Objects.requireNonNull(body, "Test case body should not be null");
    }

    public static TestCase of(String name, String description, Body body)
    {
        return new TestCase(name, description, true, body);
    }

    public static TestCase disabled(String name, String description, Body body)
    {
        return new TestCase(name, description, false, body);
    }

    public String name()
    {
        return name;
    }

    /**
     * Empty string when the case has no description.
     */
    public String description()
    {
        return description;
    }

    public boolean enabled()
    {
        return enabled;
    }

    public Body body()
    {
        return body;
    }

    public String toString()
    {
        return enabled ? name : name + " (disabled)";
    }
}
