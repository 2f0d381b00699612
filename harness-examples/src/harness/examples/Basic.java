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

package harness.examples;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import harness.generators.Fuzzer;
import harness.model.CaseOutcome;
import harness.model.TestSuite;
import harness.runner.HarnessRunner;

/**
 * A small set of suites showing what the harness can do. Try:
 *
 * <pre>
 *   Basic --list
 *   Basic --iterations 10
 *   Basic --filter exhaustiveRange
 *   Basic --seed &lt;seed of a previous run&gt; --filter joinSplit
 * </pre>
 */
public class Basic extends HarnessRunner
{
    public static final TestSuite FUZZER = TestSuite.builder("Fuzzer")
                                                    .setSetUp(ctx -> ctx.asserts().check(ctx.fuzzer().invocationCount() == 0,
                                                                                         "Fuzzer is freshly seeded"))
                                                    .addCase("asciiString", "Random strings are printable ASCII", ctx -> {
                                                        int length = ctx.fuzzer().randomIntegerInRange(0, 64);
                                                        String s = ctx.fuzzer().randomAsciiString(length);
                                                        ctx.asserts().check(s.length() == length, "Length is %d", length);
                                                        ctx.asserts().check(s.chars().allMatch(c -> c >= 32 && c <= 126), "Only printable characters");
                                                        return CaseOutcome.COMPLETED;
                                                    })
                                                    .addCase("integerRange", "Bounds are inclusive and may be given in either order", ctx -> {
                                                        Fuzzer fuzzer = ctx.fuzzer();
                                                        for (int i = 0; i < 100; i++)
                                                        {
                                                            int v = fuzzer.randomIntegerInRange(10, -10);
                                                            if (!ctx.asserts().check(v >= -10 && v <= 10, "%d in [-10, 10]", v))
                                                                return CaseOutcome.COMPLETED;
                                                        }
                                                        return CaseOutcome.COMPLETED;
                                                    })
                                                    .addCase("oddKeysOnly", "Only meaningful for odd execution keys", ctx -> {
                                                        if ((ctx.execKey() & 1) == 0)
                                                            return CaseOutcome.SKIPPED;
                                                        ctx.asserts().check((ctx.execKey() & 1) == 1, "Execution key is odd");
                                                        return CaseOutcome.COMPLETED;
                                                    })
                                                    .addDisabledCase("exhaustiveRange", "Slow; run it with --filter exhaustiveRange", ctx -> {
                                                        boolean[] seen = new boolean[256];
                                                        for (int i = 0; i < 100_000; i++)
                                                            seen[ctx.fuzzer().randomIntegerInRange(0, 255)] = true;
                                                        for (int i = 0; i < seen.length; i++)
                                                            ctx.asserts().check(seen[i], "Value %d was generated", i);
                                                        return CaseOutcome.COMPLETED;
                                                    })
                                                    .build();

    public static final TestSuite STRINGS = TestSuite.builder("Strings")
                                                     .addCase("joinSplit", "Joining and splitting random words is lossless", ctx -> {
                                                         List<String> words = new ArrayList<>();
                                                         int count = ctx.fuzzer().randomIntegerInRange(1, 20);
                                                         for (int i = 0; i < count; i++)
                                                             words.add(ctx.fuzzer().randomAsciiString(ctx.fuzzer().randomIntegerInRange(0, 10)).replace(',', '_'));

                                                         String joined = Joiner.on(',').join(words);
                                                         List<String> split = Splitter.on(',').splitToList(joined);
                                                         ctx.asserts().check(split.equals(words), "'%s' splits back into %d words", joined, count);
                                                         return CaseOutcome.COMPLETED;
                                                     })
                                                     .addCase("trimmedWords", null, ctx -> {
                                                         String word = ctx.fuzzer().randomAsciiString(8);
                                                         String padded = "  " + word + "  ";
                                                         ctx.asserts().check(padded.trim().equals(word.trim()), "Trimming '%s'", padded);
                                                         return CaseOutcome.COMPLETED;
                                                     })
                                                     .build();

    public static final List<TestSuite> SUITES = ImmutableList.of(FUZZER, STRINGS);

    protected List<TestSuite> suites()
    {
        return SUITES;
    }

    public static void main(String... args)
    {
        new Basic().run(args);
    }
}
