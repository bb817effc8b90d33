/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSDF.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidsdf.tests;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.xilinx.rapidsdf.util.MessageGenerator;

/**
 * Simple tool for measuring the runtime and heap growth of named code segments
 * (reading, parsing, reporting) and printing a summary.
 */
public class CodePerfTracker {

    private final String name;

    private final List<String> segmentNames = new ArrayList<>();

    private final List<Long> runtimes = new ArrayList<>();

    private final List<Long> memUsages = new ArrayList<>();

    private final Runtime rt = Runtime.getRuntime();

    private final PrintStream out;

    private boolean printProgress;

    private int maxSegmentNameSize = 24;

    public static final CodePerfTracker SILENT = new CodePerfTracker(null, false, null);

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this(name, printProgress, System.out);
    }

    public CodePerfTracker(String name, boolean printProgress, PrintStream out) {
        this.name = name;
        this.printProgress = printProgress;
        this.out = out;
        if (printProgress && out != null && name != null) {
            out.println(MessageGenerator.makeHeader(name));
        }
    }

    private boolean isSilent() {
        return this == SILENT || out == null;
    }

    public CodePerfTracker start(String segmentName) {
        if (isSilent()) return this;
        segmentNames.add(segmentName);
        memUsages.add(rt.totalMemory() - rt.freeMemory());
        runtimes.add(System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        if (isSilent()) return this;
        int idx = runtimes.size()-1;
        if (idx < 0) {
            throw new IllegalStateException("stop() called without a matching start()");
        }
        long end = System.nanoTime();
        long currUsage = rt.totalMemory() - rt.freeMemory();
        runtimes.set(idx, end - runtimes.get(idx));
        memUsages.set(idx, currUsage - memUsages.get(idx));
        if (printProgress) {
            print(segmentNames.get(idx), runtimes.get(idx), memUsages.get(idx));
        }
        return this;
    }

    /**
     * @param segmentName Name given to {@link #start(String)}
     * @return Runtime of the finished segment in nanoseconds, or null if there is no such segment
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    public int getSegmentCount() {
        return segmentNames.size();
    }

    private void print(String segmentName, long runtime, long memUsage) {
        out.printf("%" + maxSegmentNameSize + "s: %9.3fs %10.3fMBs%n",
                segmentName, runtime / 1000000000.0, memUsage / (1024.0 * 1024.0));
    }

    public void printSummary() {
        if (isSilent()) return;
        if (!printProgress) {
            for (String segmentName : segmentNames) {
                maxSegmentNameSize = Math.max(maxSegmentNameSize, segmentName.length());
            }
            if (name != null) out.println(MessageGenerator.makeHeader(name));
            for (int i=0; i < segmentNames.size(); i++) {
                print(segmentNames.get(i), runtimes.get(i), memUsages.get(i));
            }
        }
        long totalRuntime = 0L;
        long totalUsage = 0L;
        for (int i=0; i < runtimes.size(); i++) {
            totalRuntime += runtimes.get(i);
            totalUsage += memUsages.get(i);
        }
        out.println("------------------------------------------------------------------------------");
        print("*Total*", totalRuntime, totalUsage);
    }
}
