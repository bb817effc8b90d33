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

package com.xilinx.rapidsdf.util;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidsdf.sdf.SDFCell;
import com.xilinx.rapidsdf.sdf.SDFDelayDef;
import com.xilinx.rapidsdf.sdf.SDFDelayFile;
import com.xilinx.rapidsdf.sdf.SDFHeader;
import com.xilinx.rapidsdf.sdf.SDFParseException;
import com.xilinx.rapidsdf.sdf.SDFTimingCheck;
import com.xilinx.rapidsdf.sdf.SDFTimingCheckType;
import com.xilinx.rapidsdf.sdf.SDFTools;
import com.xilinx.rapidsdf.tests.CodePerfTracker;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * CLI tool that parses one or more SDF files and reports a summary of each:
 * header identification, number of cells and number of delays and timing
 * checks by kind.
 */
public final class SDFStatistics {

    private static final String INPUT_OPT = "i";
    private static final String HELP_OPT = "h";
    private static final String DESC_INPUT = "Input SDF file (may be repeated)";

    private final int cellCount;
    private final int wildcardCellCount;
    private final Map<SDFDelayDef.Type, Integer> delayCounts;
    private final Map<SDFTimingCheckType, Integer> checkCounts;

    private SDFStatistics(int cellCount, int wildcardCellCount, Map<SDFDelayDef.Type, Integer> delayCounts,
                          Map<SDFTimingCheckType, Integer> checkCounts) {
        this.cellCount = cellCount;
        this.wildcardCellCount = wildcardCellCount;
        this.delayCounts = Collections.unmodifiableMap(delayCounts);
        this.checkCounts = Collections.unmodifiableMap(checkCounts);
    }

    /**
     * Tallies the contents of a parsed delay file.
     * @param delayFile The parsed file
     * @return Counts of cells, delays and timing checks
     */
    public static SDFStatistics compute(SDFDelayFile delayFile) {
        int wildcards = 0;
        Map<SDFDelayDef.Type, Integer> delays = new EnumMap<>(SDFDelayDef.Type.class);
        Map<SDFTimingCheckType, Integer> checks = new EnumMap<>(SDFTimingCheckType.class);
        for (SDFCell cell : delayFile.getCells()) {
            if (cell.isWildcard()) {
                wildcards++;
            }
            for (SDFDelayDef d : cell.getDelayDefs()) {
                delays.merge(d.getType(), 1, Integer::sum);
            }
            for (SDFTimingCheck c : cell.getTimingChecks()) {
                checks.merge(c.getType(), 1, Integer::sum);
            }
        }
        return new SDFStatistics(delayFile.getCells().size(), wildcards, delays, checks);
    }

    public int getCellCount() {
        return cellCount;
    }

    public int getWildcardCellCount() {
        return wildcardCellCount;
    }

    /**
     * @param type Kind of delay definition
     * @return How many definitions of that kind the file holds
     */
    public int getDelayCount(SDFDelayDef.Type type) {
        return delayCounts.getOrDefault(type, 0);
    }

    public int getDelayCount() {
        int total = 0;
        for (int count : delayCounts.values()) {
            total += count;
        }
        return total;
    }

    public int getTimingCheckCount(SDFTimingCheckType type) {
        return checkCounts.getOrDefault(type, 0);
    }

    public int getTimingCheckCount() {
        int total = 0;
        for (int count : checkCounts.values()) {
            total += count;
        }
        return total;
    }

    /**
     * Prints the report for one file.
     * @param fileName Name shown in the report
     * @param header Header of the parsed file
     * @param out Destination
     */
    public void printReport(String fileName, SDFHeader header, PrintStream out) {
        out.println("-----------------------------------------------------------");
        out.println("SDF Statistics");
        out.println("Input     : " + fileName);
        out.println("-----------------------------------------------------------");
        out.println("VERSION " + header.getSDFVersion());
        out.println("DESIGN " + header.getDesignName() + ", CREATED BY " + header.getVendor() + " "
                + header.getProgram() + " " + header.getProgramVersion());
        out.println("TIMESCALE " + header.getTimescaleInSeconds() + "s");
        out.printf("# Cells  = %,d (%,d wildcard)%n", cellCount, wildcardCellCount);
        out.printf("# Delays = %,d%n", getDelayCount());
        for (Map.Entry<SDFDelayDef.Type, Integer> e : delayCounts.entrySet()) {
            out.printf("    %-16s %,d%n", e.getKey(), e.getValue());
        }
        out.printf("# Checks = %,d%n", getTimingCheckCount());
        for (Map.Entry<SDFTimingCheckType, Integer> e : checkCounts.entrySet()) {
            out.printf("    %-16s %,d%n", e.getKey(), e.getValue());
        }
    }

    private static OptionParser createOptionParser() {
        OptionParser optParser = new OptionParser();

        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs(DESC_INPUT);

        optParser.acceptsAll(Arrays.asList(HELP_OPT, "help", "?"), "Print Help")
                .forHelp();

        return optParser;
    }

    private static void printHelp(OptionParser optParser) {
        MessageGenerator.printHeader("SDFStatistics");
        System.out.println("Summarize the contents of SDF files.\n");
        try {
            optParser.printHelpOn(System.out);
        } catch (IOException ioException) {
            ioException.printStackTrace();
        }
    }

    /**
     * Parses every input, reporting the first failure as a single ERROR line.
     * @param inputs SDF files to parse
     * @param err Destination of the error line
     * @return The parsed files in input order, or null if any could not be read or parsed
     */
    static List<SDFDelayFile> parseInputs(List<Path> inputs, PrintStream err) {
        try {
            return SDFTools.parseSDFFiles(inputs);
        } catch (SDFParseException e) {
            err.println("ERROR: " + e.getKind() + ": " + e.getMessage());
        } catch (UncheckedIOException e) {
            // message already carries the ERROR prefix
            err.println(e.getMessage());
        }
        return null;
    }

    public static void main(String[] args) {
        OptionParser optParser = createOptionParser();
        OptionSet opts;

        try {
            opts = optParser.parse(args);
        } catch (Exception parseException) {
            System.err.println("ERROR: " + parseException.getMessage());
            printHelp(optParser);
            return;
        }

        if (opts.has(HELP_OPT)) {
            printHelp(optParser);
            return;
        }

        List<Path> inputs = new ArrayList<>();
        for (Object input : opts.valuesOf(INPUT_OPT)) {
            inputs.add(Paths.get((String) input));
        }

        CodePerfTracker t = new CodePerfTracker("SDFStatistics", false);
        t.start("Parse " + inputs.size() + " file(s)");
        List<SDFDelayFile> delayFiles = parseInputs(inputs, System.err);
        if (delayFiles == null) {
            System.exit(1);
            return;
        }
        t.stop();

        for (int i = 0; i < inputs.size(); i++) {
            SDFDelayFile delayFile = delayFiles.get(i);
            compute(delayFile).printReport(inputs.get(i).toString(), delayFile.getHeader(), System.out);
        }
        t.printSummary();
    }
}
