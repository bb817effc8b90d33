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

package com.xilinx.rapidsdf.sdf;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import com.xilinx.rapidsdf.util.ParallelismTools;
import com.xilinx.rapidsdf.util.StringPool;

/**
 * Convenience entry points for reading and parsing SDF files.
 */
public class SDFTools {

    /**
     * Parses an SDF document held in memory.
     * @param text The complete document
     * @return The parsed delay file
     * @throws SDFParseException if the document is malformed or uses an unsupported construct
     */
    public static SDFDelayFile parseSDF(String text) {
        return new SDFParser(text).parseSDF();
    }

    /**
     * Reads a whole file as UTF-8 text.
     * @param fileName Path to the SDF file
     * @return The file contents
     */
    public static String readSDFFile(Path fileName) {
        try {
            return new String(Files.readAllBytes(fileName), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
    }

    public static String readSDFFile(String fileName) {
        return readSDFFile(Paths.get(fileName));
    }

    /**
     * Reads and parses an SDF file.
     * @param fileName Path to the SDF file
     * @return The parsed delay file
     */
    public static SDFDelayFile loadSDF(Path fileName) {
        return parseSDF(readSDFFile(fileName));
    }

    /**
     * Parses several SDF files, concurrently if {@link ParallelismTools#getParallel()}
     * allows it. Each file gets its own parser and string pool.
     * @param fileNames Files to parse
     * @return The parsed delay files, in the same order as fileNames
     * @throws SDFParseException from the first file (in list order) that fails to parse
     */
    public static List<SDFDelayFile> parseSDFFiles(List<Path> fileNames) {
        List<Callable<SDFDelayFile>> tasks = new ArrayList<>(fileNames.size());
        for (Path fileName : fileNames) {
            tasks.add(() -> new SDFParser(readSDFFile(fileName), StringPool.defaultParserPool()).parseSDF());
        }
        List<SDFDelayFile> results = new ArrayList<>(fileNames.size());
        for (Future<SDFDelayFile> future : ParallelismTools.invokeAll(tasks)) {
            results.add(ParallelismTools.get(future));
        }
        return results;
    }
}
