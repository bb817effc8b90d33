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

import java.util.Objects;

/**
 * The header of an SDF file. Only the version and the hierarchy divider are
 * mandatory; every other getter returns null when its entry was absent.
 */
public final class SDFHeader {

    /** Timescale assumed when the header has no TIMESCALE entry */
    public static final double DEFAULT_TIMESCALE_SECONDS = 1e-9;

    private final String sdfVersion;
    private final String designName;
    private final String date;
    private final String vendor;
    private final String program;
    private final String programVersion;
    private final char divider;
    private final SDFValue voltage;
    private final String process;
    private final SDFValue temperature;
    private final SDFTimescale timescale;

    public SDFHeader(String sdfVersion, String designName, String date, String vendor, String program,
                     String programVersion, char divider, SDFValue voltage, String process,
                     SDFValue temperature, SDFTimescale timescale) {
        if (divider != '.' && divider != '/') {
            throw new IllegalArgumentException("Hierarchy divider must be '.' or '/', got '" + divider + "'");
        }
        this.sdfVersion = Objects.requireNonNull(sdfVersion);
        this.designName = designName;
        this.date = date;
        this.vendor = vendor;
        this.program = program;
        this.programVersion = programVersion;
        this.divider = divider;
        this.voltage = voltage;
        this.process = process;
        this.temperature = temperature;
        this.timescale = timescale;
    }

    public String getSDFVersion() {
        return sdfVersion;
    }

    public String getDesignName() {
        return designName;
    }

    public String getDate() {
        return date;
    }

    public String getVendor() {
        return vendor;
    }

    public String getProgram() {
        return program;
    }

    public String getProgramVersion() {
        return programVersion;
    }

    /**
     * @return The hierarchy divider, '.' or '/', used by every path in the file
     */
    public char getDivider() {
        return divider;
    }

    public SDFValue getVoltage() {
        return voltage;
    }

    public String getProcess() {
        return process;
    }

    public SDFValue getTemperature() {
        return temperature;
    }

    public SDFTimescale getTimescale() {
        return timescale;
    }

    /**
     * @return The timescale in seconds, 1ns if the header does not give one
     */
    public double getTimescaleInSeconds() {
        return timescale == null ? DEFAULT_TIMESCALE_SECONDS : timescale.getSeconds();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFHeader h = (SDFHeader) o;
        return divider == h.divider && sdfVersion.equals(h.sdfVersion)
                && Objects.equals(designName, h.designName) && Objects.equals(date, h.date)
                && Objects.equals(vendor, h.vendor) && Objects.equals(program, h.program)
                && Objects.equals(programVersion, h.programVersion) && Objects.equals(voltage, h.voltage)
                && Objects.equals(process, h.process) && Objects.equals(temperature, h.temperature)
                && Objects.equals(timescale, h.timescale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sdfVersion, designName, date, vendor, program, programVersion, divider, voltage,
                process, temperature, timescale);
    }

    @Override
    public String toString() {
        return "SDFHeader{version=" + sdfVersion + ", design=" + designName + ", date=" + date
                + ", vendor=" + vendor + ", program=" + program + ", programVersion=" + programVersion
                + ", divider=" + divider + ", voltage=" + voltage + ", process=" + process
                + ", temperature=" + temperature + ", timescale=" + timescale + "}";
    }
}
