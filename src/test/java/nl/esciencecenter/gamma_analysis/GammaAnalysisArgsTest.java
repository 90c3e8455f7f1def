/*
* Copyright 2015 Netherlands eScience Center, VU University Amsterdam, and Netherlands Forensic Institute
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance withSupplier the License.
* You may obtain a copy of the License at
*
* http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package nl.esciencecenter.gamma_analysis;

import com.beust.jcommander.ParameterException;
import org.junit.Test;

import static org.junit.Assert.*;

public class GammaAnalysisArgsTest {

    @Test
    public void defaults() {
        GammaAnalysisArgs args = GammaAnalysisArgs.parse();

        assertArrayEquals(new double[]{3.0}, args.getDoseCriteria(), 0.0);
        assertArrayEquals(new double[]{3.0}, args.getDistanceCriteria(), 0.0);
        assertEquals(0.0, args.threshold, 0.0);
        assertEquals(0.0, args.resolution, 0.0);
        assertFalse(args.local);
        assertEquals(1, args.threads);
    }

    @Test
    public void sweepArguments() {
        GammaAnalysisArgs args = GammaAnalysisArgs.parse(
                "--dose-criteria", "1,2.5,3",
                "--distance-criteria", "2",
                "--threshold", "10",
                "--local",
                "--resolution", "3",
                "--threads", "4");

        assertArrayEquals(new double[]{1.0, 2.5, 3.0}, args.getDoseCriteria(), 0.0);
        assertArrayEquals(new double[]{2.0}, args.getDistanceCriteria(), 0.0);
        assertEquals(10.0, args.threshold, 0.0);
        assertEquals(3.0, args.resolution, 0.0);
        assertTrue(args.local);
        assertEquals(4, args.threads);
    }

    @Test(expected = ParameterException.class)
    public void zeroThreads() {
        GammaAnalysisArgs.parse("--threads", "0");
    }

    @Test(expected = ParameterException.class)
    public void zeroDoseCriterion() {
        GammaAnalysisArgs.parse("--dose-criteria", "0");
    }

    @Test(expected = ParameterException.class)
    public void unknownOption() {
        GammaAnalysisArgs.parse("--dta", "3");
    }
}
