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
package nl.esciencecenter.gamma_analysis.kernels.gamma;

import nl.esciencecenter.gamma_analysis.Distribution;
import nl.esciencecenter.gamma_analysis.kernels.distance.DistanceKernel;
import org.junit.Test;

import static org.junit.Assert.*;

public class GammaEvaluationTest {

    private static Distribution ramp(int rows, int cols, double resolution) {
        double[][] data = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                data[i][j] = 1.0 + 0.1 * i + 0.05 * j;
            }
        }

        return new Distribution(data, resolution);
    }

    @Test
    public void integerResolutionScale() {
        assertEquals(1, GammaEvaluation.resolutionScale(1.0, 1.0));
        assertEquals(3, GammaEvaluation.resolutionScale(0.1, 0.3));
        assertEquals(4, GammaEvaluation.resolutionScale(0.5, 2.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fractionalResolutionScale() {
        GammaEvaluation.resolutionScale(1.0, 1.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void coarserEvaluatedResolution() {
        GammaEvaluation.resolutionScale(2.0, 1.0);
    }

    @Test
    public void borderFollowsReferenceResolution() {
        GammaEvaluation evaluation = new GammaEvaluation(ramp(11, 11, 1.0), ramp(21, 21, 2.0));

        assertEquals(2, evaluation.getScale());
        assertEquals(3, evaluation.border(2.5));
        assertEquals(1, evaluation.border(1.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void windowOutsideEvaluatedGrid() {
        // evaluated distribution covers only half of the reference extent at twice the resolution
        GammaEvaluation evaluation = new GammaEvaluation(ramp(11, 11, 1.0), ramp(11, 11, 2.0));
        evaluation.checkArguments(3.0, DistanceKernel.create(1.0, 2.0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void kernelForWrongResolution() {
        GammaEvaluation evaluation = new GammaEvaluation(ramp(11, 11, 1.0), ramp(11, 11, 1.0));
        evaluation.checkArguments(3.0, DistanceKernel.create(1.0, 2.0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroDoseCriterion() {
        GammaEvaluation evaluation = new GammaEvaluation(ramp(11, 11, 1.0), ramp(11, 11, 1.0));
        evaluation.checkArguments(0.0, DistanceKernel.create(1.0, 1.0), 0.0);
    }

    @Test
    public void rowsAndCountAgree() {
        Distribution reference = ramp(15, 13, 1.0);
        double[][] shifted = reference.getData2D();
        for (double[] row: shifted) {
            for (int j = 0; j < row.length; j++) {
                row[j] *= 1.04;
            }
        }
        Distribution evaluated = new Distribution(shifted);

        GammaEvaluation evaluation = new GammaEvaluation(reference, evaluated);
        DistanceKernel kernel = DistanceKernel.create(2.0, 1.0);
        double[] output = new double[15 * 13];

        evaluation.applyCPU(3.0, kernel, 0.0, true, 0, 15, output);
        GammaResult result = new GammaResult(new Distribution(output, 1.0, reference.getGrid()));

        // 11 x 9 interior points
        assertEquals(99, result.getCountableCount());
        assertEquals(result.getPassRate(), evaluation.countCPU(3.0, kernel, 0.0, true), 0.0);
        assertTrue(GammaResult.isSkipped(output[0]));
        assertFalse(GammaResult.isSkipped(output[7 * 13 + 6]));
    }

    @Test
    public void passRateWithoutCountablePoints() {
        assertEquals(0.0, GammaResult.passRate(0, 0), 0.0);
        assertEquals(50.0, GammaResult.passRate(1, 2), 0.0);
    }
}
