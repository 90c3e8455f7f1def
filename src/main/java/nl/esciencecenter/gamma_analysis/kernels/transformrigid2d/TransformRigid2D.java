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
package nl.esciencecenter.gamma_analysis.kernels.transformrigid2d;

/**
 * Applies a rotation followed by a translation to a plane-separated position field.
 */
public class TransformRigid2D {

    /**
     * @param input  positions of n points, all x coordinates followed by all y coordinates
     * @param output buffer receiving the transformed positions, same layout as input
     * @param n      number of points
     * @param theta  rotation around the origin, in radians
     */
    public static void applyCPU(double[] input, double[] output, int n, double theta, double translate_x, double translate_y) {
        if (input.length < 2 * n || output.length < 2 * n) {
            throw new IllegalArgumentException("invalid element count " + input.length + ", " + output.length + " for " + n + " points");
        }

        if (theta == 0.0) {
            for (int i = 0; i < n; i++) {
                output[i] = input[i] + translate_x;
                output[n + i] = input[n + i] + translate_y;
            }
            return;
        }

        double cos = Math.cos(theta);
        double sin = Math.sin(theta);

        for (int i = 0; i < n; i++) {
            double x = input[i];
            double y = input[n + i];

            output[i] = x * cos - y * sin + translate_x;
            output[n + i] = x * sin + y * cos + translate_y;
        }
    }
}
