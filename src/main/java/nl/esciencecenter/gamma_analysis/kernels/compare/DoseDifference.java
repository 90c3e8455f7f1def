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
package nl.esciencecenter.gamma_analysis.kernels.compare;

import nl.esciencecenter.gamma_analysis.Distribution;
import nl.esciencecenter.gamma_analysis.util.Util;

/**
 * Point-by-point difference between two distributions sampled on the same grid.
 */
public class DoseDifference {

    public enum Kind {
        /** second - first, in the units of the data */
        ABSOLUTE,

        /** (first - second) as a percentage of the maximum of the second distribution */
        RELATIVE
    }

    /**
     * @return a new distribution on the grid of the second distribution
     */
    public static Distribution applyCPU(Distribution first, Distribution second, Kind kind) {
        if (!first.getDimension().equals(second.getDimension())) {
            throw new IllegalArgumentException("cannot compare distributions of shape " + first.getDimension()
                    + " and " + second.getDimension());
        }

        double[] a = first.getData();
        double[] b = second.getData();
        double[] output = new double[a.length];

        switch (kind) {
            case ABSOLUTE:
                for (int i = 0; i < a.length; i++) {
                    output[i] = b[i] - a[i];
                }
                break;
            case RELATIVE:
                double max = Util.max(b);

                for (int i = 0; i < a.length; i++) {
                    output[i] = finite((a[i] - b[i]) / max * 100);
                }
                break;
            default:
                throw new IllegalArgumentException("unknown difference kind " + kind);
        }

        return new Distribution(output, second.getResolution(), second.getGrid());
    }

    // NaN becomes 0, infinities the largest finite value of the same sign
    private static double finite(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        } else if (v == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        } else if (v == Double.NEGATIVE_INFINITY) {
            return -Double.MAX_VALUE;
        }

        return v;
    }
}
