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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Outcome of a gamma evaluation: the signed gamma index of every reference point and the pass rate.
 *
 * Negative values mark points where the reference is below the evaluated value at the corresponding cell
 * ("cold"), positive values the opposite ("hot"). Points that were not evaluated hold {@link #SKIPPED}.
 */
public class GammaResult {
    protected static final Logger logger = LogManager.getLogger();

    public static final double SKIPPED = Double.POSITIVE_INFINITY;

    private final Distribution gammaMap;
    private final long passing;
    private final long countable;

    public GammaResult(Distribution gammaMap) {
        double[] gamma = gammaMap.getData();
        long passing = 0;
        long countable = 0;

        for (int i = 0; i < gamma.length; i++) {
            if (!isSkipped(gamma[i])) {
                countable++;

                if (Math.abs(gamma[i]) <= 1.0) {
                    passing++;
                }
            }
        }

        this.gammaMap = gammaMap;
        this.passing = passing;
        this.countable = countable;
    }

    public static boolean isSkipped(double gamma) {
        return !Double.isFinite(gamma);
    }

    /**
     * Percentage of passing points among the countable ones. Without countable points the pass rate is 0.
     */
    public static double passRate(long passing, long countable) {
        if (countable == 0) {
            logger.warn("no points left to evaluate, reporting a pass rate of 0");
            return 0.0;
        }

        return (double) passing / countable * 100;
    }

    public Distribution getGammaMap() {
        return gammaMap;
    }

    /** Pass rate in %. */
    public double getPassRate() {
        return passRate(passing, countable);
    }

    public long getPassingCount() {
        return passing;
    }

    public long getCountableCount() {
        return countable;
    }

    @Override
    public String toString() {
        return "GammaResult{" +
                "passing=" + passing +
                ", countable=" + countable +
                '}';
    }
}
