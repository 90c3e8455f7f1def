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
import nl.esciencecenter.gamma_analysis.util.Dimension;
import nl.esciencecenter.gamma_analysis.util.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gamma index computation between a reference distribution and an evaluated distribution sampled at an integer
 * multiple of the reference resolution.
 *
 * For every reference point the evaluated distribution is searched in a window the size of the distance kernel,
 * centred on the corresponding evaluated cell, for the minimum of the dose difference term plus the distance term.
 * Reference points closer to the border than the search radius are skipped, as are points below the dose
 * threshold and points whose gamma is not a finite number.
 *
 * Instances only read the buffers they copied at construction and can be shared between threads.
 */
public class GammaEvaluation {
    protected static final Logger logger = LogManager.getLogger();

    private static final double RATIO_TOLERANCE = 1e-9;

    private final Dimension refDim;
    private final double[] ref;
    private final double refResolution;

    private final Dimension evalDim;
    private final double[] eval;
    private final double evalResolution;
    private final double maxEvaluated;

    private final int scale;

    public GammaEvaluation(Distribution reference, Distribution evaluated) {
        this.scale = resolutionScale(reference.getResolution(), evaluated.getResolution());

        this.refDim = reference.getDimension();
        this.ref = reference.getData();
        this.refResolution = reference.getResolution();

        this.evalDim = evaluated.getDimension();
        this.eval = evaluated.getData();
        this.evalResolution = evaluated.getResolution();
        this.maxEvaluated = Util.max(eval);
    }

    /**
     * Ratio between the evaluated and reference resolution, which must be a positive integer.
     */
    public static int resolutionScale(double refResolution, double evalResolution) {
        double ratio = evalResolution / refResolution;
        long rounded = Math.round(ratio);

        if (rounded < 1 || Math.abs(ratio - rounded) > RATIO_TOLERANCE * ratio) {
            throw new IllegalArgumentException("evaluated resolution " + evalResolution
                    + " must be an integer multiple of reference resolution " + refResolution);
        }

        return (int) rounded;
    }

    public int getScale() {
        return scale;
    }

    /**
     * Number of reference cells skipped along each border for the given distance criterion.
     */
    public int border(double dta) {
        return DistanceKernel.searchRadius(dta, refResolution);
    }

    /**
     * Checks all arguments and that the search window of every reference point that is not on the border lies
     * inside the evaluated distribution.
     */
    public void checkArguments(double doseCriterion, DistanceKernel kernel, double threshold) {
        if (!(doseCriterion > 0) || Double.isInfinite(doseCriterion)) {
            throw new IllegalArgumentException("dose criterion must be positive, got " + doseCriterion);
        }

        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a non-negative percentage, got " + threshold);
        }

        if (Double.compare(kernel.getResolution(), evalResolution) != 0) {
            throw new IllegalArgumentException("distance kernel built for " + kernel.getResolution()
                    + " points/mm but evaluated distribution has " + evalResolution + " points/mm");
        }

        int border = border(kernel.getDistanceCriterion());
        int k = kernel.getRadius();

        checkWindow("row", border, refDim.getRows(), evalDim.getRows(), k);
        checkWindow("column", border, refDim.getCols(), evalDim.getCols(), k);
    }

    private void checkWindow(String axis, int border, int refCount, int evalCount, int k) {
        int first = border;
        int last = refCount - border - 1;

        // no interior cells along this axis, nothing is searched
        if (first > last) {
            return;
        }

        int low = first * scale - k;
        int high = last * scale + k;

        if (low < 0 || high >= evalCount) {
            throw new IllegalArgumentException("search window along " + axis + " spans evaluated cells " + low
                    + " to " + high + " but the evaluated distribution has " + evalCount + " " + axis + "s");
        }
    }

    /**
     * Computes the signed gamma index of reference rows [rowBegin, rowEnd) and writes them into output, which
     * holds the whole reference grid row-major.
     *
     * @param doseCriterion dose difference criterion, in %
     * @param kernel        distance kernel for the distance criterion at the evaluated resolution
     * @param threshold     percentage of the maximum evaluated value below which reference points are skipped
     * @param local         normalise dose differences by the reference value instead of the maximum evaluated value
     */
    public void applyCPU(double doseCriterion, DistanceKernel kernel, double threshold, boolean local,
                         int rowBegin, int rowEnd, double[] output) {
        if (output.length != refDim.size()) {
            throw new IllegalArgumentException("output has " + output.length + " values, expected " + refDim.size());
        }

        int h = refDim.getRows();
        int w = refDim.getCols();
        int border = border(kernel.getDistanceCriterion());
        double thresholdDose = maxEvaluated * threshold / 100;
        double[] values = kernel.getValues();

        for (int i = rowBegin; i < rowEnd; i++) {
            for (int j = 0; j < w; j++) {
                if (i < border || i >= h - border || j < border || j >= w - border) {
                    output[i * w + j] = GammaResult.SKIPPED;
                } else {
                    output[i * w + j] = gammaAt(i, j, doseCriterion, values, kernel.getRadius(), thresholdDose, local);
                }
            }
        }
    }

    /**
     * Computes the pass rate in % without keeping the gamma values.
     */
    public double countCPU(double doseCriterion, DistanceKernel kernel, double threshold, boolean local) {
        int h = refDim.getRows();
        int w = refDim.getCols();
        int border = border(kernel.getDistanceCriterion());
        int k = kernel.getRadius();
        double thresholdDose = maxEvaluated * threshold / 100;
        double[] values = kernel.getValues();

        long passing = 0;
        long countable = 0;

        for (int i = border; i < h - border; i++) {
            for (int j = border; j < w - border; j++) {
                double gamma = gammaAt(i, j, doseCriterion, values, k, thresholdDose, local);

                if (gamma != GammaResult.SKIPPED) {
                    countable++;

                    if (Math.abs(gamma) <= 1.0) {
                        passing++;
                    }
                }
            }
        }

        logger.trace("dose {}%, dta {} mm: {} of {} points pass", doseCriterion, kernel.getDistanceCriterion(),
                passing, countable);
        return GammaResult.passRate(passing, countable);
    }

    private double gammaAt(int i, int j, double doseCriterion, double[] kernel, int k, double thresholdDose,
                           boolean local) {
        double doseRef = ref[i * refDim.getCols() + j];

        if (doseRef < thresholdDose) {
            return GammaResult.SKIPPED;
        }

        int ew = evalDim.getCols();
        int size = 2 * k + 1;
        int cr = i * scale;
        int cc = j * scale;

        double denom = (local ? doseRef : maxEvaluated) * doseCriterion / 100;
        double denom2 = denom * denom;

        double min = Double.POSITIVE_INFINITY;

        for (int a = 0; a < size; a++) {
            int e = (cr - k + a) * ew + (cc - k);
            int q = a * size;

            for (int b = 0; b < size; b++) {
                double diff = eval[e + b] - doseRef;
                double v = diff * diff / denom2 + kernel[q + b];

                // NaN never compares smaller
                if (v < min) {
                    min = v;
                }
            }
        }

        if (!Double.isFinite(min)) {
            return GammaResult.SKIPPED;
        }

        double gamma = Math.sqrt(min);

        // sign from the directly corresponding cell, not from the minimising one
        if (doseRef < eval[cr * ew + cc]) {
            gamma = -gamma;
        }

        return gamma;
    }
}
