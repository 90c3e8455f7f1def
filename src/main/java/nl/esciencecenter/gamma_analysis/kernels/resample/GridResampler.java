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
package nl.esciencecenter.gamma_analysis.kernels.resample;

import nl.esciencecenter.gamma_analysis.Distribution;
import nl.esciencecenter.gamma_analysis.Grid;
import nl.esciencecenter.gamma_analysis.util.Dimension;
import nl.esciencecenter.gamma_analysis.util.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resamples a distribution onto the extent of a reference grid using bilinear interpolation.
 *
 * Only regularly spaced rectangular grids are supported: the x coordinate must be constant down every column
 * and the y coordinate constant along every row. Positions of the result that fall outside the source extent
 * are linearly extrapolated from the nearest edge cell; choosing a reference grid inside the overlap of both
 * distributions is up to the caller.
 */
public class GridResampler {
    protected static final Logger logger = LogManager.getLogger();

    private static final double COUNT_TOLERANCE = 1e-9;
    private static final double AXIS_TOLERANCE = 1e-9;

    /**
     * @param source        distribution to interpolate
     * @param reference     distribution whose first and last positions along each axis bound the result
     * @param newResolution resolution of the result in points / mm, or 0 to use the resolution of the reference
     * @return a new distribution; neither input is modified
     */
    public static Distribution applyCPU(Distribution source, Distribution reference, double newResolution) {
        double scale;
        if (newResolution == 0.0) {
            newResolution = reference.getResolution();
            scale = 1.0;
        } else if (newResolution > 0 && !Double.isInfinite(newResolution)) {
            scale = newResolution / reference.getResolution();
        } else {
            throw new IllegalArgumentException("new resolution must be positive, got " + newResolution);
        }

        // Axes of the reference grid, with its placement applied
        Axes ref = axesOf(reference, "reference");
        int nx = sampleCount(scale, ref.x.length);
        int ny = sampleCount(scale, ref.y.length);
        double[] xNew = Util.linspace(ref.x[0], ref.x[ref.x.length - 1], nx);
        double[] yNew = Util.linspace(ref.y[0], ref.y[ref.y.length - 1], ny);

        // Axes of the source grid, used as nodes of the interpolant
        Axes src = axesOf(source, "source");
        if (src.x.length < 2 || src.y.length < 2) {
            throw new IllegalArgumentException("bilinear interpolation needs at least 2x2 source points, got "
                    + source.getDimension());
        }

        int[] colIndex = new int[nx];
        double[] colWeight = new double[nx];
        for (int j = 0; j < nx; j++) {
            colIndex[j] = locate(src.x, xNew[j]);
            colWeight[j] = weight(src.x, colIndex[j], xNew[j]);
        }

        int[] rowIndex = new int[ny];
        double[] rowWeight = new double[ny];
        for (int i = 0; i < ny; i++) {
            rowIndex[i] = locate(src.y, yNew[i]);
            rowWeight[i] = weight(src.y, rowIndex[i], yNew[i]);
        }

        double[] values = source.getData();
        int w = source.getCols();
        double[] output = new double[ny * nx];

        for (int i = 0; i < ny; i++) {
            int r0 = rowIndex[i] * w;
            int r1 = r0 + w;
            double ty = rowWeight[i];

            for (int j = 0; j < nx; j++) {
                int c0 = colIndex[j];
                double tx = colWeight[j];

                double top = values[r0 + c0] * (1 - tx) + values[r0 + c0 + 1] * tx;
                double bottom = values[r1 + c0] * (1 - tx) + values[r1 + c0 + 1] * tx;

                output[i * nx + j] = top * (1 - ty) + bottom * ty;
            }
        }

        logger.debug("resampled {} onto {}x{} points at {} points/mm", source.getDimension(), ny, nx, newResolution);
        return new Distribution(output, newResolution, Grid.meshgrid(xNew, yNew));
    }

    /**
     * Number of samples after scaling an axis of count points, keeping both end points.
     */
    static int sampleCount(double scale, int count) {
        double exact = scale * (count - 1) + 1;
        long rounded = Math.round(exact);

        if (Math.abs(exact - rounded) > COUNT_TOLERANCE * Math.max(1.0, exact) || rounded < 1) {
            throw new IllegalArgumentException("scaling " + count + " points by " + scale
                    + " does not give a whole number of points (" + exact + ")");
        }

        return (int) rounded;
    }

    private static class Axes {
        private final double[] x;
        private final double[] y;

        private Axes(double[] x, double[] y) {
            this.x = x;
            this.y = y;
        }
    }

    /**
     * Extracts the x axis (first row) and y axis (first column) of a distribution and checks that they describe
     * the whole grid.
     */
    private static Axes axesOf(Distribution dist, String name) {
        Dimension dim = dist.getDimension();
        int h = dim.getRows();
        int w = dim.getCols();
        int n = dim.size();
        double[] pos = dist.getPositions();

        double[] x = new double[w];
        double[] y = new double[h];
        System.arraycopy(pos, 0, x, 0, w);
        for (int i = 0; i < h; i++) {
            y[i] = pos[n + i * w];
        }

        double tolerance = AXIS_TOLERANCE * Math.max(1.0, Math.max(extent(x), extent(y)));

        for (int i = 0; i < h; i++) {
            for (int j = 0; j < w; j++) {
                if (Math.abs(pos[i * w + j] - x[j]) > tolerance || Math.abs(pos[n + i * w + j] - y[i]) > tolerance) {
                    throw new UnsupportedOperationException("resampling of non-rectangular " + name
                            + " grids is not implemented (cell " + i + ", " + j + ")");
                }
            }
        }

        if (!isMonotonic(x) || !isMonotonic(y)) {
            throw new UnsupportedOperationException("resampling of " + name
                    + " grids with non-monotonic axes is not implemented");
        }

        return new Axes(x, y);
    }

    private static double extent(double[] axis) {
        return Math.abs(axis[axis.length - 1] - axis[0]);
    }

    private static boolean isMonotonic(double[] axis) {
        boolean ascending = true;
        boolean descending = true;

        for (int i = 1; i < axis.length; i++) {
            ascending &= axis[i] > axis[i - 1];
            descending &= axis[i] < axis[i - 1];
        }

        return ascending || descending;
    }

    /**
     * Index k of the axis interval [k, k + 1] used to interpolate at v. Values beyond the ends use the
     * outermost interval.
     */
    static int locate(double[] axis, double v) {
        int n = axis.length;
        double sign = axis[n - 1] >= axis[0] ? 1.0 : -1.0;
        double target = sign * v;

        int lo = 0;
        int hi = n - 2;

        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;

            if (sign * axis[mid] <= target) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }

        return lo;
    }

    private static double weight(double[] axis, int k, double v) {
        return (v - axis[k]) / (axis[k + 1] - axis[k]);
    }
}
