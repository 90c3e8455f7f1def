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
package nl.esciencecenter.gamma_analysis.kernels.distance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Distance half of the squared gamma index for every offset inside the search window of one
 * distance-to-agreement (DTA) criterion.
 *
 * The kernel is square with side 2k + 1 where k = ceil(dta * resolution). The offset of a cell is the sum of the
 * absolute physical offsets along both axes, so the region within the DTA is a diamond rather than a disc.
 * Cells further away than the DTA hold {@link #OUTSIDE} divided by dta squared, which is large enough to never
 * be selected as a minimum while staying finite.
 */
public class DistanceKernel {
    protected static final Logger logger = LogManager.getLogger();

    public static final double OUTSIDE = 1e9;

    private final double dta;
    private final double resolution;
    private final int radius;
    private final int size;
    private final double[] values;

    private DistanceKernel(double dta, double resolution, int radius, double[] values) {
        this.dta = dta;
        this.resolution = resolution;
        this.radius = radius;
        this.size = 2 * radius + 1;
        this.values = values;
    }

    /**
     * @param dta        distance to agreement criterion, in mm
     * @param resolution resolution of the evaluated distribution, in points / mm
     */
    public static DistanceKernel create(double dta, double resolution) {
        if (!(dta > 0) || Double.isInfinite(dta)) {
            throw new IllegalArgumentException("distance criterion must be positive, got " + dta);
        }

        if (!(resolution > 0) || Double.isInfinite(resolution)) {
            throw new IllegalArgumentException("resolution must be positive, got " + resolution);
        }

        int radius = searchRadius(dta, resolution);
        int size = 2 * radius + 1;
        double[] values = new double[size * size];

        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                double offset = Math.abs(i - radius) / resolution + Math.abs(j - radius) / resolution;
                double squared = offset * offset;

                if (Math.sqrt(squared) > dta) {
                    squared = OUTSIDE;
                }

                values[i * size + j] = squared / (dta * dta);
            }
        }

        logger.debug("built {}x{} distance kernel for dta {} mm at {} points/mm", size, size, dta, resolution);
        return new DistanceKernel(dta, resolution, radius, values);
    }

    /**
     * Number of grid cells covered by the DTA criterion on either side of a point.
     */
    public static int searchRadius(double dta, double resolution) {
        return (int) Math.ceil(dta * resolution);
    }

    public double getDistanceCriterion() {
        return dta;
    }

    public double getResolution() {
        return resolution;
    }

    /** Half width k of the kernel, in cells. */
    public int getRadius() {
        return radius;
    }

    /** Side length 2k + 1 of the kernel, in cells. */
    public int getSize() {
        return size;
    }

    /**
     * @param dy row offset from the centre, between -k and k
     * @param dx column offset from the centre, between -k and k
     */
    public double get(int dy, int dx) {
        if (Math.abs(dy) > radius || Math.abs(dx) > radius) {
            throw new IndexOutOfBoundsException("offset (" + dy + ", " + dx + ") outside kernel of radius " + radius);
        }

        return values[(dy + radius) * size + (dx + radius)];
    }

    /** Copy of the kernel values, row-major. */
    public double[] getValues() {
        return values.clone();
    }

    public double[][] getValues2D() {
        double[][] output = new double[size][];

        for (int i = 0; i < size; i++) {
            output[i] = Arrays.copyOfRange(values, i * size, (i + 1) * size);
        }

        return output;
    }

    @Override
    public String toString() {
        return "DistanceKernel{" +
                "dta=" + dta +
                ", resolution=" + resolution +
                ", size=" + size +
                '}';
    }
}
