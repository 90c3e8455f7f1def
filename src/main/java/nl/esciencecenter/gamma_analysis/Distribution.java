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

import nl.esciencecenter.gamma_analysis.kernels.resample.GridResampler;
import nl.esciencecenter.gamma_analysis.util.Dimension;
import nl.esciencecenter.gamma_analysis.util.Util;

import java.io.Serializable;

/**
 * A 2D scalar field sampled on a {@link Grid}, for example a measured or planned dose map.
 *
 * Distributions are immutable. Methods that change the placement or the sampling return a new
 * distribution; the data buffer is shared where it does not change.
 */
public class Distribution implements Serializable {
    private static final long serialVersionUID = -2968711416226019585L;

    private final double[] data;
    private final double resolution;
    private final Grid grid;

    /**
     * Creates a distribution with a resolution of 1 point / mm, centred on the origin.
     */
    public Distribution(double[][] data) {
        this(data, 1.0);
    }

    /**
     * Creates a distribution centred on the origin.
     *
     * @param resolution points / mm
     */
    public Distribution(double[][] data, double resolution) {
        this(Util.from2DTo1D(data), resolution, Grid.uniform(Dimension.of(data), resolution));
    }

    /**
     * Creates a distribution at explicit positions.
     *
     * @param resolution points / mm
     * @param position   position of each point, shape 2 x rows x cols
     */
    public Distribution(double[][] data, double resolution, double[][][] position) {
        this(Util.from2DTo1D(data), resolution, Grid.of(Dimension.of(data), position));
    }

    /**
     * Creates a distribution from a row-major buffer. The buffer is not copied and must not be modified
     * afterwards.
     */
    public Distribution(double[] data, double resolution, Grid grid) {
        if (data.length != grid.getDimension().size()) {
            throw new IllegalArgumentException("data has " + data.length + " values but grid is "
                    + grid.getDimension());
        }

        if (!(resolution > 0) || Double.isInfinite(resolution)) {
            throw new IllegalArgumentException("resolution must be positive, got " + resolution);
        }

        this.data = data;
        this.resolution = resolution;
        this.grid = grid;
    }

    public Dimension getDimension() {
        return grid.getDimension();
    }

    public int getRows() {
        return grid.getDimension().getRows();
    }

    public int getCols() {
        return grid.getDimension().getCols();
    }

    /** Resolution in points / mm. */
    public double getResolution() {
        return resolution;
    }

    public Grid getGrid() {
        return grid;
    }

    public Placement getPlacement() {
        return grid.getPlacement();
    }

    public double get(int i, int j) {
        return data[grid.getDimension().index(i, j)];
    }

    /** Copy of the values, row-major. */
    public double[] getData() {
        return data.clone();
    }

    public double[][] getData2D() {
        return Util.from1DTo2D(getRows(), getCols(), data);
    }

    public double getMax() {
        return Util.max(data);
    }

    /** Positions with the current placement applied, as two planes (x first, then y). */
    public double[] getPositions() {
        return grid.getPositions();
    }

    /** Positions with the current placement applied, shape 2 x rows x cols. */
    public double[][][] getPositions3D() {
        return grid.getPositions3D();
    }

    public Distribution withPlacement(Placement placement) {
        return new Distribution(data, resolution, grid.withPlacement(placement));
    }

    /** Returns this distribution shifted by (dx, dy) mm from its base position, keeping the rotation. */
    public Distribution withTranslation(double dx, double dy) {
        return withPlacement(getPlacement().withTranslation(dx, dy));
    }

    /** Returns this distribution rotated by the given angle in radians, keeping the translation. */
    public Distribution withRotation(double rotation) {
        return withPlacement(getPlacement().withRotation(rotation));
    }

    /**
     * Resamples this distribution at the positions of a reference distribution.
     *
     * @param reference     distribution whose grid extent is used, or null to use this distribution
     * @param newResolution resolution of the result in points / mm, or 0 to use the reference resolution
     * @see GridResampler#applyCPU(Distribution, Distribution, double)
     */
    public Distribution scaleGrid(Distribution reference, double newResolution) {
        return GridResampler.applyCPU(this, reference == null ? this : reference, newResolution);
    }

    public Distribution scaleGrid(Distribution reference) {
        return scaleGrid(reference, 0.0);
    }

    @Override
    public String toString() {
        return "Distribution{" +
                "dim=" + getDimension() +
                ", resolution=" + resolution +
                ", placement=" + getPlacement() +
                '}';
    }
}
