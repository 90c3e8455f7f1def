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

import nl.esciencecenter.gamma_analysis.kernels.transformrigid2d.TransformRigid2D;
import nl.esciencecenter.gamma_analysis.util.Dimension;
import nl.esciencecenter.gamma_analysis.util.Util;

import java.io.Serializable;

/**
 * Rectangular array of sample positions, in mm, plus the placement applied to them when read.
 *
 * The base positions are stored as two planes of rows x cols values (x first, then y) and are never
 * modified. Changing the placement creates a new grid sharing the same base positions.
 */
public class Grid implements Serializable {
    private static final long serialVersionUID = 3190275484460731356L;

    private final Dimension dim;
    private final double[] base;
    private final Placement placement;

    private Grid(Dimension dim, double[] base, Placement placement) {
        this.dim = dim;
        this.base = base;
        this.placement = placement;
    }

    /**
     * Creates a grid from explicit positions with shape 2 x rows x cols.
     */
    public static Grid of(Dimension dim, double[][][] position) {
        return new Grid(dim, Util.fromPositionsTo1D(dim, position), Placement.IDENTITY);
    }

    /**
     * Creates a regular grid with a spacing of 1 / resolution mm, centred on the origin. The centre is the
     * midpoint of the extent along each axis.
     *
     * @param resolution sampling density in points / mm
     */
    public static Grid uniform(int rows, int cols, double resolution) {
        return uniform(new Dimension(rows, cols), resolution);
    }

    public static Grid uniform(Dimension dim, double resolution) {
        if (!(resolution > 0) || Double.isInfinite(resolution)) {
            throw new IllegalArgumentException("resolution must be positive, got " + resolution);
        }

        int rows = dim.getRows();
        int cols = dim.getCols();
        int n = dim.size();
        double[] position = new double[2 * n];

        double xOffset = ((cols - 1) / resolution) / 2;
        double yOffset = ((rows - 1) / resolution) / 2;

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                position[i * cols + j] = j / resolution - xOffset;
                position[n + i * cols + j] = i / resolution - yOffset;
            }
        }

        return new Grid(dim, position, Placement.IDENTITY);
    }

    /**
     * Creates a rectangular grid from its x axis (one value per column) and y axis (one value per row).
     */
    public static Grid meshgrid(double[] x, double[] y) {
        Dimension dim = new Dimension(y.length, x.length);
        int n = dim.size();
        double[] position = new double[2 * n];

        for (int i = 0; i < y.length; i++) {
            for (int j = 0; j < x.length; j++) {
                position[i * x.length + j] = x[j];
                position[n + i * x.length + j] = y[i];
            }
        }

        return new Grid(dim, position, Placement.IDENTITY);
    }

    public Grid withPlacement(Placement placement) {
        return new Grid(dim, base, placement);
    }

    public Dimension getDimension() {
        return dim;
    }

    public Placement getPlacement() {
        return placement;
    }

    public double[] getBasePositions() {
        return base.clone();
    }

    /**
     * Returns the positions with the current placement applied, as two planes (x first, then y).
     */
    public double[] getPositions() {
        double[] output = new double[base.length];
        TransformRigid2D.applyCPU(
                base,
                output,
                dim.size(),
                placement.getRotation(),
                placement.getTranslationX(),
                placement.getTranslationY());
        return output;
    }

    /**
     * Same as {@link #getPositions()} but shaped 2 x rows x cols.
     */
    public double[][][] getPositions3D() {
        return Util.fromPositionsTo3D(dim, getPositions());
    }

    public double getX(int i, int j) {
        double[] p = transformCell(i, j);
        return p[0];
    }

    public double getY(int i, int j) {
        double[] p = transformCell(i, j);
        return p[1];
    }

    private double[] transformCell(int i, int j) {
        if (i < 0 || i >= dim.getRows() || j < 0 || j >= dim.getCols()) {
            throw new IndexOutOfBoundsException("cell (" + i + ", " + j + ") outside " + dim);
        }

        int k = dim.index(i, j);
        double[] input = {base[k], base[dim.size() + k]};
        double[] output = new double[2];
        TransformRigid2D.applyCPU(
                input,
                output,
                1,
                placement.getRotation(),
                placement.getTranslationX(),
                placement.getTranslationY());
        return output;
    }

    @Override
    public String toString() {
        return "Grid{" +
                "dim=" + dim +
                ", placement=" + placement +
                '}';
    }
}
