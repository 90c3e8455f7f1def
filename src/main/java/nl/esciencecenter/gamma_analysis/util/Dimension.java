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
package nl.esciencecenter.gamma_analysis.util;

import java.io.Serializable;
import java.util.Objects;

/**
 * Shape of a sampled 2D field: number of rows and columns.
 */
public class Dimension implements Serializable  {
    private static final long serialVersionUID = 7391066127514301882L;

    private int rows;
    private int cols;

    public Dimension(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("invalid dimension " + rows + "x" + cols);
        }

        this.rows = rows;
        this.cols = cols;
    }

    public static Dimension of(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("data must have at least one row");
        }

        int cols = data[0].length;
        for (int i = 1; i < data.length; i++) {
            if (data[i].length != cols) {
                throw new IllegalArgumentException("row " + i + " has " + data[i].length
                        + " columns, expected " + cols);
            }
        }

        return new Dimension(data.length, cols);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int size() {
        return rows * cols;
    }

    public int index(int i, int j) {
        return i * cols + j;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dimension dimension = (Dimension) o;
        return rows == dimension.rows &&
                cols == dimension.cols;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, cols);
    }

    @Override
    public String toString() {
        return "Dimension{" +
                "rows=" + rows +
                ", cols=" + cols +
                '}';
    }
}
