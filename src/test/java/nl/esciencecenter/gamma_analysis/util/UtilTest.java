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

import org.junit.Test;

import static org.junit.Assert.*;

public class UtilTest {

    @Test
    public void linspaceKeepsEndPoints() {
        double[] x = Util.linspace(-1.3, 2.9, 7);

        assertEquals(7, x.length);
        assertEquals(-1.3, x[0], 0.0);
        assertEquals(2.9, x[6], 0.0);
        assertEquals(0.1, x[2], 1e-12);
        assertArrayEquals(new double[]{4.0}, Util.linspace(4.0, 8.0, 1), 0.0);
    }

    @Test
    public void positionsRoundTripThroughPlanes() {
        Dimension dim = new Dimension(2, 3);
        double[][][] position = {
                {{0, 1, 2}, {0, 1, 2}},
                {{5, 5, 5}, {6, 6, 6}}};

        double[] flat = Util.fromPositionsTo1D(dim, position);

        assertArrayEquals(new double[]{0, 1, 2, 0, 1, 2, 5, 5, 5, 6, 6, 6}, flat, 0.0);
        assertArrayEquals(position[1][1], Util.fromPositionsTo3D(dim, flat)[1][1], 0.0);
    }

    @Test
    public void dimensionIndexIsRowMajor() {
        Dimension dim = new Dimension(4, 5);

        assertEquals(20, dim.size());
        assertEquals(13, dim.index(2, 3));
        assertEquals(dim, Dimension.of(new double[4][5]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyDimension() {
        new Dimension(0, 3);
    }
}
