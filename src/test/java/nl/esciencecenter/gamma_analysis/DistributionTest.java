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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class DistributionTest {
    private static final double EPS = 1e-9;

    protected double[][] block;
    protected Distribution dist;

    /**
     * 11x11 zeros with a 5x5 block of 2.0 in rows and columns 3 to 7.
     */
    static double[][] blockData() {
        double[][] data = new double[11][11];

        for (int i = 3; i < 8; i++) {
            for (int j = 3; j < 8; j++) {
                data[i][j] = 2.0;
            }
        }

        return data;
    }

    @Before
    public void setUp() {
        block = blockData();
        dist = new Distribution(block);
    }

    @Test
    public void defaultPositionsAreCentred() {
        double[][][] pos = dist.getPositions3D();

        for (int i = 0; i < 11; i++) {
            for (int j = 0; j < 11; j++) {
                assertEquals(j - 5.0, pos[0][i][j], 0.0);
                assertEquals(i - 5.0, pos[1][i][j], 0.0);
            }
        }

        assertEquals(1.0, dist.getResolution(), 0.0);
        assertArrayEquals(block[4], dist.getData2D()[4], 0.0);
        assertEquals(2.0, dist.getMax(), 0.0);
    }

    @Test
    public void uniformPositionsFollowResolution() {
        Distribution half = new Distribution(new double[5][3], 0.5);

        assertEquals(-2.0, half.getGrid().getX(0, 0), EPS);
        assertEquals(2.0, half.getGrid().getX(0, 2), EPS);
        assertEquals(-4.0, half.getGrid().getY(0, 0), EPS);
        assertEquals(4.0, half.getGrid().getY(4, 0), EPS);
    }

    @Test
    public void explicitPositions() {
        double[][][] position = new double[2][11][11];
        for (int i = 0; i < 11; i++) {
            for (int j = 0; j < 11; j++) {
                position[0][i][j] = j - 4.0;
                position[1][i][j] = i - 3.0;
            }
        }

        Distribution shifted = new Distribution(block, 1.0, position);
        double[][][] pos = shifted.getPositions3D();

        assertEquals(-4.0, pos[0][0][0], 0.0);
        assertEquals(6.0, pos[0][0][10], 0.0);
        assertEquals(-3.0, pos[1][0][0], 0.0);
        assertEquals(7.0, pos[1][10][0], 0.0);
    }

    @Test
    public void translationAppliesOnRead() {
        Distribution moved = dist.withTranslation(1, 2);
        double[][][] pos = moved.getPositions3D();

        assertEquals(1.0, moved.getPlacement().getTranslationX(), 0.0);
        assertEquals(2.0, moved.getPlacement().getTranslationY(), 0.0);

        for (int i = 0; i < 11; i++) {
            for (int j = 0; j < 11; j++) {
                assertEquals(j - 4.0, pos[0][i][j], EPS);
                assertEquals(i - 3.0, pos[1][i][j], EPS);
            }
        }

        // original is unchanged
        assertEquals(-5.0, dist.getGrid().getX(0, 0), 0.0);
        assertEquals(Placement.IDENTITY, dist.getPlacement());
    }

    @Test
    public void rotationByQuarterTurn() {
        Distribution rotated = dist.withRotation(Math.PI / 2);
        double[][][] pos = rotated.getPositions3D();

        assertEquals(Math.PI / 2, rotated.getPlacement().getRotation(), 0.0);

        // same as rotating the position arrays by 90 degrees counter clockwise
        for (int i = 0; i < 11; i++) {
            for (int j = 0; j < 11; j++) {
                assertEquals(5.0 - i, pos[0][i][j], EPS);
                assertEquals(j - 5.0, pos[1][i][j], EPS);
            }
        }

        assertArrayEquals(dist.getGrid().getBasePositions(), rotated.getGrid().getBasePositions(), 0.0);
    }

    @Test
    public void latestPlacementWins() {
        Distribution moved = dist.withRotation(Math.PI / 2).withTranslation(1, 2).withRotation(0.0);

        assertEquals(-4.0, moved.getGrid().getX(0, 0), EPS);
        assertEquals(-3.0, moved.getGrid().getY(0, 0), EPS);
    }

    @Test(expected = IllegalArgumentException.class)
    public void mismatchedPositionShape() {
        new Distribution(block, 1.0, new double[2][11][10]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedData() {
        new Distribution(new double[][]{{1, 2}, {3}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveResolution() {
        new Distribution(block, 0.0);
    }
}
