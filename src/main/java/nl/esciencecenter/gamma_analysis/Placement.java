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

import java.io.Serializable;
import java.util.Objects;

/**
 * Rigid placement of a grid in space: a rotation around the origin followed by a translation.
 * For example, a shift of 1 mm in x and -2 mm in y is {@code new Placement(1, -2, 0)}.
 */
public class Placement implements Serializable {
    private static final long serialVersionUID = -5216034371902874175L;

    public static final Placement IDENTITY = new Placement(0.0, 0.0, 0.0);

    private final double dx;
    private final double dy;
    private final double rotation;

    public Placement(double dx, double dy, double rotation) {
        if (!Double.isFinite(dx) || !Double.isFinite(dy) || !Double.isFinite(rotation)) {
            throw new IllegalArgumentException("placement must be finite: " + dx + ", " + dy + ", " + rotation);
        }

        this.dx = dx;
        this.dy = dy;
        this.rotation = rotation;
    }

    public Placement withTranslation(double dx, double dy) {
        return new Placement(dx, dy, rotation);
    }

    public Placement withRotation(double rotation) {
        return new Placement(dx, dy, rotation);
    }

    public double getTranslationX() {
        return dx;
    }

    public double getTranslationY() {
        return dy;
    }

    /** Rotation in radians. */
    public double getRotation() {
        return rotation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Placement that = (Placement) o;
        return Double.compare(that.dx, dx) == 0 &&
                Double.compare(that.dy, dy) == 0 &&
                Double.compare(that.rotation, rotation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dx, dy, rotation);
    }

    @Override
    public String toString() {
        return "Placement{" +
                "dx=" + dx +
                ", dy=" + dy +
                ", rotation=" + rotation +
                '}';
    }
}
