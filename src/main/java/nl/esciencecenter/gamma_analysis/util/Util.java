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

/**
 * Helpers for converting between nested arrays and the flat row-major buffers used by the kernels.
 */
public class Util {
	public static double[] from2DTo1D(double[][] input) {
		Dimension dim = Dimension.of(input);
		int h = dim.getRows();
		int w = dim.getCols();
		double[] output = new double[h * w];

		for (int i = 0; i < h; i++) {
			System.arraycopy(input[i], 0, output, i * w, w);
		}

		return output;
	}

	public static double[][] from1DTo2D(int h, int w, double[] input) {
		if (input.length != h * w) {
			throw new IllegalArgumentException("buffer of length " + input.length + " cannot hold " + h + "x" + w);
		}

		double[][] output = new double[h][w];

		for (int i = 0; i < h; i++) {
			System.arraycopy(input, i * w, output[i], 0, w);
		}

		return output;
	}

	/**
	 * Flattens a position field of shape 2 x h x w into two consecutive planes (x first, then y).
	 */
	public static double[] fromPositionsTo1D(Dimension dim, double[][][] position) {
		if (position.length != 2) {
			throw new IllegalArgumentException("position must have 2 planes, got " + position.length);
		}

		for (int p = 0; p < 2; p++) {
			if (!Dimension.of(position[p]).equals(dim)) {
				throw new IllegalArgumentException("position plane " + p + " has shape "
						+ Dimension.of(position[p]) + ", expected " + dim);
			}
		}

		int n = dim.size();
		double[] output = new double[2 * n];
		System.arraycopy(from2DTo1D(position[0]), 0, output, 0, n);
		System.arraycopy(from2DTo1D(position[1]), 0, output, n, n);
		return output;
	}

	public static double[][][] fromPositionsTo3D(Dimension dim, double[] position) {
		int h = dim.getRows();
		int w = dim.getCols();
		int n = dim.size();

		double[][][] output = new double[2][h][w];
		for (int i = 0; i < h; i++) {
			System.arraycopy(position, i * w, output[0][i], 0, w);
			System.arraycopy(position, n + i * w, output[1][i], 0, w);
		}

		return output;
	}

	public static double max(double[] input) {
		double max = Double.NEGATIVE_INFINITY;

		for (int i = 0; i < input.length; i++) {
			max = Math.max(max, input[i]);
		}

		return max;
	}

	/**
	 * Returns n evenly spaced samples from first to last, both included.
	 */
	public static double[] linspace(double first, double last, int n) {
		if (n < 1) {
			throw new IllegalArgumentException("need at least one sample, got " + n);
		}

		double[] output = new double[n];
		if (n == 1) {
			output[0] = first;
			return output;
		}

		double step = (last - first) / (n - 1);
		for (int i = 0; i < n; i++) {
			output[i] = first + i * step;
		}

		// endpoints are anchored exactly
		output[n - 1] = last;
		return output;
	}
}
