/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package beamsmooth;

/**
 * a file with some useful numerical analysis stuff.
 *
 * @author Justin Kunimune
 */
public class Math2 {

	/** the sharpness of the cubic interpolation curve; -1/2 makes it Catmull-Rom */
	private static final double CUBIC_SHARPNESS = -0.5;

	public static double sum(double[] arr) {
		double s = 0;
		for (double x: arr)
			s += x;
		return s;
	}

	public static double sum(double[][] arr) {
		double s = 0;
		for (double[] row: arr)
			for (double x: row)
				s += x;
		return s;
	}

	/**
	 * the smallest finite element of a cube, or NaN if there aren't any
	 */
	public static double nanmin(float[][][] arr) {
		double min = Double.POSITIVE_INFINITY;
		for (float[][] lvl: arr)
			for (float[] row: lvl)
				for (float x: row)
					if (Float.isFinite(x) && x < min)
						min = x;
		return (min == Double.POSITIVE_INFINITY) ? Double.NaN : min;
	}

	/**
	 * the largest finite element of a cube, or NaN if there aren't any
	 */
	public static double nanmax(float[][][] arr) {
		double max = Double.NEGATIVE_INFINITY;
		for (float[][] lvl: arr)
			for (float[] row: lvl)
				for (float x: row)
					if (Float.isFinite(x) && x > max)
						max = x;
		return (max == Double.NEGATIVE_INFINITY) ? Double.NaN : max;
	}

	public static boolean all_zero(double[] values) {
		for (double value: values)
			if (value != 0)
				return false;
		return true;
	}

	/**
	 * the smallest power of 2 that is no less than n
	 */
	public static int nextPowerOf2(int n) {
		if (n <= 1)
			return 1;
		int m = Integer.highestOneBit(n - 1) << 1;
		if (m <= 0)
			throw new IllegalArgumentException(n+" is too big to round up to a power of 2");
		return m;
	}

	/**
	 * map an index that may be out of bounds back into an array by reflecting it off the ends,
	 * duplicating the edge elements (so -1 goes to 0, -2 goes to 1, and n goes to n - 1).
	 */
	public static int reflect(int index, int length) {
		int period = 2*length;
		index = Math.floorMod(index, period);
		if (index >= length)
			index = period - 1 - index;
		return index;
	}

	/**
	 * rotate a 2D array by 180°
	 */
	public static double[][] flip(double[][] arr) {
		int n = arr.length;
		double[][] output = new double[n][];
		for (int i = 0; i < n; i ++) {
			int m = arr[n - 1 - i].length;
			output[i] = new double[m];
			for (int j = 0; j < m; j ++)
				output[i][j] = arr[n - 1 - i][m - 1 - j];
		}
		return output;
	}

	public static double[][][] deepCopy(double[][][] arr) {
		double[][][] copy = new double[arr.length][][];
		for (int i = 0; i < arr.length; i ++) {
			copy[i] = new double[arr[i].length][];
			for (int j = 0; j < arr[i].length; j ++)
				copy[i][j] = arr[i][j].clone();
		}
		return copy;
	}

	/**
	 * index a 2D array with non-integers, assuming that intermediate indices give intermediate
	 * values.  the array is treated as infinite in extent; all out of bounds queries will go to 0.
	 * @param values the values at the specified integer indices
	 * @param i the partial index along the first axis
	 * @param j the partial index along the following axis
	 * @return the interpolated value
	 */
	public static double interp(double[][] values, double i, double j) {
		if (Double.isNaN(i) || Double.isNaN(j))
			throw new IllegalArgumentException("is this a joke to you ("+i+","+j+")");

		int i0 = (int) Math.floor(i), j0 = (int) Math.floor(j);
		double ci0 = 1 - (i - i0);
		double cj0 = 1 - (j - j0);
		double value = 0;
		for (int di = 0; di <= 1; di ++)
			if (i0 + di >= 0 && i0 + di < values.length)
				for (int dj = 0; dj <= 1; dj ++)
					if (j0 + dj >= 0 && j0 + dj < values[i0 + di].length)
						value += values[i0 + di][j0 + dj] *
						         Math.abs(ci0 - di) *
						         Math.abs(cj0 - dj);
		return value;
	}

	/**
	 * index a 2D array with non-integers using bicubic (Catmull-Rom) interpolation.  like
	 * {@link #interp(double[][], double, double)}, everything outside the array is 0.  unlike
	 * it, this can overshoot, so the result may be negative even if all the values are positive.
	 * @param values the values at the specified integer indices
	 * @param i the partial index along the first axis
	 * @param j the partial index along the following axis
	 * @return the interpolated value
	 */
	public static double interpCubic(double[][] values, double i, double j) {
		if (Double.isNaN(i) || Double.isNaN(j))
			throw new IllegalArgumentException("is this a joke to you ("+i+","+j+")");

		int i0 = (int) Math.floor(i), j0 = (int) Math.floor(j);
		double value = 0;
		for (int di = -1; di <= 2; di ++) {
			if (i0 + di < 0 || i0 + di >= values.length)
				continue;
			double wi = cubic(i - (i0 + di));
			if (wi == 0)
				continue;
			double[] row = values[i0 + di];
			for (int dj = -1; dj <= 2; dj ++)
				if (j0 + dj >= 0 && j0 + dj < row.length)
					value += row[j0 + dj]*wi*cubic(j - (j0 + dj));
		}
		return value;
	}

	/**
	 * the cubic convolution weight for a sample at the given distance
	 */
	private static double cubic(double x) {
		x = Math.abs(x);
		if (x >= 2)
			return 0;
		double xx = x*x;
		if (x < 1)
			return (CUBIC_SHARPNESS + 2)*xx*x - (CUBIC_SHARPNESS + 3)*xx + 1;
		else
			return CUBIC_SHARPNESS*xx*x - 5*CUBIC_SHARPNESS*xx + 8*CUBIC_SHARPNESS*x - 4*CUBIC_SHARPNESS;
	}
}
