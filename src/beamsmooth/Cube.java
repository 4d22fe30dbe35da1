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

import java.util.Arrays;

/**
 * a read-only view of a 2D image or a 3D spectral cube.  either way the values are stored as
 * [channel][row][column]; an image is just a cube with one channel that remembers it has
 * rank 2.  the arrays passed in are not copied, but nothing here ever writes to them.
 *
 * @author Justin Kunimune
 */
public class Cube {

	private final double[][][] planes;
	private final int rank;

	private Cube(double[][][] planes, int rank) {
		if (planes.length == 0 || planes[0].length == 0 || planes[0][0].length == 0)
			throw new DimensionalityException("the array can't have any empty axes");
		for (double[][] plane: planes) {
			if (plane.length != planes[0].length)
				throw new IllegalArgumentException("all channels must have the same number of rows");
			for (double[] row: plane)
				if (row.length != planes[0][0].length)
					throw new IllegalArgumentException("all rows must have the same length");
		}
		this.planes = planes;
		this.rank = rank;
	}

	public static Cube of(double[][] image) {
		return new Cube(new double[][][] {image}, 2);
	}

	public static Cube of(double[][][] cube) {
		return new Cube(cube, 3);
	}

	/**
	 * wrap a flat C-contiguous array
	 * @param values the values, with the last axis varying fastest
	 * @param shape the axis lengths, slowest first: (rows, columns) or (channels, rows, columns)
	 * @throws DimensionalityException if the shape has anything other than 2 or 3 axes
	 */
	public static Cube of(double[] values, int... shape) {
		if (shape.length < 2 || shape.length > 3)
			throw new DimensionalityException(
					"only 2D and 3D arrays can be smoothed, not "+shape.length+"D");
		int nk = (shape.length == 3) ? shape[0] : 1;
		int ni = shape[shape.length - 2], nj = shape[shape.length - 1];
		if ((long) nk*ni*nj != values.length)
			throw new IllegalArgumentException(String.format(
					"the shape %s doesn't match the %d values given", Arrays.toString(shape), values.length));
		double[][][] planes = new double[nk][ni][nj];
		for (int k = 0; k < nk; k ++)
			for (int i = 0; i < ni; i ++)
				System.arraycopy(values, (k*ni + i)*nj, planes[k][i], 0, nj);
		return new Cube(planes, shape.length);
	}

	public int rank() {
		return rank;
	}

	public int channels() {
		return planes.length;
	}

	public int rows() {
		return planes[0].length;
	}

	public int columns() {
		return planes[0][0].length;
	}

	public long size() {
		return (long) channels()*rows()*columns();
	}

	public double get(int k, int i, int j) {
		return planes[k][i][j];
	}

	/**
	 * a fresh copy of the values, which the caller is free to change
	 */
	public double[][][] copyValues() {
		return Math2.deepCopy(planes);
	}

	public String toString() {
		if (rank == 2)
			return String.format("Cube(%d×%d)", rows(), columns());
		else
			return String.format("Cube(%d×%d×%d)", channels(), rows(), columns());
	}
}
