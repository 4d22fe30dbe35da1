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
import java.util.logging.Logger;

/**
 * methods to turn a gaussian described by its widths and orientation into a normalized raster
 * that can be convolved with an image.
 *
 * @author Justin Kunimune
 */
public class KernelSynthesizer {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * how to resample the kernel when rotating it
	 */
	public enum Interpolation {
		LINEAR, CUBIC
	}

	private KernelSynthesizer() {}

	/**
	 * decide how many pixels across a kernel should be.  it covers the given number of FWHMs
	 * of its major axis (rounded up to a whole pixel), is always odd so that it has a center
	 * pixel, and never exceeds any of the given axis lengths less a pixel of margin.
	 * @param fwhm the FWHM of the kernel's major axis in pixels
	 * @param widthInFwhms how many FWHMs the footprint should span (normally 6)
	 * @param axisLengths the lengths of the axes the kernel will be swept over
	 * @return the side length of the kernel
	 * @throws DimensionalityException if there's no room for even one pixel
	 */
	public static int footprint(double fwhm, double widthInFwhms, int... axisLengths) {
		if (!(fwhm > 0) || Double.isInfinite(fwhm))
			throw new IllegalArgumentException("the kernel FWHM must be positive and finite, not "+fwhm);
		long side = (long) Math.ceil(Math.ceil(fwhm)*widthInFwhms);
		if (side%2 == 0)
			side ++; // (with the default width of 6 this is always just the +1)
		for (int length: axisLengths)
			side = Math.min(side, (length/2)*2 - 1);
		if (side <= 0)
			throw new DimensionalityException(String.format(
					"a kernel of FWHM %.3g pixels doesn't fit in axes of length %s",
					fwhm, Arrays.toString(axisLengths)));
		return (int) side;
	}

	/**
	 * rasterize an elliptical gaussian.  the kernel's first index is the row (increasing toward
	 * the top of the image, which is north when the grid isn't rotated) and its second index
	 * is the column (increasing toward the west).  the gaussian is first laid out with its major
	 * axis pointing north, and then turned counterclockwise by the position angle about the
	 * center pixel, taking the major axis from north toward east.  any negative values the
	 * rotation introduces are clipped, and the result is normalized to sum to 1.
	 * @param kernel the shape of the gaussian, with widths in pixels and the position angle in
	 *               degrees relative to the pixel grid
	 * @param size the side length of the raster (see {@link #footprint})
	 * @param interpolation the resampling used for the rotation
	 * @return a size×size array that sums to 1
	 */
	public static double[][] synthesize(Beam kernel, int size, Interpolation interpolation) {
		if (size <= 0 || size%2 == 0)
			throw new DimensionalityException("the kernel size must be odd and positive, not "+size);
		int c = size/2;
		double σ_major = kernel.major*Beam.FWHM_TO_SIGMA;
		double σ_minor = kernel.minor*Beam.FWHM_TO_SIGMA;

		double[][] upright = new double[size][size];
		for (int i = 0; i < size; i ++) {
			double y = (i - c)/σ_major;
			for (int j = 0; j < size; j ++) {
				double x = (j - c)/σ_minor;
				upright[i][j] = Math.exp(-(x*x + y*y)/2);
			}
		}

		double[][] rotated = rotate(upright, kernel.pa, interpolation);

		for (double[] row: rotated)
			for (int j = 0; j < size; j ++)
				if (row[j] < 0)
					row[j] = 0;

		double total = Math2.sum(rotated);
		for (double[] row: rotated) {
			for (int j = 0; j < size; j ++) {
				row[j] = FloatingPointMonitor.divide(row[j], total);
				FloatingPointMonitor.inspect(row[j]);
			}
		}
		logger.fine(String.format("synthesized a %d×%d kernel for %s", size, size, kernel));
		return rotated;
	}

	/**
	 * turn a square raster counterclockwise about its center pixel, filling in with zeros
	 * wherever the source doesn't reach.
	 * @param input a square array with odd side length
	 * @param angle the rotation in degrees
	 * @param interpolation how to sample between pixels
	 */
	static double[][] rotate(double[][] input, double angle, Interpolation interpolation) {
		int size = input.length;
		double[][] output = new double[size][size];
		double c = (size - 1)/2.;
		double θ = Math.toRadians(angle);
		double cos = Math.cos(θ), sin = Math.sin(θ);
		for (int i = 0; i < size; i ++) {
			double y = i - c;
			for (int j = 0; j < size; j ++) {
				double x = j - c;
				// the inverse rotation tells us where in the input this pixel comes from
				double xSource = x*cos + y*sin;
				double ySource = -x*sin + y*cos;
				if (interpolation == Interpolation.CUBIC)
					output[i][j] = Math2.interpCubic(input, c + ySource, c + xSource);
				else
					output[i][j] = Math2.interp(input, c + ySource, c + xSource);
			}
		}
		return output;
	}

	/**
	 * sample a normalized one-dimensional gaussian.
	 * @param fwhm the full width at half maximum, in samples
	 * @param size the length of the kernel (see {@link #footprint})
	 * @return an array of length size that sums to 1
	 */
	public static double[] gaussian(double fwhm, int size) {
		if (size <= 0 || size%2 == 0)
			throw new DimensionalityException("the kernel size must be odd and positive, not "+size);
		double σ = fwhm*Beam.FWHM_TO_SIGMA;
		int c = size/2;
		double[] kernel = new double[size];
		for (int i = 0; i < size; i ++)
			kernel[i] = Math.exp(-Math.pow((i - c)/σ, 2)/2);
		double total = Math2.sum(kernel);
		for (int i = 0; i < size; i ++)
			kernel[i] = FloatingPointMonitor.divide(kernel[i], total);
		return kernel;
	}
}
