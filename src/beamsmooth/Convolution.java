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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * methods to convolve images and cubes with kernels, either directly or by way of the FFT.
 *
 * @author Justin Kunimune
 */
public class Convolution {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * how to do a spatial convolution
	 */
	public enum Method {
		/** pick whichever of the other two should be faster */
		AUTO,
		/** sum up the kernel taps around each pixel */
		DIRECT,
		/** multiply in the frequency domain */
		FFT
	}

	private Convolution() {}

	/**
	 * guess which convolution method will be faster.  direct convolution costs about the
	 * kernel size per pixel, split among however many cores are doing it; the FFT costs about
	 * the log of the image size per pixel.
	 * @param kernelPixels the total number of pixels in the kernel
	 * @param totalPixels the total number of pixels in the data
	 * @param parallelism the number of cores available
	 * @param efficiency the fraction of those cores that will actually help
	 * @return FFT if the kernel is big enuff to make it worth it, DIRECT otherwise
	 */
	public static Method choose(long kernelPixels, long totalPixels, int parallelism, double efficiency) {
		double kernelCost = Math.sqrt(kernelPixels)/(parallelism*efficiency);
		double imageCost = Math.sqrt(8*Math.log(totalPixels)/Math.log(2));
		return (kernelCost > imageCost) ? Method.FFT : Method.DIRECT;
	}

	/**
	 * convolve every plane of a cube with the same 2D kernel.  channels never mix.
	 * @param planes the data, indexed [channel][row][column]
	 * @param kernel the normalized kernel, with odd dimensions
	 * @param method DIRECT or FFT
	 * @param threads how many threads direct convolution should use (1 to stay on this one)
	 * @return a new cube of the same shape
	 */
	public static double[][][] convolvePlanes(double[][][] planes, double[][] kernel,
	                                          Method method, int threads) {
		if (method == Method.AUTO)
			throw new IllegalArgumentException("choose a method before convolving");
		double[][][] output = new double[planes.length][][];
		if (method == Method.FFT) {
			output = Fourier.convolve(planes, kernel);
			logger.fine(String.format("convolved %d channels in the frequency domain", planes.length));
		}
		else {
			double[][] flipped = Math2.flip(kernel);
			ExecutorService pool = (threads > 1) ? Executors.newFixedThreadPool(threads) : null;
			try {
				for (int k = 0; k < planes.length; k ++) {
					output[k] = direct(planes[k], flipped, pool, threads);
					logger.fine(String.format("convolved channel %d/%d", k + 1, planes.length));
				}
			} finally {
				if (pool != null)
					pool.shutdown();
			}
		}
		return output;
	}

	/**
	 * do an equal 2D convolution of an image with a kernel by sweeping the kernel over it.
	 * kernel taps that fall off the edge of the image contribute nothing.
	 * @param image the image to be convolved
	 * @param flipped the kernel, already rotated 180° (so that this is really a correlation)
	 * @param pool the threads to spread the rows over, or null to do it all on this thread
	 * @param threads the number of threads in the pool
	 * @return the convolved image
	 */
	static double[][] direct(double[][] image, double[][] flipped, ExecutorService pool, int threads) {
		int n = image.length, m = image[0].length;
		double[][] output = new double[n][m];
		if (pool == null || threads <= 1 || n < 2) {
			correlateRows(image, flipped, output, 0, n);
			return output;
		}

		List<Callable<Void>> tasks = new ArrayList<>();
		int rowsPerTask = Math.max(1, (n + threads - 1)/threads);
		for (int start = 0; start < n; start += rowsPerTask) {
			final int from = start, to = Math.min(n, start + rowsPerTask); // each task gets its own rows
			tasks.add(() -> {
				correlateRows(image, flipped, output, from, to);
				return null;
			});
		}
		try {
			for (Future<Void> future: pool.invokeAll(tasks))
				future.get();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(ex);
		} catch (ExecutionException ex) {
			throw new RuntimeException("a convolution thread failed", ex.getCause());
		}
		return output;
	}

	/**
	 * fill in rows [from, to) of the output with the correlation of the image and kernel
	 */
	private static void correlateRows(double[][] image, double[][] kernel, double[][] output,
	                                  int from, int to) {
		int n = image.length, m = image[0].length;
		int ci = kernel.length/2, cj = kernel[0].length/2;
		for (int i = from; i < to; i ++) {
			for (int j = 0; j < m; j ++) {
				double sum = 0;
				for (int k = Math.max(0, ci - i); k < kernel.length && i + k - ci < n; k ++) {
					double[] imageRow = image[i + k - ci];
					double[] kernelRow = kernel[k];
					for (int l = Math.max(0, cj - j); l < kernelRow.length && j + l - cj < m; l ++)
						sum += imageRow[j + l - cj]*kernelRow[l];
				}
				output[i][j] = sum;
			}
		}
	}

	/**
	 * convolve every spectrum in a cube with a 1D kernel along the channel axis, reflecting the
	 * spectrum at its ends.  spectra with no nonzero values are left alone.
	 * @param cube the data, indexed [channel][row][column]; it is modified in place
	 * @param kernel the normalized kernel, with odd length
	 * @return the number of spectra that were actually convolved
	 */
	public static int convolveSpectra(double[][][] cube, double[] kernel) {
		int nChannels = cube.length;
		int c = kernel.length/2;
		double[] spectrum = new double[nChannels];
		int count = 0;
		for (int i = 0; i < cube[0].length; i ++) {
			for (int j = 0; j < cube[0][i].length; j ++) {
				for (int k = 0; k < nChannels; k ++)
					spectrum[k] = cube[k][i][j];
				if (Math2.all_zero(spectrum))
					continue;
				for (int k = 0; k < nChannels; k ++) {
					double sum = 0;
					for (int t = 0; t < kernel.length; t ++)
						sum += spectrum[Math2.reflect(k - (t - c), nChannels)]*kernel[t];
					cube[k][i][j] = sum;
				}
				count ++;
			}
		}
		return count;
	}
}
