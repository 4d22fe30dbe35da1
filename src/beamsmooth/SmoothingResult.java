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
 * what comes out of a smoothing operation: the data, its updated metadata, and whether the
 * smoothing actually happened.
 *
 * @author Justin Kunimune
 */
public class SmoothingResult {

	private final float[][][] data;
	private final int rank;
	private final Header header;
	private final KernelResolver.Resolution resolution;
	private final Convolution.Method method;

	SmoothingResult(float[][][] data, int rank, Header header,
	                KernelResolver.Resolution resolution, Convolution.Method method) {
		this.data = data;
		this.rank = rank;
		this.header = header;
		this.resolution = resolution;
		this.method = method;
	}

	/**
	 * whether the target beam could be reached.  if not, the data is the input with its
	 * missing and masked samples marked, but otherwise untouched.
	 */
	public boolean isFeasible() {
		return resolution.isFeasible();
	}

	/**
	 * the output as a 2D image
	 * @throws IllegalStateException if the input was a cube
	 */
	public float[][] image() {
		if (rank != 2)
			throw new IllegalStateException("this result is a "+rank+"D cube, not an image");
		return data[0];
	}

	/**
	 * the output indexed [channel][row][column]; an image has a single channel
	 */
	public float[][][] cube() {
		return data;
	}

	public int rank() {
		return rank;
	}

	public Header header() {
		return header;
	}

	public KernelResolver.Resolution resolution() {
		return resolution;
	}

	/**
	 * the convolution method that was used, or null if nothing was convolved
	 */
	public Convolution.Method method() {
		return method;
	}
}
