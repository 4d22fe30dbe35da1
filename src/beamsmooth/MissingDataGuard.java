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

import java.util.logging.Logger;

/**
 * keeps track of which samples of a cube are missing or masked out, so that they can be
 * replaced with zeros for the convolution and put back as missing afterward.  zero here is just
 * the neutral fill for the convolution; a missing neighbor slightly dilutes the pixels around it.
 *
 * @author Justin Kunimune
 */
public class MissingDataGuard {

	private static final Logger logger = Logger.getLogger("root");

	/** the value that marks a missing sample in the output */
	public static final float MISSING = Float.NaN;

	private final boolean[][][] excluded;
	private final boolean[][][] zero;
	private final int numExcluded;

	private MissingDataGuard(boolean[][][] excluded, boolean[][][] zero, int numExcluded) {
		this.excluded = excluded;
		this.zero = zero;
		this.numExcluded = numExcluded;
	}

	/**
	 * work out which samples to exclude: every non-finite one, and every one where the mask is
	 * nonzero.
	 * @param data the input
	 * @param mask null, or a cube of the same shape as data, or a 2D image with the same spatial
	 *             shape as data (in which case it applies to every channel)
	 */
	public static MissingDataGuard of(Cube data, Cube mask) {
		if (mask != null) {
			if (mask.rows() != data.rows() || mask.columns() != data.columns())
				throw new IllegalArgumentException(String.format(
						"the mask %s doesn't match the data %s", mask, data));
			if (mask.rank() == 3 && mask.channels() != data.channels())
				throw new IllegalArgumentException(String.format(
						"the mask %s doesn't match the data %s", mask, data));
		}
		int nk = data.channels(), ni = data.rows(), nj = data.columns();
		boolean[][][] excluded = new boolean[nk][ni][nj];
		boolean[][][] zero = new boolean[nk][ni][nj];
		int count = 0;
		for (int k = 0; k < nk; k ++) {
			int kMask = (mask != null && mask.rank() == 3) ? k : 0;
			for (int i = 0; i < ni; i ++) {
				for (int j = 0; j < nj; j ++) {
					double value = data.get(k, i, j);
					zero[k][i][j] = value == 0;
					excluded[k][i][j] = !Double.isFinite(value) ||
					                    (mask != null && mask.get(kMask, i, j) != 0);
					if (excluded[k][i][j])
						count ++;
				}
			}
		}
		logger.fine(String.format("excluding %d of %d samples", count, data.size()));
		return new MissingDataGuard(excluded, zero, count);
	}

	/**
	 * a working copy of the data with every excluded sample set to 0
	 */
	public double[][][] neutralize(Cube data) {
		double[][][] working = data.copyValues();
		for (int k = 0; k < working.length; k ++)
			for (int i = 0; i < working[k].length; i ++)
				for (int j = 0; j < working[k][i].length; j ++)
					if (excluded[k][i][j])
						working[k][i][j] = 0;
		return working;
	}

	/**
	 * mark every excluded sample of the output as missing, overwriting whatever the convolution
	 * put there.  if preserveZeros is set, samples that were exactly zero in the input are then
	 * set back to zero, even if that undoes the previous step.
	 * @param output the finished output, which is modified in place
	 * @param preserveZeros whether to force the input's zeros back to zero
	 */
	public void restore(float[][][] output, boolean preserveZeros) {
		for (int k = 0; k < output.length; k ++) {
			for (int i = 0; i < output[k].length; i ++) {
				for (int j = 0; j < output[k][i].length; j ++) {
					if (excluded[k][i][j])
						output[k][i][j] = MISSING;
					if (preserveZeros && zero[k][i][j])
						output[k][i][j] = 0;
				}
			}
		}
	}

	public boolean isExcluded(int k, int i, int j) {
		return excluded[k][i][j];
	}

	public int numExcluded() {
		return numExcluded;
	}
}
