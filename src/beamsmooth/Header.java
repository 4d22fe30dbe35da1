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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * the metadata that goes with an image or cube.  axis lengths are given in storage order
 * reversed, the way astronomers number them: axis 1 is the fastest-varying (columns), axis 2 is
 * the rows, and axis 3 (if present) is the spectral channels.  instances are immutable; the
 * with* methods return modified copies.
 *
 * @author Justin Kunimune
 */
public class Header {

	private final int[] axes;
	private final double cdelt1; // angular size of a pixel along axis 1; pixels are square
	private final double rotation; // rotation of the pixel grid from standard orientation (°)
	private final double channelWidth; // velocity width of one channel (NaN for images)
	private final String unit;
	private final Beam beam; // may be null if the metadata doesn't say
	private final double dataMin;
	private final double dataMax;
	private final List<String> history;

	/**
	 * describe a 2D image
	 */
	public Header(int naxis1, int naxis2, double cdelt1, double rotation,
	              String unit, Beam beam) {
		this(new int[] {naxis1, naxis2}, cdelt1, rotation, Double.NaN, unit, beam,
		     Double.NaN, Double.NaN, Collections.emptyList());
	}

	/**
	 * describe a 3D spectral cube
	 */
	public Header(int naxis1, int naxis2, int naxis3, double cdelt1,
	              double rotation, double channelWidth, String unit, Beam beam) {
		this(new int[] {naxis1, naxis2, naxis3}, cdelt1, rotation, channelWidth, unit, beam,
		     Double.NaN, Double.NaN, Collections.emptyList());
	}

	private Header(int[] axes, double cdelt1, double rotation,
	               double channelWidth, String unit, Beam beam,
	               double dataMin, double dataMax, List<String> history) {
		if (axes.length < 2 || axes.length > 3)
			throw new DimensionalityException("metadata must describe 2 or 3 axes, not "+axes.length);
		for (int n: axes)
			if (n <= 0)
				throw new IllegalArgumentException("axis lengths must be positive: "+Arrays.toString(axes));
		if (!(cdelt1 != 0) || !Double.isFinite(cdelt1))
			throw new IllegalArgumentException("the pixel scale must be finite and nonzero, not "+cdelt1);
		this.axes = axes.clone();
		this.cdelt1 = cdelt1;
		this.rotation = rotation;
		this.channelWidth = channelWidth;
		this.unit = (unit == null) ? "" : unit;
		this.beam = beam;
		this.dataMin = dataMin;
		this.dataMax = dataMax;
		this.history = Collections.unmodifiableList(new ArrayList<>(history));
	}

	public int rank() {
		return axes.length;
	}

	/**
	 * the length of an axis, numbered from 1
	 */
	public int naxis(int i) {
		if (i < 1 || i > axes.length)
			throw new IndexOutOfBoundsException("there is no axis "+i+" in a "+axes.length+"D header");
		return axes[i - 1];
	}

	/**
	 * the angular size of a pixel.  pixels are assumed square, so this comes from the first axis.
	 */
	public double pixelScale() {
		return Math.abs(cdelt1);
	}

	public double rotation() {
		return rotation;
	}

	public double channelWidth() {
		return channelWidth;
	}

	public String unit() {
		return unit;
	}

	public Beam beam() {
		return beam;
	}

	public double dataMin() {
		return dataMin;
	}

	public double dataMax() {
		return dataMax;
	}

	public List<String> history() {
		return history;
	}

	public Header withBeam(Beam beam) {
		return new Header(axes, cdelt1, rotation, channelWidth, unit, beam,
		                  dataMin, dataMax, history);
	}

	public Header withUnit(String unit) {
		return new Header(axes, cdelt1, rotation, channelWidth, unit, beam,
		                  dataMin, dataMax, history);
	}

	public Header withExtrema(double dataMin, double dataMax) {
		return new Header(axes, cdelt1, rotation, channelWidth, unit, beam,
		                  dataMin, dataMax, history);
	}

	public Header withHistory(String entry) {
		List<String> longer = new ArrayList<>(history);
		longer.add(entry);
		return new Header(axes, cdelt1, rotation, channelWidth, unit, beam,
		                  dataMin, dataMax, longer);
	}

	public String toString() {
		return String.format("Header(%s, scale=%.4g, rotation=%.1f°, unit=%s, beam=%s)",
		                     Arrays.toString(axes), pixelScale(), rotation, unit, beam);
	}
}
