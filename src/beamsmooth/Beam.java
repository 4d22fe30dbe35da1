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
 * an elliptical gaussian point-spread function, described by the full widths at half maximum
 * of its two principal axes and the position angle of its major axis.  the widths are in
 * whatever angular unit the pixel scale uses; the position angle is in degrees, measured
 * from north thru east.
 *
 * @author Justin Kunimune
 */
public class Beam {

	/**
	 * the ratio between the full width at half maximum and the standard deviation of a gaussian
	 */
	public static final double FWHM_TO_SIGMA = 1/Math.sqrt(8*Math.log(2));

	public final double major;
	public final double minor;
	public final double pa;

	public Beam(double major, double minor, double pa) {
		if (!Double.isFinite(major) || !Double.isFinite(minor) || !Double.isFinite(pa))
			throw new IllegalArgumentException("beam parameters must be finite: ("+major+", "+minor+", "+pa+")");
		if (major < 0 || minor < 0)
			throw new IllegalArgumentException("beam widths can't be negative: ("+major+", "+minor+")");
		if (minor > major)
			throw new IllegalArgumentException(String.format(
					"the minor axis (%.4g) is bigger than the major axis (%.4g)", minor, major));
		this.major = major;
		this.minor = minor;
		this.pa = pa;
	}

	/**
	 * a circular beam with the given width
	 */
	public static Beam circular(double fwhm) {
		return new Beam(fwhm, fwhm, 0);
	}

	/**
	 * the product of the two axes, which is proportional to the solid angle the beam covers
	 */
	public double axisProduct() {
		return major*minor;
	}

	/**
	 * the solid angle of the beam, measured in square pixels
	 * @param pixelScale the angular size of one pixel
	 */
	public double areaInPixels(double pixelScale) {
		return Math.abs(major*minor/(pixelScale*pixelScale)*2*Math.PI/(8*Math.log(2)));
	}

	/**
	 * convert this beam's widths to pixel units, leaving the position angle alone.
	 */
	public Beam inPixels(double pixelScale) {
		return new Beam(major/pixelScale, minor/pixelScale, pa);
	}

	/**
	 * the same beam, with its position angle measured relative to a grid that is rotated by the
	 * given angle.
	 */
	public Beam rotatedBy(double angle) {
		return new Beam(major, minor, pa + angle);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Beam))
			return false;
		Beam that = (Beam) o;
		return this.major == that.major && this.minor == that.minor && this.pa == that.pa;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(major) + 31*Double.hashCode(minor) + 961*Double.hashCode(pa);
	}

	@Override
	public String toString() {
		return String.format("(%.4g, %.4g, %.1f°)", major, minor, pa);
	}
}
