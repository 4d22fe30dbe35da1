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

import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * corrects the brightness of smoothed data for the change in beam area.
 *
 * @author Justin Kunimune
 */
public class FluxRescaler {

	private static final Logger logger = Logger.getLogger("root");

	private static final Pattern PER_BEAM_UNIT = Pattern.compile("(/beam|beam\\^?-1)");
	private static final Pattern PER_PIXEL_UNIT = Pattern.compile("(/\\s*pix(el)?|pix(el)?\\^?-1)", Pattern.CASE_INSENSITIVE);

	/**
	 * the surface brightness conventions that need different corrections
	 */
	public enum Convention {
		PER_BEAM, PER_PIXEL, OTHER;

		/**
		 * guess the convention from a unit string like "Jy/beam" or "K"
		 */
		public static Convention of(String unit) {
			String normalized = unit.toLowerCase(Locale.ROOT).replaceAll("\\s", "");
			if (PER_BEAM_UNIT.matcher(normalized).find())
				return PER_BEAM;
			else if (PER_PIXEL_UNIT.matcher(normalized).find())
				return PER_PIXEL;
			else
				return OTHER;
		}
	}

	private FluxRescaler() {}

	/**
	 * decide how much to multiply the smoothed data by, and what its unit should be afterward.
	 * data per beam gets the ratio of the beam areas; data per pixel gets the new beam area in
	 * pixels, and becomes data per beam; anything else gets the explicit scale, or 1.
	 * @param unit the brightness unit of the input
	 * @param target the beam the data is being smoothed to
	 * @param original the beam the data had
	 * @param pixelScale the angular size of a pixel
	 * @param explicitScale a scale the caller asked for, or NaN if they didn't
	 */
	public static Rescale plan(String unit, Beam target, Beam original, double pixelScale,
	                           double explicitScale) {
		if (!Double.isNaN(explicitScale))
			return new Rescale(explicitScale, unit, Convention.OTHER);
		Convention convention = Convention.of(unit);
		switch (convention) {
			case PER_BEAM:
				return new Rescale(
						FloatingPointMonitor.divide(target.axisProduct(), original.axisProduct()),
						unit, convention);
			case PER_PIXEL:
				return new Rescale(target.areaInPixels(pixelScale), perBeam(unit), convention);
			default:
				return new Rescale(1.0, unit, convention);
		}
	}

	/**
	 * change a per-pixel unit string to the equivalent per-beam one
	 */
	static String perBeam(String unit) {
		Matcher matcher = PER_PIXEL_UNIT.matcher(unit);
		if (!matcher.find())
			return unit;
		String match = matcher.group();
		String replacement = match.startsWith("/") ? "/beam" : match.replaceFirst("(?i)pix(el)?", "beam");
		return unit.substring(0, matcher.start()) + replacement + unit.substring(matcher.end());
	}

	/**
	 * multiply every value by the factor and narrow the result to single precision
	 */
	public static float[][][] apply(double[][][] data, double factor) {
		FloatingPointMonitor.inspect(factor);
		logger.info(String.format("rescaling the data by %.6g", factor));
		float[][][] output = new float[data.length][][];
		for (int k = 0; k < data.length; k ++) {
			output[k] = new float[data[k].length][];
			for (int i = 0; i < data[k].length; i ++) {
				output[k][i] = new float[data[k][i].length];
				for (int j = 0; j < data[k][i].length; j ++)
					output[k][i][j] = FloatingPointMonitor.narrow(data[k][i][j]*factor);
			}
		}
		return output;
	}

	/**
	 * a brightness correction: the factor to apply and the unit that results
	 */
	public static class Rescale {
		public final double factor;
		public final String unit;
		public final Convention convention;

		public Rescale(double factor, String unit, Convention convention) {
			this.factor = factor;
			this.unit = unit;
			this.convention = convention;
		}

		public String toString() {
			return String.format("×%.6g (%s, now %s)", factor, convention, unit);
		}
	}
}
