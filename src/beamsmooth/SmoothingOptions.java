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

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * the knobs that control how a smoothing operation is carried out, as opposed to what it
 * does.  every field has a sensible default; values can be overridden from a properties file
 * (see {@link #load()}) or one at a time with the with* methods.
 *
 * @author Justin Kunimune
 */
public class SmoothingOptions {

	private static final Logger logger = Logger.getLogger("root");

	public static final String RESOURCE = "smoothing.properties";

	/** how many cores the convolution routines are assumed to have */
	private final int parallelism;
	/** the fraction of those cores that is assumed to actually be useful */
	private final double efficiency;
	private final Convolution.Method method;
	private final KernelSynthesizer.Interpolation interpolation;
	/** the kernel footprint, in multiples of the kernel's (rounded up) major FWHM */
	private final double kernelWidth;
	/** below this many threads, direct convolution doesn't bother going parallel */
	private final int directMinThreads;
	private final boolean preserveZeros;
	/** an explicit flux scale, or NaN to work it out from the units */
	private final double fluxScale;

	public SmoothingOptions() {
		this(Runtime.getRuntime().availableProcessors(), 0.8, Convolution.Method.AUTO,
		     KernelSynthesizer.Interpolation.LINEAR, 6, 2, false, Double.NaN);
	}

	private SmoothingOptions(int parallelism, double efficiency, Convolution.Method method,
	                         KernelSynthesizer.Interpolation interpolation, double kernelWidth,
	                         int directMinThreads, boolean preserveZeros, double fluxScale) {
		if (parallelism < 1)
			throw new IllegalArgumentException("parallelism must be at least 1, not "+parallelism);
		if (!(efficiency > 0))
			throw new IllegalArgumentException("efficiency must be positive, not "+efficiency);
		if (!(kernelWidth > 0))
			throw new IllegalArgumentException("the kernel width must be positive, not "+kernelWidth);
		if (method == null || interpolation == null)
			throw new IllegalArgumentException("the method and interpolation can't be null");
		this.parallelism = parallelism;
		this.efficiency = efficiency;
		this.method = method;
		this.interpolation = interpolation;
		this.kernelWidth = kernelWidth;
		this.directMinThreads = directMinThreads;
		this.preserveZeros = preserveZeros;
		this.fluxScale = fluxScale;
	}

	/**
	 * the defaults, overridden by whatever is in smoothing.properties on the classpath
	 */
	public static SmoothingOptions load() {
		Properties properties = new Properties();
		try (InputStream in = SmoothingOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null)
				properties.load(in);
		} catch (IOException e) {
			throw new IllegalStateException("couldn't read "+RESOURCE, e);
		}
		return fromProperties(properties);
	}

	/**
	 * the defaults, overridden by any smooth.* keys in the given properties
	 */
	public static SmoothingOptions fromProperties(Properties properties) {
		SmoothingOptions defaults = new SmoothingOptions();
		String threads = properties.getProperty("smooth.parallelism", "").trim();
		SmoothingOptions options = new SmoothingOptions(
				threads.isEmpty() ? defaults.parallelism : Integer.parseInt(threads),
				Double.parseDouble(properties.getProperty("smooth.efficiency", "0.8")),
				Convolution.Method.valueOf(properties.getProperty(
						"smooth.method", "AUTO").trim().toUpperCase(Locale.ROOT)),
				KernelSynthesizer.Interpolation.valueOf(properties.getProperty(
						"smooth.interpolation", "LINEAR").trim().toUpperCase(Locale.ROOT)),
				Double.parseDouble(properties.getProperty("smooth.kernel.width", "6")),
				Integer.parseInt(properties.getProperty("smooth.direct.minThreads", "2").trim()),
				Boolean.parseBoolean(properties.getProperty("smooth.preserveZeros", "false").trim()),
				Double.parseDouble(properties.getProperty("smooth.fluxScale", "NaN")));
		logger.fine("loaded "+options);
		return options;
	}

	public int parallelism() {
		return parallelism;
	}

	public double efficiency() {
		return efficiency;
	}

	public Convolution.Method method() {
		return method;
	}

	public KernelSynthesizer.Interpolation interpolation() {
		return interpolation;
	}

	public double kernelWidth() {
		return kernelWidth;
	}

	public int directMinThreads() {
		return directMinThreads;
	}

	public boolean preserveZeros() {
		return preserveZeros;
	}

	public double fluxScale() {
		return fluxScale;
	}

	public boolean hasFluxScale() {
		return !Double.isNaN(fluxScale);
	}

	public SmoothingOptions withParallelism(int parallelism) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public SmoothingOptions withEfficiency(double efficiency) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public SmoothingOptions withMethod(Convolution.Method method) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public SmoothingOptions withInterpolation(KernelSynthesizer.Interpolation interpolation) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public SmoothingOptions withPreserveZeros(boolean preserveZeros) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public SmoothingOptions withFluxScale(double fluxScale) {
		return new SmoothingOptions(parallelism, efficiency, method, interpolation, kernelWidth,
		                            directMinThreads, preserveZeros, fluxScale);
	}

	public String toString() {
		return String.format("SmoothingOptions(threads=%d, efficiency=%.2f, method=%s, " +
		                     "interpolation=%s, width=%.1f, preserveZeros=%s, fluxScale=%s)",
		                     parallelism, efficiency, method, interpolation, kernelWidth,
		                     preserveZeros, hasFluxScale() ? fluxScale : "auto");
	}
}
