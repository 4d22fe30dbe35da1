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
 * brings an image or spectral cube from its native resolution to a coarser one, by convolving
 * it with whatever gaussian takes its beam to the target beam, and optionally smoothing it
 * along the velocity axis too.
 *
 * @author Justin Kunimune
 */
public class Smoother {

	private static final Logger logger = Logger.getLogger("root");

	private final KernelResolver kernelResolver;
	private final SmoothingOptions options;

	/**
	 * a smoother that reads the native beam from the header, subtracts beams as gaussians, and
	 * takes its options from smoothing.properties
	 */
	public Smoother() {
		this(BeamLookup.FROM_HEADER, Deconvolution.GAUSSIAN, SmoothingOptions.load());
	}

	public Smoother(SmoothingOptions options) {
		this(BeamLookup.FROM_HEADER, Deconvolution.GAUSSIAN, options);
	}

	/**
	 * @param lookup how to find the native beam when the caller doesn't give it
	 * @param resolver how to find the residual kernel between two beams
	 * @param options how to go about the convolution
	 */
	public Smoother(BeamLookup lookup, BeamResolver resolver, SmoothingOptions options) {
		if (options == null)
			throw new IllegalArgumentException("the options can't be null");
		this.kernelResolver = new KernelResolver(lookup, resolver);
		this.options = options;
	}

	/**
	 * smooth spatially, getting the native beam from the metadata.
	 * @see #smooth(Cube, Header, BeamSpec, BeamSpec, Cube, double)
	 */
	public SmoothingResult smooth(Cube data, Header header, BeamSpec target) {
		return smooth(data, header, target, BeamSpec.unspecified(), null, 0);
	}

	/**
	 * smooth spatially, with no mask and no velocity smoothing.
	 * @see #smooth(Cube, Header, BeamSpec, BeamSpec, Cube, double)
	 */
	public SmoothingResult smooth(Cube data, Header header, BeamSpec target, BeamSpec original) {
		return smooth(data, header, target, original, null, 0);
	}

	/**
	 * convolve the data so that its beam becomes the target beam.  the input is never modified.
	 * @param data a 2D image or a 3D cube whose last two axes are spatial
	 * @param header the metadata describing data
	 * @param target the beam to smooth to
	 * @param original the beam the data has now (or how to find it)
	 * @param mask null, or an array whose nonzero elements mark samples to leave out
	 * @param velocityFwhm the FWHM of the gaussian to smooth each spectrum with, in the same
	 *                     units as the header's channel width; 0 for no velocity smoothing
	 * @return the smoothed data, the updated header, and whether smoothing was possible
	 * @throws DimensionalityException if the data is not 2D or 3D, or too small for any kernel
	 * @throws NumericException if the arithmetic overflowed or went invalid somewhere
	 */
	public SmoothingResult smooth(Cube data, Header header, BeamSpec target, BeamSpec original,
	                              Cube mask, double velocityFwhm) {
		checkShape(data, header);
		if (!(velocityFwhm >= 0) || Double.isInfinite(velocityFwhm))
			throw new IllegalArgumentException("the velocity FWHM must be finite and nonnegative, not "+velocityFwhm);

		try (FloatingPointMonitor.Scope scope = FloatingPointMonitor.enter()) {
			KernelResolver.Resolution resolution = kernelResolver.resolve(
					target, original, header, options.kernelWidth());
			MissingDataGuard guard = MissingDataGuard.of(data, mask);
			double[][][] working = guard.neutralize(data);

			if (!resolution.isFeasible()) {
				float[][][] output = narrow(working);
				guard.restore(output, options.preserveZeros());
				Header newHeader = header
						.withExtrema(Math2.nanmin(output), Math2.nanmax(output))
						.withHistory(String.format("not smoothed: %s can't be reached from %s",
						                           resolution.target, resolution.original));
				scope.check();
				return new SmoothingResult(output, data.rank(), newHeader, resolution, null);
			}

			double[][] kernel = KernelSynthesizer.synthesize(
					resolution.kernelInPixels, resolution.size, options.interpolation());

			Convolution.Method method = options.method();
			if (method == Convolution.Method.AUTO)
				method = Convolution.choose((long) resolution.size*resolution.size, data.size(),
				                            options.parallelism(), options.efficiency());
			int threads = (options.parallelism() >= options.directMinThreads()) ? options.parallelism() : 1;
			logger.info(String.format("convolving %s with a %d×%d kernel using %s",
			                          data, resolution.size, resolution.size, method));
			double[][][] smoothed = Convolution.convolvePlanes(working, kernel, method, threads);

			if (velocityFwhm > 0) {
				if (data.rank() == 2)
					logger.warning("a velocity FWHM was given for a 2D image; it will be ignored");
				else
					smoothVelocity(smoothed, header, velocityFwhm);
			}

			for (int k = 0; k < smoothed.length; k ++)
				for (int i = 0; i < smoothed[k].length; i ++)
					for (int j = 0; j < smoothed[k][i].length; j ++)
						if (!guard.isExcluded(k, i, j))
							FloatingPointMonitor.inspect(smoothed[k][i][j]);

			FluxRescaler.Rescale rescale = FluxRescaler.plan(
					header.unit(), resolution.target, resolution.original,
					header.pixelScale(), options.fluxScale());
			float[][][] output = FluxRescaler.apply(smoothed, rescale.factor);
			guard.restore(output, options.preserveZeros());

			Header newHeader = header
					.withBeam(resolution.target)
					.withUnit(rescale.unit)
					.withExtrema(Math2.nanmin(output), Math2.nanmax(output))
					.withHistory(String.format("smoothed from %s to %s with a %s kernel; flux scaled %s",
					                           resolution.original, resolution.target,
					                           resolution.residual.beam(), rescale));
			if (velocityFwhm > 0 && data.rank() == 3)
				newHeader = newHeader.withHistory(String.format(
						"smoothed along the velocity axis with FWHM %.4g", velocityFwhm));
			scope.check();
			return new SmoothingResult(output, data.rank(), newHeader, resolution, method);
		}
	}

	/**
	 * convolve each spectrum of a cube with a gaussian.
	 * @param cube the cube, which is modified in place
	 * @param header its metadata, for the channel width
	 * @param velocityFwhm the FWHM in velocity units
	 */
	private void smoothVelocity(double[][][] cube, Header header, double velocityFwhm) {
		double channelWidth = Math.abs(header.channelWidth());
		if (!(channelWidth > 0) || Double.isInfinite(channelWidth))
			throw new IllegalArgumentException(
					"velocity smoothing needs a channel width, not "+header.channelWidth());
		double fwhm = velocityFwhm/channelWidth;
		int size = KernelSynthesizer.footprint(fwhm, options.kernelWidth(), cube.length);
		double[] kernel = KernelSynthesizer.gaussian(fwhm, size);
		int count = Convolution.convolveSpectra(cube, kernel);
		logger.info(String.format("smoothed %d spectra with a %d-channel kernel (FWHM %.3g channels)",
		                          count, size, fwhm));
	}

	/**
	 * make sure the data and the metadata agree about the array's shape
	 */
	private static void checkShape(Cube data, Header header) {
		if (data.rank() != 2 && data.rank() != 3)
			throw new DimensionalityException("only 2D and 3D arrays can be smoothed, not "+data.rank()+"D");
		if (header.rank() != data.rank())
			throw new DimensionalityException(String.format(
					"the header describes %d axes but the data has %d", header.rank(), data.rank()));
		if (header.naxis(1) != data.columns() || header.naxis(2) != data.rows() ||
				(data.rank() == 3 && header.naxis(3) != data.channels()))
			throw new IllegalArgumentException(String.format(
					"the header %s doesn't match the data %s", header, data));
	}

	/**
	 * convert the working data to single precision without changing it otherwise, recording
	 * overflow for any value too big to survive the conversion
	 */
	private static float[][][] narrow(double[][][] working) {
		float[][][] output = new float[working.length][][];
		for (int k = 0; k < working.length; k ++) {
			output[k] = new float[working[k].length][];
			for (int i = 0; i < working[k].length; i ++) {
				output[k][i] = new float[working[k][i].length];
				for (int j = 0; j < working[k][i].length; j ++)
					output[k][i][j] = FloatingPointMonitor.narrow(working[k][i][j]);
			}
		}
		return output;
	}
}
