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
 * works out which gaussian has to be convolved with an image to bring it from its native beam
 * to the one the caller asked for, and what that gaussian looks like on the pixel grid.
 *
 * @author Justin Kunimune
 */
public class KernelResolver {

	private static final Logger logger = Logger.getLogger("root");

	private final BeamLookup lookup;
	private final BeamResolver resolver;

	/**
	 * @param lookup how to find the native beam when the caller doesn't give it
	 * @param resolver how to subtract one beam from another
	 */
	public KernelResolver(BeamLookup lookup, BeamResolver resolver) {
		if (lookup == null || resolver == null)
			throw new IllegalArgumentException("the lookup and resolver can't be null");
		this.lookup = lookup;
		this.resolver = resolver;
	}

	/**
	 * the beam the caller wants.  unlike the original beam, this has to be given explicitly.
	 */
	public Beam targetBeam(BeamSpec target) {
		Beam beam = (target == null) ? null : target.explicitBeam();
		if (beam == null)
			throw new IllegalArgumentException("a target beam must be given, not "+target);
		return beam;
	}

	/**
	 * the beam the data has now.  an explicit beam is taken at its word; anything else goes to the
	 * lookup, which normally reads it from the metadata.
	 */
	public Beam originalBeam(BeamSpec original, Header header) {
		if (original == null)
			original = BeamSpec.unspecified();
		Beam explicit = original.explicitBeam();
		if (explicit != null)
			return explicit;
		else
			return lookup.lookup(header);
	}

	/**
	 * figure out the kernel
	 * @param target the beam the caller wants
	 * @param original the beam the data has now
	 * @param header the image metadata, for the pixel scale, grid rotation, and axis lengths
	 * @param widthInFwhms how many FWHMs the kernel footprint should span
	 * @return everything there is to know about the kernel
	 */
	public Resolution resolve(BeamSpec target, BeamSpec original, Header header, double widthInFwhms) {
		Beam targetBeam = targetBeam(target);
		Beam originalBeam = originalBeam(original, header);
		ResidualKernel residual = resolver.resolve(targetBeam, originalBeam);
		if (!residual.isFeasible()) {
			logger.warning(String.format("the target beam %s is not larger than the original beam %s; " +
			                             "the data will not be smoothed", targetBeam, originalBeam));
			return new Resolution(targetBeam, originalBeam, residual, null, 0);
		}

		// the kernel must be drawn on the pixel grid, not the sky
		Beam inPixels = residual.beam().inPixels(header.pixelScale()).rotatedBy(header.rotation());
		int size = KernelSynthesizer.footprint(
				inPixels.major, widthInFwhms, header.naxis(1), header.naxis(2));
		logger.info(String.format("convolving %s with %s to get %s (a %d×%d kernel of %s pixels)",
		                          originalBeam, residual.beam(), targetBeam, size, size, inPixels));
		return new Resolution(targetBeam, originalBeam, residual, inPixels, size);
	}

	/**
	 * the outcome of resolving a beam pair against a particular pixel grid
	 */
	public static class Resolution {
		public final Beam target;
		public final Beam original;
		public final ResidualKernel residual;
		/** the kernel shape in pixels, relative to the grid; null if infeasible */
		public final Beam kernelInPixels;
		/** the side length of the kernel raster; 0 if infeasible */
		public final int size;

		Resolution(Beam target, Beam original, ResidualKernel residual, Beam kernelInPixels, int size) {
			this.target = target;
			this.original = original;
			this.residual = residual;
			this.kernelInPixels = kernelInPixels;
			this.size = size;
		}

		public boolean isFeasible() {
			return residual.isFeasible();
		}
	}
}
