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
 * subtraction of one elliptical gaussian beam from another, which is to say, finding the
 * gaussian that you'd have to convolve with the first to get the second.  gaussians add in
 * quadrature under convolution, so this is done by working with the second-moment tensors of
 * the two beams and taking their difference.
 *
 * @author Justin Kunimune
 */
public class Deconvolution {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * the default way to resolve a target/original beam pair
	 */
	public static final BeamResolver GAUSSIAN = Deconvolution::deconvolve;

	private Deconvolution() {}

	/**
	 * find the gaussian that, convolved with the original beam, yields the target beam.  if the
	 * target is not strictly bigger than the original along every direction, there is no such
	 * gaussian, and an infeasible kernel is returned.
	 * @param target the beam to reach
	 * @param original the beam the data currently has
	 * @return the residual kernel, whose widths are in the same units as the inputs and whose
	 *         position angle is in degrees
	 */
	public static ResidualKernel deconvolve(Beam target, Beam original) {
		double maj1 = target.major, min1 = target.minor, pa1 = Math.toRadians(target.pa);
		double maj2 = original.major, min2 = original.minor, pa2 = Math.toRadians(original.pa);

		// the components of the difference of the two covariance tensors (times 8ln2)
		double α = Math.pow(maj1*Math.cos(pa1), 2) + Math.pow(min1*Math.sin(pa1), 2) -
		           Math.pow(maj2*Math.cos(pa2), 2) - Math.pow(min2*Math.sin(pa2), 2);
		double β = Math.pow(maj1*Math.sin(pa1), 2) + Math.pow(min1*Math.cos(pa1), 2) -
		           Math.pow(maj2*Math.sin(pa2), 2) - Math.pow(min2*Math.cos(pa2), 2);
		double γ = 2*((min1*min1 - maj1*maj1)*Math.sin(pa1)*Math.cos(pa1) -
		              (min2*min2 - maj2*maj2)*Math.sin(pa2)*Math.cos(pa2));
		double s = α + β;
		double t = Math.hypot(α - β, γ);

		if (α < 0 || β < 0 || s < t) {
			logger.fine(String.format("%s can't be reached from %s", target, original));
			return ResidualKernel.infeasible();
		}

		double major = Math.sqrt((s + t)/2);
		double minor = Math.sqrt((s - t)/2);
		// round-off can leave a sliver where the two beams are really equal along some axis
		double limit = 1e-12*Math.max(maj1*maj1, maj2*maj2);
		if ((s - t)/2 <= limit) {
			logger.fine(String.format("%s is no bigger than %s along its minor axis", target, original));
			return ResidualKernel.infeasible();
		}

		double pa;
		if (Math.abs(γ) + Math.abs(α - β) == 0)
			pa = 0;
		else
			pa = Math.toDegrees(Math.atan2(-γ, α - β)/2);

		return ResidualKernel.feasible(new Beam(major, minor, pa));
	}
}
