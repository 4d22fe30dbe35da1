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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DeconvolutionTest {

	@Test
	void circularBeamsSubtractInQuadrature() {
		ResidualKernel kernel = Deconvolution.deconvolve(Beam.circular(10), Beam.circular(5));
		assertThat(kernel.isFeasible()).isTrue();
		assertThat(kernel.beam().major).isCloseTo(Math.sqrt(75), within(1e-9));
		assertThat(kernel.beam().minor).isCloseTo(Math.sqrt(75), within(1e-9));
		assertThat(kernel.beam().pa).isCloseTo(0, within(1e-12));
	}

	@Test
	void equalBeamsAreInfeasible() {
		Beam beam = new Beam(7, 4, 25);
		assertThat(Deconvolution.deconvolve(beam, beam).isFeasible()).isFalse();
	}

	@Test
	void smallerTargetIsInfeasible() {
		assertThat(Deconvolution.deconvolve(Beam.circular(4), Beam.circular(5)).isFeasible()).isFalse();
	}

	@Test
	void targetNoBiggerAlongOneAxisIsInfeasible() {
		ResidualKernel kernel = Deconvolution.deconvolve(new Beam(10, 5, 0), Beam.circular(5));
		assertThat(kernel.isFeasible()).isFalse();
	}

	@Test
	void strictlyBiggerTargetIsFeasible() {
		assertThat(Deconvolution.deconvolve(new Beam(5.01, 5.01, 0), Beam.circular(5)).isFeasible()).isTrue();
	}

	@Test
	void ellipticalKernelFollowsTheTargetOrientation() {
		ResidualKernel kernel = Deconvolution.deconvolve(new Beam(10, 6, 90), Beam.circular(2));
		assertThat(kernel.isFeasible()).isTrue();
		assertThat(kernel.beam().major).isCloseTo(Math.sqrt(96), within(1e-9));
		assertThat(kernel.beam().minor).isCloseTo(Math.sqrt(32), within(1e-9));
		assertThat(Math.abs(kernel.beam().pa)).isCloseTo(90, within(1e-6));
	}

	@Test
	void squaredWidthsAreAdditive() {
		Beam target = new Beam(12, 8, 30);
		Beam original = new Beam(5, 3, 10);
		Beam kernel = Deconvolution.deconvolve(target, original).beam();
		double expected = target.major*target.major + target.minor*target.minor -
		                  original.major*original.major - original.minor*original.minor;
		assertThat(kernel.major*kernel.major + kernel.minor*kernel.minor).isCloseTo(expected, within(1e-9));
	}

	@Test
	void infeasibleKernelHasNoShape() {
		ResidualKernel kernel = ResidualKernel.infeasible();
		assertThatThrownBy(kernel::beam)
				.isInstanceOf(IllegalStateException.class);
	}
}
