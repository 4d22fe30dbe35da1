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

class KernelResolverTest {

	private static final Beam HEADER_BEAM = Beam.circular(5);
	private static final Beam LOOKED_UP_BEAM = Beam.circular(3);

	private final KernelResolver resolver = new KernelResolver(header -> LOOKED_UP_BEAM, Deconvolution.GAUSSIAN);
	private final KernelResolver headerResolver = new KernelResolver(BeamLookup.FROM_HEADER, Deconvolution.GAUSSIAN);

	private static Header header(Beam beam, double rotation) {
		return new Header(64, 48, -0.5, rotation, "Jy/beam", beam);
	}

	@Test
	void unspecifiedOriginalGoesToTheLookup() {
		assertThat(resolver.originalBeam(BeamSpec.unspecified(), header(HEADER_BEAM, 0))).isEqualTo(LOOKED_UP_BEAM);
		assertThat(resolver.originalBeam(null, header(HEADER_BEAM, 0))).isEqualTo(LOOKED_UP_BEAM);
		assertThat(resolver.originalBeam(BeamSpec.unspecified(), header(null, 0))).isEqualTo(LOOKED_UP_BEAM);
	}

	@Test
	void defaultLookupReadsTheHeader() {
		assertThat(headerResolver.originalBeam(BeamSpec.unspecified(), header(HEADER_BEAM, 0))).isEqualTo(HEADER_BEAM);
	}

	@Test
	void lookedUpBeamDecidesFeasibility() {
		// the header's beam is bigger than the target, but the lookup's isn't
		KernelResolver.Resolution resolution = resolver.resolve(
				BeamSpec.isotropic(4), BeamSpec.unspecified(), header(HEADER_BEAM, 0), 6);
		assertThat(resolution.original).isEqualTo(LOOKED_UP_BEAM);
		assertThat(resolution.isFeasible()).isTrue();
		assertThat(resolution.residual.beam().major).isCloseTo(Math.sqrt(16 - 9), within(1e-9));
	}

	@Test
	void resolvingFromMetadataAlwaysUsesTheLookup() {
		assertThat(resolver.originalBeam(BeamSpec.resolveFromMetadata(), header(HEADER_BEAM, 0)))
				.isEqualTo(LOOKED_UP_BEAM);
	}

	@Test
	void explicitOriginalIsTakenAtItsWord() {
		assertThat(resolver.originalBeam(BeamSpec.isotropic(4), header(HEADER_BEAM, 0))).isEqualTo(Beam.circular(4));
		assertThat(resolver.originalBeam(BeamSpec.elliptical(4, 2, 15), header(HEADER_BEAM, 0)))
				.isEqualTo(new Beam(4, 2, 15));
	}

	@Test
	void headerLookupFailsWithoutABeam() {
		assertThatThrownBy(() -> BeamLookup.FROM_HEADER.lookup(header(null, 0)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void targetMustBeGiven() {
		assertThatThrownBy(() -> resolver.targetBeam(BeamSpec.unspecified()))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> resolver.targetBeam(BeamSpec.resolveFromMetadata()))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> BeamSpec.isotropic(-1))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void kernelIsConvertedToPixelsAndRotatedOntoTheGrid() {
		KernelResolver.Resolution resolution = headerResolver.resolve(
				BeamSpec.elliptical(12, 8, 20), BeamSpec.unspecified(), header(HEADER_BEAM, 30), 6);
		assertThat(resolution.isFeasible()).isTrue();
		Beam residual = resolution.residual.beam();
		assertThat(residual.major).isCloseTo(Math.sqrt(144 - 25), within(1e-9));
		assertThat(residual.minor).isCloseTo(Math.sqrt(64 - 25), within(1e-9));
		assertThat(resolution.kernelInPixels.major).isCloseTo(residual.major/0.5, within(1e-9));
		assertThat(resolution.kernelInPixels.minor).isCloseTo(residual.minor/0.5, within(1e-9));
		assertThat(resolution.kernelInPixels.pa).isCloseTo(residual.pa + 30, within(1e-9));
		assertThat(resolution.size).isEqualTo(47);
	}

	@Test
	void infeasibleTargetHasNoKernel() {
		KernelResolver.Resolution resolution = headerResolver.resolve(
				BeamSpec.isotropic(4), BeamSpec.unspecified(), header(HEADER_BEAM, 0), 6);
		assertThat(resolution.isFeasible()).isFalse();
		assertThat(resolution.kernelInPixels).isNull();
		assertThat(resolution.size).isEqualTo(0);
	}
}
