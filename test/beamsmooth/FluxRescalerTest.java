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
import static org.assertj.core.api.Assertions.within;

class FluxRescalerTest {

	@Test
	void conventionsAreRecognized() {
		assertThat(FluxRescaler.Convention.of("Jy/beam")).isEqualTo(FluxRescaler.Convention.PER_BEAM);
		assertThat(FluxRescaler.Convention.of("JY / BEAM")).isEqualTo(FluxRescaler.Convention.PER_BEAM);
		assertThat(FluxRescaler.Convention.of("mJy beam-1")).isEqualTo(FluxRescaler.Convention.PER_BEAM);
		assertThat(FluxRescaler.Convention.of("Jy/pixel")).isEqualTo(FluxRescaler.Convention.PER_PIXEL);
		assertThat(FluxRescaler.Convention.of("Jy/pix")).isEqualTo(FluxRescaler.Convention.PER_PIXEL);
		assertThat(FluxRescaler.Convention.of("K")).isEqualTo(FluxRescaler.Convention.OTHER);
		assertThat(FluxRescaler.Convention.of("")).isEqualTo(FluxRescaler.Convention.OTHER);
	}

	@Test
	void perBeamDataIsScaledByTheBeamAreaRatio() {
		FluxRescaler.Rescale rescale = FluxRescaler.plan(
				"Jy/beam", new Beam(10, 8, 0), new Beam(5, 4, 30), 1, Double.NaN);
		assertThat(rescale.factor).isCloseTo(4, within(1e-12));
		assertThat(rescale.unit).isEqualTo("Jy/beam");
	}

	@Test
	void perBeamScaleIsOneWhenTheBeamDoesntChange() {
		Beam beam = new Beam(6, 3, 12);
		assertThat(FluxRescaler.plan("Jy/beam", beam, beam, 1, Double.NaN).factor).isEqualTo(1);
	}

	@Test
	void perPixelDataBecomesPerBeam() {
		FluxRescaler.Rescale rescale = FluxRescaler.plan(
				"Jy/pixel", new Beam(4, 2, 0), Beam.circular(1), 0.5, Double.NaN);
		assertThat(rescale.factor).isCloseTo(4*2/0.25*2*Math.PI/(8*Math.log(2)), within(1e-9));
		assertThat(rescale.unit).isEqualTo("Jy/beam");
		assertThat(rescale.convention).isEqualTo(FluxRescaler.Convention.PER_PIXEL);
	}

	@Test
	void perPixelUnitsAreRewritten() {
		assertThat(FluxRescaler.perBeam("Jy/pix")).isEqualTo("Jy/beam");
		assertThat(FluxRescaler.perBeam("Jy / Pixel")).isEqualTo("Jy /beam");
		assertThat(FluxRescaler.perBeam("Jy pixel-1")).isEqualTo("Jy beam-1");
	}

	@Test
	void otherUnitsAreLeftAlone() {
		FluxRescaler.Rescale rescale = FluxRescaler.plan("K", Beam.circular(10), Beam.circular(5), 1, Double.NaN);
		assertThat(rescale.factor).isEqualTo(1);
		assertThat(rescale.unit).isEqualTo("K");
	}

	@Test
	void anExplicitScaleWins() {
		FluxRescaler.Rescale rescale = FluxRescaler.plan("Jy/beam", Beam.circular(10), Beam.circular(5), 1, 2.5);
		assertThat(rescale.factor).isEqualTo(2.5);
		assertThat(rescale.unit).isEqualTo("Jy/beam");
	}

	@Test
	void applyingScalesAndNarrows() {
		double[][][] data = {{{1, -2}, {0.1, 0}}};
		float[][][] output = FluxRescaler.apply(data, 3);
		assertThat(output[0][0]).containsExactly(3f, -6f);
		assertThat(output[0][1]).containsExactly((float) 0.30000000000000004, 0f);
	}
}
