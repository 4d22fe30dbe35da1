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

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConvolutionTest {

	private static double max(double[][] arr) {
		double max = Double.NEGATIVE_INFINITY;
		for (double[] row: arr)
			for (double value: row)
				max = Math.max(max, value);
		return max;
	}

	private static double[][][] randomCube(int channels, int rows, int columns, long seed) {
		Random random = new Random(seed);
		double[][][] cube = new double[channels][rows][columns];
		for (double[][] plane: cube)
			for (double[] row: plane)
				for (int j = 0; j < columns; j ++)
					row[j] = random.nextDouble()*10 - 2;
		return cube;
	}

	private static void assertClose(double[][][] actual, double[][][] expected, double tolerance) {
		assertThat(actual.length).isEqualTo(expected.length);
		for (int k = 0; k < expected.length; k ++)
			for (int i = 0; i < expected[k].length; i ++)
				for (int j = 0; j < expected[k][i].length; j ++)
					assertThat(actual[k][i][j]).as("element (%d, %d, %d)", k, i, j)
							.isCloseTo(expected[k][i][j], within(tolerance));
	}

	@Test
	void directAndFourierAgreeForASmallKernel() {
		double[][][] cube = randomCube(2, 23, 17, 0);
		double[][] kernel = KernelSynthesizer.synthesize(new Beam(1.5, 1, 20), 5, KernelSynthesizer.Interpolation.LINEAR);
		double[][][] direct = Convolution.convolvePlanes(cube, kernel, Convolution.Method.DIRECT, 1);
		double[][][] fourier = Convolution.convolvePlanes(cube, kernel, Convolution.Method.FFT, 1);
		assertClose(fourier, direct, 1e-9);
	}

	@Test
	void directAndFourierAgreeForALargeKernel() {
		double[][][] cube = randomCube(1, 40, 36, 1);
		double[][] kernel = KernelSynthesizer.synthesize(new Beam(6, 3, -65), 31, KernelSynthesizer.Interpolation.CUBIC);
		double[][][] direct = Convolution.convolvePlanes(cube, kernel, Convolution.Method.DIRECT, 1);
		double[][][] fourier = Convolution.convolvePlanes(cube, kernel, Convolution.Method.FFT, 1);
		assertClose(fourier, direct, 1e-9);
	}

	@Test
	void threadedDirectConvolutionMatchesSingleThreaded() {
		double[][][] cube = randomCube(3, 29, 31, 2);
		double[][] kernel = KernelSynthesizer.synthesize(Beam.circular(2), 13, KernelSynthesizer.Interpolation.LINEAR);
		double[][][] serial = Convolution.convolvePlanes(cube, kernel, Convolution.Method.DIRECT, 1);
		double[][][] parallel = Convolution.convolvePlanes(cube, kernel, Convolution.Method.DIRECT, 4);
		assertClose(parallel, serial, 0);
	}

	@Test
	void kernelIsAppliedAsAConvolutionNotACorrelation() {
		double[][][] cube = randomCube(1, 9, 8, 3);
		double[][] shift = new double[3][3];
		shift[2][1] = 1; // one row below the center
		for (Convolution.Method method: new Convolution.Method[] {Convolution.Method.DIRECT, Convolution.Method.FFT}) {
			double[][] output = Convolution.convolvePlanes(cube, shift, method, 1)[0];
			for (int j = 0; j < 8; j ++)
				assertThat(output[0][j]).isCloseTo(0, within(1e-12));
			for (int i = 1; i < 9; i ++)
				for (int j = 0; j < 8; j ++)
					assertThat(output[i][j]).isCloseTo(cube[0][i - 1][j], within(1e-12));
		}
	}

	@Test
	void edgesAreZeroPadded() {
		double[][][] ones = new double[1][6][6];
		for (double[] row: ones[0])
			Arrays.fill(row, 1);
		double[][] box = new double[3][3];
		for (double[] row: box)
			Arrays.fill(row, 1/9.);
		double[][] output = Convolution.convolvePlanes(ones, box, Convolution.Method.DIRECT, 1)[0];
		assertThat(output[0][0]).isCloseTo(4/9., within(1e-12));
		assertThat(output[0][3]).isCloseTo(6/9., within(1e-12));
		assertThat(output[3][3]).isCloseTo(1, within(1e-12));
	}

	@Test
	void sharedKernelTransformGivesTheSameAnswerAsOnePlaneAtATime() {
		double[][][] cube = randomCube(3, 21, 26, 4);
		double[][] kernel = KernelSynthesizer.synthesize(new Beam(4, 2.5, 70), 19, KernelSynthesizer.Interpolation.LINEAR);
		double[][][] together = Fourier.convolve(cube, kernel);
		for (int k = 0; k < 3; k ++) {
			double[][][] alone = Fourier.convolve(new double[][][] {cube[k]}, kernel);
			assertClose(new double[][][] {together[k]}, alone, 0);
		}
	}

	@Test
	void planesOfDifferentShapesAreRejected() {
		double[][][] ragged = {new double[8][8], new double[8][9]};
		assertThatThrownBy(() -> Fourier.convolve(ragged, new double[][] {{1}}))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void channelsDontMix() {
		double[][][] cube = new double[3][10][10];
		cube[1][5][5] = 1;
		double[][] kernel = KernelSynthesizer.synthesize(Beam.circular(2), 7, KernelSynthesizer.Interpolation.LINEAR);
		for (Convolution.Method method: new Convolution.Method[] {Convolution.Method.DIRECT, Convolution.Method.FFT}) {
			double[][][] output = Convolution.convolvePlanes(cube, kernel, method, 1);
			assertThat(max(output[0])).isCloseTo(0, within(1e-12));
			assertThat(max(output[2])).isCloseTo(0, within(1e-12));
			assertThat(Math2.sum(output[1])).isCloseTo(1, within(1e-9));
		}
	}

	@Test
	void bigKernelsOnFewCoresGoToTheFourierDomain() {
		assertThat(Convolution.choose(55*55, 64*64, 1, 0.8)).isEqualTo(Convolution.Method.FFT);
		assertThat(Convolution.choose(55*55, 64*64, 16, 0.8)).isEqualTo(Convolution.Method.DIRECT);
		assertThat(Convolution.choose(5*5, 4096L*4096, 1, 0.8)).isEqualTo(Convolution.Method.DIRECT);
	}

	@Test
	void emptySpectraAreLeftAlone() {
		double[][][] cube = new double[7][2][2];
		for (int k = 0; k < 7; k ++)
			cube[k][0][0] = k;
		cube[3][1][1] = 1;
		double[] kernel = KernelSynthesizer.gaussian(2, 5);
		int count = Convolution.convolveSpectra(cube, kernel);
		assertThat(count).isEqualTo(2);
		for (int k = 0; k < 7; k ++) {
			assertThat(cube[k][0][1]).isEqualTo(0);
			assertThat(cube[k][1][0]).isEqualTo(0);
		}
		assertThat(cube[3][1][1]).isCloseTo(kernel[2], within(1e-15));
		assertThat(cube[2][1][1]).isCloseTo(kernel[1], within(1e-15));
	}

	@Test
	void spectraAreReflectedAtTheirEnds() {
		double[][][] cube = new double[6][1][1];
		for (int k = 0; k < 6; k ++)
			cube[k][0][0] = 3.5;
		Convolution.convolveSpectra(cube, KernelSynthesizer.gaussian(3, 5));
		for (int k = 0; k < 6; k ++)
			assertThat(cube[k][0][0]).isCloseTo(3.5, within(1e-12));
	}
}
