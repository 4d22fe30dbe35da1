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
 * the gaussian that turns one beam into another, or the news that there isn't one.
 *
 * @author Justin Kunimune
 */
public class ResidualKernel {

	private final Beam beam;
	private final boolean feasible;

	private ResidualKernel(Beam beam, boolean feasible) {
		this.beam = beam;
		this.feasible = feasible;
	}

	public static ResidualKernel feasible(Beam beam) {
		if (!(beam.minor > 0))
			throw new IllegalArgumentException("a feasible kernel needs a nonzero size, not "+beam);
		return new ResidualKernel(beam, true);
	}

	public static ResidualKernel infeasible() {
		return new ResidualKernel(null, false);
	}

	/**
	 * the kernel's shape, in the same units as the beams it came from
	 * @throws IllegalStateException if there is no such kernel
	 */
	public Beam beam() {
		if (!feasible)
			throw new IllegalStateException("there is no residual kernel for an infeasible target");
		return beam;
	}

	public boolean isFeasible() {
		return feasible;
	}

	public String toString() {
		return feasible ? "ResidualKernel"+beam : "ResidualKernel(infeasible)";
	}
}
