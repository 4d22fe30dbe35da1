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
 * the ways a caller can describe a beam: not at all, as a single circular width, as a full
 * ellipse, or as an explicit request to look it up from the image metadata.
 *
 * @author Justin Kunimune
 */
public abstract class BeamSpec {

	private BeamSpec() {}

	public static BeamSpec unspecified() {
		return Unspecified.INSTANCE;
	}

	public static BeamSpec isotropic(double size) {
		return new Isotropic(size);
	}

	public static BeamSpec elliptical(double major, double minor, double pa) {
		return new Elliptical(new Beam(major, minor, pa));
	}

	public static BeamSpec of(Beam beam) {
		return new Elliptical(beam);
	}

	public static BeamSpec resolveFromMetadata() {
		return ResolveFromMetadata.INSTANCE;
	}

	/**
	 * the beam this spec names directly, or null if it must be found some other way
	 */
	public abstract Beam explicitBeam();

	/**
	 * nothing was given; use the metadata beam if there is one, or look it up if there isn't
	 */
	public static class Unspecified extends BeamSpec {
		private static final Unspecified INSTANCE = new Unspecified();

		@Override
		public Beam explicitBeam() {
			return null;
		}

		public String toString() {
			return "unspecified";
		}
	}

	/**
	 * a circular beam with a single width and no position angle
	 */
	public static class Isotropic extends BeamSpec {
		public final double size;

		public Isotropic(double size) {
			if (!(size > 0))
				throw new IllegalArgumentException("the beam size must be positive, not "+size);
			this.size = size;
		}

		@Override
		public Beam explicitBeam() {
			return Beam.circular(size);
		}

		public String toString() {
			return String.format("%.4g", size);
		}
	}

	/**
	 * a fully specified elliptical beam
	 */
	public static class Elliptical extends BeamSpec {
		public final Beam beam;

		public Elliptical(Beam beam) {
			if (beam == null)
				throw new IllegalArgumentException("the beam may not be null");
			this.beam = beam;
		}

		@Override
		public Beam explicitBeam() {
			return beam;
		}

		public String toString() {
			return beam.toString();
		}
	}

	/**
	 * always ask the external beam lookup, even if the metadata already carries a beam
	 */
	public static class ResolveFromMetadata extends BeamSpec {
		private static final ResolveFromMetadata INSTANCE = new ResolveFromMetadata();

		@Override
		public Beam explicitBeam() {
			return null;
		}

		public String toString() {
			return "from metadata";
		}
	}
}
