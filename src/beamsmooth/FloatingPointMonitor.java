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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * a per-thread register of IEEE floating-point exception flags.  the JVM doesn't expose the
 * hardware status word, so the numerical routines here report into this register themselves
 * whenever they produce (or would produce) an exceptional value.  an operation opens a
 * {@link Scope}, which clears the flags and installs its own reporting modes; closing the scope
 * puts back whatever the caller had before.
 *
 * @author Justin Kunimune
 */
public class FloatingPointMonitor {

	public enum Flag {
		UNDERFLOW, OVERFLOW, INVALID, DIVIDE_BY_ZERO
	}

	public enum Mode {
		IGNORE, RAISE
	}

	private static final ThreadLocal<State> state = ThreadLocal.withInitial(State::new);

	private FloatingPointMonitor() {}

	/**
	 * clear the flags and start recording, with underflow ignored and everything else raised.
	 */
	public static Scope enter() {
		Map<Flag, Mode> modes = new EnumMap<>(Flag.class);
		for (Flag flag: Flag.values())
			modes.put(flag, Mode.RAISE);
		modes.put(Flag.UNDERFLOW, Mode.IGNORE);
		return new Scope(modes);
	}

	/**
	 * record that an exception of the given class happened on this thread
	 */
	public static void raise(Flag flag) {
		state.get().raised.add(flag);
	}

	/**
	 * look at a value that came out of some arithmetic and record the appropriate flag if it
	 * isn't finite.
	 */
	public static void inspect(double value) {
		if (Double.isNaN(value))
			raise(Flag.INVALID);
		else if (Double.isInfinite(value))
			raise(Flag.OVERFLOW);
	}

	/**
	 * narrow a double to single precision, recording overflow if it was finite but isn't anymore
	 * and underflow if it was nonzero but lost its normal representation.
	 */
	public static float narrow(double value) {
		float result = (float) value;
		if (Double.isFinite(value) && Float.isInfinite(result))
			raise(Flag.OVERFLOW);
		else if (value != 0 && Math.abs(result) < Float.MIN_NORMAL)
			raise(Flag.UNDERFLOW);
		return result;
	}

	/**
	 * divide two numbers, recording division by zero if the denominator is zero and the
	 * numerator isn't, or an invalid operation if both are.
	 */
	public static double divide(double numerator, double denominator) {
		if (denominator == 0)
			raise((numerator == 0 || Double.isNaN(numerator)) ? Flag.INVALID : Flag.DIVIDE_BY_ZERO);
		return numerator/denominator;
	}

	/**
	 * the flags raised on this thread since the current scope was entered
	 */
	public static Set<Flag> flags() {
		return EnumSet.copyOf(state.get().raised);
	}

	public static Mode mode(Flag flag) {
		return state.get().modes.get(flag);
	}

	/**
	 * the flags and modes in effect on one thread.  outside of any scope, nothing raises.
	 */
	private static class State {
		private final Set<Flag> raised = EnumSet.noneOf(Flag.class);
		private final Map<Flag, Mode> modes = new EnumMap<>(Flag.class);

		private State() {
			for (Flag flag: Flag.values())
				modes.put(flag, Mode.IGNORE);
		}
	}

	/**
	 * a stretch of computation during which the flags are being collected.  use it in a
	 * try-with-resources block; call {@link #check()} once the work is done.
	 */
	public static class Scope implements AutoCloseable {
		private final Set<Flag> savedFlags;
		private final Map<Flag, Mode> savedModes;
		private boolean closed = false;

		private Scope(Map<Flag, Mode> modes) {
			State current = state.get();
			this.savedFlags = EnumSet.copyOf(current.raised);
			this.savedModes = new EnumMap<>(current.modes);
			current.raised.clear();
			current.modes.putAll(modes);
		}

		/**
		 * throw if any flag whose mode is RAISE has been set in this scope
		 * @throws NumericException naming the offending flags
		 */
		public void check() {
			State current = state.get();
			Set<Flag> fatal = EnumSet.noneOf(Flag.class);
			for (Flag flag: current.raised)
				if (current.modes.get(flag) == Mode.RAISE)
					fatal.add(flag);
			if (!fatal.isEmpty())
				throw new NumericException(fatal);
		}

		@Override
		public void close() {
			if (closed)
				return;
			State current = state.get();
			current.raised.clear();
			current.raised.addAll(savedFlags);
			current.modes.clear();
			current.modes.putAll(savedModes);
			closed = true;
		}
	}
}
