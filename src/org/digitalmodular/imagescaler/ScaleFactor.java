/*
 * This file is part of ImageScaler.
 *
 * Copyleft 2025 Mark Jeronimus. All Rights Reversed.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ImageScaler. If not, see <http://www.gnu.org/licenses/>.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package org.digitalmodular.imagescaler;

import java.util.Locale;

/**
 * A uniform scale factor on a fixed grid of 5% steps, from 5% up to 300%.
 * <p>
 * The factor is stored as an integer number of ticks ({@code factor = tick * 0.05}) so stepping up and down any
 * number of times never accumulates rounding errors. Instances are interned, so they can be compared with
 * {@code ==}.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public final class ScaleFactor implements Comparable<ScaleFactor> {
	public static final int PERCENT_PER_TICK = 5;
	public static final int MIN_TICK         = 1;
	public static final int MAX_TICK         = 60;
	public static final int UNITY_TICK       = 100 / PERCENT_PER_TICK;

	private static final ScaleFactor[] INSTANCES = new ScaleFactor[MAX_TICK + 1];

	static {
		for (int tick = MIN_TICK; tick <= MAX_TICK; tick++)
			INSTANCES[tick] = new ScaleFactor(tick);
	}

	/** 5% */
	public static final ScaleFactor MIN   = INSTANCES[MIN_TICK];
	/** 300% */
	public static final ScaleFactor MAX   = INSTANCES[MAX_TICK];
	/** 100% */
	public static final ScaleFactor UNITY = INSTANCES[UNITY_TICK];

	private final int tick;

	private ScaleFactor(int tick) {
		this.tick = tick;
	}

	public static ScaleFactor ofTick(int tick) {
		if (tick < MIN_TICK || tick > MAX_TICK)
			throw new IllegalArgumentException("tick must be in [" + MIN_TICK + ", " + MAX_TICK + "]: " + tick);

		return INSTANCES[tick];
	}

	/**
	 * Returns the scale factor with the specified percentage.
	 *
	 * @throws IllegalArgumentException when the percentage is not a multiple of 5 between 5 and 300
	 */
	public static ScaleFactor ofPercent(int percent) {
		if (percent % PERCENT_PER_TICK != 0)
			throw new IllegalArgumentException("percent must be a multiple of " + PERCENT_PER_TICK + ": " + percent);

		return ofTick(percent / PERCENT_PER_TICK);
	}

	public int getTick()       { return tick; }

	public int getPercent()    { return tick * PERCENT_PER_TICK; }

	public double getFactor()  { return getPercent() / 100.0; }

	public boolean isMin()     { return tick == MIN_TICK; }

	public boolean isMax()     { return tick == MAX_TICK; }

	/**
	 * Returns {@code true} when the factor is strictly greater than 1.
	 */
	public boolean isUpscale() { return tick > UNITY_TICK; }

	/**
	 * Returns the next larger factor, or this factor when already at the maximum.
	 */
	public ScaleFactor next() {
		return INSTANCES[Math.min(tick + 1, MAX_TICK)];
	}

	/**
	 * Returns the next smaller factor, or this factor when already at the minimum.
	 */
	public ScaleFactor previous() {
		return INSTANCES[Math.max(tick - 1, MIN_TICK)];
	}

	/**
	 * Scales a length in pixels, rounding half up, to a minimum of 1. The result can exceed the range of
	 * {@code int}.
	 */
	public long scaleLength(int length) {
		if (length <= 0)
			throw new IllegalArgumentException("length must be positive: " + length);

		// round(length * tick / 20) without floating point
		long scaled = ((long)length * tick + UNITY_TICK / 2) / UNITY_TICK;
		return Math.max(1, scaled);
	}

	@Override
	public int compareTo(ScaleFactor other) {
		return Integer.compare(tick, other.tick);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ScaleFactor)) return false;

		return tick == ((ScaleFactor)o).tick;
	}

	@Override
	public int hashCode() {
		return tick;
	}

	/**
	 * Returns the factor with two decimals, like {@code "1.05x"}.
	 */
	@Override
	public String toString() {
		int percent = getPercent();
		return String.format(Locale.ROOT, "%d.%02dx", percent / 100, percent % 100);
	}
}
