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

package org.digitalmodular.imagescaler.resize.filter;

/**
 * Windowed sinc curve, {@code sinc(x) * sinc(x / lobes)}. Radius = number of lobes. Under- and overshoot on hard
 * edges, increasing with the number of lobes.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public final class LanczosResamplingCurve implements ResamplingCurve {
	/** Three lobes, 6×6 neighborhood when applied on both axes. */
	public static final LanczosResamplingCurve INSTANCE = new LanczosResamplingCurve(3);

	private final int lobes;

	public LanczosResamplingCurve(int lobes) {
		if (lobes < 1)
			throw new IllegalArgumentException("lobes must be at least 1: " + lobes);

		this.lobes = lobes;
	}

	public int getLobes() { return lobes; }

	@Override
	public double getRadius() { return lobes; }

	@Override
	public double apply(double x) {
		double t = Math.abs(x);
		if (t >= lobes)
			return 0;
		if (t == 0)
			return 1;

		double px = Math.PI * t;
		return sinc(px) * sinc(px / lobes);
	}

	private static double sinc(double px) {
		return Math.sin(px) / px;
	}
}
