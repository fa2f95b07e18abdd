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
 * Keys' cubic convolution curve with {@code a = -0.5}, otherwise known as Catmull-Rom. Applied on both axes this is
 * bicubic interpolation over a 4×4 neighborhood. Radius = 2. Slight overshoot on hard edges.
 * <p>
 * For the family of curves and the meaning of {@code a}, see
 * <a href="http://entropymine.com/imageworsener/bicubic">entropymine.com/imageworsener/bicubic</a>.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public final class CubicResamplingCurve implements ResamplingCurve {
	public static final double A = -0.5;

	public static final CubicResamplingCurve INSTANCE = new CubicResamplingCurve();

	private CubicResamplingCurve() {
	}

	@Override
	public double getRadius() { return 2; }

	@Override
	public double apply(double x) {
		double t = Math.abs(x);
		if (t >= 2)
			return 0;

		double tt = t * t;
		if (t < 1)
			return ((A + 2) * t - (A + 3)) * tt + 1;

		return ((t - 5) * t + 8) * t * A - 4 * A;
	}
}
