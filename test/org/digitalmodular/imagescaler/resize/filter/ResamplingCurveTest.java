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

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class ResamplingCurveTest {
	private static final ResamplingCurve[] CURVES = {
			LinearResamplingCurve.INSTANCE, CubicResamplingCurve.INSTANCE, LanczosResamplingCurve.INSTANCE};

	@Test
	void testRadii() {
		assertEquals(1, LinearResamplingCurve.INSTANCE.getRadius());
		assertEquals(2, CubicResamplingCurve.INSTANCE.getRadius());
		assertEquals(3, LanczosResamplingCurve.INSTANCE.getRadius());
		assertEquals(3, LanczosResamplingCurve.INSTANCE.getLobes());
	}

	@Test
	void testInterpolating() {
		for (ResamplingCurve curve : CURVES) {
			assertEquals(1, curve.apply(0), 1e-12);

			for (int x = 1; x <= curve.getRadius() + 1; x++) {
				assertEquals(0, curve.apply(x), 1e-12, curve.getClass().getSimpleName() + " at " + x);
				assertEquals(0, curve.apply(-x), 1e-12, curve.getClass().getSimpleName() + " at " + -x);
			}
		}
	}

	@Test
	void testSymmetric() {
		for (ResamplingCurve curve : CURVES)
			for (double x = 0; x < 4; x += 0.125)
				assertEquals(curve.apply(x), curve.apply(-x), 1e-15);
	}

	@Test
	void testLinear() {
		assertEquals(0.5, LinearResamplingCurve.INSTANCE.apply(0.5), 1e-12);
		assertEquals(0.75, LinearResamplingCurve.INSTANCE.apply(-0.25), 1e-12);
	}

	@Test
	void testCatmullRom() {
		assertEquals(-0.5, CubicResamplingCurve.A);
		assertEquals(0.5625, CubicResamplingCurve.INSTANCE.apply(0.5), 1e-12);
		assertEquals(-0.0625, CubicResamplingCurve.INSTANCE.apply(1.5), 1e-12);
	}

	@Test
	void testLanczosHasNegativeLobe() {
		assertTrue(LanczosResamplingCurve.INSTANCE.apply(1.5) < 0);
		assertEquals(0, LanczosResamplingCurve.INSTANCE.apply(3.5));
		assertThrows(IllegalArgumentException.class, () -> new LanczosResamplingCurve(0));
	}
}
