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

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import org.digitalmodular.imagescaler.resize.ConvolutionResampler;
import org.digitalmodular.imagescaler.resize.ImageResampler;
import org.digitalmodular.imagescaler.resize.NearestNeighborResampler;
import org.digitalmodular.imagescaler.resize.SamplingDataCalculator;
import org.digitalmodular.imagescaler.resize.filter.LanczosResamplingCurve;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class InterpolationMethodTest {
	@Test
	void testLabels() {
		assertEquals("Nearest Neighbor", InterpolationMethod.NEAREST.getLabel());
		assertEquals("Bilinear", InterpolationMethod.BILINEAR.toString());
		assertSame(InterpolationMethod.BICUBIC, InterpolationMethod.DEFAULT);
	}

	@Test
	void testParse() {
		assertSame(InterpolationMethod.NEAREST, InterpolationMethod.parse("nearest neighbor"));
		assertSame(InterpolationMethod.NEAREST, InterpolationMethod.parse("NEAREST"));
		assertSame(InterpolationMethod.LANCZOS, InterpolationMethod.parse(" lanczos "));
		assertThrows(IllegalArgumentException.class, () -> InterpolationMethod.parse("sinc"));
	}

	@Test
	void testCreateResampler() {
		ScalerSettings settings = new ScalerSettings();
		settings.setNumThreads(2);
		settings.setAntialias(false);

		ImageResampler nearest = InterpolationMethod.NEAREST.createResampler(settings);
		assertTrue(nearest instanceof NearestNeighborResampler);
		assertEquals(2, nearest.getNumThreads());

		ImageResampler lanczos = InterpolationMethod.LANCZOS.createResampler(settings);
		assertTrue(lanczos instanceof ConvolutionResampler);
		assertSame(LanczosResamplingCurve.INSTANCE, ((ConvolutionResampler)lanczos).getCurve());
		assertFalse(((ConvolutionResampler)lanczos).isAntialias());
		assertEquals(2, lanczos.getNumThreads());
	}

	@Test
	void testNeighbourhoodWidensWhenShrinking() {
		for (InterpolationMethod method : InterpolationMethod.values()) {
			if (method.getCurve() == null)
				continue;

			int enlarging = SamplingDataCalculator.calculateNumSamples(method.getCurve(), 10, 20, true);
			int shrinking = SamplingDataCalculator.calculateNumSamples(method.getCurve(), 20, 10, true);
			int aliased   = SamplingDataCalculator.calculateNumSamples(method.getCurve(), 20, 10, false);

			assertEquals(2 * enlarging, shrinking, method.toString());
			assertEquals(enlarging, aliased, method.toString());
		}
	}
}
