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

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class ScaleRendererTest {
	private final ScaleRenderer renderer = new ScaleRenderer(new ScalerSettings());

	@Test
	void testUnityKeepsSizeForEveryMethod() throws InterruptedException {
		SourceImage source = new SourceImage(ImageFixtures.noise(200, 100, BufferedImage.TYPE_INT_RGB, 1));

		for (InterpolationMethod method : InterpolationMethod.values()) {
			ScaledImage scaled = renderer.render(source, ScaleFactor.UNITY, method);

			assertEquals(new SizeInt(200, 100), scaled.getSize(), method.name());
			assertTrue(ImageFixtures.samePixels(source.copyImage(), scaled.getImage()), method.name());
		}
	}

	@Test
	void testMinimumScaleGivesAtLeastOnePixel() throws InterruptedException {
		SourceImage source = new SourceImage(ImageFixtures.noise(10, 10, BufferedImage.TYPE_INT_RGB, 2));

		for (InterpolationMethod method : InterpolationMethod.values())
			assertEquals(new SizeInt(1, 1), renderer.render(source, ScaleFactor.MIN, method).getSize(), method.name());
	}

	@Test
	void testOneStepUp() throws InterruptedException {
		SourceImage source = new SourceImage(ImageFixtures.noise(200, 100, BufferedImage.TYPE_INT_ARGB, 3));

		ScaledImage scaled = renderer.render(source, ScaleFactor.ofTick(21), InterpolationMethod.BICUBIC);

		assertEquals(new SizeInt(210, 105), scaled.getSize());
		assertSame(InterpolationMethod.BICUBIC, scaled.getMethod());
		assertEquals(21, scaled.getScale().getTick());
		assertTrue(scaled.getImage().getColorModel().hasAlpha());
		assertEquals(4, scaled.getImage().getRaster().getNumBands());
		assertEquals(DataBuffer.TYPE_INT, scaled.getImage().getRaster().getDataBuffer().getDataType());
	}

	@Test
	void testDeterministic() throws InterruptedException {
		SourceImage source = new SourceImage(ImageFixtures.noise(31, 17, BufferedImage.TYPE_3BYTE_BGR, 4));

		for (InterpolationMethod method : InterpolationMethod.values()) {
			ScaledImage first  = renderer.render(source, ScaleFactor.ofTick(33), method);
			ScaledImage second = renderer.render(new RenderRequest(source, ScaleFactor.ofTick(33), method));

			assertTrue(ImageFixtures.samePixels(first.getImage(), second.getImage()), method.name());
		}
	}

	@Test
	void testOutputSize() {
		assertEquals(new SizeInt(600, 300), renderer.calculateOutputSize(new SizeInt(200, 100), ScaleFactor.MAX));
		assertEquals(new SizeInt(10, 5), renderer.calculateOutputSize(new SizeInt(200, 100), ScaleFactor.MIN));
		assertEquals(new SizeInt(1, 2), renderer.calculateOutputSize(new SizeInt(3, 30), ScaleFactor.MIN));
	}

	@Test
	void testOverflow() {
		ScalerSettings settings = new ScalerSettings();
		settings.setMaxOutputPixels(1000);
		ScaleRenderer smallRenderer = new ScaleRenderer(settings);

		SourceImage source = new SourceImage(new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB));

		DimensionOverflowException ex = assertThrows(
				DimensionOverflowException.class,
				() -> smallRenderer.render(source, ScaleFactor.UNITY, InterpolationMethod.NEAREST));
		assertEquals(10000, ex.getRequestedPixels());
		assertEquals(1000, ex.getMaxPixels());

		assertDoesNotThrow(() -> smallRenderer.calculateOutputSize(source.getSize(), ScaleFactor.ofTick(6)));
	}

	@Test
	void testOverflowOfIntRange() {
		DimensionOverflowException ex = assertThrows(
				DimensionOverflowException.class,
				() -> renderer.calculateOutputSize(new SizeInt(Integer.MAX_VALUE, 1), ScaleFactor.MAX));
		assertTrue(ex.getRequestedPixels() > Integer.MAX_VALUE);
	}

	@Test
	void testSourceIsNotModified() throws InterruptedException {
		BufferedImage image  = ImageFixtures.noise(20, 20, BufferedImage.TYPE_INT_RGB, 5);
		SourceImage   source = new SourceImage(image);

		renderer.render(source, ScaleFactor.ofTick(37), InterpolationMethod.LANCZOS);

		assertTrue(ImageFixtures.samePixels(image, source.copyImage()));
	}
}
