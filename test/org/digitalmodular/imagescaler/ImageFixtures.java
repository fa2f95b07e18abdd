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
import java.awt.image.Raster;
import java.util.Arrays;
import java.util.Random;

/**
 * Creates small images for tests.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-09
public final class ImageFixtures {
	public static BufferedImage filled(int width, int height, int type, int argb) {
		BufferedImage image = new BufferedImage(width, height, type);
		for (int y = 0; y < height; y++)
			for (int x = 0; x < width; x++)
				image.setRGB(x, y, argb);

		return image;
	}

	/**
	 * Fills the image with pseudo-random colors. The same seed gives the same image.
	 */
	public static BufferedImage noise(int width, int height, int type, long seed) {
		Random        random = new Random(seed);
		BufferedImage image  = new BufferedImage(width, height, type);
		for (int y = 0; y < height; y++)
			for (int x = 0; x < width; x++)
				image.setRGB(x, y, random.nextInt());

		return image;
	}

	public static int[] pixels(BufferedImage image) {
		Raster raster = image.getRaster();
		return raster.getPixels(0, 0, raster.getWidth(), raster.getHeight(), (int[])null);
	}

	public static boolean samePixels(BufferedImage a, BufferedImage b) {
		return a.getWidth() == b.getWidth() &&
		       a.getHeight() == b.getHeight() &&
		       Arrays.equals(pixels(a), pixels(b));
	}

	private ImageFixtures() {
		throw new AssertionError();
	}
}
