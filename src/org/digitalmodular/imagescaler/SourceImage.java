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
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * An image as it was loaded, at its native size. All scaling reads from this, never from a previously scaled image.
 * <p>
 * The pixels are a private copy of the image passed in, and are never modified.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public final class SourceImage {
	private final BufferedImage image;
	private final SizeInt       size;
	private final String        name;

	public SourceImage(BufferedImage image) {
		this(image, null);
	}

	/**
	 * @param name a name for display, such as the file name, or {@code null}
	 */
	public SourceImage(BufferedImage image, String name) {
		requireNonNull(image, "image");

		this.image = ImageUtilities.copyImage(image);
		size = new SizeInt(image);
		this.name = name;
	}

	public SizeInt getSize() { return size; }

	public int getWidth()    { return size.getWidth(); }

	public int getHeight()   { return size.getHeight(); }

	/**
	 * Returns the display name, or {@code null} if there is none.
	 */
	public String getName()  { return name; }

	/**
	 * The shared pixels. Only the renderer may see these, and only to read them.
	 */
	BufferedImage getImage() { return image; }

	/**
	 * Returns a copy of the pixels, which the caller may modify.
	 */
	public BufferedImage copyImage() {
		return ImageUtilities.copyImage(image);
	}

	@Override
	public String toString() {
		return (name == null ? "SourceImage" : name) + " (" + size + ", " + ImageUtilities.analyzeImage(image) + ')';
	}
}
