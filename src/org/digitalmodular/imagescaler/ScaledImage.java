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
 * The result of rendering a {@link RenderRequest}: the source image scaled by the requested factor with the requested
 * method.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public final class ScaledImage {
	private final RenderRequest request;
	private final BufferedImage image;
	private final SizeInt       size;

	public ScaledImage(RenderRequest request, BufferedImage image) {
		this.request = requireNonNull(request, "request");
		this.image = requireNonNull(image, "image");
		size = new SizeInt(image);
	}

	public RenderRequest getRequest()      { return request; }

	public ScaleFactor getScale()          { return request.getScale(); }

	public InterpolationMethod getMethod() { return request.getMethod(); }

	public SizeInt getSize()               { return size; }

	/**
	 * Returns the pixels. The image may be shared (for example with a cache) so it must be treated as read-only.
	 */
	public BufferedImage getImage()        { return image; }

	@Override
	public String toString() {
		return "ScaledImage(" + size + ", " + request + ')';
	}
}
