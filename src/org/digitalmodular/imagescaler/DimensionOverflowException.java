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

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * Thrown when the requested output image would contain more pixels than allowed by
 * {@link ScalerSettings#getMaxOutputPixels()}.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-04
public class DimensionOverflowException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final long requestedPixels;
	private final long maxPixels;

	public DimensionOverflowException(long requestedWidth, long requestedHeight, long maxPixels) {
		super("Output size " + requestedWidth + '×' + requestedHeight + " exceeds the maximum of " + maxPixels +
		      " pixels");
		requestedPixels = requestedWidth > Long.MAX_VALUE / requestedHeight
		                  ? Long.MAX_VALUE
		                  : requestedWidth * requestedHeight;
		this.maxPixels = maxPixels;
	}

	public DimensionOverflowException(SizeInt requestedSize, long maxPixels) {
		this(requestedSize.getWidth(), requestedSize.getHeight(), maxPixels);
	}

	public long getRequestedPixels() { return requestedPixels; }

	public long getMaxPixels()       { return maxPixels; }
}
