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

import static java.util.Objects.requireNonNull;

/**
 * Tracks the loaded image and its current scale factor. Until an image is loaded, every operation that changes the
 * scale throws {@link NoImageLoadedException}.
 * <p>
 * This class is not thread-safe.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public class ScaleStateMachine {
	private SourceImage source = null;
	private ScaleFactor scale  = ScaleFactor.UNITY;

	/**
	 * Replaces the image (if any) and resets the scale to 100%.
	 */
	public void load(SourceImage source) {
		this.source = requireNonNull(source, "source");
		scale = ScaleFactor.UNITY;
	}

	public boolean isLoaded() {
		return source != null;
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public SourceImage getSource() {
		requireLoaded("get the source image");
		return source;
	}

	/**
	 * Returns the current scale factor. Without an image this is always 100%.
	 */
	public ScaleFactor getScale() {
		return scale;
	}

	/**
	 * Steps the scale up by one tick. Does nothing at the maximum.
	 *
	 * @return the new scale factor
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public ScaleFactor increase() {
		requireLoaded("increase the scale");
		scale = scale.next();
		return scale;
	}

	/**
	 * Steps the scale down by one tick. Does nothing at the minimum.
	 *
	 * @return the new scale factor
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public ScaleFactor decrease() {
		requireLoaded("decrease the scale");
		scale = scale.previous();
		return scale;
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public void reset() {
		requireLoaded("reset the scale");
		scale = ScaleFactor.UNITY;
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public boolean isAtMinScale() {
		requireLoaded("query the scale");
		return scale.isMin();
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public boolean isAtMaxScale() {
		requireLoaded("query the scale");
		return scale.isMax();
	}

	private void requireLoaded(String operation) {
		if (source == null)
			throw new NoImageLoadedException(operation);
	}

	@Override
	public String toString() {
		return source == null ? "NoImage" : "Loaded(" + scale.getTick() + ')';
	}
}
