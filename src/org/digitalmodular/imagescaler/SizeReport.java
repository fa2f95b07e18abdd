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

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * The sizes of an image at the three stages of display: as loaded, after scaling, and as shown on screen.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-03
public final class SizeReport {
	private final SizeInt     original;
	private final SizeInt     scaled;
	private final SizeInt     displayed;
	private final ScaleFactor scale;

	public SizeReport(SizeInt original, SizeInt scaled, SizeInt displayed, ScaleFactor scale) {
		this.original = requireNonNull(original, "original");
		this.scaled = requireNonNull(scaled, "scaled");
		this.displayed = requireNonNull(displayed, "displayed");
		this.scale = requireNonNull(scale, "scale");
	}

	public SizeInt getOriginal()  { return original; }

	public SizeInt getScaled()    { return scaled; }

	public SizeInt getDisplayed() { return displayed; }

	public ScaleFactor getScale() { return scale; }

	public boolean isUpscaled()   { return scale.isUpscale(); }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SizeReport)) return false;

		SizeReport other = (SizeReport)o;

		return original.equals(other.original) &&
		       scaled.equals(other.scaled) &&
		       displayed.equals(other.displayed) &&
		       scale.equals(other.scale);
	}

	@Override
	public int hashCode() {
		int result = original.hashCode();
		result = 31 * result + scaled.hashCode();
		result = 31 * result + displayed.hashCode();
		result = 31 * result + scale.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "SizeReport(" + original + " @ " + scale + " = " + scaled + ", displayed " + displayed + ')';
	}
}
