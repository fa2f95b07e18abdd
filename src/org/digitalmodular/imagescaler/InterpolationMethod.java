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

import org.digitalmodular.imagescaler.resize.ConvolutionResampler;
import org.digitalmodular.imagescaler.resize.ImageResampler;
import org.digitalmodular.imagescaler.resize.NearestNeighborResampler;
import org.digitalmodular.imagescaler.resize.filter.CubicResamplingCurve;
import org.digitalmodular.imagescaler.resize.filter.LanczosResamplingCurve;
import org.digitalmodular.imagescaler.resize.filter.LinearResamplingCurve;
import org.digitalmodular.imagescaler.resize.filter.ResamplingCurve;

/**
 * The resampling algorithms a user can choose from.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public enum InterpolationMethod {
	/** Copies source pixels. Never introduces new colors. */
	NEAREST("Nearest Neighbor", null),
	/**
	 * Linear interpolation between the 2×2 nearest pixels when enlarging. When shrinking with antialiasing on, the
	 * kernel is stretched by the shrink factor and covers proportionally more source pixels.
	 */
	BILINEAR("Bilinear", LinearResamplingCurve.INSTANCE),
	/**
	 * Catmull-Rom cubic convolution over 4×4 pixels when enlarging. When shrinking with antialiasing on, the
	 * neighbourhood widens by the shrink factor.
	 */
	BICUBIC("Bicubic", CubicResamplingCurve.INSTANCE),
	/**
	 * Lanczos3 windowed sinc over 6×6 pixels when enlarging. When shrinking with antialiasing on, the neighbourhood
	 * widens by the shrink factor.
	 */
	LANCZOS("Lanczos", LanczosResamplingCurve.INSTANCE);

	public static final InterpolationMethod DEFAULT = BICUBIC;

	private final String          label;
	private final ResamplingCurve curve;

	InterpolationMethod(String label, ResamplingCurve curve) {
		this.label = label;
		this.curve = curve;
	}

	/**
	 * Returns a short, friendly name, such as one that you would use in a ComboBox.
	 */
	public String getLabel() { return label; }

	/**
	 * Returns the curve of the convolution resampler, or {@code null} for {@link #NEAREST}.
	 */
	public ResamplingCurve getCurve() { return curve; }

	/**
	 * Creates a new resampler for this method, configured from the settings.
	 */
	public ImageResampler createResampler(ScalerSettings settings) {
		ImageResampler resampler;
		if (curve == null) {
			resampler = new NearestNeighborResampler();
		} else {
			ConvolutionResampler convolutionResampler = new ConvolutionResampler(curve);
			convolutionResampler.setAntialias(settings.isAntialias());
			convolutionResampler.setDontPreAlpha(settings.isDontPreAlpha());
			resampler = convolutionResampler;
		}

		resampler.setNumThreads(settings.getNumThreads());
		return resampler;
	}

	/**
	 * Parses either the constant name or the label, ignoring case.
	 *
	 * @throws IllegalArgumentException when nothing matches
	 */
	public static InterpolationMethod parse(String text) {
		String trimmed = text.trim();
		for (InterpolationMethod method : values()) {
			if (method.name().equalsIgnoreCase(trimmed) || method.label.equalsIgnoreCase(trimmed))
				return method;
		}

		throw new IllegalArgumentException("Unknown interpolation method: " + text);
	}

	@Override
	public String toString() {
		return label;
	}
}
