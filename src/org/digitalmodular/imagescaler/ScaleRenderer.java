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
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.resize.ImageResampler;
import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * Turns a {@link RenderRequest} into a {@link ScaledImage}: calculates the output size, guards it against the pixel
 * ceiling, and runs the resampler of the requested method on the source image.
 * <p>
 * Rendering is deterministic: the same request always produces the same pixels, regardless of the number of
 * threads.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-06
public class ScaleRenderer {
	private final ScalerSettings settings;
	private final long           maxOutputPixels;

	private final Map<InterpolationMethod, ImageResampler> resamplers = new EnumMap<>(InterpolationMethod.class);

	public ScaleRenderer(ScalerSettings settings) {
		this.settings = requireNonNull(settings, "settings");
		maxOutputPixels = settings.getMaxOutputPixels();
	}

	/**
	 * Calculates the size of the source image after scaling. Each side is rounded half up, to a minimum of 1 pixel.
	 *
	 * @throws DimensionOverflowException when the result has more pixels than allowed
	 */
	public SizeInt calculateOutputSize(SizeInt sourceSize, ScaleFactor scale) {
		long width  = scale.scaleLength(sourceSize.getWidth());
		long height = scale.scaleLength(sourceSize.getHeight());

		if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE || width * height > maxOutputPixels)
			throw new DimensionOverflowException(width, height, maxOutputPixels);

		return new SizeInt((int)width, (int)height);
	}

	public ScaledImage render(SourceImage source, ScaleFactor scale, InterpolationMethod method)
			throws InterruptedException {
		return render(new RenderRequest(source, scale, method));
	}

	/**
	 * The cancellation policy is to interrupt this thread, which makes this method throw an
	 * {@link InterruptedException} as soon as possible.
	 *
	 * @throws DimensionOverflowException      when the output would have more pixels than allowed
	 * @throws UnsupportedImageFormatException when the pixel layout of the source can't be resampled
	 * @throws InterruptedException            when the thread has been interrupted
	 */
	public ScaledImage render(RenderRequest request) throws InterruptedException {
		SourceImage source     = request.getSource();
		SizeInt     outputSize = calculateOutputSize(source.getSize(), request.getScale());

		if (Logger.getGlobal().isLoggable(Level.FINE))
			Logger.getGlobal().fine("Rendering " + request + " -> " + outputSize);

		BufferedImage scaled = getResampler(request.getMethod()).resize(source.getImage(), outputSize);

		return new ScaledImage(request, scaled);
	}

	private synchronized ImageResampler getResampler(InterpolationMethod method) {
		return resamplers.computeIfAbsent(method, ignored -> method.createResampler(settings));
	}
}
