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

import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * The commands and queries of one image scaling session: load an image, step its scale up and down, choose the
 * interpolation method, and save the result.
 * <p>
 * Rendering is lazy. {@link #currentRenderedImage()} renders on the calling thread and caches the result. Callers
 * that render elsewhere (for example with a {@link SingleFlightRenderer}) take the request from
 * {@link #getRenderRequest()} and hand the result back through {@link #offerRendered(ScaledImage)}.
 * <p>
 * This class is not thread-safe. All calls must come from the same thread (such as the event dispatch thread).
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-06
public class ImageScalerSession {
	private final ScaleRenderer     renderer;
	private final ScaleStateMachine state = new ScaleStateMachine();

	private InterpolationMethod method;
	private ScaledImage         rendered = null;

	public ImageScalerSession() {
		this(new ScalerSettings());
	}

	public ImageScalerSession(ScalerSettings settings) {
		this(new ScaleRenderer(settings), settings.getDefaultMethod());
	}

	public ImageScalerSession(ScaleRenderer renderer, InterpolationMethod method) {
		this.renderer = requireNonNull(renderer, "renderer");
		this.method = requireNonNull(method, "method");
	}

	public ScaleRenderer getRenderer() {
		return renderer;
	}

	/**
	 * Loads an image file and resets the scale to 100%. On failure, the session is unchanged.
	 *
	 * @throws InvalidImageException when the file can't be read or decoded
	 */
	public SourceImage load(File file) throws InvalidImageException {
		SourceImage source = ImageCodec.read(file);
		load(source);
		return source;
	}

	/**
	 * Replaces the image and resets the scale to 100%.
	 */
	public void load(SourceImage source) {
		state.load(source);
		rendered = null;
	}

	public boolean hasImage() {
		return state.isLoaded();
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public SourceImage getSource() {
		return state.getSource();
	}

	public ScaleFactor getScale() {
		return state.getScale();
	}

	public InterpolationMethod getMethod() {
		return method;
	}

	public void setMethod(InterpolationMethod method) {
		this.method = requireNonNull(method, "method");
	}

	/**
	 * Steps the scale up by one tick, unless already at the maximum.
	 *
	 * @return the new scale factor
	 * @throws NoImageLoadedException     when no image is loaded
	 * @throws DimensionOverflowException when the image would become too large. The scale is left unchanged.
	 */
	public ScaleFactor increase() {
		SourceImage source = state.getSource();
		renderer.calculateOutputSize(source.getSize(), state.getScale().next());
		return state.increase();
	}

	/**
	 * Steps the scale down by one tick, unless already at the minimum.
	 *
	 * @return the new scale factor
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public ScaleFactor decrease() {
		return state.decrease();
	}

	/**
	 * Returns the scale to 100%.
	 *
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public void reset() {
		state.reset();
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public boolean isAtMinScale() {
		return state.isAtMinScale();
	}

	/**
	 * Returns {@code true} when {@link #increase()} can't go any further, either because the scale is at its maximum
	 * or because the next step would make the image too large.
	 *
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public boolean isAtMaxScale() {
		if (state.isAtMaxScale())
			return true;

		try {
			renderer.calculateOutputSize(state.getSource().getSize(), state.getScale().next());
			return false;
		} catch (DimensionOverflowException ignored) {
			return true;
		}
	}

	/**
	 * Returns the text that announces the interpolation method, or {@code null} when the image isn't upscaled (or
	 * there is no image).
	 */
	public String activeMethodLabel() {
		if (!state.isLoaded() || !state.getScale().isUpscale())
			return null;

		return SizeReportFormatter.formatMethodLabel(method);
	}

	/**
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public RenderRequest getRenderRequest() {
		return new RenderRequest(state.getSource(), state.getScale(), method);
	}

	/**
	 * Renders the image at the current scale with the current method, or returns the cached image when nothing
	 * changed since the last render.
	 *
	 * @throws NoImageLoadedException          when no image is loaded
	 * @throws DimensionOverflowException      when the image would become too large
	 * @throws UnsupportedImageFormatException when the pixel layout of the image can't be resampled
	 * @throws InterruptedException            when the thread has been interrupted
	 */
	public ScaledImage currentRenderedImage() throws InterruptedException {
		RenderRequest request = getRenderRequest();
		if (rendered != null && rendered.getRequest().equals(request))
			return rendered;

		rendered = renderer.render(request);
		return rendered;
	}

	/**
	 * Accepts an image that was rendered elsewhere, if it's still current.
	 *
	 * @return {@code true} if the image was rendered for the current request and is now cached, {@code false} if it's
	 * stale and was discarded
	 */
	public boolean offerRendered(ScaledImage image) {
		requireNonNull(image, "image");

		if (!state.isLoaded() || !image.getRequest().equals(getRenderRequest())) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Discarding stale " + image);
			return false;
		}

		rendered = image;
		return true;
	}

	/**
	 * Returns the sizes at the current scale, displayed at the scaled size.
	 *
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public SizeReport currentSizeReport() {
		return currentSizeReport(null);
	}

	/**
	 * Returns the sizes at the current scale, displayed fitted inside the viewport.
	 *
	 * @param viewportBound the area available for display, or {@code null} to display at the scaled size
	 * @throws NoImageLoadedException when no image is loaded
	 */
	public SizeReport currentSizeReport(SizeInt viewportBound) {
		SizeInt     original = state.getSource().getSize();
		ScaleFactor scale    = state.getScale();
		SizeInt     scaled   = renderer.calculateOutputSize(original, scale);

		return SizeReportFormatter.createReport(original, scale, scaled, viewportBound);
	}

	/**
	 * Saves the current rendered image, choosing the format from the file extension.
	 *
	 * @throws NoImageLoadedException          when no image is loaded
	 * @throws DimensionOverflowException      when the rendered size exceeds the pixel ceiling
	 * @throws UnsupportedImageFormatException when the pixel layout of the image can't be resampled
	 * @throws ImageEncodeException            when the format is unknown or writing fails
	 * @throws InterruptedException            when the thread has been interrupted while rendering
	 */
	public void save(File file) throws ImageEncodeException, InterruptedException {
		ImageCodec.write(currentRenderedImage().getImage(), file);
	}

	/**
	 * Saves the current rendered image in the given format.
	 *
	 * @throws NoImageLoadedException          when no image is loaded
	 * @throws DimensionOverflowException      when the rendered size exceeds the pixel ceiling
	 * @throws UnsupportedImageFormatException when the pixel layout of the image can't be resampled
	 * @throws ImageEncodeException            when the format is unknown or writing fails
	 * @throws InterruptedException            when the thread has been interrupted while rendering
	 */
	public void save(File file, String formatName) throws ImageEncodeException, InterruptedException {
		ImageCodec.write(currentRenderedImage().getImage(), file, formatName);
	}
}
