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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

/**
 * Renders on a background thread, at most one request at a time. Submitting a request cancels (interrupts) the
 * request in flight, and the result of a superseded request is never delivered: the last request wins.
 * <p>
 * Callbacks are invoked on the render thread. Delivery is best-effort ordered: a consumer that needs certainty must
 * still check that the delivered image belongs to its current request, like
 * {@link ImageScalerSession#offerRendered(ScaledImage)} does.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-07
public class SingleFlightRenderer implements AutoCloseable {
	@FunctionalInterface
	public interface RenderFunction {
		ScaledImage render(RenderRequest request) throws InterruptedException;
	}

	public interface RenderCallback {
		void renderCompleted(ScaledImage image);

		void renderFailed(RenderRequest request, RuntimeException ex);
	}

	private final RenderFunction  function;
	private final ExecutorService executor = Executors.newSingleThreadExecutor(SingleFlightRenderer::newRenderThread);

	private Future<?> inFlight   = null;
	private long      generation = 0;

	public SingleFlightRenderer(ScaleRenderer renderer) {
		this(requireNonNull(renderer, "renderer")::render);
	}

	public SingleFlightRenderer(RenderFunction function) {
		this.function = requireNonNull(function, "function");
	}

	private static Thread newRenderThread(Runnable runnable) {
		Thread thread = new Thread(runnable, "ImageScaler-render");
		thread.setDaemon(true);
		return thread;
	}

	/**
	 * Starts rendering the request, superseding any request still in flight.
	 *
	 * @return the future of the render task, which completes after the callback returns
	 */
	public synchronized Future<?> submit(RenderRequest request, RenderCallback callback) {
		requireNonNull(request, "request");
		requireNonNull(callback, "callback");

		if (inFlight != null)
			inFlight.cancel(true);

		long requestGeneration = ++generation;
		inFlight = executor.submit(() -> run(request, callback, requestGeneration));
		return inFlight;
	}

	/**
	 * Cancels the request in flight, if any. Its result won't be delivered.
	 */
	public synchronized void cancel() {
		generation++;

		if (inFlight != null) {
			inFlight.cancel(true);
			inFlight = null;
		}
	}

	public synchronized boolean isBusy() {
		return inFlight != null && !inFlight.isDone();
	}

	private void run(RenderRequest request, RenderCallback callback, long requestGeneration) {
		ScaledImage image;
		try {
			image = function.render(request);
		} catch (InterruptedException ignored) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Render superseded: " + request);
			return;
		} catch (RuntimeException ex) {
			if (isCurrent(requestGeneration))
				callback.renderFailed(request, ex);
			else
				Logger.getGlobal().log(Level.WARNING, "Superseded render failed: " + request, ex);
			return;
		}

		if (isCurrent(requestGeneration))
			callback.renderCompleted(image);
		else if (Logger.getGlobal().isLoggable(Level.FINE))
			Logger.getGlobal().fine("Render superseded after completion: " + request);
	}

	private synchronized boolean isCurrent(long requestGeneration) {
		return requestGeneration == generation;
	}

	@Override
	public void close() {
		cancel();
		executor.shutdownNow();
	}
}
