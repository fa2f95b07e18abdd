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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class SingleFlightRendererTest {
	private final SourceImage   source = new SourceImage(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB));
	private final RenderRequest first  = new RenderRequest(source, ScaleFactor.ofTick(21), InterpolationMethod.BICUBIC);
	private final RenderRequest second = new RenderRequest(source, ScaleFactor.ofTick(22), InterpolationMethod.BICUBIC);

	private final CountDownLatch firstStarted     = new CountDownLatch(1);
	private final CountDownLatch firstInterrupted = new CountDownLatch(1);

	private final RecordingCallback callback = new RecordingCallback();

	/** Blocks on the first request until interrupted, renders every other request immediately. */
	private ScaledImage render(RenderRequest request) throws InterruptedException {
		if (request == first) {
			firstStarted.countDown();
			try {
				new CountDownLatch(1).await();
			} catch (InterruptedException ex) {
				firstInterrupted.countDown();
				throw ex;
			}
		}

		return new ScaledImage(request, new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB));
	}

	@Test
	void testLastRequestWins() throws Exception {
		try (SingleFlightRenderer renderer = new SingleFlightRenderer(this::render)) {
			renderer.submit(first, callback);
			assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

			Future<?> future = renderer.submit(second, callback);
			future.get(5, TimeUnit.SECONDS);

			assertTrue(firstInterrupted.await(5, TimeUnit.SECONDS));
			assertEquals(1, callback.completed.size());
			assertSame(second, callback.completed.get(0).getRequest());
			assertTrue(callback.failed.isEmpty());
			assertFalse(renderer.isBusy());
		}
	}

	@Test
	void testCancel() throws Exception {
		try (SingleFlightRenderer renderer = new SingleFlightRenderer(this::render)) {
			renderer.submit(first, callback);
			assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

			renderer.cancel();

			assertTrue(firstInterrupted.await(5, TimeUnit.SECONDS));
			assertTrue(callback.completed.isEmpty());
			assertTrue(callback.failed.isEmpty());
		}
	}

	@Test
	void testFailureIsReported() throws Exception {
		IllegalStateException failure = new IllegalStateException("test");

		try (SingleFlightRenderer renderer = new SingleFlightRenderer(request -> {
			throw failure;
		})) {
			renderer.submit(second, callback).get(5, TimeUnit.SECONDS);

			assertTrue(callback.completed.isEmpty());
			assertEquals(List.of(failure), callback.failed);
		}
	}

	@Test
	void testWithRealRenderer() throws Exception {
		ScaleRenderer renderer = new ScaleRenderer(new ScalerSettings());

		try (SingleFlightRenderer singleFlight = new SingleFlightRenderer(renderer)) {
			singleFlight.submit(second, callback).get(5, TimeUnit.SECONDS);

			assertEquals(1, callback.completed.size());
			assertEquals(9, callback.completed.get(0).getSize().getWidth());
		}
	}

	@Test
	void testClosed() {
		SingleFlightRenderer renderer = new SingleFlightRenderer(this::render);
		renderer.close();

		assertThrows(RejectedExecutionException.class, () -> renderer.submit(second, callback));
	}

	private static final class RecordingCallback implements SingleFlightRenderer.RenderCallback {
		private final List<ScaledImage>      completed = new CopyOnWriteArrayList<>();
		private final List<RuntimeException> failed    = new CopyOnWriteArrayList<>();

		@Override
		public void renderCompleted(ScaledImage image) {
			completed.add(image);
		}

		@Override
		public void renderFailed(RenderRequest request, RuntimeException ex) {
			failed.add(ex);
		}
	}
}
