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

package org.digitalmodular.imagescaler.resize;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.ImageUtilities;
import org.digitalmodular.imagescaler.UnsupportedImageFormatException;
import org.digitalmodular.imagescaler.internal.LayeredWorkerQueue;
import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * Superclass for resamplers that process an image in horizontal strips, in parallel.
 * <p>
 * Subclasses receive the source raster and an empty destination raster with the same layout, and must write every
 * destination pixel. Each worker must only write its own rows.
 *
 * @author Mark Jeronimus
 */
// Created 2015-08-22
// Changed 2025-06-04 Generalized to any non-palette image of up to 16 bits per sample
abstract class AbstractImageResampler implements ImageResampler {
	protected static final int AVAILABLE_PROCESSORS = Runtime.getRuntime().availableProcessors();

	private final ThreadPoolExecutor executor = new ThreadPoolExecutor(
			AVAILABLE_PROCESSORS, AVAILABLE_PROCESSORS, 60L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
			AbstractImageResampler::newWorkerThread);

	protected int numThreads = 0;

	// Working data, valid during resize()
	protected int     srcWidth   = 0;
	protected int     srcHeight  = 0;
	protected int     dstWidth   = 0;
	protected int     dstHeight  = 0;
	protected int     numBands   = 0;
	protected int[]   maxValues  = null;
	protected boolean hasAlpha   = false;
	protected boolean isAlphaPre = false;

	protected AbstractImageResampler() {
		executor.allowCoreThreadTimeOut(true);
	}

	private static Thread newWorkerThread(Runnable runnable) {
		Thread thread = new Thread(runnable, "ImageScaler-resampler");
		thread.setDaemon(true);
		return thread;
	}

	@Override
	public int getNumThreads() { return numThreads; }

	@Override
	public void setNumThreads(int numThreads) {
		if (numThreads < 0)
			throw new IllegalArgumentException("numThreads can't be negative: " + numThreads);
		this.numThreads = numThreads;
	}

	@Override
	public synchronized BufferedImage resize(BufferedImage image, SizeInt outputSize) throws InterruptedException {
		requireNonNull(image, "image");
		requireNonNull(outputSize, "outputSize");

		String unsupportedReason = ImageUtilities.getUnsupportedReason(image);
		if (unsupportedReason != null)
			throw new UnsupportedImageFormatException(
					unsupportedReason + " (" + ImageUtilities.analyzeImage(image) + ')');

		if (Logger.getGlobal().isLoggable(Level.FINEST))
			Logger.getGlobal().finest("input img: " + ImageUtilities.analyzeImage(image) + ", " +
			                          image.getWidth() + '×' + image.getHeight() + " -> " + outputSize);

		prepare(image, outputSize);

		if (srcWidth == dstWidth && srcHeight == dstHeight)
			return ImageUtilities.copyImage(image);

		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();

		BufferedImage out = ImageUtilities.createCompatibleImage(image, dstWidth, dstHeight);

		resample(image.getRaster(), out.getRaster());

		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();

		return out;
	}

	private void prepare(BufferedImage image, SizeInt outputSize) {
		ColorModel  colorModel  = image.getColorModel();
		SampleModel sampleModel = image.getSampleModel();

		srcWidth = image.getWidth();
		srcHeight = image.getHeight();
		dstWidth = outputSize.getWidth();
		dstHeight = outputSize.getHeight();
		numBands = sampleModel.getNumBands();
		hasAlpha = colorModel.hasAlpha();
		isAlphaPre = colorModel.isAlphaPremultiplied();

		maxValues = new int[numBands];
		for (int band = 0; band < numBands; band++)
			maxValues[band] = (1 << sampleModel.getSampleSize(band)) - 1;
	}

	/**
	 * Resamples all pixels of {@code src} into {@code dst}. The fields describing the working data have been set.
	 */
	protected abstract void resample(Raster src, WritableRaster dst) throws InterruptedException;

	/**
	 * Returns the number of strips to divide the image in, which equals the number of threads to use.
	 */
	protected int getNumStrips() {
		return getNumThreads() == 0 ? AVAILABLE_PROCESSORS : getNumThreads();
	}

	/**
	 * Returns the first row of the strip. The end of the strip is the beginning of the next strip.
	 */
	protected int stripBegin(int strip, int numStrips, int numRows) {
		return (int)((long)strip * numRows / numStrips);
	}

	/**
	 * Rounds and clamps a sample to the range of the band, so over- and undershoot never wrap around.
	 */
	protected final int clampSample(double value, int band) {
		long rounded = Math.round(value);
		return rounded < 0 ? 0 : rounded > maxValues[band] ? maxValues[band] : (int)rounded;
	}

	protected void runWorkers(LayeredWorkerQueue<Void> workers) throws InterruptedException {
		int maxWorkers = getNumStrips();

		// A fresh service per run, so futures cancelled in an aborted run can't show up in the next one
		CompletionService<Void> service = new ExecutorCompletionService<>(executor);

		// Keep track of which workers there are in the service
		Set<Future<Void>> runningWorkers = new HashSet<>(maxWorkers * 2);

		try {
			submitEligibleWorkers(service, workers, runningWorkers, maxWorkers);

			while (!runningWorkers.isEmpty()) {
				// Wait for next completed worker
				Future<Void> future = service.take(); // Blocks
				try {
					future.get(); // Doesn't block anymore, but required to obtain the exceptions.
				} finally {
					runningWorkers.remove(future);
				}

				// A finished worker might have released the next layer
				submitEligibleWorkers(service, workers, runningWorkers, maxWorkers);
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw ex;
		} catch (ExecutionException ex) {
			Throwable th = ex.getCause();
			// Check if it is one of the unchecked throwables
			if (th instanceof RuntimeException) {
				throw (RuntimeException)th;
			} else if (th instanceof Error) {
				//noinspection ProhibitedExceptionThrown
				throw (Error)th;
			} else if (th instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				throw (InterruptedException)th;
			} else {
				throw new AssertionError("Unhandled checked exception", th);
			}
		} finally {
			runningWorkers.forEach(future -> future.cancel(true));
		}

		if (!workers.isEmpty())
			throw new IllegalStateException("Workers left that never became eligible: " + workers.size());
	}

	private static void submitEligibleWorkers(CompletionService<Void> service,
	                                          LayeredWorkerQueue<Void> workers,
	                                          Set<Future<Void>> runningWorkers,
	                                          int maxWorkers) throws InterruptedException {
		while (runningWorkers.size() < maxWorkers && workers.hasEligibleWorkers()) {
			Callable<Void> worker = workers.takeEligibleWorker(); // Doesn't block
			runningWorkers.add(service.submit(worker));
		}
	}
}
