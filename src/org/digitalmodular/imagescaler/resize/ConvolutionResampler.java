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

import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.internal.LayeredWorkerQueue;
import org.digitalmodular.imagescaler.internal.PerformanceTimer;
import org.digitalmodular.imagescaler.resize.filter.ResamplingCurve;
import static org.digitalmodular.imagescaler.resize.SamplingDataCalculator.SamplingData;
import static org.digitalmodular.imagescaler.resize.SamplingDataCalculator.calculateNumSamples;
import static org.digitalmodular.imagescaler.resize.SamplingDataCalculator.createSubSampling;

/**
 * Separable convolution resampler. The image is resampled in one direction, then in the other, each time with the
 * same 1-dimensional {@link ResamplingCurve}.
 * <p>
 * Features:<ul>
 * <li>Compatible images: any non-palette image with up to 16 bits per sample,</li>
 * <li>Internal format: {@code float} per sample, sums in {@code double},</li>
 * <li>Intermediate clamping: no, only the final values are rounded and clamped to the range of each band,</li>
 * <li>Alpha: pre-multiplies when necessary,</li>
 * <li>Edges: clamped (edge pixels are replicated),</li>
 * <li>Parallel processing: each step is divided in horizontal strips. A step starts when the previous step has
 * finished completely.</li>
 * </ul>
 * Results don't depend on the number of threads.
 *
 * @author Mark Jeronimus
 */
// Created 2015-08-14
// Changed 2025-06-05 Rewritten for float buffers and arbitrary sample layouts
public class ConvolutionResampler extends AbstractImageResampler {
	private enum ResamplingOrder {
		X_ONLY,
		Y_ONLY,
		X_FIRST,
		Y_FIRST
	}

	private final ResamplingCurve  curve;
	private final PerformanceTimer timer = new PerformanceTimer();

	private boolean antialias    = true;
	private boolean dontPreAlpha = false;

	// Working data, valid during resample()
	private boolean      premultiply            = false;
	private SamplingData horizontalSamplingData = null;
	private SamplingData verticalSamplingData   = null;

	public ConvolutionResampler(ResamplingCurve curve) {
		this.curve = requireNonNull(curve, "curve");
	}

	public ResamplingCurve getCurve() { return curve; }

	public boolean isAntialias() { return antialias; }

	/**
	 * Set whether to widen the curve when shrinking, so every source pixel contributes to the result. Default is
	 * {@code true}.
	 * <p>
	 * When {@code false}, each destination pixel only sees the nominal neighborhood of the curve (2×2 for linear, 4×4
	 * for cubic, 6×6 for Lanczos3), which is faster but aliases when shrinking.
	 */
	public void setAntialias(boolean antialias) { this.antialias = antialias; }

	public boolean isDontPreAlpha() { return dontPreAlpha; }

	/**
	 * Set whether to premultiply and un-multiply the alpha values before and after resizing. Default is {@code
	 * false}.
	 * <p>
	 * Set to true if you don't want the algorithm to premultiply alpha beforehand and un-multiply afterwards.
	 * If the image to resize already has it's alpha pre-multiplied, then this flag has no effect.
	 * <p>
	 * Ignoring the alpha channel speeds up the resizing algorithm, but colors of fully transparent pixels will bleed
	 * into neighboring pixels.
	 */
	public void setDontPreAlpha(boolean dontPreAlpha) { this.dontPreAlpha = dontPreAlpha; }

	@Override
	protected void resample(Raster src, WritableRaster dst) throws InterruptedException {
		timer.start();

		premultiply = hasAlpha && !isAlphaPre && !dontPreAlpha;

		ResamplingOrder order = determineResampleOrder();

		float[] srcBuffer  = new float[srcWidth * srcHeight * numBands];
		float[] workBuffer = makeWorkBuffer(order);
		float[] dstBuffer  = new float[dstWidth * dstHeight * numBands];

		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();

		timer.record("Allocate");

		try {
			horizontalSamplingData = order == ResamplingOrder.Y_ONLY
			                         ? null
			                         : createSubSampling(curve, srcWidth, dstWidth, antialias);
			verticalSamplingData = order == ResamplingOrder.X_ONLY
			                       ? null
			                       : createSubSampling(curve, srcHeight, dstHeight, antialias);

			timer.record("Sub-sampling");

			LayeredWorkerQueue<Void> workerQueue = makeResampleQueue(order, src, srcBuffer, workBuffer, dstBuffer, dst);

			runWorkers(workerQueue);

			timer.record("Resample");
			timer.logResults("Resampled " + srcWidth + '×' + srcHeight + " -> " + dstWidth + '×' + dstHeight +
			                 " (" + order + ')', (long)dstWidth * dstHeight);
		} finally {
			// GC this:
			horizontalSamplingData = null;
			verticalSamplingData = null;
		}
	}

	private ResamplingOrder determineResampleOrder() {
		boolean doX = srcWidth != dstWidth;
		boolean doY = srcHeight != dstHeight;

		ResamplingOrder order;
		if (!doY) {
			order = ResamplingOrder.X_ONLY;
		} else if (!doX) {
			order = ResamplingOrder.Y_ONLY;
		} else {
			// Calculate the work effort of each possible sub-process.
			// The +1 tweak comes from the store operation for each resampled pixel.
			long samplesX = calculateNumSamples(curve, srcWidth, dstWidth, antialias) + 1;
			long samplesY = calculateNumSamples(curve, srcHeight, dstHeight, antialias) + 1;

			long effortXFirst = (long)srcHeight * dstWidth * samplesX + (long)dstWidth * dstHeight * samplesY;
			long effortYFirst = (long)srcWidth * dstHeight * samplesY + (long)dstHeight * dstWidth * samplesX;

			if (Logger.getGlobal().isLoggable(Level.FINEST))
				Logger.getGlobal().finest("Efforts: " + effortXFirst + " <> " + effortYFirst);

			order = effortXFirst <= effortYFirst ? ResamplingOrder.X_FIRST : ResamplingOrder.Y_FIRST;
		}

		if (Logger.getGlobal().isLoggable(Level.FINEST))
			Logger.getGlobal().finest("Resampling order: " + order);

		return order;
	}

	private float[] makeWorkBuffer(ResamplingOrder order) {
		switch (order) {
			case X_ONLY:
			case Y_ONLY:
				// Only step: no need for a work buffer
				return null;
			case X_FIRST:
				// First step: use only width from dst
				return new float[dstWidth * srcHeight * numBands];
			case Y_FIRST:
				// First step: use only height from dst
				return new float[srcWidth * dstHeight * numBands];
			default:
				throw new AssertionError(order);
		}
	}

	private LayeredWorkerQueue<Void> makeResampleQueue(ResamplingOrder order,
	                                                   Raster src, float[] srcBuffer,
	                                                   float[] workBuffer,
	                                                   float[] dstBuffer, WritableRaster dst) {
		int numStrips = getNumStrips();

		// Make 4 lists of workers for each of the steps in the process.
		List<Callable<Void>> preConvertWorkers  = new ArrayList<>(numStrips);
		List<Callable<Void>> step1Workers       = new ArrayList<>(numStrips);
		List<Callable<Void>> step2Workers       = new ArrayList<>(numStrips);
		List<Callable<Void>> postConvertWorkers = new ArrayList<>(numStrips);

		// Divide the rows of the image in approximately equal pieces
		for (int i = 0; i < numStrips; i++) {
			int srcBegin = stripBegin(i, numStrips, srcHeight);
			int srcEnd   = stripBegin(i + 1, numStrips, srcHeight);
			int dstBegin = stripBegin(i, numStrips, dstHeight);
			int dstEnd   = stripBegin(i + 1, numStrips, dstHeight);

			if (srcBegin < srcEnd)
				preConvertWorkers.add(new PreConvertWorker(src, srcBuffer, srcBegin, srcEnd));

			if (srcBegin < srcEnd && (order == ResamplingOrder.X_ONLY || order == ResamplingOrder.X_FIRST)) {
				float[] out = order == ResamplingOrder.X_ONLY ? dstBuffer : workBuffer;
				step1Workers.add(new HorizontalResampleWorker(srcBuffer, out, srcBegin, srcEnd));
			}

			if (dstBegin < dstEnd) {
				switch (order) {
					case X_ONLY:
						break;
					case Y_ONLY:
						step1Workers.add(new VerticalResampleWorker(srcBuffer, dstBuffer, dstBegin, dstEnd, srcWidth));
						break;
					case X_FIRST:
						step2Workers.add(new VerticalResampleWorker(workBuffer, dstBuffer, dstBegin, dstEnd, dstWidth));
						break;
					case Y_FIRST:
						step1Workers.add(new VerticalResampleWorker(srcBuffer, workBuffer, dstBegin, dstEnd, srcWidth));
						step2Workers.add(new HorizontalResampleWorker(workBuffer, dstBuffer, dstBegin, dstEnd));
						break;
					default:
						throw new AssertionError(order);
				}

				postConvertWorkers.add(new PostConvertWorker(dstBuffer, dst, dstBegin, dstEnd));
			}
		}

		LayeredWorkerQueue<Void> workerQueue = new LayeredWorkerQueue<>();
		workerQueue.addLayer(preConvertWorkers);
		workerQueue.addLayer(step1Workers);
		workerQueue.addLayer(step2Workers);
		workerQueue.addLayer(postConvertWorkers);
		return workerQueue;
	}

	private final class PreConvertWorker implements Callable<Void> {
		private final Raster  src;
		private final float[] outPixels;
		private final int     begin;
		private final int     end;

		private PreConvertWorker(Raster src, float[] outPixels, int begin, int end) {
			this.src = src;
			this.outPixels = outPixels;
			this.begin = begin;
			this.end = end;
		}

		@Override
		public Void call() {
			float[] strip = src.getPixels(0, begin, srcWidth, end - begin, (float[])null);

			if (premultiply) {
				int   alphaBand = numBands - 1;
				float alphaMax  = maxValues[alphaBand];
				for (int p = 0; p < strip.length; p += numBands) {
					float alpha = strip[p + alphaBand] / alphaMax;
					for (int band = 0; band < alphaBand; band++)
						strip[p + band] *= alpha;
				}
			}

			System.arraycopy(strip, 0, outPixels, begin * srcWidth * numBands, strip.length);
			return null;
		}
	}

	private final class HorizontalResampleWorker implements Callable<Void> {
		private final float[] inPixels;
		private final float[] outPixels;
		private final int     begin;
		private final int     end;

		private HorizontalResampleWorker(float[] inPixels, float[] outPixels, int begin, int end) {
			this.inPixels = inPixels;
			this.outPixels = outPixels;
			this.begin = begin;
			this.end = end;
		}

		@Override
		public Void call() throws InterruptedException {
			int      numSamples = horizontalSamplingData.getNumSamples();
			int[]    indices    = horizontalSamplingData.getIndices();
			double[] weights    = horizontalSamplingData.getWeights();

			for (int y = begin; y < end; y++) {
				if (Thread.currentThread().isInterrupted())
					throw new InterruptedException();

				int inRow = y * srcWidth * numBands;
				int out   = y * dstWidth * numBands;

				for (int x = 0; x < dstWidth; x++) {
					int first = x * numSamples;
					for (int band = 0; band < numBands; band++) {
						double sum = 0;
						for (int k = first; k < first + numSamples; k++)
							sum += weights[k] * inPixels[inRow + indices[k] * numBands + band];

						outPixels[out++] = (float)sum;
					}
				}
			}

			return null;
		}
	}

	private final class VerticalResampleWorker implements Callable<Void> {
		private final float[] inPixels;
		private final float[] outPixels;
		private final int     begin;
		private final int     end;
		private final int     rowLength;

		private VerticalResampleWorker(float[] inPixels, float[] outPixels, int begin, int end, int width) {
			this.inPixels = inPixels;
			this.outPixels = outPixels;
			this.begin = begin;
			this.end = end;
			rowLength = width * numBands;
		}

		@Override
		public Void call() throws InterruptedException {
			int      numSamples = verticalSamplingData.getNumSamples();
			int[]    indices    = verticalSamplingData.getIndices();
			double[] weights    = verticalSamplingData.getWeights();

			for (int y = begin; y < end; y++) {
				if (Thread.currentThread().isInterrupted())
					throw new InterruptedException();

				int first = y * numSamples;
				int out   = y * rowLength;

				for (int i = 0; i < rowLength; i++) {
					double sum = 0;
					for (int k = first; k < first + numSamples; k++)
						sum += weights[k] * inPixels[indices[k] * rowLength + i];

					outPixels[out + i] = (float)sum;
				}
			}

			return null;
		}
	}

	private final class PostConvertWorker implements Callable<Void> {
		private final float[]        inPixels;
		private final WritableRaster dst;
		private final int            begin;
		private final int            end;

		private PostConvertWorker(float[] inPixels, WritableRaster dst, int begin, int end) {
			this.inPixels = inPixels;
			this.dst = dst;
			this.begin = begin;
			this.end = end;
		}

		@Override
		public Void call() {
			int   offset = begin * dstWidth * numBands;
			int[] strip  = new int[(end - begin) * dstWidth * numBands];

			if (premultiply) {
				int    alphaBand = numBands - 1;
				double alphaMax  = maxValues[alphaBand];
				for (int p = 0; p < strip.length; p += numBands) {
					double alpha = Math.max(0, Math.min(alphaMax, inPixels[offset + p + alphaBand]));
					double scale = alpha == 0 ? 0 : alphaMax / alpha;
					for (int band = 0; band < alphaBand; band++)
						strip[p + band] = clampSample(inPixels[offset + p + band] * scale, band);

					strip[p + alphaBand] = clampSample(alpha, alphaBand);
				}
			} else if (hasAlpha && isAlphaPre) {
				// A premultiplied color can't exceed its alpha
				int alphaBand = numBands - 1;
				for (int p = 0; p < strip.length; p += numBands) {
					int    alpha         = clampSample(inPixels[offset + p + alphaBand], alphaBand);
					double alphaFraction = alpha / (double)maxValues[alphaBand];
					for (int band = 0; band < alphaBand; band++) {
						int value = clampSample(inPixels[offset + p + band], band);
						strip[p + band] = Math.min(value, (int)Math.round(alphaFraction * maxValues[band]));
					}

					strip[p + alphaBand] = alpha;
				}
			} else {
				for (int p = 0; p < strip.length; p++)
					strip[p] = clampSample(inPixels[offset + p], p % numBands);
			}

			dst.setPixels(0, begin, dstWidth, end - begin, strip);
			return null;
		}
	}
}
