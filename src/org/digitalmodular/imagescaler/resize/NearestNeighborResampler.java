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

import org.digitalmodular.imagescaler.internal.LayeredWorkerQueue;
import static org.digitalmodular.imagescaler.resize.SamplingDataCalculator.createNearestIndices;

/**
 * Copies, for each destination pixel, the source pixel whose area contains the destination pixel center.
 * <p>
 * Samples are copied verbatim (including alpha), so the result never contains values that aren't in the source. This
 * keeps hard edges hard, for example in pixel art. An enlargement by an integer factor {@code k} turns every source
 * pixel into a {@code k×k} block.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-05
public class NearestNeighborResampler extends AbstractImageResampler {
	private int[] columnIndices = null;
	private int[] rowIndices    = null;

	@Override
	protected void resample(Raster src, WritableRaster dst) throws InterruptedException {
		columnIndices = createNearestIndices(srcWidth, dstWidth);
		rowIndices = createNearestIndices(srcHeight, dstHeight);

		int                  numStrips = getNumStrips();
		List<Callable<Void>> workers   = new ArrayList<>(numStrips);
		for (int i = 0; i < numStrips; i++) {
			int begin = stripBegin(i, numStrips, dstHeight);
			int end   = stripBegin(i + 1, numStrips, dstHeight);
			if (begin < end)
				workers.add(new CopyWorker(src, dst, begin, end));
		}

		LayeredWorkerQueue<Void> workerQueue = new LayeredWorkerQueue<>();
		workerQueue.addLayer(workers);

		try {
			runWorkers(workerQueue);
		} finally {
			// GC this:
			columnIndices = null;
			rowIndices = null;
		}
	}

	private final class CopyWorker implements Callable<Void> {
		private final Raster         src;
		private final WritableRaster dst;
		private final int            begin;
		private final int            end;

		private CopyWorker(Raster src, WritableRaster dst, int begin, int end) {
			this.src = src;
			this.dst = dst;
			this.begin = begin;
			this.end = end;
		}

		@Override
		public Void call() throws InterruptedException {
			int[] srcRow = new int[srcWidth * numBands];
			int[] dstRow = new int[dstWidth * numBands];

			int lastSrcY = -1;
			for (int y = begin; y < end; y++) {
				if (Thread.currentThread().isInterrupted())
					throw new InterruptedException();

				int srcY = rowIndices[y];
				if (srcY != lastSrcY) {
					src.getPixels(0, srcY, srcWidth, 1, srcRow);

					int p = 0;
					for (int x = 0; x < dstWidth; x++) {
						int q = columnIndices[x] * numBands;
						for (int band = 0; band < numBands; band++)
							dstRow[p++] = srcRow[q + band];
					}

					lastSrcY = srcY;
				}

				dst.setPixels(0, y, dstWidth, 1, dstRow);
			}

			return null;
		}
	}
}
