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

import org.digitalmodular.imagescaler.resize.filter.ResamplingCurve;

/**
 * Pre-calculates which source samples contribute to each destination sample along one axis, and by how much.
 * <p>
 * Pixel centers are aligned: destination pixel {@code i} samples the source at {@code (i + 0.5) / scale - 0.5},
 * where {@code scale = dstSize / srcSize}. Indices beyond the edge are clamped (edge pixels are replicated).
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
// Changed 2025-06-05 Added nearest-neighbor index tables
public enum SamplingDataCalculator {
	;

	public static final class SamplingData {
		private final int      numSamples;
		private final int[]    indices;
		private final double[] weights;

		private SamplingData(int numSamples, int[] indices, double[] weights) {
			this.numSamples = numSamples;
			this.indices = indices;
			this.weights = weights;
		}

		/**
		 * The number of input samples per output sample.
		 */
		public int getNumSamples() { return numSamples; }

		/**
		 * The input sample positions, {@link #getNumSamples()} consecutive entries for each output sample.
		 */
		public int[] getIndices() { return indices; }

		/**
		 * The normalized input sample weights, laid out like {@link #getIndices()}.
		 */
		public double[] getWeights() { return weights; }
	}

	/**
	 * @param antialias when {@code true} and shrinking, the curve is stretched by {@code 1 / scale} so every source
	 *                  pixel contributes to the result. When {@code false}, the curve keeps its nominal support.
	 */
	public static SamplingData createSubSampling(ResamplingCurve curve, int srcSize, int dstSize, boolean antialias) {
		double scale   = dstSize / (double)srcSize;
		double stretch = getStretch(scale, antialias);
		double radius  = curve.getRadius() / stretch;

		int      numSamples = calculateNumSamples(curve, srcSize, dstSize, antialias);
		int[]    indices    = new int[dstSize * numSamples];
		double[] weights    = new double[dstSize * numSamples];

		int k = 0;
		for (int i = 0; i < dstSize; i++) {
			double center = (i + 0.5) / scale - 0.5;
			int    left   = (int)Math.ceil(center - radius);
			int    first  = k;

			double sum = 0;
			for (int j = left; j < left + numSamples; j++) {
				double weight = curve.apply((j - center) * stretch);

				indices[k] = j < 0 ? 0 : j >= srcSize ? srcSize - 1 : j;
				weights[k] = weight;
				sum += weight;
				k++;
			}

			if (sum != 0) {
				for (int j = first; j < k; j++)
					weights[j] /= sum;
			}
		}

		return new SamplingData(numSamples, indices, weights);
	}

	/**
	 * Calculates the minimum number of taps required to cover the (possibly stretched) curve.
	 */
	public static int calculateNumSamples(ResamplingCurve curve, int srcSize, int dstSize, boolean antialias) {
		double radius = curve.getRadius() / getStretch(dstSize / (double)srcSize, antialias);
		return Math.max(1, (int)Math.ceil(radius * 2));
	}

	private static double getStretch(double scale, boolean antialias) {
		return antialias && scale < 1 ? scale : 1;
	}

	/**
	 * Returns, for each destination position, the source position whose area contains the destination pixel center.
	 * This is {@code floor((i + 0.5) * srcSize / dstSize)} evaluated in integer arithmetic, so an integer
	 * enlargement by {@code k} repeats every source position exactly {@code k} times.
	 */
	public static int[] createNearestIndices(int srcSize, int dstSize) {
		int[] indices = new int[dstSize];

		for (int i = 0; i < dstSize; i++) {
			long index = (2L * i + 1) * srcSize / (2L * dstSize);
			indices[i] = (int)Math.min(index, srcSize - 1);
		}

		return indices;
	}
}
