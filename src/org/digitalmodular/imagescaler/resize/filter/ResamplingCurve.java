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

package org.digitalmodular.imagescaler.resize.filter;

/**
 * A 1-dimensional reconstruction kernel, used separately on each axis by the convolution resamplers.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-02
public interface ResamplingCurve {
	/**
	 * Returns the support radius of the curve in (unscaled) source pixels. The curve is zero outside the open range
	 * {@code (-radius, radius)}.
	 * <p>
	 * For example, linear interpolation needs one pixel on each side, so {@code radius = 1}.
	 */
	double getRadius();

	/**
	 * Calculates the weight of a source sample at fractional distance {@code x} from the sampling position.
	 * <p>
	 * The curve must be symmetric and have the value {@code 1.0} at {@code x = 0}. When it is {@code 0.0} at every
	 * other integer position the curve is interpolating: sampling exactly on a source pixel returns that pixel.
	 *
	 * @param x the fractional pixel distance
	 * @return the unnormalized weight
	 */
	double apply(double x);
}
