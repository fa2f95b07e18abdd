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

import org.digitalmodular.imagescaler.UnsupportedImageFormatException;
import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * @author Mark Jeronimus
 */
// Created 2016-05-06
// Changed 2025-06-04 Output size is passed per call instead of stored
public interface ImageResampler {
	int getNumThreads();

	/**
	 * Set the maximum number of threads to utilize. Default is {@code 0}, which automatically uses the same number of
	 * threads as {@code Runtime.getRuntime().availableProcessors()}.
	 */
	void setNumThreads(int numThreads);

	/**
	 * Resizes the image to the specified dimensions. The result has the same color model, sample layout and bit depth
	 * as the input, and never shares its pixel data (if the size doesn't change, a copy is returned). The input image
	 * is only read.
	 * <p>
	 * The cancellation policy is to interrupt this thread. This will interrupt all workers and return as soon
	 * as possible by throwing an {@link InterruptedException}.
	 *
	 * @throws UnsupportedImageFormatException when the pixel layout of the image can't be resampled
	 * @throws InterruptedException            when the thread has been interrupted
	 */
	BufferedImage resize(BufferedImage image, SizeInt outputSize) throws InterruptedException;
}
