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

package org.digitalmodular.imagescaler.viewer;

import java.io.File;
import javax.swing.SwingUtilities;

import org.digitalmodular.imagescaler.ImageScalerSession;
import org.digitalmodular.imagescaler.ScalerSettings;

/**
 * Starts the viewer. Accepts an optional image to open, as either {@code <path>} or {@code load <path>}.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-08
public final class ImageScalerMain {
	public static void main(String[] args) {
		File file = parseStartupFile(args);

		ScalerSettings settings = ScalerSettings.load();

		SwingUtilities.invokeLater(() -> {
			ImageScalerFrame frame = new ImageScalerFrame(new ImageScalerSession(settings));
			frame.setVisible(true);

			if (file != null)
				frame.load(file);
		});
	}

	/**
	 * @return the file to open at startup, or {@code null} when there is none
	 * @throws IllegalArgumentException when the arguments don't match either form
	 */
	static File parseStartupFile(String... args) {
		if (args.length == 0)
			return null;
		else if (args.length == 1)
			return new File(args[0]);
		else if (args.length == 2 && "load".equals(args[0]))
			return new File(args[1]);

		throw new IllegalArgumentException("Usage: ImageScalerMain [[load] <path>]");
	}

	private ImageScalerMain() {
		throw new AssertionError();
	}
}
