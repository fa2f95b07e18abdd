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

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import static java.util.Objects.requireNonNull;

/**
 * Reads and writes image files through {@link ImageIO}.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-05
public enum ImageCodec {
	;

	/** The background that replaces transparency when the output format has no alpha channel. */
	public static final Color FLATTEN_BACKGROUND = Color.WHITE;

	/**
	 * Decodes an image file. Images the resamplers can't process directly (such as palette images) are converted to
	 * 8-bit RGB or ARGB.
	 *
	 * @throws InvalidImageException when the file can't be read or decoded
	 */
	public static SourceImage read(File file) throws InvalidImageException {
		requireNonNull(file, "file");

		BufferedImage image;
		try {
			image = ImageIO.read(file);
		} catch (IOException | RuntimeException ex) {
			throw new InvalidImageException("Can't read " + file + ": " + ex.getMessage(), ex);
		}

		if (image == null)
			throw new InvalidImageException("No decoder understands " + file);

		if (!ImageUtilities.isSupported(image)) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Converting " + ImageUtilities.analyzeImage(image));

			image = ImageUtilities.toSupportedImage(image);
		}

		SourceImage source = new SourceImage(image, file.getName());

		if (Logger.getGlobal().isLoggable(Level.INFO))
			Logger.getGlobal().info("Loaded " + source);

		return source;
	}

	/**
	 * Encodes an image, choosing the format from the file extension.
	 *
	 * @throws ImageEncodeException when the extension is missing or unknown, or writing fails
	 */
	public static void write(BufferedImage image, File file) throws ImageEncodeException {
		String formatName = getFormatName(file);
		if (formatName == null)
			throw new ImageEncodeException("File name has no extension: " + file);

		write(image, file, formatName);
	}

	/**
	 * Encodes an image in the given format. When the format can't store the image as it is, it is reduced to 8 bits
	 * per sample, and if the format can't store transparency either, composited onto {@link #FLATTEN_BACKGROUND}.
	 * <p>
	 * The image is written to a temporary file next to the target and then moved into place, so a failure never
	 * leaves a partially written target file.
	 *
	 * @throws ImageEncodeException when there is no encoder for the format, or writing fails
	 */
	public static void write(BufferedImage image, File file, String formatName) throws ImageEncodeException {
		requireNonNull(image, "image");
		requireNonNull(file, "file");
		requireNonNull(formatName, "formatName");

		BufferedImage encodable = toEncodableImage(image, formatName);
		if (encodable == null)
			throw new ImageEncodeException("No encoder for format '" + formatName + "' and image " +
			                               ImageUtilities.analyzeImage(image));

		Path target = file.toPath().toAbsolutePath();
		Path temp   = null;
		try {
			temp = Files.createTempFile(target.getParent(), '.' + target.getFileName().toString(), ".tmp");

			if (!ImageIO.write(encodable, formatName, temp.toFile()))
				throw new ImageEncodeException("No encoder for format '" + formatName + '\'');

			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			temp = null;
		} catch (ImageEncodeException ex) {
			throw ex;
		} catch (IOException | RuntimeException ex) {
			throw new ImageEncodeException("Can't write " + file + ": " + ex.getMessage(), ex);
		} finally {
			if (temp != null)
				deleteQuietly(temp);
		}

		if (Logger.getGlobal().isLoggable(Level.INFO))
			Logger.getGlobal().info("Saved " + file + " as " + formatName + " (" +
			                        image.getWidth() + '×' + image.getHeight() + ')');
	}

	/**
	 * Returns the image, or a converted copy, that the format can encode. Tries the image as-is, then reduced to 8
	 * bits per sample, then also without transparency.
	 *
	 * @return the encodable image, or {@code null} if the format can't encode any of them
	 */
	private static BufferedImage toEncodableImage(BufferedImage image, String formatName) {
		if (canWrite(image, formatName))
			return image;

		BufferedImage eightBit = ImageUtilities.toEightBitImage(image);
		if (eightBit != image && canWrite(eightBit, formatName)) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Reduced to 8 bits for " + formatName + ": " + ImageUtilities.analyzeImage(image));
			return eightBit;
		}

		BufferedImage flattened = ImageUtilities.flattenAlpha(eightBit, FLATTEN_BACKGROUND);
		if (flattened != eightBit && canWrite(flattened, formatName)) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Flattened alpha for " + formatName + ": " + ImageUtilities.analyzeImage(image));
			return flattened;
		}

		return null;
	}

	private static boolean canWrite(BufferedImage image, String formatName) {
		ImageTypeSpecifier    type    = ImageTypeSpecifier.createFromRenderedImage(image);
		Iterator<ImageWriter> writers = ImageIO.getImageWriters(type, formatName);
		return writers.hasNext();
	}

	private static void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException ex) {
			Logger.getGlobal().log(Level.WARNING, "Can't delete temporary file " + temp, ex);
		}
	}

	/**
	 * Returns the lower-case extension of the file name, or {@code null} when there is none.
	 */
	public static String getFormatName(File file) {
		String name = file.getName();
		int    dot  = name.lastIndexOf('.');
		if (dot < 0 || dot == name.length() - 1)
			return null;

		return name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}
}
