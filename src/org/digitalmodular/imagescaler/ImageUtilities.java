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

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;

/**
 * @author Mark Jeronimus
 */
// Created 2009-04-28
// Changed 2025-06-04 Reduced to the functions needed by the resamplers and the codec
public enum ImageUtilities {
	;

	/** The largest number of bits per sample the resamplers accept. */
	public static final int MAX_BITS_PER_SAMPLE = 16;

	// Indexed by BufferedImage.TYPE_*
	private static final String[] IMAGE_TYPE_NAMES = {
			"TYPE_CUSTOM", "TYPE_INT_RGB", "TYPE_INT_ARGB", "TYPE_INT_ARGB_PRE", "TYPE_INT_BGR", "TYPE_3BYTE_BGR",
			"TYPE_4BYTE_ABGR", "TYPE_4BYTE_ABGR_PRE", "TYPE_USHORT_565_RGB", "TYPE_USHORT_555_RGB",
			"TYPE_BYTE_GRAY", "TYPE_USHORT_GRAY", "TYPE_BYTE_BINARY", "TYPE_BYTE_INDEXED"};

	// Indexed by DataBuffer.TYPE_*
	private static final String[] DATA_TYPE_NAMES = {
			"TYPE_BYTE", "TYPE_USHORT", "TYPE_SHORT", "TYPE_INT", "TYPE_FLOAT", "TYPE_DOUBLE"};

	public static String imageTypeName(int type) {
		return type >= 0 && type < IMAGE_TYPE_NAMES.length ? IMAGE_TYPE_NAMES[type] : Integer.toString(type);
	}

	public static String dataTypeName(int type) {
		return type >= 0 && type < DATA_TYPE_NAMES.length ? DATA_TYPE_NAMES[type] : Integer.toString(type);
	}

	/**
	 * Returns a one-line description of the pixel layout, for logging and error messages.
	 */
	public static String analyzeImage(BufferedImage image) {
		ColorModel colorModel = image.getColorModel();
		int        dataType   = image.getRaster().getDataBuffer().getDataType();
		int        colorType  = colorModel.getColorSpace().getType();
		String     colorName  = colorType == ColorSpace.TYPE_GRAY ? "gray"
		                        : colorType == ColorSpace.TYPE_RGB ? "RGB" : "other";

		return imageTypeName(image.getType())
		       + " / " + dataTypeName(dataType)
		       + " / " + image.getRaster().getNumBands() + "ch"
		       + " / " + (colorModel.hasAlpha() ? "alpha" : "opaque")
		       + (colorModel.isAlphaPremultiplied() ? " premultiplied" : "")
		       + " / " + colorName
		       + (colorModel instanceof IndexColorModel ? " / palette" : "");
	}

	/**
	 * Checks whether the resamplers can process the pixels of this image directly.
	 *
	 * @return {@code null} if the image is supported, otherwise a description of the problem
	 */
	public static String getUnsupportedReason(BufferedImage image) {
		ColorModel colorModel = image.getColorModel();
		if (colorModel instanceof IndexColorModel)
			return "palette images are not supported";

		int dataType = image.getRaster().getDataBuffer().getDataType();
		if (dataType != DataBuffer.TYPE_BYTE && dataType != DataBuffer.TYPE_USHORT && dataType != DataBuffer.TYPE_INT)
			return "sample data type " + dataTypeName(dataType) + " is not supported";

		SampleModel sampleModel = image.getSampleModel();
		for (int band = 0; band < sampleModel.getNumBands(); band++) {
			int bits = sampleModel.getSampleSize(band);
			if (bits > MAX_BITS_PER_SAMPLE)
				return bits + " bits in band " + band + " is not supported";
		}

		return null;
	}

	public static boolean isSupported(BufferedImage image) {
		return getUnsupportedReason(image) == null;
	}

	/**
	 * Creates an empty image with the same color model, sample layout and bit depth as the template, but with a
	 * different size.
	 */
	public static BufferedImage createCompatibleImage(BufferedImage template, int width, int height) {
		ColorModel     colorModel = template.getColorModel();
		WritableRaster raster     = template.getRaster().createCompatibleWritableRaster(width, height);
		return new BufferedImage(colorModel, raster, colorModel.isAlphaPremultiplied(), null);
	}

	/**
	 * Creates a deep copy with the same color model, sample layout and bit depth.
	 */
	public static BufferedImage copyImage(BufferedImage image) {
		ColorModel colorModel = image.getColorModel();
		return new BufferedImage(colorModel, image.copyData(null), colorModel.isAlphaPremultiplied(), null);
	}

	/**
	 * Returns an image the resamplers can process. Supported images are returned unchanged. Others (palette images,
	 * floating point samples, etc.) are drawn onto a {@link BufferedImage#TYPE_4BYTE_ABGR} or
	 * {@link BufferedImage#TYPE_3BYTE_BGR} image, depending on transparency.
	 */
	public static BufferedImage toSupportedImage(BufferedImage image) {
		if (isSupported(image))
			return image;

		int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_4BYTE_ABGR : BufferedImage.TYPE_3BYTE_BGR;
		return redraw(image, type, null);
	}

	/**
	 * Returns an image with 8 bits per sample: {@link BufferedImage#TYPE_BYTE_GRAY} for opaque gray images,
	 * otherwise {@link BufferedImage#TYPE_4BYTE_ABGR} or {@link BufferedImage#TYPE_3BYTE_BGR} depending on
	 * transparency. Images that already have one of these types are returned unchanged.
	 */
	public static BufferedImage toEightBitImage(BufferedImage image) {
		ColorModel colorModel = image.getColorModel();
		boolean    gray       = colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY;

		int type;
		if (colorModel.hasAlpha())
			type = BufferedImage.TYPE_4BYTE_ABGR;
		else if (gray)
			type = BufferedImage.TYPE_BYTE_GRAY;
		else
			type = BufferedImage.TYPE_3BYTE_BGR;

		if (image.getType() == type)
			return image;

		return redraw(image, type, null);
	}

	/**
	 * Returns an opaque version of the image, with transparent areas composited over the background color. Opaque
	 * images are returned unchanged. Gray images stay gray.
	 */
	public static BufferedImage flattenAlpha(BufferedImage image, Color background) {
		if (!image.getColorModel().hasAlpha())
			return image;

		boolean gray = image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY;
		return redraw(image, gray ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR, background);
	}

	private static BufferedImage redraw(BufferedImage image, int type, Color background) {
		BufferedImage out = new BufferedImage(image.getWidth(), image.getHeight(), type);

		Graphics2D g = out.createGraphics();
		try {
			if (background != null) {
				g.setColor(background);
				g.fillRect(0, 0, image.getWidth(), image.getHeight());
			} else {
				g.setComposite(AlphaComposite.Src);
			}

			g.drawImage(image, 0, 0, null);
		} finally {
			g.dispose();
		}

		return out;
	}
}
