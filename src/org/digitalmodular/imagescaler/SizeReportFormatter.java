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

import java.util.LinkedHashMap;
import java.util.Map;

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * Creates {@link SizeReport}s and formats them for display.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-03
public enum SizeReportFormatter {
	;

	public static final String SCALE_TITLE          = "Scale:";
	public static final String ORIGINAL_SIZE_TITLE  = "Original size:";
	public static final String SCALED_SIZE_TITLE    = "Current size (with scale):";
	public static final String DISPLAYED_SIZE_TITLE = "Size in frame:";

	public static final String METHOD_LABEL_PREFIX = "Interpolation method: ";

	/**
	 * @param viewportBound the area available for display, or {@code null} to display at the scaled size
	 */
	public static SizeReport createReport(SizeInt original, ScaleFactor scale, SizeInt scaled, SizeInt viewportBound) {
		SizeInt displayed = viewportBound == null ? scaled : fitInside(scaled, viewportBound);
		return new SizeReport(original, scaled, displayed, scale);
	}

	/**
	 * Calculates the largest size with the same aspect ratio as the image that fits inside the bound. This can be
	 * larger than the image itself. Neither side becomes smaller than 1.
	 */
	public static SizeInt fitInside(SizeInt imageSize, SizeInt bound) {
		long wCross = (long)imageSize.getWidth() * bound.getHeight();
		long hCross = (long)imageSize.getHeight() * bound.getWidth();

		long width;
		long height;
		if (wCross > hCross) {
			width = bound.getWidth();
			height = longDivRound(hCross, imageSize.getWidth());
		} else {
			width = longDivRound(wCross, imageSize.getHeight());
			height = bound.getHeight();
		}

		return new SizeInt((int)Math.max(1, Math.min(width, bound.getWidth())),
		                   (int)Math.max(1, Math.min(height, bound.getHeight())));
	}

	/**
	 * @return Same as {@code Math.round((double)numerator / denominator)} for positive numbers, but without
	 * intermediate floating point arithmetic.
	 */
	private static long longDivRound(long numerator, long denominator) {
		return (numerator + denominator / 2) / denominator;
	}

	public static String formatScale(ScaleFactor scale) {
		return scale.toString();
	}

	/**
	 * Returns the size in the form {@code "200×100 px"}.
	 */
	public static String formatSize(SizeInt size) {
		return size + " px";
	}

	/**
	 * Returns the rows of the information table, in display order, from title to value.
	 */
	public static Map<String, String> formatInfoRows(SizeReport report) {
		Map<String, String> rows = new LinkedHashMap<>(8);
		rows.put(SCALE_TITLE, formatScale(report.getScale()));
		rows.put(ORIGINAL_SIZE_TITLE, formatSize(report.getOriginal()));
		rows.put(SCALED_SIZE_TITLE, formatSize(report.getScaled()));
		rows.put(DISPLAYED_SIZE_TITLE, formatSize(report.getDisplayed()));
		return rows;
	}

	public static String formatMethodLabel(InterpolationMethod method) {
		return METHOD_LABEL_PREFIX + method.getLabel();
	}
}
