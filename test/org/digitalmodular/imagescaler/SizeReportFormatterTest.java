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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class SizeReportFormatterTest {
	@Test
	void testFitInside() {
		assertEquals(new SizeInt(300, 150), SizeReportFormatter.fitInside(new SizeInt(200, 100), new SizeInt(300, 300)));
		assertEquals(new SizeInt(150, 300), SizeReportFormatter.fitInside(new SizeInt(100, 200), new SizeInt(300, 300)));
		assertEquals(new SizeInt(50, 25), SizeReportFormatter.fitInside(new SizeInt(2000, 1000), new SizeInt(50, 300)));
		assertEquals(new SizeInt(10, 1), SizeReportFormatter.fitInside(new SizeInt(1000, 1), new SizeInt(10, 10)));
		assertEquals(new SizeInt(300, 300), SizeReportFormatter.fitInside(new SizeInt(7, 7), new SizeInt(300, 300)));
	}

	@Test
	void testReportWithoutBound() {
		SizeReport report = SizeReportFormatter.createReport(
				new SizeInt(200, 100), ScaleFactor.ofTick(21), new SizeInt(210, 105), null);

		assertEquals(new SizeInt(200, 100), report.getOriginal());
		assertEquals(new SizeInt(210, 105), report.getScaled());
		assertEquals(new SizeInt(210, 105), report.getDisplayed());
		assertTrue(report.isUpscaled());
	}

	@Test
	void testReportWithBound() {
		SizeReport report = SizeReportFormatter.createReport(
				new SizeInt(200, 100), ScaleFactor.UNITY, new SizeInt(200, 100), new SizeInt(100, 100));

		assertEquals(new SizeInt(100, 50), report.getDisplayed());
		assertFalse(report.isUpscaled());
	}

	@Test
	void testInfoRows() {
		SizeReport report = SizeReportFormatter.createReport(
				new SizeInt(200, 100), ScaleFactor.ofTick(21), new SizeInt(210, 105), new SizeInt(420, 420));

		Map<String, String> rows = SizeReportFormatter.formatInfoRows(report);

		assertEquals(Arrays.asList("Scale:", "Original size:", "Current size (with scale):", "Size in frame:"),
		             new ArrayList<>(rows.keySet()));
		assertEquals(Arrays.asList("1.05x", "200×100 px", "210×105 px", "420×210 px"),
		             new ArrayList<>(rows.values()));
	}

	@Test
	void testMethodLabel() {
		assertEquals("Interpolation method: Bicubic", SizeReportFormatter.formatMethodLabel(InterpolationMethod.BICUBIC));
		assertEquals("Interpolation method: Nearest Neighbor",
		             SizeReportFormatter.formatMethodLabel(InterpolationMethod.NEAREST));
	}
}
