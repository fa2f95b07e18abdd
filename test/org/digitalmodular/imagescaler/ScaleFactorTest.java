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

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class ScaleFactorTest {
	@Test
	void testFactorOfEveryTick() {
		for (int tick = ScaleFactor.MIN_TICK; tick <= ScaleFactor.MAX_TICK; tick++) {
			ScaleFactor scale = ScaleFactor.ofTick(tick);
			assertEquals(tick, scale.getTick());
			assertEquals(tick * 0.05, scale.getFactor(), 1e-12);
			assertEquals(tick * 5, scale.getPercent());
		}
	}

	@Test
	void testNextThenPreviousReturnsToSameTick() {
		for (int tick = ScaleFactor.MIN_TICK; tick < ScaleFactor.MAX_TICK; tick++) {
			ScaleFactor scale = ScaleFactor.ofTick(tick);
			assertSame(scale, scale.next().previous());
		}
	}

	@Test
	void testSteppingIsClamped() {
		assertSame(ScaleFactor.MAX, ScaleFactor.MAX.next());
		assertSame(ScaleFactor.MIN, ScaleFactor.MIN.previous());
		assertTrue(ScaleFactor.MAX.isMax());
		assertTrue(ScaleFactor.MIN.isMin());
		assertFalse(ScaleFactor.UNITY.isMin());
		assertFalse(ScaleFactor.UNITY.isMax());
	}

	@Test
	void testConstants() {
		assertEquals(1, ScaleFactor.MIN.getTick());
		assertEquals(20, ScaleFactor.UNITY.getTick());
		assertEquals(60, ScaleFactor.MAX.getTick());
		assertEquals(1.0, ScaleFactor.UNITY.getFactor());
		assertEquals(3.0, ScaleFactor.MAX.getFactor());
	}

	@Test
	void testInvalidTicks() {
		assertThrows(IllegalArgumentException.class, () -> ScaleFactor.ofTick(0));
		assertThrows(IllegalArgumentException.class, () -> ScaleFactor.ofTick(61));
		assertThrows(IllegalArgumentException.class, () -> ScaleFactor.ofPercent(7));
		assertThrows(IllegalArgumentException.class, () -> ScaleFactor.ofPercent(305));
	}

	@Test
	void testOfPercent() {
		assertSame(ScaleFactor.UNITY, ScaleFactor.ofPercent(100));
		assertEquals(30, ScaleFactor.ofPercent(150).getTick());
	}

	@Test
	void testIsUpscale() {
		assertFalse(ScaleFactor.UNITY.isUpscale());
		assertTrue(ScaleFactor.ofTick(21).isUpscale());
		assertFalse(ScaleFactor.ofTick(19).isUpscale());
	}

	@Test
	void testScaleLength() {
		assertEquals(200, ScaleFactor.UNITY.scaleLength(200));
		assertEquals(210, ScaleFactor.ofTick(21).scaleLength(200));
		assertEquals(1, ScaleFactor.MIN.scaleLength(10));
		// 1.5 rounds up
		assertEquals(2, ScaleFactor.ofTick(10).scaleLength(3));
		// 0.05 never rounds to 0
		assertEquals(1, ScaleFactor.MIN.scaleLength(1));
		assertEquals(3L * Integer.MAX_VALUE, ScaleFactor.MAX.scaleLength(Integer.MAX_VALUE));
		assertThrows(IllegalArgumentException.class, () -> ScaleFactor.UNITY.scaleLength(0));
	}

	@Test
	void testToString() {
		assertEquals("1.00x", ScaleFactor.UNITY.toString());
		assertEquals("1.05x", ScaleFactor.ofTick(21).toString());
		assertEquals("0.05x", ScaleFactor.MIN.toString());
		assertEquals("3.00x", ScaleFactor.MAX.toString());
	}

	@Test
	void testOrdering() {
		assertTrue(ScaleFactor.MIN.compareTo(ScaleFactor.MAX) < 0);
		assertEquals(0, ScaleFactor.UNITY.compareTo(ScaleFactor.ofPercent(100)));
	}
}
