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

package org.digitalmodular.imagescaler.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Jeronimus
 */
// Created 2025-06-09
class LayeredWorkerQueueTest {
	private final List<String> log = new ArrayList<>();

	private Callable<Void> worker(String name) {
		return () -> {
			log.add(name);
			return null;
		};
	}

	@Test
	void testEmpty() {
		LayeredWorkerQueue<Void> queue = new LayeredWorkerQueue<>();
		queue.addLayer(Collections.emptyList());

		assertTrue(queue.isEmpty());
		assertEquals(0, queue.size());
		assertFalse(queue.hasEligibleWorkers());
	}

	@Test
	void testNextLayerWaitsForPreviousLayer() throws Exception {
		LayeredWorkerQueue<Void> queue = new LayeredWorkerQueue<>();
		queue.addLayer(List.of(worker("a1"), worker("a2")));
		queue.addLayer(Collections.emptyList());
		queue.addLayer(List.of(worker("b")));

		assertEquals(3, queue.size());
		assertTrue(queue.hasEligibleWorkers());

		Callable<Void> a1 = queue.takeEligibleWorker();
		Callable<Void> a2 = queue.takeEligibleWorker();
		assertFalse(queue.hasEligibleWorkers());
		assertEquals(1, queue.size());

		a2.call();
		assertFalse(queue.hasEligibleWorkers());

		a1.call();
		assertTrue(queue.hasEligibleWorkers());

		queue.takeEligibleWorker().call();
		assertTrue(queue.isEmpty());
		assertEquals(List.of("a2", "a1", "b"), log);
	}

	@Test
	void testLayerAddedAfterPreviousFinished() throws Exception {
		LayeredWorkerQueue<Void> queue = new LayeredWorkerQueue<>();
		queue.addLayer(List.of(worker("a")));
		queue.takeEligibleWorker().call();

		queue.addLayer(List.of(worker("b")));
		assertTrue(queue.hasEligibleWorkers());
	}

	@Test
	void testClear() {
		LayeredWorkerQueue<Void> queue = new LayeredWorkerQueue<>();
		queue.addLayer(List.of(worker("a")));
		queue.addLayer(List.of(worker("b")));

		queue.clear();

		assertTrue(queue.isEmpty());
		assertFalse(queue.hasEligibleWorkers());
	}
}
