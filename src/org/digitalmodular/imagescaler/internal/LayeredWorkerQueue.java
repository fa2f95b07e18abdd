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
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * A sequence of layers of workers. All workers in a layer can run in parallel, but a layer only becomes eligible when
 * every worker of the previous layer has finished. When retrieving a worker, only an eligible worker will be returned.
 * If there are none, it will block until there is one.
 * <p>
 * A typical use is a two-pass separable resampler, where the second pass reads rows written by any of the workers of
 * the first pass.
 *
 * @param <V> the result type of the worker
 * @author Mark Jeronimus
 */
// Created 2025-06-03
public class LayeredWorkerQueue<V> {
	private final Queue<List<Callable<V>>>         blockedLayers = new LinkedList<>();
	private final BlockingQueue<LayeredCallable>   eligibleQueue = new LinkedBlockingQueue<>();

	/** Workers of the current layer that have been made eligible but haven't finished yet. */
	private int unfinishedInLayer = 0;

	public synchronized void clear() {
		blockedLayers.clear();
		eligibleQueue.clear();
		unfinishedInLayer = 0;
	}

	/**
	 * Adds a layer of workers. The layer becomes eligible as soon as all previously added layers have finished.
	 * Empty layers are ignored.
	 */
	public synchronized void addLayer(Collection<? extends Callable<V>> workers) {
		if (workers.isEmpty())
			return;

		blockedLayers.add(new ArrayList<>(workers));

		if (unfinishedInLayer == 0 && eligibleQueue.isEmpty())
			releaseNextLayer();
	}

	public synchronized boolean hasEligibleWorkers() {
		return !eligibleQueue.isEmpty();
	}

	public Callable<V> takeEligibleWorker() throws InterruptedException {
		return eligibleQueue.take();
	}

	/**
	 * Returns the number of workers that haven't been taken yet.
	 */
	public synchronized int size() {
		int size = eligibleQueue.size();
		for (List<Callable<V>> layer : blockedLayers)
			size += layer.size();
		return size;
	}

	/**
	 * Returns {@code true} when all workers have been taken.
	 */
	public synchronized boolean isEmpty() {
		return blockedLayers.isEmpty() && eligibleQueue.isEmpty();
	}

	synchronized void workerFinished() {
		unfinishedInLayer--;

		if (unfinishedInLayer == 0)
			releaseNextLayer();
	}

	private void releaseNextLayer() {
		List<Callable<V>> layer = blockedLayers.poll();
		if (layer == null)
			return;

		unfinishedInLayer = layer.size();
		for (Callable<V> worker : layer)
			eligibleQueue.add(new LayeredCallable(worker));
	}

	private final class LayeredCallable implements Callable<V> {
		private final Callable<V> worker;

		private LayeredCallable(Callable<V> worker) {
			this.worker = worker;
		}

		@Override
		public V call() throws Exception {
			V result = worker.call();
			workerFinished();
			return result;
		}
	}
}
