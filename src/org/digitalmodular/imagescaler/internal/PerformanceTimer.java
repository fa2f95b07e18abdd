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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the durations of consecutive steps and logs them at {@link Level#FINE}. Recording is skipped entirely when
 * that level isn't loggable.
 *
 * @author Mark Jeronimus
 */
// Created 2015-09-08
// Changed 2025-06-03 Log through java.util.logging instead of printing to stdout
public class PerformanceTimer {
	private final List<Long>   durations    = new ArrayList<>();
	private final List<String> descriptions = new ArrayList<>();

	private boolean enabled;
	private long    startTime;
	private long    lastTime;
	private int     longestDescription;

	public void start() {
		durations.clear();
		descriptions.clear();

		enabled = Logger.getGlobal().isLoggable(Level.FINE);
		startTime = System.nanoTime();
		lastTime = startTime;
		longestDescription = "Total".length();
	}

	public void record(String description) {
		if (!enabled)
			return;

		long time = System.nanoTime();
		durations.add(time - lastTime);
		descriptions.add(description);
		longestDescription = Math.max(longestDescription, description.length());
		lastTime = time;
	}

	/**
	 * Logs the durations of each step, the total, and the number of work units per millisecond.
	 */
	public void logResults(String title, long workload) {
		if (!enabled)
			return;

		String        formatString = "%n  %-" + longestDescription + "s %8.2f ms (%,10.1f/ms)";
		StringBuilder message      = new StringBuilder(title);
		for (int i = 0; i < durations.size(); i++) {
			long duration = durations.get(i);
			message.append(String.format(formatString, descriptions.get(i), duration / 1e6, workload * 1e6 / duration));
		}

		long total = lastTime - startTime;
		message.append(String.format(formatString, "Total", total / 1e6, workload * 1e6 / total));

		Logger.getGlobal().fine(message.toString());
	}
}
