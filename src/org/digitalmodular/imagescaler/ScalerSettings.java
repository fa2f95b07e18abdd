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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

/**
 * Tuning knobs of the engine. Changes only affect renderers created afterwards.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-06
public class ScalerSettings {
	/** The classpath resource read by {@link #load()}. */
	public static final String RESOURCE_NAME = "/imagescaler.properties";
	/** The prefix of system properties that override the resource. */
	public static final String SYSTEM_PREFIX = "imagescaler.";

	public static final String KEY_NUM_THREADS       = "numThreads";
	public static final String KEY_MAX_OUTPUT_PIXELS = "maxOutputPixels";
	public static final String KEY_ANTIALIAS         = "antialias";
	public static final String KEY_DONT_PRE_ALPHA    = "dontPreAlpha";
	public static final String KEY_DEFAULT_METHOD    = "defaultMethod";

	public static final long DEFAULT_MAX_OUTPUT_PIXELS = 50_000_000L;

	private int                 numThreads      = 0;
	private long                maxOutputPixels = DEFAULT_MAX_OUTPUT_PIXELS;
	private boolean             antialias       = true;
	private boolean             dontPreAlpha    = false;
	private InterpolationMethod defaultMethod   = InterpolationMethod.DEFAULT;

	/**
	 * Reads the settings from {@value #RESOURCE_NAME} when it exists, then applies the system properties that start
	 * with {@value #SYSTEM_PREFIX}.
	 *
	 * @throws IllegalArgumentException when a value can't be parsed
	 */
	public static ScalerSettings load() {
		ScalerSettings settings = new ScalerSettings();

		try (InputStream in = ScalerSettings.class.getResourceAsStream(RESOURCE_NAME)) {
			if (in != null) {
				Properties properties = new Properties();
				properties.load(in);
				settings.apply(properties, "");
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Can't read " + RESOURCE_NAME, ex);
		}

		settings.apply(System.getProperties(), SYSTEM_PREFIX);

		if (Logger.getGlobal().isLoggable(Level.CONFIG))
			Logger.getGlobal().config("Settings: " + settings);

		return settings;
	}

	/**
	 * Applies every known key (after the prefix) found in the properties. Unknown keys are ignored.
	 *
	 * @throws IllegalArgumentException when a value can't be parsed
	 */
	public void apply(Properties properties, String prefix) {
		String value = properties.getProperty(prefix + KEY_NUM_THREADS);
		if (value != null)
			setNumThreads(parseInt(prefix + KEY_NUM_THREADS, value));

		value = properties.getProperty(prefix + KEY_MAX_OUTPUT_PIXELS);
		if (value != null)
			setMaxOutputPixels(parseLong(prefix + KEY_MAX_OUTPUT_PIXELS, value));

		value = properties.getProperty(prefix + KEY_ANTIALIAS);
		if (value != null)
			setAntialias(parseBoolean(prefix + KEY_ANTIALIAS, value));

		value = properties.getProperty(prefix + KEY_DONT_PRE_ALPHA);
		if (value != null)
			setDontPreAlpha(parseBoolean(prefix + KEY_DONT_PRE_ALPHA, value));

		value = properties.getProperty(prefix + KEY_DEFAULT_METHOD);
		if (value != null)
			setDefaultMethod(InterpolationMethod.parse(value));
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException(key + " is not an integer: " + value, ex);
		}
	}

	private static long parseLong(String key, String value) {
		try {
			return Long.parseLong(value.trim().replace("_", ""));
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException(key + " is not an integer: " + value, ex);
		}
	}

	private static boolean parseBoolean(String key, String value) {
		String trimmed = value.trim();
		if ("true".equalsIgnoreCase(trimmed))
			return true;
		else if ("false".equalsIgnoreCase(trimmed))
			return false;

		throw new IllegalArgumentException(key + " is not a boolean: " + value);
	}

	public int getNumThreads() { return numThreads; }

	/**
	 * Set the maximum number of threads per render. Default is {@code 0}, which uses as many threads as there are
	 * processors.
	 */
	public void setNumThreads(int numThreads) {
		if (numThreads < 0)
			throw new IllegalArgumentException("numThreads can't be negative: " + numThreads);
		this.numThreads = numThreads;
	}

	public long getMaxOutputPixels() { return maxOutputPixels; }

	/**
	 * Set the largest number of pixels a rendered image may have. Larger requests fail with a
	 * {@link DimensionOverflowException} before any memory is allocated. Default is
	 * {@value #DEFAULT_MAX_OUTPUT_PIXELS}.
	 */
	public void setMaxOutputPixels(long maxOutputPixels) {
		if (maxOutputPixels < 1)
			throw new IllegalArgumentException("maxOutputPixels must be positive: " + maxOutputPixels);
		this.maxOutputPixels = maxOutputPixels;
	}

	public boolean isAntialias() { return antialias; }

	/**
	 * Set whether the smooth methods widen their curve when shrinking. Default is {@code true}.
	 */
	public void setAntialias(boolean antialias) { this.antialias = antialias; }

	public boolean isDontPreAlpha() { return dontPreAlpha; }

	/**
	 * Set to true to resample alpha like any other channel, without premultiplying. Default is {@code false}.
	 */
	public void setDontPreAlpha(boolean dontPreAlpha) { this.dontPreAlpha = dontPreAlpha; }

	public InterpolationMethod getDefaultMethod() { return defaultMethod; }

	/**
	 * Set the method a new session starts with. Default is {@link InterpolationMethod#DEFAULT}.
	 */
	public void setDefaultMethod(InterpolationMethod defaultMethod) {
		this.defaultMethod = requireNonNull(defaultMethod, "defaultMethod");
	}

	@Override
	public String toString() {
		return KEY_NUM_THREADS + '=' + numThreads +
		       ", " + KEY_MAX_OUTPUT_PIXELS + '=' + maxOutputPixels +
		       ", " + KEY_ANTIALIAS + '=' + antialias +
		       ", " + KEY_DONT_PRE_ALPHA + '=' + dontPreAlpha +
		       ", " + KEY_DEFAULT_METHOD + '=' + defaultMethod.name();
	}
}
