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

import static java.util.Objects.requireNonNull;

/**
 * Everything a render depends on. Rendering the same request always gives the same pixels, so a request also serves
 * as the key of a rendered image.
 * <p>
 * Source images are compared by identity: loading the same file twice gives two different requests.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-06
public final class RenderRequest {
	private final SourceImage         source;
	private final ScaleFactor         scale;
	private final InterpolationMethod method;

	public RenderRequest(SourceImage source, ScaleFactor scale, InterpolationMethod method) {
		this.source = requireNonNull(source, "source");
		this.scale = requireNonNull(scale, "scale");
		this.method = requireNonNull(method, "method");
	}

	public SourceImage getSource()         { return source; }

	public ScaleFactor getScale()          { return scale; }

	public InterpolationMethod getMethod() { return method; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof RenderRequest)) return false;

		RenderRequest other = (RenderRequest)o;

		return source == other.source &&
		       scale.equals(other.scale) &&
		       method == other.method;
	}

	@Override
	public int hashCode() {
		int result = System.identityHashCode(source);
		result = 31 * result + scale.hashCode();
		result = 31 * result + method.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "RenderRequest(" + source.getSize() + " @ " + scale + ", " + method + ')';
	}
}
