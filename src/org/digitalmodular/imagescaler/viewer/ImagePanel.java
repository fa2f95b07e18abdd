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

package org.digitalmodular.imagescaler.viewer;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import javax.swing.BorderFactory;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;

import org.digitalmodular.imagescaler.SizeReportFormatter;
import org.digitalmodular.imagescaler.util.SizeInt;

/**
 * Shows an image centered and fitted inside the panel, keeping its aspect ratio.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-08
public class ImagePanel extends JPanel {
	private static final long serialVersionUID = 1L;

	private final String placeholder;

	private transient BufferedImage image = null;

	public ImagePanel(String placeholder) {
		this.placeholder = placeholder;

		setBorder(BorderFactory.createLineBorder(Color.GRAY));
		setPreferredSize(new Dimension(600, 400));
		setMinimumSize(new Dimension(300, 300));
	}

	public void setImage(BufferedImage image) {
		if (!SwingUtilities.isEventDispatchThread())
			throw new IllegalStateException("This may only be executed on the EDT");

		this.image = image;
		repaint();
	}

	public BufferedImage getImage() {
		return image;
	}

	/**
	 * Returns the area available to the image, or {@code null} when the panel has no area (yet).
	 */
	public SizeInt getViewportBound() {
		int width  = getWidth() - 2;
		int height = getHeight() - 2;
		return width > 0 && height > 0 ? new SizeInt(width, height) : null;
	}

	@Override
	protected void paintComponent(Graphics g) {
		super.paintComponent(g);

		SizeInt bound = getViewportBound();
		if (bound == null)
			return;

		if (image == null) {
			FontMetrics metrics = g.getFontMetrics();
			int         x       = (getWidth() - metrics.stringWidth(placeholder)) / 2;
			int         y       = (getHeight() - metrics.getHeight()) / 2 + metrics.getAscent();
			g.setColor(getForeground());
			g.drawString(placeholder, x, y);
			return;
		}

		SizeInt displaySize = SizeReportFormatter.fitInside(new SizeInt(image), bound);
		int     x           = (getWidth() - displaySize.getWidth()) / 2;
		int     y           = (getHeight() - displaySize.getHeight()) / 2;

		((Graphics2D)g).setRenderingHint(RenderingHints.KEY_INTERPOLATION,
		                                 RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
		g.drawImage(image, x, y, displaySize.getWidth(), displaySize.getHeight(), null);
	}
}
