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

import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.FlowLayout;
import java.awt.Font;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import javax.swing.filechooser.FileNameExtensionFilter;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.imagescaler.DimensionOverflowException;
import org.digitalmodular.imagescaler.ImageEncodeException;
import org.digitalmodular.imagescaler.ImageScalerSession;
import org.digitalmodular.imagescaler.InterpolationMethod;
import org.digitalmodular.imagescaler.InvalidImageException;
import org.digitalmodular.imagescaler.RenderRequest;
import org.digitalmodular.imagescaler.ScaledImage;
import org.digitalmodular.imagescaler.SingleFlightRenderer;
import org.digitalmodular.imagescaler.SizeReport;
import org.digitalmodular.imagescaler.SizeReportFormatter;
import org.digitalmodular.imagescaler.UnsupportedImageFormatException;

/**
 * The main window. It only issues commands to the {@link ImageScalerSession} and shows what the session reports.
 * Rendering happens in the background, on a {@link SingleFlightRenderer}.
 *
 * @author Mark Jeronimus
 */
// Created 2025-06-08
public class ImageScalerFrame extends JFrame implements SingleFlightRenderer.RenderCallback {
	private static final long serialVersionUID = 1L;

	public static final String TITLE = "Image Resolution Scaler";

	private static final String[] INFO_TITLES = {
			SizeReportFormatter.SCALE_TITLE,
			SizeReportFormatter.ORIGINAL_SIZE_TITLE,
			SizeReportFormatter.SCALED_SIZE_TITLE,
			SizeReportFormatter.DISPLAYED_SIZE_TITLE};

	private final transient ImageScalerSession   session;
	private final transient SingleFlightRenderer backgroundRenderer;

	private final ImagePanel                     imagePanel         = new ImagePanel("Load an image");
	private final JLabel                         interpolationLabel = new JLabel(" ");
	private final Map<String, JLabel>            infoValues         = new LinkedHashMap<>(8);
	private final JComboBox<InterpolationMethod> methodComboBox     = new JComboBox<>(InterpolationMethod.values());

	private final JButton loadButton     = new JButton("Load Image");
	private final JButton decreaseButton = new JButton("Decrease Resolution");
	private final JButton increaseButton = new JButton("Increase Resolution");
	private final JButton saveButton     = new JButton("Save As...");

	private final JFileChooser fileChooser = new JFileChooser();

	public ImageScalerFrame(ImageScalerSession session) {
		super(TITLE);
		this.session = requireNonNull(session, "session");
		backgroundRenderer = new SingleFlightRenderer(session.getRenderer());

		setDefaultCloseOperation(DISPOSE_ON_CLOSE);
		addWindowListener(new WindowAdapter() {
			@Override
			public void windowClosed(WindowEvent e) {
				backgroundRenderer.close();
			}
		});

		interpolationLabel.setForeground(Color.RED);
		interpolationLabel.setFont(interpolationLabel.getFont().deriveFont(Font.BOLD));
		interpolationLabel.setVisible(false);

		JPanel imageArea = new JPanel(new BorderLayout(0, 5));
		imageArea.add(imagePanel, BorderLayout.CENTER);
		imageArea.add(interpolationLabel, BorderLayout.SOUTH);

		JPanel bottom = new JPanel(new BorderLayout());
		bottom.add(createInfoPanel(), BorderLayout.CENTER);
		bottom.add(createButtonPanel(), BorderLayout.SOUTH);

		JPanel contentPane = new JPanel(new BorderLayout(0, 5));
		contentPane.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
		contentPane.add(imageArea, BorderLayout.CENTER);
		contentPane.add(bottom, BorderLayout.SOUTH);
		setContentPane(contentPane);

		imagePanel.addComponentListener(new ComponentAdapter() {
			@Override
			public void componentResized(ComponentEvent e) {
				updateInfo();
			}
		});

		fileChooser.setFileFilter(new FileNameExtensionFilter("Images (*.png *.jpg *.jpeg *.bmp *.gif)",
		                                                      "png", "jpg", "jpeg", "bmp", "gif"));

		methodComboBox.setSelectedItem(session.getMethod());

		updateControls();

		pack();
		setLocationRelativeTo(null);
	}

	private JPanel createInfoPanel() {
		JPanel grid = new JPanel(new GridBagLayout());

		GridBagConstraints c = new GridBagConstraints();
		c.anchor = GridBagConstraints.WEST;
		c.insets = new Insets(2, 5, 2, 5);

		for (int row = 0; row < INFO_TITLES.length; row++) {
			JLabel value = new JLabel("-");
			infoValues.put(INFO_TITLES[row], value);

			c.gridy = row;
			c.gridx = 0;
			grid.add(new JLabel(INFO_TITLES[row]), c);
			c.gridx = 1;
			grid.add(value, c);
		}

		JPanel centered = new JPanel(new FlowLayout(FlowLayout.CENTER));
		centered.add(grid);
		return centered;
	}

	private JPanel createButtonPanel() {
		loadButton.addActionListener(ignored -> chooseAndLoad());
		decreaseButton.addActionListener(ignored -> decrease());
		increaseButton.addActionListener(ignored -> increase());
		saveButton.addActionListener(ignored -> chooseAndSave());
		methodComboBox.addActionListener(ignored -> methodChanged());

		JPanel buttons = new JPanel(new FlowLayout(FlowLayout.CENTER));
		buttons.add(loadButton);
		buttons.add(decreaseButton);
		buttons.add(increaseButton);
		buttons.add(saveButton);
		buttons.add(new JLabel("Method:"));
		buttons.add(methodComboBox);
		return buttons;
	}

	private void chooseAndLoad() {
		if (fileChooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION)
			return;

		load(fileChooser.getSelectedFile());
	}

	/**
	 * Loads the file and shows it at 100%. On failure, a warning is shown and the previous image stays.
	 */
	public void load(File file) {
		try {
			session.load(file);
		} catch (InvalidImageException ex) {
			Logger.getGlobal().log(Level.WARNING, "Failed to load " + file, ex);
			showWarning("Failed to load image:\n" + ex.getMessage());
			return;
		}

		imagePanel.setImage(null);
		setTitle(TITLE + " - " + file.getName());
		refresh();
	}

	private void decrease() {
		session.decrease();
		refresh();
	}

	private void increase() {
		try {
			session.increase();
		} catch (DimensionOverflowException ex) {
			Logger.getGlobal().log(Level.WARNING, ex.getMessage(), ex);
			showWarning(ex.getMessage());
		}

		refresh();
	}

	private void methodChanged() {
		InterpolationMethod method = (InterpolationMethod)methodComboBox.getSelectedItem();
		if (method == null || method == session.getMethod())
			return;

		session.setMethod(method);
		if (session.hasImage())
			refresh();
	}

	private void chooseAndSave() {
		if (fileChooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION)
			return;

		File file = fileChooser.getSelectedFile();
		try {
			session.save(file);
		} catch (ImageEncodeException ex) {
			Logger.getGlobal().log(Level.WARNING, "Failed to save " + file, ex);
			showWarning("Failed to save image:\n" + ex.getMessage());
		} catch (DimensionOverflowException | UnsupportedImageFormatException ex) {
			Logger.getGlobal().log(Level.WARNING, ex.getMessage(), ex);
			showWarning("Failed to save image:\n" + ex.getMessage());
		} catch (InterruptedException ignored) {
			Thread.currentThread().interrupt();
		}
	}

	private void refresh() {
		backgroundRenderer.submit(session.getRenderRequest(), this);
		updateInfo();
		updateControls();
	}

	private void updateInfo() {
		if (!session.hasImage())
			return;

		SizeReport report;
		try {
			report = session.currentSizeReport(imagePanel.getViewportBound());
		} catch (DimensionOverflowException ex) {
			Logger.getGlobal().log(Level.WARNING, ex.getMessage(), ex);
			return;
		}

		Map<String, String> rows = SizeReportFormatter.formatInfoRows(report);
		for (Map.Entry<String, String> row : rows.entrySet())
			infoValues.get(row.getKey()).setText(row.getValue());

		String methodLabel = session.activeMethodLabel();
		interpolationLabel.setText(methodLabel == null ? " " : methodLabel);
		interpolationLabel.setVisible(methodLabel != null);
	}

	private void updateControls() {
		boolean hasImage = session.hasImage();
		decreaseButton.setEnabled(hasImage && !session.isAtMinScale());
		increaseButton.setEnabled(hasImage && !session.isAtMaxScale());
		saveButton.setEnabled(hasImage);
	}

	@Override
	public void renderCompleted(ScaledImage image) {
		SwingUtilities.invokeLater(() -> {
			if (session.offerRendered(image))
				imagePanel.setImage(image.getImage());
		});
	}

	@Override
	public void renderFailed(RenderRequest request, RuntimeException ex) {
		Logger.getGlobal().log(Level.WARNING, "Failed to render " + request, ex);
		SwingUtilities.invokeLater(() -> showWarning("Failed to scale image:\n" + ex.getMessage()));
	}

	private void showWarning(String message) {
		JOptionPane.showMessageDialog(this, message, "Error", JOptionPane.WARNING_MESSAGE);
	}
}
