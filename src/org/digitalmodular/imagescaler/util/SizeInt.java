/*
 * This file has no licence. Replace this class with your own,
 * with a library class (e.g. Dimension from AWT), or keep
 * using it as-is.
 */
package org.digitalmodular.imagescaler.util;

import java.awt.image.BufferedImage;

/**
 * Immutable pixel dimensions. Both sides are strictly positive.
 */
public final class SizeInt {
	private final int width;
	private final int height;

	public SizeInt(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Dimensions must be positive: (" + width + ", " + height + ')');

		this.width = width;
		this.height = height;
	}

	public SizeInt(BufferedImage img) {
		this(img.getWidth(), img.getHeight());
	}

	public int getWidth()  { return width; }

	public int getHeight() { return height; }

	/**
	 * Number of pixels, as a {@code long} so it can't overflow.
	 */
	public long getArea()  { return (long)width * height; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SizeInt)) return false;

		SizeInt other = (SizeInt)o;

		return width == other.width &&
		       height == other.height;
	}

	@Override
	public int hashCode() {
		int hash = 0x4C1DF00D;
		hash *= 0x01000193;
		hash ^= width;
		hash *= 0x01000193;
		hash ^= height;
		return hash;
	}

	/**
	 * Returns the size in the form {@code "200×100"}.
	 */
	@Override
	public String toString() {
		return width + "×" + height;
	}
}
