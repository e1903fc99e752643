package borg.ed.phasecorrelation.grid;

import boofcv.struct.image.GrayF32;

/**
 * Single channel correlation result with the size of the un-padded search image. The value at x/y tells how well
 * the template aligns with the search image when its top-left corner is placed at x/y. Values lie roughly in 0..1.
 */
public class CorrelationSurface {

	private final GrayF32 values;

	private CorrelationSurface(GrayF32 values) {
		this.values = values;
	}

	/**
	 * Takes ownership of the given image. The caller must not touch it afterwards.
	 */
	public static CorrelationSurface wrap(GrayF32 values) {
		return new CorrelationSurface(values);
	}

	public int getWidth() {
		return this.values.width;
	}

	public int getHeight() {
		return this.values.height;
	}

	public float get(int x, int y) {
		return this.values.get(x, y);
	}

	public GrayF32 copyValues() {
		return this.values.clone();
	}

	/**
	 * Largest absolute difference to another surface of the same size
	 */
	public float maxDifference(CorrelationSurface other) {
		if (this.getWidth() != other.getWidth() || this.getHeight() != other.getHeight()) {
			throw new IllegalArgumentException("Surfaces differ in size: " + this.getWidth() + "x" + this.getHeight() + " vs " + other.getWidth() + "x" + other.getHeight());
		}
		float max = 0f;
		for (int y = 0; y < this.values.height; y++) {
			for (int x = 0; x < this.values.width; x++) {
				max = Math.max(max, Math.abs(this.values.unsafe_get(x, y) - other.values.unsafe_get(x, y)));
			}
		}
		return max;
	}

}
