package borg.ed.phasecorrelation.grid;

import boofcv.struct.image.InterleavedF32;

/**
 * Immutable W x H grid of complex numbers, stored interleaved as BoofCV keeps its Fourier transforms: band 0 holds the
 * real part, band 1 the imaginary part.
 */
public class ComplexGrid {

	private final InterleavedF32 data;

	private ComplexGrid(InterleavedF32 data) {
		this.data = data;
	}

	/**
	 * Takes ownership of the given transform. The caller must not touch it afterwards.
	 */
	public static ComplexGrid wrap(InterleavedF32 transform) {
		if (transform.numBands != 2) {
			throw new IllegalArgumentException("A complex grid needs 2 bands, got " + transform.numBands);
		}
		return new ComplexGrid(transform);
	}

	/**
	 * Empty transform of the given size to be filled by a stage and then {@link #wrap(InterleavedF32) wrapped}
	 */
	public static InterleavedF32 allocate(int width, int height) {
		return new InterleavedF32(width, height, 2);
	}

	public int getWidth() {
		return this.data.width;
	}

	public int getHeight() {
		return this.data.height;
	}

	public float getReal(int x, int y) {
		return this.data.data[this.index(x, y)];
	}

	public float getImaginary(int x, int y) {
		return this.data.data[this.index(x, y) + 1];
	}

	/**
	 * Magnitude sqrt(real&sup2; + imag&sup2;) of one bin
	 */
	public float getMagnitude(int x, int y) {
		int index = this.index(x, y);
		float real = this.data.data[index];
		float imaginary = this.data.data[index + 1];
		return (float) Math.sqrt(real * real + imaginary * imaginary);
	}

	/**
	 * Copy of the underlying transform, e.g. as input for an inverse transform which may modify it.
	 */
	public InterleavedF32 copyData() {
		InterleavedF32 copy = allocate(this.data.width, this.data.height);
		for (int y = 0; y < this.data.height; y++) {
			System.arraycopy(this.data.data, this.data.startIndex + y * this.data.stride, copy.data, copy.startIndex + y * copy.stride, this.data.width * 2);
		}
		return copy;
	}

	public boolean isSameShape(ComplexGrid other) {
		return this.getWidth() == other.getWidth() && this.getHeight() == other.getHeight();
	}

	/**
	 * Rejects grids of different dimensions meeting at a stage boundary
	 */
	public void checkSameShape(ComplexGrid other) {
		if (!this.isSameShape(other)) {
			throw new IllegalArgumentException("Complex grids differ in size: " + this.getWidth() + "x" + this.getHeight() + " vs " + other.getWidth() + "x" + other.getHeight());
		}
	}

	private int index(int x, int y) {
		if (x < 0 || y < 0 || x >= this.data.width || y >= this.data.height) {
			throw new IllegalArgumentException("Bin " + x + "/" + y + " is outside of " + this.data.width + "x" + this.data.height);
		}
		return this.data.startIndex + y * this.data.stride + x * 2;
	}

	@Override
	public String toString() {
		return "complex " + this.getWidth() + "x" + this.getHeight();
	}

}
