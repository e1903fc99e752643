package borg.ed.phasecorrelation.matching;

import java.util.Locale;

import borg.ed.phasecorrelation.grid.CorrelationSurface;

/**
 * Best alignment of a template inside a search image. The template cropped from the search image at x/y with the
 * template's size is the best match.
 */
public class MatchResult {

	private final int x;
	private final int y;
	private final float score;
	private final int width;
	private final int height;
	private final CorrelationSurface surface;

	public MatchResult(int x, int y, float score, int width, int height, CorrelationSurface surface) {
		this.x = x;
		this.y = y;
		this.score = score;
		this.width = width;
		this.height = height;
		this.surface = surface;
	}

	/**
	 * Left edge of the match in the search image
	 */
	public int getX() {
		return x;
	}

	/**
	 * Top edge of the match in the search image
	 */
	public int getY() {
		return y;
	}

	/**
	 * Height of the correlation peak, about 1.0 for a perfect match and close to 0.0 for none
	 */
	public float getScore() {
		return score;
	}

	/**
	 * Template width
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Template height
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * The correlation surface the peak was found on, e.g. for rendering
	 */
	public CorrelationSurface getSurface() {
		return surface;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MatchResult other = (MatchResult) obj;
		if (x != other.x)
			return false;
		if (y != other.y)
			return false;
		if (Float.floatToIntBits(score) != Float.floatToIntBits(other.score))
			return false;
		if (width != other.width)
			return false;
		if (height != other.height)
			return false;
		return true;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + x;
		result = prime * result + y;
		result = prime * result + Float.floatToIntBits(score);
		result = prime * result + width;
		result = prime * result + height;
		return result;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "%d/%d (%dx%d) score %.4f", x, y, width, height, score);
	}

}
