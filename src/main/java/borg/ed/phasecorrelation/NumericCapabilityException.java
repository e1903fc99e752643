package borg.ed.phasecorrelation;

/**
 * The 32-bit float transform backend cannot hold a transform of the requested size. Raised before any computation.
 */
public class NumericCapabilityException extends PhaseCorrelationException {

	private static final long serialVersionUID = 6071472850907913164L;

	private final int paddedSize;

	public NumericCapabilityException(int paddedSize, String reason) {
		super("Cannot transform a " + paddedSize + "x" + paddedSize + " canvas: " + reason);

		this.paddedSize = paddedSize;
	}

	/**
	 * Edge length of the square canvas that was rejected
	 */
	public int getPaddedSize() {
		return paddedSize;
	}

}
