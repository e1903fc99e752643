package borg.ed.phasecorrelation;

/**
 * Base class of all failures raised while locating a template. A failed match never returns a partial result.
 */
public class PhaseCorrelationException extends RuntimeException {

	private static final long serialVersionUID = 3317652046271508113L;

	public PhaseCorrelationException(String message) {
		super(message);
	}

	public PhaseCorrelationException(String message, Throwable cause) {
		super(message, cause);
	}

}
