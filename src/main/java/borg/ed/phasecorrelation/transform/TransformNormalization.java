package borg.ed.phasecorrelation.transform;

import java.util.Locale;

/**
 * Where the 1/N factor of a forward/inverse transform pair goes. One convention must be used for all transforms of a
 * single match; mixing them scales the magnitudes of the template and search transforms differently.
 */
public enum TransformNormalization {

	/**
	 * Forward transform divided by the number of bins, inverse transform unscaled
	 */
	FORWARD {
		@Override
		public float forwardScale(int bins) {
			return 1f / bins;
		}

		@Override
		public float inverseScale(int bins) {
			return 1f;
		}
	},

	/**
	 * Forward transform unscaled, inverse transform divided by the number of bins
	 */
	INVERSE {
		@Override
		public float forwardScale(int bins) {
			return 1f;
		}

		@Override
		public float inverseScale(int bins) {
			return 1f / bins;
		}
	};

	public abstract float forwardScale(int bins);

	public abstract float inverseScale(int bins);

	/**
	 * Magnitude a unit amplitude frequency component carries in this convention's frequency domain. A phase-only
	 * spectrum scaled by this factor inverts to the same surface under either convention.
	 */
	public float spectrumScale(int bins) {
		return this.forwardScale(bins);
	}

	public static TransformNormalization fromName(String name) {
		try {
			return TransformNormalization.valueOf(name.trim().toUpperCase(Locale.US));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown transform normalization '" + name + "', expected forward or inverse", e);
		}
	}

}
