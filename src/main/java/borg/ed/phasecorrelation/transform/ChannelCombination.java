package borg.ed.phasecorrelation.transform;

import java.util.Locale;

/**
 * Rule which reduces the per channel correlation surfaces of a colour image to one gray surface. A single channel
 * passes through every rule unchanged.
 */
public enum ChannelCombination {

	/**
	 * Luma weighted sum (Rec. 601: 0.299 R + 0.587 G + 0.114 B), needs exactly three channels
	 */
	GRAY,

	/**
	 * Unweighted mean
	 */
	AVERAGE,

	/**
	 * Root of the mean of squares
	 */
	RMS;

	static final float[] LUMA_WEIGHTS = { 0.299f, 0.587f, 0.114f };

	/**
	 * Fails before any computation if this rule cannot combine the given number of channels.
	 */
	public void checkChannels(int numChannels) {
		if (numChannels < 1) {
			throw new IllegalArgumentException("Nothing to combine");
		} else if (this == GRAY && numChannels != 1 && numChannels != LUMA_WEIGHTS.length) {
			throw new IllegalArgumentException("Gray combination needs 1 or 3 channels, got " + numChannels);
		}
	}

	/**
	 * Combines the values of all channels at one pixel
	 */
	public float combine(float[] values) {
		if (values.length == 1) {
			return values[0];
		}

		switch (this) {
		case GRAY:
			float luma = 0f;
			for (int channel = 0; channel < values.length; channel++) {
				luma += LUMA_WEIGHTS[channel] * values[channel];
			}
			return luma;
		case AVERAGE:
			float sum = 0f;
			for (float value : values) {
				sum += value;
			}
			return sum / values.length;
		case RMS:
			float squares = 0f;
			for (float value : values) {
				squares += value * value;
			}
			return (float) Math.sqrt(squares / values.length);
		default:
			throw new IllegalStateException("Unhandled combination " + this);
		}
	}

	public static ChannelCombination fromName(String name) {
		try {
			return ChannelCombination.valueOf(name.trim().toUpperCase(Locale.US));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown channel combination '" + name + "', expected gray, average or rms", e);
		}
	}

}
