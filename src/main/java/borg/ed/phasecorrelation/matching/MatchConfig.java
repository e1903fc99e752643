package borg.ed.phasecorrelation.matching;

import borg.ed.phasecorrelation.transform.ChannelCombination;
import borg.ed.phasecorrelation.transform.TransformNormalization;

/**
 * Immutable settings of one {@link PhaseCorrelator#matchTemplate(borg.ed.phasecorrelation.grid.PixelGrid, borg.ed.phasecorrelation.grid.PixelGrid, MatchConfig) match}.
 */
public class MatchConfig {

	public static final int DEFAULT_MAX_PADDED_SIZE = 8192;

	private static final MatchConfig DEFAULTS = new MatchConfig(ChannelCombination.GRAY, TransformNormalization.INVERSE, DEFAULT_MAX_PADDED_SIZE);

	private final ChannelCombination channelCombination;
	private final TransformNormalization transformNormalization;
	private final int maxPaddedSize;

	public MatchConfig(ChannelCombination channelCombination, TransformNormalization transformNormalization, int maxPaddedSize) {
		if (channelCombination == null) {
			throw new NullPointerException("channelCombination");
		} else if (transformNormalization == null) {
			throw new NullPointerException("transformNormalization");
		} else if (maxPaddedSize < 2) {
			throw new IllegalArgumentException("Invalid max padded size " + maxPaddedSize);
		}

		this.channelCombination = channelCombination;
		this.transformNormalization = transformNormalization;
		this.maxPaddedSize = maxPaddedSize;
	}

	/**
	 * Gray combination, inverse normalization, canvas up to 8192x8192
	 */
	public static MatchConfig defaults() {
		return DEFAULTS;
	}

	public MatchConfig withChannelCombination(ChannelCombination channelCombination) {
		return new MatchConfig(channelCombination, this.transformNormalization, this.maxPaddedSize);
	}

	public MatchConfig withTransformNormalization(TransformNormalization transformNormalization) {
		return new MatchConfig(this.channelCombination, transformNormalization, this.maxPaddedSize);
	}

	public MatchConfig withMaxPaddedSize(int maxPaddedSize) {
		return new MatchConfig(this.channelCombination, this.transformNormalization, maxPaddedSize);
	}

	public ChannelCombination getChannelCombination() {
		return channelCombination;
	}

	public TransformNormalization getTransformNormalization() {
		return transformNormalization;
	}

	public int getMaxPaddedSize() {
		return maxPaddedSize;
	}

	@Override
	public String toString() {
		return "combination=" + channelCombination + ", normalization=" + transformNormalization + ", maxPaddedSize=" + maxPaddedSize;
	}

}
