package borg.ed.phasecorrelation.matching;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import borg.ed.phasecorrelation.transform.ChannelCombination;
import borg.ed.phasecorrelation.transform.TransformNormalization;

public class MatchConfigTest {

	@Test
	public void defaultsToGrayInverseAndLargeCanvas() {
		MatchConfig config = MatchConfig.defaults();

		assertEquals(ChannelCombination.GRAY, config.getChannelCombination());
		assertEquals(TransformNormalization.INVERSE, config.getTransformNormalization());
		assertEquals(MatchConfig.DEFAULT_MAX_PADDED_SIZE, config.getMaxPaddedSize());
	}

	@Test
	public void copiesLeaveOriginalUnchanged() {
		MatchConfig config = MatchConfig.defaults().withChannelCombination(ChannelCombination.RMS).withMaxPaddedSize(128);

		assertEquals(ChannelCombination.RMS, config.getChannelCombination());
		assertEquals(128, config.getMaxPaddedSize());
		assertEquals(ChannelCombination.GRAY, MatchConfig.defaults().getChannelCombination());
	}

	@Test
	public void rejectsInvalidValues() {
		assertThrows(NullPointerException.class, () -> MatchConfig.defaults().withTransformNormalization(null));
		assertThrows(IllegalArgumentException.class, () -> MatchConfig.defaults().withMaxPaddedSize(0));
	}

	@Test
	public void resultEqualityIgnoresSurface() {
		MatchResult a = new MatchResult(3, 4, 0.5f, 8, 8, null);
		MatchResult b = new MatchResult(3, 4, 0.5f, 8, 8, null);

		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, new MatchResult(3, 5, 0.5f, 8, 8, null));
		assertEquals("3/4 (8x8) score 0.5000", a.toString());
	}

}
