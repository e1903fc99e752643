package borg.ed.phasecorrelation.matching;

import borg.ed.phasecorrelation.grid.CorrelationSurface;

/**
 * Finds the global maximum of a correlation surface.
 */
public abstract class PeakLocator {

	/**
	 * Scans the surface once in row-major order. Ties go to the first occurrence, NaN samples are skipped. A surface
	 * without any usable sample yields 0/0 with score 0.
	 */
	public static MatchResult locatePeak(CorrelationSurface surface, int templateWidth, int templateHeight) {
		int bestX = 0;
		int bestY = 0;
		float bestValue = Float.NEGATIVE_INFINITY;
		for (int y = 0; y < surface.getHeight(); y++) {
			for (int x = 0; x < surface.getWidth(); x++) {
				float value = surface.get(x, y);
				if (value > bestValue) {
					bestValue = value;
					bestX = x;
					bestY = y;
				}
			}
		}
		if (bestValue == Float.NEGATIVE_INFINITY) {
			bestValue = 0f;
		}
		return new MatchResult(bestX, bestY, bestValue, templateWidth, templateHeight, surface);
	}

}
