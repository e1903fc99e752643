package borg.ed.phasecorrelation.transform;

import borg.ed.phasecorrelation.grid.ComplexGrid;

/**
 * Phase-only spectrum together with the number of bins which had no usable magnitude and were set to zero.
 */
public class NormalizedSpectrum {

	private final ComplexGrid spectrum;
	private final int degenerateBins;

	public NormalizedSpectrum(ComplexGrid spectrum, int degenerateBins) {
		this.spectrum = spectrum;
		this.degenerateBins = degenerateBins;
	}

	public ComplexGrid getSpectrum() {
		return spectrum;
	}

	public int getDegenerateBins() {
		return degenerateBins;
	}

	public boolean isDegenerate() {
		return degenerateBins > 0;
	}

}
