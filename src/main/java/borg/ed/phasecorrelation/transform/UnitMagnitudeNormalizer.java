package borg.ed.phasecorrelation.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.InterleavedF32;
import borg.ed.phasecorrelation.grid.ComplexGrid;

/**
 * Divides every bin of a transform by its own magnitude, leaving only the phase. This is what turns plain cross
 * correlation into phase correlation.
 * <p>
 * Bins whose magnitude is zero or not finite carry no phase. They are set to zero instead of producing NaN or
 * infinity. Weak bins are kept, however small: smooth images keep most of their phase in them.
 */
public abstract class UnitMagnitudeNormalizer {

	static final Logger logger = LoggerFactory.getLogger(UnitMagnitudeNormalizer.class);

	public static NormalizedSpectrum normalize(ComplexGrid transform) {
		final int width = transform.getWidth();
		final int height = transform.getHeight();

		InterleavedF32 normalized = ComplexGrid.allocate(width, height);
		int degenerateBins = 0;
		for (int y = 0; y < height; y++) {
			int index = normalized.startIndex + y * normalized.stride;
			for (int x = 0; x < width; x++, index += 2) {
				float magnitude = transform.getMagnitude(x, y);
				// NaN fails the comparison
				if (magnitude > 0f && !Float.isInfinite(magnitude)) {
					normalized.data[index] = transform.getReal(x, y) / magnitude;
					normalized.data[index + 1] = transform.getImaginary(x, y) / magnitude;
				} else {
					// Left at zero
					degenerateBins++;
				}
			}
		}

		if (degenerateBins > 0) {
			logger.debug(degenerateBins + " of " + (width * height) + " frequency bins have no usable magnitude and were zeroed");
		}
		return new NormalizedSpectrum(ComplexGrid.wrap(normalized), degenerateBins);
	}

}
