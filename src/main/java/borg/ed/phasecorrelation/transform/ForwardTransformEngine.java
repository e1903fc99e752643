package borg.ed.phasecorrelation.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.abst.transform.fft.DiscreteFourierTransform;
import boofcv.alg.transform.fft.DiscreteFourierTransformOps;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.InterleavedF32;
import borg.ed.phasecorrelation.NumericCapabilityException;
import borg.ed.phasecorrelation.grid.ComplexGrid;

/**
 * 2-D discrete Fourier transform of real valued grids, with the scaling fixed by one {@link TransformNormalization}.
 * <p>
 * BoofCV's transform leaves the forward direction unscaled and divides by the number of bins on the way back. The
 * {@link TransformNormalization#FORWARD} convention moves that factor into the forward direction, so that forward
 * followed by inverse is the identity either way.
 * <p>
 * Thread safe. The BoofCV transform keeps work buffers, so every call creates its own.
 */
public class ForwardTransformEngine {

	static final Logger logger = LoggerFactory.getLogger(ForwardTransformEngine.class);

	/**
	 * Largest interleaved float buffer a Java array can hold
	 */
	static final long MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

	private final TransformNormalization normalization;
	private final int maxPaddedSize;

	public ForwardTransformEngine(TransformNormalization normalization, int maxPaddedSize) {
		if (normalization == null) {
			throw new NullPointerException("normalization");
		} else if (maxPaddedSize < 2) {
			throw new IllegalArgumentException("Invalid max padded size " + maxPaddedSize);
		}

		this.normalization = normalization;
		this.maxPaddedSize = maxPaddedSize;
	}

	/**
	 * Fails with a {@link NumericCapabilityException} if a square canvas of the given edge length cannot be
	 * transformed. Meant to be called before any work starts.
	 */
	public void checkCapability(int paddedSize) {
		if (paddedSize > this.maxPaddedSize) {
			throw new NumericCapabilityException(paddedSize, "exceeds the configured maximum of " + this.maxPaddedSize);
		} else if (2L * paddedSize * paddedSize > MAX_ARRAY_LENGTH) {
			throw new NumericCapabilityException(paddedSize, "interleaved transform does not fit into a float array");
		}
	}

	public ComplexGrid forward(GrayF32 channel) {
		this.checkCapability(Math.max(channel.width, channel.height));

		InterleavedF32 transform = ComplexGrid.allocate(channel.width, channel.height);
		DiscreteFourierTransform<GrayF32, InterleavedF32> dft = DiscreteFourierTransformOps.createTransformF32();
		dft.forward(channel, transform);

		float scale = this.normalization.forwardScale(channel.width * channel.height);
		if (scale != 1f) {
			scale(transform, scale);
		}
		return ComplexGrid.wrap(transform);
	}

	/**
	 * Inverse transform keeping only the real part. The imaginary residue left by rounding is dropped.
	 */
	public GrayF32 inverse(ComplexGrid spectrum) {
		InterleavedF32 transform = spectrum.copyData();
		GrayF32 result = new GrayF32(spectrum.getWidth(), spectrum.getHeight());
		DiscreteFourierTransform<GrayF32, InterleavedF32> dft = DiscreteFourierTransformOps.createTransformF32();
		dft.setModifyInputs(true);
		dft.inverse(transform, result);

		// BoofCV already divided by the number of bins
		int bins = spectrum.getWidth() * spectrum.getHeight();
		float scale = this.normalization.inverseScale(bins) * bins;
		if (scale != 1f) {
			for (int y = 0; y < result.height; y++) {
				for (int x = 0; x < result.width; x++) {
					result.unsafe_set(x, y, result.unsafe_get(x, y) * scale);
				}
			}
		}
		return result;
	}

	public TransformNormalization getNormalization() {
		return normalization;
	}

	public int getMaxPaddedSize() {
		return maxPaddedSize;
	}

	static void scale(InterleavedF32 transform, float factor) {
		for (int y = 0; y < transform.height; y++) {
			int index = transform.startIndex + y * transform.stride;
			int end = index + transform.width * transform.numBands;
			for (; index < end; index++) {
				transform.data[index] *= factor;
			}
		}
	}

}
