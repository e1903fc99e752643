package borg.ed.phasecorrelation.transform;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.InterleavedF32;
import borg.ed.phasecorrelation.grid.ComplexGrid;
import borg.ed.phasecorrelation.grid.CorrelationSurface;

/**
 * Turns per channel cross-power spectra back into one correlation surface of the un-padded search image size.
 */
public class SurfaceBuilder {

	static final Logger logger = LoggerFactory.getLogger(SurfaceBuilder.class);

	private final ForwardTransformEngine engine;

	public SurfaceBuilder(ForwardTransformEngine engine) {
		this.engine = engine;
	}

	/**
	 * Spatial surface of one channel, cropped to width x height at the origin.
	 *
	 * @param crossPower
	 * 		Phase-only cross-power spectrum with unit magnitude bins
	 */
	public GrayF32 inverse(ComplexGrid crossPower, int width, int height) {
		if (width > crossPower.getWidth() || height > crossPower.getHeight()) {
			throw new IllegalArgumentException("Cannot crop " + width + "x" + height + " from " + crossPower);
		}

		int bins = crossPower.getWidth() * crossPower.getHeight();
		float scale = this.engine.getNormalization().spectrumScale(bins);
		ComplexGrid spectrum = crossPower;
		if (scale != 1f) {
			InterleavedF32 scaled = crossPower.copyData();
			ForwardTransformEngine.scale(scaled, scale);
			spectrum = ComplexGrid.wrap(scaled);
		}

		GrayF32 full = this.engine.inverse(spectrum);
		if (full.width == width && full.height == height) {
			return full;
		} else {
			return full.subimage(0, 0, width, height).clone();
		}
	}

	/**
	 * Inverts every channel and combines the results into one gray surface.
	 */
	public CorrelationSurface build(List<ComplexGrid> crossPowers, int width, int height, ChannelCombination combination) {
		if (crossPowers.isEmpty()) {
			throw new IllegalArgumentException("No cross-power spectra given");
		}
		for (ComplexGrid crossPower : crossPowers) {
			crossPowers.get(0).checkSameShape(crossPower);
		}

		List<GrayF32> channelSurfaces = new ArrayList<>(crossPowers.size());
		for (ComplexGrid crossPower : crossPowers) {
			channelSurfaces.add(this.inverse(crossPower, width, height));
		}
		return combine(channelSurfaces, combination);
	}

	/**
	 * Reduces per channel surfaces of the same size to one. A single surface is passed through unchanged.
	 */
	public static CorrelationSurface combine(List<GrayF32> channelSurfaces, ChannelCombination combination) {
		combination.checkChannels(channelSurfaces.size());

		GrayF32 first = channelSurfaces.get(0);
		for (GrayF32 channelSurface : channelSurfaces) {
			if (channelSurface.width != first.width || channelSurface.height != first.height) {
				throw new IllegalArgumentException("Channel surfaces differ in size");
			}
		}
		if (channelSurfaces.size() == 1) {
			return CorrelationSurface.wrap(first.clone());
		}

		GrayF32 combined = first.createSameShape();
		float[] values = new float[channelSurfaces.size()];
		for (int y = 0; y < combined.height; y++) {
			for (int x = 0; x < combined.width; x++) {
				for (int channel = 0; channel < values.length; channel++) {
					values[channel] = channelSurfaces.get(channel).unsafe_get(x, y);
				}
				combined.unsafe_set(x, y, combination.combine(values));
			}
		}
		return CorrelationSurface.wrap(combined);
	}

}
