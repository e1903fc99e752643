package borg.ed.phasecorrelation.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.ed.phasecorrelation.InputSizeException;

/**
 * Pads search image and template to an even, square canvas so both transforms share one size and wrap around
 * symmetrically. The original content stays at the origin, the rest is filled with zero.
 */
public abstract class CanvasNormalizer {

	static final Logger logger = LoggerFactory.getLogger(CanvasNormalizer.class);

	/**
	 * Next even number &gt;= the larger of both dimensions
	 */
	public static int paddedSize(int width, int height) {
		int larger = Math.max(width, height);
		return larger + (larger % 2);
	}

	/**
	 * Fails with an {@link InputSizeException} if the template is wider or higher than the search image.
	 */
	public static void checkFits(PixelGrid template, PixelGrid search) {
		if (template.getWidth() > search.getWidth() || template.getHeight() > search.getHeight()) {
			throw new InputSizeException(template.getWidth(), template.getHeight(), search.getWidth(), search.getHeight());
		}
	}

	public static PaddedCanvas pad(PixelGrid template, PixelGrid search) {
		checkFits(template, search);

		final int size = paddedSize(search.getWidth(), search.getHeight());
		logger.debug("Padding " + search + " search image and " + template + " template to " + size + "x" + size);

		return new PaddedCanvas(padTo(template, size), padTo(search, size), template.getWidth(), template.getHeight(), search.getWidth(), search.getHeight());
	}

	static PixelGrid padTo(PixelGrid grid, int size) {
		Planar<GrayF32> padded = new Planar<>(GrayF32.class, size, size, grid.getNumChannels());
		for (int channel = 0; channel < grid.getNumChannels(); channel++) {
			GrayF32 source = grid.copyChannel(channel);
			GrayF32 target = padded.getBand(channel);
			for (int y = 0; y < source.height; y++) {
				System.arraycopy(source.data, source.startIndex + y * source.stride, target.data, target.startIndex + y * target.stride, source.width);
			}
		}
		return PixelGrid.of(padded);
	}

}
