package borg.ed.phasecorrelation.grid;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;

/**
 * Immutable W x H x C grid of real samples, one {@link GrayF32} band per channel.
 * <p>
 * The bands are copied on the way in and on the way out, so no caller can change a grid after it was captured.
 */
public class PixelGrid {

	private final Planar<GrayF32> bands;

	private PixelGrid(Planar<GrayF32> bands) {
		this.bands = bands;
	}

	/**
	 * Single channel grid copied from the given image
	 */
	public static PixelGrid of(GrayF32 gray) {
		checkSize(gray.width, gray.height);

		Planar<GrayF32> bands = new Planar<>(GrayF32.class, gray.width, gray.height, 1);
		bands.getBand(0).setTo(gray);
		return new PixelGrid(bands);
	}

	/**
	 * Multi channel grid copied from the given planar image, one channel per band
	 */
	public static PixelGrid of(Planar<GrayF32> planar) {
		checkSize(planar.width, planar.height);
		if (planar.getNumBands() < 1) {
			throw new IllegalArgumentException("A pixel grid needs at least one channel");
		}

		Planar<GrayF32> bands = new Planar<>(GrayF32.class, planar.width, planar.height, planar.getNumBands());
		for (int band = 0; band < planar.getNumBands(); band++) {
			bands.getBand(band).setTo(planar.getBand(band));
		}
		return new PixelGrid(bands);
	}

	/**
	 * Grid built from row-major sample arrays, one array of <code>width * height</code> values per channel
	 */
	public static PixelGrid of(int width, int height, float[]... channels) {
		checkSize(width, height);
		if (channels.length < 1) {
			throw new IllegalArgumentException("A pixel grid needs at least one channel");
		}

		Planar<GrayF32> bands = new Planar<>(GrayF32.class, width, height, channels.length);
		for (int band = 0; band < channels.length; band++) {
			float[] samples = channels[band];
			if (samples.length != width * height) {
				throw new IllegalArgumentException("Channel " + band + " has " + samples.length + " samples, expected " + (width * height));
			}
			GrayF32 target = bands.getBand(band);
			for (int y = 0; y < height; y++) {
				System.arraycopy(samples, y * width, target.data, target.startIndex + y * target.stride, width);
			}
		}
		return new PixelGrid(bands);
	}

	private static void checkSize(int width, int height) {
		if (width < 1 || height < 1) {
			throw new IllegalArgumentException("Invalid grid size " + width + "x" + height);
		}
	}

	public int getWidth() {
		return this.bands.width;
	}

	public int getHeight() {
		return this.bands.height;
	}

	public int getNumChannels() {
		return this.bands.getNumBands();
	}

	public float get(int x, int y, int channel) {
		return this.bands.getBand(checkChannel(channel)).get(x, y);
	}

	/**
	 * Copy of one channel. Changing the copy leaves this grid untouched.
	 */
	public GrayF32 copyChannel(int channel) {
		return this.bands.getBand(checkChannel(channel)).clone();
	}

	/**
	 * Copy of all channels as a planar image
	 */
	public Planar<GrayF32> copyBands() {
		return this.bands.clone();
	}

	private int checkChannel(int channel) {
		if (channel < 0 || channel >= this.bands.getNumBands()) {
			throw new IllegalArgumentException("Invalid channel " + channel + " for a grid with " + this.bands.getNumBands() + " channel(s)");
		}
		return channel;
	}

	@Override
	public String toString() {
		return this.getWidth() + "x" + this.getHeight() + "x" + this.getNumChannels();
	}

}
