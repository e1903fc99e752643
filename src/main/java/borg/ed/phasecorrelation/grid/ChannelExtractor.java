package borg.ed.phasecorrelation.grid;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.ed.phasecorrelation.util.ImageUtil;

/**
 * Splits a decoded image into one grid channel per colour component. No colour math happens here: gray images give one
 * channel, colour images three (red, green, blue). Alpha is dropped. Samples are normalized to 0.0..1.0.
 */
public abstract class ChannelExtractor {

	static final Logger logger = LoggerFactory.getLogger(ChannelExtractor.class);

	public static PixelGrid extract(BufferedImage image) {
		if (image.getColorModel() instanceof IndexColorModel) {
			// Palette indices carry no intensity, expand to RGB first
			return extract(ImageUtil.toRgb(image));
		}

		Raster raster = image.getRaster();
		int numChannels = image.getColorModel().getNumColorComponents();
		if (numChannels != 1 && numChannels != 3) {
			throw new IllegalArgumentException("Unsupported image with " + numChannels + " colour components");
		}

		Planar<GrayF32> bands = new Planar<>(GrayF32.class, image.getWidth(), image.getHeight(), numChannels);
		float[] row = new float[image.getWidth()];
		for (int band = 0; band < numChannels; band++) {
			GrayF32 target = bands.getBand(band);
			for (int y = 0; y < image.getHeight(); y++) {
				raster.getSamples(0, y, image.getWidth(), 1, band, row);
				System.arraycopy(row, 0, target.data, target.startIndex + y * target.stride, row.length);
			}
		}

		float maxValue = maxSampleValue(raster);
		if (logger.isTraceEnabled()) {
			logger.trace("Extracted " + numChannels + " channel(s) of " + image.getWidth() + "x" + image.getHeight() + ", max sample value " + maxValue);
		}
		return PixelGrid.of(ImageUtil.normalize(bands, maxValue));
	}

	/**
	 * Extracts an already decoded planar image, e.g. straight from BoofCV, with samples in 0..255.
	 */
	public static PixelGrid extract255(Planar<GrayF32> planar) {
		return PixelGrid.of(ImageUtil.normalize(planar, 255f));
	}

	private static float maxSampleValue(Raster raster) {
		int dataType = raster.getDataBuffer().getDataType();
		if (dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE) {
			return 1f;
		} else {
			int bits = raster.getSampleModel().getSampleSize(0);
			return (float) ((1L << bits) - 1);
		}
	}

}
