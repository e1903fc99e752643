package borg.ed.phasecorrelation.util;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;

public abstract class ImageUtil {

	/**
	 * Hard division by the given maximum sample value. Multiple invocations will divide again.
	 */
	public static GrayF32 normalize(GrayF32 original, float maxValue) {
		GrayF32 normalized = original.createSameShape();
		for (int y = 0; y < original.height; y++) {
			for (int x = 0; x < original.width; x++) {
				normalized.unsafe_set(x, y, original.unsafe_get(x, y) / maxValue);
			}
		}
		return normalized;
	}

	/**
	 * Hard division by the given maximum sample value, band by band. Multiple invocations will divide again.
	 */
	public static Planar<GrayF32> normalize(Planar<GrayF32> original, float maxValue) {
		Planar<GrayF32> normalized = original.createSameShape();
		for (int band = 0; band < original.getNumBands(); band++) {
			normalized.setBand(band, ImageUtil.normalize(original.getBand(band), maxValue));
		}
		return normalized;
	}

	/**
	 * Multiplication by 255 after clamping to 0.0..1.0, ready for an 8 bit image.
	 */
	public static GrayF32 denormalize255(GrayF32 original) {
		GrayF32 denormalized = original.createSameShape();
		for (int y = 0; y < original.height; y++) {
			for (int x = 0; x < original.width; x++) {
				denormalized.unsafe_set(x, y, clamp(original.unsafe_get(x, y)) * 255f);
			}
		}
		return denormalized;
	}

	public static Planar<GrayF32> denormalize255(Planar<GrayF32> original) {
		Planar<GrayF32> denormalized = original.createSameShape();
		for (int band = 0; band < original.getNumBands(); band++) {
			denormalized.setBand(band, ImageUtil.denormalize255(original.getBand(band)));
		}
		return denormalized;
	}

	/**
	 * Linear auto-level: the minimum maps to 0.0, the maximum to 1.0. A flat image maps to 0.0 everywhere.
	 */
	public static GrayF32 stretch(GrayF32 original) {
		float min = Float.POSITIVE_INFINITY;
		float max = Float.NEGATIVE_INFINITY;
		for (int y = 0; y < original.height; y++) {
			for (int x = 0; x < original.width; x++) {
				float v = original.unsafe_get(x, y);
				if (!Float.isNaN(v)) {
					min = Math.min(min, v);
					max = Math.max(max, v);
				}
			}
		}

		GrayF32 stretched = original.createSameShape();
		float range = max - min;
		if (range > 0f) {
			for (int y = 0; y < original.height; y++) {
				for (int x = 0; x < original.width; x++) {
					stretched.unsafe_set(x, y, (original.unsafe_get(x, y) - min) / range);
				}
			}
		}
		return stretched;
	}

	/**
	 * Clamp into 0.0..1.0, NaN becomes 0.0
	 */
	public static float clamp(float value) {
		if (Float.isNaN(value) || value < 0f) {
			return 0f;
		} else if (value > 1f) {
			return 1f;
		} else {
			return value;
		}
	}

	/**
	 * Copy as TYPE_INT_RGB, the type annotations are drawn into
	 */
	public static BufferedImage toRgb(BufferedImage original) {
		BufferedImage rgb = new BufferedImage(original.getWidth(), original.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = rgb.createGraphics();
		try {
			g.drawImage(original, 0, 0, null);
		} finally {
			g.dispose();
		}
		return rgb;
	}

}
