package borg.ed.phasecorrelation.visualization;

import java.awt.image.BufferedImage;

import boofcv.io.image.ConvertBufferedImage;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.ed.phasecorrelation.grid.CorrelationSurface;
import borg.ed.phasecorrelation.util.ImageUtil;

/**
 * Display helpers for correlation surfaces. Nothing here affects where a match is found.
 */
public abstract class SurfaceRenderer {

	/**
	 * Control points of the pseudocolor ramp: blue, cyan, green, yellow, red
	 */
	static final float[][] RAMP = { { 0f, 0f, 1f }, { 0f, 1f, 1f }, { 0f, 1f, 0f }, { 1f, 1f, 0f }, { 1f, 0f, 0f } };

	/**
	 * Auto-level: the lowest value of the surface becomes 0.0, the highest 1.0
	 */
	public static GrayF32 stretch(CorrelationSurface surface) {
		return ImageUtil.stretch(surface.copyValues());
	}

	/**
	 * Maps levels in 0.0..1.0 onto a blue to red ramp. Values outside are clamped.
	 *
	 * @return RGB image with bands normalized to 0.0..1.0
	 */
	public static Planar<GrayF32> pseudocolor(GrayF32 levels) {
		Planar<GrayF32> rgb = new Planar<>(GrayF32.class, levels.width, levels.height, 3);
		final int segments = RAMP.length - 1;
		for (int y = 0; y < levels.height; y++) {
			for (int x = 0; x < levels.width; x++) {
				float position = ImageUtil.clamp(levels.unsafe_get(x, y)) * segments;
				int segment = Math.min(segments - 1, (int) position);
				float fraction = position - segment;
				for (int band = 0; band < 3; band++) {
					float from = RAMP[segment][band];
					float to = RAMP[segment + 1][band];
					rgb.getBand(band).unsafe_set(x, y, from + (to - from) * fraction);
				}
			}
		}
		return rgb;
	}

	/**
	 * 8 bit rendering of a surface. Without stretching, values are clamped to 0.0..1.0.
	 */
	public static BufferedImage render(CorrelationSurface surface, boolean stretch, boolean pseudocolor) {
		GrayF32 levels = stretch ? stretch(surface) : surface.copyValues();
		if (pseudocolor) {
			return ConvertBufferedImage.convertTo_F32(ImageUtil.denormalize255(pseudocolor(levels)), null, true);
		} else {
			return ConvertBufferedImage.convertTo(ImageUtil.denormalize255(levels), null);
		}
	}

}
