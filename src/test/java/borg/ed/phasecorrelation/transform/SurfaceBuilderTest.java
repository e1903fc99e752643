package borg.ed.phasecorrelation.transform;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.InterleavedF32;
import borg.ed.phasecorrelation.grid.ComplexGrid;
import borg.ed.phasecorrelation.grid.CorrelationSurface;

public class SurfaceBuilderTest {

	private static final float EPSILON = 1e-4f;

	/**
	 * Phase-only spectrum of a unit impulse at x/y
	 */
	private static ComplexGrid impulse(int size, int x, int y) {
		InterleavedF32 data = ComplexGrid.allocate(size, size);
		for (int v = 0; v < size; v++) {
			for (int u = 0; u < size; u++) {
				double angle = -2 * Math.PI * ((double) u * x / size + (double) v * y / size);
				int index = data.startIndex + v * data.stride + u * 2;
				data.data[index] = (float) Math.cos(angle);
				data.data[index + 1] = (float) Math.sin(angle);
			}
		}
		return ComplexGrid.wrap(data);
	}

	@Test
	public void invertsToUnitPeakUnderEitherConvention() {
		for (TransformNormalization normalization : TransformNormalization.values()) {
			SurfaceBuilder builder = new SurfaceBuilder(new ForwardTransformEngine(normalization, 64));

			GrayF32 surface = builder.inverse(impulse(8, 3, 2), 8, 8);

			assertEquals(1f, surface.get(3, 2), EPSILON, normalization.name());
			assertEquals(0f, surface.get(2, 3), EPSILON, normalization.name());
		}
	}

	@Test
	public void cropsToSearchImageSize() {
		SurfaceBuilder builder = new SurfaceBuilder(new ForwardTransformEngine(TransformNormalization.INVERSE, 64));

		CorrelationSurface surface = builder.build(Collections.singletonList(impulse(8, 4, 1)), 7, 3, ChannelCombination.GRAY);

		assertEquals(7, surface.getWidth());
		assertEquals(3, surface.getHeight());
		assertEquals(1f, surface.get(4, 1), EPSILON);
		assertThrows(IllegalArgumentException.class, () -> builder.inverse(impulse(8, 0, 0), 9, 8));
	}

	@Test
	public void combinesChannelSurfaces() {
		GrayF32 red = new GrayF32(2, 1);
		GrayF32 green = new GrayF32(2, 1);
		GrayF32 blue = new GrayF32(2, 1);
		red.set(0, 0, 0.2f);
		green.set(0, 0, 0.4f);
		blue.set(0, 0, 0.6f);

		CorrelationSurface average = SurfaceBuilder.combine(Arrays.asList(red, green, blue), ChannelCombination.AVERAGE);

		assertEquals(0.4f, average.get(0, 0), 1e-6f);
		assertEquals(0f, average.get(1, 0));
		assertThrows(IllegalArgumentException.class, () -> SurfaceBuilder.combine(Arrays.asList(red, green), ChannelCombination.GRAY));
	}

	@Test
	public void rejectsSpectraOfDifferentSize() {
		SurfaceBuilder builder = new SurfaceBuilder(new ForwardTransformEngine(TransformNormalization.INVERSE, 64));

		assertThrows(IllegalArgumentException.class, () -> builder.build(Arrays.asList(impulse(8, 0, 0), impulse(6, 0, 0)), 6, 6, ChannelCombination.AVERAGE));
		assertThrows(IllegalArgumentException.class, () -> builder.build(Collections.emptyList(), 6, 6, ChannelCombination.AVERAGE));
	}

}
