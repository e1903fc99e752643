package borg.ed.phasecorrelation.transform;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import boofcv.struct.image.GrayF32;
import borg.ed.phasecorrelation.NumericCapabilityException;
import borg.ed.phasecorrelation.TestImages;
import borg.ed.phasecorrelation.grid.ComplexGrid;

public class ForwardTransformEngineTest {

	private static final float EPSILON = 1e-4f;

	@Test
	public void inverseConventionLeavesForwardUnscaled() {
		ComplexGrid transform = new ForwardTransformEngine(TransformNormalization.INVERSE, 64).forward(TestImages.constant(4, 4, 1f).copyChannel(0));

		assertEquals(16f, transform.getReal(0, 0), EPSILON);
		assertEquals(0f, transform.getImaginary(0, 0), EPSILON);
		assertEquals(0f, transform.getMagnitude(1, 0), EPSILON);
		assertEquals(0f, transform.getMagnitude(2, 3), EPSILON);
	}

	@Test
	public void forwardConventionDividesByNumberOfBins() {
		ComplexGrid transform = new ForwardTransformEngine(TransformNormalization.FORWARD, 64).forward(TestImages.constant(4, 4, 1f).copyChannel(0));

		assertEquals(1f, transform.getReal(0, 0), EPSILON);
		assertEquals(0f, transform.getMagnitude(3, 3), EPSILON);
	}

	@ParameterizedTest
	@EnumSource(TransformNormalization.class)
	public void inverseUndoesForward(TransformNormalization normalization) {
		ForwardTransformEngine engine = new ForwardTransformEngine(normalization, 64);
		GrayF32 original = TestImages.texture(16, 16, 1, 3L).getBand(0);

		GrayF32 restored = engine.inverse(engine.forward(original));

		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 16; x++) {
				assertEquals(original.get(x, y), restored.get(x, y), EPSILON, "at " + x + "/" + y);
			}
		}
	}

	@Test
	public void inverseLeavesSpectrumUntouched() {
		ForwardTransformEngine engine = new ForwardTransformEngine(TransformNormalization.INVERSE, 64);
		ComplexGrid spectrum = engine.forward(TestImages.texture(8, 8, 1, 4L).getBand(0));
		float real = spectrum.getReal(1, 2);

		engine.inverse(spectrum);

		assertEquals(real, spectrum.getReal(1, 2));
	}

	@Test
	public void rejectsCanvasLargerThanConfigured() {
		ForwardTransformEngine engine = new ForwardTransformEngine(TransformNormalization.INVERSE, 32);

		assertDoesNotThrow(() -> engine.checkCapability(32));
		NumericCapabilityException e = assertThrows(NumericCapabilityException.class, () -> engine.checkCapability(34));
		assertEquals(34, e.getPaddedSize());
		assertThrows(NumericCapabilityException.class, () -> engine.forward(new GrayF32(34, 34)));
	}

	@Test
	public void rejectsCanvasBeyondArrayLimit() {
		ForwardTransformEngine engine = new ForwardTransformEngine(TransformNormalization.INVERSE, Integer.MAX_VALUE);

		assertThrows(NumericCapabilityException.class, () -> engine.checkCapability(40000));
	}

	@Test
	public void rejectsInvalidConstruction() {
		assertThrows(NullPointerException.class, () -> new ForwardTransformEngine(null, 64));
		assertThrows(IllegalArgumentException.class, () -> new ForwardTransformEngine(TransformNormalization.FORWARD, 1));
	}

}
