package borg.ed.phasecorrelation.util;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import boofcv.struct.image.GrayF32;

public class ImageUtilTest {

	@Test
	public void normalizeAndDenormalize() {
		GrayF32 gray = new GrayF32(3, 1);
		gray.set(0, 0, 51f);
		gray.set(1, 0, 510f);
		gray.set(2, 0, -3f);

		GrayF32 normalized = ImageUtil.normalize(gray, 255f);
		GrayF32 denormalized = ImageUtil.denormalize255(normalized);

		assertEquals(0.2f, normalized.get(0, 0), 1e-6f);
		assertEquals(51f, denormalized.get(0, 0), 1e-4f);
		assertEquals(255f, denormalized.get(1, 0));
		assertEquals(0f, denormalized.get(2, 0));
		assertEquals(51f, gray.get(0, 0));
	}

	@Test
	public void stretchIgnoresNaNAndFlatImages() {
		GrayF32 gray = new GrayF32(3, 1);
		gray.set(0, 0, 2f);
		gray.set(1, 0, Float.NaN);
		gray.set(2, 0, 4f);

		GrayF32 stretched = ImageUtil.stretch(gray);
		assertEquals(0f, stretched.get(0, 0));
		assertEquals(1f, stretched.get(2, 0));

		GrayF32 flat = new GrayF32(2, 2);
		flat.set(1, 1, 0f);
		GrayF32 flatStretched = ImageUtil.stretch(flat);
		assertEquals(0f, flatStretched.get(1, 1));
	}

	@Test
	public void clamp() {
		assertEquals(0f, ImageUtil.clamp(Float.NaN));
		assertEquals(0f, ImageUtil.clamp(-1f));
		assertEquals(1f, ImageUtil.clamp(3f));
		assertEquals(0.25f, ImageUtil.clamp(0.25f));
	}

	@Test
	public void toRgbCopies() {
		BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
		gray.getRaster().setSample(1, 1, 0, 255);

		BufferedImage rgb = ImageUtil.toRgb(gray);

		assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
		assertEquals(0xFFFFFF, rgb.getRGB(1, 1) & 0xFFFFFF);
		rgb.setRGB(0, 0, 0xFFFFFF);
		assertEquals(0, gray.getRaster().getSample(0, 0, 0));
	}

}
