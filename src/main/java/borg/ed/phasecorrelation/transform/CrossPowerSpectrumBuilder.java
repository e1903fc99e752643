package borg.ed.phasecorrelation.transform;

import boofcv.struct.image.InterleavedF32;
import borg.ed.phasecorrelation.grid.ComplexGrid;

/**
 * Complex product of the conjugated template transform with the search transform. Its inverse peaks at the offset
 * which carries the template onto the search image.
 */
public abstract class CrossPowerSpectrumBuilder {

	/**
	 * <code>conj(template) * search</code>, bin by bin. For template = a1 + i a2 and search = b1 + i b2 that is
	 * (a1 b1 + a2 b2) + i (a1 b2 - a2 b1).
	 */
	public static ComplexGrid crossPower(ComplexGrid template, ComplexGrid search) {
		template.checkSameShape(search);

		InterleavedF32 product = ComplexGrid.allocate(search.getWidth(), search.getHeight());
		for (int y = 0; y < search.getHeight(); y++) {
			int index = product.startIndex + y * product.stride;
			for (int x = 0; x < search.getWidth(); x++, index += 2) {
				float a1 = template.getReal(x, y);
				float a2 = template.getImaginary(x, y);
				float b1 = search.getReal(x, y);
				float b2 = search.getImaginary(x, y);
				product.data[index] = a1 * b1 + a2 * b2;
				product.data[index + 1] = a1 * b2 - a2 * b1;
			}
		}
		return ComplexGrid.wrap(product);
	}

}
