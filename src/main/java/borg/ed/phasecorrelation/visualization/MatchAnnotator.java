package borg.ed.phasecorrelation.visualization;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import borg.ed.phasecorrelation.matching.MatchResult;
import borg.ed.phasecorrelation.util.ImageUtil;

/**
 * Marks a match on a copy of the search image. The given images are never changed.
 */
public abstract class MatchAnnotator {

	public static BufferedImage drawBox(BufferedImage search, MatchResult match, Color color) {
		BufferedImage annotated = ImageUtil.toRgb(search);
		Graphics2D g = annotated.createGraphics();
		try {
			g.setColor(color);
			g.setStroke(new BasicStroke(1));
			// Outline covers exactly the matched pixels
			g.drawRect(match.getX(), match.getY(), match.getWidth() - 1, match.getHeight() - 1);
		} finally {
			g.dispose();
		}
		return annotated;
	}

	/**
	 * Blends the template over the search image at the match location.
	 *
	 * @param opacity
	 * 		0.0 leaves the search image visible, 1.0 shows only the template
	 */
	public static BufferedImage overlay(BufferedImage search, BufferedImage template, MatchResult match, float opacity) {
		if (opacity < 0f || opacity > 1f) {
			throw new IllegalArgumentException("Invalid opacity " + opacity);
		}

		BufferedImage annotated = ImageUtil.toRgb(search);
		Graphics2D g = annotated.createGraphics();
		try {
			g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, opacity));
			g.drawImage(template, match.getX(), match.getY(), null);
		} finally {
			g.dispose();
		}
		return annotated;
	}

}
