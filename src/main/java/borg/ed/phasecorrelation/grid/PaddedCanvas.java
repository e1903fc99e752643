package borg.ed.phasecorrelation.grid;

/**
 * Template and search image padded to the same even square canvas, both anchored at the origin.
 */
public class PaddedCanvas {

	private final PixelGrid template;
	private final PixelGrid search;
	private final int templateWidth;
	private final int templateHeight;
	private final int searchWidth;
	private final int searchHeight;

	PaddedCanvas(PixelGrid template, PixelGrid search, int templateWidth, int templateHeight, int searchWidth, int searchHeight) {
		this.template = template;
		this.search = search;
		this.templateWidth = templateWidth;
		this.templateHeight = templateHeight;
		this.searchWidth = searchWidth;
		this.searchHeight = searchHeight;
	}

	/**
	 * Padded template, zero outside of the original template area
	 */
	public PixelGrid getTemplate() {
		return template;
	}

	/**
	 * Padded search image, zero outside of the original search area
	 */
	public PixelGrid getSearch() {
		return search;
	}

	/**
	 * Edge length D of the square canvas
	 */
	public int getSize() {
		return search.getWidth();
	}

	public int getNumChannels() {
		return search.getNumChannels();
	}

	public int getTemplateWidth() {
		return templateWidth;
	}

	public int getTemplateHeight() {
		return templateHeight;
	}

	public int getSearchWidth() {
		return searchWidth;
	}

	public int getSearchHeight() {
		return searchHeight;
	}

}
