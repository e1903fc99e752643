package borg.ed.phasecorrelation;

/**
 * The template is larger than the search image in at least one axis.
 */
public class InputSizeException extends PhaseCorrelationException {

	private static final long serialVersionUID = -2190863551744208925L;

	private final int templateWidth;
	private final int templateHeight;
	private final int searchWidth;
	private final int searchHeight;

	public InputSizeException(int templateWidth, int templateHeight, int searchWidth, int searchHeight) {
		super("Template of " + templateWidth + "x" + templateHeight + " does not fit into search image of " + searchWidth + "x" + searchHeight);

		this.templateWidth = templateWidth;
		this.templateHeight = templateHeight;
		this.searchWidth = searchWidth;
		this.searchHeight = searchHeight;
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
