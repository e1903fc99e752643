package borg.ed.phasecorrelation;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;

/**
 * Command line of {@link PhaseCorrelationApplication}. Options left out fall back to the settings file.
 */
public class CommandLineArguments {

	@Parameter(description = "<template> <search>")
	public List<String> images = new ArrayList<>();

	@Parameter(
			names = { "-c", "--combine" },
			description = "Channel combination of colour images: gray, average or rms."
	)
	public String channelCombination;

	@Parameter(
			names = { "-n", "--normalization" },
			description = "Where the 1/N factor of the transforms goes: forward or inverse."
	)
	public String transformNormalization;

	@Parameter(
			names = { "-s", "--stretch" },
			description = "Auto-level the written correlation surface."
	)
	public Boolean stretch;

	@Parameter(
			names = { "-p", "--pseudocolor" },
			description = "Write the correlation surface in pseudocolor."
	)
	public Boolean pseudocolor;

	@Parameter(
			names = { "-b", "--box" },
			description = "Draw a box around the match into the annotated image."
	)
	public Boolean box;

	@Parameter(
			names = "--overlay",
			description = "Blend the template over the match in the annotated image."
	)
	public Boolean overlay;

	@Parameter(
			names = "--surface",
			description = "PNG file to write the correlation surface to."
	)
	public File surfaceFile;

	@Parameter(
			names = "--annotated",
			description = "PNG file to write the annotated search image to."
	)
	public File annotatedFile;

	@Parameter(
			names = "--settings",
			description = "JSON file with defaults for all options."
	)
	public File settingsFile;

	@Parameter(
			names = { "-h", "--help" },
			description = "Show usage.",
			help = true
	)
	public boolean help;

	public File getTemplateFile() {
		return new File(this.images.get(0));
	}

	public File getSearchFile() {
		return new File(this.images.get(1));
	}

	/**
	 * Overrides the given settings with every option present on the command line
	 */
	public MatchSettings applyTo(MatchSettings settings) {
		if (this.channelCombination != null) {
			settings.setChannelCombination(this.channelCombination);
		}
		if (this.transformNormalization != null) {
			settings.setTransformNormalization(this.transformNormalization);
		}
		if (this.stretch != null) {
			settings.setStretch(this.stretch);
		}
		if (this.pseudocolor != null) {
			settings.setPseudocolor(this.pseudocolor);
		}
		if (this.box != null) {
			settings.setBox(this.box);
		}
		if (this.overlay != null) {
			settings.setOverlay(this.overlay);
		}
		return settings;
	}

}
