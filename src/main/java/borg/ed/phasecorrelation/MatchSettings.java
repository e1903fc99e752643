package borg.ed.phasecorrelation;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import borg.ed.phasecorrelation.matching.MatchConfig;
import borg.ed.phasecorrelation.transform.ChannelCombination;
import borg.ed.phasecorrelation.transform.TransformNormalization;

/**
 * Defaults for the command line, stored as JSON.
 */
public class MatchSettings {

	private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	private String channelCombination = "gray";
	private String transformNormalization = "inverse";
	private int maxPaddedSize = MatchConfig.DEFAULT_MAX_PADDED_SIZE;
	private boolean stretch = false;
	private boolean pseudocolor = false;
	private boolean box = false;
	private boolean overlay = false;
	private float overlayOpacity = 0.5f;

	public static MatchSettings load(File settingsFile) throws IOException {
		try (InputStreamReader reader = new InputStreamReader(new BufferedInputStream(new FileInputStream(settingsFile)), StandardCharsets.UTF_8)) {
			MatchSettings settings = gson.fromJson(reader, MatchSettings.class);
			return settings == null ? new MatchSettings() : settings;
		} catch (JsonParseException e) {
			throw new IOException("Invalid settings file " + settingsFile, e);
		}
	}

	public static void save(File settingsFile, MatchSettings settings) throws IOException {
		try (OutputStreamWriter writer = new OutputStreamWriter(new BufferedOutputStream(new FileOutputStream(settingsFile)), StandardCharsets.UTF_8)) {
			gson.toJson(settings, writer);
		}
	}

	/**
	 * Core configuration described by these settings
	 */
	public MatchConfig toMatchConfig() {
		return new MatchConfig(ChannelCombination.fromName(this.channelCombination), TransformNormalization.fromName(this.transformNormalization), this.maxPaddedSize);
	}

	public String getChannelCombination() {
		return channelCombination;
	}

	public void setChannelCombination(String channelCombination) {
		this.channelCombination = channelCombination;
	}

	public String getTransformNormalization() {
		return transformNormalization;
	}

	public void setTransformNormalization(String transformNormalization) {
		this.transformNormalization = transformNormalization;
	}

	public int getMaxPaddedSize() {
		return maxPaddedSize;
	}

	public void setMaxPaddedSize(int maxPaddedSize) {
		this.maxPaddedSize = maxPaddedSize;
	}

	public boolean isStretch() {
		return stretch;
	}

	public void setStretch(boolean stretch) {
		this.stretch = stretch;
	}

	public boolean isPseudocolor() {
		return pseudocolor;
	}

	public void setPseudocolor(boolean pseudocolor) {
		this.pseudocolor = pseudocolor;
	}

	public boolean isBox() {
		return box;
	}

	public void setBox(boolean box) {
		this.box = box;
	}

	public boolean isOverlay() {
		return overlay;
	}

	public void setOverlay(boolean overlay) {
		this.overlay = overlay;
	}

	public float getOverlayOpacity() {
		return overlayOpacity;
	}

	public void setOverlayOpacity(float overlayOpacity) {
		this.overlayOpacity = overlayOpacity;
	}

}
