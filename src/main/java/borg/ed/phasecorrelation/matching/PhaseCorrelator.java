package borg.ed.phasecorrelation.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.ed.phasecorrelation.PhaseCorrelationException;
import borg.ed.phasecorrelation.grid.CanvasNormalizer;
import borg.ed.phasecorrelation.grid.ComplexGrid;
import borg.ed.phasecorrelation.grid.CorrelationSurface;
import borg.ed.phasecorrelation.grid.PaddedCanvas;
import borg.ed.phasecorrelation.grid.PixelGrid;
import borg.ed.phasecorrelation.transform.CrossPowerSpectrumBuilder;
import borg.ed.phasecorrelation.transform.ForwardTransformEngine;
import borg.ed.phasecorrelation.transform.NormalizedSpectrum;
import borg.ed.phasecorrelation.transform.SurfaceBuilder;
import borg.ed.phasecorrelation.transform.UnitMagnitudeNormalizer;

/**
 * Locates a template inside a larger search image by phase correlation.
 * <p>
 * Both images are padded to one even square canvas and transformed channel by channel. Each transform is reduced to
 * its phase, the phases are multiplied into a cross-power spectrum and transformed back. The highest point of the
 * resulting surface is where the template's top-left corner belongs.
 * <p>
 * Channels are independent. With an executor they are processed in parallel, without one on the calling thread.
 * Instances hold no per-match state and can be shared.
 */
public class PhaseCorrelator {

	static final Logger logger = LoggerFactory.getLogger(PhaseCorrelator.class);

	private final ExecutorService executor;

	/**
	 * Processes all channels on the calling thread
	 */
	public PhaseCorrelator() {
		this(null);
	}

	/**
	 * @param executor
	 * 		Runs one task per channel, may be <code>null</code>
	 */
	public PhaseCorrelator(ExecutorService executor) {
		this.executor = executor;
	}

	public MatchResult matchTemplate(PixelGrid template, PixelGrid search) {
		return this.matchTemplate(template, search, MatchConfig.defaults());
	}

	/**
	 * @throws borg.ed.phasecorrelation.InputSizeException
	 * 		If the template is wider or higher than the search image
	 * @throws borg.ed.phasecorrelation.NumericCapabilityException
	 * 		If the padded canvas is too large to be transformed
	 * @throws IllegalArgumentException
	 * 		If the channel counts differ or the combination rule cannot handle them
	 */
	public MatchResult matchTemplate(PixelGrid template, PixelGrid search, MatchConfig config) {
		if (template == null) {
			throw new NullPointerException("template");
		} else if (search == null) {
			throw new NullPointerException("search");
		} else if (config == null) {
			throw new NullPointerException("config");
		}

		// Everything which can fail is checked before the first transform
		if (template.getNumChannels() != search.getNumChannels()) {
			throw new IllegalArgumentException("Template has " + template.getNumChannels() + " channel(s), search image has " + search.getNumChannels());
		}
		config.getChannelCombination().checkChannels(search.getNumChannels());
		CanvasNormalizer.checkFits(template, search);
		final ForwardTransformEngine engine = new ForwardTransformEngine(config.getTransformNormalization(), config.getMaxPaddedSize());
		engine.checkCapability(CanvasNormalizer.paddedSize(search.getWidth(), search.getHeight()));

		final long start = System.currentTimeMillis();
		final PaddedCanvas canvas = CanvasNormalizer.pad(template, search);

		List<ComplexGrid> crossPowers = this.crossPowers(canvas, engine);
		CorrelationSurface surface = new SurfaceBuilder(engine).build(crossPowers, canvas.getSearchWidth(), canvas.getSearchHeight(), config.getChannelCombination());
		MatchResult result = PeakLocator.locatePeak(surface, canvas.getTemplateWidth(), canvas.getTemplateHeight());

		if (logger.isDebugEnabled()) {
			logger.debug("Matched " + template + " in " + search + " (" + config + ") at " + result + " in " + (System.currentTimeMillis() - start) + "ms");
		}
		return result;
	}

	private List<ComplexGrid> crossPowers(PaddedCanvas canvas, ForwardTransformEngine engine) {
		List<Callable<ComplexGrid>> tasks = new ArrayList<>(canvas.getNumChannels());
		for (int channel = 0; channel < canvas.getNumChannels(); channel++) {
			tasks.add(new ChannelTask(canvas, engine, channel));
		}

		List<ComplexGrid> crossPowers = new ArrayList<>(tasks.size());
		if (this.executor == null || tasks.size() == 1) {
			for (Callable<ComplexGrid> task : tasks) {
				try {
					crossPowers.add(task.call());
				} catch (RuntimeException e) {
					throw e;
				} catch (Exception e) {
					throw new PhaseCorrelationException("Failed to correlate a channel", e);
				}
			}
			return crossPowers;
		}

		List<Future<ComplexGrid>> futures = new ArrayList<>(tasks.size());
		for (Callable<ComplexGrid> task : tasks) {
			futures.add(this.executor.submit(task));
		}
		try {
			for (Future<ComplexGrid> future : futures) {
				crossPowers.add(future.get());
			}
			return crossPowers;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PhaseCorrelationException("Interrupted while correlating channels", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			} else if (e.getCause() instanceof Error) {
				throw (Error) e.getCause();
			} else {
				throw new PhaseCorrelationException("Failed to correlate a channel", e.getCause());
			}
		} finally {
			for (Future<ComplexGrid> future : futures) {
				future.cancel(true);
			}
		}
	}

	/**
	 * Forward transforms, phase normalization and cross-power spectrum of one channel
	 */
	static class ChannelTask implements Callable<ComplexGrid> {

		private final PaddedCanvas canvas;
		private final ForwardTransformEngine engine;
		private final int channel;

		ChannelTask(PaddedCanvas canvas, ForwardTransformEngine engine, int channel) {
			this.canvas = canvas;
			this.engine = engine;
			this.channel = channel;
		}

		@Override
		public ComplexGrid call() {
			final long start = System.currentTimeMillis();

			NormalizedSpectrum template = UnitMagnitudeNormalizer.normalize(this.engine.forward(this.canvas.getTemplate().copyChannel(this.channel)));
			NormalizedSpectrum search = UnitMagnitudeNormalizer.normalize(this.engine.forward(this.canvas.getSearch().copyChannel(this.channel)));
			ComplexGrid crossPower = CrossPowerSpectrumBuilder.crossPower(template.getSpectrum(), search.getSpectrum());

			if (logger.isTraceEnabled()) {
				logger.trace("Channel " + this.channel + ": " + template.getDegenerateBins() + "/" + search.getDegenerateBins() + " degenerate bins, " + (System.currentTimeMillis() - start) + "ms");
			}
			return crossPower;
		}

	}

}
