package borg.ed.phasecorrelation;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import borg.ed.phasecorrelation.grid.ChannelExtractor;
import borg.ed.phasecorrelation.grid.PixelGrid;
import borg.ed.phasecorrelation.matching.MatchConfig;
import borg.ed.phasecorrelation.matching.MatchResult;
import borg.ed.phasecorrelation.matching.PhaseCorrelator;
import borg.ed.phasecorrelation.util.ImageUtil;
import borg.ed.phasecorrelation.visualization.MatchAnnotator;
import borg.ed.phasecorrelation.visualization.SurfaceRenderer;

@Configuration
public class PhaseCorrelationApplication {

	static final Logger logger = LoggerFactory.getLogger(PhaseCorrelationApplication.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	/**
	 * Runs one match as described by the command line and prints <code>x y score</code>.
	 *
	 * @return The process exit code
	 */
	public static int run(String[] args, PrintStream out) {
		CommandLineArguments arguments = new CommandLineArguments();
		JCommander jCommander = JCommander.newBuilder().programName("phase-correlation").addObject(arguments).build();
		try {
			jCommander.parse(args);
		} catch (ParameterException e) {
			logger.error(e.getMessage());
			return EXIT_USAGE;
		}
		if (arguments.help) {
			jCommander.usage();
			return EXIT_OK;
		} else if (arguments.images.size() != 2) {
			logger.error("Expected a template and a search image, got " + arguments.images.size() + " file(s)");
			return EXIT_USAGE;
		}

		try (AnnotationConfigApplicationContext appctx = new AnnotationConfigApplicationContext(PhaseCorrelationApplication.class)) {
			MatchSettings settings = arguments.applyTo(arguments.settingsFile == null ? new MatchSettings() : MatchSettings.load(arguments.settingsFile));
			MatchConfig config = settings.toMatchConfig();

			BufferedImage templateImage = readImage(arguments.getTemplateFile());
			BufferedImage searchImage = readImage(arguments.getSearchFile());
			PixelGrid template = ChannelExtractor.extract(templateImage);
			PixelGrid search = ChannelExtractor.extract(searchImage);
			if (template.getNumChannels() != search.getNumChannels()) {
				// A gray image is expanded to three equal channels
				logger.warn("Template has " + template.getNumChannels() + " channel(s), search image has " + search.getNumChannels() + ", matching both as RGB");
				template = ChannelExtractor.extract(ImageUtil.toRgb(templateImage));
				search = ChannelExtractor.extract(ImageUtil.toRgb(searchImage));
			}

			MatchResult result = appctx.getBean(PhaseCorrelator.class).matchTemplate(template, search, config);
			logger.info("Best match of " + arguments.getTemplateFile().getName() + " in " + arguments.getSearchFile().getName() + ": " + result);
			out.println(String.format(Locale.US, "%d %d %.6f", result.getX(), result.getY(), result.getScore()));

			if (arguments.surfaceFile != null) {
				writeImage(SurfaceRenderer.render(result.getSurface(), settings.isStretch(), settings.isPseudocolor()), arguments.surfaceFile);
			}
			if (arguments.annotatedFile != null) {
				BufferedImage annotated = searchImage;
				if (settings.isOverlay()) {
					annotated = MatchAnnotator.overlay(annotated, templateImage, result, settings.getOverlayOpacity());
				}
				if (settings.isBox() || !settings.isOverlay()) {
					annotated = MatchAnnotator.drawBox(annotated, result, Color.RED);
				}
				writeImage(annotated, arguments.annotatedFile);
			}
			return EXIT_OK;
		} catch (IOException e) {
			logger.error("Failed to match " + arguments.images, e);
			return EXIT_FAILURE;
		} catch (PhaseCorrelationException | IllegalArgumentException e) {
			logger.error("Failed to match " + arguments.images + ": " + e.getMessage());
			return EXIT_FAILURE;
		}
	}

	static BufferedImage readImage(File file) throws IOException {
		BufferedImage image = ImageIO.read(file);
		if (image == null) {
			throw new IOException("No image decoder for " + file);
		}
		return image;
	}

	static void writeImage(BufferedImage image, File file) throws IOException {
		if (!ImageIO.write(image, "PNG", file)) {
			throw new IOException("No PNG encoder available for " + file);
		}
		logger.debug("Wrote " + file);
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService channelExecutor() {
		final AtomicInteger threadNumber = new AtomicInteger(0);
		return Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors(), new ThreadFactory() {
			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r);
				thread.setName("PCThread-" + threadNumber.incrementAndGet());
				thread.setDaemon(true);
				return thread;
			}
		});
	}

	@Bean
	public PhaseCorrelator phaseCorrelator() {
		return new PhaseCorrelator(this.channelExecutor());
	}

}
