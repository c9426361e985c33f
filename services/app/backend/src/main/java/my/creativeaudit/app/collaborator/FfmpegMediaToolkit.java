package my.creativeaudit.app.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.creativeaudit.app.model.AudioLevels;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.model.TechnicalMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link MediaToolkit} backed by local ffmpeg/ffprobe binaries. Each operation works in its own temporary
 * directory, removed afterwards.
 */
public class FfmpegMediaToolkit implements MediaToolkit {
	private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaToolkit.class);
	private static final Pattern MEAN_VOLUME = Pattern.compile("mean_volume:\\s*([\\-\\d.]+)\\s*dB");
	private static final double SILENCE_DB = -60.0;
	private static final double VOLUME_JUMP_PERCENT = 10.0;
	private static final long STEP_TIMEOUT_SECONDS = 30;

	private final String ffmpegPath;
	private final String ffprobePath;
	private final ResilientCaller caller;
	private final CallPolicy policy;
	private final ObjectMapper objectMapper;

	public FfmpegMediaToolkit(String ffmpegPath,
							  String ffprobePath,
							  ResilientCaller caller,
							  CallPolicy policy,
							  ObjectMapper objectMapper) {
		this.ffmpegPath = ffmpegPath == null || ffmpegPath.isBlank() ? "ffmpeg" : ffmpegPath;
		this.ffprobePath = ffprobePath == null || ffprobePath.isBlank() ? "ffprobe" : ffprobePath;
		this.caller = caller;
		this.policy = policy;
		this.objectMapper = objectMapper;
	}

	@Override
	public CollaboratorResult<byte[]> trimLeading(byte[] video, double seconds) {
		return caller.call("media.trim", policy, () -> withWorkspace(video, (workspace) -> {
			Path output = workspace.dir().resolve("leading.mp4");
			run(List.of(ffmpegPath, "-y", "-i", workspace.input().toString(), "-t", format(seconds),
					"-c", "copy", output.toString()));
			return readNonEmpty(output);
		}));
	}

	@Override
	public CollaboratorResult<List<byte[]>> extractFrames(byte[] video, List<Double> timestampsSeconds) {
		return caller.call("media.keyframes", policy, () -> withWorkspace(video, (workspace) -> {
			List<byte[]> frames = new ArrayList<>();
			for (int i = 0; i < timestampsSeconds.size(); i++) {
				Path frame = workspace.dir().resolve(String.format(Locale.ROOT, "scene_%03d.jpg", i));
				try {
					run(List.of(ffmpegPath, "-y", "-ss", format(timestampsSeconds.get(i)), "-i", workspace.input().toString(),
							"-vframes", "1", "-q:v", "2",
							"-vf", "scale=640:360:force_original_aspect_ratio=decrease,pad=640:360:(ow-iw)/2:(oh-ih)/2:black",
							frame.toString()));
					frames.add(readNonEmpty(frame));
				} catch (CollaboratorException ex) {
					logger.warn("Keyframe extraction failed for scene {}: {}", i, ex.getMessage());
					frames.add(new byte[0]);
				}
			}
			return frames;
		}));
	}

	@Override
	public CollaboratorResult<AudioLevels> audioLevels(byte[] video, List<Scene> scenes) {
		return caller.call("media.audio", policy, () -> withWorkspace(video, (workspace) -> {
			List<AudioLevels.SceneVolume> volumes = new ArrayList<>();
			double previousPercent = 0.0;
			double totalDb = 0.0;
			for (int i = 0; i < scenes.size(); i++) {
				Scene scene = scenes.get(i);
				double start = scene.startSeconds();
				double end = scene.endSeconds() <= start ? start + 0.5 : scene.endSeconds();
				double meanDb = SILENCE_DB;
				try {
					String stderr = run(List.of(ffmpegPath, "-y", "-ss", format(start), "-to", format(end),
							"-i", workspace.input().toString(), "-af", "volumedetect", "-f", "null", "-"));
					Matcher matcher = MEAN_VOLUME.matcher(stderr);
					if (matcher.find()) {
						meanDb = Double.parseDouble(matcher.group(1));
					}
				} catch (CollaboratorException ex) {
					logger.warn("Volume analysis failed for scene {}: {}", scene.index(), ex.getMessage());
				}
				double percent = round1(Math.max(0.0, Math.min(100.0, (meanDb - SILENCE_DB) / -SILENCE_DB * 100.0)));
				double change = i == 0 ? 0.0 : round1(percent - previousPercent);
				volumes.add(new AudioLevels.SceneVolume(scene.index(), round1(meanDb), percent, change,
						Math.abs(change) > VOLUME_JUMP_PERCENT));
				previousPercent = percent;
				totalDb += meanDb;
			}
			Double mean = scenes.isEmpty() ? null : round1(totalDb / scenes.size());
			return new AudioLevels(mean, volumes);
		}));
	}

	@Override
	public CollaboratorResult<TechnicalMetadata> probe(byte[] video) {
		return caller.call("media.probe", policy, () -> withWorkspace(video, (workspace) -> {
			String stdout = runForStdout(List.of(ffprobePath, "-v", "quiet", "-print_format", "json",
					"-show_format", "-show_streams", workspace.input().toString()));
			try {
				JsonNode root = objectMapper.readTree(stdout);
				JsonNode format = root.path("format");
				JsonNode video0 = null;
				for (JsonNode stream : root.path("streams")) {
					if ("video".equals(stream.path("codec_type").asText())) {
						video0 = stream;
						break;
					}
				}
				Double duration = format.hasNonNull("duration") ? format.get("duration").asDouble() : null;
				Long bitRate = format.hasNonNull("bit_rate") ? format.get("bit_rate").asLong() : null;
				if (video0 == null) {
					return new TechnicalMetadata(duration, null, null, null, null, bitRate);
				}
				return new TechnicalMetadata(
						duration,
						video0.hasNonNull("width") ? video0.get("width").asInt() : null,
						video0.hasNonNull("height") ? video0.get("height").asInt() : null,
						parseFrameRate(video0.path("r_frame_rate").asText(null)),
						video0.path("codec_name").asText(null),
						bitRate
				);
			} catch (IOException ex) {
				throw new CollaboratorException("ffprobe output is not JSON", null, false,
						CollaboratorErrorKind.MALFORMED_RESPONSE, ex);
			}
		}));
	}

	static Double parseFrameRate(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String[] parts = value.split("/");
		try {
			if (parts.length == 2) {
				double denominator = Double.parseDouble(parts[1]);
				return denominator == 0 ? null : round1(Double.parseDouble(parts[0]) / denominator);
			}
			return Double.parseDouble(value);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	private <T> T withWorkspace(byte[] video, Function<Workspace, T> action) {
		Path dir = null;
		try {
			dir = Files.createTempDirectory("media-");
			Path input = dir.resolve("input.mp4");
			Files.write(input, video);
			return action.apply(new Workspace(dir, input));
		} catch (IOException ex) {
			throw new CollaboratorException("Media workspace failed: " + ex.getMessage(), null, false, ex);
		} finally {
			deleteQuietly(dir);
		}
	}

	private String run(List<String> command) {
		return execute(command, true);
	}

	private String runForStdout(List<String> command) {
		return execute(command, false);
	}

	private String execute(List<String> command, boolean captureStderr) {
		Path log = null;
		try {
			log = Files.createTempFile("media-", ".log");
			ProcessBuilder builder = new ProcessBuilder(command);
			if (captureStderr) {
				builder.redirectErrorStream(true);
			} else {
				builder.redirectError(ProcessBuilder.Redirect.DISCARD);
			}
			builder.redirectOutput(log.toFile());
			Process process = builder.start();
			if (!process.waitFor(STEP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				process.destroyForcibly();
				throw new CollaboratorException(command.get(0) + " timed out", null, false, CollaboratorErrorKind.TIMEOUT, null);
			}
			String output = Files.readString(log, StandardCharsets.UTF_8);
			if (process.exitValue() != 0) {
				throw new CollaboratorException(command.get(0) + " exited with " + process.exitValue(), null, false, null);
			}
			return output;
		} catch (IOException ex) {
			throw new CollaboratorException(command.get(0) + " failed: " + ex.getMessage(), null, false, ex);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new CollaboratorException(command.get(0) + " interrupted", null, false, ex);
		} finally {
			deleteQuietly(log);
		}
	}

	private static byte[] readNonEmpty(Path path) {
		try {
			if (!Files.exists(path) || Files.size(path) == 0) {
				throw new CollaboratorException("No output produced: " + path.getFileName(), null, false, null);
			}
			return Files.readAllBytes(path);
		} catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	private static void deleteQuietly(Path path) {
		if (path == null || !Files.exists(path)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(path)) {
			walk.sorted(Comparator.reverseOrder()).forEach(entry -> entry.toFile().delete());
		} catch (IOException ex) {
			logger.debug("Failed to clean up {}: {}", path, ex.getMessage());
		}
	}

	private static String format(double seconds) {
		return String.format(Locale.ROOT, "%.3f", seconds);
	}

	private static double round1(double value) {
		return Math.round(value * 10.0) / 10.0;
	}

	private record Workspace(Path dir, Path input) {
	}
}
