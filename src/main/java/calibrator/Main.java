package calibrator;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import nu.pattern.OpenCV;

/*
 * Interactive camera calibration.
 *
 * Show the calibration pattern to the camera from different angles and distances and
 * press Enter (or c) for each view. After the requested number of views the camera
 * parameters are calculated, saved and queued for upload to the calibration server.
 *
 * This Main handles the user and camera interfaces; the capture flow runs on its own
 * thread and the corner finding on another.
 */

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
public class Main {
    private static final String VERSION = "1.0.0"; // change this

    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/

    public static void main(String[] args) throws Exception
    {
        LOGGER = LoggerSetup.setupLogger();
        LOGGER.config("Camera Calibrator version " + VERSION);

        // get the parameters for the user provided options
        LOGGER.config("Command Line Args " + Arrays.toString(args));
        CalibrationConfig config;
        try {
            config = handleArgs(args);
            if (config == null) {
                System.exit(0);
            }
        } catch (ParseException e) {
            LOGGER.severe("Failed to parse command-line options! " + e.getMessage());
            System.exit(1);
            return;
        }
        LOGGER.config(config.toString());

        OpenCV.loadLocally();

        if ( ! FileUploader.createQueueDir(config.queueDir)) {
            System.exit(1);
        }

        // establish keyboard handler
        Keystroke keystroke = new Keystroke();
        Thread keyboardThread = new Thread(keystroke, "keys");
        keyboardThread.setDaemon(true);
        keyboardThread.start();

        VideoCaptureFrameSource source;
        try {
            source = new VideoCaptureFrameSource(config.cameraId, config.imageWidth, config.imageHeight);
        } catch (IllegalStateException e) {
            LOGGER.severe("Unable to open video source. " + e.getMessage());
            System.exit(1);
            return;
        }

        // the session works at the size the camera actually delivers
        try (source;
             CalibrationSession session = new CalibrationSession(config.pattern, config.captureCount,
                source.width(), source.height(), new OpenCvVisionLibrary());
             FileUploader uploader = config.uploadUrl.isEmpty() ? null
                : new FileUploader(config.queueDir, Cfg.queueIndexFileExtension, config.uploadUrl,
                    Duration.ofMillis(Cfg.uploadStatusHideAfterMillis));
             PreviewDisplay preview = config.preview ? new PreviewDisplay("Camera Calibrator", source.width(), source.height()) : null)
        {
            var camera = new CameraDescription(config.deviceId, config.cameraId, 0, config.cameraFacing,
                config.focalLength, source.width(), source.height());
            var saver = new CalibrationResultSaver(config.queueDir, config.saveDir,
                config.uploadUrl, config.authenticationToken, camera, uploader);
            var flow = new FlowController(session, saver);

            flow.start();
            if (uploader != null) {
                uploader.tickle(); // anything left in the queue from before
            }
            try {
                pump(flow, session, source, uploader, keystroke, preview);
            } finally {
                flow.stop();
            }
        } catch (CalibrationConfigurationException e) {
            LOGGER.severe("Calibration settings not usable. " + e.getMessage());
            System.exit(1);
        }

        LOGGER.info("Camera Calibrator ended");
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     pump                                                        */
/*                                     pump                                                        */
/*                                     pump                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Pass camera frames to the session while capturing, pass keys to the flow and
     * report status changes. Returns when the user quits.
     */
    private static void pump(FlowController flow, CalibrationSession session, VideoCaptureFrameSource source,
            FileUploader uploader, Keystroke keystroke, PreviewDisplay preview)
    {
        var lastFlow = Pair.of(FlowState.NOT_INITED, "");
        String lastUploadMessage = "";

        frameGrabLoop:
        while ( ! Thread.interrupted()) {

            // status
            var flowNow = Pair.of(flow.state(), flow.statusMessage());
            if ( ! flowNow.equals(lastFlow)) {
                LOGGER.info(flowNow.getLeft() + (flowNow.getRight().isEmpty() ? "" : " - " + flowNow.getRight()));
                lastFlow = flowNow;
            }
            var uploadStatus = uploader == null ? UploadStatus.NONE : uploader.status(Instant.now());
            if ( ! uploadStatus.message().equals(lastUploadMessage)) {
                if ( ! uploadStatus.message().isEmpty()) {
                    LOGGER.info(uploadStatus.message());
                }
                lastUploadMessage = uploadStatus.message();
            }

            // get any user keyed input, terminal first then the preview window
            int key = keystroke.getKey();
            if (preview != null) {
                int windowKey = preview.show(session.resultBuffer(), session.pattern(),
                    flowNow.getLeft(), flowNow.getRight(), uploadStatus.message());
                if (key == Keystroke.keyNone) {
                    key = windowKey;
                }
            }
            if (key != Keystroke.keyNone) {
                if (Keystroke.isTerminate(key)) {
                    LOGGER.info("Camera Calibrator action CANCELLED");
                    break frameGrabLoop; // quit
                }
                FlowEvent event = Keystroke.toFlowEvent(key);
                if (event != FlowEvent.NONE && ! flow.handleEvent(event)) {
                    LOGGER.fine(event + " not used now");
                }
            }

            if (flowNow.getLeft() == FlowState.CAPTURING) {
                session.submitFrame(source);
            }
            else {
                try {
                    Thread.sleep(Cfg.pumpSleepMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break frameGrabLoop;
                }
            }
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     handleArgs                                                  */
/*                                     handleArgs                                                  */
/*                                     handleArgs                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Parse the command line
     * @param args command line
     * @return the settings, or null if help was requested
     * @throws ParseException unknown option or unusable value
     */
    static CalibrationConfig handleArgs(String[] args) throws ParseException {

        Options options = new Options();

        options.addOption("h", "help", false, "Show this help text and exit");
        options.addOption("c", "cameraId", true, "camera id (0); two forms: 1. integer or 2. stream URL http://...");
        options.addOption("i", "deviceId", true, "camera device id reported with the upload (none; required to upload)");
        options.addOption("F", "facing", true, "camera facing reported with the upload (default)");
        options.addOption("f", "focalLength", true, "camera focal length reported with the upload (0 unknown)");
        options.addOption("W", "width", true, "camera image width (" + Cfg.image_width + ")");
        options.addOption("H", "height", true, "camera image height (" + Cfg.image_height + ")");
        options.addOption("t", "patternType", true, "calibration pattern (CHESSBOARD) " + Arrays.toString(PatternType.values()));
        options.addOption("x", "patternWide", true, "pattern features across (pattern type default)");
        options.addOption("y", "patternHigh", true, "pattern features down (pattern type default)");
        options.addOption("s", "patternSpacing", true, "pattern feature spacing mm (pattern type default)");
        options.addOption("n", "captures", true, "number of pattern views to capture (" + Cfg.calibImageCountMax + ")");
        options.addOption("o", "saveDir", true, "directory to keep a copy of the camera parameters (none)");
        options.addOption("q", "queueDir", true, "upload queue directory (" + Cfg.queueDir + ")");
        options.addOption("u", "uploadUrl", true, "calibration server upload URL (none)");
        options.addOption("a", "authToken", true, "calibration server authentication token (none)");
        options.addOption("P", "preview", false, "show the camera image and found corners in a window");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);

        if(cmd.getArgs().length > 0) {
            LOGGER.warning("Arguments Not Recognized: " + Arrays.toString(cmd.getArgs()));
        }

        if (cmd.hasOption("h")) {
            // make a string to hold the help and log it
            StringWriter sw = new StringWriter(1000);
            PrintWriter pw = new PrintWriter(sw);
            HelpFormatter helpFormatter = new HelpFormatter.Builder().setPrintWriter(pw).get();
            helpFormatter.printHelp("\n\njava -jar <your jar file>.jar [options]", options);
            pw.flush();
            LOGGER.config("\n\n" + sw.toString());
            return null; // exit program
        }

        PatternType patternType;
        try {
            patternType = PatternType.valueOf(cmd.getOptionValue("patternType", "CHESSBOARD").toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ParseException("unknown pattern type " + cmd.getOptionValue("patternType"));
        }

        PatternSpec pattern;
        if (cmd.hasOption("x") || cmd.hasOption("y") || cmd.hasOption("s")) {
            if ( ! (cmd.hasOption("x") && cmd.hasOption("y") && cmd.hasOption("s")) && ! patternType.hasDefaultGeometry()) {
                throw new ParseException("pattern " + patternType + " needs patternWide, patternHigh and patternSpacing");
            }
            var defaultSize = patternType.hasDefaultGeometry() ? patternType.defaultSize() : null;
            pattern = new PatternSpec(patternType,
                intOption(cmd, "x", defaultSize == null ? 0 : (int) defaultSize.width),
                intOption(cmd, "y", defaultSize == null ? 0 : (int) defaultSize.height),
                doubleOption(cmd, "s", patternType.defaultSpacing()));
        }
        else {
            try {
                pattern = PatternSpec.defaultFor(patternType);
            } catch (CalibrationConfigurationException e) {
                throw new ParseException(e.getMessage());
            }
        }

        String cameraId = cmd.getOptionValue("cameraId", "0").trim();
        if ( ! cameraId.contains("://") && ! StringUtils.isNumeric(cameraId))
        {
            throw new ParseException("camera id is neither an integer nor a stream URL: " + cameraId);
        }

        String saveDir = cmd.getOptionValue("saveDir");

        return new CalibrationConfig(
            cameraId,
            cmd.getOptionValue("deviceId", ""),
            cmd.getOptionValue("facing", "default"),
            doubleOption(cmd, "focalLength", 0.),
            intOption(cmd, "width", Cfg.image_width),
            intOption(cmd, "height", Cfg.image_height),
            pattern,
            intOption(cmd, "captures", Cfg.calibImageCountMax),
            StringUtils.isBlank(saveDir) ? null : Path.of(saveDir),
            Path.of(cmd.getOptionValue("queueDir", Cfg.queueDir)),
            StringUtils.trimToEmpty(cmd.getOptionValue("uploadUrl")),
            StringUtils.trimToEmpty(cmd.getOptionValue("authToken")),
            cmd.hasOption("P"));

    } // end handleArgs method

    private static int intOption(CommandLine cmd, String option, int defaultValue) throws ParseException {
        String value = cmd.getOptionValue(option);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ParseException("option " + option + " is not an integer: " + value);
        }
    }

    private static double doubleOption(CommandLine cmd, String option, double defaultValue) throws ParseException {
        String value = cmd.getOptionValue(option);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ParseException("option " + option + " is not a number: " + value);
        }
    }
}
