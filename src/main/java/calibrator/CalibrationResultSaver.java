package calibrator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationResultSaver class                                */
/*                                     CalibrationResultSaver class                                */
/*                                     CalibrationResultSaver class                                */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Saves each successful calibration and queues it for upload.
 *
 * The parameters are written as JSON to the queue directory, named by the UTC time of
 * day, copied to the save directory if there is one, and described by an index file
 * that the FileUploader posts to the server.
 */
public class CalibrationResultSaver implements CompletionCallback
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    static final int indexFileVersion = 1;
    private static final DateTimeFormatter idFormat = DateTimeFormatter.ofPattern("HHmmss");
    private static final DateTimeFormatter timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss '+0000'");

    private final Path queueDir;
    private final Path saveDir; // may be null
    private final String uploadUrl; // may be null
    private final String authenticationToken; // may be null
    private final CameraDescription camera;
    private final FileUploader uploader; // may be null
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param queueDir upload queue directory
     * @param saveDir where to keep a copy of the parameters; null for none
     * @param uploadUrl server form URL; null or empty to not upload
     * @param authenticationToken shared secret identifying this calibrator to the server; null for none
     * @param camera the camera being calibrated
     * @param uploader upload queue to tickle; null for none
     */
    public CalibrationResultSaver(Path queueDir, Path saveDir, String uploadUrl, String authenticationToken,
            CameraDescription camera, FileUploader uploader)
    {
        this(queueDir, saveDir, uploadUrl, authenticationToken, camera, uploader, Clock.systemUTC());
    }

    CalibrationResultSaver(Path queueDir, Path saveDir, String uploadUrl, String authenticationToken,
            CameraDescription camera, FileUploader uploader, Clock clock)
    {
        this.queueDir = queueDir;
        this.saveDir = saveDir;
        this.uploadUrl = uploadUrl;
        this.authenticationToken = authenticationToken;
        this.camera = camera;
        this.uploader = uploader;
        this.clock = clock;
    }

    @Override
    public void calibrationCompleted(CalibrationOutcome outcome)
    {
        if ( ! outcome.success())
        {
            LOGGER.warning("not saving failed calibration: " + outcome.failureReason());
            return;
        }
        save(outcome);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     save                                                        */
/*                                     save                                                        */
/*                                     save                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Write the parameters and, if uploading, the index file
     * @param outcome successful calibration
     * @return false on any file error
     */
    boolean save(CalibrationOutcome outcome)
    {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        String id = now.format(idFormat);

        Path paramFile = queueDir.resolve(id + "-" + Cfg.paramFileSuffix);
        try {
            mapper.writeValue(paramFile.toFile(), outcome.parameters());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error saving camera parameters to " + paramFile, e);
            return false;
        }
        LOGGER.info("camera parameters saved to " + paramFile);

        if (saveDir != null)
        {
            copyToSaveDir(paramFile);
        }

        if (StringUtils.isEmpty(uploadUrl) || StringUtils.isEmpty(camera.deviceId()))
        {
            deleteQuietly(paramFile); // not uploading
            return true;
        }

        Path indexFile = queueDir.resolve(id + "-index");
        Path indexUploadFile = queueDir.resolve(id + "-index." + Cfg.queueIndexFileExtension);
        try {
            Files.writeString(indexFile, indexContents(outcome, paramFile, now), StandardCharsets.UTF_8);
            Files.move(indexFile, indexUploadFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error writing upload index " + indexFile, e);
            deleteQuietly(indexFile);
            deleteQuietly(indexUploadFile);
            deleteQuietly(paramFile);
            return false;
        }

        if (uploader != null)
        {
            uploader.tickle();
        }
        return true;
    }

    /**
     * camera_para-{device id}-{index}-{w}x{h}[-{focal length}].json with path separators
     * in the device id replaced
     * @return file name
     */
    String saveFileName()
    {
        String device = StringUtils.defaultIfEmpty(camera.deviceId(), camera.name());
        device = StringUtils.replaceChars(StringUtils.defaultString(device), "/\\", "__");
        StringBuilder name = new StringBuilder("camera_para-")
            .append(device).append('-')
            .append(camera.index()).append('-')
            .append(camera.width()).append('x').append(camera.height());
        if (camera.focalLength() > 0.)
        {
            name.append('-').append(String.format(Locale.ROOT, "%.3f", camera.focalLength()));
        }
        return name.append(".json").toString();
    }

    private void copyToSaveDir(Path paramFile)
    {
        Path saveFile = saveDir.resolve(saveFileName());
        try {
            Files.createDirectories(saveDir);
            Files.copy(paramFile, saveFile, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("camera parameters copied to " + saveFile);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error copying camera parameters to " + saveFile, e);
        }
    }

    private String indexContents(CalibrationOutcome outcome, Path paramFile, ZonedDateTime now)
    {
        StringBuilder index = new StringBuilder();
        appendField(index, "version", Integer.toString(indexFileVersion));
        appendField(index, "file", paramFile.toAbsolutePath().toString());
        appendField(index, "timestamp", now.format(timestampFormat));
        appendField(index, "os_name", System.getProperty("os.name"));
        appendField(index, "os_arch", System.getProperty("os.arch"));
        appendField(index, "os_version", System.getProperty("os.version"));
        appendField(index, "device_id", camera.deviceId());
        appendField(index, "focal_length", String.format(Locale.ROOT, "%.3f", camera.focalLength()));
        appendField(index, "camera_index", Integer.toString(camera.index()));
        appendField(index, "camera_face", camera.facing());
        appendField(index, "camera_width", Integer.toString(camera.width()));
        appendField(index, "camera_height", Integer.toString(camera.height()));
        appendField(index, "err_min", String.format(Locale.ROOT, "%f", outcome.errorMin()));
        appendField(index, "err_avg", String.format(Locale.ROOT, "%f", outcome.errorAvg()));
        appendField(index, "err_max", String.format(Locale.ROOT, "%f", outcome.errorMax()));
        if (StringUtils.isNotEmpty(authenticationToken))
        {
            appendField(index, "ss", md5Hex(authenticationToken));
        }
        return index.toString();
    }

    private static void appendField(StringBuilder index, String key, String value)
    {
        // one field per line; a line break in a value would start a new field
        index.append(key).append(',').append(StringUtils.replaceChars(StringUtils.defaultString(value), "\r\n", "  ")).append('\n');
    }

    static String md5Hex(String text)
    {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static void deleteQuietly(Path path)
    {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error removing " + path, e);
        }
    }
}
