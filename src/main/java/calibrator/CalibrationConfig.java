package calibrator;

import java.nio.file.Path;

/**
 * Run time settings from the command line
 */
final class CalibrationConfig
{
    final String cameraId;
    final String deviceId; // empty if unknown; nothing is uploaded without it
    final String cameraFacing;
    final double focalLength;
    final int imageWidth;
    final int imageHeight;
    final PatternSpec pattern;
    final int captureCount;
    final Path saveDir; // null if not saving a copy
    final Path queueDir;
    final String uploadUrl; // empty if not uploading
    final String authenticationToken; // empty if none
    final boolean preview;

    CalibrationConfig(String cameraId, String deviceId, String cameraFacing, double focalLength,
            int imageWidth, int imageHeight, PatternSpec pattern, int captureCount,
            Path saveDir, Path queueDir, String uploadUrl, String authenticationToken, boolean preview)
    {
        this.cameraId = cameraId;
        this.deviceId = deviceId;
        this.cameraFacing = cameraFacing;
        this.focalLength = focalLength;
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.pattern = pattern;
        this.captureCount = captureCount;
        this.saveDir = saveDir;
        this.queueDir = queueDir;
        this.uploadUrl = uploadUrl;
        this.authenticationToken = authenticationToken;
        this.preview = preview;
    }

    @Override
    public String toString()
    {
        return "camera " + cameraId + " device " + deviceId + " " + cameraFacing + " focal length " + focalLength
            + " " + imageWidth + "x" + imageHeight + ", " + pattern + ", " + captureCount + " captures"
            + ", save " + saveDir + ", queue " + queueDir + ", upload " + uploadUrl
            + (authenticationToken.isEmpty() ? "" : " with token") + (preview ? ", preview" : "");
    }
}
