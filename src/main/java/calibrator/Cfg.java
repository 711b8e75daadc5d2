package calibrator;

import java.util.logging.Level;

public class Cfg
{
    // logging
    static Level loggerMinimumLevel = Level.CONFIG;
    static final String logFile = "calibrator.log";

    // camera image size if not specified on the command line
    static final int image_width = 640;
    static final int image_height = 480;

    // capture count; the default pattern geometry is in PatternType
    static final int calibImageCountMax = 10;

    // corner finder
    static final int cornerSubPixWindow = 5; // half side length of the sub-pixel search window
    static final int cornerSubPixMaxIterations = 100;
    static final double cornerSubPixEpsilon = 0.1;

    // data upload
    static final String queueDir = "queue";
    static final String queueIndexFileExtension = "upload";
    static final String paramFileSuffix = "camera_para.json";
    static final long uploadStatusHideAfterMillis = 9000L; // how long the last upload message stays visible
    static final long uploadConnectTimeoutMillis = 10000L;
    static final long uploadReadTimeoutMillis = 30000L;

    // frame pump
    static final long pumpSleepMillis = 1L; // yield between frames while not capturing

    private Cfg(){}
}
