package calibrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

final class MainTest {

    @Test
    void defaults() throws Exception {
        var config = Main.handleArgs(new String[] {});

        assertEquals("0", config.cameraId);
        assertEquals("", config.deviceId);
        assertEquals(Cfg.image_width, config.imageWidth);
        assertEquals(Cfg.image_height, config.imageHeight);
        assertEquals(PatternType.CHESSBOARD, config.pattern.type());
        assertEquals(7, config.pattern.columns());
        assertEquals(5, config.pattern.rows());
        assertEquals(Cfg.calibImageCountMax, config.captureCount);
        assertNull(config.saveDir);
        assertEquals(Path.of(Cfg.queueDir), config.queueDir);
        assertEquals("", config.uploadUrl);
        assertFalse(config.preview);
    }

    @Test
    void helpEndsTheProgram() throws Exception {
        assertNull(Main.handleArgs(new String[] {"--help"}));
    }

    @Test
    void everyOption() throws Exception {
        var config = Main.handleArgs(new String[] {
            "-c", "http://camera.local/stream", "-i", "cam-42", "-F", "rear", "-f", "4.2",
            "-W", "1280", "-H", "720", "-t", "chessboard", "-x", "9", "-y", "6", "-s", "25",
            "-n", "15", "-o", "saved", "-q", "outbox", "-u", "https://example.com/upload", "-a", "token", "-P"});

        assertEquals("http://camera.local/stream", config.cameraId);
        assertEquals("cam-42", config.deviceId);
        assertEquals("rear", config.cameraFacing);
        assertEquals(4.2, config.focalLength);
        assertEquals(1280, config.imageWidth);
        assertEquals(720, config.imageHeight);
        assertEquals(9, config.pattern.columns());
        assertEquals(6, config.pattern.rows());
        assertEquals(25., config.pattern.spacing());
        assertEquals(15, config.captureCount);
        assertEquals(Path.of("saved"), config.saveDir);
        assertEquals(Path.of("outbox"), config.queueDir);
        assertEquals("https://example.com/upload", config.uploadUrl);
        assertEquals("token", config.authenticationToken);
        assertTrue(config.preview);
    }

    @Test
    void partialPatternSizeKeepsTheTypeDefaults() throws Exception {
        var config = Main.handleArgs(new String[] {"-x", "9"});

        assertEquals(9, config.pattern.columns());
        assertEquals(5, config.pattern.rows());
        assertEquals(28.5, config.pattern.spacing());
    }

    @Test
    void cameraIdIsAnIndexOrAStreamUrl() throws Exception {
        assertEquals("2", Main.handleArgs(new String[] {"-c", "2"}).cameraId);
        assertEquals("rtsp://10.0.0.5/live", Main.handleArgs(new String[] {"-c", "rtsp://10.0.0.5/live"}).cameraId);
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"-c", "/dev/video0"}));
    }

    @Test
    void unusableValuesAreParseErrors() {
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"-W", "wide"}));
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"-t", "TRIANGLES"}));
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"-t", "CIRCLES_GRID"}));
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"-t", "CIRCLES_GRID", "-x", "4"}));
        assertThrows(ParseException.class, () -> Main.handleArgs(new String[] {"--bogus"}));
    }

    @Test
    void symmetricCirclesWithAFullSize() throws Exception {
        var config = Main.handleArgs(new String[] {"-t", "CIRCLES_GRID", "-x", "4", "-y", "5", "-s", "15"});

        assertEquals(PatternType.CIRCLES_GRID, config.pattern.type());
        assertEquals(20, config.pattern.featureCount());
    }
}
