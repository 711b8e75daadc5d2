package calibrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.MatOfPoint3f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import nu.pattern.OpenCV;

final class OpenCvVisionLibraryTest {

    private static final int WIDTH = 640;
    private static final int HEIGHT = 480;
    private static final int SQUARE = 40; // pixels
    private static final int ORIGIN_X = 120;
    private static final int ORIGIN_Y = 100;

    private final PatternSpec chessboard = new PatternSpec(PatternType.CHESSBOARD, 7, 5, 28.5);
    private final OpenCvVisionLibrary vision = new OpenCvVisionLibrary();

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    @Test
    void onlyChessboards() {
        assertTrue(vision.supports(PatternType.CHESSBOARD));
        assertFalse(vision.supports(PatternType.CIRCLES_GRID));
        assertFalse(vision.supports(PatternType.ASYMMETRIC_CIRCLES_GRID));
    }

    @Test
    void findsAndRefinesTheCornersOfADrawnBoard() {
        var frame = drawnChessboard();

        var detection = vision.detectFeatures(frame, chessboard);

        assertTrue(detection.foundAll());
        assertEquals(35, detection.positions().size());
        for (Point corner : detection.positions()) {
            assertTrue(corner.x > ORIGIN_X && corner.x < ORIGIN_X + 8*SQUARE, "corner inside the board " + corner);
            assertTrue(corner.y > ORIGIN_Y && corner.y < ORIGIN_Y + 6*SQUARE, "corner inside the board " + corner);
        }

        var refined = vision.refineFeatures(frame, detection.positions());
        assertEquals(35, refined.size());
        for (Point corner : refined) {
            // inner corners lie on the square grid
            double gridX = (corner.x - ORIGIN_X) / SQUARE;
            double gridY = (corner.y - ORIGIN_Y) / SQUARE;
            assertEquals(Math.round(gridX), gridX, 0.05, "x on the grid " + corner);
            assertEquals(Math.round(gridY), gridY, 0.05, "y on the grid " + corner);
        }
    }

    @Test
    void blankImageHasNoBoard() {
        var frame = new FrameBuffer(WIDTH, HEIGHT);

        var detection = vision.detectFeatures(frame, chessboard);

        assertFalse(detection.foundAll());
    }

    @Test
    void solvesTheCameraThatProjectedTheViews() {
        var cameraMatrix = new Mat(3, 3, CvType.CV_64F);
        cameraMatrix.put(0, 0, 500., 0., 320., 0., 500., 240., 0., 0., 1.);
        var noDistortion = new MatOfDouble(0., 0., 0., 0., 0.);
        var objectPoints = new MatOfPoint3f();
        objectPoints.fromList(chessboard.objectPoints());

        double[][] rotations = {{0.2, 0., 0.}, {-0.2, 0.1, 0.}, {0., 0.3, 0.1}, {0.1, -0.25, 0.}, {0.3, 0.2, 0.05}, {-0.1, -0.3, -0.1}};
        List<CapturedSet> sets = new ArrayList<>();
        for (double[] rotation : rotations) {
            var rvec = new Mat(3, 1, CvType.CV_64F);
            rvec.put(0, 0, rotation);
            var tvec = new Mat(3, 1, CvType.CV_64F);
            tvec.put(0, 0, -85., -57., 450.);
            var imagePoints = new MatOfPoint2f();
            Calib3d.projectPoints(objectPoints, rvec, tvec, cameraMatrix, noDistortion, imagePoints);
            sets.add(new CapturedSet(imagePoints.toList()));
        }

        var outcome = vision.solve(sets, chessboard, new Size(WIDTH, HEIGHT));

        assertTrue(outcome.success(), outcome::failureReason);
        assertEquals(rotations.length, outcome.viewCount());
        assertEquals(500., outcome.parameters().fx(), 5.);
        assertEquals(500., outcome.parameters().fy(), 5.);
        assertEquals(320., outcome.parameters().cx(), 5.);
        assertEquals(240., outcome.parameters().cy(), 5.);
        assertTrue(outcome.errorMin() <= outcome.errorAvg() && outcome.errorAvg() <= outcome.errorMax());
        assertTrue(outcome.errorMax() < 0.1, "exact projections reproject exactly " + outcome.errorMax());
        assertEquals(WIDTH, outcome.parameters().imageWidth());
    }

    @Test
    void viewsOfTheWrongSizeFail() {
        var outcome = vision.solve(List.of(new CapturedSet(List.of(new Point(1, 1)))), chessboard, new Size(WIDTH, HEIGHT));

        assertFalse(outcome.success());
    }

    // 8x6 squares, 7x5 inner corners, on a white background
    private static FrameBuffer drawnChessboard() {
        var img = new Mat(HEIGHT, WIDTH, CvType.CV_8UC1, new Scalar(255));
        for (int row = 0; row < 6; row++) {
            for (int column = 0; column < 8; column++) {
                if ((row + column) % 2 == 0) {
                    var topLeft = new Point(ORIGIN_X + column*SQUARE, ORIGIN_Y + row*SQUARE);
                    var bottomRight = new Point(ORIGIN_X + (column + 1)*SQUARE - 1, ORIGIN_Y + (row + 1)*SQUARE - 1);
                    Imgproc.rectangle(img, topLeft, bottomRight, new Scalar(0), -1);
                }
            }
        }
        var frame = new FrameBuffer(WIDTH, HEIGHT);
        img.get(0, 0, frame.pixels());
        img.release();
        return frame;
    }
}
