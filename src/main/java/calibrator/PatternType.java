package calibrator;

import org.opencv.core.Size;

/**
 * Physical calibration target classes.
 *
 * Default geometry is only known for the targets the calibrator ships printable
 * versions of; the others must be sized on the command line.
 */
public enum PatternType
{
    CHESSBOARD(new Size(7, 5), 28.5), // inner corners across x down; square width mm
    CIRCLES_GRID(null, Double.NaN),
    ASYMMETRIC_CIRCLES_GRID(new Size(4, 11), 20.0); // circles per row x rows; half column spacing mm

    private final Size defaultSize;
    private final double defaultSpacing;

    PatternType(Size defaultSize, double defaultSpacing)
    {
        this.defaultSize = defaultSize;
        this.defaultSpacing = defaultSpacing;
    }

    boolean hasDefaultGeometry()
    {
        return defaultSize != null;
    }

    Size defaultSize()
    {
        return defaultSize == null ? null : defaultSize.clone();
    }

    double defaultSpacing()
    {
        return defaultSpacing;
    }
}
