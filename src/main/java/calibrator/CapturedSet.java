package calibrator;

import java.util.List;

import org.opencv.core.Point;

/**
 * One accepted view of the pattern: sub-pixel refined feature positions.
 */
public final class CapturedSet
{
    private final List<Point> positions;

    CapturedSet(List<Point> positions)
    {
        this.positions = FeatureDetection.copyOf(positions);
    }

    public List<Point> positions()
    {
        return positions;
    }

    public int size()
    {
        return positions.size();
    }
}
