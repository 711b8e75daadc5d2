package calibrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Point;

/**
 * What a detector found in one image: whether every pattern feature was located
 * and the positions it did locate, in pattern order.
 */
public final class FeatureDetection
{
    static final FeatureDetection NOT_FOUND = new FeatureDetection(false, Collections.emptyList());

    private final boolean foundAll;
    private final List<Point> positions;

    public FeatureDetection(boolean foundAll, List<Point> positions)
    {
        this.foundAll = foundAll;
        this.positions = copyOf(positions);
    }

    public boolean foundAll()
    {
        return foundAll;
    }
    /**
     * @return unmodifiable positions
     */
    public List<Point> positions()
    {
        return positions;
    }

    // Points are mutable so take a deep copy
    static List<Point> copyOf(List<Point> points)
    {
        List<Point> copy = new ArrayList<>(points.size());
        for (Point point : points)
        {
            copy.add(point.clone());
        }
        return Collections.unmodifiableList(copy);
    }
}
