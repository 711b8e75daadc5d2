package calibrator;

import java.util.ArrayList;
import java.util.List;

import org.opencv.core.Point3;
import org.opencv.core.Size;

/**
 * Pattern descriptor handed to the detector with every job: the target type
 * and the geometry the detector should expect.
 */
public final class PatternSpec
{
    private final PatternType type;
    private final int columns; // features across
    private final int rows; // features down
    private final double spacing; // mm between adjacent features

    public PatternSpec(PatternType type, int columns, int rows, double spacing)
    {
        this.type = type;
        this.columns = columns;
        this.rows = rows;
        this.spacing = spacing;
    }

    /**
     * Pattern with the default geometry of its type
     * @param type target type
     * @return pattern descriptor
     * @throws CalibrationConfigurationException type has no default geometry
     */
    public static PatternSpec defaultFor(PatternType type) throws CalibrationConfigurationException
    {
        if ( ! type.hasDefaultGeometry())
        {
            throw new CalibrationConfigurationException("no default size for pattern " + type + "; specify the pattern size");
        }
        Size size = type.defaultSize();
        return new PatternSpec(type, (int)size.width, (int)size.height, type.defaultSpacing());
    }

    // getters
    public PatternType type()
    {
        return type;
    }
    public int columns()
    {
        return columns;
    }
    public int rows()
    {
        return rows;
    }
    public double spacing()
    {
        return spacing;
    }
    public Size size()
    {
        return new Size(columns, rows);
    }
    public int featureCount()
    {
        return columns*rows;
    }

    /**
     * Ideal positions of the pattern features on the flat target, Z = 0, in the
     * same order the detector reports them (row by row).
     * @return object points
     */
    public List<Point3> objectPoints()
    {
        List<Point3> points = new ArrayList<>(featureCount());
        for (int row = 0; row < rows; row++)
        {
            for (int column = 0; column < columns; column++)
            {
                switch (type)
                {
                    case ASYMMETRIC_CIRCLES_GRID:
                        points.add(new Point3((2*column + row%2)*spacing, row*spacing, 0.));
                        break;
                    default:
                        points.add(new Point3(column*spacing, row*spacing, 0.));
                        break;
                }
            }
        }
        return points;
    }

    @Override
    public String toString()
    {
        return type + " " + columns + "x" + rows + " spacing " + spacing;
    }
}
