package calibrator;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Camera intrinsics from a calibration: the 3x3 camera matrix in row major order
 * and the distortion coefficients (k1, k2, p1, p2, k3).
 */
public final class CameraParameters
{
    private final int imageWidth;
    private final int imageHeight;
    private final double[] cameraMatrix;
    private final double[] distortionCoefficients;

    @JsonCreator
    public CameraParameters(
            @JsonProperty("image_width") int imageWidth,
            @JsonProperty("image_height") int imageHeight,
            @JsonProperty("camera_matrix") double[] cameraMatrix,
            @JsonProperty("distortion_coefficients") double[] distortionCoefficients)
    {
        if (cameraMatrix.length != 9)
        {
            throw new IllegalArgumentException("camera matrix must have 9 elements, has " + cameraMatrix.length);
        }
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.cameraMatrix = cameraMatrix.clone();
        this.distortionCoefficients = distortionCoefficients.clone();
    }

    @JsonProperty("image_width")
    public int imageWidth()
    {
        return imageWidth;
    }
    @JsonProperty("image_height")
    public int imageHeight()
    {
        return imageHeight;
    }
    @JsonProperty("camera_matrix")
    public double[] cameraMatrix()
    {
        return cameraMatrix.clone();
    }
    @JsonProperty("distortion_coefficients")
    public double[] distortionCoefficients()
    {
        return distortionCoefficients.clone();
    }

    public double fx()
    {
        return cameraMatrix[0];
    }
    public double fy()
    {
        return cameraMatrix[4];
    }
    public double cx()
    {
        return cameraMatrix[2];
    }
    public double cy()
    {
        return cameraMatrix[5];
    }

    @Override
    public String toString()
    {
        return "image " + imageWidth + "x" + imageHeight
            + " camera matrix " + Arrays.toString(cameraMatrix)
            + " distortion " + Arrays.toString(distortionCoefficients);
    }
}
