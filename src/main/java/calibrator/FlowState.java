package calibrator;

/**
 * Steps of the capture flow
 */
public enum FlowState
{
    NOT_INITED,
    WELCOME,
    CAPTURING,
    CALIBRATING,
    DONE
}
