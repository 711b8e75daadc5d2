package calibrator;

/**
 * Operator input to the capture flow. NONE is never delivered; the mailbox returns it
 * only when the flow is stopping.
 */
public enum FlowEvent
{
    NONE,
    TOUCH,
    BACK_BUTTON,
    MODAL
}
