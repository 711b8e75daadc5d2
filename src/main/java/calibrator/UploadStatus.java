package calibrator;

/**
 * Snapshot of the upload queue status for display
 */
public final class UploadStatus
{
    public enum State
    {
        NONE, // nothing to show
        IDLE, // message shown, uploader not running
        BUSY  // message shown, uploader running
    }

    static final UploadStatus NONE = new UploadStatus(State.NONE, "");

    private final State state;
    private final String message;

    UploadStatus(State state, String message)
    {
        this.state = state;
        this.message = message;
    }

    public State state()
    {
        return state;
    }
    public String message()
    {
        return message;
    }

    @Override
    public String toString()
    {
        return state + " " + message;
    }
}
