package calibrator;

import java.io.InputStream;
import java.util.Scanner;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

// Java Scanner alternative to OpenCV keyboard usage for when there is no preview window

// Scanner keys use the same codes as OpenCV HighGui.waitKey so the terminal and the preview window map the same way
class Keystroke implements Runnable
{
        private static final Logger LOGGER = Logger.getLogger("");
        static {
          LOGGER.finest("Loading");
        }

    // key codes
    static final int keyTouch = 32; // space
    static final int keyCapture = 99; // c, same as touch
    static final int keyBack = 98; // b
    static final int keyModal = 112; // p
    static final int keyTerminate = 113; // q
    static final int keyNone = -1;  // timed out, no key pressed

    AtomicInteger dokeystroke = new AtomicInteger(keyNone);

    private final InputStream input;

    Keystroke()
    {
        this(System.in);
    }

    Keystroke(InputStream input)
    {
        this.input = input;
    }

    /**
     * Read the terminal for user entered commands.
     *
     * Scanner blocks waiting for input so this runs as its own thread and the
     * command is handed over through an atomic.
     *
     * Type a character command and press Enter; Enter alone is a touch.
     * The first character entered is the command. Excess characters before the "Enter" are ignored.
     */
    public void run()
    {
        try (Scanner keyboard = new Scanner(input))
        {
            while( ! Thread.interrupted() && keyboard.hasNextLine())
            {
                System.out.println("press Enter or c (capture), b (back), p (settings/help), q (quit) then the Enter key");
                String entered = keyboard.nextLine();
                int key = entered.isEmpty() ? keyTouch : entered.charAt(0);
                if (toFlowEvent(key) != FlowEvent.NONE || key == keyTerminate)
                {
                    LOGGER.finest("user entered " + entered + ", action is " + key);
                    dokeystroke.set(key);
                }
                else // ignore any keys that aren't commands
                {
                    LOGGER.info(entered + " not a command");
                }
            }
        } catch(IllegalStateException e) {
            LOGGER.severe("Terminal keyboard closed prematurely (Ctrl-c) or doesn't exist " + e);
        }
    }

    /**
     * Get the command entered on the terminal, from another thread than run()
     * @return the key code, keyNone if nothing was entered since the last call
     */
    int getKey() {
        return dokeystroke.getAndSet(keyNone); // after getting the previous key, re-initialize to indicate no key pressed so far
    }

    /**
     * Map a key code, from the terminal or HighGui.waitKey, to a flow event
     * @param key key code
     * @return the event, NONE if the key is not a flow command
     */
    static FlowEvent toFlowEvent(int key)
    {
        switch (Character.toLowerCase(key))
        {
            case keyTouch:
            case keyCapture:
            case '\r':
            case '\n':
                return FlowEvent.TOUCH;
            case keyBack:
            case 27: // Esc
                return FlowEvent.BACK_BUTTON;
            case keyModal:
                return FlowEvent.MODAL;
            default:
                return FlowEvent.NONE;
        }
    }

    static boolean isTerminate(int key)
    {
        return Character.toLowerCase(key) == keyTerminate;
    }
}
