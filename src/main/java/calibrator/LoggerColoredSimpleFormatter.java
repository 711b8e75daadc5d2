package calibrator;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Console formatter that uses the same layout as the SimpleFormatter format
 * set in LoggerSetup and colors the line by level with ANSI escapes.
 */
class LoggerColoredSimpleFormatter extends Formatter
{
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_WHITE = "\u001B[37m";

    private static final String format = "%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$-7s [%3$s %2$s] %5$s %6$s%n";

    @Override
    public String format(LogRecord record)
    {
        ZonedDateTime time = ZonedDateTime.ofInstant(record.getInstant(), ZoneId.systemDefault());

        String thrown = "";
        if (record.getThrown() != null)
        {
            StringWriter sw = new StringWriter();
            PrintWriter pw = new PrintWriter(sw);
            pw.println();
            record.getThrown().printStackTrace(pw);
            pw.close();
            thrown = sw.toString();
        }

        String line = String.format(format,
            time,
            record.getSourceMethodName(),
            record.getSourceClassName(),
            record.getLevel().getLocalizedName(),
            formatMessage(record),
            thrown);

        return color(record.getLevel()) + line + ANSI_RESET;
    }

    static String color(Level level)
    {
        int value = level.intValue();
        if (value >= Level.SEVERE.intValue()) return ANSI_RED;
        if (value >= Level.WARNING.intValue()) return ANSI_YELLOW;
        if (value >= Level.INFO.intValue()) return ANSI_GREEN;
        if (value >= Level.CONFIG.intValue()) return ANSI_CYAN;
        return ANSI_WHITE; // FINE, FINER, FINEST
    }
}
