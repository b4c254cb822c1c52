package org.theseed.xrf;

import java.util.Arrays;

import org.theseed.xrf.utils.BaseProcessor;

/**
 * Commands for XRF core-scan processing
 *
 * profile		produce a depth profile of element CLR values and element log ratios
 * summary		summarize the element concentrations in an XRF export file
 *
 */
public class App
{
    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "profile" :
            processor = new ProfileProcessor();
            break;
        case "summary" :
            processor = new SummaryProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
    }
}
