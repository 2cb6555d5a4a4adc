/**
 *
 */
package org.theseed.metrics;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.metrics.cli.ClusterProcessor;
import org.theseed.metrics.cli.ICommand;
import org.theseed.metrics.cli.ParseFailureException;
import org.theseed.metrics.cli.RegressionProcessor;
import org.theseed.metrics.cli.SupportProcessor;

/**
 * Main entry point for the metrics utility.  The first parameter is a command-- use "regress" to compute
 * regression metrics, "cluster" to compute clustering metrics, and "support" to list the clustering metrics
 * with their optimization direction.
 *
 * If the command is followed by an equal sign, then the part after the equal sign should be a file name.
 * The parameters will be read from the file. Otherwise, the parameters are taken from the remainder of
 * the command line.
 *
 */
public class App
{
    public static void main( String[] args )
    {
        int exitCode = 0;
        try {
            if (args.length == 0)
                throw new ParseFailureException("No command specified.  Use \"help\" for a list of commands.");
            // Parse the command and get the command-line arguments.
            String[] command = StringUtils.split(args[0], '=');
            // Get the rest of the arguments.
            args = Arrays.copyOfRange(args, 1, args.length);
            // Read in the parm file if needed.
            if (command.length == 2) {
                try {
                    List<String> buffer = readParms(new File(command[1]));
                    buffer.addAll(Arrays.asList(args));
                    args = buffer.toArray(new String[buffer.size()]);
                } catch (IOException e) {
                    throw new UncheckedIOException("Error reading parameter file", e);
                }
            }
            // Compute the appropriate command object.
            ICommand runObject = null;
            boolean success = true;
            switch (command[0]) {
            case "regress" :
                runObject = new RegressionProcessor();
                success = execute(runObject, args);
                break;
            case "cluster" :
                runObject = new ClusterProcessor();
                success = execute(runObject, args);
                break;
            case "support" :
                runObject = new SupportProcessor();
                success = execute(runObject, args);
                break;
            case "--help" :
            case "-h" :
            case "help" :
                showHelp();
                break;
            default :
                throw new ParseFailureException("Invalid command code " + command[0] + ".");
            }
            if (! success) exitCode = 255;
        } catch (Exception e) {
            e.printStackTrace();
            exitCode = 255;
        }
        // Force cleanup.
        System.exit(exitCode);
    }

    /**
     * Read command-line parameters from a file.  Each non-blank line that does not begin with a pound sign holds
     * an option, optionally followed by whitespace and a value.
     *
     * @param parmFile	file containing the parameters
     *
     * @return a modifiable list of the parameter strings
     *
     * @throws IOException
     */
    public static List<String> readParms(File parmFile) throws IOException {
        List<String> retVal = new ArrayList<String>();
        for (String line : Files.readAllLines(parmFile.toPath(), StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (! trimmed.isEmpty() && ! trimmed.startsWith("#")) {
                String[] parts = StringUtils.split(trimmed, null, 2);
                retVal.add(parts[0]);
                if (parts.length > 1)
                    retVal.add(parts[1].trim());
            }
        }
        return retVal;
    }

    /**
     * Display all the commands.
     */
    public static void showHelp() {
        System.out.println("Available commands:");
        System.out.println();
        System.out.println("regress      compute regression metrics for true and predicted columns");
        System.out.println("cluster      compute clustering metrics for labels and features");
        System.out.println("support      list the clustering metrics with their optimization direction");
    }

    /**
     * Execute a command processor.
     *
     * @param runObject		command processor to execute
     * @param args			command-line parameters
     *
     * @return TRUE if successful, else FALSE
     */
    public static boolean execute(ICommand runObject, String[] args) {
        boolean retVal = runObject.parseCommand(args);
        if (retVal) {
            runObject.run();
        }
        return retVal;
    }

}
