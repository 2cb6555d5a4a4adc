/**
 *
 */
package org.theseed.metrics.cli;

/**
 * This is the interface for a command-line command.  The command parses its parameters and, if they are valid,
 * runs.
 *
 */
public interface ICommand {

    /**
     * Parse the command-line parameters.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    boolean parseCommand(String[] args);

    /**
     * Run the command.
     */
    void run();

}
