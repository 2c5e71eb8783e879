package loadgrid;

import loadgrid.cli.LoadGridCommand;
import picocli.CommandLine;

/**
 * Command-line entry point.
 */
public final class LoadGridApp {
    private LoadGridApp() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LoadGridCommand()).execute(args);
        System.exit(code);
    }
}
