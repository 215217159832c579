package io.shiplog;

import io.shiplog.cli.ShipLogCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShipLogCommand()).execute(args);
        System.exit(exitCode);
    }
}
