package io.fetchbox;

import io.fetchbox.cli.FetchBoxCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FetchBoxCommand()).execute(args);
        System.exit(code);
    }
}
