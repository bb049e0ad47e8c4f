package io.spiffehelper;

import io.spiffehelper.cli.SpiffeHelperCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = SpiffeHelperCommand.commandLine().execute(args);
        System.exit(code);
    }
}
