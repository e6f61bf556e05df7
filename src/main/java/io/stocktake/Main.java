package io.stocktake;

import io.stocktake.cli.StockTakeCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = StockTakeCommand.commandLine().execute(args);
        System.exit(code);
    }
}
