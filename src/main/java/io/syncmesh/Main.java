package io.syncmesh;

import io.syncmesh.cli.SyncMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SyncMeshCommand()).execute(args);
        System.exit(code);
    }
}
