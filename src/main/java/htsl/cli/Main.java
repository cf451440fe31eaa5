// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.cli;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import htsl.html.Generator;
import htsl.util.condition.ConditionContext;
import htsl.util.condition.Handler;
import htsl.util.condition.exception.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the command line tool with the given arguments and returns the process exit status.
     */
    static int run(final String[] args) {
        return mainImpl(args).value;
    }

    private static ExitCode mainImpl(final String[] args) {
        var generator = new Generator();
        final var files = new ArrayList<Path>();
        var optionsEnded = false;
        for (final var arg : args) {
            if (!optionsEnded && arg.equals("--")) {
                optionsEnded = true;
            } else if (!optionsEnded && arg.equals("--newlines")) {
                generator = generator.withNewlines();
            } else if (!optionsEnded && arg.startsWith("--")) {
                return usageError("Unknown option " + arg);
            } else {
                files.add(Path.of(arg));
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var finalGenerator = generator;
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                render(finalGenerator, files);
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void render(final Generator generator, final List<Path> files) {
        try (final var streams = Streams.acquire()) {
            // Not closed: that would close standard output.
            final var writer = new BufferedWriter(new OutputStreamWriter(streams.out(), StandardCharsets.UTF_8));
            final var renderer = new Renderer(generator, writer);
            if (files.isEmpty()) {
                renderer.renderStream("<standard input>", streams.in());
            } else {
                for (final var file : files) {
                    renderer.renderFile(file);
                }
            }
            try {
                writer.flush();
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private static ExitCode usageError(final String message) {
        try (final var streams = Streams.acquire()) {
            final var err = streams.err();
            err.println(message);
            err.println("Usage: htsl [--newlines] [FILE...]");
            return ExitCode.USAGE;
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
