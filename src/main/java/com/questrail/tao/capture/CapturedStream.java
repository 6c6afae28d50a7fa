package com.questrail.tao.capture;

import java.io.PrintStream;

/**
 * Process-wide output streams that {@link StdoutCapture} can intercept.
 */
public enum CapturedStream
{
    STDOUT {
        @Override
        PrintStream current() {
            return System.out;
        }

        @Override
        void install(PrintStream stream) {
            System.setOut(stream);
        }
    },

    STDERR {
        @Override
        PrintStream current() {
            return System.err;
        }

        @Override
        void install(PrintStream stream) {
            System.setErr(stream);
        }
    };

    abstract PrintStream current();

    abstract void install(PrintStream stream);
}
